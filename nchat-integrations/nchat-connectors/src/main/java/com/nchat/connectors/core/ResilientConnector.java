package com.nchat.connectors.core;

import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.error.ErrorClassifier;
import com.nchat.connectors.event.ConnectorEvent;
import com.nchat.connectors.event.ConnectorEventBus;
import com.nchat.connectors.event.ConnectorEventListener;
import com.nchat.connectors.event.ConnectorEventType;
import com.nchat.connectors.model.CatalogEntry;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.ConnectorMetrics;
import com.nchat.connectors.model.ConnectorStatus;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.model.RequestLogEntry;
import com.nchat.connectors.ratelimit.RateLimitConfig;
import com.nchat.connectors.ratelimit.RateLimiter;
import com.nchat.connectors.retry.BackoffCalculator;
import com.nchat.connectors.retry.ConnectorOperation;
import com.nchat.connectors.retry.RetryConfig;
import com.nchat.connectors.retry.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Lifecycle wrapper around a provider {@link Connector}.
 *
 * <h2>States</h2>
 * <pre>
 *   disconnected -&gt; connecting -&gt; connected | error
 *   connected    -&gt; rate_limited | error | disconnected
 *   reconnect ceiling exceeded -&gt; disabled (terminal for this instance)
 * </pre>
 *
 * <h2>Threading</h2>
 * One instance is meant to be driven by one logical caller at a time; the only
 * blocking point is the backoff sleep inside {@link #withRetry} and
 * {@link #reconnect()}, which stalls the calling thread and nothing else.
 * Separate instances are fully independent. The bounded buffers (health
 * history, request log) and metrics are guarded so a
 * {@link com.nchat.connectors.health.HealthMonitor} thread may probe concurrently.
 *
 * @param <T> the adapter type
 */
public class ResilientConnector<T extends Connector> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResilientConnector.class);

    public static final int MAX_RECONNECT_ATTEMPTS = 5;
    public static final int HEALTH_HISTORY_SIZE    = 10;
    public static final int REQUEST_LOG_SIZE       = 100;
    static final Duration   REFRESH_BUFFER         = Duration.ofMinutes(5);

    private final T delegate;
    private final String providerId;
    private final RetryConfig retryConfig;
    private final RateLimiter rateLimiter;
    private final BackoffCalculator backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ConnectorEventBus events;

    private volatile ConnectorStatus status = ConnectorStatus.DISCONNECTED;
    private volatile ConnectorConfig config;
    private volatile ConnectorCredentials credentials;
    private volatile int reconnectAttempts;

    private final Deque<HealthCheckResult> healthHistory = new ArrayDeque<>();
    private final Deque<RequestLogEntry>   requestLogs   = new ArrayDeque<>();
    private final AtomicLong               requestSeq    = new AtomicLong();

    private final Object metricsLock = new Object();
    private long    totalCalls;
    private long    successfulCalls;
    private long    failedCalls;
    private long    totalResponseMs;
    private Instant lastSuccessAt;
    private Instant lastErrorAt;
    private String  lastError;

    protected ResilientConnector(Builder<T> b) {
        this.delegate    = b.delegate;
        this.providerId  = b.delegate.providerId();
        this.retryConfig = b.retryConfig;
        this.clock       = b.clock;
        this.rateLimiter = new RateLimiter(b.rateLimitConfig, b.clock);
        this.backoff     = new BackoffCalculator(b.retryConfig, b.random);
        this.sleeper     = b.sleeper;
        this.events      = new ConnectorEventBus(providerId, b.eventQueueCapacity);
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Connects using {@code config} and {@code credentials}. Does nothing when
     * already connected.
     *
     * @throws ConnectorException the classified failure of the adapter's connect step
     */
    public void connect(ConnectorConfig config, ConnectorCredentials credentials) throws ConnectorException {
        if (status == ConnectorStatus.CONNECTED) {
            return;
        }
        reconnectAttempts = 0;
        establish(config, credentials);
    }

    /**
     * Disconnects and clears stored config and credentials. The state always
     * ends up {@code disconnected}; a failure of the adapter's disconnect step
     * is still reported to the caller afterwards.
     */
    public void disconnect() throws ConnectorException {
        if (status == ConnectorStatus.DISCONNECTED) {
            return;
        }
        ConnectorException failure = null;
        try {
            delegate.doDisconnect();
        } catch (Exception e) {
            failure = categorizeError(e);
            log.warn("Disconnect of '{}' failed: {}", providerId, failure.getMessage());
        } finally {
            config = null;
            credentials = null;
            reconnectAttempts = 0;
            status = ConnectorStatus.DISCONNECTED;
            emit(ConnectorEventType.DISCONNECTED, null);
            log.info("Connector '{}' disconnected", providerId);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Reconnects with the stored config and credentials after a backoff delay.
     * After {@value #MAX_RECONNECT_ATTEMPTS} consecutive unsuccessful attempts
     * the connector becomes {@code disabled}.
     */
    public void reconnect() throws ConnectorException {
        ConnectorConfig storedConfig = config;
        ConnectorCredentials storedCredentials = credentials;
        if (storedConfig == null || storedCredentials == null) {
            throw ConnectorException.builder(
                    "Cannot reconnect '" + providerId + "': no stored configuration",
                    ErrorCategory.CONFIG, providerId)
                    .retryable(false)
                    .build();
        }
        if (reconnectAttempts >= MAX_RECONNECT_ATTEMPTS) {
            status = ConnectorStatus.DISABLED;
            ConnectorException exhausted = ConnectorException.builder(
                    "Max reconnect attempts (" + MAX_RECONNECT_ATTEMPTS + ") exceeded for '" + providerId + "'",
                    ErrorCategory.NETWORK, providerId)
                    .retryable(false)
                    .build();
            log.warn("Connector '{}' disabled after {} reconnect attempts", providerId, reconnectAttempts);
            emit(ConnectorEventType.ERROR, exhausted);
            throw exhausted;
        }

        int attempt = ++reconnectAttempts;
        status = ConnectorStatus.CONNECTING;
        emit(ConnectorEventType.RECONNECTING, attempt);
        long delay = backoff.delayMs(attempt);
        log.info("Reconnecting '{}' (attempt {}/{}) in {}ms", providerId, attempt, MAX_RECONNECT_ATTEMPTS, delay);
        pause(delay);

        establish(storedConfig, storedCredentials);
        reconnectAttempts = 0;
    }

    /**
     * Probes the provider and records the result. Never throws: adapter
     * failures become an unhealthy result.
     */
    public HealthCheckResult healthCheck() {
        long start = clock.millis();
        HealthCheckResult result;
        try {
            result = delegate.doHealthCheck();
            if (result == null) {
                result = HealthCheckResult.unhealthy(clock.millis() - start,
                        "Health check returned no result", clock.instant(), trailingFailures() + 1);
            } else if (!result.isHealthy()) {
                int failures = Math.max(result.getConsecutiveFailures(), trailingFailures() + 1);
                result = new HealthCheckResult(false, result.getResponseTimeMs(), result.getMessage(),
                        result.getCheckedAt() != null ? result.getCheckedAt() : clock.instant(), failures);
            }
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            String message = categorizeError(e).getMessage();
            result = HealthCheckResult.unhealthy(clock.millis() - start, message, clock.instant(),
                    trailingFailures() + 1);
        }

        synchronized (healthHistory) {
            healthHistory.addLast(result);
            while (healthHistory.size() > HEALTH_HISTORY_SIZE) {
                healthHistory.removeFirst();
            }
        }
        emit(ConnectorEventType.HEALTH_CHECK, result);
        return result;
    }

    // ------------------------------------------------------------------
    // Retry-wrapped calls
    // ------------------------------------------------------------------

    /**
     * Runs {@code operation} with rate limiting and retries: one initial attempt
     * plus up to {@code maxAttempts} retries, sleeping the backoff delay before
     * each retry. Non-retryable failures and the failure of the last attempt are
     * thrown immediately.
     *
     * @param context short label recorded in the request log, e.g. {@code "listTickets"}
     */
    public <R> R withRetry(ConnectorOperation<R> operation, String context) throws ConnectorException {
        int maxAttempts = retryConfig.getMaxAttempts();
        String label = context == null || context.isBlank() ? "operation" : context;
        ConnectorException lastFailure = null;

        for (int attempt = 0; attempt <= maxAttempts; attempt++) {
            if (attempt > 0) {
                pause(backoff.delayMs(attempt));
            }
            long start = clock.millis();
            try {
                if (!consumeRateLimit()) {
                    throw ConnectorException.builder(
                            "Rate limit exceeded for '" + providerId + "'", ErrorCategory.RATE_LIMIT, providerId)
                            .detail("resetMs", rateLimiter.resetInMs())
                            .build();
                }
                R result = operation.call();
                recordSuccess(label, clock.millis() - start);
                return result;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                    ConnectorException stopped = interrupted(e);
                    recordFailure(label, clock.millis() - start, stopped);
                    throw stopped;
                }
                ConnectorException failure = categorizeError(e);
                recordFailure(label, clock.millis() - start, failure);
                lastFailure = failure;
                if (!failure.isRetryable() || attempt == maxAttempts) {
                    throw failure;
                }
                log.warn("'{}' {} failed (attempt {}/{}, {}): {}; retrying",
                        providerId, label, attempt + 1, maxAttempts + 1,
                        failure.getCategory().wireName(), failure.getMessage());
            }
        }
        throw new ConnectorException("Operation '" + label + "' failed after " + (maxAttempts + 1) + " attempts",
                ErrorCategory.UNKNOWN, providerId, lastFailure);
    }

    /** Backoff delay for retry number {@code attempt} (1-indexed). */
    public long calculateBackoffDelay(int attempt) {
        return backoff.delayMs(attempt);
    }

    public ConnectorException categorizeError(Throwable error) {
        return ErrorClassifier.classify(error, providerId);
    }

    // ------------------------------------------------------------------
    // Rate limiting
    // ------------------------------------------------------------------

    public boolean checkRateLimit() {
        return rateLimiter.check();
    }

    /**
     * Takes one request from the current window. A rejection moves a connected
     * connector to {@code rate_limited} and emits {@code rate_limited}.
     */
    public boolean consumeRateLimit() {
        if (rateLimiter.tryConsume()) {
            return true;
        }
        if (status == ConnectorStatus.CONNECTED) {
            status = ConnectorStatus.RATE_LIMITED;
        }
        long resetMs = rateLimiter.resetInMs();
        log.debug("Rate limit hit for '{}', window resets in {}ms", providerId, resetMs);
        emit(ConnectorEventType.RATE_LIMITED, Map.of("resetMs", resetMs));
        return false;
    }

    public int getRemainingRateLimit() {
        return rateLimiter.remaining();
    }

    public long getRateLimitResetMs() {
        return rateLimiter.resetInMs();
    }

    // ------------------------------------------------------------------
    // Credentials
    // ------------------------------------------------------------------

    /** Replaces the held credentials wholesale and emits {@code credentials_refreshed}. */
    public void updateCredentials(ConnectorCredentials newCredentials) {
        this.credentials = newCredentials;
        emit(ConnectorEventType.CREDENTIALS_REFRESHED,
                newCredentials == null ? null : newCredentials.getExpiresAt());
        log.info("Credentials for '{}' replaced", providerId);
    }

    /**
     * {@code true} when the held credentials expire within five minutes or have
     * already expired. Credentials without an expiry never need a refresh.
     */
    public boolean credentialsNeedRefresh() {
        ConnectorCredentials held = credentials;
        if (held == null || held.getExpiresAt() == null) {
            return false;
        }
        return !held.getExpiresAt().isAfter(clock.instant().plus(REFRESH_BUFFER));
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    public void on(ConnectorEventType type, ConnectorEventListener listener)  { events.on(type, listener); }
    public void off(ConnectorEventType type, ConnectorEventListener listener) { events.off(type, listener); }

    protected void emit(ConnectorEventType type, Object data) {
        events.publish(new ConnectorEvent(type, providerId, clock.instant(), data));
    }

    public ConnectorEventBus getEventBus() { return events; }

    // ------------------------------------------------------------------
    // Request log and metrics
    // ------------------------------------------------------------------

    /**
     * Appends a request log entry, evicting the oldest beyond
     * {@value #REQUEST_LOG_SIZE}.
     */
    public void logRequest(String method, String url, Integer statusCode, long durationMs,
                           boolean success, String error) {
        ConnectorConfig current = config;
        RequestLogEntry entry = new RequestLogEntry(
                providerId + "-" + requestSeq.incrementAndGet(),
                current != null ? current.getId() : providerId,
                clock.instant(), method, url, statusCode, durationMs, success, error);
        synchronized (requestLogs) {
            requestLogs.addLast(entry);
            while (requestLogs.size() > REQUEST_LOG_SIZE) {
                requestLogs.removeFirst();
            }
        }
    }

    public List<RequestLogEntry> getRequestLogs() {
        return getRequestLogs(REQUEST_LOG_SIZE);
    }

    /** The most recent {@code limit} entries, oldest first. */
    public List<RequestLogEntry> getRequestLogs(int limit) {
        synchronized (requestLogs) {
            List<RequestLogEntry> all = new ArrayList<>(requestLogs);
            int from = Math.max(0, all.size() - Math.max(0, limit));
            return List.copyOf(all.subList(from, all.size()));
        }
    }

    public ConnectorMetrics getMetrics() {
        synchronized (metricsLock) {
            double average = totalCalls == 0 ? 0.0 : (double) totalResponseMs / totalCalls;
            return new ConnectorMetrics(totalCalls, successfulCalls, failedCalls, average,
                    lastSuccessAt, lastErrorAt, lastError);
        }
    }

    public void resetMetrics() {
        synchronized (metricsLock) {
            totalCalls = 0;
            successfulCalls = 0;
            failedCalls = 0;
            totalResponseMs = 0;
            lastSuccessAt = null;
            lastErrorAt = null;
            lastError = null;
        }
    }

    private void recordSuccess(String label, long durationMs) {
        synchronized (metricsLock) {
            totalCalls++;
            successfulCalls++;
            totalResponseMs += durationMs;
            lastSuccessAt = clock.instant();
        }
        if (status == ConnectorStatus.RATE_LIMITED) {
            status = ConnectorStatus.CONNECTED;
        }
        logRequest("CALL", label, null, durationMs, true, null);
    }

    private void recordFailure(String label, long durationMs, ConnectorException failure) {
        synchronized (metricsLock) {
            totalCalls++;
            failedCalls++;
            totalResponseMs += durationMs;
            lastErrorAt = clock.instant();
            lastError = failure.getMessage();
        }
        logRequest("CALL", label, failure.getStatusCode(), durationMs, false, failure.getMessage());
    }

    // ------------------------------------------------------------------
    // Health history
    // ------------------------------------------------------------------

    public List<HealthCheckResult> getHealthHistory() {
        synchronized (healthHistory) {
            return List.copyOf(healthHistory);
        }
    }

    public Optional<HealthCheckResult> getLastHealthCheck() {
        synchronized (healthHistory) {
            return Optional.ofNullable(healthHistory.peekLast());
        }
    }

    private int trailingFailures() {
        int failures = 0;
        synchronized (healthHistory) {
            Iterator<HealthCheckResult> newestFirst = healthHistory.descendingIterator();
            while (newestFirst.hasNext() && !newestFirst.next().isHealthy()) {
                failures++;
            }
        }
        return failures;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public T                    getDelegate()          { return delegate; }
    public String               getProviderId()        { return providerId; }
    public CatalogEntry         getCatalogEntry()      { return delegate.catalogEntry(); }
    public ConnectorStatus      getStatus()            { return status; }
    public boolean              isConnected()          { return status == ConnectorStatus.CONNECTED; }
    public ConnectorConfig      getConfig()            { return config; }
    public ConnectorCredentials getCredentials()       { return credentials; }
    public int                  getReconnectAttempts() { return reconnectAttempts; }
    public RetryConfig          getRetryConfig()       { return retryConfig; }
    public RateLimitConfig      getRateLimitConfig()   { return rateLimiter.getConfig(); }

    /** Stops event delivery. Does not disconnect. */
    @Override
    public void close() {
        events.close();
    }

    @Override
    public String toString() {
        return "ResilientConnector{provider='" + providerId + "', status=" + status.wireName() + '}';
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private void establish(ConnectorConfig newConfig, ConnectorCredentials newCredentials) throws ConnectorException {
        status = ConnectorStatus.CONNECTING;
        this.config = newConfig;
        this.credentials = newCredentials;
        try {
            delegate.doConnect(newConfig, newCredentials);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ConnectorException failure = categorizeError(e);
            status = ConnectorStatus.ERROR;
            log.warn("Connector '{}' failed to connect ({}): {}",
                    providerId, failure.getCategory().wireName(), failure.getMessage());
            emit(ConnectorEventType.ERROR, failure);
            throw failure;
        }
        status = ConnectorStatus.CONNECTED;
        log.info("Connector '{}' connected (install={})", providerId, newConfig != null ? newConfig.getId() : null);
        emit(ConnectorEventType.CONNECTED, newConfig != null ? newConfig.getId() : null);
    }

    private void pause(long millis) throws ConnectorException {
        if (millis <= 0) {
            return;
        }
        try {
            sleeper.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted(e);
        }
    }

    private ConnectorException interrupted(Exception e) {
        return ConnectorException.builder("Interrupted while waiting on '" + providerId + "'",
                        ErrorCategory.NETWORK, providerId)
                .retryable(false)
                .cause(e)
                .build();
    }

    // ------------------------------------------------------------------
    // Builder
    // ------------------------------------------------------------------

    public static <T extends Connector> Builder<T> builder(T delegate) {
        return new Builder<>(delegate);
    }

    public static class Builder<T extends Connector> {
        private final T delegate;
        private RateLimitConfig rateLimitConfig = RateLimitConfig.defaults();
        private RetryConfig retryConfig = RetryConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private Sleeper sleeper = Sleeper.THREAD;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();
        private int eventQueueCapacity = ConnectorEventBus.DEFAULT_CAPACITY;

        protected Builder(T delegate) {
            if (delegate == null) {
                throw new IllegalArgumentException("delegate must not be null");
            }
            this.delegate = delegate;
        }

        public Builder<T> rateLimit(RateLimitConfig config)    { this.rateLimitConfig = config; return this; }
        public Builder<T> retry(RetryConfig config)            { this.retryConfig = config; return this; }
        public Builder<T> clock(Clock clock)                   { this.clock = clock; return this; }
        public Builder<T> sleeper(Sleeper sleeper)             { this.sleeper = sleeper; return this; }
        public Builder<T> random(DoubleSupplier random)        { this.random = random; return this; }
        public Builder<T> eventQueueCapacity(int capacity)     { this.eventQueueCapacity = capacity; return this; }

        public ResilientConnector<T> build() {
            return new ResilientConnector<>(this);
        }
    }
}
