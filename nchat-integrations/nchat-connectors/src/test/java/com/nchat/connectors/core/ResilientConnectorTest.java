package com.nchat.connectors.core;

import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.event.ConnectorEvent;
import com.nchat.connectors.event.ConnectorEventListener;
import com.nchat.connectors.event.ConnectorEventType;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.ConnectorMetrics;
import com.nchat.connectors.model.ConnectorStatus;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.model.RequestLogEntry;
import com.nchat.connectors.ratelimit.RateLimitConfig;
import com.nchat.connectors.retry.RetryConfig;
import com.nchat.connectors.support.MutableClock;
import com.nchat.connectors.support.StubConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResilientConnectorTest {

    private static final ConnectorConfig CONFIG = ConnectorConfig.builder("install-1", "stub")
            .providerConfig("baseUrl", "https://example.test")
            .build();
    private static final ConnectorCredentials CREDS = ConnectorCredentials.builder("tok-1").build();

    private MutableClock clock;
    private List<Long> sleeps;
    private StubConnector stub;
    private ResilientConnector<StubConnector> connector;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        sleeps = new ArrayList<>();
        stub = new StubConnector();
        connector = newConnector(RetryConfig.defaults(), RateLimitConfig.defaults());
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    private ResilientConnector<StubConnector> newConnector(RetryConfig retry, RateLimitConfig rateLimit) {
        return ResilientConnector.builder(stub)
                .retry(retry)
                .rateLimit(rateLimit)
                .clock(clock)
                .random(() -> 0.0)
                .sleeper(millis -> {
                    sleeps.add(millis);
                    clock.advanceMillis(millis);
                })
                .build();
    }

    private List<ConnectorEvent> capture(ConnectorEventType type) {
        List<ConnectorEvent> events = new CopyOnWriteArrayList<>();
        connector.on(type, events::add);
        return events;
    }

    private void drainEvents() throws InterruptedException {
        assertTrue(connector.getEventBus().awaitDelivery(2, TimeUnit.SECONDS));
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Test
    void startsDisconnected() {
        assertEquals(ConnectorStatus.DISCONNECTED, connector.getStatus());
        assertFalse(connector.isConnected());
        assertEquals("stub", connector.getProviderId());
        assertSame(StubConnector.ENTRY, connector.getCatalogEntry());
    }

    @Test
    void connectStoresConfigAndEmitsConnected() throws Exception {
        List<ConnectorEvent> connected = capture(ConnectorEventType.CONNECTED);

        connector.connect(CONFIG, CREDS);
        drainEvents();

        assertTrue(connector.isConnected());
        assertSame(CONFIG, connector.getConfig());
        assertSame(CREDS, connector.getCredentials());
        assertEquals(1, connected.size());
        assertEquals("stub", connected.get(0).getProviderId());
        assertEquals("install-1", connected.get(0).getData());
    }

    @Test
    void connectWhenConnectedIsNoOp() throws Exception {
        connector.connect(CONFIG, CREDS);
        connector.connect(CONFIG, CREDS);
        assertEquals(1, stub.connectCalls.get());
    }

    @Test
    void connectFailureIsClassifiedAndEmitted() throws Exception {
        List<ConnectorEvent> errors = capture(ConnectorEventType.ERROR);
        stub.failConnectOnce(new IllegalStateException("401 Unauthorized"));

        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.connect(CONFIG, CREDS));
        drainEvents();

        assertEquals(ErrorCategory.AUTH, e.getCategory());
        assertFalse(e.isRetryable());
        assertEquals("stub", e.getProviderId());
        assertEquals(ConnectorStatus.ERROR, connector.getStatus());
        assertEquals(1, errors.size());
        assertSame(e, errors.get(0).getData());
    }

    @Test
    void disconnectClearsState() throws Exception {
        List<ConnectorEvent> disconnected = capture(ConnectorEventType.DISCONNECTED);
        connector.connect(CONFIG, CREDS);

        connector.disconnect();
        drainEvents();

        assertEquals(ConnectorStatus.DISCONNECTED, connector.getStatus());
        assertNull(connector.getConfig());
        assertNull(connector.getCredentials());
        assertEquals(1, disconnected.size());
    }

    @Test
    void disconnectWhenDisconnectedDoesNothing() throws Exception {
        connector.disconnect();
        assertEquals(0, stub.disconnectCalls.get());
    }

    @Test
    void disconnectFailureStillDisconnects() throws Exception {
        connector.connect(CONFIG, CREDS);
        stub.failDisconnect(new IOException("connection reset"));

        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.disconnect());

        assertEquals(ErrorCategory.NETWORK, e.getCategory());
        assertEquals(ConnectorStatus.DISCONNECTED, connector.getStatus());
        assertNull(connector.getCredentials());
    }

    @Test
    void reconnectWithoutStoredConfigFails() {
        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.reconnect());
        assertEquals(ErrorCategory.CONFIG, e.getCategory());
        assertFalse(e.isRetryable());
    }

    @Test
    void reconnectSucceedsAfterBackoff() throws Exception {
        List<ConnectorEvent> reconnecting = capture(ConnectorEventType.RECONNECTING);
        connector.connect(CONFIG, CREDS);

        connector.reconnect();
        drainEvents();

        assertTrue(connector.isConnected());
        assertEquals(List.of(1000L), sleeps);
        assertEquals(0, connector.getReconnectAttempts());
        assertEquals(1, reconnecting.size());
        assertEquals(1, reconnecting.get(0).getData());
    }

    @Test
    void reconnectDisablesAfterMaxAttempts() throws Exception {
        connector.connect(CONFIG, CREDS);
        stub.failConnectAlways(new ConnectException("Connection refused"));

        for (int i = 1; i <= ResilientConnector.MAX_RECONNECT_ATTEMPTS; i++) {
            ConnectorException e = assertThrows(ConnectorException.class, () -> connector.reconnect());
            assertEquals(ErrorCategory.NETWORK, e.getCategory());
            assertEquals(ConnectorStatus.ERROR, connector.getStatus());
            assertEquals(i, connector.getReconnectAttempts());
        }
        assertEquals(List.of(1000L, 2000L, 4000L, 8000L, 16_000L), sleeps);

        ConnectorException exhausted = assertThrows(ConnectorException.class, () -> connector.reconnect());
        assertEquals(ConnectorStatus.DISABLED, connector.getStatus());
        assertEquals(ErrorCategory.NETWORK, exhausted.getCategory());
        assertFalse(exhausted.isRetryable());
        assertTrue(exhausted.getMessage().contains("Max reconnect attempts"));
        assertEquals(1 + ResilientConnector.MAX_RECONNECT_ATTEMPTS, stub.connectCalls.get());
    }

    @Test
    void connectResetsReconnectAttempts() throws Exception {
        connector.connect(CONFIG, CREDS);
        stub.failConnectOnce(new ConnectException("refused"));
        assertThrows(ConnectorException.class, () -> connector.reconnect());
        assertEquals(1, connector.getReconnectAttempts());

        connector.connect(CONFIG, CREDS);

        assertTrue(connector.isConnected());
        assertEquals(0, connector.getReconnectAttempts());
    }

    // ------------------------------------------------------------------
    // Retries
    // ------------------------------------------------------------------

    @Test
    void withRetryRecoversFromTransientFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        String result = connector.withRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("503 Service Unavailable");
            }
            return "ok";
        }, "listTickets");

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1000L, 2000L), sleeps);

        ConnectorMetrics metrics = connector.getMetrics();
        assertEquals(3, metrics.getTotalApiCalls());
        assertEquals(1, metrics.getSuccessfulCalls());
        assertEquals(2, metrics.getFailedCalls());
        assertEquals("503 Service Unavailable", metrics.getLastError());
        assertTrue(metrics.getLastSuccessAt() != null);

        List<RequestLogEntry> logs = connector.getRequestLogs();
        assertEquals(3, logs.size());
        assertEquals("listTickets", logs.get(2).getUrl());
        assertTrue(logs.get(2).isSuccess());
        assertFalse(logs.get(0).isSuccess());
    }

    @Test
    void withRetryStopsOnNonRetryableFailure() {
        AtomicInteger calls = new AtomicInteger();

        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.withRetry(() -> {
            calls.incrementAndGet();
            throw new RuntimeException("403 Forbidden");
        }, "create"));

        assertEquals(ErrorCategory.AUTH, e.getCategory());
        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void withRetryGivesUpAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.withRetry(() -> {
            throw new IOException("timeout #" + calls.incrementAndGet());
        }, "sync"));

        assertEquals(4, calls.get());
        assertEquals("timeout #4", e.getMessage());
        assertEquals(3, sleeps.size());
    }

    @Test
    void withRetryWithZeroRetriesMakesOneAttempt() {
        connector.close();
        connector = newConnector(RetryConfig.builder().maxAttempts(0).build(), RateLimitConfig.defaults());
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConnectorException.class, () -> connector.withRetry(() -> {
            calls.incrementAndGet();
            throw new IOException("network timeout");
        }, "once"));

        assertEquals(1, calls.get());
    }

    @Test
    void withRetryPassesConnectorExceptionUnchanged() {
        ConnectorException original = new ConnectorException("bad mapping", ErrorCategory.DATA, "stub");
        ConnectorException thrown = assertThrows(ConnectorException.class,
                () -> connector.withRetry(() -> { throw original; }, "map"));
        assertSame(original, thrown);
    }

    // ------------------------------------------------------------------
    // Rate limiting
    // ------------------------------------------------------------------

    @Test
    void rateLimitRejectionMovesToRateLimitedAndRecovers() throws Exception {
        connector.close();
        connector = newConnector(RetryConfig.builder().maxAttempts(0).build(), new RateLimitConfig(2, 1000));
        List<ConnectorEvent> limited = capture(ConnectorEventType.RATE_LIMITED);
        connector.connect(CONFIG, CREDS);

        connector.withRetry(() -> 1, "a");
        connector.withRetry(() -> 2, "b");
        ConnectorException e = assertThrows(ConnectorException.class, () -> connector.withRetry(() -> 3, "c"));
        drainEvents();

        assertEquals(ErrorCategory.RATE_LIMIT, e.getCategory());
        assertEquals(1000L, e.getDetails().get("resetMs"));
        assertEquals(ConnectorStatus.RATE_LIMITED, connector.getStatus());
        assertEquals(1, limited.size());
        assertEquals(Map.of("resetMs", 1000L), limited.get(0).getData());

        clock.advanceMillis(1000);
        assertEquals(4, (int) connector.withRetry(() -> 4, "d"));
        assertEquals(ConnectorStatus.CONNECTED, connector.getStatus());
    }

    @Test
    void rateLimitedCallIsRetriedAfterBackoff() throws Exception {
        connector.close();
        connector = newConnector(RetryConfig.defaults(), new RateLimitConfig(1, 500));
        connector.withRetry(() -> "first", "a");

        // the first backoff sleep (1000ms) outlasts the 500ms window
        assertEquals("second", connector.withRetry(() -> "second", "b"));
        assertEquals(List.of(1000L), sleeps);
    }

    @Test
    void rateLimitAccessors() {
        connector.close();
        connector = newConnector(RetryConfig.defaults(), new RateLimitConfig(3, 10_000));

        assertTrue(connector.checkRateLimit());
        assertTrue(connector.consumeRateLimit());
        assertEquals(2, connector.getRemainingRateLimit());
        clock.advanceMillis(4000);
        assertEquals(6000, connector.getRateLimitResetMs());
        assertEquals(3, connector.getRateLimitConfig().getMaxRequests());
    }

    // ------------------------------------------------------------------
    // Credentials
    // ------------------------------------------------------------------

    @Test
    void credentialsNeedRefreshWithinFiveMinutes() throws Exception {
        connector.connect(CONFIG, ConnectorCredentials.builder("t").build());
        assertFalse(connector.credentialsNeedRefresh());

        connector.updateCredentials(ConnectorCredentials.builder("t")
                .expiresAt(clock.instant().plus(Duration.ofMinutes(10))).build());
        assertFalse(connector.credentialsNeedRefresh());

        connector.updateCredentials(ConnectorCredentials.builder("t")
                .expiresAt(clock.instant().plus(Duration.ofMinutes(4))).build());
        assertTrue(connector.credentialsNeedRefresh());

        connector.updateCredentials(ConnectorCredentials.builder("t")
                .expiresAt(clock.instant().minusSeconds(1)).build());
        assertTrue(connector.credentialsNeedRefresh());
    }

    @Test
    void updateCredentialsEmitsRefreshed() throws Exception {
        List<ConnectorEvent> refreshed = capture(ConnectorEventType.CREDENTIALS_REFRESHED);
        Instant expiry = clock.instant().plus(Duration.ofHours(1));
        ConnectorCredentials fresh = ConnectorCredentials.builder("tok-2").expiresAt(expiry).build();

        connector.updateCredentials(fresh);
        drainEvents();

        assertSame(fresh, connector.getCredentials());
        assertEquals(1, refreshed.size());
        assertEquals(expiry, refreshed.get(0).getData());
    }

    // ------------------------------------------------------------------
    // Health
    // ------------------------------------------------------------------

    @Test
    void healthCheckCountsConsecutiveFailures() throws Exception {
        List<ConnectorEvent> checks = capture(ConnectorEventType.HEALTH_CHECK);
        stub.nextHealth(new IOException("timeout"))
                .nextHealth(HealthCheckResult.unhealthy(3, "degraded", clock.instant(), 0))
                .nextHealth(new RuntimeException("503"));

        assertEquals(1, connector.healthCheck().getConsecutiveFailures());
        HealthCheckResult second = connector.healthCheck();
        assertEquals(2, second.getConsecutiveFailures());
        assertEquals("degraded", second.getMessage());
        HealthCheckResult third = connector.healthCheck();
        assertFalse(third.isHealthy());
        assertEquals(3, third.getConsecutiveFailures());
        assertEquals("503", third.getMessage());

        HealthCheckResult healthy = connector.healthCheck();
        assertTrue(healthy.isHealthy());
        assertEquals(0, healthy.getConsecutiveFailures());
        assertTrue(connector.healthCheck().isHealthy());

        drainEvents();
        assertEquals(5, checks.size());
    }

    @Test
    void healthHistoryIsBounded() {
        for (int i = 0; i < 15; i++) {
            connector.healthCheck();
        }
        assertEquals(ResilientConnector.HEALTH_HISTORY_SIZE, connector.getHealthHistory().size());
        assertTrue(connector.getLastHealthCheck().isPresent());
    }

    // ------------------------------------------------------------------
    // Request log and metrics
    // ------------------------------------------------------------------

    @Test
    void requestLogKeepsMostRecentEntries() {
        for (int i = 0; i < 105; i++) {
            connector.logRequest("GET", "/items/" + i, 200, 10, true, null);
        }
        List<RequestLogEntry> all = connector.getRequestLogs();
        assertEquals(ResilientConnector.REQUEST_LOG_SIZE, all.size());
        assertEquals("/items/5", all.get(0).getUrl());

        List<RequestLogEntry> recent = connector.getRequestLogs(3);
        assertEquals(3, recent.size());
        assertEquals("/items/104", recent.get(2).getUrl());
        assertEquals("stub", recent.get(2).getIntegrationId());
    }

    @Test
    void requestLogUsesInstallIdWhenConnected() throws Exception {
        connector.connect(CONFIG, CREDS);
        connector.logRequest("POST", "/issue", 201, 12, true, null);
        assertEquals("install-1", connector.getRequestLogs(1).get(0).getIntegrationId());
    }

    @Test
    void metricsAverageAndReset() throws Exception {
        connector.withRetry(() -> {
            clock.advanceMillis(40);
            return null;
        }, "slow");
        connector.withRetry(() -> {
            clock.advanceMillis(20);
            return null;
        }, "fast");

        assertEquals(30.0, connector.getMetrics().getAverageResponseTimeMs());

        connector.resetMetrics();
        ConnectorMetrics metrics = connector.getMetrics();
        assertEquals(0, metrics.getTotalApiCalls());
        assertEquals(0.0, metrics.getAverageResponseTimeMs());
        assertNull(metrics.getLastSuccessAt());
    }

    @Test
    void calculateBackoffDelayUsesRetryConfig() {
        assertEquals(1000, connector.calculateBackoffDelay(1));
        assertEquals(8000, connector.calculateBackoffDelay(4));
        assertEquals(30_000, connector.calculateBackoffDelay(9));
    }

    @Test
    void listenersCanBeRemoved() throws Exception {
        List<ConnectorEvent> seen = new CopyOnWriteArrayList<>();
        ConnectorEventListener listener = seen::add;
        connector.on(ConnectorEventType.CONNECTED, listener);
        connector.off(ConnectorEventType.CONNECTED, listener);

        connector.connect(CONFIG, CREDS);
        drainEvents();

        assertTrue(seen.isEmpty());
    }
}
