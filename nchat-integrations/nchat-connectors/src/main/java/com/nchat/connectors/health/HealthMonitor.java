package com.nchat.connectors.health;

import com.nchat.connectors.core.ResilientConnector;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.util.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically probes installed connectors and disables the ones that keep failing.
 *
 * <p>The first probe runs as soon as monitoring starts, then every
 * {@code checkIntervalMs}. When a probe reports at least
 * {@code maxConsecutiveFailures} consecutive failures the
 * {@link AutoDisableListener} is told and monitoring of that integration stops.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthMonitorConfig config;
    private final AutoDisableListener autoDisableListener;
    private final ScheduledExecutorService scheduler;

    private final Map<String, ResilientConnector<?>> monitored = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>>    tasks     = new ConcurrentHashMap<>();

    public HealthMonitor(HealthMonitorConfig config) {
        this(config, null);
    }

    public HealthMonitor(HealthMonitorConfig config, AutoDisableListener autoDisableListener) {
        this.config = config;
        this.autoDisableListener = autoDisableListener;
        this.scheduler = Executors.newScheduledThreadPool(config.getThreads(),
                new DaemonThreadFactory("connector-health-"));
    }

    /**
     * Starts probing {@code connector} under {@code integrationId}, replacing any
     * earlier monitoring of the same id.
     */
    public synchronized void startMonitoring(String integrationId, ResilientConnector<?> connector) {
        stopMonitoring(integrationId);
        monitored.put(integrationId, connector);
        ScheduledFuture<?> task = scheduler.scheduleWithFixedDelay(
                () -> probe(integrationId, connector),
                0, config.getCheckIntervalMs(), TimeUnit.MILLISECONDS);
        tasks.put(integrationId, task);
        log.info("Health monitoring started for '{}' every {}ms", integrationId, config.getCheckIntervalMs());
    }

    public synchronized void stopMonitoring(String integrationId) {
        ScheduledFuture<?> task = tasks.remove(integrationId);
        if (task != null) {
            task.cancel(false);
            log.info("Health monitoring stopped for '{}'", integrationId);
        }
        monitored.remove(integrationId);
    }

    public void stopAll() {
        for (String id : List.copyOf(tasks.keySet())) {
            stopMonitoring(id);
        }
    }

    public boolean isMonitoring(String integrationId) {
        return tasks.containsKey(integrationId);
    }

    public Optional<HealthCheckResult> getLatest(String integrationId) {
        ResilientConnector<?> connector = monitored.get(integrationId);
        return connector == null ? Optional.empty() : connector.getLastHealthCheck();
    }

    public List<HealthCheckResult> getHistory(String integrationId) {
        ResilientConnector<?> connector = monitored.get(integrationId);
        return connector == null ? List.of() : connector.getHealthHistory();
    }

    @Override
    public void close() {
        stopAll();
        scheduler.shutdownNow();
    }

    private void probe(String integrationId, ResilientConnector<?> connector) {
        HealthCheckResult result = connector.healthCheck();
        if (result.isHealthy()) {
            log.debug("'{}' healthy in {}ms", integrationId, result.getResponseTimeMs());
            return;
        }
        log.warn("'{}' unhealthy ({} consecutive): {}",
                integrationId, result.getConsecutiveFailures(), result.getMessage());
        if (result.getConsecutiveFailures() >= config.getMaxConsecutiveFailures()) {
            String reason = "Auto-disabled after " + result.getConsecutiveFailures()
                    + " consecutive health check failures: " + result.getMessage();
            stopMonitoring(integrationId);
            log.warn("Integration '{}' auto-disabled", integrationId);
            if (autoDisableListener != null) {
                try {
                    autoDisableListener.onAutoDisable(integrationId, reason);
                } catch (RuntimeException e) {
                    log.error("Auto-disable listener failed for '{}'", integrationId, e);
                }
            }
        }
    }
}
