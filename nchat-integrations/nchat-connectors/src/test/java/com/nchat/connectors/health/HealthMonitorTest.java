package com.nchat.connectors.health;

import com.nchat.connectors.core.ResilientConnector;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.support.StubConnector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthMonitorTest {

    private final StubConnector stub = new StubConnector();
    private final ResilientConnector<StubConnector> connector = ResilientConnector.builder(stub).build();
    private HealthMonitor monitor;

    @AfterEach
    void tearDown() {
        if (monitor != null) {
            monitor.close();
        }
        connector.close();
    }

    private static HealthMonitorConfig fastConfig(int maxFailures) {
        return HealthMonitorConfig.builder()
                .checkIntervalMs(10)
                .maxConsecutiveFailures(maxFailures)
                .threads(1)
                .build();
    }

    @Test
    void probesPeriodicallyAndExposesLatest() throws Exception {
        monitor = new HealthMonitor(fastConfig(3));
        monitor.startMonitoring("jira-1", connector);

        long deadline = System.currentTimeMillis() + 2000;
        while (stub.healthCalls.get() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }

        assertTrue(stub.healthCalls.get() >= 3);
        assertTrue(monitor.isMonitoring("jira-1"));
        assertTrue(monitor.getLatest("jira-1").orElseThrow().isHealthy());
        assertFalse(monitor.getHistory("jira-1").isEmpty());
    }

    @Test
    void autoDisablesAfterConsecutiveFailures() throws Exception {
        for (int i = 0; i < 10; i++) {
            stub.nextHealth(new IOException("connection refused"));
        }
        CountDownLatch disabled = new CountDownLatch(1);
        AtomicReference<String> reason = new AtomicReference<>();
        monitor = new HealthMonitor(fastConfig(3), (id, why) -> {
            reason.set(id + ": " + why);
            disabled.countDown();
        });

        monitor.startMonitoring("github-1", connector);

        assertTrue(disabled.await(2, TimeUnit.SECONDS));
        assertTrue(reason.get().startsWith("github-1: Auto-disabled after 3 consecutive"));
        assertFalse(monitor.isMonitoring("github-1"));

        int callsAtDisable = stub.healthCalls.get();
        Thread.sleep(50);
        assertEquals(callsAtDisable, stub.healthCalls.get());
    }

    @Test
    void recoveryResetsTheFailureStreak() throws Exception {
        stub.nextHealth(new IOException("timeout"))
                .nextHealth(new IOException("timeout"))
                .nextHealth(HealthCheckResult.healthy(1, "OK", Instant.EPOCH))
                .nextHealth(new IOException("timeout"))
                .nextHealth(new IOException("timeout"));
        CountDownLatch disabled = new CountDownLatch(1);
        monitor = new HealthMonitor(fastConfig(3), (id, why) -> disabled.countDown());

        monitor.startMonitoring("cal-1", connector);

        assertFalse(disabled.await(300, TimeUnit.MILLISECONDS));
        assertTrue(monitor.isMonitoring("cal-1"));
    }

    @Test
    void stopMonitoringCancelsProbes() throws Exception {
        monitor = new HealthMonitor(HealthMonitorConfig.builder().checkIntervalMs(60_000).build());
        monitor.startMonitoring("a", connector);
        monitor.startMonitoring("b", connector);

        monitor.stopMonitoring("a");
        assertFalse(monitor.isMonitoring("a"));
        assertTrue(monitor.getHistory("a").isEmpty());

        monitor.stopAll();
        assertFalse(monitor.isMonitoring("b"));
    }

    @Test
    void configDefaultsAndValidation() {
        HealthMonitorConfig defaults = HealthMonitorConfig.builder().build();
        assertEquals(60_000, defaults.getCheckIntervalMs());
        assertEquals(3, defaults.getMaxConsecutiveFailures());
        assertThrows(IllegalArgumentException.class,
                () -> HealthMonitorConfig.builder().checkIntervalMs(0).build());
    }
}
