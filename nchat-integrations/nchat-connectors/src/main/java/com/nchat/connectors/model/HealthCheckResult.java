package com.nchat.connectors.model;

import java.time.Instant;

/**
 * Outcome of a single connector health probe.
 */
public final class HealthCheckResult {

    private final boolean healthy;
    private final long    responseTimeMs;
    private final String  message;
    private final Instant checkedAt;
    private final int     consecutiveFailures;

    public HealthCheckResult(boolean healthy, long responseTimeMs, String message,
                             Instant checkedAt, int consecutiveFailures) {
        this.healthy             = healthy;
        this.responseTimeMs      = responseTimeMs;
        this.message             = message;
        this.checkedAt           = checkedAt;
        this.consecutiveFailures = consecutiveFailures;
    }

    public static HealthCheckResult healthy(long responseTimeMs, String message, Instant checkedAt) {
        return new HealthCheckResult(true, responseTimeMs, message, checkedAt, 0);
    }

    public static HealthCheckResult unhealthy(long responseTimeMs, String message, Instant checkedAt,
                                              int consecutiveFailures) {
        return new HealthCheckResult(false, responseTimeMs, message, checkedAt, consecutiveFailures);
    }

    public boolean isHealthy()              { return healthy; }
    public long    getResponseTimeMs()      { return responseTimeMs; }
    public String  getMessage()             { return message; }
    public Instant getCheckedAt()           { return checkedAt; }
    public int     getConsecutiveFailures() { return consecutiveFailures; }

    @Override
    public String toString() {
        return "HealthCheckResult{healthy=" + healthy + ", responseTimeMs=" + responseTimeMs +
               ", message='" + message + "', consecutiveFailures=" + consecutiveFailures + '}';
    }
}
