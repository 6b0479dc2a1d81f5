package com.nchat.connectors.model;

import java.time.Instant;

/**
 * Point-in-time snapshot of a connector's call counters.
 */
public final class ConnectorMetrics {

    private final long    totalApiCalls;
    private final long    successfulCalls;
    private final long    failedCalls;
    private final double  averageResponseTimeMs;
    private final Instant lastSuccessAt;
    private final Instant lastErrorAt;
    private final String  lastError;

    public ConnectorMetrics(long totalApiCalls, long successfulCalls, long failedCalls,
                            double averageResponseTimeMs, Instant lastSuccessAt,
                            Instant lastErrorAt, String lastError) {
        this.totalApiCalls         = totalApiCalls;
        this.successfulCalls       = successfulCalls;
        this.failedCalls           = failedCalls;
        this.averageResponseTimeMs = averageResponseTimeMs;
        this.lastSuccessAt         = lastSuccessAt;
        this.lastErrorAt           = lastErrorAt;
        this.lastError             = lastError;
    }

    public static ConnectorMetrics empty() {
        return new ConnectorMetrics(0, 0, 0, 0.0, null, null, null);
    }

    public long    getTotalApiCalls()         { return totalApiCalls; }
    public long    getSuccessfulCalls()       { return successfulCalls; }
    public long    getFailedCalls()           { return failedCalls; }
    public double  getAverageResponseTimeMs() { return averageResponseTimeMs; }
    public Instant getLastSuccessAt()         { return lastSuccessAt; }
    public Instant getLastErrorAt()           { return lastErrorAt; }
    public String  getLastError()             { return lastError; }

    @Override
    public String toString() {
        return "ConnectorMetrics{total=" + totalApiCalls + ", ok=" + successfulCalls +
               ", failed=" + failedCalls + ", avgMs=" + averageResponseTimeMs + '}';
    }
}
