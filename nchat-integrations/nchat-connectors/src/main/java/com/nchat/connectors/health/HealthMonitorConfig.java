package com.nchat.connectors.health;

/**
 * Settings for {@link HealthMonitor}.
 */
public final class HealthMonitorConfig {

    private final long checkIntervalMs;
    private final int  maxConsecutiveFailures;
    private final int  threads;

    private HealthMonitorConfig(Builder b) {
        this.checkIntervalMs        = b.checkIntervalMs;
        this.maxConsecutiveFailures = b.maxConsecutiveFailures;
        this.threads                = b.threads;
    }

    public long getCheckIntervalMs()        { return checkIntervalMs; }
    public int  getMaxConsecutiveFailures() { return maxConsecutiveFailures; }
    public int  getThreads()                { return threads; }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private long checkIntervalMs        = 60_000;
        private int  maxConsecutiveFailures = 3;
        private int  threads                = 2;

        public Builder checkIntervalMs(long intervalMs)       { this.checkIntervalMs = intervalMs; return this; }
        public Builder maxConsecutiveFailures(int failures)   { this.maxConsecutiveFailures = failures; return this; }
        public Builder threads(int threads)                   { this.threads = threads; return this; }

        public HealthMonitorConfig build() {
            if (checkIntervalMs <= 0) {
                throw new IllegalArgumentException("checkIntervalMs must be > 0, got: " + checkIntervalMs);
            }
            if (maxConsecutiveFailures <= 0) {
                throw new IllegalArgumentException("maxConsecutiveFailures must be > 0, got: " + maxConsecutiveFailures);
            }
            if (threads <= 0) {
                throw new IllegalArgumentException("threads must be > 0, got: " + threads);
            }
            return new HealthMonitorConfig(this);
        }
    }
}
