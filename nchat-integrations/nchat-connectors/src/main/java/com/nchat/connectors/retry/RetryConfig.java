package com.nchat.connectors.retry;

/**
 * Retry and backoff settings for one connector instance.
 *
 * <pre>
 *   RetryConfig retry = RetryConfig.builder()
 *       .maxAttempts(3)
 *       .initialDelayMs(500)
 *       .maxDelayMs(15_000)
 *       .build();
 * </pre>
 */
public final class RetryConfig {

    private final int    maxAttempts;
    private final long   initialDelayMs;
    private final long   maxDelayMs;
    private final double backoffMultiplier;
    private final double jitterFactor;

    private RetryConfig(Builder b) {
        this.maxAttempts       = b.maxAttempts;
        this.initialDelayMs    = b.initialDelayMs;
        this.maxDelayMs        = b.maxDelayMs;
        this.backoffMultiplier = b.backoffMultiplier;
        this.jitterFactor      = b.jitterFactor;
    }

    public static RetryConfig defaults() { return builder().build(); }

    /** Number of retries after the initial attempt. */
    public int    getMaxAttempts()       { return maxAttempts; }
    public long   getInitialDelayMs()    { return initialDelayMs; }
    public long   getMaxDelayMs()        { return maxDelayMs; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public double getJitterFactor()      { return jitterFactor; }

    @Override
    public String toString() {
        return "RetryConfig{maxAttempts=" + maxAttempts + ", initialDelayMs=" + initialDelayMs +
               ", maxDelayMs=" + maxDelayMs + ", multiplier=" + backoffMultiplier +
               ", jitter=" + jitterFactor + '}';
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int    maxAttempts       = 3;
        private long   initialDelayMs    = 1_000;
        private long   maxDelayMs        = 30_000;
        private double backoffMultiplier = 2.0;
        private double jitterFactor      = 0.1;

        public Builder maxAttempts(int maxAttempts)              { this.maxAttempts = maxAttempts; return this; }
        public Builder initialDelayMs(long initialDelayMs)       { this.initialDelayMs = initialDelayMs; return this; }
        public Builder maxDelayMs(long maxDelayMs)               { this.maxDelayMs = maxDelayMs; return this; }
        public Builder backoffMultiplier(double multiplier)      { this.backoffMultiplier = multiplier; return this; }
        public Builder jitterFactor(double jitterFactor)         { this.jitterFactor = jitterFactor; return this; }

        public RetryConfig build() {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("maxAttempts must be >= 0, got: " + maxAttempts);
            }
            if (initialDelayMs < 0 || maxDelayMs < 0) {
                throw new IllegalArgumentException("delays must be >= 0");
            }
            if (backoffMultiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1, got: " + backoffMultiplier);
            }
            if (jitterFactor < 0) {
                throw new IllegalArgumentException("jitterFactor must be >= 0, got: " + jitterFactor);
            }
            return new RetryConfig(this);
        }
    }
}
