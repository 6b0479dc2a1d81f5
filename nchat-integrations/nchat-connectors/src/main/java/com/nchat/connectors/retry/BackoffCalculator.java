package com.nchat.connectors.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with additive jitter.
 *
 * <p>Delay formula for attempt {@code n} (1-indexed):
 * {@code base = min(initialDelay * multiplier^(n-1), maxDelay)}, then
 * {@code floor(base + base * jitterFactor * random)} with {@code random} in [0, 1).
 * Jitter only ever lengthens the base delay.
 */
public final class BackoffCalculator {

    private final RetryConfig    config;
    private final DoubleSupplier random;

    public BackoffCalculator(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of uniform values in [0, 1)
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /** Base delay for {@code attempt} before jitter is applied. */
    public long baseDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        double exp = config.getInitialDelayMs() * Math.pow(config.getBackoffMultiplier(), attempt - 1);
        return (long) Math.min(exp, (double) config.getMaxDelayMs());
    }

    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        double base = Math.min(
                config.getInitialDelayMs() * Math.pow(config.getBackoffMultiplier(), attempt - 1),
                (double) config.getMaxDelayMs());
        double jitter = base * config.getJitterFactor() * random.getAsDouble();
        return (long) Math.floor(base + jitter);
    }

    public RetryConfig getConfig() { return config; }
}
