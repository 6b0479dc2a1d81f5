package com.nchat.connectors.ratelimit;

import java.time.Clock;

/**
 * Fixed-window request counter.
 *
 * <p>The window is reset lazily by comparing wall-clock time against
 * {@code windowStart}; there is no timer. Once {@code windowMs} has elapsed the
 * counter returns to zero and the window restarts at the current time.
 *
 * <p>Methods are synchronized so the check-then-increment in
 * {@link #tryConsume()} stays atomic even if a connector is shared between threads.
 */
public final class RateLimiter {

    private final RateLimitConfig config;
    private final Clock clock;

    private int  currentCount;
    private long windowStart;

    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config      = config;
        this.clock       = clock;
        this.windowStart = clock.millis();
    }

    /** Returns {@code true} if a request would currently be permitted, without consuming it. */
    public synchronized boolean check() {
        rollWindow();
        return currentCount < config.getMaxRequests();
    }

    /**
     * Consumes one request from the current window.
     *
     * @return {@code true} if the request is permitted
     */
    public synchronized boolean tryConsume() {
        rollWindow();
        if (currentCount < config.getMaxRequests()) {
            currentCount++;
            return true;
        }
        return false;
    }

    public synchronized int remaining() {
        rollWindow();
        return Math.max(0, config.getMaxRequests() - currentCount);
    }

    /** Milliseconds until the current window closes; never negative. */
    public synchronized long resetInMs() {
        long elapsed = clock.millis() - windowStart;
        return Math.max(0, config.getWindowMs() - elapsed);
    }

    public RateLimitConfig getConfig() { return config; }

    private void rollWindow() {
        long now = clock.millis();
        if (now - windowStart >= config.getWindowMs()) {
            currentCount = 0;
            windowStart  = now;
        }
    }
}
