package com.nchat.connectors.ratelimit;

/**
 * Fixed-window request budget for one connector instance.
 */
public final class RateLimitConfig {

    public static final int  DEFAULT_MAX_REQUESTS = 100;
    public static final long DEFAULT_WINDOW_MS    = 60_000;

    private final int  maxRequests;
    private final long windowMs;

    public RateLimitConfig(int maxRequests, long windowMs) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be > 0, got: " + maxRequests);
        }
        if (windowMs <= 0) {
            throw new IllegalArgumentException("windowMs must be > 0, got: " + windowMs);
        }
        this.maxRequests = maxRequests;
        this.windowMs    = windowMs;
    }

    public static RateLimitConfig defaults() {
        return new RateLimitConfig(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW_MS);
    }

    public int  getMaxRequests() { return maxRequests; }
    public long getWindowMs()    { return windowMs; }

    @Override
    public String toString() {
        return "RateLimitConfig{maxRequests=" + maxRequests + ", windowMs=" + windowMs + '}';
    }
}
