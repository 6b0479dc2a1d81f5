package com.nchat.connectors.error;

/**
 * Closed taxonomy every connector failure is mapped into.
 *
 * <ul>
 *   <li>{@link #AUTH}, {@link #DATA}, {@link #CONFIG}: surfaced immediately, never retried.</li>
 *   <li>{@link #RATE_LIMIT}, {@link #NETWORK}: retried with backoff, then surfaced.</li>
 *   <li>{@link #UNKNOWN}: not retried unless the thrower says otherwise.</li>
 * </ul>
 */
public enum ErrorCategory {
    AUTH("auth", false),
    RATE_LIMIT("rate_limit", true),
    NETWORK("network", true),
    DATA("data", false),
    CONFIG("config", false),
    UNKNOWN("unknown", false);

    private final String  wireName;
    private final boolean retryableByDefault;

    ErrorCategory(String wireName, boolean retryableByDefault) {
        this.wireName           = wireName;
        this.retryableByDefault = retryableByDefault;
    }

    public String  wireName()             { return wireName; }
    public boolean isRetryableByDefault() { return retryableByDefault; }
}
