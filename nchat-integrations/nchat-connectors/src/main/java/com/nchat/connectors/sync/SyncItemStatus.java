package com.nchat.connectors.sync;

/**
 * <pre>
 *   PENDING -&gt; PROCESSING -&gt; (completed, removed from the queue)
 *   PROCESSING -&gt; PENDING   retry budget left
 *   PROCESSING -&gt; ERROR     retries exhausted or failure not retryable
 * </pre>
 */
public enum SyncItemStatus {
    PENDING("pending"),
    PROCESSING("processing"),
    ERROR("error");

    private final String wireName;

    SyncItemStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
