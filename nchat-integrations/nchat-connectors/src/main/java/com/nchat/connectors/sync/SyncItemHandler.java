package com.nchat.connectors.sync;

/**
 * Applies one queued change, usually through a connector's
 * {@link com.nchat.connectors.core.ResilientConnector#withRetry withRetry}.
 * Any exception marks the item failed; it is classified to decide whether
 * the item goes back on the queue.
 */
@FunctionalInterface
public interface SyncItemHandler {

    void handle(SyncItem item) throws Exception;
}
