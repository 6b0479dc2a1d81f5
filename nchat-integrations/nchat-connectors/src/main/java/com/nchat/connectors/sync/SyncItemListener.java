package com.nchat.connectors.sync;

/** Told about every item {@link SyncEngine#processQueue} handles. */
@FunctionalInterface
public interface SyncItemListener {

    void onItemProcessed(SyncItem item, boolean success);
}
