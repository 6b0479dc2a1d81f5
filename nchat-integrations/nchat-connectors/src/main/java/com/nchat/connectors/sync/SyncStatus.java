package com.nchat.connectors.sync;

/** Coarse state of one integration/entity-type pair. */
public enum SyncStatus {
    IDLE("idle"),
    SYNCING("syncing"),
    ERROR("error");

    private final String wireName;

    SyncStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
