package com.nchat.connectors.sync;

/** Which way a change travels between nchat and the provider. */
public enum SyncDirection {
    INCOMING("incoming"),
    OUTGOING("outgoing");

    private final String wireName;

    SyncDirection(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
