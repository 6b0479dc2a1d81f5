package com.nchat.connectors.sync;

public enum SyncOperation {
    CREATE("create"),
    UPDATE("update"),
    DELETE("delete");

    private final String wireName;

    SyncOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
