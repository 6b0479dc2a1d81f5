package com.nchat.connectors.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Current data for one entity, with the checksum recorded at its last sync
 * ({@code null} when it was never synced).
 */
public final class SyncRecord {

    private final String              entityId;
    private final Map<String, Object> data;
    private final String              previousChecksum;

    public SyncRecord(String entityId, Map<String, ?> data, String previousChecksum) {
        this.entityId         = entityId;
        this.data             = Collections.unmodifiableMap(new LinkedHashMap<>(data));
        this.previousChecksum = previousChecksum;
    }

    public SyncRecord(String entityId, Map<String, ?> data) {
        this(entityId, data, null);
    }

    public String              getEntityId()         { return entityId; }
    public Map<String, Object> getData()             { return data; }
    public String              getPreviousChecksum() { return previousChecksum; }
}
