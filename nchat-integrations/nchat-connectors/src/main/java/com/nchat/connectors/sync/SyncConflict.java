package com.nchat.connectors.sync;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Both versions of an entity that changed on each side since the last sync.
 * Immutable; resolving produces a new instance.
 */
public final class SyncConflict {

    private final String              id;
    private final String              integrationId;
    private final String              entityType;
    private final String              entityId;
    private final Map<String, Object> sourceData;
    private final Map<String, Object> targetData;
    private final Instant             detectedAt;
    private final ConflictResolution  resolution;
    private final String              resolvedBy;
    private final Instant             resolvedAt;

    SyncConflict(String id, String integrationId, String entityType, String entityId,
                 Map<String, ?> sourceData, Map<String, ?> targetData, Instant detectedAt) {
        this(id, integrationId, entityType, entityId, copy(sourceData), copy(targetData), detectedAt,
                null, null, null);
    }

    private SyncConflict(String id, String integrationId, String entityType, String entityId,
                         Map<String, Object> sourceData, Map<String, Object> targetData, Instant detectedAt,
                         ConflictResolution resolution, String resolvedBy, Instant resolvedAt) {
        this.id            = id;
        this.integrationId = integrationId;
        this.entityType    = entityType;
        this.entityId      = entityId;
        this.sourceData    = sourceData;
        this.targetData    = targetData;
        this.detectedAt    = detectedAt;
        this.resolution    = resolution;
        this.resolvedBy    = resolvedBy;
        this.resolvedAt    = resolvedAt;
    }

    public String              getId()            { return id; }
    public String              getIntegrationId() { return integrationId; }
    public String              getEntityType()    { return entityType; }
    public String              getEntityId()      { return entityId; }
    public Map<String, Object> getSourceData()    { return sourceData; }
    public Map<String, Object> getTargetData()    { return targetData; }
    public Instant             getDetectedAt()    { return detectedAt; }
    /** {@code null} while unresolved. */
    public ConflictResolution  getResolution()    { return resolution; }
    public String              getResolvedBy()    { return resolvedBy; }
    public Instant             getResolvedAt()    { return resolvedAt; }

    public boolean isResolved() {
        return resolution != null;
    }

    SyncConflict resolve(ConflictResolution resolution, String resolvedBy, Instant resolvedAt) {
        return new SyncConflict(id, integrationId, entityType, entityId, sourceData, targetData, detectedAt,
                resolution, resolvedBy, resolvedAt);
    }

    private static Map<String, Object> copy(Map<String, ?> data) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    @Override
    public String toString() {
        return "SyncConflict{id='" + id + "', " + integrationId + '/' + entityType + '/' + entityId +
               ", resolution=" + (resolution == null ? "open" : resolution.wireName()) + '}';
    }
}
