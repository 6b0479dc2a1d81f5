package com.nchat.connectors.sync;

import java.util.List;

/**
 * Outcome of one {@link SyncEngine#processQueue} batch for one
 * integration, entity type and direction.
 */
public final class SyncResult {

    private final String        integrationId;
    private final String        entityType;
    private final SyncDirection direction;
    private final int           created;
    private final int           updated;
    private final int           deleted;
    private final int           errors;
    private final List<String>  errorMessages;
    private final long          durationMs;

    SyncResult(String integrationId, String entityType, SyncDirection direction, int created, int updated,
               int deleted, int errors, List<String> errorMessages, long durationMs) {
        this.integrationId = integrationId;
        this.entityType    = entityType;
        this.direction     = direction;
        this.created       = created;
        this.updated       = updated;
        this.deleted       = deleted;
        this.errors        = errors;
        this.errorMessages = List.copyOf(errorMessages);
        this.durationMs    = durationMs;
    }

    public String        getIntegrationId() { return integrationId; }
    public String        getEntityType()    { return entityType; }
    public SyncDirection getDirection()     { return direction; }
    public int           getCreated()       { return created; }
    public int           getUpdated()       { return updated; }
    public int           getDeleted()       { return deleted; }
    public int           getErrors()        { return errors; }
    public List<String>  getErrorMessages() { return errorMessages; }
    public long          getDurationMs()    { return durationMs; }

    public int getProcessed() {
        return created + updated + deleted + errors;
    }

    @Override
    public String toString() {
        return "SyncResult{" + integrationId + '/' + entityType + '/' + direction.wireName() +
               ", created=" + created + ", updated=" + updated + ", deleted=" + deleted +
               ", errors=" + errors + ", " + durationMs + "ms}";
    }
}
