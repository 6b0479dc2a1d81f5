package com.nchat.connectors.sync;

import java.time.Instant;
import java.util.Map;

/**
 * A queued {@link SyncRequest} plus the engine's bookkeeping. The status
 * fields are written by {@link SyncEngine} only.
 */
public final class SyncItem {

    private final String      id;
    private final long        sequence;
    private final SyncRequest request;
    private final Instant     enqueuedAt;

    private volatile SyncItemStatus status = SyncItemStatus.PENDING;
    private volatile int            attempts;
    private volatile String         lastError;

    SyncItem(String id, long sequence, SyncRequest request, Instant enqueuedAt) {
        this.id         = id;
        this.sequence   = sequence;
        this.request    = request;
        this.enqueuedAt = enqueuedAt;
    }

    public String              getId()            { return id; }
    public String              getIntegrationId() { return request.getIntegrationId(); }
    public String              getEntityType()    { return request.getEntityType(); }
    public String              getEntityId()      { return request.getEntityId(); }
    public SyncDirection       getDirection()     { return request.getDirection(); }
    public SyncOperation       getOperation()     { return request.getOperation(); }
    public Map<String, Object> getPayload()       { return request.getPayload(); }
    public int                 getPriority()      { return request.getPriority(); }
    public int                 getMaxRetries()    { return request.getMaxRetries(); }
    public Instant             getEnqueuedAt()    { return enqueuedAt; }
    public SyncItemStatus      getStatus()        { return status; }
    public int                 getAttempts()      { return attempts; }
    public String              getLastError()     { return lastError; }

    long sequence() { return sequence; }

    void startAttempt() {
        status = SyncItemStatus.PROCESSING;
        attempts++;
    }

    void requeue(String error) {
        status = SyncItemStatus.PENDING;
        lastError = error;
    }

    void release() {
        status = SyncItemStatus.PENDING;
        attempts--;
    }

    void park(String error) {
        status = SyncItemStatus.ERROR;
        lastError = error;
    }

    @Override
    public String toString() {
        return "SyncItem{id='" + id + "', " + getIntegrationId() + '/' + getEntityType() + '/' + getEntityId() +
               ", op=" + getOperation().wireName() + ", status=" + status.wireName() + ", attempts=" + attempts + '}';
    }
}
