package com.nchat.connectors.sync;

import java.time.Instant;

/**
 * Progress of one integration/entity-type pair. {@code pendingCount} is taken
 * from the live queue whenever the state is read.
 */
public final class SyncState {

    private final String     integrationId;
    private final String     entityType;
    private final SyncStatus status;
    private final Instant    lastSyncAt;
    private final String     lastSyncCursor;
    private final long       syncedCount;
    private final long       errorCount;
    private final int        pendingCount;
    private final String     lastError;

    private SyncState(Builder b) {
        this.integrationId  = b.integrationId;
        this.entityType     = b.entityType;
        this.status         = b.status;
        this.lastSyncAt     = b.lastSyncAt;
        this.lastSyncCursor = b.lastSyncCursor;
        this.syncedCount    = b.syncedCount;
        this.errorCount     = b.errorCount;
        this.pendingCount   = b.pendingCount;
        this.lastError      = b.lastError;
    }

    public String     getIntegrationId()  { return integrationId; }
    public String     getEntityType()     { return entityType; }
    public SyncStatus getStatus()         { return status; }
    public Instant    getLastSyncAt()     { return lastSyncAt; }
    /** Provider paging or change-feed position to resume from. */
    public String     getLastSyncCursor() { return lastSyncCursor; }
    public long       getSyncedCount()    { return syncedCount; }
    public long       getErrorCount()     { return errorCount; }
    public int        getPendingCount()   { return pendingCount; }
    public String     getLastError()      { return lastError; }

    public Builder toBuilder() {
        return new Builder(integrationId, entityType)
                .status(status)
                .lastSyncAt(lastSyncAt)
                .lastSyncCursor(lastSyncCursor)
                .syncedCount(syncedCount)
                .errorCount(errorCount)
                .lastError(lastError)
                .pendingCount(pendingCount);
    }

    @Override
    public String toString() {
        return "SyncState{" + integrationId + '/' + entityType + ", status=" + status.wireName() +
               ", synced=" + syncedCount + ", pending=" + pendingCount + ", errors=" + errorCount + '}';
    }

    static Builder builder(String integrationId, String entityType) {
        return new Builder(integrationId, entityType);
    }

    public static final class Builder {
        private final String integrationId;
        private final String entityType;
        private SyncStatus status = SyncStatus.IDLE;
        private Instant lastSyncAt;
        private String  lastSyncCursor;
        private long    syncedCount;
        private long    errorCount;
        private int     pendingCount;
        private String  lastError;

        private Builder(String integrationId, String entityType) {
            this.integrationId = integrationId;
            this.entityType = entityType;
        }

        public Builder status(SyncStatus status)         { this.status = status; return this; }
        public Builder lastSyncAt(Instant lastSyncAt)    { this.lastSyncAt = lastSyncAt; return this; }
        public Builder lastSyncCursor(String cursor)     { this.lastSyncCursor = cursor; return this; }
        public Builder syncedCount(long syncedCount)     { this.syncedCount = syncedCount; return this; }
        public Builder errorCount(long errorCount)       { this.errorCount = errorCount; return this; }
        public Builder lastError(String lastError)       { this.lastError = lastError; return this; }
        Builder pendingCount(int pendingCount)           { this.pendingCount = pendingCount; return this; }

        public SyncState build() {
            if (status == null) {
                throw new IllegalArgumentException("status must not be null");
            }
            return new SyncState(this);
        }
    }
}
