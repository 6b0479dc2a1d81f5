package com.nchat.connectors.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A change to queue on a {@link SyncEngine}.
 *
 * <pre>
 *   engine.enqueue(SyncRequest.builder("jira-1", "ticket", "CHAT-12")
 *       .operation(SyncOperation.CREATE)
 *       .payload(Map.of("title", "Login broken"))
 *       .priority(10)
 *       .build());
 * </pre>
 */
public final class SyncRequest {

    private final String              integrationId;
    private final String              entityType;
    private final String              entityId;
    private final SyncDirection       direction;
    private final SyncOperation       operation;
    private final Map<String, Object> payload;
    private final int                 priority;
    private final int                 maxRetries;

    private SyncRequest(Builder b) {
        this.integrationId = b.integrationId;
        this.entityType    = b.entityType;
        this.entityId      = b.entityId;
        this.direction     = b.direction;
        this.operation     = b.operation;
        this.payload       = Collections.unmodifiableMap(new LinkedHashMap<>(b.payload));
        this.priority      = b.priority;
        this.maxRetries    = b.maxRetries;
    }

    public String              getIntegrationId() { return integrationId; }
    public String              getEntityType()    { return entityType; }
    public String              getEntityId()      { return entityId; }
    public SyncDirection       getDirection()     { return direction; }
    public SyncOperation       getOperation()     { return operation; }
    public Map<String, Object> getPayload()       { return payload; }
    /** Higher runs first. */
    public int                 getPriority()      { return priority; }
    /** Attempts allowed before the item is parked in {@code error}. */
    public int                 getMaxRetries()    { return maxRetries; }

    public static Builder builder(String integrationId, String entityType, String entityId) {
        return new Builder(integrationId, entityType, entityId);
    }

    public static final class Builder {
        private final String integrationId;
        private final String entityType;
        private final String entityId;
        private SyncDirection direction = SyncDirection.OUTGOING;
        private SyncOperation operation = SyncOperation.UPDATE;
        private final Map<String, Object> payload = new LinkedHashMap<>();
        private int priority   = 5;
        private int maxRetries = 3;

        private Builder(String integrationId, String entityType, String entityId) {
            this.integrationId = integrationId;
            this.entityType = entityType;
            this.entityId = entityId;
        }

        public Builder direction(SyncDirection direction)  { this.direction = direction; return this; }
        public Builder operation(SyncOperation operation)  { this.operation = operation; return this; }
        public Builder payload(Map<String, ?> payload)     { this.payload.putAll(payload); return this; }
        public Builder priority(int priority)              { this.priority = priority; return this; }
        public Builder maxRetries(int maxRetries)          { this.maxRetries = maxRetries; return this; }

        public SyncRequest build() {
            requireText(integrationId, "integrationId");
            requireText(entityType, "entityType");
            requireText(entityId, "entityId");
            if (direction == null || operation == null) {
                throw new IllegalArgumentException("direction and operation must not be null");
            }
            if (maxRetries < 1) {
                throw new IllegalArgumentException("maxRetries must be >= 1, got: " + maxRetries);
            }
            return new SyncRequest(this);
        }

        private static void requireText(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
        }
    }
}
