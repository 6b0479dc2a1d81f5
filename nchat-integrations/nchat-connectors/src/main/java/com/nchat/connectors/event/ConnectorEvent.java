package com.nchat.connectors.event;

import java.time.Instant;

/**
 * Immutable notification delivered to {@link ConnectorEventListener}s.
 */
public final class ConnectorEvent {

    private final ConnectorEventType type;
    private final String  providerId;
    private final Instant timestamp;
    private final Object  data;

    public ConnectorEvent(ConnectorEventType type, String providerId, Instant timestamp, Object data) {
        this.type       = type;
        this.providerId = providerId;
        this.timestamp  = timestamp;
        this.data       = data;
    }

    public ConnectorEventType getType()       { return type; }
    public String             getProviderId() { return providerId; }
    public Instant            getTimestamp()  { return timestamp; }
    /** Event-specific payload; may be {@code null}. */
    public Object             getData()       { return data; }

    @Override
    public String toString() {
        return "ConnectorEvent{type=" + type.wireName() + ", provider=" + providerId +
               ", timestamp=" + timestamp + '}';
    }
}
