package com.nchat.connectors.event;

/**
 * Lifecycle notifications a connector publishes on its
 * {@link ConnectorEventBus}.
 */
public enum ConnectorEventType {
    CONNECTED("connected"),
    DISCONNECTED("disconnected"),
    ERROR("error"),
    HEALTH_CHECK("health_check"),
    RATE_LIMITED("rate_limited"),
    EVENT_RECEIVED("event_received"),
    EVENT_SENT("event_sent"),
    RECONNECTING("reconnecting"),
    CREDENTIALS_REFRESHED("credentials_refreshed");

    private final String wireName;

    ConnectorEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
