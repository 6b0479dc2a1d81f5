package com.nchat.connectors.model;

/**
 * Lifecycle states of a {@link com.nchat.connectors.core.ResilientConnector}.
 *
 * <pre>
 *   DISCONNECTED -> CONNECTING -> CONNECTED | ERROR
 *   CONNECTED    -> RATE_LIMITED | ERROR | DISCONNECTED
 *   (reconnect ceiling exceeded) -> DISABLED
 * </pre>
 *
 * {@code DISABLED} is only left by creating a new connector instance.
 */
public enum ConnectorStatus {
    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    RATE_LIMITED("rate_limited"),
    DISABLED("disabled"),
    ERROR("error");

    private final String wireName;

    ConnectorStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
