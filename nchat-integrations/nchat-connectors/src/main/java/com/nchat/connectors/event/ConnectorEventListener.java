package com.nchat.connectors.event;

/**
 * Callback for connector lifecycle events.
 *
 * <p>Listeners run on the bus's delivery thread, never on the thread that
 * changed the connector's state. A listener that throws is logged and skipped.
 */
@FunctionalInterface
public interface ConnectorEventListener {

    void onEvent(ConnectorEvent event);
}
