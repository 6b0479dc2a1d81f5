package com.nchat.connectors.health;

/**
 * Notified when {@link HealthMonitor} gives up on an integration.
 */
@FunctionalInterface
public interface AutoDisableListener {

    void onAutoDisable(String integrationId, String reason);
}
