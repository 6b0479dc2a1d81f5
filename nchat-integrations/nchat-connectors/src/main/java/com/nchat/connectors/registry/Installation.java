package com.nchat.connectors.registry;

import com.nchat.connectors.core.Connector;
import com.nchat.connectors.core.ResilientConnector;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorStatus;

import java.time.Instant;

/**
 * One installed integration as tracked by {@link ConnectorRegistry}.
 *
 * <p>The registry keeps the config here rather than relying on the connector,
 * which forgets its config on disconnect, so a disabled installation can be
 * enabled again. A disabled installation reports {@code disabled} whatever
 * state its connector is in.
 */
public final class Installation {

    private final String  id;
    private final String  providerId;
    private final Instant installedAt;

    private volatile ResilientConnector<Connector> connector;
    private volatile ConnectorConfig config;
    private volatile boolean enabled = true;
    private volatile String  disabledReason;

    Installation(ConnectorConfig config, ResilientConnector<Connector> connector, Instant installedAt) {
        this.id          = config.getId();
        this.providerId  = config.getProvider();
        this.installedAt = installedAt;
        this.config      = config;
        this.connector   = connector;
    }

    public String                        getId()             { return id; }
    public String                        getProviderId()     { return providerId; }
    public Instant                       getInstalledAt()    { return installedAt; }
    public ResilientConnector<Connector> getConnector()      { return connector; }
    public ConnectorConfig               getConfig()         { return config; }
    public boolean                       isEnabled()         { return enabled; }
    /** Why the installation was disabled, or {@code null} while enabled. */
    public String                        getDisabledReason() { return disabledReason; }

    public ConnectorStatus getStatus() {
        return enabled ? connector.getStatus() : ConnectorStatus.DISABLED;
    }

    void setConfig(ConnectorConfig config) {
        this.config = config;
    }

    void setConnector(ResilientConnector<Connector> connector) {
        this.connector = connector;
    }

    void markEnabled() {
        this.enabled = true;
        this.disabledReason = null;
    }

    void markDisabled(String reason) {
        this.enabled = false;
        this.disabledReason = reason;
    }

    @Override
    public String toString() {
        return "Installation{id='" + id + "', provider='" + providerId + "', status=" + getStatus().wireName() + '}';
    }
}
