package com.nchat.connectors.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable settings for one installed connection to an external service.
 *
 * <p>Owned by the caller, handed to
 * {@link com.nchat.connectors.core.ResilientConnector#connect(ConnectorConfig, ConnectorCredentials)}
 * and retained by the connector until it disconnects.
 *
 * <pre>
 *   ConnectorConfig config = ConnectorConfig.builder("install-42", "jira")
 *       .displayName("Jira (Platform team)")
 *       .workspaceId("ws-1")
 *       .providerConfig("siteUrl", "https://acme.atlassian.net")
 *       .build();
 * </pre>
 */
public final class ConnectorConfig {

    private final String id;
    private final String provider;
    private final String displayName;
    private final String workspaceId;
    private final Map<String, Object> providerConfig;

    private ConnectorConfig(Builder b) {
        this.id             = b.id;
        this.provider       = b.provider;
        this.displayName    = b.displayName != null ? b.displayName : b.provider;
        this.workspaceId    = b.workspaceId;
        this.providerConfig = Collections.unmodifiableMap(new LinkedHashMap<>(b.providerConfig));
    }

    public String getId()                          { return id; }
    public String getProvider()                    { return provider; }
    public String getDisplayName()                 { return displayName; }
    public String getWorkspaceId()                 { return workspaceId; }
    public Map<String, Object> getProviderConfig() { return providerConfig; }

    /**
     * Returns a provider config value rendered as a string, or {@code null} when absent.
     */
    public String getString(String key) {
        Object value = providerConfig.get(key);
        return value == null ? null : value.toString();
    }

    public String getString(String key, String defaultValue) {
        String value = getString(key);
        return value == null || value.isBlank() ? defaultValue : value;
    }

    @Override
    public String toString() {
        return "ConnectorConfig{id='" + id + "', provider='" + provider +
               "', workspaceId='" + workspaceId + "', keys=" + providerConfig.keySet() + '}';
    }

    public static Builder builder(String id, String provider) {
        return new Builder(id, provider);
    }

    /** A builder pre-filled with this config; id and provider cannot change. */
    public Builder toBuilder() {
        return new Builder(id, provider)
                .displayName(displayName)
                .workspaceId(workspaceId)
                .providerConfig(providerConfig);
    }

    public static final class Builder {
        private final String id;
        private final String provider;
        private String displayName;
        private String workspaceId;
        private final Map<String, Object> providerConfig = new LinkedHashMap<>();

        private Builder(String id, String provider) {
            this.id = id;
            this.provider = provider;
        }

        public Builder displayName(String name)                  { this.displayName = name; return this; }
        public Builder workspaceId(String workspaceId)           { this.workspaceId = workspaceId; return this; }
        public Builder providerConfig(String key, Object value)  { this.providerConfig.put(key, value); return this; }
        public Builder providerConfig(Map<String, ?> values)     { this.providerConfig.putAll(values); return this; }

        public ConnectorConfig build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            if (provider == null || provider.isBlank()) {
                throw new IllegalArgumentException("provider must not be blank");
            }
            return new ConnectorConfig(this);
        }
    }
}
