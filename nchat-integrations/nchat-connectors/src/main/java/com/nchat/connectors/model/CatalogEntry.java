package com.nchat.connectors.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Static descriptor of a provider adapter: who it is, what it can do and
 * which {@link ConnectorConfig#getProviderConfig() provider config} keys must
 * be present before it can be installed.
 */
public final class CatalogEntry {

    private final String id;
    private final String name;
    private final String description;
    private final IntegrationCategory category;
    private final Set<ConnectorCapability> capabilities;
    private final Set<String> requiredConfig;
    private final boolean requiresOAuth;
    private final String version;

    private CatalogEntry(Builder b) {
        this.id             = b.id;
        this.name           = b.name != null ? b.name : b.id;
        this.description    = b.description;
        this.category       = b.category;
        this.capabilities   = Collections.unmodifiableSet(b.capabilities.isEmpty()
                ? EnumSet.noneOf(ConnectorCapability.class)
                : EnumSet.copyOf(b.capabilities));
        this.requiredConfig = Collections.unmodifiableSet(new LinkedHashSet<>(b.requiredConfig));
        this.requiresOAuth  = b.requiresOAuth;
        this.version        = b.version;
    }

    public String                   getId()             { return id; }
    public String                   getName()           { return name; }
    public String                   getDescription()    { return description; }
    public IntegrationCategory      getCategory()       { return category; }
    public Set<ConnectorCapability> getCapabilities()   { return capabilities; }
    public Set<String>              getRequiredConfig() { return requiredConfig; }
    public boolean                  isRequiresOAuth()   { return requiresOAuth; }
    public String                   getVersion()        { return version; }

    public boolean supports(ConnectorCapability capability) {
        return capabilities.contains(capability);
    }

    /**
     * Returns the required config keys that {@code config} does not provide
     * (absent or blank), in declaration order.
     */
    public List<String> missingConfig(ConnectorConfig config) {
        return requiredConfig.stream()
                .filter(key -> {
                    String value = config.getString(key);
                    return value == null || value.isBlank();
                })
                .toList();
    }

    @Override
    public String toString() {
        return "CatalogEntry{id='" + id + "', category=" + category + ", version=" + version + '}';
    }

    public static Builder builder(String id, IntegrationCategory category) {
        return new Builder(id, category);
    }

    public static final class Builder {
        private final String id;
        private final IntegrationCategory category;
        private String name;
        private String description = "";
        private final Set<ConnectorCapability> capabilities = new LinkedHashSet<>();
        private final Set<String> requiredConfig = new LinkedHashSet<>();
        private boolean requiresOAuth;
        private String version = "1.0.0";

        private Builder(String id, IntegrationCategory category) {
            this.id = id;
            this.category = category;
        }

        public Builder name(String name)                         { this.name = name; return this; }
        public Builder description(String description)           { this.description = description; return this; }
        public Builder capability(ConnectorCapability capability) { this.capabilities.add(capability); return this; }
        public Builder requiredConfig(String key)                { this.requiredConfig.add(key); return this; }
        public Builder requiresOAuth(boolean requiresOAuth)      { this.requiresOAuth = requiresOAuth; return this; }
        public Builder version(String version)                   { this.version = version; return this; }

        public CatalogEntry build() {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("id must not be blank");
            }
            if (category == null) {
                throw new IllegalArgumentException("category must not be null");
            }
            return new CatalogEntry(this);
        }
    }
}
