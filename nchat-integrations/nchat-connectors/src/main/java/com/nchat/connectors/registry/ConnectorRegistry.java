package com.nchat.connectors.registry;

import com.nchat.connectors.core.Connector;
import com.nchat.connectors.core.ResilientConnector;
import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.health.HealthMonitor;
import com.nchat.connectors.health.HealthMonitorConfig;
import com.nchat.connectors.model.CatalogEntry;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.ConnectorMetrics;
import com.nchat.connectors.model.ConnectorStatus;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.model.IntegrationCategory;
import com.nchat.connectors.ratelimit.RateLimitConfig;
import com.nchat.connectors.retry.RetryConfig;
import com.nchat.connectors.vault.CredentialEncryptionException;
import com.nchat.connectors.vault.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Catalog of available providers plus the set of installed connections.
 *
 * <p>Installing connects a new {@link ResilientConnector} for the requested
 * provider and keeps its credentials encrypted in the {@link CredentialVault};
 * uninstalling disconnects it and drops the credentials. Installations can be
 * disabled and enabled again without losing their config or credentials.
 *
 * <p>When built with a {@link HealthMonitorConfig} every enabled installation
 * is probed in the background, and one that keeps failing is disabled with the
 * monitor's reason.
 *
 * <pre>
 *   ConnectorRegistry registry = new ConnectorRegistry(vault, HealthMonitorConfig.builder().build());
 *   registry.registerProvider(RestConnector.CATALOG_ENTRY, RestConnector::new);
 *   Installation api = registry.install(config, credentials);
 * </pre>
 */
public class ConnectorRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    private final CredentialVault vault;
    private final HealthMonitor healthMonitor;
    private final Clock clock;
    private final Map<String, Registration> providers = new ConcurrentHashMap<>();
    private final Map<String, Installation> installed = new ConcurrentHashMap<>();

    public ConnectorRegistry(CredentialVault vault) {
        this(vault, null, Clock.systemUTC());
    }

    public ConnectorRegistry(CredentialVault vault, HealthMonitorConfig monitorConfig) {
        this(vault, monitorConfig, Clock.systemUTC());
    }

    /**
     * @param monitorConfig {@code null} to install without background health checks
     */
    public ConnectorRegistry(CredentialVault vault, HealthMonitorConfig monitorConfig, Clock clock) {
        this.vault = vault;
        this.clock = clock;
        this.healthMonitor = monitorConfig == null ? null : new HealthMonitor(monitorConfig, this::autoDisable);
    }

    // ------------------------------------------------------------------
    // Catalog
    // ------------------------------------------------------------------

    public void registerProvider(CatalogEntry entry, ConnectorFactory factory) {
        registerProvider(entry, factory, RateLimitConfig.defaults(), RetryConfig.defaults());
    }

    /**
     * Registers a provider with its own rate-limit and retry settings.
     *
     * @throws IllegalStateException if a provider with the same id is already registered
     */
    public void registerProvider(CatalogEntry entry, ConnectorFactory factory,
                                 RateLimitConfig rateLimit, RetryConfig retry) {
        Registration registration = new Registration(entry, factory, rateLimit, retry);
        if (providers.putIfAbsent(entry.getId(), registration) != null) {
            throw new IllegalStateException("Provider already registered: " + entry.getId());
        }
        log.info("Registered provider '{}' ({})", entry.getId(), entry.getCategory());
    }

    /**
     * Removes a provider from the catalog.
     *
     * @return {@code false} if no such provider was registered
     * @throws IllegalStateException while installations of the provider remain
     */
    public synchronized boolean unregisterProvider(String providerId) {
        List<String> remaining = installed.values().stream()
                .filter(i -> i.getProviderId().equals(providerId))
                .map(Installation::getId)
                .sorted()
                .toList();
        if (!remaining.isEmpty()) {
            throw new IllegalStateException("Provider '" + providerId + "' still has installations: " + remaining);
        }
        boolean removed = providers.remove(providerId) != null;
        if (removed) {
            log.info("Unregistered provider '{}'", providerId);
        }
        return removed;
    }

    public Optional<CatalogEntry> findEntry(String providerId) {
        Registration registration = providers.get(providerId);
        return registration == null ? Optional.empty() : Optional.of(registration.entry);
    }

    public List<CatalogEntry> catalog() {
        return entries(entry -> true);
    }

    /**
     * Case-insensitive substring match on id, name and description. A blank
     * query returns the whole catalog.
     */
    public List<CatalogEntry> searchCatalog(String query) {
        if (query == null || query.isBlank()) {
            return catalog();
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return entries(entry -> contains(entry.getId(), needle)
                || contains(entry.getName(), needle)
                || contains(entry.getDescription(), needle));
    }

    public List<CatalogEntry> filterByCategory(IntegrationCategory category) {
        return entries(entry -> entry.getCategory() == category);
    }

    // ------------------------------------------------------------------
    // Installations
    // ------------------------------------------------------------------

    /**
     * Creates, connects and records a connector for {@code config.getProvider()}.
     *
     * @throws ConnectorException {@code config} category when the provider is
     *         unknown, the install id is taken or required config is missing;
     *         otherwise whatever the connect step raised
     */
    public synchronized Installation install(ConnectorConfig config, ConnectorCredentials credentials)
            throws ConnectorException {
        Registration registration = providers.get(config.getProvider());
        if (registration == null) {
            throw configError("Unknown provider: " + config.getProvider(), config.getProvider());
        }
        if (installed.containsKey(config.getId())) {
            throw configError("Integration already installed: " + config.getId(), config.getProvider());
        }
        requireConfig(registration, config);

        ResilientConnector<Connector> connector = registration.newConnector();
        try {
            connector.connect(config, credentials);
        } catch (ConnectorException e) {
            connector.close();
            throw e;
        }

        try {
            vault.store(config.getId(), credentials);
        } catch (CredentialEncryptionException e) {
            discard(connector);
            throw ConnectorException.builder("Cannot store credentials for " + config.getId(),
                            ErrorCategory.CONFIG, config.getProvider())
                    .cause(e)
                    .build();
        }
        Installation installation = new Installation(config, connector, clock.instant());
        installed.put(config.getId(), installation);
        startMonitoring(installation);
        log.info("Installed integration '{}' ({})", config.getId(), config.getProvider());
        return installation;
    }

    /**
     * Applies {@code changes} to the installation's config. An enabled
     * installation is reconnected with the new config; a disabled one picks it
     * up when it is next enabled.
     *
     * @throws ConnectorException {@code config} category when the installation
     *         is unknown or the new config lacks required keys; otherwise the
     *         reconnect failure, in which case the new config is still kept
     */
    public synchronized Installation configure(String integrationId, Consumer<ConnectorConfig.Builder> changes)
            throws ConnectorException {
        Installation installation = require(integrationId);
        ConnectorConfig.Builder builder = installation.getConfig().toBuilder();
        changes.accept(builder);
        ConnectorConfig updated = builder.build();
        requireConfig(providers.get(installation.getProviderId()), updated);

        installation.setConfig(updated);
        log.info("Reconfigured integration '{}'", integrationId);
        if (installation.isEnabled()) {
            ResilientConnector<Connector> connector = installation.getConnector();
            ConnectorCredentials credentials = credentialsFor(installation);
            disconnectQuietly(connector);
            connector.connect(updated, credentials);
        }
        return installation;
    }

    /**
     * Disconnects an installation and marks it {@code disabled}. Config and
     * credentials are kept. A connector that gave up after too many
     * reconnects is swapped for a fresh one here, ready for {@link #enable}.
     * Disabling twice is a no-op.
     */
    public Installation disable(String integrationId) throws ConnectorException {
        return disable(integrationId, "Disabled by user");
    }

    public synchronized Installation disable(String integrationId, String reason) throws ConnectorException {
        Installation installation = require(integrationId);
        if (!installation.isEnabled()) {
            return installation;
        }
        installation.markDisabled(reason);
        stopMonitoring(integrationId);
        log.info("Disabled integration '{}': {}", integrationId, reason);
        ResilientConnector<Connector> connector = installation.getConnector();
        boolean exhausted = connector.getStatus() == ConnectorStatus.DISABLED;
        try {
            connector.disconnect();
        } finally {
            if (exhausted) {
                connector.close();
                installation.setConnector(providers.get(installation.getProviderId()).newConnector());
            }
        }
        return installation;
    }

    /**
     * Reconnects a disabled installation with its stored config and
     * credentials. Enabling an enabled installation is a no-op.
     */
    public synchronized Installation enable(String integrationId) throws ConnectorException {
        Installation installation = require(integrationId);
        if (installation.isEnabled()) {
            return installation;
        }
        ConnectorCredentials credentials = credentialsFor(installation);
        installation.getConnector().connect(installation.getConfig(), credentials);
        installation.markEnabled();
        startMonitoring(installation);
        log.info("Enabled integration '{}'", integrationId);
        return installation;
    }

    /**
     * Disconnects and removes an installation.
     *
     * @return {@code false} if nothing was installed under {@code integrationId}
     */
    public synchronized boolean uninstall(String integrationId) throws ConnectorException {
        Installation installation = installed.remove(integrationId);
        if (installation == null) {
            return false;
        }
        stopMonitoring(integrationId);
        vault.remove(integrationId);
        ResilientConnector<Connector> connector = installation.getConnector();
        try {
            connector.disconnect();
        } finally {
            connector.close();
            log.info("Uninstalled integration '{}'", integrationId);
        }
        return true;
    }

    public Optional<Installation> find(String integrationId) {
        return Optional.ofNullable(installed.get(integrationId));
    }

    /** All installations, ordered by id. */
    public List<Installation> installed() {
        return installations(i -> true);
    }

    public List<Installation> getInstallationsByStatus(ConnectorStatus status) {
        return installations(i -> i.getStatus() == status);
    }

    /** Most recent health check of an installation, if it has been probed. */
    public Optional<HealthCheckResult> getHealth(String integrationId) {
        return find(integrationId).flatMap(i -> i.getConnector().getLastHealthCheck());
    }

    public Optional<ConnectorMetrics> getMetrics(String integrationId) {
        return find(integrationId).map(i -> i.getConnector().getMetrics());
    }

    public CredentialVault getVault() { return vault; }

    public Optional<HealthMonitor> getHealthMonitor() { return Optional.ofNullable(healthMonitor); }

    /**
     * Stops health monitoring and disconnects every installation. Installations
     * and credentials stay recorded.
     */
    @Override
    public synchronized void close() {
        if (healthMonitor != null) {
            healthMonitor.close();
        }
        for (Installation installation : installed.values()) {
            discard(installation.getConnector());
        }
        log.info("Registry closed ({} installations)", installed.size());
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private void autoDisable(String integrationId, String reason) {
        try {
            disable(integrationId, reason);
        } catch (ConnectorException e) {
            log.warn("Disconnect of auto-disabled '{}' failed: {}", integrationId, e.getMessage());
        }
    }

    private Installation require(String integrationId) throws ConnectorException {
        Installation installation = installed.get(integrationId);
        if (installation == null) {
            throw configError("Integration not found: " + integrationId, null);
        }
        return installation;
    }

    private ConnectorCredentials credentialsFor(Installation installation) throws ConnectorException {
        try {
            return vault.retrieve(installation.getId()).orElseThrow(() -> configError(
                    "No stored credentials for " + installation.getId(), installation.getProviderId()));
        } catch (CredentialEncryptionException e) {
            throw ConnectorException.builder("Cannot read credentials for " + installation.getId(),
                            ErrorCategory.CONFIG, installation.getProviderId())
                    .cause(e)
                    .build();
        }
    }

    private void startMonitoring(Installation installation) {
        if (healthMonitor != null) {
            healthMonitor.startMonitoring(installation.getId(), installation.getConnector());
        }
    }

    private void stopMonitoring(String integrationId) {
        if (healthMonitor != null) {
            healthMonitor.stopMonitoring(integrationId);
        }
    }

    private List<CatalogEntry> entries(Predicate<CatalogEntry> filter) {
        return providers.values().stream()
                .map(r -> r.entry)
                .filter(filter)
                .sorted(Comparator.comparing(CatalogEntry::getId))
                .toList();
    }

    private List<Installation> installations(Predicate<Installation> filter) {
        return installed.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Installation::getId))
                .toList();
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static void requireConfig(Registration registration, ConnectorConfig config) throws ConnectorException {
        List<String> missing = registration.entry.missingConfig(config);
        if (!missing.isEmpty()) {
            throw ConnectorException.builder(
                            "Missing required config for " + config.getProvider() + ": " + missing,
                            ErrorCategory.CONFIG, config.getProvider())
                    .detail("missing", missing)
                    .build();
        }
    }

    private static void disconnectQuietly(ResilientConnector<Connector> connector) {
        try {
            connector.disconnect();
        } catch (ConnectorException e) {
            log.warn("Disconnect of '{}' failed: {}", connector.getProviderId(), e.getMessage());
        }
    }

    private static void discard(ResilientConnector<Connector> connector) {
        try {
            disconnectQuietly(connector);
        } finally {
            connector.close();
        }
    }

    private static ConnectorException configError(String message, String providerId) {
        return ConnectorException.builder(message, ErrorCategory.CONFIG, providerId).build();
    }

    private static final class Registration {
        final CatalogEntry entry;
        final ConnectorFactory factory;
        final RateLimitConfig rateLimit;
        final RetryConfig retry;

        Registration(CatalogEntry entry, ConnectorFactory factory, RateLimitConfig rateLimit, RetryConfig retry) {
            this.entry = entry;
            this.factory = factory;
            this.rateLimit = rateLimit;
            this.retry = retry;
        }

        ResilientConnector<Connector> newConnector() {
            return ResilientConnector.builder(factory.create())
                    .rateLimit(rateLimit)
                    .retry(retry)
                    .build();
        }
    }
}
