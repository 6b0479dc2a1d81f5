package com.nchat.connectors.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.nchat.connectors.core.Connector;
import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.model.CatalogEntry;
import com.nchat.connectors.model.ConnectorCapability;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.model.IntegrationCategory;

import java.io.IOException;
import java.time.Clock;

/**
 * Generic adapter for any bearer-token JSON API.
 *
 * <p>Provider config keys:
 * <ul>
 *   <li>{@code baseUrl} (required) – API root, e.g. {@code https://api.example.com/v1}</li>
 *   <li>{@code healthPath} – path probed on connect and by health checks; default {@code /}</li>
 *   <li>{@code timeoutMs} – response timeout; default 30000</li>
 * </ul>
 */
public class RestConnector implements Connector {

    public static final String PROVIDER_ID = "rest";

    public static final CatalogEntry CATALOG_ENTRY = CatalogEntry.builder(PROVIDER_ID, IntegrationCategory.CUSTOM)
            .name("REST API")
            .description("Generic JSON API reachable with a bearer token")
            .capability(ConnectorCapability.READ)
            .capability(ConnectorCapability.WRITE)
            .requiredConfig("baseUrl")
            .build();

    private final Clock clock;

    private volatile RestApiClient client;
    private volatile String healthPath = "/";

    public RestConnector() {
        this(Clock.systemUTC());
    }

    public RestConnector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CatalogEntry catalogEntry() {
        return CATALOG_ENTRY;
    }

    @Override
    public void doConnect(ConnectorConfig config, ConnectorCredentials credentials) throws Exception {
        String baseUrl = config.getString("baseUrl");
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ConnectorException("baseUrl is required", ErrorCategory.CONFIG, PROVIDER_ID);
        }
        long timeoutMs = Long.parseLong(config.getString("timeoutMs", "30000"));
        RestApiClient candidate = new RestApiClient(PROVIDER_ID, baseUrl,
                credentials.getTokenType(), credentials.getAccessToken(), timeoutMs);
        String probePath = config.getString("healthPath", "/");
        try {
            candidate.get(probePath);
        } catch (ConnectorException e) {
            candidate.close();
            throw e;
        }
        this.healthPath = probePath;
        this.client = candidate;
    }

    @Override
    public void doDisconnect() throws IOException {
        RestApiClient current = client;
        client = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    public HealthCheckResult doHealthCheck() throws ConnectorException {
        RestApiClient current = client;
        if (current == null) {
            return HealthCheckResult.unhealthy(0, "Not connected", clock.instant(), 0);
        }
        long start = clock.millis();
        current.get(healthPath);
        return HealthCheckResult.healthy(clock.millis() - start, "OK", clock.instant());
    }

    public JsonNode get(String path) throws ConnectorException {
        return requireClient().get(path);
    }

    public JsonNode post(String path, Object body) throws ConnectorException {
        return requireClient().post(path, body);
    }

    private RestApiClient requireClient() throws ConnectorException {
        RestApiClient current = client;
        if (current == null) {
            throw new ConnectorException("REST connector is not connected", ErrorCategory.CONFIG, PROVIDER_ID);
        }
        return current;
    }
}
