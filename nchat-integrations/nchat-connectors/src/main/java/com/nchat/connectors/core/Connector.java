package com.nchat.connectors.core;

import com.nchat.connectors.model.CatalogEntry;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.HealthCheckResult;

/**
 * SPI implemented by every provider adapter (calendar, ticketing, CI/CD, ...).
 *
 * <p>An adapter supplies only the transport-specific steps. Wrap it in a
 * {@link ResilientConnector} to get lifecycle state, rate limiting, retries,
 * error classification and events:
 *
 * <pre>
 *   ResilientConnector&lt;JiraAdapter&gt; jira = ResilientConnector.builder(new JiraAdapter())
 *       .rateLimit(new RateLimitConfig(300, 60_000))
 *       .build();
 *   jira.connect(config, credentials);
 *   List&lt;Ticket&gt; open = jira.withRetry(() -&gt; jira.getDelegate().listOpen("CHAT"), "listOpen");
 * </pre>
 *
 * Implementations may throw anything from the {@code do*} methods; the wrapper
 * classifies failures. Throwing a {@link com.nchat.connectors.error.ConnectorException}
 * directly skips the message-based classification.
 */
public interface Connector {

    /** Static descriptor: id, capabilities and required config keys. */
    CatalogEntry catalogEntry();

    /** Identifier used in errors, events and logs; defaults to the catalog id. */
    default String providerId() {
        return catalogEntry().getId();
    }

    /**
     * Opens the provider session. Called with the config and credentials the
     * caller passed to {@link ResilientConnector#connect}.
     */
    void doConnect(ConnectorConfig config, ConnectorCredentials credentials) throws Exception;

    /** Releases whatever {@link #doConnect} acquired. */
    void doDisconnect() throws Exception;

    /** Probes the provider. May return an unhealthy result or throw. */
    HealthCheckResult doHealthCheck() throws Exception;
}
