package com.nchat.connectors.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.nchat.connectors.core.ResilientConnector;
import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.model.ConnectorConfig;
import com.nchat.connectors.model.ConnectorCredentials;
import com.nchat.connectors.model.ConnectorStatus;
import com.nchat.connectors.model.HealthCheckResult;
import com.nchat.connectors.retry.RetryConfig;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RestConnectorTest {

    private HttpServer server;
    private String baseUrl;
    private final Map<String, String> lastHeaders = new ConcurrentHashMap<>();
    private final AtomicInteger flakyCalls = new AtomicInteger();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/health", exchange -> {
            lastHeaders.put("Authorization", String.valueOf(exchange.getRequestHeaders().getFirst("Authorization")));
            respond(exchange, 200, "{\"status\":\"ok\"}");
        });
        server.createContext("/issues", exchange -> {
            if ("POST".equals(exchange.getRequestMethod())) {
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                respond(exchange, 201, "{\"created\":" + body + "}");
            } else {
                respond(exchange, 200, "[{\"key\":\"CHAT-1\"},{\"key\":\"CHAT-2\"}]");
            }
        });
        server.createContext("/denied", exchange -> respond(exchange, 401, "{\"error\":\"bad token\"}"));
        server.createContext("/limited", exchange -> respond(exchange, 429, "slow down"));
        server.createContext("/flaky", exchange -> {
            if (flakyCalls.incrementAndGet() < 3) {
                respond(exchange, 503, "unavailable");
            } else {
                respond(exchange, 200, "{\"ok\":true}");
            }
        });
        server.createContext("/empty", exchange -> {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private ConnectorConfig config(String healthPath) {
        return ConnectorConfig.builder("rest-1", RestConnector.PROVIDER_ID)
                .providerConfig("baseUrl", baseUrl)
                .providerConfig("healthPath", healthPath)
                .build();
    }

    private static ResilientConnector<RestConnector> wrap(RestConnector delegate) {
        return ResilientConnector.builder(delegate)
                .retry(RetryConfig.builder().maxAttempts(3).build())
                .sleeper(millis -> { })
                .build();
    }

    @Test
    void connectProbesHealthPathWithBearerToken() throws Exception {
        try (ResilientConnector<RestConnector> rest = wrap(new RestConnector())) {
            rest.connect(config("/health"), ConnectorCredentials.builder("tok-123").build());

            assertEquals(ConnectorStatus.CONNECTED, rest.getStatus());
            assertEquals("Bearer tok-123", lastHeaders.get("Authorization"));

            HealthCheckResult health = rest.healthCheck();
            assertTrue(health.isHealthy());
            rest.disconnect();
        }
    }

    @Test
    void connectFailsWithAuthCategoryOn401() {
        try (ResilientConnector<RestConnector> rest = wrap(new RestConnector())) {
            ConnectorException e = assertThrows(ConnectorException.class,
                    () -> rest.connect(config("/denied"), ConnectorCredentials.builder("bad").build()));

            assertEquals(ErrorCategory.AUTH, e.getCategory());
            assertEquals(401, e.getStatusCode());
            assertTrue(e.getMessage().startsWith("rest API 401: "));
            assertEquals(ConnectorStatus.ERROR, rest.getStatus());
        }
    }

    @Test
    void getAndPostJson() throws Exception {
        try (ResilientConnector<RestConnector> rest = wrap(new RestConnector())) {
            rest.connect(config("/health"), ConnectorCredentials.builder("t").build());

            JsonNode issues = rest.withRetry(() -> rest.getDelegate().get("/issues"), "GET /issues");
            assertEquals(2, issues.size());
            assertEquals("CHAT-2", issues.get(1).get("key").asText());

            JsonNode created = rest.withRetry(
                    () -> rest.getDelegate().post("issues", Map.of("title", "Broken build")), "POST /issues");
            assertEquals("Broken build", created.get("created").get("title").asText());

            assertTrue(rest.getDelegate().get("/empty").isEmpty());
            rest.disconnect();
        }
    }

    @Test
    void serverErrorsAreRetried() throws Exception {
        try (ResilientConnector<RestConnector> rest = wrap(new RestConnector())) {
            rest.connect(config("/health"), ConnectorCredentials.builder("t").build());

            JsonNode result = rest.withRetry(() -> rest.getDelegate().get("/flaky"), "GET /flaky");

            assertTrue(result.get("ok").asBoolean());
            assertEquals(3, flakyCalls.get());
            assertEquals(2, rest.getMetrics().getFailedCalls());
            assertEquals(503, rest.getRequestLogs().get(0).getStatusCode());
            rest.disconnect();
        }
    }

    @Test
    void rateLimitStatusIsClassified() throws Exception {
        try (RestApiClient client = new RestApiClient("rest", baseUrl + "/", "Bearer", "t", 5000)) {
            ConnectorException e = assertThrows(ConnectorException.class, () -> client.get("/limited"));
            assertEquals(ErrorCategory.RATE_LIMIT, e.getCategory());
            assertTrue(e.isRetryable());
            assertEquals(baseUrl, client.getBaseUrl());
        }
    }

    @Test
    void unreachableHostIsNetworkFailure() throws Exception {
        int closedPort;
        try (ServerSocket reserved = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            closedPort = reserved.getLocalPort();
        }
        try (RestApiClient client = new RestApiClient("rest", "http://127.0.0.1:" + closedPort, "Bearer", "t", 1000)) {
            ConnectorException e = assertThrows(ConnectorException.class, () -> client.get("/health"));
            assertEquals(ErrorCategory.NETWORK, e.getCategory());
            assertTrue(e.isRetryable());
        }
    }

    @Test
    void healthCheckWhenNotConnected() {
        try (ResilientConnector<RestConnector> rest = wrap(new RestConnector())) {
            HealthCheckResult result = rest.healthCheck();
            assertFalse(result.isHealthy());
            assertEquals("Not connected", result.getMessage());
            assertThrows(ConnectorException.class, () -> rest.getDelegate().get("/issues"));
        }
    }

    @Test
    void catalogEntryRequiresBaseUrl() {
        assertTrue(RestConnector.CATALOG_ENTRY.getRequiredConfig().contains("baseUrl"));
        assertEquals(RestConnector.PROVIDER_ID, new RestConnector().providerId());
    }
}
