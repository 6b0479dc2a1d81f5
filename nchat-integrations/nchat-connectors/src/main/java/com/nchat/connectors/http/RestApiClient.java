package com.nchat.connectors.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nchat.connectors.error.ConnectorException;
import com.nchat.connectors.error.ErrorCategory;
import com.nchat.connectors.error.ErrorClassifier;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Thin JSON-over-HTTP client shared by provider adapters.
 *
 * <p>Every request carries {@code Authorization: <tokenType> <accessToken>}.
 * Non-2xx responses become a {@link ConnectorException} whose message reads
 * {@code "<provider> API <status>: <body>"} and whose category follows the
 * status (401/403 auth, 429 rate_limit, 5xx network, other 4xx data).
 * Transport failures are reported as {@code network}.
 */
public class RestApiClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RestApiClient.class);
    private static final int MAX_ERROR_BODY = 500;

    private final String providerId;
    private final String baseUrl;
    private final String authorization;
    private final CloseableHttpClient http;
    private final ObjectMapper mapper;

    public RestApiClient(String providerId, String baseUrl, String tokenType, String accessToken, long timeoutMs) {
        this.providerId    = providerId;
        this.baseUrl       = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.authorization = (tokenType == null || tokenType.isBlank() ? "Bearer" : tokenType) + " " + accessToken;
        this.http = HttpClients.custom()
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .build())
                .build();
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    // ------------------------------------------------------------------
    // Requests
    // ------------------------------------------------------------------

    public JsonNode get(String path) throws ConnectorException {
        return send(new HttpGet(url(path)));
    }

    public JsonNode post(String path, Object body) throws ConnectorException {
        HttpPost post = new HttpPost(url(path));
        try {
            post.setEntity(new StringEntity(mapper.writeValueAsString(body), ContentType.APPLICATION_JSON));
        } catch (JsonProcessingException e) {
            throw ConnectorException.builder("Cannot serialise request body for " + path,
                            ErrorCategory.DATA, providerId)
                    .cause(e)
                    .build();
        }
        return send(post);
    }

    /**
     * Converts a JSON tree into {@code type}.
     */
    public <R> R convert(JsonNode node, Class<R> type) throws ConnectorException {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw ConnectorException.builder("Unexpected response shape from " + providerId + ": " + e.getOriginalMessage(),
                            ErrorCategory.DATA, providerId)
                    .cause(e)
                    .build();
        }
    }

    public String getBaseUrl() { return baseUrl; }

    @Override
    public void close() throws IOException {
        http.close();
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private JsonNode send(HttpUriRequestBase request) throws ConnectorException {
        request.setHeader("Authorization", authorization);
        request.setHeader("Accept", "application/json");

        RawResponse response;
        try {
            response = http.execute(request, r -> {
                HttpEntity entity = r.getEntity();
                String body = entity == null
                        ? ""
                        : new String(entity.getContent().readAllBytes(), StandardCharsets.UTF_8);
                return new RawResponse(r.getCode(), body);
            });
        } catch (IOException e) {
            ConnectorException classified = ErrorClassifier.classify(e, providerId);
            throw ConnectorException.builder(
                            providerId + " " + request.getMethod() + " " + request.getRequestUri()
                                    + " failed: " + classified.getMessage(),
                            ErrorCategory.NETWORK, providerId)
                    .cause(e)
                    .build();
        }

        log.debug("{} {} -> {}", request.getMethod(), request.getRequestUri(), response.status);
        if (response.status < 200 || response.status >= 300) {
            ErrorCategory category = ErrorClassifier.categoryForStatus(response.status);
            throw ConnectorException.builder(
                            providerId + " API " + response.status + ": " + abbreviate(response.body),
                            category != null ? category : ErrorCategory.UNKNOWN, providerId)
                    .statusCode(response.status)
                    .build();
        }
        if (response.status == 204 || response.body.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(response.body);
        } catch (JsonProcessingException e) {
            throw ConnectorException.builder("Invalid JSON from " + providerId + ": " + e.getOriginalMessage(),
                            ErrorCategory.DATA, providerId)
                    .statusCode(response.status)
                    .cause(e)
                    .build();
        }
    }

    private String url(String path) {
        if (path == null || path.isEmpty()) return baseUrl;
        return path.startsWith("/") ? baseUrl + path : baseUrl + "/" + path;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) return "(empty body)";
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }

    private static final class RawResponse {
        final int status;
        final String body;

        RawResponse(int status, String body) {
            this.status = status;
            this.body = body;
        }
    }
}
