package com.nchat.webhooks.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nchat.webhooks.model.ParsedWebhook;
import com.nchat.webhooks.model.WebhookSource;
import com.nchat.webhooks.security.SlackSignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a raw request (body bytes plus headers) into a {@link ParsedWebhook}.
 *
 * <p>Source detection checks header fingerprints in this order:
 * <ol>
 *   <li>{@code x-github-event} → {@code github}</li>
 *   <li>{@code x-slack-signature} → {@code slack}</li>
 *   <li>{@code x-atlassian-webhook-identifier} → {@code jira}</li>
 *   <li>{@code x-webhook-source} → its (lowercased) value</li>
 *   <li>otherwise {@code unknown}</li>
 * </ol>
 */
public class WebhookParser {

    private static final Logger log = LoggerFactory.getLogger(WebhookParser.class);

    private final ObjectMapper mapper;
    private final Clock        clock;

    public WebhookParser() {
        this(new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param mapper copied, with trailing tokens after the root value made an error
     */
    public WebhookParser(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock  = clock;
    }

    /**
     * Lowercases header names. When the same header appears under several
     * casings the last one wins; {@code null} names and values are dropped.
     */
    public static Map<String, String> normalizeHeaders(Map<String, String> headers) {
        Map<String, String> normalized = new LinkedHashMap<>();
        if (headers == null) {
            return normalized;
        }
        headers.forEach((name, value) -> {
            if (name != null && value != null) {
                normalized.put(name.toLowerCase(Locale.ROOT), value);
            }
        });
        return normalized;
    }

    /** @param headers normalized headers */
    public String detectSource(Map<String, String> headers) {
        if (headers.containsKey(WebhookSource.GITHUB_EVENT_HEADER))    return WebhookSource.GITHUB;
        if (headers.containsKey(WebhookSource.SLACK_SIGNATURE_HEADER)) return WebhookSource.SLACK;
        if (headers.containsKey(WebhookSource.JIRA_IDENTIFIER_HEADER)) return WebhookSource.JIRA;
        String custom = headers.get(WebhookSource.CUSTOM_SOURCE_HEADER);
        if (custom != null && !custom.isBlank()) {
            return custom.trim().toLowerCase(Locale.ROOT);
        }
        return WebhookSource.UNKNOWN;
    }

    /** Provider event name, or {@code unknown} when none can be found. */
    public String extractEvent(String source, JsonNode payload, Map<String, String> headers) {
        String event;
        switch (source) {
            case WebhookSource.GITHUB -> event = headers.get(WebhookSource.GITHUB_EVENT_HEADER);
            case WebhookSource.SLACK -> {
                event = text(payload.path("event").path("type"));
                if (event == null) {
                    event = text(payload.path("type"));
                }
            }
            case WebhookSource.JIRA -> event = text(payload.path("webhookEvent"));
            default -> {
                event = headers.get(WebhookSource.CUSTOM_EVENT_HEADER);
                if (event == null || event.isBlank()) {
                    event = text(payload.path("event"));
                }
                if (event == null) {
                    event = text(payload.path("type"));
                }
            }
        }
        return event == null || event.isBlank() ? WebhookSource.UNKNOWN : event;
    }

    /**
     * Slack: {@code x-slack-request-timestamp} (epoch seconds). Jira: the
     * payload's {@code timestamp} (epoch millis). Anything else, or an
     * unreadable value, falls back to {@code receivedAt}.
     */
    public Instant extractTimestamp(String source, JsonNode payload, Map<String, String> headers,
                                    Instant receivedAt) {
        if (WebhookSource.SLACK.equals(source)) {
            String seconds = headers.get(SlackSignatureVerifier.TIMESTAMP_HEADER);
            if (seconds != null) {
                try {
                    return Instant.ofEpochSecond(Long.parseLong(seconds.trim()));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unreadable Slack timestamp '{}'", seconds);
                }
            }
        } else if (WebhookSource.JIRA.equals(source)) {
            JsonNode millis = payload.path("timestamp");
            if (millis.canConvertToLong()) {
                return Instant.ofEpochMilli(millis.asLong());
            }
        }
        return receivedAt;
    }

    /**
     * Parses one delivery. Never throws: an unreadable body yields an invalid
     * result whose error starts with {@code "Invalid JSON"}.
     */
    public ParsedWebhook parse(byte[] rawBody, Map<String, String> headers) {
        Map<String, String> normalized = normalizeHeaders(headers);
        String source = detectSource(normalized);
        Instant receivedAt = clock.instant();

        if (rawBody == null || rawBody.length == 0) {
            return ParsedWebhook.invalid(source, receivedAt, normalized, "Invalid JSON: empty body");
        }
        JsonNode payload;
        try {
            payload = mapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            return ParsedWebhook.invalid(source, receivedAt, normalized, "Invalid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            return ParsedWebhook.invalid(source, receivedAt, normalized, "Invalid JSON: " + e.getMessage());
        }
        if (payload == null || payload.isMissingNode()) {
            return ParsedWebhook.invalid(source, receivedAt, normalized, "Invalid JSON: empty body");
        }

        String event = extractEvent(source, payload, normalized);
        Instant timestamp = extractTimestamp(source, payload, normalized, receivedAt);
        return ParsedWebhook.valid(source, event, timestamp, payload, normalized);
    }

    private static String text(JsonNode node) {
        return node.isValueNode() && !node.isNull() ? node.asText() : null;
    }
}
