package com.nchat.webhooks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized delivery passed to a {@link com.nchat.webhooks.handler.WebhookHandler}.
 *
 * <p>The payload is the provider's JSON exactly as received; unknown fields
 * are kept so handlers written against older payloads keep working.
 */
public final class WebhookEnvelope {

    /** "github", "slack", "jira" or a custom source name. */
    private final String source;

    /** Provider event name, e.g. "push", "message", "jira:issue_created". */
    private final String event;

    /** Provider-reported time where available, otherwise time of receipt. */
    private final Instant timestamp;

    private final JsonNode payload;

    /** Lowercase header names. */
    private final Map<String, String> headers;

    public WebhookEnvelope(String source, String event, Instant timestamp, JsonNode payload,
                           Map<String, String> headers) {
        this.source    = source;
        this.event     = event;
        this.timestamp = timestamp;
        this.payload   = payload;
        this.headers   = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String              getSource()    { return source; }
    public String              getEvent()     { return event; }
    public Instant             getTimestamp() { return timestamp; }
    public JsonNode            getPayload()   { return payload; }
    public Map<String, String> getHeaders()   { return headers; }

    /** Header value by case-insensitive name, or {@code null}. */
    public String getHeader(String name) {
        return name == null ? null : headers.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "WebhookEnvelope{source='" + source + '\'' +
               ", event='" + event + '\'' +
               ", timestamp=" + timestamp + '}';
    }
}
