package com.nchat.webhooks.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

/**
 * One inbound delivery after header normalization and JSON parsing. Built
 * per request and never stored.
 */
public final class ParsedWebhook {

    private final String              source;
    private final String              event;
    private final Instant             timestamp;
    private final JsonNode            payload;
    private final Map<String, String> headers;
    private final boolean             valid;
    private final String              validationError;

    private ParsedWebhook(String source, String event, Instant timestamp, JsonNode payload,
                          Map<String, String> headers, boolean valid, String validationError) {
        this.source          = source;
        this.event           = event;
        this.timestamp       = timestamp;
        this.payload         = payload;
        this.headers         = Map.copyOf(headers);
        this.valid           = valid;
        this.validationError = validationError;
    }

    public static ParsedWebhook valid(String source, String event, Instant timestamp, JsonNode payload,
                                      Map<String, String> headers) {
        return new ParsedWebhook(source, event, timestamp, payload, headers, true, null);
    }

    public static ParsedWebhook invalid(String source, Instant receivedAt, Map<String, String> headers,
                                        String validationError) {
        return new ParsedWebhook(source, WebhookSource.UNKNOWN, receivedAt, null, headers, false, validationError);
    }

    public String              getSource()          { return source; }
    public String              getEvent()           { return event; }
    public Instant             getTimestamp()       { return timestamp; }
    public JsonNode            getPayload()         { return payload; }
    public Map<String, String> getHeaders()         { return headers; }
    public boolean             isValid()            { return valid; }
    public String              getValidationError() { return validationError; }

    /** The envelope handed to handlers. */
    public WebhookEnvelope toEnvelope() {
        return new WebhookEnvelope(source, event, timestamp, payload, headers);
    }

    @Override
    public String toString() {
        return "ParsedWebhook{source='" + source + "', event='" + event + "', valid=" + valid +
               (valid ? "" : ", error='" + validationError + '\'') + '}';
    }
}
