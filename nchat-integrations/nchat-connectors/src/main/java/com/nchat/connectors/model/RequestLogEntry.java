package com.nchat.connectors.model;

import java.time.Instant;

/**
 * One outbound call recorded by a connector. Observability only.
 */
public final class RequestLogEntry {

    private final String  id;
    private final String  integrationId;
    private final Instant timestamp;
    private final String  method;
    private final String  url;
    private final Integer statusCode;
    private final long    durationMs;
    private final boolean success;
    private final String  error;

    public RequestLogEntry(String id, String integrationId, Instant timestamp, String method, String url,
                           Integer statusCode, long durationMs, boolean success, String error) {
        this.id            = id;
        this.integrationId = integrationId;
        this.timestamp     = timestamp;
        this.method        = method;
        this.url           = url;
        this.statusCode    = statusCode;
        this.durationMs    = durationMs;
        this.success       = success;
        this.error         = error;
    }

    public String  getId()            { return id; }
    public String  getIntegrationId() { return integrationId; }
    public Instant getTimestamp()     { return timestamp; }
    public String  getMethod()        { return method; }
    public String  getUrl()           { return url; }
    /** {@code null} when the call never produced an HTTP status. */
    public Integer getStatusCode()    { return statusCode; }
    public long    getDurationMs()    { return durationMs; }
    public boolean isSuccess()        { return success; }
    public String  getError()         { return error; }

    @Override
    public String toString() {
        return "RequestLogEntry{" + method + ' ' + url + ", status=" + statusCode +
               ", durationMs=" + durationMs + ", success=" + success + '}';
    }
}
