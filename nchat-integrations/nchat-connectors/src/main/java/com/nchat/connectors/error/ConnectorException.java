package com.nchat.connectors.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The only failure type that leaves the connector framework.
 *
 * <p>Every instance carries exactly one {@link ErrorCategory} and a retry
 * decision. Raw transport exceptions are wrapped by
 * {@link ErrorClassifier#classify(Throwable, String)} before they reach callers.
 */
public class ConnectorException extends Exception {

    private final ErrorCategory category;
    private final String providerId;
    private final boolean retryable;
    private final Integer statusCode;
    private final Map<String, Object> details;

    public ConnectorException(String message, ErrorCategory category, String providerId) {
        this(builder(message, category, providerId));
    }

    public ConnectorException(String message, ErrorCategory category, String providerId, Throwable cause) {
        this(builder(message, category, providerId).cause(cause));
    }

    private ConnectorException(Builder b) {
        super(b.message, b.cause);
        this.category   = Objects.requireNonNull(b.category, "category");
        this.providerId = b.providerId;
        this.retryable  = b.retryable != null ? b.retryable : b.category.isRetryableByDefault();
        this.statusCode = b.statusCode;
        this.details    = Collections.unmodifiableMap(new LinkedHashMap<>(b.details));
    }

    public ErrorCategory getCategory()        { return category; }
    public String getProviderId()             { return providerId; }
    public boolean isRetryable()              { return retryable; }
    /** HTTP status reported by the provider, or {@code null}. */
    public Integer getStatusCode()            { return statusCode; }
    public Map<String, Object> getDetails()   { return details; }

    @Override
    public String toString() {
        return "ConnectorException{category=" + category.wireName() + ", provider=" + providerId +
               ", retryable=" + retryable + (statusCode != null ? ", status=" + statusCode : "") +
               ", message='" + getMessage() + "'}";
    }

    public static Builder builder(String message, ErrorCategory category, String providerId) {
        return new Builder(message, category, providerId);
    }

    public static final class Builder {
        private final String message;
        private final ErrorCategory category;
        private final String providerId;
        private Boolean retryable;
        private Integer statusCode;
        private Throwable cause;
        private final Map<String, Object> details = new LinkedHashMap<>();

        private Builder(String message, ErrorCategory category, String providerId) {
            this.message = message;
            this.category = category;
            this.providerId = providerId;
        }

        public Builder retryable(boolean retryable)         { this.retryable = retryable; return this; }
        public Builder statusCode(Integer statusCode)       { this.statusCode = statusCode; return this; }
        public Builder cause(Throwable cause)               { this.cause = cause; return this; }
        public Builder detail(String key, Object value)     { this.details.put(key, value); return this; }

        public ConnectorException build() {
            return new ConnectorException(this);
        }
    }
}
