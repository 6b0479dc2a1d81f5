package com.nchat.connectors.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * OAuth-style credentials held by a connector while it is connected.
 *
 * <p>Instances are immutable; a token refresh replaces the whole object via
 * {@link com.nchat.connectors.core.ResilientConnector#updateCredentials(ConnectorCredentials)}.
 * The JSON shape produced by Jackson is what
 * {@link com.nchat.connectors.vault.CredentialCipher} encrypts.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConnectorCredentials {

    private final String accessToken;
    private final String refreshToken;
    private final Instant expiresAt;
    private final String tokenType;
    private final String scope;
    private final Map<String, String> metadata;

    @JsonCreator
    public ConnectorCredentials(@JsonProperty("accessToken")  String accessToken,
                                @JsonProperty("refreshToken") String refreshToken,
                                @JsonProperty("expiresAt")    Instant expiresAt,
                                @JsonProperty("tokenType")    String tokenType,
                                @JsonProperty("scope")        String scope,
                                @JsonProperty("metadata")     Map<String, String> metadata) {
        this.accessToken  = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt    = expiresAt;
        this.tokenType    = tokenType;
        this.scope        = scope;
        this.metadata     = metadata == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @JsonProperty("accessToken")  public String getAccessToken()          { return accessToken; }
    @JsonProperty("refreshToken") public String getRefreshToken()         { return refreshToken; }
    @JsonProperty("expiresAt")    public Instant getExpiresAt()           { return expiresAt; }
    @JsonProperty("tokenType")    public String getTokenType()            { return tokenType; }
    @JsonProperty("scope")        public String getScope()                { return scope; }
    @JsonProperty("metadata")     public Map<String, String> getMetadata() { return metadata; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectorCredentials)) return false;
        ConnectorCredentials that = (ConnectorCredentials) o;
        return Objects.equals(accessToken, that.accessToken)
                && Objects.equals(refreshToken, that.refreshToken)
                && Objects.equals(expiresAt, that.expiresAt)
                && Objects.equals(tokenType, that.tokenType)
                && Objects.equals(scope, that.scope)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(accessToken, refreshToken, expiresAt, tokenType, scope, metadata);
    }

    /** Never prints token values. */
    @Override
    public String toString() {
        return "ConnectorCredentials{tokenType='" + tokenType + "', scope='" + scope +
               "', expiresAt=" + expiresAt + ", hasRefreshToken=" + (refreshToken != null) + '}';
    }

    public static Builder builder(String accessToken) {
        return new Builder(accessToken);
    }

    public static final class Builder {
        private final String accessToken;
        private String refreshToken;
        private Instant expiresAt;
        private String tokenType = "Bearer";
        private String scope;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder(String accessToken) {
            this.accessToken = accessToken;
        }

        public Builder refreshToken(String token)           { this.refreshToken = token; return this; }
        public Builder expiresAt(Instant expiresAt)         { this.expiresAt = expiresAt; return this; }
        public Builder tokenType(String tokenType)          { this.tokenType = tokenType; return this; }
        public Builder scope(String scope)                  { this.scope = scope; return this; }
        public Builder metadata(String key, String value)   { this.metadata.put(key, value); return this; }

        public ConnectorCredentials build() {
            if (accessToken == null || accessToken.isBlank()) {
                throw new IllegalArgumentException("accessToken must not be blank");
            }
            return new ConnectorCredentials(accessToken, refreshToken, expiresAt, tokenType, scope, metadata);
        }
    }
}
