package com.nchat.webhooks.security;

/**
 * How a signature header is framed and which HMAC produced it.
 *
 * <pre>
 *   SignatureOptions github = SignatureOptions.builder(secret)
 *       .algorithm(SignatureAlgorithm.SHA256)
 *       .prefix("sha256=")
 *       .build();
 * </pre>
 */
public final class SignatureOptions {

    private final String             secret;
    private final SignatureAlgorithm algorithm;
    private final String             prefix;
    private final boolean            prefixRequired;

    private SignatureOptions(Builder b) {
        this.secret         = b.secret;
        this.algorithm      = b.algorithm;
        this.prefix         = b.prefix;
        this.prefixRequired = b.prefixRequired;
    }

    public String             getSecret()       { return secret; }
    public SignatureAlgorithm getAlgorithm()    { return algorithm; }
    public String             getPrefix()       { return prefix; }
    public boolean            isPrefixRequired() { return prefixRequired; }

    public static Builder builder(String secret) { return new Builder(secret); }

    public static final class Builder {
        private final String secret;
        private SignatureAlgorithm algorithm = SignatureAlgorithm.SHA256;
        private String  prefix;
        private boolean prefixRequired = true;

        private Builder(String secret) {
            this.secret = secret;
        }

        public Builder algorithm(SignatureAlgorithm algorithm) { this.algorithm = algorithm; return this; }
        public Builder prefix(String prefix)                   { this.prefix = prefix; return this; }

        /** Accept signatures with or without the prefix. */
        public Builder optionalPrefix()                        { this.prefixRequired = false; return this; }

        public SignatureOptions build() {
            if (algorithm == null) {
                throw new IllegalStateException("algorithm is required");
            }
            return new SignatureOptions(this);
        }
    }
}
