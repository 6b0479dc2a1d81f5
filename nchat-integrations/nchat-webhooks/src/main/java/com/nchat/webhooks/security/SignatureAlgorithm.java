package com.nchat.webhooks.security;

/** HMAC digests accepted by {@link HmacSignatureVerifier}. */
public enum SignatureAlgorithm {
    SHA1("HmacSHA1", "sha1"),
    SHA256("HmacSHA256", "sha256"),
    SHA512("HmacSHA512", "sha512");

    private final String jcaName;
    private final String label;

    SignatureAlgorithm(String jcaName, String label) {
        this.jcaName = jcaName;
        this.label = label;
    }

    public String jcaName() { return jcaName; }

    /** Lowercase name used in signature prefixes, e.g. {@code sha256}. */
    public String label() { return label; }
}
