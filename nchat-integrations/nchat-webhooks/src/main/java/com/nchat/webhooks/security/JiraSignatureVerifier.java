package com.nchat.webhooks.security;

import java.util.Map;

/** Jira Cloud: {@code x-hub-signature: sha256=<hex>} over the raw body. */
public class JiraSignatureVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-hub-signature";

    @Override
    public VerificationResult verify(byte[] rawBody, Map<String, String> headers, String secret) {
        SignatureOptions options = SignatureOptions.builder(secret)
                .algorithm(SignatureAlgorithm.SHA256)
                .prefix("sha256=")
                .build();
        return HmacSignatureVerifier.verify(rawBody, headers.get(SIGNATURE_HEADER), options);
    }
}
