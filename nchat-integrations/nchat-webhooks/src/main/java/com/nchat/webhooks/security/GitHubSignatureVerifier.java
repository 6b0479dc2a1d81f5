package com.nchat.webhooks.security;

import java.util.Map;

/** GitHub: {@code x-hub-signature-256: sha256=<hex>} over the raw body. */
public class GitHubSignatureVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-hub-signature-256";

    @Override
    public VerificationResult verify(byte[] rawBody, Map<String, String> headers, String secret) {
        SignatureOptions options = SignatureOptions.builder(secret)
                .algorithm(SignatureAlgorithm.SHA256)
                .prefix("sha256=")
                .build();
        return HmacSignatureVerifier.verify(rawBody, headers.get(SIGNATURE_HEADER), options);
    }
}
