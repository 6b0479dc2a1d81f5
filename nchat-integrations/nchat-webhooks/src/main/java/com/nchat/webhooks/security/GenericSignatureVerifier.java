package com.nchat.webhooks.security;

import java.util.Map;

/**
 * Fallback for custom sources: {@code x-webhook-signature} carrying an
 * HMAC-SHA256 hex digest, with or without a {@code sha256=} prefix.
 */
public class GenericSignatureVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-webhook-signature";

    @Override
    public VerificationResult verify(byte[] rawBody, Map<String, String> headers, String secret) {
        SignatureOptions options = SignatureOptions.builder(secret)
                .algorithm(SignatureAlgorithm.SHA256)
                .prefix("sha256=")
                .optionalPrefix()
                .build();
        return HmacSignatureVerifier.verify(rawBody, headers.get(SIGNATURE_HEADER), options);
    }
}
