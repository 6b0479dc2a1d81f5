package com.nchat.webhooks.security;

import java.util.Map;

/**
 * Provider-specific signature framing over {@link HmacSignatureVerifier}.
 *
 * <p>{@code headers} must already be normalized to lowercase names.
 */
@FunctionalInterface
public interface SignatureVerifier {

    VerificationResult verify(byte[] rawBody, Map<String, String> headers, String secret);
}
