package com.nchat.webhooks.security;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * HMAC signing and verification over raw webhook bodies.
 *
 * <p>Signatures are lowercase hex digests, optionally preceded by a prefix
 * such as {@code sha256=}. Verification never throws: every problem is
 * reported through {@link VerificationResult}.
 */
public final class HmacSignatureVerifier {

    private HmacSignatureVerifier() {}

    public static VerificationResult verify(String payload, String signature, SignatureOptions options) {
        return verify(payload == null ? new byte[0] : payload.getBytes(StandardCharsets.UTF_8), signature, options);
    }

    public static VerificationResult verify(byte[] payload, String signature, SignatureOptions options) {
        if (options == null || options.getSecret() == null || options.getSecret().isEmpty()) {
            return VerificationResult.invalid("Missing secret");
        }
        if (signature == null || signature.isBlank()) {
            return VerificationResult.invalid("Missing signature");
        }

        String received = signature.trim();
        String prefix = options.getPrefix();
        if (prefix != null && !prefix.isEmpty()) {
            if (received.startsWith(prefix)) {
                received = received.substring(prefix.length());
            } else if (options.isPrefixRequired()) {
                return VerificationResult.invalid("Invalid signature format: expected prefix '" + prefix + "'");
            }
        }

        String expected = hmacHex(payload, options);
        return constantTimeEquals(expected, received)
                ? VerificationResult.valid()
                : VerificationResult.invalid("Signature mismatch");
    }

    /** Signature for {@code payload} including the configured prefix. */
    public static String sign(String payload, SignatureOptions options) {
        return sign(payload.getBytes(StandardCharsets.UTF_8), options);
    }

    public static String sign(byte[] payload, SignatureOptions options) {
        String prefix = options.getPrefix() == null ? "" : options.getPrefix();
        return prefix + hmacHex(payload, options);
    }

    /**
     * Compares in time independent of where the strings differ. Strings of
     * different length fail immediately, so only the length can leak.
     */
    public static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null || a.length() != b.length()) {
            return false;
        }
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }

    private static String hmacHex(byte[] data, SignatureOptions options) {
        String algorithm = options.getAlgorithm().jcaName();
        try {
            Mac mac = Mac.getInstance(algorithm);
            mac.init(new SecretKeySpec(options.getSecret().getBytes(StandardCharsets.UTF_8), algorithm));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException(algorithm + " unavailable", e);
        }
    }
}
