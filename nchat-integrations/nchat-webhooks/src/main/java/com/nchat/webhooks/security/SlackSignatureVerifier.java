package com.nchat.webhooks.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

/**
 * Slack request signing.
 *
 * <p>The signed base string is {@code v0:<timestamp>:<raw body>} and the
 * signature header reads {@code v0=<hex>}. Requests whose
 * {@code x-slack-request-timestamp} is more than the tolerance away from now
 * are rejected before any HMAC is computed.
 */
public class SlackSignatureVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-slack-signature";
    public static final String TIMESTAMP_HEADER = "x-slack-request-timestamp";
    public static final long   DEFAULT_TOLERANCE_SECONDS = 300;

    private static final String VERSION = "v0";

    private final Clock clock;
    private final long  toleranceSeconds;

    public SlackSignatureVerifier() {
        this(Clock.systemUTC(), DEFAULT_TOLERANCE_SECONDS);
    }

    public SlackSignatureVerifier(Clock clock, long toleranceSeconds) {
        this.clock = clock;
        this.toleranceSeconds = toleranceSeconds;
    }

    @Override
    public VerificationResult verify(byte[] rawBody, Map<String, String> headers, String secret) {
        String timestamp = headers.get(TIMESTAMP_HEADER);
        if (timestamp == null || timestamp.isBlank()) {
            return VerificationResult.invalid("Missing timestamp");
        }
        String trimmed = timestamp.trim();
        long seconds;
        try {
            seconds = Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            return VerificationResult.invalid("Invalid timestamp: " + timestamp);
        }
        long now = clock.millis() / 1000;
        if (seconds < now - toleranceSeconds || seconds > now + toleranceSeconds) {
            return VerificationResult.invalid("Request timestamp outside tolerance of " + toleranceSeconds + "s");
        }

        return HmacSignatureVerifier.verify(baseString(trimmed, rawBody), headers.get(SIGNATURE_HEADER),
                options(secret));
    }

    /** Slack-style signature for {@code rawBody} sent at {@code timestampSeconds}. */
    public static String sign(byte[] rawBody, long timestampSeconds, String secret) {
        return HmacSignatureVerifier.sign(baseString(Long.toString(timestampSeconds), rawBody), options(secret));
    }

    private static SignatureOptions options(String secret) {
        return SignatureOptions.builder(secret)
                .algorithm(SignatureAlgorithm.SHA256)
                .prefix(VERSION + "=")
                .build();
    }

    private static byte[] baseString(String timestamp, byte[] rawBody) {
        byte[] head = (VERSION + ":" + timestamp + ":").getBytes(StandardCharsets.UTF_8);
        byte[] base = new byte[head.length + rawBody.length];
        System.arraycopy(head, 0, base, 0, head.length);
        System.arraycopy(rawBody, 0, base, head.length, rawBody.length);
        return base;
    }
}
