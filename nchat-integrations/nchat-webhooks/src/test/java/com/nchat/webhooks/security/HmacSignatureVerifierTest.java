package com.nchat.webhooks.security;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HmacSignatureVerifierTest {

    private static final String PAYLOAD = "{\"action\":\"opened\",\"number\":42}";

    private static SignatureOptions sha256(String secret) {
        return SignatureOptions.builder(secret).prefix("sha256=").build();
    }

    @Test
    void knownDigest() {
        SignatureOptions options = SignatureOptions.builder("key").build();
        assertEquals("f7bc83f430538424b13298e6aa6fb143ef4d59a14946175997479dbc2d1a3cd8",
                HmacSignatureVerifier.sign("The quick brown fox jumps over the lazy dog", options));
    }

    @Test
    void signedPayloadVerifies() {
        String signature = HmacSignatureVerifier.sign(PAYLOAD, sha256("s3cret"));

        assertTrue(signature.matches("sha256=[0-9a-f]{64}"));
        VerificationResult result = HmacSignatureVerifier.verify(PAYLOAD, signature, sha256("s3cret"));
        assertTrue(result.isValid());
        assertNull(result.getError());
    }

    @Test
    void flippingAnySignatureCharacterFails() {
        String signature = HmacSignatureVerifier.sign(PAYLOAD, sha256("s3cret"));
        for (int i = "sha256=".length(); i < signature.length(); i++) {
            char c = signature.charAt(i);
            char flipped = c == '0' ? '1' : '0';
            String tampered = signature.substring(0, i) + flipped + signature.substring(i + 1);
            assertFalse(HmacSignatureVerifier.verify(PAYLOAD, tampered, sha256("s3cret")).isValid(), tampered);
        }
    }

    @Test
    void wrongSecretOrPayloadFails() {
        String signature = HmacSignatureVerifier.sign(PAYLOAD, sha256("s3cret"));

        VerificationResult wrongSecret = HmacSignatureVerifier.verify(PAYLOAD, signature, sha256("other"));
        assertFalse(wrongSecret.isValid());
        assertEquals("Signature mismatch", wrongSecret.getError());
        assertFalse(HmacSignatureVerifier.verify(PAYLOAD + " ", signature, sha256("s3cret")).isValid());
    }

    @Test
    void missingSignatureAndWrongPrefix() {
        assertEquals("Missing signature",
                HmacSignatureVerifier.verify(PAYLOAD, null, sha256("s")).getError());
        assertEquals("Missing signature",
                HmacSignatureVerifier.verify(PAYLOAD, " ", sha256("s")).getError());

        String bare = HmacSignatureVerifier.sign(PAYLOAD, SignatureOptions.builder("s").build());
        VerificationResult result = HmacSignatureVerifier.verify(PAYLOAD, bare, sha256("s"));
        assertFalse(result.isValid());
        assertTrue(result.getError().startsWith("Invalid signature format"));
    }

    @Test
    void optionalPrefixAcceptsBothForms() {
        SignatureOptions options = SignatureOptions.builder("s").prefix("sha256=").optionalPrefix().build();
        String prefixed = HmacSignatureVerifier.sign(PAYLOAD, options);

        assertTrue(HmacSignatureVerifier.verify(PAYLOAD, prefixed, options).isValid());
        assertTrue(HmacSignatureVerifier.verify(PAYLOAD, prefixed.substring(7), options).isValid());
    }

    @Test
    void changingCaseOfOneHexLetterFails() {
        String signature = HmacSignatureVerifier.sign(PAYLOAD, sha256("s3cret"));
        int letters = 0;
        for (int i = "sha256=".length(); i < signature.length(); i++) {
            char c = signature.charAt(i);
            if (!Character.isLetter(c)) {
                continue;
            }
            letters++;
            String tampered = signature.substring(0, i) + Character.toUpperCase(c) + signature.substring(i + 1);
            assertFalse(HmacSignatureVerifier.verify(PAYLOAD, tampered, sha256("s3cret")).isValid(), tampered);
        }
        assertTrue(letters > 0);
    }

    @Test
    void uppercaseHexIsRejected() {
        String signature = HmacSignatureVerifier.sign(PAYLOAD, sha256("s"));
        String upper = "sha256=" + signature.substring(7).toUpperCase(Locale.ROOT);
        VerificationResult result = HmacSignatureVerifier.verify(PAYLOAD, upper, sha256("s"));
        assertFalse(result.isValid());
        assertEquals("Signature mismatch", result.getError());
    }

    @Test
    void otherAlgorithms() {
        SignatureOptions sha512 = SignatureOptions.builder("s").algorithm(SignatureAlgorithm.SHA512)
                .prefix("sha512=").build();
        SignatureOptions sha1 = SignatureOptions.builder("s").algorithm(SignatureAlgorithm.SHA1)
                .prefix("sha1=").build();

        String sig512 = HmacSignatureVerifier.sign(PAYLOAD, sha512);
        assertTrue(sig512.matches("sha512=[0-9a-f]{128}"));
        assertTrue(HmacSignatureVerifier.verify(PAYLOAD, sig512, sha512).isValid());
        assertTrue(HmacSignatureVerifier.sign(PAYLOAD, sha1).matches("sha1=[0-9a-f]{40}"));

        // a SHA-256 digest does not satisfy a SHA-512 check
        String sig256 = "sha512=" + HmacSignatureVerifier.sign(PAYLOAD, sha256("s")).substring(7);
        assertFalse(HmacSignatureVerifier.verify(PAYLOAD, sig256, sha512).isValid());
    }

    @Test
    void emptyPayloadAndUnicode() {
        assertTrue(HmacSignatureVerifier.verify("", HmacSignatureVerifier.sign("", sha256("s")), sha256("s")).isValid());
        String unicode = "{\"text\":\"héllo 👋\"}";
        assertTrue(HmacSignatureVerifier.verify(unicode, HmacSignatureVerifier.sign(unicode, sha256("s")),
                sha256("s")).isValid());
        assertNotEquals(HmacSignatureVerifier.sign("a", sha256("s")), HmacSignatureVerifier.sign("b", sha256("s")));
    }

    @Test
    void missingSecretIsInvalid() {
        assertEquals("Missing secret",
                HmacSignatureVerifier.verify(PAYLOAD, "sha256=00", SignatureOptions.builder("").build()).getError());
    }

    @Test
    void constantTimeEquals() {
        assertTrue(HmacSignatureVerifier.constantTimeEquals("hello", "hello"));
        assertTrue(HmacSignatureVerifier.constantTimeEquals("", ""));
        assertFalse(HmacSignatureVerifier.constantTimeEquals("hello", "world"));
        assertFalse(HmacSignatureVerifier.constantTimeEquals("short", "longer_string"));
        assertFalse(HmacSignatureVerifier.constantTimeEquals(null, "x"));
    }
}
