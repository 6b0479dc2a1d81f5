package com.nchat.connectors.error;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    private static ConnectorException classify(String message) {
        return ErrorClassifier.classify(new RuntimeException(message), "jira");
    }

    @Test
    void authFailuresAreNotRetryable() {
        for (String message : new String[] {"HTTP 401", "403 Forbidden", "Unauthorized", "token expired"}) {
            ConnectorException e = classify(message);
            assertEquals(ErrorCategory.AUTH, e.getCategory(), message);
            assertFalse(e.isRetryable(), message);
        }
    }

    @Test
    void rateLimitFailuresAreRetryable() {
        ConnectorException e = classify("Too Many Requests");
        assertEquals(ErrorCategory.RATE_LIMIT, e.getCategory());
        assertTrue(e.isRetryable());
        assertEquals(ErrorCategory.RATE_LIMIT, classify("got 429").getCategory());
    }

    @Test
    void networkFailuresByMessage() {
        for (String message : new String[] {"ECONNREFUSED", "connection reset by peer", "ENOTFOUND api.example.com",
                "request timed out", "502 Bad Gateway", "503", "504", "connect ETIMEDOUT"}) {
            ConnectorException e = classify(message);
            assertEquals(ErrorCategory.NETWORK, e.getCategory(), message);
            assertTrue(e.isRetryable(), message);
        }
    }

    @Test
    void networkFailuresByType() {
        assertEquals(ErrorCategory.NETWORK,
                ErrorClassifier.classify(new ConnectException("nope"), "x").getCategory());
        assertEquals(ErrorCategory.NETWORK,
                ErrorClassifier.classify(new UnknownHostException("api.invalid"), "x").getCategory());
        assertEquals(ErrorCategory.NETWORK,
                ErrorClassifier.classify(new SocketTimeoutException(), "x").getCategory());
    }

    @Test
    void dataFailures() {
        assertEquals(ErrorCategory.DATA, classify("400 Bad Request").getCategory());
        assertEquals(ErrorCategory.DATA, classify("Validation failed: title").getCategory());
        assertFalse(classify("invalid payload").isRetryable());
    }

    @Test
    void wordNetworkAloneIsNotATransportFailure() {
        ConnectorException e = classify("Invalid network configuration");
        assertEquals(ErrorCategory.DATA, e.getCategory());
        assertFalse(e.isRetryable());
        assertEquals(ErrorCategory.UNKNOWN, classify("network unreachable").getCategory());
    }

    @Test
    void rulesApplyInPriorityOrder() {
        // auth wins over data even though "invalid" also matches
        assertEquals(ErrorCategory.AUTH, classify("401 invalid token").getCategory());
        assertEquals(ErrorCategory.RATE_LIMIT, classify("429 timeout").getCategory());
    }

    @Test
    void unknownFallback() {
        ConnectorException e = classify("something odd");
        assertEquals(ErrorCategory.UNKNOWN, e.getCategory());
        assertFalse(e.isRetryable());
        assertEquals("jira", e.getProviderId());
    }

    @Test
    void blankMessageFallsBackToTypeName() {
        ConnectorException e = ErrorClassifier.classify(new IOException(), "x");
        assertEquals("IOException", e.getMessage());
        assertEquals(ErrorCategory.UNKNOWN, e.getCategory());
    }

    @Test
    void connectorExceptionPassesThrough() {
        ConnectorException original = new ConnectorException("401 but trusted", ErrorCategory.CONFIG, "x");
        assertSame(original, ErrorClassifier.classify(original, "other"));
    }

    @Test
    void wrapsOriginalAsCause() {
        RuntimeException cause = new RuntimeException("503");
        assertSame(cause, ErrorClassifier.classify(cause, "x").getCause());
    }

    @Test
    void categoryForStatus() {
        assertEquals(ErrorCategory.AUTH, ErrorClassifier.categoryForStatus(401));
        assertEquals(ErrorCategory.AUTH, ErrorClassifier.categoryForStatus(403));
        assertEquals(ErrorCategory.RATE_LIMIT, ErrorClassifier.categoryForStatus(429));
        assertEquals(ErrorCategory.NETWORK, ErrorClassifier.categoryForStatus(503));
        assertEquals(ErrorCategory.DATA, ErrorClassifier.categoryForStatus(404));
        assertNull(ErrorClassifier.categoryForStatus(204));
    }

    @Test
    void builderOverridesRetryability() {
        ConnectorException e = ConnectorException.builder("stop", ErrorCategory.NETWORK, "x")
                .retryable(false)
                .statusCode(503)
                .detail("attempt", 2)
                .build();
        assertFalse(e.isRetryable());
        assertEquals(503, e.getStatusCode());
        assertEquals(2, e.getDetails().get("attempt"));
    }
}
