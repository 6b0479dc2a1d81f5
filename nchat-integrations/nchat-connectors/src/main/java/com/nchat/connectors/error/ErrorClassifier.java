package com.nchat.connectors.error;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps arbitrary failures into the {@link ErrorCategory} taxonomy.
 *
 * <p>Rules are evaluated in order and the first match wins:
 * <ol>
 *   <li>auth: 401, 403, "unauthorized", "forbidden", "token expired"</li>
 *   <li>rate_limit: 429, "rate limit", "too many requests"</li>
 *   <li>network: refused/reset connections, DNS failures, timeouts, 502/503/504</li>
 *   <li>data: 400, 422, "validation", "invalid"</li>
 *   <li>otherwise unknown</li>
 * </ol>
 * Upstream transports mostly report failures as unstructured text, so the
 * matching is on the lower-cased message; a handful of JDK exception types
 * whose messages carry no useful text are matched by type instead.
 * A {@link ConnectorException} is returned unchanged.
 */
public final class ErrorClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule(ErrorCategory.AUTH, messageContains(
                    "401", "403", "unauthorized", "forbidden", "token expired")),
            new Rule(ErrorCategory.RATE_LIMIT, messageContains(
                    "429", "rate limit", "too many requests")),
            new Rule(ErrorCategory.NETWORK, isNetworkType().or(messageContains(
                    "econnrefused", "connection refused", "econnreset", "connection reset",
                    "enotfound", "dns", "timeout", "timed out", "etimedout",
                    "502", "503", "504"))),
            new Rule(ErrorCategory.DATA, messageContains(
                    "400", "422", "validation", "invalid"))
    );

    private ErrorClassifier() {}

    /**
     * Classifies {@code error} on behalf of {@code providerId}.
     *
     * @return {@code error} itself when it is already a {@link ConnectorException},
     *         otherwise a new exception wrapping it
     */
    public static ConnectorException classify(Throwable error, String providerId) {
        if (error instanceof ConnectorException) {
            return (ConnectorException) error;
        }
        String message = messageOf(error);
        ErrorCategory category = RULES.stream()
                .filter(rule -> rule.matches.test(error))
                .map(rule -> rule.category)
                .findFirst()
                .orElse(ErrorCategory.UNKNOWN);
        return ConnectorException.builder(message, category, providerId)
                .cause(error)
                .build();
    }

    /**
     * Category implied by an HTTP status code, or {@code null} for 1xx-3xx.
     */
    public static ErrorCategory categoryForStatus(int status) {
        if (status == 401 || status == 403) return ErrorCategory.AUTH;
        if (status == 429)                  return ErrorCategory.RATE_LIMIT;
        if (status >= 500)                  return ErrorCategory.NETWORK;
        if (status >= 400)                  return ErrorCategory.DATA;
        return null;
    }

    static String messageOf(Throwable error) {
        if (error == null) {
            return "Unknown error";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static Predicate<Throwable> messageContains(String... needles) {
        return error -> {
            String message = messageOf(error).toLowerCase(Locale.ROOT);
            for (String needle : needles) {
                if (message.contains(needle)) {
                    return true;
                }
            }
            return false;
        };
    }

    private static Predicate<Throwable> isNetworkType() {
        return error -> error instanceof ConnectException
                || error instanceof UnknownHostException
                || error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException;
    }

    private static final class Rule {
        final ErrorCategory category;
        final Predicate<Throwable> matches;

        Rule(ErrorCategory category, Predicate<Throwable> matches) {
            this.category = category;
            this.matches = matches;
        }
    }
}
