package com.nchat.webhooks.manager;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.nchat.webhooks.handler.WebhookHandler;
import com.nchat.webhooks.handler.WebhookHandlerException;
import com.nchat.webhooks.model.ParsedWebhook;
import com.nchat.webhooks.model.WebhookFailure;
import com.nchat.webhooks.model.WebhookResult;
import com.nchat.webhooks.model.WebhookSource;
import com.nchat.webhooks.parser.WebhookParser;
import com.nchat.webhooks.security.GenericSignatureVerifier;
import com.nchat.webhooks.security.GitHubSignatureVerifier;
import com.nchat.webhooks.security.JiraSignatureVerifier;
import com.nchat.webhooks.security.SignatureVerifier;
import com.nchat.webhooks.security.SlackSignatureVerifier;
import com.nchat.webhooks.security.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Routes inbound deliveries to one handler per source.
 *
 * <h2>Usage</h2>
 * <pre>
 *   WebhookHandlerManager manager = new WebhookHandlerManager();
 *   manager.setSignatureSecret(WebhookSource.GITHUB, githubSecret);
 *   manager.registerHandler(WebhookSource.GITHUB, envelope -&gt; {
 *       if ("push".equals(envelope.getEvent())) { ... }
 *   });
 *
 *   WebhookResult result = manager.processWebhook(body, headers);
 * </pre>
 *
 * Sources with a registered secret must carry a valid signature. Sources
 * without one are accepted unverified.
 */
public class WebhookHandlerManager {

    private static final Logger log = LoggerFactory.getLogger(WebhookHandlerManager.class);

    private final WebhookParser parser;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    /** source → handler */
    private final Map<String, WebhookHandler> handlers = new HashMap<>();
    /** source → shared secret */
    private final Map<String, String> secrets = new HashMap<>();
    /** source → verifier; anything else uses {@link #fallbackVerifier} */
    private final Map<String, SignatureVerifier> verifiers = new HashMap<>();
    private final SignatureVerifier fallbackVerifier = new GenericSignatureVerifier();

    public WebhookHandlerManager() {
        this(Clock.systemUTC());
    }

    public WebhookHandlerManager(Clock clock) {
        this(new WebhookParser(new ObjectMapper().registerModule(new JavaTimeModule()), clock),
                new SlackSignatureVerifier(clock, SlackSignatureVerifier.DEFAULT_TOLERANCE_SECONDS));
    }

    private WebhookHandlerManager(WebhookParser parser, SlackSignatureVerifier slackVerifier) {
        this.parser = parser;
        verifiers.put(WebhookSource.GITHUB, new GitHubSignatureVerifier());
        verifiers.put(WebhookSource.SLACK, slackVerifier);
        verifiers.put(WebhookSource.JIRA, new JiraSignatureVerifier());
    }

    // ------------------------------------------------------------------
    // Registration API
    // ------------------------------------------------------------------

    /** Registers {@code handler} for {@code source}, replacing any earlier one. */
    public void registerHandler(String source, WebhookHandler handler) {
        write(() -> handlers.put(key(source), handler));
        log.info("Registered handler {} for source='{}'", handler.getClass().getSimpleName(), source);
    }

    public void removeHandler(String source) {
        write(() -> handlers.remove(key(source)));
    }

    /** Enables signature verification for {@code source}. */
    public void setSignatureSecret(String source, String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        write(() -> secrets.put(key(source), secret));
        log.info("Signature verification enabled for source='{}'", source);
    }

    public void removeSignatureSecret(String source) {
        write(() -> secrets.remove(key(source)));
    }

    /** Overrides the verifier used for {@code source}, e.g. for a custom header scheme. */
    public void registerVerifier(String source, SignatureVerifier verifier) {
        write(() -> verifiers.put(key(source), verifier));
    }

    public boolean hasHandler(String source) {
        lock.readLock().lock();
        try {
            return handlers.containsKey(key(source));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> registeredSources() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(handlers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public WebhookParser getParser() { return parser; }

    // ------------------------------------------------------------------
    // Processing
    // ------------------------------------------------------------------

    public WebhookResult processWebhook(String rawBody, Map<String, String> headers) {
        return processWebhook(rawBody == null ? new byte[0] : rawBody.getBytes(StandardCharsets.UTF_8), headers);
    }

    /**
     * Parses, verifies and dispatches one delivery. Never throws; every
     * failure is returned as an unsuccessful {@link WebhookResult}.
     */
    public WebhookResult processWebhook(byte[] rawBody, Map<String, String> headers) {
        ParsedWebhook parsed = parser.parse(rawBody, headers);
        String source = parsed.getSource();
        if (!parsed.isValid()) {
            log.warn("Rejected webhook from '{}': {}", source, parsed.getValidationError());
            return WebhookResult.failure(source, null, WebhookFailure.INVALID_JSON, parsed.getValidationError());
        }

        String secret;
        SignatureVerifier verifier;
        WebhookHandler handler;
        lock.readLock().lock();
        try {
            secret = secrets.get(source);
            verifier = verifiers.getOrDefault(source, fallbackVerifier);
            handler = handlers.get(source);
        } finally {
            lock.readLock().unlock();
        }

        if (secret != null) {
            VerificationResult verification = verifier.verify(rawBody, parsed.getHeaders(), secret);
            if (!verification.isValid()) {
                log.warn("Rejected webhook from '{}' ({}): {}", source, parsed.getEvent(), verification.getError());
                return WebhookResult.failure(source, parsed.getEvent(), WebhookFailure.INVALID_SIGNATURE,
                        "Invalid signature: " + verification.getError());
            }
        }

        if (handler == null) {
            log.warn("No handler registered for source '{}'", source);
            return WebhookResult.failure(source, parsed.getEvent(), WebhookFailure.NO_HANDLER,
                    "No handler registered for source: " + source);
        }

        log.debug("Dispatching {}", parsed);
        try {
            handler.handle(parsed.toEnvelope());
        } catch (WebhookHandlerException e) {
            log.error("Handler {} failed for {} event '{}': {}",
                    handler.getClass().getSimpleName(), source, parsed.getEvent(), e.getMessage(), e);
            return WebhookResult.failure(source, parsed.getEvent(), WebhookFailure.HANDLER_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in handler {} for {} event '{}'",
                    handler.getClass().getSimpleName(), source, parsed.getEvent(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return WebhookResult.failure(source, parsed.getEvent(), WebhookFailure.HANDLER_FAILED, message);
        }
        return WebhookResult.success(source, parsed.getEvent());
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private void write(Runnable mutation) {
        lock.writeLock().lock();
        try {
            mutation.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static String key(String source) {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source must not be null or blank");
        }
        return source.trim().toLowerCase(Locale.ROOT);
    }
}
