package com.nchat.webhooks.handler;

import com.nchat.webhooks.model.WebhookEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference handler that logs each delivery at INFO. Handy as a placeholder
 * while wiring a new source.
 */
public class LoggingWebhookHandler implements WebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(LoggingWebhookHandler.class);

    @Override
    public void handle(WebhookEnvelope envelope) {
        log.info("Webhook received: source={} event={} ts={} fields={}",
                envelope.getSource(),
                envelope.getEvent(),
                envelope.getTimestamp(),
                envelope.getPayload() == null ? 0 : envelope.getPayload().size());
    }
}
