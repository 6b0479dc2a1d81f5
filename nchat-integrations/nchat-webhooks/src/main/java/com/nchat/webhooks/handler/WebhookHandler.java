package com.nchat.webhooks.handler;

import com.nchat.webhooks.model.WebhookEnvelope;

/**
 * SPI for receiving verified webhook deliveries.
 *
 * <p>Register one handler per source with
 * {@link com.nchat.webhooks.manager.WebhookHandlerManager}. Handlers must be
 * thread-safe: the server calls {@link #handle(WebhookEnvelope)} from its
 * request threads concurrently.
 */
@FunctionalInterface
public interface WebhookHandler {

    /**
     * Called once per delivery from the source this handler was registered for.
     *
     * @throws WebhookHandlerException if the delivery cannot be processed; the
     *         manager reports it as a failed delivery and does not retry
     */
    void handle(WebhookEnvelope envelope) throws WebhookHandlerException;
}
