package com.nchat.webhooks.handler;

/** Thrown by a {@link WebhookHandler} when a delivery cannot be processed. */
public class WebhookHandlerException extends Exception {

    public WebhookHandlerException(String message) {
        super(message);
    }

    public WebhookHandlerException(String message, Throwable cause) {
        super(message, cause);
    }
}
