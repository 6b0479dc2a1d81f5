package com.nchat.webhooks.model;

/** Why a delivery was not handled. Every failure is terminal for that request. */
public enum WebhookFailure {
    INVALID_JSON,
    INVALID_SIGNATURE,
    NO_HANDLER,
    HANDLER_FAILED
}
