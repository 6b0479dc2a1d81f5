package com.nchat.webhooks.model;

/** Outcome of {@link com.nchat.webhooks.manager.WebhookHandlerManager#processWebhook}. */
public final class WebhookResult {

    private final boolean        success;
    private final String         source;
    private final String         event;
    private final String         error;
    private final WebhookFailure failure;

    private WebhookResult(boolean success, String source, String event, String error, WebhookFailure failure) {
        this.success = success;
        this.source  = source;
        this.event   = event;
        this.error   = error;
        this.failure = failure;
    }

    public static WebhookResult success(String source, String event) {
        return new WebhookResult(true, source, event, null, null);
    }

    public static WebhookResult failure(String source, String event, WebhookFailure failure, String error) {
        return new WebhookResult(false, source, event, error, failure);
    }

    public boolean        isSuccess()  { return success; }
    public String         getSource()  { return source; }
    public String         getEvent()   { return event; }
    public String         getError()   { return error; }

    /** {@code null} on success. */
    public WebhookFailure getFailure() { return failure; }

    @Override
    public String toString() {
        return success
                ? "WebhookResult{success, source='" + source + "', event='" + event + "'}"
                : "WebhookResult{" + failure + ", source='" + source + "', error='" + error + "'}";
    }
}
