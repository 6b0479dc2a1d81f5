package com.nchat.webhooks.model;

/**
 * Source identifiers that {@link com.nchat.webhooks.parser.WebhookParser}
 * recognizes from request headers. Register a
 * {@link com.nchat.webhooks.handler.WebhookHandler} under one of these, or
 * under any custom value a sender puts in {@code x-webhook-source}.
 */
public final class WebhookSource {

    private WebhookSource() {}

    public static final String GITHUB  = "github";
    public static final String SLACK   = "slack";
    public static final String JIRA    = "jira";
    public static final String UNKNOWN = "unknown";

    // ---------------------------------------------------------------
    // Fingerprint headers (lowercase)
    // ---------------------------------------------------------------
    public static final String GITHUB_EVENT_HEADER   = "x-github-event";
    public static final String SLACK_SIGNATURE_HEADER = "x-slack-signature";
    public static final String JIRA_IDENTIFIER_HEADER = "x-atlassian-webhook-identifier";
    public static final String CUSTOM_SOURCE_HEADER  = "x-webhook-source";
    public static final String CUSTOM_EVENT_HEADER   = "x-webhook-event";
}
