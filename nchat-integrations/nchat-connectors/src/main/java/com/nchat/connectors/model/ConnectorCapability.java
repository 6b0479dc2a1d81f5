package com.nchat.connectors.model;

/** What a provider adapter can do once connected. */
public enum ConnectorCapability {
    /** Fetch records from the provider. */
    READ,
    /** Create or update records in the provider. */
    WRITE,
    /** Receive provider events, usually via webhooks. */
    SUBSCRIBE,
    /** Full-text or structured search. */
    SEARCH,
    /** Push notifications into chat channels. */
    NOTIFY
}
