package com.nchat.connectors.model;

/** Catalog grouping used by the integrations UI. */
public enum IntegrationCategory {
    CALENDAR,
    TICKETING,
    CI_CD,
    DOCS,
    CRM,
    CHAT,
    CUSTOM
}
