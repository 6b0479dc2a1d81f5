package com.nchat.connectors.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CatalogEntryTest {

    private final CatalogEntry jira = CatalogEntry.builder("jira", IntegrationCategory.TICKETING)
            .name("Jira")
            .capability(ConnectorCapability.READ)
            .capability(ConnectorCapability.WRITE)
            .requiredConfig("siteUrl")
            .requiredConfig("projectKey")
            .requiresOAuth(true)
            .build();

    @Test
    void capabilities() {
        assertTrue(jira.supports(ConnectorCapability.WRITE));
        assertFalse(jira.supports(ConnectorCapability.NOTIFY));
        assertEquals("1.0.0", jira.getVersion());
        assertTrue(jira.isRequiresOAuth());
    }

    @Test
    void missingConfigListsAbsentAndBlankKeys() {
        ConnectorConfig config = ConnectorConfig.builder("jira-1", "jira")
                .providerConfig("siteUrl", " ")
                .build();
        assertEquals(List.of("siteUrl", "projectKey"), jira.missingConfig(config));

        ConnectorConfig complete = ConnectorConfig.builder("jira-1", "jira")
                .providerConfig("siteUrl", "https://acme.atlassian.net")
                .providerConfig("projectKey", "CHAT")
                .build();
        assertTrue(jira.missingConfig(complete).isEmpty());
    }

    @Test
    void credentialsToStringHidesTokens() {
        ConnectorCredentials creds = ConnectorCredentials.builder("secret-access").refreshToken("secret-refresh").build();
        assertFalse(creds.toString().contains("secret"));
    }

    @Test
    void statusWireNames() {
        assertEquals("rate_limited", ConnectorStatus.RATE_LIMITED.wireName());
        assertEquals("disabled", ConnectorStatus.DISABLED.wireName());
    }
}
