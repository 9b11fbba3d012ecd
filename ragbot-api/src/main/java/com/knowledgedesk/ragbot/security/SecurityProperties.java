package com.knowledgedesk.ragbot.security;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Access to the {@code /admin} ingestion and document endpoints. The Slack events endpoint is
 * authenticated by its request signature instead and never reads these settings.
 */
@ConfigurationProperties(prefix = "ragbot.security")
public class SecurityProperties {

    /**
     * Shared bearer token operators present on admin calls. Every admin call is refused when unset.
     */
    private String staticToken;

    public String getStaticToken() {
        return staticToken;
    }

    public void setStaticToken(String staticToken) {
        this.staticToken = staticToken == null ? null : staticToken.trim();
    }

    public boolean adminEndpointsOpen() {
        return staticToken != null && !staticToken.isEmpty();
    }
}
