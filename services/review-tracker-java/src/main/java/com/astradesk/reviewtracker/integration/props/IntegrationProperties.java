package com.astradesk.reviewtracker.integration.props;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties describing how the tracker talks to Jira.
 *
 * <p>The structure mirrors {@code application.yml}. Validation ensures missing critical
 * settings are caught at startup instead of failing during the first review.</p>
 */
@Validated
@ConfigurationProperties(prefix = "integration")
public class IntegrationProperties {

    @Valid
    @NestedConfigurationProperty
    private final JiraProperties jira = new JiraProperties();

    public JiraProperties getJira() {
        return jira;
    }

    public static class JiraProperties {

        /**
         * Kill switch; with Jira disabled only caller-supplied histories can be analysed.
         */
        private boolean enabled = true;

        @NotBlank
        private String baseUrl = "https://example.atlassian.net";

        @NotBlank
        private String username = "jira-bot@example.com";

        @NotBlank
        private String apiToken = "changeme";

        /**
         * Changelog entries requested per page. Jira Cloud caps this at 100.
         */
        @Min(1)
        @Max(100)
        private int pageSize = 100;

        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getApiToken() {
            return apiToken;
        }

        public void setApiToken(String apiToken) {
            this.apiToken = apiToken;
        }

        public int getPageSize() {
            return pageSize;
        }

        public void setPageSize(int pageSize) {
            this.pageSize = pageSize;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }
}
