package com.example.notificationscheduler.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Slack configuration properties
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slack")
public class SlackProperties {
    private String webhookUrl;
    private String channel = "#farm-notifications";
    private boolean enabled = false;

    /**
     * Alert when a notification runs out of retries
     */
    private boolean alertOnExhaustion = false;

    /**
     * Alert when a scheduled job fails
     */
    private boolean alertOnJobFailure = false;

    private String dashboardBaseUrl = "http://localhost:8080";

    public boolean isConfigured() {
        return enabled && webhookUrl != null && !webhookUrl.isBlank();
    }
}
