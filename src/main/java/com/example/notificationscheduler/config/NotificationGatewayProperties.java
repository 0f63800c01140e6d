package com.example.notificationscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the notification gateway
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "external-services.notification-gateway")
public class NotificationGatewayProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8090";

    @Min(1)
    private int timeoutSeconds = 30;
}
