package com.example.notificationscheduler.config;

import com.example.notificationscheduler.service.retry.RetryConfig;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the notification retry queue
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notification-retry")
public class NotificationRetryProperties {

    /**
     * Failed attempts after which a notification is exhausted
     */
    @Min(1)
    private int maxRetries = RetryConfig.DEFAULT_MAX_RETRIES;

    private Duration initialDelay = Duration.ofMillis(RetryConfig.DEFAULT_INITIAL_DELAY_MS);

    private Duration maxDelay = Duration.ofMillis(RetryConfig.DEFAULT_MAX_DELAY_MS);

    @DecimalMin(value = "1.0", inclusive = false)
    private double backoffMultiplier = RetryConfig.DEFAULT_BACKOFF_MULTIPLIER;

    /**
     * Random extra delay as a fraction of the computed delay. 0 disables jitter.
     */
    @DecimalMin("0.0")
    private double jitterRatio = 0.0;

    /**
     * Maximum notifications picked up per sweep
     */
    @Min(1)
    private int batchSize = 100;

    public RetryConfig toRetryConfig() {
        return RetryConfig.builder()
                .maxRetries(maxRetries)
                .initialDelayMs(initialDelay.toMillis())
                .maxDelayMs(maxDelay.toMillis())
                .backoffMultiplier(backoffMultiplier)
                .jitterRatio(jitterRatio)
                .build();
    }
}
