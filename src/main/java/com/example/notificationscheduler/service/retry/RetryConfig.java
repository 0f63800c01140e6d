package com.example.notificationscheduler.service.retry;

import lombok.Builder;
import lombok.Value;

/**
 * Backoff parameters for notification retries.
 * <p>
 * Immutable; the builder rejects values that would make the backoff
 * degenerate.
 */
@Value
public class RetryConfig {

    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_INITIAL_DELAY_MS = 5 * 60 * 1000L;
    public static final long DEFAULT_MAX_DELAY_MS = 24 * 60 * 60 * 1000L;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    /**
     * Attempts after which a notification is exhausted
     */
    int maxRetries;

    long initialDelayMs;

    long maxDelayMs;

    double backoffMultiplier;

    /**
     * Upper bound of the random extra delay, as a fraction of the computed delay
     */
    double jitterRatio;

    @Builder(toBuilder = true)
    private RetryConfig(Integer maxRetries, Long initialDelayMs, Long maxDelayMs, Double backoffMultiplier,
                        Double jitterRatio) {
        this.maxRetries = maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
        this.initialDelayMs = initialDelayMs != null ? initialDelayMs : DEFAULT_INITIAL_DELAY_MS;
        this.maxDelayMs = maxDelayMs != null ? maxDelayMs : DEFAULT_MAX_DELAY_MS;
        this.backoffMultiplier = backoffMultiplier != null ? backoffMultiplier : DEFAULT_BACKOFF_MULTIPLIER;
        this.jitterRatio = jitterRatio != null ? jitterRatio : 0.0;

        if (this.maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive: " + this.maxRetries);
        }
        if (this.initialDelayMs <= 0) {
            throw new IllegalArgumentException("initialDelayMs must be positive: " + this.initialDelayMs);
        }
        if (this.maxDelayMs < this.initialDelayMs) {
            throw new IllegalArgumentException(
                    "maxDelayMs (" + this.maxDelayMs + ") must not be below initialDelayMs (" + this.initialDelayMs + ")");
        }
        if (!(this.backoffMultiplier > 1.0)) {
            throw new IllegalArgumentException("backoffMultiplier must be greater than 1: " + this.backoffMultiplier);
        }
        if (this.jitterRatio < 0.0 || this.jitterRatio >= 1.0) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1): " + this.jitterRatio);
        }
    }

    public static RetryConfig defaults() {
        return RetryConfig.builder().build();
    }
}
