package com.example.notificationscheduler.service.retry;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff: {@code min(maxDelay, initialDelay * multiplier^(n-1))}
 * for the n-th failed attempt, plus optional jitter.
 */
public class BackoffPolicy {

    private final RetryConfig config;
    private final DoubleSupplier random;

    public BackoffPolicy(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1), only consulted when jitter is enabled
     */
    public BackoffPolicy(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Delay before the next attempt, given the number of failed attempts so far.
     *
     * @param attemptCount failed attempts, at least 1
     */
    public long delayMs(int attemptCount) {
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be at least 1: " + attemptCount);
        }
        var raw = config.getInitialDelayMs() * Math.pow(config.getBackoffMultiplier(), attemptCount - 1);
        var capped = (long) Math.min((double) config.getMaxDelayMs(), raw);

        if (config.getJitterRatio() == 0.0) {
            return capped;
        }
        var jitter = (long) (capped * config.getJitterRatio() * random.getAsDouble());
        return capped + jitter;
    }

    public RetryConfig getConfig() {
        return config;
    }
}
