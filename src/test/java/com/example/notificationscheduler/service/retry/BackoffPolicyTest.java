package com.example.notificationscheduler.service.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffPolicy Tests")
class BackoffPolicyTest {

    private final RetryConfig defaults = RetryConfig.defaults();

    @Test
    @DisplayName("Should double the delay from five minutes")
    void shouldDoubleDelay() {
        var policy = new BackoffPolicy(defaults);

        assertThat(policy.delayMs(1)).isEqualTo(300_000L);
        assertThat(policy.delayMs(2)).isEqualTo(600_000L);
        assertThat(policy.delayMs(3)).isEqualTo(1_200_000L);
    }

    @Test
    @DisplayName("Should cap the delay at the maximum")
    void shouldCapDelay() {
        var policy = new BackoffPolicy(defaults);

        // 300000 * 2^9 = 153600000 > 24h
        assertThat(policy.delayMs(10)).isEqualTo(86_400_000L);
        assertThat(policy.delayMs(100)).isEqualTo(86_400_000L);
    }

    @Test
    @DisplayName("Should never decrease as attempts grow")
    void shouldBeMonotonic() {
        var policy = new BackoffPolicy(RetryConfig.builder()
                .initialDelayMs(1_000L)
                .maxDelayMs(60_000L)
                .backoffMultiplier(1.5)
                .build());

        var previous = 0L;
        for (var attempt = 1; attempt <= 30; attempt++) {
            var delay = policy.delayMs(attempt);
            assertThat(delay).isGreaterThanOrEqualTo(previous).isLessThanOrEqualTo(60_000L);
            previous = delay;
        }
    }

    @Test
    @DisplayName("Should add jitter within the configured ratio")
    void shouldAddJitter() {
        var config = defaults.toBuilder().jitterRatio(0.1).build();

        assertThat(new BackoffPolicy(config, () -> 0.0).delayMs(1)).isEqualTo(300_000L);
        assertThat(new BackoffPolicy(config, () -> 0.5).delayMs(1)).isEqualTo(315_000L);
        assertThat(new BackoffPolicy(config, () -> 0.999).delayMs(1)).isLessThan(330_000L);
    }

    @Test
    @DisplayName("Should reject attempt counts below one")
    void shouldRejectAttemptBelowOne() {
        var policy = new BackoffPolicy(defaults);

        assertThatThrownBy(() -> policy.delayMs(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.delayMs(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
