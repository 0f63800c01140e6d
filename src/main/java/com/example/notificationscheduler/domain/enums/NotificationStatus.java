package com.example.notificationscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;

/**
 * Delivery status of a notification in the retry queue.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationStatus {

    /**
     * Initial delivery failed; waiting for the first retry attempt.
     */
    PENDING(true),

    /**
     * At least one retry attempt failed; another attempt is scheduled.
     */
    RETRYING(true),

    /**
     * Delivered. Terminal.
     */
    DELIVERED(false),

    /**
     * All retry attempts used up. Terminal.
     */
    EXHAUSTED(false);

    /**
     * Statuses the retry coordinator picks up.
     */
    public static final List<NotificationStatus> RETRYABLE = Arrays.stream(values())
            .filter(NotificationStatus::isRetryable)
            .toList();

    private final boolean retryable;

    public boolean isTerminal() {
        return !retryable;
    }
}
