package com.example.notificationscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary of the notification retry queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryStatistics {

    /**
     * Notifications that left PENDING (retrying, delivered or exhausted)
     */
    private long totalFailed;

    /**
     * Sum of attempt counts over those notifications
     */
    private long totalRetried;

    /**
     * totalRetried / totalFailed, two decimals, 0 when nothing failed
     */
    private double averageRetries;

    /**
     * delivered / (delivered + exhausted), 0 when both are 0
     */
    private double successRate;

    private long pendingCount;
    private long retryingCount;
    private long deliveredCount;
    private long exhaustedCount;
    private Instant generatedAt;
}
