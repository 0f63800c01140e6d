package com.example.notificationscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters from one sweep of the retry queue
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryProcessingResult {

    /**
     * Rows picked up as due
     */
    private int processed;

    private int successful;

    /**
     * Rows that failed again and got a later attempt
     */
    private int scheduled;

    /**
     * Rows that failed their last allowed attempt
     */
    private int exhausted;

    /**
     * Another sweep was running, so this one did nothing
     */
    private boolean skipped;

    public RetryProcessingResult(int processed, int successful, int scheduled, int exhausted) {
        this(processed, successful, scheduled, exhausted, false);
    }

    public static RetryProcessingResult empty() {
        return new RetryProcessingResult(0, 0, 0, 0);
    }

    public static RetryProcessingResult skipped() {
        return RetryProcessingResult.builder().skipped(true).build();
    }
}
