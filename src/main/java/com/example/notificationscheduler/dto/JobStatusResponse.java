package com.example.notificationscheduler.dto;

import com.example.notificationscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Point-in-time view of a scheduled job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {

    private String name;
    private String description;
    private String schedule;
    private JobStatus status;

    /**
     * False while the job is paused or the scheduler is stopped
     */
    private boolean bound;

    private Instant lastRun;
    private Instant nextRun;
    private String lastError;
    private Long lastDurationMs;
    private long runCount;
    private long failureCount;

    /**
     * Ticks or triggers dropped because an execution was still running
     */
    private long skippedRuns;

    private Instant registeredAt;
}
