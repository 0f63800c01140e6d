package com.example.notificationscheduler.service.executor;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Outcome of one dispatch of a job to the executor.
 */
@Data
@Builder
public class JobExecutionResult {

    private String jobName;

    private ExecutionTrigger trigger;

    /**
     * Whether the task ran and returned normally
     */
    private boolean success;

    /**
     * Whether the dispatch was dropped because the job was already running
     */
    private boolean skipped;

    /**
     * Error description recorded as the job's last error
     */
    private String errorMessage;

    /**
     * Exception class name for analysis
     */
    private String errorType;

    private Instant startedAt;

    private Long durationMs;

    public static JobExecutionResult success(String jobName, ExecutionTrigger trigger, Instant startedAt, long durationMs) {
        return JobExecutionResult.builder()
                .jobName(jobName)
                .trigger(trigger)
                .success(true)
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
    }

    public static JobExecutionResult failure(String jobName, ExecutionTrigger trigger, Instant startedAt, long durationMs,
                                             Throwable error) {
        return JobExecutionResult.builder()
                .jobName(jobName)
                .trigger(trigger)
                .success(false)
                .errorMessage(describe(error))
                .errorType(error.getClass().getSimpleName())
                .startedAt(startedAt)
                .durationMs(durationMs)
                .build();
    }

    public static JobExecutionResult skipped(String jobName, ExecutionTrigger trigger) {
        return JobExecutionResult.builder()
                .jobName(jobName)
                .trigger(trigger)
                .success(false)
                .skipped(true)
                .errorMessage("Job " + jobName + " is already running")
                .build();
    }

    /**
     * Render an error as {@code SimpleName: message}
     */
    public static String describe(Throwable error) {
        if (error == null) {
            return null;
        }
        var message = error.getMessage();
        return message != null && !message.isBlank()
                ? error.getClass().getSimpleName() + ": " + message
                : error.getClass().getSimpleName();
    }
}
