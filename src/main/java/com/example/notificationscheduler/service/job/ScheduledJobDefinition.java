package com.example.notificationscheduler.service.job;

/**
 * A recurring job contributed as a Spring bean.
 * <p>
 * Definitions are picked up at startup and registered with the scheduler
 * under {@link #getJobName()}. Implementations should:
 * - Be stateless between runs
 * - Throw on failure rather than returning a status
 * - Not catch and hide their own errors
 */
public interface ScheduledJobDefinition {

    /**
     * Unique job name, e.g. {@code process-failed-notifications}
     */
    String getJobName();

    /**
     * 5-field cron expression used unless overridden in configuration
     */
    String getDefaultSchedule();

    default String getDescription() {
        return null;
    }

    /**
     * Run one occurrence of the job
     */
    void run() throws Exception;
}
