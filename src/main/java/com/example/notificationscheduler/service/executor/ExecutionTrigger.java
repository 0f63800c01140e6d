package com.example.notificationscheduler.service.executor;

/**
 * What started a job execution
 */
public enum ExecutionTrigger {

    /**
     * Cron tick from the clock
     */
    SCHEDULED,

    /**
     * Out-of-band trigger through the API
     */
    MANUAL;

    public String tag() {
        return name().toLowerCase();
    }
}
