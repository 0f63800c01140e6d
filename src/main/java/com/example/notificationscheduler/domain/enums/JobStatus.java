package com.example.notificationscheduler.domain.enums;

/**
 * Lifecycle status of an in-memory scheduled job.
 * <p>
 * Pausing is not a status: a paused job keeps its last known status and is
 * simply not bound to the clock.
 */
public enum JobStatus {

    /**
     * Registered, never executed.
     */
    IDLE,

    /**
     * An execution is in flight. Ticks arriving in this state are skipped.
     */
    RUNNING,

    /**
     * Last execution finished without error.
     */
    COMPLETED,

    /**
     * Last execution threw.
     */
    FAILED;

    /**
     * Whether a new execution may start from this status
     */
    public boolean canStart() {
        return this != RUNNING;
    }
}
