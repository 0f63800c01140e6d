package com.example.notificationscheduler.service.clock;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Time source for the job scheduler.
 * <p>
 * Provides the current instant and fires callbacks at future instants. The
 * production implementation delegates to a Spring {@code TaskScheduler};
 * tests substitute a manually advanced clock.
 */
public interface SchedulerClock {

    /**
     * Current instant
     */
    Instant now();

    /**
     * Zone used to evaluate cron expressions
     */
    ZoneId zone();

    /**
     * Run {@code callback} once at {@code time}. A time in the past fires as
     * soon as possible.
     *
     * @return handle that cancels the callback if it has not fired yet
     */
    Registration scheduleAt(Instant time, Runnable callback);

    /**
     * Handle for a pending callback
     */
    interface Registration {

        /**
         * Cancel the callback. No-op if it already fired. Never interrupts a
         * callback that is running.
         */
        void cancel();
    }
}
