package com.example.notificationscheduler.service.clock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

/**
 * {@link SchedulerClock} backed by a Spring {@link TaskScheduler} and a
 * {@link Clock}.
 */
@Slf4j
public class TaskSchedulerClock implements SchedulerClock {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerClock(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public ZoneId zone() {
        return clock.getZone();
    }

    @Override
    public Registration scheduleAt(Instant time, Runnable callback) {
        log.trace("Scheduling clock callback at {}", time);
        var future = taskScheduler.schedule(callback, time);
        return () -> future.cancel(false);
    }
}
