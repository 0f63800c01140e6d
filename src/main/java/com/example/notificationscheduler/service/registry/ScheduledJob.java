package com.example.notificationscheduler.service.registry;

import com.example.notificationscheduler.domain.enums.JobStatus;
import com.example.notificationscheduler.service.clock.CronSchedule;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory record of a named recurring job.
 * <p>
 * Status moves through {@code IDLE|COMPLETED|FAILED -> RUNNING -> COMPLETED|FAILED}.
 * The transition into {@code RUNNING} is a compare-and-set, so at most one
 * execution of a job is ever in flight. All other mutations (schedule, clock
 * binding, outcome recording) synchronize on the record itself.
 * <p>
 * A job is "paused" when it holds no clock binding. Pausing never changes
 * {@link #getStatus()}.
 */
public class ScheduledJob {

    @Getter
    private final String name;

    @Getter
    private final String description;

    @Getter
    private final JobTask task;

    @Getter
    private final Instant registeredAt;

    @Getter
    private final long sequence;

    private final AtomicReference<JobStatus> status = new AtomicReference<>(JobStatus.IDLE);

    private final AtomicLong runCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicLong skippedRuns = new AtomicLong();

    private volatile CronSchedule cronSchedule;

    @Getter
    private volatile Instant lastRun;

    @Getter
    private volatile Instant nextRun;

    @Getter
    private volatile String lastError;

    @Getter
    private volatile Long lastDurationMs;

    // === Clock binding, guarded by this ===

    private SchedulerClock.Registration binding;
    private long bindingGeneration;

    public ScheduledJob(String name, String description, CronSchedule cronSchedule, JobTask task,
                        Instant registeredAt, long sequence) {
        this.name = name;
        this.description = description;
        this.cronSchedule = cronSchedule;
        this.task = task;
        this.registeredAt = registeredAt;
        this.sequence = sequence;
    }

    public JobStatus getStatus() {
        return status.get();
    }

    public CronSchedule getCronSchedule() {
        return cronSchedule;
    }

    /**
     * Cron expression text
     */
    public String getSchedule() {
        return cronSchedule.getExpression();
    }

    public long getRunCount() {
        return runCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getSkippedRuns() {
        return skippedRuns.get();
    }

    // === Execution lifecycle ===

    /**
     * Move to RUNNING if no execution is in flight.
     *
     * @return false if the job is already running
     */
    public boolean tryStart(Instant startedAt) {
        var current = status.get();
        while (current.canStart()) {
            if (status.compareAndSet(current, JobStatus.RUNNING)) {
                lastRun = startedAt;
                runCount.incrementAndGet();
                return true;
            }
            current = status.get();
        }
        return false;
    }

    /**
     * Record a successful execution. Status is published last.
     */
    public synchronized void markCompleted(long durationMs) {
        lastError = null;
        lastDurationMs = durationMs;
        status.set(JobStatus.COMPLETED);
    }

    /**
     * Record a failed execution. Status is published last.
     */
    public synchronized void markFailed(String error, long durationMs) {
        lastError = error;
        lastDurationMs = durationMs;
        failureCount.incrementAndGet();
        status.set(JobStatus.FAILED);
    }

    /**
     * Count a tick or trigger dropped because an execution was in flight
     */
    public long recordSkip() {
        return skippedRuns.incrementAndGet();
    }

    // === Schedule and binding ===

    public synchronized void updateSchedule(CronSchedule newSchedule) {
        this.cronSchedule = newSchedule;
    }

    public synchronized boolean isBound() {
        return binding != null;
    }

    /**
     * Reserve a generation for a new binding. Callbacks carrying an older
     * generation are stale.
     */
    public synchronized long nextBindingGeneration() {
        return ++bindingGeneration;
    }

    public synchronized boolean isCurrentBinding(long generation) {
        return binding != null && bindingGeneration == generation;
    }

    /**
     * Install the clock registration for the next occurrence
     */
    public synchronized void attachBinding(long generation, SchedulerClock.Registration registration, Instant nextRun) {
        if (generation != bindingGeneration) {
            registration.cancel();
            return;
        }
        if (binding != null && binding != registration) {
            binding.cancel();
        }
        this.binding = registration;
        this.nextRun = nextRun;
    }

    /**
     * Cancel the pending clock registration, if any.
     *
     * @return true if the job was bound
     */
    public synchronized boolean detachBinding() {
        bindingGeneration++;
        nextRun = null;
        if (binding == null) {
            return false;
        }
        binding.cancel();
        binding = null;
        return true;
    }
}
