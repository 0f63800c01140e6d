package com.example.notificationscheduler.service.scheduler;

import com.example.notificationscheduler.dto.JobStatusResponse;
import com.example.notificationscheduler.dto.JobTriggerResult;
import com.example.notificationscheduler.mapper.JobMapper;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import com.example.notificationscheduler.service.executor.ExecutionTrigger;
import com.example.notificationscheduler.service.executor.JobExecutionResult;
import com.example.notificationscheduler.service.executor.JobExecutor;
import com.example.notificationscheduler.service.registry.JobRegistry;
import com.example.notificationscheduler.service.registry.JobTask;
import com.example.notificationscheduler.service.registry.ScheduledJob;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Binds registered jobs to the clock and exposes manual control over them.
 * <p>
 * Each bound job holds one clock registration for its next cron occurrence.
 * When it fires, the following occurrence is armed first (so {@code nextRun}
 * never drifts) and the job is then dispatched to the {@link JobExecutor}.
 * The scheduler never waits for a job to finish.
 * <p>
 * Operations on one job serialize on that job's record; operations on
 * different jobs are independent.
 */
@Slf4j
public class NotificationJobScheduler {

    private final JobRegistry jobRegistry;
    private final JobExecutor jobExecutor;
    private final SchedulerClock clock;
    private final JobMapper jobMapper;

    private final AtomicBoolean started = new AtomicBoolean(false);

    public NotificationJobScheduler(JobRegistry jobRegistry, JobExecutor jobExecutor, SchedulerClock clock,
                                    JobMapper jobMapper) {
        this.jobRegistry = jobRegistry;
        this.jobExecutor = jobExecutor;
        this.clock = clock;
        this.jobMapper = jobMapper;
    }

    // === Registration ===

    /**
     * Register a job. If the scheduler has already been started, the job is
     * bound to the clock right away.
     *
     * @throws com.example.notificationscheduler.exception.DuplicateJobException if the name is taken
     */
    public void registerJob(String name, String cronExpression, JobTask task) {
        registerJob(name, cronExpression, task, null);
    }

    public void registerJob(String name, String cronExpression, JobTask task, String description) {
        var job = jobRegistry.register(name, cronExpression, task, description);
        if (started.get()) {
            synchronized (job) {
                if (!job.isBound()) {
                    arm(job);
                }
            }
        }
    }

    // === Bulk binding ===

    /**
     * Bind every unbound job to the clock. Already bound jobs are left alone.
     */
    public void startAllJobs() {
        started.set(true);
        var bound = 0;
        for (var job : jobRegistry.list()) {
            synchronized (job) {
                if (job.isBound()) {
                    continue;
                }
                arm(job);
                bound++;
            }
            log.info("Started job: {} (next run {})", job.getName(), job.getNextRun());
        }
        log.info("{} of {} jobs newly bound to the clock", bound, jobRegistry.size());
    }

    /**
     * Detach every job from the clock. Executions in flight run to completion.
     */
    public void stopAllJobs() {
        log.info("Stopping all scheduled jobs...");
        started.set(false);
        for (var job : jobRegistry.list()) {
            if (job.detachBinding()) {
                log.info("Stopped job: {}", job.getName());
            }
        }
        log.info("All jobs stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    // === Per-job control ===

    /**
     * Stop producing ticks for a job. Its last known status is kept.
     *
     * @return true if the job was bound, false if it was already paused
     * @throws com.example.notificationscheduler.exception.JobNotFoundException for unknown names
     */
    public boolean pauseJob(String name) {
        var job = jobRegistry.get(name);
        if (!job.detachBinding()) {
            log.debug("Job {} is already paused", name);
            return false;
        }
        log.info("Paused job: {}", name);
        return true;
    }

    /**
     * Rebind a paused job using its stored schedule. The next run is computed
     * from now; missed occurrences are not replayed.
     *
     * @return true if the job was rebound, false if it was already bound
     * @throws com.example.notificationscheduler.exception.JobNotFoundException for unknown names
     */
    public boolean resumeJob(String name) {
        var job = jobRegistry.get(name);
        synchronized (job) {
            if (job.isBound()) {
                log.debug("Job {} is already running on its schedule", name);
                return false;
            }
            arm(job);
        }
        log.info("Resumed job: {} (next run {})", name, job.getNextRun());
        return true;
    }

    /**
     * Replace a job's schedule and rebind it if it was bound. Run history is kept.
     *
     * @throws com.example.notificationscheduler.exception.JobNotFoundException           for unknown names
     * @throws com.example.notificationscheduler.exception.InvalidCronExpressionException for a bad expression
     */
    public boolean updateJobSchedule(String name, String newCronExpression) {
        var job = jobRegistry.get(name);
        synchronized (job) {
            jobRegistry.updateSchedule(name, newCronExpression);
            if (job.detachBinding()) {
                arm(job);
            }
        }
        log.info("Updated job schedule: {} -> {}", name, newCronExpression);
        return true;
    }

    /**
     * Run a job now, outside its schedule, and wait for the outcome. The
     * cron-derived next run is left untouched.
     *
     * @throws com.example.notificationscheduler.exception.JobNotFoundException for unknown names
     */
    public JobTriggerResult triggerJob(String name) {
        return triggerJobAsync(name).join();
    }

    /**
     * Asynchronous form of {@link #triggerJob}
     */
    public CompletableFuture<JobTriggerResult> triggerJobAsync(String name) {
        var job = jobRegistry.get(name);
        log.info("Manually triggering job: {}", name);
        return jobExecutor.execute(job, ExecutionTrigger.MANUAL).thenApply(this::toTriggerResult);
    }

    // === Status ===

    public List<JobStatusResponse> getJobsStatus() {
        return jobRegistry.list().stream().map(this::snapshot).toList();
    }

    public Optional<JobStatusResponse> getJobStatus(String name) {
        return jobRegistry.find(name).map(this::snapshot);
    }

    // === Clock binding ===

    /**
     * Arm the next occurrence after now. Caller holds the job's monitor.
     */
    private void arm(ScheduledJob job) {
        armAfter(job, clock.now());
    }

    private void armAfter(ScheduledJob job, Instant after) {
        var next = job.getCronSchedule().next(after, clock.zone());
        if (next == null) {
            log.warn("Job {} has no future occurrence for schedule {}", job.getName(), job.getSchedule());
            job.detachBinding();
            return;
        }
        var generation = job.nextBindingGeneration();
        var registration = clock.scheduleAt(next, () -> onTick(job, generation));
        job.attachBinding(generation, registration, next);
    }

    private void onTick(ScheduledJob job, long generation) {
        synchronized (job) {
            if (!job.isCurrentBinding(generation)) {
                log.debug("Ignoring stale tick for job {}", job.getName());
                return;
            }
            var firedFor = job.getNextRun();
            var now = clock.now();
            armAfter(job, firedFor != null && firedFor.isAfter(now) ? firedFor : now);
        }
        jobExecutor.execute(job, ExecutionTrigger.SCHEDULED);
    }

    private JobStatusResponse snapshot(ScheduledJob job) {
        synchronized (job) {
            return jobMapper.toResponse(job);
        }
    }

    private JobTriggerResult toTriggerResult(JobExecutionResult result) {
        if (result.isSuccess()) {
            return JobTriggerResult.success(result.getJobName());
        }
        return result.isSkipped()
                ? JobTriggerResult.skipped(result.getJobName(), result.getErrorMessage())
                : JobTriggerResult.failure(result.getJobName(), result.getErrorMessage());
    }
}
