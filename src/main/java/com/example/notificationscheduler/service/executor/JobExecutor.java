package com.example.notificationscheduler.service.executor;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import com.example.notificationscheduler.service.registry.ScheduledJob;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one job's task to completion on the worker pool.
 * <p>
 * Handles:
 * - Re-entrancy guard (a running job is never started twice)
 * - Status, last run and last error bookkeeping on the job record
 * - Failure containment: task exceptions end up in the record, never in the caller
 * - Metrics and optional failure alerts
 * <p>
 * {@link #execute} returns immediately; the returned future completes when
 * the task has finished and its outcome is recorded. The future itself never
 * completes exceptionally.
 */
@Slf4j
public class JobExecutor {

    private final SchedulerClock clock;
    private final Executor workerExecutor;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;

    public JobExecutor(SchedulerClock clock, Executor workerExecutor, MetricsConfig metricsConfig,
                       SlackAlertService slackAlertService) {
        this.clock = clock;
        this.workerExecutor = workerExecutor;
        this.metricsConfig = metricsConfig;
        this.slackAlertService = slackAlertService;
    }

    /**
     * Dispatch a job execution.
     *
     * @param job     the job to run
     * @param trigger what caused this run
     * @return future of the recorded outcome; a skipped result if the job was already running
     */
    public CompletableFuture<JobExecutionResult> execute(ScheduledJob job, ExecutionTrigger trigger) {
        var jobName = job.getName();
        var startedAt = clock.now();

        if (!job.tryStart(startedAt)) {
            var skipped = job.recordSkip();
            log.warn("Skipping {} run of job {}: previous execution still running ({} skipped so far)",
                    trigger.tag(), jobName, skipped);
            metricsConfig.recordJobSkip(jobName, trigger);
            return CompletableFuture.completedFuture(JobExecutionResult.skipped(jobName, trigger));
        }

        log.info("Executing job {} ({})", jobName, trigger.tag());
        var timerSample = metricsConfig.startJobTimer();

        try {
            return CompletableFuture
                    .runAsync(() -> runTask(job), workerExecutor)
                    .handle((ignored, error) -> finish(job, trigger, startedAt, timerSample, unwrap(error)));
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected job {}: {}", jobName, e.getMessage());
            return CompletableFuture.completedFuture(finish(job, trigger, startedAt, timerSample, e));
        }
    }

    private void runTask(ScheduledJob job) {
        try {
            job.getTask().run();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }

    private JobExecutionResult finish(ScheduledJob job, ExecutionTrigger trigger, Instant startedAt,
                                      Timer.Sample timerSample, Throwable error) {
        var jobName = job.getName();
        var durationMs = Math.max(0L, Duration.between(startedAt, clock.now()).toMillis());

        if (error == null) {
            job.markCompleted(durationMs);
            metricsConfig.recordJobExecution(timerSample, jobName, trigger, true);
            log.info("Job completed: {} in {}ms", jobName, durationMs);
            return JobExecutionResult.success(jobName, trigger, startedAt, durationMs);
        }

        var result = JobExecutionResult.failure(jobName, trigger, startedAt, durationMs, error);
        job.markFailed(result.getErrorMessage(), durationMs);
        metricsConfig.recordJobExecution(timerSample, jobName, trigger, false);
        log.error("Error executing job {}: {}", jobName, result.getErrorMessage(), error);
        slackAlertService.sendJobFailureAlert(jobName, job.getSchedule(), result.getErrorMessage());
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
