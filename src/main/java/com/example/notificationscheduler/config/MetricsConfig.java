package com.example.notificationscheduler.config;

import com.example.notificationscheduler.domain.enums.NotificationStatus;
import com.example.notificationscheduler.domain.repository.RetryableNotificationRepository;
import com.example.notificationscheduler.service.executor.ExecutionTrigger;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for job execution and the notification retry queue.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job execution times, outcomes and skipped runs
 * - Retry outcomes (delivered, rescheduled, exhausted)
 * - Retry queue size by status
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final RetryableNotificationRepository notificationRepository;

    private final Map<NotificationStatus, AtomicLong> queueCounts = new EnumMap<>(NotificationStatus.class);

    @PostConstruct
    public void initializeMetrics() {
        for (var status : NotificationStatus.values()) {
            var counter = new AtomicLong(0);
            queueCounts.put(status, counter);

            Gauge.builder("notification_retry_queue", counter, AtomicLong::get)
                    .tag("status", status.name().toLowerCase())
                    .description("Number of retry-queue notifications by status")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically refresh queue gauges from the database
     */
    @Scheduled(fixedDelayString = "${notification-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var entry : queueCounts.entrySet()) {
                entry.getValue().set(notificationRepository.countByStatus(entry.getKey()));
            }
        } catch (RuntimeException e) {
            log.warn("Could not refresh retry queue gauges: {}", e.getMessage());
        }
    }

    // === Jobs ===

    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordJobExecution(Timer.Sample sample, String jobName, ExecutionTrigger trigger, boolean success) {
        sample.stop(Timer.builder("notification_scheduler_job_execution_time")
                .tag("job", jobName)
                .tag("trigger", trigger.tag())
                .tag("success", String.valueOf(success))
                .description("Job execution time")
                .register(meterRegistry));
    }

    public void recordJobSkip(String jobName, ExecutionTrigger trigger) {
        meterRegistry.counter("notification_scheduler_job_skips",
                "job", jobName,
                "trigger", trigger.tag()
        ).increment();
    }

    // === Retry queue ===

    public void recordNotificationDelivered() {
        meterRegistry.counter("notification_retry_delivered").increment();
    }

    public void recordNotificationRetryScheduled(int attemptNumber) {
        meterRegistry.counter("notification_retry_scheduled",
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordNotificationExhausted() {
        meterRegistry.counter("notification_retry_exhausted").increment();
    }
}
