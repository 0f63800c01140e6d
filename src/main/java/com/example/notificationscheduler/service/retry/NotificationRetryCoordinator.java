package com.example.notificationscheduler.service.retry;

import com.example.notificationscheduler.config.MetricsConfig;
import com.example.notificationscheduler.domain.entity.RetryableNotification;
import com.example.notificationscheduler.domain.enums.NotificationStatus;
import com.example.notificationscheduler.domain.repository.RetryableNotificationRepository;
import com.example.notificationscheduler.dto.RetryProcessingResult;
import com.example.notificationscheduler.exception.NotificationDeliveryException;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import com.example.notificationscheduler.service.executor.JobExecutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sweeps the retry queue and re-attempts every due notification once.
 * <p>
 * Per notification:
 * - Delivered: status DELIVERED, error cleared
 * - Failed, attempts left: status RETRYING, next attempt after backoff
 * - Failed, no attempts left: status EXHAUSTED, never picked up again
 * <p>
 * Each row is saved on its own, so one row failing to persist does not
 * affect the others.
 * <p>
 * At most one sweep runs at a time per coordinator, whichever path starts it.
 * A sweep requested while another is in flight returns a skipped result.
 */
@Slf4j
public class NotificationRetryCoordinator {

    private final RetryableNotificationRepository notificationRepository;
    private final NotificationTransport transport;
    private final BackoffPolicy backoffPolicy;
    private final SchedulerClock clock;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final int batchSize;

    private final AtomicBoolean sweeping = new AtomicBoolean(false);

    public NotificationRetryCoordinator(RetryableNotificationRepository notificationRepository,
                                        NotificationTransport transport,
                                        BackoffPolicy backoffPolicy,
                                        SchedulerClock clock,
                                        MetricsConfig metricsConfig,
                                        SlackAlertService slackAlertService,
                                        int batchSize) {
        this.notificationRepository = notificationRepository;
        this.transport = transport;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
        this.metricsConfig = metricsConfig;
        this.slackAlertService = slackAlertService;
        this.batchSize = batchSize;
    }

    /**
     * Attempt delivery of every notification whose next attempt is due.
     *
     * @return counters for this sweep; all zero if nothing was due, flagged
     * skipped if another sweep was already running
     */
    public RetryProcessingResult processFailedNotifications() {
        if (!sweeping.compareAndSet(false, true)) {
            log.info("Retry sweep already in progress, skipping");
            return RetryProcessingResult.skipped();
        }
        try {
            return sweep();
        } finally {
            sweeping.set(false);
        }
    }

    public RetryConfig getRetryConfig() {
        return backoffPolicy.getConfig();
    }

    private RetryProcessingResult sweep() {
        var now = clock.now();
        var due = notificationRepository.findDueForRetry(NotificationStatus.RETRYABLE, now, PageRequest.of(0, batchSize));

        if (due.isEmpty()) {
            log.debug("No notifications due for retry");
            return RetryProcessingResult.empty();
        }

        log.info("Processing {} notifications due for retry", due.size());
        var result = RetryProcessingResult.empty();
        result.setProcessed(due.size());

        for (var notification : due) {
            var outcome = attempt(notification, now);
            if (!persist(notification)) {
                continue;
            }
            switch (outcome) {
                case DELIVERED -> {
                    result.setSuccessful(result.getSuccessful() + 1);
                    metricsConfig.recordNotificationDelivered();
                }
                case RETRYING -> {
                    result.setScheduled(result.getScheduled() + 1);
                    metricsConfig.recordNotificationRetryScheduled(notification.getAttemptCount());
                }
                case EXHAUSTED -> {
                    result.setExhausted(result.getExhausted() + 1);
                    metricsConfig.recordNotificationExhausted();
                    slackAlertService.sendNotificationExhaustedAlert(notification);
                }
                default -> throw new IllegalStateException("Unexpected retry outcome: " + outcome);
            }
        }

        log.info("Retry sweep finished: processed={}, delivered={}, rescheduled={}, exhausted={}",
                result.getProcessed(), result.getSuccessful(), result.getScheduled(), result.getExhausted());
        return result;
    }

    /**
     * Try one delivery and apply the resulting transition to the entity
     */
    private NotificationStatus attempt(RetryableNotification notification, Instant now) {
        try {
            transport.deliver(notification);
            notification.markDelivered(now);
            log.info("Notification {} delivered on retry", notification.getId());
            return NotificationStatus.DELIVERED;
        } catch (NotificationDeliveryException | RuntimeException e) {
            return recordFailure(notification, now, JobExecutionResult.describe(e));
        }
    }

    private NotificationStatus recordFailure(RetryableNotification notification, Instant now, String error) {
        var maxRetries = backoffPolicy.getConfig().getMaxRetries();
        var attempts = Math.min(notification.getAttemptCount() + 1, maxRetries);

        if (attempts >= maxRetries) {
            notification.markExhausted(attempts, now, error);
            log.warn("Notification {} exhausted after {} attempts: {}", notification.getId(), attempts, error);
            return NotificationStatus.EXHAUSTED;
        }

        var nextAttemptAt = now.plusMillis(backoffPolicy.delayMs(attempts));
        notification.markRetrying(attempts, nextAttemptAt, error);
        log.warn("Notification {} failed attempt {}/{}, next attempt at {}: {}",
                notification.getId(), attempts, maxRetries, nextAttemptAt, error);
        return NotificationStatus.RETRYING;
    }

    private boolean persist(RetryableNotification notification) {
        try {
            notificationRepository.save(notification);
            return true;
        } catch (DataAccessException e) {
            log.error("Failed to persist retry state for notification {}: {}", notification.getId(), e.getMessage(), e);
            return false;
        }
    }
}
