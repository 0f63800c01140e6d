package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.service.retry.NotificationRetryCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sweeps the notification retry queue every five minutes
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FailedNotificationRetryJob implements ScheduledJobDefinition {

    public static final String JOB_NAME = "process-failed-notifications";

    private final NotificationRetryCoordinator retryCoordinator;

    @Override
    public String getJobName() {
        return JOB_NAME;
    }

    @Override
    public String getDefaultSchedule() {
        return "*/5 * * * *";
    }

    @Override
    public String getDescription() {
        return "Retry delivery of failed notifications that are due";
    }

    @Override
    public void run() {
        var result = retryCoordinator.processFailedNotifications();
        if (result.isSkipped()) {
            log.info("Another retry sweep is still running, nothing to do");
        } else if (result.getProcessed() > 0) {
            log.info("Processed {} failed notifications: {} delivered, {} rescheduled, {} exhausted",
                    result.getProcessed(), result.getSuccessful(), result.getScheduled(), result.getExhausted());
        }
    }
}
