package com.example.notificationscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Notification Scheduler Application
 * <p>
 * Runs the farm platform's recurring notification jobs on cron schedules
 * and retries failed notifications with exponential backoff.
 * <p>
 * Features:
 * - Per-job pause, resume, trigger and reschedule through the REST API
 * - Overlapping runs of the same job are skipped and counted
 * - Retry queue with capped exponential backoff and statistics
 * - Optional Slack alerting for exhausted notifications and failed jobs
 */
@EnableScheduling
@SpringBootApplication
public class NotificationSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotificationSchedulerApplication.class, args);
    }
}
