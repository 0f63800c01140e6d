package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.service.retry.RetryStatisticsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs a retry queue summary every six hours
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetryStatisticsReportJob implements ScheduledJobDefinition {

    public static final String JOB_NAME = "retry-statistics";

    private final RetryStatisticsService statisticsService;

    @Override
    public String getJobName() {
        return JOB_NAME;
    }

    @Override
    public String getDefaultSchedule() {
        return "0 */6 * * *";
    }

    @Override
    public String getDescription() {
        return "Log notification retry statistics";
    }

    @Override
    public void run() {
        var stats = statisticsService.getRetryStatistics();
        log.info("Notification retry statistics: failed={}, retried={}, avgRetries={}, successRate={}, pending={}",
                stats.getTotalFailed(), stats.getTotalRetried(), stats.getAverageRetries(),
                String.format("%.1f%%", stats.getSuccessRate() * 100), stats.getPendingCount());
    }
}
