package com.example.notificationscheduler.service.job;

import com.example.notificationscheduler.dto.RetryProcessingResult;
import com.example.notificationscheduler.dto.RetryStatistics;
import com.example.notificationscheduler.service.clock.CronSchedule;
import com.example.notificationscheduler.service.retry.NotificationRetryCoordinator;
import com.example.notificationscheduler.service.retry.RetryStatisticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Built-in Job Tests")
class BuiltInJobsTest {

    @Mock
    private NotificationRetryCoordinator retryCoordinator;

    @Mock
    private RetryStatisticsService statisticsService;

    @InjectMocks
    private FailedNotificationRetryJob retryJob;

    @InjectMocks
    private RetryStatisticsReportJob statisticsJob;

    @Test
    @DisplayName("Retry job should sweep the queue every five minutes")
    void retryJobShouldSweepQueue() {
        // Given
        when(retryCoordinator.processFailedNotifications())
                .thenReturn(new RetryProcessingResult(2, 1, 1, 0));

        // When
        retryJob.run();

        // Then
        verify(retryCoordinator).processFailedNotifications();
        assertThat(retryJob.getJobName()).isEqualTo("process-failed-notifications");
        assertThat(retryJob.getDefaultSchedule()).isEqualTo("*/5 * * * *");
        assertThat(CronSchedule.parse(retryJob.getDefaultSchedule()).getExpression()).isEqualTo("*/5 * * * *");
    }

    @Test
    @DisplayName("Retry job should complete quietly when another sweep is running")
    void retryJobShouldToleratePendingSweep() {
        // Given
        when(retryCoordinator.processFailedNotifications()).thenReturn(RetryProcessingResult.skipped());

        // When
        retryJob.run();

        // Then
        verify(retryCoordinator).processFailedNotifications();
    }

    @Test
    @DisplayName("Statistics job should read statistics every six hours")
    void statisticsJobShouldReadStatistics() {
        // Given
        when(statisticsService.getRetryStatistics()).thenReturn(RetryStatistics.builder()
                .totalFailed(4).totalRetried(8).averageRetries(2.0).successRate(0.75).build());

        // When
        statisticsJob.run();

        // Then
        verify(statisticsService).getRetryStatistics();
        assertThat(statisticsJob.getJobName()).isEqualTo("retry-statistics");
        assertThat(statisticsJob.getDefaultSchedule()).isEqualTo("0 */6 * * *");
        assertThat(CronSchedule.parse(statisticsJob.getDefaultSchedule()).getExpression()).isEqualTo("0 */6 * * *");
    }
}
