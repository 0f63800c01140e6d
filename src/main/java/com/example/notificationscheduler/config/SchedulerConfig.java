package com.example.notificationscheduler.config;

import com.example.notificationscheduler.domain.repository.RetryableNotificationRepository;
import com.example.notificationscheduler.mapper.JobMapper;
import com.example.notificationscheduler.service.alert.SlackAlertService;
import com.example.notificationscheduler.service.clock.SchedulerClock;
import com.example.notificationscheduler.service.clock.TaskSchedulerClock;
import com.example.notificationscheduler.service.executor.JobExecutor;
import com.example.notificationscheduler.service.job.JobDefinitionRegistry;
import com.example.notificationscheduler.service.registry.JobRegistry;
import com.example.notificationscheduler.service.retry.BackoffPolicy;
import com.example.notificationscheduler.service.retry.NotificationRetryCoordinator;
import com.example.notificationscheduler.service.retry.NotificationTransport;
import com.example.notificationscheduler.service.retry.RetryConfig;
import com.example.notificationscheduler.service.scheduler.NotificationJobScheduler;
import com.example.notificationscheduler.service.scheduler.NotificationSchedulerLifecycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the scheduler core. The core classes carry no Spring annotations so
 * they can be built directly in tests around a manual clock.
 */
@Slf4j
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock schedulerTimeSource(NotificationSchedulerProperties properties) {
        var zone = ZoneId.of(properties.getZone());
        log.info("Evaluating cron schedules in zone {}", zone);
        return Clock.system(zone);
    }

    @Bean
    public SchedulerClock schedulerClock(@Qualifier("jobClockScheduler") ThreadPoolTaskScheduler jobClockScheduler,
                                         Clock schedulerTimeSource) {
        return new TaskSchedulerClock(jobClockScheduler, schedulerTimeSource);
    }

    @Bean
    public JobRegistry jobRegistry(SchedulerClock schedulerClock) {
        return new JobRegistry(schedulerClock);
    }

    @Bean
    public JobExecutor jobExecutor(SchedulerClock schedulerClock,
                                   @Qualifier("jobWorkerExecutor") ThreadPoolTaskExecutor jobWorkerExecutor,
                                   MetricsConfig metricsConfig,
                                   SlackAlertService slackAlertService) {
        return new JobExecutor(schedulerClock, jobWorkerExecutor, metricsConfig, slackAlertService);
    }

    @Bean
    public NotificationJobScheduler notificationJobScheduler(JobRegistry jobRegistry, JobExecutor jobExecutor,
                                                             SchedulerClock schedulerClock, JobMapper jobMapper) {
        return new NotificationJobScheduler(jobRegistry, jobExecutor, schedulerClock, jobMapper);
    }

    @Bean
    public NotificationSchedulerLifecycle notificationSchedulerLifecycle(NotificationJobScheduler notificationJobScheduler,
                                                                         JobDefinitionRegistry jobDefinitionRegistry,
                                                                         NotificationSchedulerProperties properties) {
        return new NotificationSchedulerLifecycle(notificationJobScheduler, jobDefinitionRegistry, properties);
    }

    // === Retry queue ===

    @Bean
    public RetryConfig retryConfig(NotificationRetryProperties retryProperties) {
        var config = retryProperties.toRetryConfig();
        log.info("Notification retry config: {}", config);
        return config;
    }

    @Bean
    public BackoffPolicy backoffPolicy(RetryConfig retryConfig) {
        return new BackoffPolicy(retryConfig);
    }

    @Bean
    public NotificationRetryCoordinator notificationRetryCoordinator(RetryableNotificationRepository notificationRepository,
                                                                     NotificationTransport notificationTransport,
                                                                     BackoffPolicy backoffPolicy,
                                                                     SchedulerClock schedulerClock,
                                                                     MetricsConfig metricsConfig,
                                                                     SlackAlertService slackAlertService,
                                                                     NotificationRetryProperties retryProperties) {
        return new NotificationRetryCoordinator(notificationRepository, notificationTransport, backoffPolicy,
                schedulerClock, metricsConfig, slackAlertService, retryProperties.getBatchSize());
    }
}
