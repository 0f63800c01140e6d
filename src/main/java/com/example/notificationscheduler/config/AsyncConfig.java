package com.example.notificationscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for the scheduler.
 * <p>
 * - {@code jobClockScheduler}: fires cron ticks (and {@code @Scheduled} methods)
 * - {@code jobWorkerExecutor}: runs job bodies
 * - {@code taskExecutor}: Spring's {@code @Async} methods (Slack alerts)
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    private final NotificationSchedulerProperties properties;

    public AsyncConfig(NotificationSchedulerProperties properties) {
        this.properties = properties;
    }

    @Bean(name = "jobClockScheduler")
    public ThreadPoolTaskScheduler jobClockScheduler() {
        log.info("Creating job clock scheduler with {} threads", properties.getClockPoolSize());

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getClockPoolSize());
        scheduler.setThreadNamePrefix("job-clock-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);

        return scheduler;
    }

    /**
     * Worker pool for job bodies. A full queue rejects the submission and the
     * job is recorded as failed instead of running on the clock thread.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor() {
        log.info("Creating job worker pool with {} threads", properties.getWorkerPoolSize());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("job-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        return executor;
    }
}
