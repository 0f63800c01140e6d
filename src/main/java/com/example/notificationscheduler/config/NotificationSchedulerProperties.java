package com.example.notificationscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "notification-scheduler")
public class NotificationSchedulerProperties {

    /**
     * Time zone cron schedules are evaluated in
     */
    @NotBlank
    private String zone = "UTC";

    /**
     * Threads running job bodies
     */
    @Min(1)
    private int workerPoolSize = 8;

    /**
     * Threads firing clock ticks. Ticks only dispatch, so this stays small.
     */
    @Min(1)
    private int clockPoolSize = 2;

    /**
     * Bind all registered jobs to the clock once the application has started
     */
    private boolean autoStart = true;

    private long metricsUpdateIntervalMs = 60000;

    /**
     * Per-job overrides keyed by job name
     */
    private Map<String, JobOverride> jobs = new LinkedHashMap<>();

    public JobOverride overrideFor(String jobName) {
        return jobs.getOrDefault(jobName, new JobOverride());
    }

    @Data
    public static class JobOverride {

        /**
         * Replaces the job's default cron expression when set
         */
        private String schedule;

        /**
         * Disabled jobs are not registered at all
         */
        private boolean enabled = true;
    }
}
