package com.example.notificationscheduler.service.scheduler;

import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.service.job.JobDefinitionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the job scheduler with the Spring container lifecycle.
 * <p>
 * On first start every enabled {@code ScheduledJobDefinition} is registered,
 * using the configured schedule override when there is one. Jobs are bound
 * to the clock when {@code notification-scheduler.auto-start} is set.
 * Stopping the container detaches all jobs.
 */
@Slf4j
public class NotificationSchedulerLifecycle implements SmartLifecycle {

    private final NotificationJobScheduler scheduler;
    private final JobDefinitionRegistry definitionRegistry;
    private final NotificationSchedulerProperties properties;

    private volatile boolean running = false;
    private boolean definitionsRegistered = false;

    public NotificationSchedulerLifecycle(NotificationJobScheduler scheduler, JobDefinitionRegistry definitionRegistry,
                                          NotificationSchedulerProperties properties) {
        this.scheduler = scheduler;
        this.definitionRegistry = definitionRegistry;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (!definitionsRegistered) {
            registerDefinitions();
            definitionsRegistered = true;
        }
        if (properties.isAutoStart()) {
            scheduler.startAllJobs();
        } else {
            log.info("Auto-start disabled; jobs stay unbound until started through the API");
        }
        running = true;
    }

    @Override
    public synchronized void stop() {
        scheduler.stopAllJobs();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    private void registerDefinitions() {
        var registered = 0;
        for (var definition : definitionRegistry.getDefinitions()) {
            var name = definition.getJobName();
            var override = properties.overrideFor(name);
            if (!override.isEnabled()) {
                log.info("Job {} is disabled by configuration", name);
                continue;
            }
            var schedule = override.getSchedule() != null && !override.getSchedule().isBlank()
                    ? override.getSchedule()
                    : definition.getDefaultSchedule();
            scheduler.registerJob(name, schedule, definition::run, definition.getDescription());
            registered++;
        }
        log.info("Registered {} of {} job definitions", registered, definitionRegistry.getDefinitionCount());
    }
}
