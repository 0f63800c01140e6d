package com.example.notificationscheduler.service.scheduler;

import com.example.notificationscheduler.config.NotificationSchedulerProperties;
import com.example.notificationscheduler.service.job.JobDefinitionRegistry;
import com.example.notificationscheduler.service.job.ScheduledJobDefinition;
import com.example.notificationscheduler.service.registry.JobTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationSchedulerLifecycle Tests")
class NotificationSchedulerLifecycleTest {

    @Mock
    private NotificationJobScheduler scheduler;

    private NotificationSchedulerProperties properties;
    private JobDefinitionRegistry definitionRegistry;

    @BeforeEach
    void setUp() {
        properties = new NotificationSchedulerProperties();
        definitionRegistry = new JobDefinitionRegistry(List.of(
                definition("process-failed-notifications", "*/5 * * * *"),
                definition("retry-statistics", "0 */6 * * *"),
                definition("weather-alerts", "0 6 * * *")));
    }

    private static ScheduledJobDefinition definition(String name, String schedule) {
        return new ScheduledJobDefinition() {
            @Override
            public String getJobName() {
                return name;
            }

            @Override
            public String getDefaultSchedule() {
                return schedule;
            }

            @Override
            public void run() {
            }
        };
    }

    @Test
    @DisplayName("Should register definitions with overrides, skip disabled ones and start")
    void shouldRegisterAndStart() {
        // Given
        var override = new NotificationSchedulerProperties.JobOverride();
        override.setSchedule("*/10 * * * *");
        var disabled = new NotificationSchedulerProperties.JobOverride();
        disabled.setEnabled(false);
        properties.getJobs().put("process-failed-notifications", override);
        properties.getJobs().put("weather-alerts", disabled);
        var lifecycle = new NotificationSchedulerLifecycle(scheduler, definitionRegistry, properties);

        // When
        lifecycle.start();

        // Then
        verify(scheduler).registerJob(eq("process-failed-notifications"), eq("*/10 * * * *"), any(JobTask.class), any());
        verify(scheduler).registerJob(eq("retry-statistics"), eq("0 */6 * * *"), any(JobTask.class), any());
        verify(scheduler, never()).registerJob(eq("weather-alerts"), anyString(), any(JobTask.class), any());
        verify(scheduler).startAllJobs();
        assertThat(lifecycle.isRunning()).isTrue();
    }

    @Test
    @DisplayName("Should register but not bind when auto-start is off")
    void shouldNotStartWhenAutoStartOff() {
        properties.setAutoStart(false);
        var lifecycle = new NotificationSchedulerLifecycle(scheduler, definitionRegistry, properties);

        lifecycle.start();

        verify(scheduler, times(3)).registerJob(anyString(), anyString(), any(JobTask.class), any());
        verify(scheduler, never()).startAllJobs();
    }

    @Test
    @DisplayName("Should stop all jobs and register only once across restarts")
    void shouldStopAndRestart() {
        var lifecycle = new NotificationSchedulerLifecycle(scheduler, definitionRegistry, properties);

        lifecycle.start();
        lifecycle.stop();
        lifecycle.start();

        verify(scheduler).stopAllJobs();
        verify(scheduler, times(2)).startAllJobs();
        verify(scheduler, times(3)).registerJob(anyString(), anyString(), any(JobTask.class), any());
        assertThat(lifecycle.isRunning()).isTrue();
    }
}
