package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.dto.RetryProcessingResult;
import com.example.notificationscheduler.dto.RetryStatistics;
import com.example.notificationscheduler.service.retry.NotificationRetryCoordinator;
import com.example.notificationscheduler.service.retry.RetryConfig;
import com.example.notificationscheduler.service.retry.RetryStatisticsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(NotificationRetryController.class)
@DisplayName("NotificationRetryController Tests")
class NotificationRetryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private NotificationRetryCoordinator retryCoordinator;

    @MockBean
    private RetryStatisticsService statisticsService;

    @Test
    @DisplayName("Should return retry statistics")
    void shouldReturnStatistics() throws Exception {
        when(statisticsService.getRetryStatistics()).thenReturn(RetryStatistics.builder()
                .totalFailed(4).totalRetried(12).averageRetries(3.0).successRate(0.75)
                .deliveredCount(3).exhaustedCount(1).build());

        mockMvc.perform(get("/api/v1/notifications/retries/statistics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.totalFailed").value(4))
                .andExpect(jsonPath("$.data.totalRetried").value(12))
                .andExpect(jsonPath("$.data.successRate").value(0.75));
    }

    @Test
    @DisplayName("Should run a retry sweep on demand")
    void shouldProcessNow() throws Exception {
        when(retryCoordinator.processFailedNotifications()).thenReturn(new RetryProcessingResult(3, 1, 1, 1));

        mockMvc.perform(post("/api/v1/notifications/retries/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Processed 3 notifications"))
                .andExpect(jsonPath("$.data.exhausted").value(1));
    }

    @Test
    @DisplayName("Should report a skipped sweep while another is running")
    void shouldReportSkippedSweep() throws Exception {
        when(retryCoordinator.processFailedNotifications()).thenReturn(RetryProcessingResult.skipped());

        mockMvc.perform(post("/api/v1/notifications/retries/process"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Retry sweep already in progress"))
                .andExpect(jsonPath("$.data.skipped").value(true))
                .andExpect(jsonPath("$.data.processed").value(0));
    }

    @Test
    @DisplayName("Should return effective retry config")
    void shouldReturnConfig() throws Exception {
        when(retryCoordinator.getRetryConfig()).thenReturn(RetryConfig.defaults());

        mockMvc.perform(get("/api/v1/notifications/retries/config"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.maxRetries").value(3))
                .andExpect(jsonPath("$.data.initialDelayMs").value(300000))
                .andExpect(jsonPath("$.data.maxDelayMs").value(86400000));
    }
}
