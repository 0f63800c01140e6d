package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.dto.ApiResponse;
import com.example.notificationscheduler.dto.RetryProcessingResult;
import com.example.notificationscheduler.dto.RetryStatistics;
import com.example.notificationscheduler.service.retry.NotificationRetryCoordinator;
import com.example.notificationscheduler.service.retry.RetryConfig;
import com.example.notificationscheduler.service.retry.RetryStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/notifications/retries")
@Tag(name = "Notification Retries", description = "APIs for the failed-notification retry queue")
public class NotificationRetryController {

    private final NotificationRetryCoordinator retryCoordinator;
    private final RetryStatisticsService statisticsService;

    @GetMapping("/statistics")
    @Operation(summary = "Retry statistics", description = "Counts, average retries and success rate of the retry queue")
    public ResponseEntity<ApiResponse<RetryStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(statisticsService.getRetryStatistics()));
    }

    @PostMapping("/process")
    @Operation(summary = "Process due retries", description = "Run one retry sweep now, outside the job schedule. Skipped while another sweep is running.")
    public ResponseEntity<ApiResponse<RetryProcessingResult>> processNow() {
        log.info("API: Process failed notifications");

        var result = retryCoordinator.processFailedNotifications();
        var message = result.isSkipped()
                ? "Retry sweep already in progress"
                : String.format("Processed %d notifications", result.getProcessed());
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @GetMapping("/config")
    @Operation(summary = "Retry configuration", description = "Effective backoff configuration")
    public ResponseEntity<ApiResponse<RetryConfig>> getConfig() {
        return ResponseEntity.ok(ApiResponse.success(retryCoordinator.getRetryConfig()));
    }
}
