package com.example.notificationscheduler.controller;

import com.example.notificationscheduler.dto.ApiResponse;
import com.example.notificationscheduler.dto.JobStatusResponse;
import com.example.notificationscheduler.dto.JobTriggerResult;
import com.example.notificationscheduler.dto.UpdateScheduleRequest;
import com.example.notificationscheduler.exception.JobNotFoundException;
import com.example.notificationscheduler.service.scheduler.NotificationJobScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for scheduled job control.
 * <p>
 * Provides endpoints for:
 * - Listing job status
 * - Pausing, resuming and rescheduling single jobs
 * - Triggering a job outside its schedule
 * - Starting and stopping the whole scheduler
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Scheduler", description = "APIs for controlling scheduled jobs")
public class JobController {

    private final NotificationJobScheduler scheduler;

    // === Status ===

    @GetMapping
    @Operation(summary = "List jobs", description = "Status of every registered job")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> getJobs() {
        return ResponseEntity.ok(ApiResponse.success(scheduler.getJobsStatus()));
    }

    @GetMapping("/{name}")
    @Operation(summary = "Get job status", description = "Status of one job by name")
    public ResponseEntity<ApiResponse<JobStatusResponse>> getJob(
            @Parameter(description = "Job name") @PathVariable String name) {
        var status = scheduler.getJobStatus(name).orElseThrow(() -> new JobNotFoundException(name));
        return ResponseEntity.ok(ApiResponse.success(status));
    }

    // === Per-job control ===

    @PostMapping("/{name}/pause")
    @Operation(summary = "Pause a job", description = "Stop firing the job on its schedule. Last status is kept.")
    public ResponseEntity<ApiResponse<JobStatusResponse>> pauseJob(@PathVariable String name) {
        log.info("API: Pause job {}", name);

        var changed = scheduler.pauseJob(name);
        return ResponseEntity.ok(ApiResponse.success(currentStatus(name),
                changed ? "Job paused" : "Job was already paused"));
    }

    @PostMapping("/{name}/resume")
    @Operation(summary = "Resume a job", description = "Rebind a paused job; the next run is computed from now")
    public ResponseEntity<ApiResponse<JobStatusResponse>> resumeJob(@PathVariable String name) {
        log.info("API: Resume job {}", name);

        var changed = scheduler.resumeJob(name);
        return ResponseEntity.ok(ApiResponse.success(currentStatus(name),
                changed ? "Job resumed" : "Job was already running on its schedule"));
    }

    @PostMapping("/{name}/trigger")
    @Operation(summary = "Trigger a job", description = "Run the job now and wait for the outcome. The schedule is not affected.")
    public ResponseEntity<ApiResponse<JobTriggerResult>> triggerJob(@PathVariable String name) {
        log.info("API: Trigger job {}", name);

        var result = scheduler.triggerJob(name);
        var message = result.isSuccess() ? "Job completed" : result.isSkipped() ? "Job skipped" : "Job failed";
        return ResponseEntity.ok(ApiResponse.success(result, message));
    }

    @PutMapping("/{name}/schedule")
    @Operation(summary = "Update job schedule", description = "Replace the job's cron expression")
    public ResponseEntity<ApiResponse<JobStatusResponse>> updateSchedule(
            @PathVariable String name,
            @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("API: Update schedule of job {} to {}", name, request.getSchedule());

        scheduler.updateJobSchedule(name, request.getSchedule());
        return ResponseEntity.ok(ApiResponse.success(currentStatus(name), "Schedule updated"));
    }

    // === Scheduler control ===

    @PostMapping("/start")
    @Operation(summary = "Start all jobs", description = "Bind every unbound job to its schedule")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> startAll() {
        log.info("API: Start all jobs");

        scheduler.startAllJobs();
        return ResponseEntity.ok(ApiResponse.success(scheduler.getJobsStatus(), "All jobs started"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop all jobs", description = "Detach every job from its schedule. Running executions finish.")
    public ResponseEntity<ApiResponse<List<JobStatusResponse>>> stopAll() {
        log.info("API: Stop all jobs");

        scheduler.stopAllJobs();
        return ResponseEntity.ok(ApiResponse.success(scheduler.getJobsStatus(), "All jobs stopped"));
    }

    private JobStatusResponse currentStatus(String name) {
        return scheduler.getJobStatus(name).orElseThrow(() -> new JobNotFoundException(name));
    }
}
