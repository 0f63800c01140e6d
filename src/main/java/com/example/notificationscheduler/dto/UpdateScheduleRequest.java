package com.example.notificationscheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for changing a job's cron schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    /**
     * 5-field cron expression, e.g. {@code 0 9 * * *}
     */
    @NotBlank
    private String schedule;
}
