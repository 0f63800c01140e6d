package com.example.notificationscheduler.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a manual job trigger
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobTriggerResult {

    private String jobName;
    private boolean success;
    private boolean skipped;
    private String error;

    public static JobTriggerResult success(String jobName) {
        return JobTriggerResult.builder().jobName(jobName).success(true).build();
    }

    public static JobTriggerResult failure(String jobName, String error) {
        return JobTriggerResult.builder().jobName(jobName).success(false).error(error).build();
    }

    public static JobTriggerResult skipped(String jobName, String error) {
        return JobTriggerResult.builder().jobName(jobName).success(false).skipped(true).error(error).build();
    }
}
