package com.example.notificationscheduler.exception;

import lombok.Getter;

/**
 * Exception for operations on an unknown job name
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final String jobName;

    public JobNotFoundException(String jobName) {
        super("Job not found: " + jobName);
        this.jobName = jobName;
    }
}
