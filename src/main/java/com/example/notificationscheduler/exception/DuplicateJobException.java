package com.example.notificationscheduler.exception;

import lombok.Getter;

/**
 * Exception for registering a job name that already exists
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final String jobName;

    public DuplicateJobException(String jobName) {
        super("Job already registered: " + jobName);
        this.jobName = jobName;
    }
}
