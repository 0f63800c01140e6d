package com.example.notificationscheduler.exception;

import lombok.Getter;

/**
 * Exception for a schedule that is not a valid 5-field cron expression
 */
@Getter
public class InvalidCronExpressionException extends IllegalArgumentException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super(String.format("Invalid cron expression '%s': %s", expression, reason));
        this.expression = expression;
    }

    public InvalidCronExpressionException(String expression, Exception cause) {
        super(String.format("Invalid cron expression '%s': %s", expression, cause.getMessage()), cause);
        this.expression = expression;
    }
}
