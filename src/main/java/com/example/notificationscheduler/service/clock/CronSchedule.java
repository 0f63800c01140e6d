package com.example.notificationscheduler.service.clock;

import com.example.notificationscheduler.exception.InvalidCronExpressionException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A parsed 5-field POSIX cron expression
 * ({@code minute hour day-of-month month day-of-week}).
 * <p>
 * Fields accept integers, ranges, lists, {@code *} and {@code *}{@code /n}
 * steps. Evaluation is delegated to Spring's {@link CronExpression} with the
 * seconds field pinned to zero.
 */
@Getter
@EqualsAndHashCode(of = "expression")
public final class CronSchedule {

    private static final int FIELD_COUNT = 5;

    private final String expression;

    private final CronExpression cronExpression;

    private CronSchedule(String expression, CronExpression cronExpression) {
        this.expression = expression;
        this.cronExpression = cronExpression;
    }

    /**
     * Parse a 5-field cron expression
     *
     * @throws InvalidCronExpressionException if the expression is blank, has the
     *                                        wrong number of fields or a field is
     *                                        out of range
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is blank");
        }
        var normalized = expression.trim().replaceAll("\\s+", " ");
        var fields = normalized.split(" ");
        if (fields.length != FIELD_COUNT) {
            throw new InvalidCronExpressionException(expression,
                    String.format("expected %d fields but found %d", FIELD_COUNT, fields.length));
        }
        try {
            return new CronSchedule(normalized, CronExpression.parse("0 " + normalized));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e);
        }
    }

    /**
     * First occurrence strictly after {@code after}, evaluated in {@code zone}
     *
     * @return next fire time, or null if the expression never fires again
     */
    public Instant next(Instant after, ZoneId zone) {
        ZonedDateTime next = cronExpression.next(after.atZone(zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String toString() {
        return expression;
    }
}
