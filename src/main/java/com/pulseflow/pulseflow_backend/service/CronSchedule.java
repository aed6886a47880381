package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.exception.InvalidScheduleException;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Five-field cron schedules as the editor writes them, evaluated in UTC on top of Spring's
 * six-field {@link CronExpression} (seconds pinned to 0).
 */
public final class CronSchedule {

    public static final Duration MIN_INTERVAL = Duration.ofMinutes(20);

    // Gaps between this many upcoming fire times decide the effective interval
    private static final int SAMPLED_RUNS = 5;

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidScheduleException("Cron expression is required for scheduled workflows");
        }
        String trimmed = expression.trim();
        if (trimmed.split("\\s+").length != 5) {
            throw new InvalidScheduleException(
                    "Cron expression must have exactly 5 fields (minute hour day month weekday)");
        }
        try {
            return new CronSchedule(trimmed, CronExpression.parse("0 " + trimmed));
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("Invalid cron expression: " + e.getMessage(), e);
        }
    }

    /** Parses and rejects schedules that fire more often than {@link #MIN_INTERVAL}. */
    public static CronSchedule parseWithMinimumInterval(String expression, Instant from) {
        CronSchedule schedule = parse(expression);
        Duration interval = schedule.shortestInterval(from);
        if (interval.compareTo(MIN_INTERVAL) < 0) {
            throw new InvalidScheduleException("Minimum interval is " + MIN_INTERVAL.toMinutes()
                    + " minutes. Your schedule runs every " + interval.toMinutes() + " minutes.");
        }
        return schedule;
    }

    public Instant nextRunAfter(Instant from) {
        ZonedDateTime next = cron.next(from.atZone(ZoneOffset.UTC));
        if (next == null) {
            throw new InvalidScheduleException("Cron expression never fires: " + expression);
        }
        return next.toInstant();
    }

    Duration shortestInterval(Instant from) {
        Instant previous = nextRunAfter(from);
        Duration shortest = null;
        for (int i = 1; i < SAMPLED_RUNS; i++) {
            Instant next = nextRunAfter(previous);
            Duration gap = Duration.between(previous, next);
            if (shortest == null || gap.compareTo(shortest) < 0) {
                shortest = gap;
            }
            previous = next;
        }
        return shortest;
    }

    public String expression() {
        return expression;
    }
}
