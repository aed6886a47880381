package com.pulseflow.pulseflow_backend.service;

import com.pulseflow.pulseflow_backend.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CronScheduleTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:30:00Z");

    @Test
    void nextRunFollowsFiveFieldExpressionInUtc() {
        CronSchedule schedule = CronSchedule.parse("0 */2 * * *");

        assertThat(schedule.nextRunAfter(NOW)).isEqualTo(Instant.parse("2026-01-01T02:00:00Z"));
        assertThat(schedule.shortestInterval(NOW)).isEqualTo(Duration.ofHours(2));
    }

    @Test
    void twentyMinuteScheduleIsTheFastestAllowed() {
        CronSchedule schedule = CronSchedule.parseWithMinimumInterval("*/20 * * * *", NOW);

        assertThat(schedule.nextRunAfter(NOW)).isEqualTo(Instant.parse("2026-01-01T00:40:00Z"));
    }

    @Test
    void fasterSchedulesAreRejected() {
        assertThatThrownBy(() -> CronSchedule.parseWithMinimumInterval("*/5 * * * *", NOW))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessage("Minimum interval is 20 minutes. Your schedule runs every 5 minutes.");
        assertThatThrownBy(() -> CronSchedule.parseWithMinimumInterval("0,10,30,45 * * * *", NOW))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("runs every 10 minutes");
    }

    @Test
    void malformedExpressionsAreRejected() {
        assertThatThrownBy(() -> CronSchedule.parse("0 0 * *"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageContaining("exactly 5 fields");
        assertThatThrownBy(() -> CronSchedule.parse("99 * * * *"))
                .isInstanceOf(InvalidScheduleException.class)
                .hasMessageStartingWith("Invalid cron expression");
        assertThatThrownBy(() -> CronSchedule.parse(null))
                .isInstanceOf(InvalidScheduleException.class);
    }
}
