package com.drover.core.jobs;

import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;

/**
 * Parses schedule values and computes due times.
 * <p>
 * Intervals are whole seconds ({@code "300"}) or ISO-8601 durations ({@code "PT5M"}). Cron
 * expressions take the classic five fields or Spring's six (with seconds) and are evaluated in UTC.
 */
final class Schedules {

    private Schedules() {}

    /**
     * @throws IllegalArgumentException if the value does not fit the type
     */
    static void validate(ScheduleType type, String value) {
        switch (type) {
            case ONCE -> instant(value);
            case INTERVAL -> interval(value);
            case CRON -> cron(value);
        }
    }

    /** First due time of a new or rescheduled job. */
    static Instant first(ScheduleType type, String value, Instant now) {
        return type == ScheduleType.ONCE ? instant(value) : next(type, value, now);
    }

    /** Due time after a run at {@code now}; null when the job is done. */
    static Instant next(ScheduleType type, String value, Instant now) {
        return switch (type) {
            case ONCE -> null;
            case INTERVAL -> now.plus(interval(value));
            case CRON -> {
                ZonedDateTime next = cron(value).next(now.atZone(ZoneOffset.UTC));
                yield next == null ? null : next.toInstant();
            }
        };
    }

    static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("A one-shot job needs an ISO-8601 time");
        }
        try {
            return Instant.parse(value.strip());
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(value.strip()).toInstant();
            } catch (DateTimeParseException again) {
                throw new IllegalArgumentException("Not an ISO-8601 time: " + value, again);
            }
        }
    }

    static Duration interval(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("An interval job needs a number of seconds");
        }
        String v = value.strip();
        Duration interval;
        try {
            interval = v.startsWith("P") || v.startsWith("p") ? Duration.parse(v) : Duration.ofSeconds(Long.parseLong(v));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalArgumentException("Not an interval: " + value, e);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + value);
        }
        return interval;
    }

    static CronExpression cron(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("A cron job needs an expression");
        }
        String v = value.strip();
        if (v.split("\\s+").length == 5) {
            v = "0 " + v;
        }
        return CronExpression.parse(v);
    }
}
