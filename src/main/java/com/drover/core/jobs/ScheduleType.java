package com.drover.core.jobs;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ScheduleType {
    /** Runs once at an ISO-8601 instant, then disables itself. */
    @JsonProperty("once") ONCE,
    /** Runs every N seconds, counted from the previous run. */
    @JsonProperty("interval") INTERVAL,
    /** Runs on a cron expression, evaluated in UTC. */
    @JsonProperty("cron") CRON
}
