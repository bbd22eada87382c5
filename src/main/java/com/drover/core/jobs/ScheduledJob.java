package com.drover.core.jobs;

import com.drover.core.model.PlanTask;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a job that starts a background task on a schedule.
 *
 * @param id            job id
 * @param description   request handed to the background task
 * @param scheduleType  once, interval or cron
 * @param scheduleValue ISO instant, seconds, or cron expression, depending on the type
 * @param plan          explicit plan for each run; empty to let the planner decide
 * @param enabled       disabled jobs are never dispatched
 * @param lastRun       time of the latest dispatch (nullable)
 * @param nextRun       when the job is next due (nullable once a one-shot job has run)
 * @param createdAt     creation time
 * @param runCount      number of dispatches so far
 * @param lastTaskId    background task started by the latest dispatch (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledJob(
    String id,
    String description,
    @JsonProperty("schedule_type") ScheduleType scheduleType,
    @JsonProperty("schedule_value") String scheduleValue,
    List<PlanTask> plan,
    boolean enabled,
    @JsonProperty("last_run") Instant lastRun,
    @JsonProperty("next_run") Instant nextRun,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("run_count") int runCount,
    @JsonProperty("last_task_id") String lastTaskId
) {

    public ScheduledJob {
        plan = plan == null ? List.of() : List.copyOf(plan);
    }
}
