package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Externally visible snapshot of a mission running as a background job.
 *
 * @param id          task id
 * @param description the original request
 * @param status      running, completed, failed or cancelled
 * @param plan        plan snapshot taken when the mission was launched
 * @param progressLog ordered progress entries
 * @param result      final text (nullable while running)
 * @param createdAt   creation time
 * @param updatedAt   last mutation time
 */
public record BackgroundTask(
    String id,
    String description,
    BackgroundTaskStatus status,
    List<PlanTask> plan,
    @JsonProperty("progress_log") List<ProgressEntry> progressLog,
    String result,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {

    public BackgroundTask {
        plan = plan == null ? List.of() : List.copyOf(plan);
        progressLog = progressLog == null ? List.of() : List.copyOf(progressLog);
    }
}
