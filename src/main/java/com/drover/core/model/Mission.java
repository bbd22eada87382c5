package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of a mission: its task graph, status and per-task results.
 *
 * @param id          mission id
 * @param tasks       tasks in plan order
 * @param status      current status
 * @param results     task id to terminal outcome
 * @param synthesis   final user-facing answer (nullable until finished)
 * @param createdAt   submission time
 * @param completedAt completion time (nullable)
 */
public record Mission(
    String id,
    List<Task> tasks,
    MissionStatus status,
    Map<String, TaskResult> results,
    String synthesis,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("completed_at") Instant completedAt
) {

    public Mission {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public Task task(String taskId) {
        return tasks.stream()
                .filter(t -> t.id().equals(taskId))
                .findFirst()
                .orElse(null);
    }

    public long countByStatus(TaskStatus status) {
        return tasks.stream().filter(t -> t.status() == status).count();
    }
}
