package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal outcome of one task, kept in the mission's results map.
 *
 * @param taskId  the task
 * @param agentId agent that ran it (nullable when it never ran)
 * @param status  DONE, FAILED or SKIPPED
 * @param output  produced text (nullable)
 * @param error   failure or skip explanation (nullable)
 */
public record TaskResult(
    @JsonProperty("task_id") String taskId,
    @JsonProperty("agent_id") String agentId,
    TaskStatus status,
    String output,
    String error
) {

    public static TaskResult done(String taskId, String agentId, String output) {
        return new TaskResult(taskId, agentId, TaskStatus.DONE, output, null);
    }

    public static TaskResult failed(String taskId, String agentId, String error) {
        return new TaskResult(taskId, agentId, TaskStatus.FAILED, null, error);
    }

    public static TaskResult skipped(String taskId, String reason) {
        return new TaskResult(taskId, null, TaskStatus.SKIPPED, null, reason);
    }

    public boolean succeeded() {
        return status == TaskStatus.DONE;
    }
}
