package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A node in a mission's dependency graph, owned by the mission that contains it.
 *
 * @param id              unique id within the mission (e.g. "t1")
 * @param target          explicit agent id / model key, or a capability tag
 * @param description     what the task should accomplish
 * @param dependsOn       ids of tasks that must be DONE before this one is READY
 * @param toolsNeeded     whether the routed agent should run its tool loop
 * @param capability      capability hint used when {@code target} matches no agent (nullable)
 * @param needsEscalation pre-flagged as exceeding fleet capability
 * @param status          current status
 * @param result          output text once DONE, or the failure explanation (nullable)
 */
public record Task(
    String id,
    String target,
    String description,
    @JsonProperty("depends_on") Set<String> dependsOn,
    @JsonProperty("tools_needed") boolean toolsNeeded,
    String capability,
    @JsonProperty("needs_escalation") boolean needsEscalation,
    TaskStatus status,
    String result
) {

    public Task {
        dependsOn = dependsOn == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
        status = status == null ? TaskStatus.PENDING : status;
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, target, description, dependsOn, toolsNeeded, capability, needsEscalation,
                newStatus, result);
    }

    public Task withResult(TaskStatus newStatus, String newResult) {
        return new Task(id, target, description, dependsOn, toolsNeeded, capability, needsEscalation,
                newStatus, newResult);
    }

    /** Re-targets the task, clearing the escalation flag so it can run. */
    public Task redirectTo(String newTarget) {
        return new Task(id, newTarget, description, dependsOn, toolsNeeded, capability, false,
                TaskStatus.PENDING, null);
    }
}
