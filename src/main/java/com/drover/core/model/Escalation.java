package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * A suspend/resume gate over one mission branch, awaiting a human choice of target.
 *
 * @param id            escalation id
 * @param missionId     mission whose branch is suspended
 * @param taskId        suspended task (nullable for mission-level escalations)
 * @param reason        why fleet capability was exceeded
 * @param findingsSoFar partial findings, truncated to {@link #MAX_FINDINGS} characters
 * @param targets       selectable targets
 * @param status        pending, resolved or discarded
 * @param chosenTarget  key of the chosen target once resolved
 * @param createdAt     creation time
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Escalation(
    String id,
    @JsonProperty("mission_id") String missionId,
    @JsonProperty("task_id") String taskId,
    String reason,
    @JsonProperty("findings_so_far") String findingsSoFar,
    List<EscalationTarget> targets,
    EscalationStatus status,
    @JsonProperty("chosen_target") String chosenTarget,
    @JsonProperty("created_at") Instant createdAt
) {

    public static final int MAX_FINDINGS = 2000;

    public Escalation {
        targets = targets == null ? List.of() : List.copyOf(targets);
        if (findingsSoFar != null && findingsSoFar.length() > MAX_FINDINGS) {
            findingsSoFar = findingsSoFar.substring(0, MAX_FINDINGS);
        }
    }

    public Optional<EscalationTarget> target(String key) {
        return targets.stream().filter(t -> t.key().equals(key)).findFirst();
    }

    public Escalation resolve(String targetKey) {
        return new Escalation(id, missionId, taskId, reason, findingsSoFar, targets,
                EscalationStatus.RESOLVED, targetKey, createdAt);
    }

    public Escalation discard() {
        return new Escalation(id, missionId, taskId, reason, findingsSoFar, targets,
                EscalationStatus.DISCARDED, null, createdAt);
    }
}
