package com.drover.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Wire shape of one planned task, as produced by a planner or submitted by a caller.
 *
 * @param id                   task id; defaults to {@code t<n>} by position when omitted
 * @param model                agent id, model key or capability tag to route to
 * @param task                 task description
 * @param toolsNeeded          whether the agent should use its tools
 * @param dependsOn            ids this task waits for; defaults to empty
 * @param securityConsultation routes to an agent with the {@code security} capability
 * @param needsEscalation      pre-check flag raising an escalation instead of running
 * @param capability           explicit capability hint (nullable)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanTask(
    String id,
    String model,
    String task,
    @JsonProperty("tools_needed") boolean toolsNeeded,
    @JsonProperty("depends_on") List<String> dependsOn,
    @JsonProperty("security_consultation") boolean securityConsultation,
    @JsonProperty("needs_escalation") boolean needsEscalation,
    String capability
) {

    public static final String SECURITY_CAPABILITY = "security";

    public PlanTask {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    public static PlanTask of(String id, String model, String task, List<String> dependsOn) {
        return new PlanTask(id, model, task, false, dependsOn, false, false, null);
    }

    /**
     * Fills in omitted ids ({@code t1}, {@code t2}, ... by position).
     */
    public static List<PlanTask> normalize(List<PlanTask> plan) {
        var normalized = new ArrayList<PlanTask>(plan.size());
        for (int i = 0; i < plan.size(); i++) {
            var p = plan.get(i);
            String id = p.id() == null || p.id().isBlank() ? "t" + (i + 1) : p.id();
            normalized.add(new PlanTask(id, p.model(), p.task(), p.toolsNeeded(), p.dependsOn(),
                    p.securityConsultation(), p.needsEscalation(), p.capability()));
        }
        return normalized;
    }

    public Task toTask() {
        String hint = capability;
        if (hint == null && securityConsultation) {
            hint = SECURITY_CAPABILITY;
        }
        return new Task(id, model, task, new LinkedHashSet<>(dependsOn), toolsNeeded, hint,
                needsEscalation, TaskStatus.PENDING, null);
    }
}
