package com.drover.core.agents;

import com.drover.core.model.PlanTask;

import java.util.List;

/**
 * Output of planning a request.
 *
 * @param tasks           planned tasks (empty when planning failed)
 * @param needsEscalation true when the request exceeds what the local fleet can do
 * @param reason          explanation for an escalation (nullable)
 */
public record PlanResult(List<PlanTask> tasks, boolean needsEscalation, String reason) {

    public static final PlanResult EMPTY = new PlanResult(List.of(), false, null);

    public PlanResult {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }
}
