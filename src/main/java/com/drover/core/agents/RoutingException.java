package com.drover.core.agents;

import com.drover.core.OrchestrationException;

/**
 * Thrown when no registered agent can take a task.
 */
public class RoutingException extends OrchestrationException {

    public RoutingException(String taskId, String target) {
        super("No agent available for task '%s' (target '%s') and no default agent registered"
                .formatted(taskId, target));
    }
}
