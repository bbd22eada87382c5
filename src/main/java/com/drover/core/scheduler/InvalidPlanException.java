package com.drover.core.scheduler;

import com.drover.core.OrchestrationException;

/**
 * Thrown at submission when a plan cannot be scheduled, before any task runs.
 */
public class InvalidPlanException extends OrchestrationException {

    public InvalidPlanException(String message) {
        super(message);
    }
}
