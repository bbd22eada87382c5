package com.drover.core.escalation;

import com.drover.core.OrchestrationException;

/**
 * Thrown when resolving an escalation that does not exist or is no longer pending.
 */
public class EscalationNotFoundException extends OrchestrationException {

    private final boolean alreadyResolved;

    public EscalationNotFoundException(String escalationId, boolean alreadyResolved) {
        super(alreadyResolved
                ? "Escalation %s was already resolved".formatted(escalationId)
                : "Unknown escalation: %s".formatted(escalationId));
        this.alreadyResolved = alreadyResolved;
    }

    private EscalationNotFoundException(String message) {
        super(message);
        this.alreadyResolved = false;
    }

    /** The escalation's branch was cancelled before a target was chosen. */
    public static EscalationNotFoundException discarded(String escalationId) {
        return new EscalationNotFoundException(
                "Escalation %s was discarded when its mission was cancelled".formatted(escalationId));
    }

    public boolean isAlreadyResolved() {
        return alreadyResolved;
    }
}
