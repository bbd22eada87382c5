package com.drover.core.agents;

import com.drover.core.model.AgentMessage;
import com.drover.core.model.AgentState;

import java.util.Set;

/**
 * A runnable agent. Agents are registered once at startup and addressed by id.
 */
public interface Agent {

    String agentId();

    /** Logical model key the agent's inference calls go to. */
    String modelKey();

    Set<String> capabilities();

    boolean canUseTools();

    AgentState state();

    /**
     * Handles one TASK message.
     *
     * @return a RESULT (with {@code error=true} in the payload on failure) or an ESCALATION_REQUEST
     * @throws com.drover.core.inference.AdmissionRejectedException if the agent's model has no free slot
     */
    AgentMessage run(AgentMessage message);
}
