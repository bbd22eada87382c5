package com.drover.core.agents;

import java.util.List;
import java.util.Set;

/**
 * Static configuration of one agent.
 *
 * @param agentId       unique id
 * @param modelKey      model key for inference
 * @param capabilities  capability tags used for routing
 * @param canUseTools   whether the agent may call tools at all
 * @param allowedTools  tools it may call (empty for every registered tool)
 * @param maxTokens     generation limit (nullable for the model key default)
 * @param temperature   sampling temperature (nullable for the model key default)
 * @param systemPrompt  instructions prepended to every conversation
 * @param maxToolRounds upper bound of tool-calling rounds per task
 */
public record AgentDefinition(
    String agentId,
    String modelKey,
    Set<String> capabilities,
    boolean canUseTools,
    List<String> allowedTools,
    Integer maxTokens,
    Double temperature,
    String systemPrompt,
    int maxToolRounds
) {

    public AgentDefinition {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        allowedTools = allowedTools == null ? List.of() : List.copyOf(allowedTools);
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
    }

    public static AgentDefinition of(String agentId, String modelKey, Set<String> capabilities) {
        return new AgentDefinition(agentId, modelKey, capabilities, false, List.of(), null, null, "", 0);
    }

    public boolean allowsTool(String toolName) {
        return canUseTools && (allowedTools.isEmpty() || allowedTools.contains(toolName));
    }
}
