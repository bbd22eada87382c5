package com.drover.core.agents;

import com.drover.core.inference.ToolCall;
import com.drover.core.inference.ToolDefinition;

import java.util.List;

/**
 * Runs tools on behalf of tool-calling agents.
 */
public interface ToolExecutor {

    List<ToolDefinition> definitions();

    /**
     * Executes a call and returns its textual result.
     *
     * @throws IllegalArgumentException if the tool is unknown or its arguments are malformed
     */
    String execute(String agentId, String missionId, ToolCall call);
}
