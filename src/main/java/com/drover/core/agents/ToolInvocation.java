package com.drover.core.agents;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A tool call with the context it runs in.
 *
 * @param agentId   calling agent
 * @param missionId mission the call belongs to
 * @param arguments parsed arguments object
 */
public record ToolInvocation(String agentId, String missionId, JsonNode arguments) {

    public String argument(String name, String fallback) {
        JsonNode value = arguments.get(name);
        return value == null || value.isNull() ? fallback : value.asText();
    }
}
