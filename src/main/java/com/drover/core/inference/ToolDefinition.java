package com.drover.core.inference;

import java.util.Map;

/**
 * A tool offered to the model, rendered as an OpenAI-style function definition.
 *
 * @param name        function name
 * @param description what the tool does
 * @param parameters  JSON schema of the arguments
 */
public record ToolDefinition(String name, String description, Map<String, Object> parameters) {

    public ToolDefinition {
        parameters = parameters == null ? Map.of("type", "object", "properties", Map.of()) : Map.copyOf(parameters);
    }
}
