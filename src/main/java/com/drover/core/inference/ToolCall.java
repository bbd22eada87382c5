package com.drover.core.inference;

/**
 * A tool invocation requested by the model.
 *
 * @param id        call id assigned by the backend (may be synthesised)
 * @param name      tool name
 * @param arguments arguments as a JSON object string
 */
public record ToolCall(String id, String name, String arguments) {

    /** Identity used to suppress repeated identical calls within one tool loop. */
    public String signature() {
        return name + ":" + arguments;
    }
}
