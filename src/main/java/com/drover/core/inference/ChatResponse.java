package com.drover.core.inference;

import java.util.List;

/**
 * Backend-neutral completion result.
 *
 * @param text         generated text (empty when the model only requested tools)
 * @param finishReason "stop", "length", "tool_calls", ...
 * @param toolCalls    tool invocations requested by the model
 * @param usage        token accounting
 */
public record ChatResponse(String text, String finishReason, List<ToolCall> toolCalls, Usage usage) {

    public ChatResponse {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Usage.EMPTY : usage;
    }

    public static ChatResponse ofText(String text) {
        return new ChatResponse(text, "stop", List.of(), Usage.EMPTY);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public record Usage(int promptTokens, int completionTokens) {
        public static final Usage EMPTY = new Usage(0, 0);

        public int totalTokens() {
            return promptTokens + completionTokens;
        }
    }
}
