package com.drover.core.inference;

import java.time.Duration;
import java.util.List;

/**
 * Parameters of one completion call. Null numeric fields fall back to the model key's defaults.
 *
 * @param messages    conversation
 * @param tools       tools offered to the model (empty for none)
 * @param maxTokens   generation limit (nullable)
 * @param temperature sampling temperature (nullable)
 * @param toolChoice  "auto", "none", "required" or a tool name (nullable)
 * @param timeout     per-call timeout (nullable for the backend default)
 */
public record ChatRequest(
    List<ChatMessage> messages,
    List<ToolDefinition> tools,
    Integer maxTokens,
    Double temperature,
    String toolChoice,
    Duration timeout
) {

    public ChatRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public static ChatRequest of(List<ChatMessage> messages) {
        return new ChatRequest(messages, List.of(), null, null, null, null);
    }

    public ChatRequest withTools(List<ToolDefinition> newTools, String newToolChoice) {
        return new ChatRequest(messages, newTools, maxTokens, temperature, newToolChoice, timeout);
    }

    public ChatRequest withSampling(Integer newMaxTokens, Double newTemperature) {
        return new ChatRequest(messages, tools, newMaxTokens, newTemperature, toolChoice, timeout);
    }

    public ChatRequest withTimeout(Duration newTimeout) {
        return new ChatRequest(messages, tools, maxTokens, temperature, toolChoice, newTimeout);
    }

    public ChatRequest withMessages(List<ChatMessage> newMessages) {
        return new ChatRequest(newMessages, tools, maxTokens, temperature, toolChoice, timeout);
    }
}
