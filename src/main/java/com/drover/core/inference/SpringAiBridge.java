package com.drover.core.inference;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.model.ModelOptionsUtils;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Conversions between the router's backend-neutral types and Spring AI's chat and embedding
 * model API, plus the mapping of Spring HTTP failures onto {@link InferenceException}s.
 */
final class SpringAiBridge {

    private SpringAiBridge() {
    }

    static List<Message> toMessages(List<ChatMessage> messages) {
        var converted = new ArrayList<Message>(messages.size());
        var toolNames = new HashMap<String, String>();
        for (ChatMessage message : messages) {
            switch (message.role()) {
                case "system" -> converted.add(new SystemMessage(message.content()));
                case "assistant" -> {
                    var calls = new ArrayList<AssistantMessage.ToolCall>();
                    for (ToolCall call : message.toolCalls()) {
                        toolNames.put(call.id(), call.name());
                        calls.add(new AssistantMessage.ToolCall(call.id(), "function", call.name(), call.arguments()));
                    }
                    converted.add(new AssistantMessage(message.content(), Map.of(), calls));
                }
                case "tool" -> {
                    String id = message.toolCallId() == null ? "" : message.toolCallId();
                    converted.add(new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse(
                            id, toolNames.getOrDefault(id, ""), message.content()))));
                }
                default -> converted.add(new UserMessage(message.content()));
            }
        }
        return converted;
    }

    /**
     * Tool definitions offered to the model. A {@code "none"} tool choice offers nothing.
     */
    static List<ToolCallback> toolCallbacks(ChatRequest request) {
        if (request.tools().isEmpty() || "none".equals(request.toolChoice())) {
            return List.of();
        }
        return request.tools().stream()
                .map(tool -> (ToolCallback) new DeclaredTool(
                        org.springframework.ai.tool.definition.ToolDefinition.builder()
                                .name(tool.name())
                                .description(tool.description())
                                .inputSchema(ModelOptionsUtils.toJsonString(tool.parameters()))
                                .build()))
                .toList();
    }

    static ChatResponse fromSpringAi(org.springframework.ai.chat.model.ChatResponse response) {
        Generation generation = response == null ? null : response.getResult();
        if (generation == null || generation.getOutput() == null) {
            return new ChatResponse("", "stop", List.of(), ChatResponse.Usage.EMPTY);
        }
        AssistantMessage output = generation.getOutput();
        var calls = new ArrayList<ToolCall>();
        if (output.getToolCalls() != null) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                String id = call.id() == null || call.id().isBlank()
                        ? "call_" + UUID.randomUUID().toString().substring(0, 8)
                        : call.id();
                String arguments = call.arguments() == null || call.arguments().isBlank() ? "{}" : call.arguments();
                calls.add(new ToolCall(id, call.name(), arguments));
            }
        }
        return new ChatResponse(output.getText(), finishReason(generation, calls), calls, usage(response));
    }

    private static String finishReason(Generation generation, List<ToolCall> calls) {
        if (!calls.isEmpty()) {
            return "tool_calls";
        }
        String reason = generation.getMetadata() == null ? null : generation.getMetadata().getFinishReason();
        return reason == null || reason.isBlank() ? "stop" : reason.toLowerCase(Locale.ROOT);
    }

    private static ChatResponse.Usage usage(org.springframework.ai.chat.model.ChatResponse response) {
        Usage usage = response.getMetadata() == null ? null : response.getMetadata().getUsage();
        if (usage == null) {
            return ChatResponse.Usage.EMPTY;
        }
        return new ChatResponse.Usage(orZero(usage.getPromptTokens()), orZero(usage.getCompletionTokens()));
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    /**
     * Text fragments of a streaming completion. A gap longer than {@code idleTimeout} between
     * fragments fails the stream.
     */
    static TokenStream stream(String backend, Flux<org.springframework.ai.chat.model.ChatResponse> responses,
                              Duration idleTimeout) {
        Flux<String> fragments = responses
                .timeout(idleTimeout)
                .map(SpringAiBridge::fragment)
                .filter(text -> !text.isEmpty());
        return TokenStream.ofFlux(backend, fragments, e -> translate(backend, e));
    }

    private static String fragment(org.springframework.ai.chat.model.ChatResponse chunk) {
        Generation generation = chunk.getResult();
        if (generation == null || generation.getOutput() == null || generation.getOutput().getText() == null) {
            return "";
        }
        return generation.getOutput().getText();
    }

    static List<float[]> vectors(EmbeddingResponse response) {
        return response.getResults().stream()
                .sorted(Comparator.comparing(Embedding::getIndex, Comparator.nullsLast(Comparator.naturalOrder())))
                .map(Embedding::getOutput)
                .toList();
    }

    static InferenceException translate(String backend, RuntimeException e) {
        if (e instanceof InferenceException inference) {
            return inference;
        }
        Throwable cause = NestedExceptionUtils.getMostSpecificCause(e);
        if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException
                || cause instanceof TimeoutException) {
            return new InferenceTimeoutException("%s request timed out".formatted(backend), e);
        }
        if (e instanceof RestClientResponseException response) {
            int status = response.getStatusCode().value();
            return new BackendUnavailableException(backend, status,
                    "%s request failed (HTTP %d): %s".formatted(backend, status, response.getResponseBodyAsString()), e);
        }
        if (e instanceof WebClientResponseException response) {
            int status = response.getStatusCode().value();
            return new BackendUnavailableException(backend, status,
                    "%s stream failed (HTTP %d): %s".formatted(backend, status, response.getResponseBodyAsString()), e);
        }
        return new BackendUnavailableException(backend, -1,
                "Cannot reach %s: %s".formatted(backend, cause.getMessage()), e);
    }

    /** A tool the model may ask for. The requesting agent runs it, never the chat model. */
    private record DeclaredTool(org.springframework.ai.tool.definition.ToolDefinition definition)
            implements ToolCallback {

        @Override
        public org.springframework.ai.tool.definition.ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("Tool " + definition.name() + " runs in the requesting agent");
        }
    }
}
