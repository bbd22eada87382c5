package com.drover.core.inference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import reactor.core.publisher.Flux;

import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpringAiBridgeTest {

    @Test
    @DisplayName("conversation roles map onto Spring AI messages and tool results keep their tool name")
    void toMessages() {
        List<Message> messages = SpringAiBridge.toMessages(List.of(
                ChatMessage.system("be brief"),
                ChatMessage.user("list files"),
                ChatMessage.assistant("", List.of(new ToolCall("c1", "list_dir", "{}"))),
                ChatMessage.tool("c1", "a.txt")));

        assertInstanceOf(SystemMessage.class, messages.get(0));
        assertInstanceOf(UserMessage.class, messages.get(1));
        var assistant = assertInstanceOf(AssistantMessage.class, messages.get(2));
        assertEquals("list_dir", assistant.getToolCalls().get(0).name());
        var toolResult = assertInstanceOf(ToolResponseMessage.class, messages.get(3));
        ToolResponseMessage.ToolResponse response = toolResult.getResponses().get(0);
        assertEquals("c1", response.id());
        assertEquals("list_dir", response.name());
        assertEquals("a.txt", response.responseData());
    }

    @Test
    @DisplayName("tools are offered as declared callbacks unless the tool choice is none")
    void toolCallbacks() {
        var tool = new ToolDefinition("read_file", "Reads a file",
                Map.of("type", "object", "properties", Map.of("path", Map.of("type", "string"))));
        var request = ChatRequest.of(List.of(ChatMessage.user("hi"))).withTools(List.of(tool), null);

        List<ToolCallback> callbacks = SpringAiBridge.toolCallbacks(request);

        assertEquals(1, callbacks.size());
        assertEquals("read_file", callbacks.get(0).getToolDefinition().name());
        assertTrue(callbacks.get(0).getToolDefinition().inputSchema().contains("\"path\""));
        assertThrows(UnsupportedOperationException.class, () -> callbacks.get(0).call("{}"));
        assertTrue(SpringAiBridge.toolCallbacks(request.withTools(List.of(tool), "none")).isEmpty());
    }

    @Test
    @DisplayName("tool calls without ids get generated ids and empty arguments become an empty object")
    void fromSpringAi() {
        var output = new AssistantMessage("", Map.of(),
                List.of(new AssistantMessage.ToolCall("", "function", "list_dir", "")));
        var generation = new Generation(output, ChatGenerationMetadata.builder().finishReason("STOP").build());

        ChatResponse response = SpringAiBridge.fromSpringAi(
                new org.springframework.ai.chat.model.ChatResponse(List.of(generation)));

        ToolCall call = response.toolCalls().get(0);
        assertTrue(call.id().startsWith("call_"));
        assertEquals("{}", call.arguments());
        assertEquals("tool_calls", response.finishReason());
    }

    @Test
    @DisplayName("finish reasons are lower-cased")
    void finishReason() {
        var generation = new Generation(new AssistantMessage("done"),
                ChatGenerationMetadata.builder().finishReason("LENGTH").build());

        ChatResponse response = SpringAiBridge.fromSpringAi(
                new org.springframework.ai.chat.model.ChatResponse(List.of(generation)));

        assertEquals("done", response.text());
        assertEquals("length", response.finishReason());
    }

    @Test
    @DisplayName("a stalled stream fails with an inference timeout")
    void idleStream() {
        var chunk = new org.springframework.ai.chat.model.ChatResponse(
                List.of(new Generation(new AssistantMessage("partial"))));
        TokenStream stream = SpringAiBridge.stream("local",
                Flux.just(chunk).concatWith(Flux.never()), Duration.ofMillis(50));

        var fragments = new ArrayList<String>();
        assertThrows(InferenceTimeoutException.class, () -> stream.collect(fragments::add));
        assertEquals(List.of("partial"), fragments);
    }

    @Test
    @DisplayName("HTTP failures are translated by kind")
    void translate() {
        var timeout = new ResourceAccessException("I/O error", new SocketTimeoutException("Read timed out"));
        var serverError = new HttpServerErrorException(HttpStatus.BAD_GATEWAY, "Bad Gateway",
                "upstream down".getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);

        assertInstanceOf(InferenceTimeoutException.class, SpringAiBridge.translate("local", timeout));
        var unavailable = assertInstanceOf(BackendUnavailableException.class,
                SpringAiBridge.translate("local", serverError));
        assertEquals(502, unavailable.getStatusCode());
        assertTrue(unavailable.getMessage().contains("upstream down"));
        var existing = new InferenceException("already mapped");
        assertSame(existing, SpringAiBridge.translate("local", existing));
    }
}
