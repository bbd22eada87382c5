package com.drover.core.inference;

import com.drover.core.json.WireFormat;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.headerDoesNotExist;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpBackendsTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final ObjectMapper MAPPER = WireFormat.newObjectMapper();

    private RestClient.Builder rest;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        rest = RestClient.builder();
        server = MockRestServiceServer.bindTo(rest).build();
    }

    private static ChatRequest hello() {
        return ChatRequest.of(List.of(ChatMessage.user("hello"))).withSampling(32, 0.2);
    }

    private ClientBuilders clients() {
        return clients(WebClient.builder());
    }

    private ClientBuilders clients(WebClient.Builder web) {
        return new ClientBuilders() {
            @Override
            public RestClient.Builder rest(Duration readTimeout) {
                return rest;
            }

            @Override
            public WebClient.Builder web() {
                return web;
            }
        };
    }

    /** A WebClient whose every exchange answers with the given streaming body. */
    private static WebClient.Builder streaming(String contentType, String body) {
        return WebClient.builder().exchangeFunction(request -> Mono.just(ClientResponse.create(HttpStatus.OK)
                .header(HttpHeaders.CONTENT_TYPE, contentType)
                .body(body)
                .build()));
    }

    @Nested
    @DisplayName("OpenAI-compatible")
    class OpenAi {

        private OpenAiCompatBackend backend(String apiKey, StubHttp http, ClientBuilders clients) throws Exception {
            return new OpenAiCompatBackend("default", "http://localhost:1234/", apiKey, 2, TIMEOUT,
                    http.client(), clients, MAPPER);
        }

        @Test
        @DisplayName("completion text, tool calls and usage are read from the chat model")
        void parsesCompletion() throws Exception {
            server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(header("Authorization", "Bearer secret"))
                    .andExpect(jsonPath("$.model").value("qwen"))
                    .andExpect(jsonPath("$.max_tokens").value(32))
                    .andExpect(jsonPath("$.tools[0].function.name").value("read_workspace"))
                    .andRespond(withSuccess("""
                            {"id":"c0","object":"chat.completion","created":1,"model":"qwen",
                             "choices":[{"index":0,"finish_reason":"tool_calls","message":{"role":"assistant","content":"",
                               "tool_calls":[{"id":"c1","type":"function",
                                 "function":{"name":"read_workspace","arguments":"{\\"limit\\":3}"}}]}}],
                             "usage":{"prompt_tokens":12,"completion_tokens":4,"total_tokens":16}}""",
                            MediaType.APPLICATION_JSON));
            var tool = new ToolDefinition("read_workspace", "Reads workspace entries",
                    Map.of("type", "object", "properties", Map.of("limit", Map.of("type", "integer"))));

            ChatResponse response = backend("secret", new StubHttp(), clients())
                    .call("qwen", hello().withTools(List.of(tool), null));

            assertTrue(response.hasToolCalls());
            assertEquals(new ToolCall("c1", "read_workspace", "{\"limit\":3}"), response.toolCalls().get(0));
            assertEquals("tool_calls", response.finishReason());
            assertEquals(16, response.usage().totalTokens());
            server.verify();
        }

        @Test
        @DisplayName("HTTP errors become backend-unavailable with the status code")
        void httpError() throws Exception {
            server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                    .andExpect(headerDoesNotExist("Authorization"))
                    .andRespond(withServerError().body("model crashed"));

            var ex = assertThrows(BackendUnavailableException.class,
                    () -> backend(null, new StubHttp(), clients()).call("qwen", hello()));
            assertEquals(500, ex.getStatusCode());
            assertTrue(ex.getMessage().contains("model crashed"));
            server.verify();
        }

        @Test
        @DisplayName("connection failures and timeouts are told apart")
        void transportFailures() throws Exception {
            server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                    .andRespond(request -> {
                        throw new ConnectException("Connection refused");
                    });
            server.expect(requestTo("http://localhost:1234/v1/chat/completions"))
                    .andRespond(request -> {
                        throw new SocketTimeoutException("Read timed out");
                    });
            var backend = backend(null, new StubHttp(), clients());

            var refused = assertThrows(BackendUnavailableException.class, () -> backend.call("m", hello()));
            assertEquals(-1, refused.getStatusCode());
            assertThrows(InferenceTimeoutException.class, () -> backend.call("m", hello()));
        }

        @Test
        @DisplayName("discovery falls back to /v1/models without the native listing")
        void discoveryFallback() throws Exception {
            var http = new StubHttp().on("/v1/models", """
                    {"data":[{"id":"qwen"},{"id":"nomic-embed","capabilities":["embedding"]}]}""");

            var backend = backend(null, http, clients());
            List<ModelInfo> models = backend.discoverModels();

            assertEquals(List.of("/api/v1/models", "/v1/models"), http.paths());
            assertEquals(2, models.size());
            assertEquals(List.of("embedding"), models.get(1).capabilities());
            assertEquals("downloaded", backend.modelState("qwen"));
        }

        @Test
        @DisplayName("native listing reports loaded instances")
        void nativeDiscovery() throws Exception {
            var http = new StubHttp().on("/api/v1/models", """
                    {"models":[{"key":"qwen","loaded_instances":[{"id":"i1"}],"size_bytes":42}]}""");
            var backend = backend(null, http, clients());

            ModelInfo model = backend.discoverModels().get(0);

            assertEquals("loaded", model.state());
            assertEquals(42, model.sizeBytes());
            assertTrue(backend.load("qwen", 60));
            assertEquals(1, http.requests().size());
        }

        @Test
        @DisplayName("server-sent events are streamed until [DONE]")
        void streams() throws Exception {
            var web = streaming(MediaType.TEXT_EVENT_STREAM_VALUE, """
                    data: {"id":"c1","object":"chat.completion.chunk","created":1,"model":"qwen","choices":[{"index":0,"delta":{"role":"assistant","content":"Hel"},"finish_reason":null}]}

                    data: {"id":"c1","object":"chat.completion.chunk","created":1,"model":"qwen","choices":[{"index":0,"delta":{"content":"lo"},"finish_reason":null}]}

                    data: {"id":"c1","object":"chat.completion.chunk","created":1,"model":"qwen","choices":[{"index":0,"delta":{},"finish_reason":"stop"}]}

                    data: [DONE]

                    """);
            var fragments = new ArrayList<String>();

            try (TokenStream stream = backend(null, new StubHttp(), clients(web)).stream("qwen", hello())) {
                assertEquals("Hello", stream.collect(fragments::add));
            }
            assertEquals(List.of("Hel", "lo"), fragments);
        }

        @Test
        @DisplayName("embeddings come back in input order")
        void embeds() throws Exception {
            server.expect(requestTo("http://localhost:1234/v1/embeddings"))
                    .andExpect(jsonPath("$.model").value("nomic-embed"))
                    .andRespond(withSuccess("""
                            {"object":"list","model":"nomic-embed",
                             "data":[{"object":"embedding","index":1,"embedding":[0.5,0.5]},
                                     {"object":"embedding","index":0,"embedding":[1.0,0.0]}],
                             "usage":{"prompt_tokens":4,"total_tokens":4}}""", MediaType.APPLICATION_JSON));

            List<float[]> vectors = backend(null, new StubHttp(), clients())
                    .embed("nomic-embed", List.of("first", "second"), null);

            assertEquals(2, vectors.size());
            assertArrayEquals(new float[]{1.0f, 0.0f}, vectors.get(0));
            assertArrayEquals(new float[]{0.5f, 0.5f}, vectors.get(1));
        }
    }

    @Nested
    @DisplayName("Ollama")
    class Ollama {

        private OllamaBackend backend(StubHttp http, ClientBuilders clients) throws Exception {
            return new OllamaBackend("ollama", "http://localhost:11434", 2, TIMEOUT, http.client(), clients, MAPPER);
        }

        @Test
        @DisplayName(":latest tags are stripped from model names")
        void stripsLatest() {
            assertEquals("llama3", OllamaBackend.stripLatest("llama3:latest"));
            assertEquals("qwen2.5:7b", OllamaBackend.stripLatest("qwen2.5:7b"));
        }

        @Test
        @DisplayName("chat response maps the done reason and token counts")
        void call() throws Exception {
            server.expect(requestTo("http://localhost:11434/api/chat"))
                    .andExpect(jsonPath("$.model").value("llama3"))
                    .andExpect(jsonPath("$.stream").value(false))
                    .andRespond(withSuccess("""
                            {"model":"llama3","created_at":"2024-05-01T10:00:00Z",
                             "message":{"role":"assistant","content":"hi there"},"done":true,"done_reason":"stop",
                             "total_duration":10,"load_duration":1,"prompt_eval_count":7,"prompt_eval_duration":2,
                             "eval_count":3,"eval_duration":3}""", MediaType.APPLICATION_JSON));

            ChatResponse response = backend(new StubHttp(), clients()).call("llama3", hello());

            assertEquals("hi there", response.text());
            assertEquals("stop", response.finishReason());
            assertEquals(10, response.usage().totalTokens());
            server.verify();
        }

        @Test
        @DisplayName("discovery lists tags with embedding capability detection")
        void discovers() throws Exception {
            server.expect(requestTo("http://localhost:11434/api/tags"))
                    .andExpect(method(HttpMethod.GET))
                    .andRespond(withSuccess("""
                            {"models":[{"name":"llama3:latest","model":"llama3:latest","size":100},
                                       {"name":"nomic-embed-text:latest","model":"nomic-embed-text:latest"}]}""",
                            MediaType.APPLICATION_JSON));

            List<ModelInfo> models = backend(new StubHttp(), clients()).discoverModels();

            assertEquals("llama3", models.get(0).id());
            assertEquals(100, models.get(0).sizeBytes());
            assertEquals(List.of("chat"), models.get(0).capabilities());
            assertEquals(List.of("embedding"), models.get(1).capabilities());
        }

        @Test
        @DisplayName("NDJSON chunks stream until done")
        void streams() throws Exception {
            var web = streaming("application/x-ndjson", """
                    {"model":"llama3","created_at":"2024-05-01T10:00:00Z","message":{"role":"assistant","content":"a"},"done":false}
                    {"model":"llama3","created_at":"2024-05-01T10:00:00Z","message":{"role":"assistant","content":"b"},"done":false}
                    {"model":"llama3","created_at":"2024-05-01T10:00:00Z","message":{"role":"assistant","content":""},"done":true,"done_reason":"stop","total_duration":10,"load_duration":1,"prompt_eval_count":3,"prompt_eval_duration":2,"eval_count":2,"eval_duration":3}
                    """);

            try (TokenStream stream = backend(new StubHttp(), clients(web)).stream("llama3", hello())) {
                assertEquals("ab", stream.collect(null));
            }
        }

        @Test
        @DisplayName("old servers without /api/embed are embedded one text at a time")
        void embedFallback() throws Exception {
            server.expect(requestTo("http://localhost:11434/api/embed"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND).body("404 page not found"));
            var http = new StubHttp().on("/api/embeddings", "{\"embedding\":[0.5,0.25]}");

            List<float[]> vectors = backend(http, clients()).embed("nomic-embed-text", List.of("a", "b"), null);

            assertEquals(2, vectors.size());
            assertArrayEquals(new float[]{0.5f, 0.25f}, vectors.get(1));
            assertEquals(List.of("/api/embeddings", "/api/embeddings"), http.paths());
            server.verify();
        }

        @Test
        @DisplayName("load checks the model, then pre-warms it with the TTL as keep-alive")
        void load() throws Exception {
            server.expect(requestTo("http://localhost:11434/api/show"))
                    .andExpect(jsonPath("$.model").value("llama3"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));
            server.expect(requestTo("http://localhost:11434/api/chat"))
                    .andExpect(jsonPath("$.keep_alive").value("60s"))
                    .andRespond(withSuccess("""
                            {"model":"llama3","created_at":"2024-05-01T10:00:00Z",
                             "message":{"role":"assistant","content":""},"done":true,"done_reason":"load"}""",
                            MediaType.APPLICATION_JSON));
            var backend = backend(new StubHttp(), clients());

            assertTrue(backend.load("llama3", 60));
            assertTrue(backend.load("llama3", 60));
            assertEquals("loaded", backend.modelState("llama3"));
            server.verify();
        }
    }

    @Nested
    @DisplayName("llama.cpp")
    class LlamaCpp {

        @Test
        @DisplayName("ChatML prompt ends with an open assistant turn")
        void chatMl() {
            String prompt = LlamaCppBackend.toChatMl(List.of(ChatMessage.system("be brief"), ChatMessage.user("hi")));
            assertEquals("<|im_start|>system\nbe brief<|im_end|>\n"
                    + "<|im_start|>user\nhi<|im_end|>\n"
                    + "<|im_start|>assistant\n", prompt);
        }

        @Test
        @DisplayName("modern servers are detected from /v1/models and chat through the OpenAI routes")
        void modernServer() throws Exception {
            var http = new StubHttp().on("/v1/models", "{\"data\":[{\"id\":\"phi-3\"}]}");
            server.expect(requestTo("http://localhost:8080/v1/chat/completions"))
                    .andRespond(withSuccess("""
                            {"id":"c0","object":"chat.completion","created":1,"model":"phi-3",
                             "choices":[{"index":0,"finish_reason":"stop","message":{"role":"assistant","content":"ok"}}],
                             "usage":{"prompt_tokens":1,"completion_tokens":1,"total_tokens":2}}""",
                            MediaType.APPLICATION_JSON));
            var backend = new LlamaCppBackend("llamacpp", "http://localhost:8080", 1, TIMEOUT, http.client(),
                    clients(), MAPPER);

            assertTrue(backend.isModern());
            assertEquals("phi-3", backend.discoverModels().get(0).id());
            assertEquals("ok", backend.call("phi-3", hello()).text());
            server.verify();
        }

        @Test
        @DisplayName("legacy servers are described from /props and /health")
        void legacyServer() throws Exception {
            var http = new StubHttp()
                    .on("/health", "{\"status\":\"ok\"}")
                    .on("/props", "{\"default_generation_settings\":{\"model\":\"/models/mistral.gguf\"}}");
            var backend = new LlamaCppBackend("llamacpp", "http://localhost:8080", 1, TIMEOUT, http.client(),
                    clients(), MAPPER);

            assertFalse(backend.isModern());
            ModelInfo model = backend.discoverModels().get(0);
            assertEquals("/models/mistral.gguf", model.id());
            assertEquals("loaded", model.state());
        }

        @Test
        @DisplayName("legacy /completion streams stop at the stop flag")
        void legacyStream() throws Exception {
            var http = new StubHttp()
                    .on("/health", "{\"status\":\"ok\"}")
                    .onStream("/completion", """
                            data: {"content":"Hi","stop":false}
                            data: {"content":" there","stop":true}
                            data: {"content":"ignored","stop":false}
                            """);
            var backend = new LlamaCppBackend("llamacpp", "http://localhost:8080", 1, TIMEOUT, http.client(),
                    clients(), MAPPER);

            try (TokenStream stream = backend.stream("mistral", hello())) {
                assertEquals("Hi there", stream.collect(null));
            }
        }
    }
}
