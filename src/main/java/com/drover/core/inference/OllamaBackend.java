package com.drover.core.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.ollama.OllamaEmbeddingModel;
import org.springframework.ai.ollama.api.OllamaApi;
import org.springframework.ai.ollama.api.OllamaOptions;
import org.springframework.web.client.DefaultResponseErrorHandler;
import reactor.core.publisher.Flux;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend for the Ollama native API, driven through Spring AI's {@link OllamaApi} and
 * {@link OllamaChatModel}. Only the single-text {@code /api/embeddings} fallback for old servers
 * is a plain JSON call.
 */
public class OllamaBackend extends AbstractHttpBackend {

    private static final Logger log = LoggerFactory.getLogger(OllamaBackend.class);

    public static final String TYPE = "ollama";

    private static final Duration PULL_TIMEOUT = Duration.ofHours(1);

    private final Object loadLock = new Object();
    private final ClientBuilders clients;
    private final Map<Duration, OllamaApi> apis = new ConcurrentHashMap<>();

    public OllamaBackend(String name, String baseUrl, int maxSlots, Duration defaultTimeout,
                         ObjectMapper objectMapper) {
        this(name, baseUrl, maxSlots, defaultTimeout, defaultHttpClient(), null, objectMapper);
    }

    OllamaBackend(String name, String baseUrl, int maxSlots, Duration defaultTimeout,
                  HttpClient httpClient, ClientBuilders clients, ObjectMapper objectMapper) {
        super(name, baseUrl, null, maxSlots, defaultTimeout, httpClient, objectMapper);
        this.clients = clients != null ? clients : ClientBuilders.over(httpClient);
    }

    @Override
    public String type() {
        return TYPE;
    }

    private OllamaApi api(Duration timeout) {
        return apis.computeIfAbsent(timeout, t -> OllamaApi.builder()
                .baseUrl(baseUrl)
                .restClientBuilder(clients.rest(t))
                .webClientBuilder(clients.web())
                .responseErrorHandler(new DefaultResponseErrorHandler())
                .build());
    }

    private OllamaChatModel chatModel(Duration timeout) {
        return OllamaChatModel.builder().ollamaApi(api(timeout)).build();
    }

    @Override
    public List<ModelInfo> discoverModels() {
        OllamaApi.ListModelResponse listing;
        try {
            listing = api(DISCOVERY_TIMEOUT).listModels();
        } catch (RuntimeException e) {
            throw SpringAiBridge.translate(name(), e);
        }
        var models = new ArrayList<ModelInfo>();
        if (listing == null || listing.models() == null) {
            return models;
        }
        for (OllamaApi.Model m : listing.models()) {
            String id = stripLatest(m.name() == null ? "" : m.name());
            List<String> caps = id.toLowerCase().contains("embed") ? List.of("embedding") : List.of("chat");
            modelStates.putIfAbsent(id, "downloaded");
            models.add(new ModelInfo(id, name(), modelStates.get(id), caps, m.size() == null ? 0 : m.size()));
        }
        return models;
    }

    static String stripLatest(String name) {
        return name.endsWith(":latest") ? name.substring(0, name.length() - ":latest".length()) : name;
    }

    @Override
    public ChatResponse call(String modelId, ChatRequest request) {
        try {
            return SpringAiBridge.fromSpringAi(chatModel(timeoutOr(request.timeout())).call(prompt(modelId, request)));
        } catch (RuntimeException e) {
            throw SpringAiBridge.translate(name(), e);
        }
    }

    @Override
    public TokenStream stream(String modelId, ChatRequest request) {
        Duration timeout = timeoutOr(request.timeout());
        return SpringAiBridge.stream(name(),
                Flux.defer(() -> chatModel(timeout).stream(prompt(modelId, request))), timeout);
    }

    private static Prompt prompt(String modelId, ChatRequest request) {
        var options = OllamaOptions.builder()
                .model(modelId)
                .numPredict(request.maxTokens())
                .temperature(request.temperature())
                .toolCallbacks(SpringAiBridge.toolCallbacks(request))
                .internalToolExecutionEnabled(false)
                .build();
        return new Prompt(SpringAiBridge.toMessages(request.messages()), options);
    }

    /**
     * Embeds with the batch {@code /api/embed} endpoint, falling back to one
     * {@code /api/embeddings} call per text on servers that answer the batch route with an error.
     */
    @Override
    public List<float[]> embed(String modelId, List<String> texts, Duration timeout) {
        var options = OllamaOptions.builder().model(modelId).build();
        try {
            var model = OllamaEmbeddingModel.builder().ollamaApi(api(timeoutOr(timeout))).defaultOptions(options).build();
            List<float[]> vectors = SpringAiBridge.vectors(model.call(new EmbeddingRequest(texts, options)));
            if (vectors.size() == texts.size()) {
                return vectors;
            }
        } catch (RuntimeException e) {
            InferenceException failure = SpringAiBridge.translate(name(), e);
            if (!(failure instanceof BackendUnavailableException unavailable) || unavailable.getStatusCode() < 0) {
                throw failure;
            }
            log.debug("{}: batch embed unsupported ({}), embedding one text at a time", name(), failure.getMessage());
        }

        var vectors = new ArrayList<float[]>(texts.size());
        for (String text : texts) {
            ObjectNode single = objectMapper.createObjectNode();
            single.put("model", modelId);
            single.put("prompt", text);
            vectors.add(toVector(postJson("/api/embeddings", single, timeoutOr(timeout)).path("embedding")));
        }
        return vectors;
    }

    /**
     * Confirms the model exists, then asks Ollama to load it with an empty chat. The TTL becomes
     * the {@code keep_alive} of that request.
     */
    @Override
    public boolean load(String modelId, Integer ttlSeconds) {
        synchronized (loadLock) {
            if ("loaded".equals(modelStates.get(modelId))) {
                return true;
            }
            try {
                api(DISCOVERY_TIMEOUT).showModel(new OllamaApi.ShowModelRequest(modelId));
            } catch (RuntimeException e) {
                log.warn("Model {} not found on {}: {}", modelId, name(), SpringAiBridge.translate(name(), e).getMessage());
                return false;
            }
            try {
                api(LOAD_TIMEOUT).chat(OllamaApi.ChatRequest.builder(modelId)
                        .messages(List.of())
                        .stream(false)
                        .keepAlive(ttlSeconds != null ? ttlSeconds + "s" : null)
                        .build());
                modelStates.put(modelId, "loaded");
                log.info("Loaded {} on {}", modelId, name());
                return true;
            } catch (RuntimeException e) {
                log.warn("Failed to pre-warm {} on {}: {}", modelId, name(), SpringAiBridge.translate(name(), e).getMessage());
                return false;
            }
        }
    }

    @Override
    public boolean unload(String modelId) {
        boolean accepted;
        try {
            api(DISCOVERY_TIMEOUT).chat(OllamaApi.ChatRequest.builder(modelId)
                    .messages(List.of())
                    .stream(false)
                    .keepAlive("0")
                    .build());
            accepted = true;
            log.info("Unloaded {} from {}", modelId, name());
        } catch (RuntimeException e) {
            log.debug("{}: unload of {} not accepted: {}", name(), modelId, e.getMessage());
            accepted = false;
        }
        modelStates.put(modelId, "unloaded");
        return accepted;
    }

    @Override
    public boolean download(String modelId) {
        log.info("Pulling {} on {}", modelId, name());
        try {
            OllamaApi.ProgressResponse last = api(PULL_TIMEOUT)
                    .pullModel(new OllamaApi.PullModelRequest(modelId))
                    .blockLast(PULL_TIMEOUT);
            if (last == null || !"success".equals(last.status())) {
                log.warn("Pull of {} ended with status {}", modelId, last == null ? "none" : last.status());
                return false;
            }
            modelStates.put(modelId, "downloaded");
            return true;
        } catch (RuntimeException e) {
            log.warn("Pull of {} failed: {}", modelId, SpringAiBridge.translate(name(), e).getMessage());
            return false;
        }
    }
}
