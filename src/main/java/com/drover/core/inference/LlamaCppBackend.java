package com.drover.core.inference;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Backend for a llama.cpp server process, which serves exactly one model.
 * <p>
 * Modern servers expose the OpenAI routes under {@code /v1} and are driven through Spring AI's
 * OpenAI model; legacy ones only offer {@code /completion}, which takes a raw ChatML prompt.
 * The mode is detected once and cached.
 */
public class LlamaCppBackend extends AbstractHttpBackend {

    private static final Logger log = LoggerFactory.getLogger(LlamaCppBackend.class);

    public static final String TYPE = "llamacpp";

    private static final String[] CHATML_STOP = {"<|im_end|>", "<|im_start|>"};

    private final OpenAiModels models;
    private volatile Boolean modern;
    private volatile String serverModel;

    public LlamaCppBackend(String name, String baseUrl, int maxSlots, Duration defaultTimeout,
                           ObjectMapper objectMapper) {
        this(name, baseUrl, maxSlots, defaultTimeout, defaultHttpClient(), null, objectMapper);
    }

    LlamaCppBackend(String name, String baseUrl, int maxSlots, Duration defaultTimeout,
                    HttpClient httpClient, ClientBuilders clients, ObjectMapper objectMapper) {
        super(name, baseUrl, null, maxSlots, defaultTimeout, httpClient, objectMapper);
        this.models = new OpenAiModels(name, this.baseUrl, null,
                clients != null ? clients : ClientBuilders.over(httpClient));
    }

    @Override
    public String type() {
        return TYPE;
    }

    boolean isModern() {
        Boolean cached = modern;
        if (cached != null) {
            return cached;
        }
        try {
            JsonNode models = getJson("/v1/models", DISCOVERY_TIMEOUT);
            JsonNode first = models.path("data").path(0);
            if (!first.isMissingNode()) {
                serverModel = first.path("id").asText("unknown");
            }
            modern = true;
        } catch (InferenceException e) {
            getJson("/health", DISCOVERY_TIMEOUT);
            modern = false;
        }
        log.info("{}: detected {} llama.cpp server", name(), modern ? "modern" : "legacy");
        return modern;
    }

    @Override
    public List<ModelInfo> discoverModels() {
        var models = new ArrayList<ModelInfo>();
        if (isModern()) {
            for (JsonNode m : getJson("/v1/models", DISCOVERY_TIMEOUT).path("data")) {
                String id = m.path("id").asText("unknown");
                modelStates.put(id, "loaded");
                models.add(new ModelInfo(id, name(), "loaded", List.of("chat"), 0));
            }
            return models;
        }
        String id = "unknown";
        try {
            JsonNode props = getJson("/props", DISCOVERY_TIMEOUT);
            id = props.path("default_generation_settings").path("model").asText("unknown");
        } catch (InferenceException e) {
            log.debug("{}: /props unavailable: {}", name(), e.getMessage());
        }
        serverModel = id;
        String status = getJson("/health", DISCOVERY_TIMEOUT).path("status").asText("unknown");
        String state = "ok".equals(status) ? "loaded" : "unknown";
        modelStates.put(id, state);
        models.add(new ModelInfo(id, name(), state, List.of("chat"), 0));
        return models;
    }

    @Override
    public ChatResponse call(String modelId, ChatRequest request) {
        if (isModern()) {
            return models.call(modelId, request, timeoutOr(request.timeout()));
        }
        JsonNode body = postJson("/completion", completionPayload(request, false), timeoutOr(request.timeout()));
        var usage = new ChatResponse.Usage(body.path("tokens_evaluated").asInt(0), body.path("tokens_predicted").asInt(0));
        String stopType = body.path("stop_type").asText("eos");
        return new ChatResponse(body.path("content").asText("").strip(),
                "limit".equals(stopType) ? "length" : "stop", List.of(), usage);
    }

    @Override
    public TokenStream stream(String modelId, ChatRequest request) {
        if (isModern()) {
            return models.stream(modelId, request, timeoutOr(request.timeout()));
        }
        return postStream("/completion", completionPayload(request, true), timeoutOr(request.timeout()),
                this::decodeLegacyLine);
    }

    private TokenStream.Chunk decodeLegacyLine(String line) {
        if (!line.startsWith("data:")) {
            return null;
        }
        try {
            JsonNode chunk = objectMapper.readTree(line.substring(5).trim());
            String text = chunk.path("content").asText("");
            return chunk.path("stop").asBoolean(false) ? new TokenStream.Chunk(text, true) : TokenStream.Chunk.of(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private ObjectNode completionPayload(ChatRequest request, boolean stream) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("prompt", toChatMl(request.messages()));
        payload.put("n_predict", request.maxTokens());
        payload.put("temperature", request.temperature());
        payload.put("stream", stream);
        var stop = payload.putArray("stop");
        for (String s : CHATML_STOP) {
            stop.add(s);
        }
        return payload;
    }

    /**
     * Renders a conversation as a ChatML prompt that ends with an open assistant turn.
     */
    static String toChatMl(List<ChatMessage> messages) {
        var prompt = new StringBuilder();
        for (ChatMessage message : messages) {
            prompt.append("<|im_start|>").append(message.role()).append('\n')
                    .append(message.content()).append("<|im_end|>\n");
        }
        prompt.append("<|im_start|>assistant\n");
        return prompt.toString();
    }

    @Override
    public List<float[]> embed(String modelId, List<String> texts, Duration timeout) {
        if (isModern()) {
            return models.embed(modelId, texts, timeoutOr(timeout));
        }
        var vectors = new ArrayList<float[]>(texts.size());
        for (String text : texts) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("content", text);
            vectors.add(toVector(postJson("/embedding", payload, timeoutOr(timeout)).path("embedding")));
        }
        return vectors;
    }

    /**
     * The server loads its model at process start, so loading is a health check.
     */
    @Override
    public boolean load(String modelId, Integer ttlSeconds) {
        if ("loaded".equals(modelStates.get(modelId))) {
            return true;
        }
        try {
            String status = getJson("/health", DISCOVERY_TIMEOUT).path("status").asText("");
            if ("ok".equals(status)) {
                modelStates.put(modelId, "loaded");
                return true;
            }
            log.info("{}: server reports '{}' for {}", name(), status, modelId);
        } catch (InferenceException e) {
            log.warn("{}: health check failed while loading {}: {}", name(), modelId, e.getMessage());
        }
        return false;
    }

    /** Advisory only; the process keeps its model until restarted. */
    @Override
    public boolean unload(String modelId) {
        modelStates.put(modelId, "unloaded");
        return true;
    }

    String serverModel() {
        return serverModel;
    }
}
