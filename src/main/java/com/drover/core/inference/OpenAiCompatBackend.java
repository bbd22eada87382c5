package com.drover.core.inference;

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
 * Backend for servers speaking the OpenAI HTTP API (LM Studio, vLLM, TGI, ...). Chat, streaming
 * and embeddings go through Spring AI's OpenAI model; model listing and LM Studio's load and
 * unload routes are plain JSON calls.
 * <p>
 * Discovery prefers LM Studio's native {@code /api/v1/models}, which reports whether a model is
 * actually loaded, and falls back to {@code /v1/models}, where every model counts as downloaded.
 */
public class OpenAiCompatBackend extends AbstractHttpBackend {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatBackend.class);

    public static final String TYPE = "openai";

    private final Object loadLock = new Object();
    private final OpenAiModels models;

    public OpenAiCompatBackend(String name, String baseUrl, String apiKey, int maxSlots,
                               Duration defaultTimeout, ObjectMapper objectMapper) {
        this(name, baseUrl, apiKey, maxSlots, defaultTimeout, defaultHttpClient(), null, objectMapper);
    }

    OpenAiCompatBackend(String name, String baseUrl, String apiKey, int maxSlots, Duration defaultTimeout,
                        HttpClient httpClient, ClientBuilders clients, ObjectMapper objectMapper) {
        super(name, baseUrl, apiKey, maxSlots, defaultTimeout, httpClient, objectMapper);
        this.models = new OpenAiModels(name, this.baseUrl, apiKey,
                clients != null ? clients : ClientBuilders.over(httpClient));
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<ModelInfo> discoverModels() {
        try {
            return discoverNative(getJson("/api/v1/models", DISCOVERY_TIMEOUT));
        } catch (InferenceException e) {
            log.debug("{}: native model listing unavailable ({}), falling back to /v1/models", name(), e.getMessage());
        }
        JsonNode body = getJson("/v1/models", DISCOVERY_TIMEOUT);
        var models = new ArrayList<ModelInfo>();
        for (JsonNode m : body.path("data")) {
            String id = m.path("id").asText("");
            modelStates.put(id, "downloaded");
            models.add(new ModelInfo(id, name(), "downloaded", capabilities(m.path("capabilities")), 0));
        }
        return models;
    }

    private List<ModelInfo> discoverNative(JsonNode body) {
        var models = new ArrayList<ModelInfo>();
        for (JsonNode m : body.path("models")) {
            String id = m.hasNonNull("key") ? m.get("key").asText() : m.path("id").asText("");
            boolean loaded = m.path("loaded_instances").size() > 0;
            String state = loaded ? "loaded" : "downloaded";
            modelStates.put(id, state);
            models.add(new ModelInfo(id, name(), state, capabilities(m.path("capabilities")),
                    m.path("size_bytes").asLong(0)));
        }
        return models;
    }

    private static List<String> capabilities(JsonNode caps) {
        var result = new ArrayList<String>();
        if (caps.isObject()) {
            caps.fieldNames().forEachRemaining(result::add);
        } else if (caps.isArray()) {
            caps.forEach(c -> result.add(c.asText()));
        }
        return result;
    }

    @Override
    public ChatResponse call(String modelId, ChatRequest request) {
        return models.call(modelId, request, timeoutOr(request.timeout()));
    }

    @Override
    public TokenStream stream(String modelId, ChatRequest request) {
        return models.stream(modelId, request, timeoutOr(request.timeout()));
    }

    @Override
    public List<float[]> embed(String modelId, List<String> texts, Duration timeout) {
        return models.embed(modelId, texts, timeoutOr(timeout));
    }

    @Override
    public boolean load(String modelId, Integer ttlSeconds) {
        synchronized (loadLock) {
            if ("loaded".equals(modelStates.get(modelId))) {
                return true;
            }
            try {
                for (JsonNode m : getJson("/api/v1/models", DISCOVERY_TIMEOUT).path("models")) {
                    String id = m.hasNonNull("key") ? m.get("key").asText() : m.path("id").asText("");
                    if (id.equals(modelId) && m.path("loaded_instances").size() > 0) {
                        modelStates.put(modelId, "loaded");
                        return true;
                    }
                }
            } catch (InferenceException e) {
                log.debug("{}: cannot read load state of {}: {}", name(), modelId, e.getMessage());
            }

            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("model", modelId);
            if (ttlSeconds != null) {
                payload.put("ttl", ttlSeconds);
            }
            log.info("Loading model {} on {}", modelId, name());
            if (postAccepted("/api/v1/models/load", payload, LOAD_TIMEOUT)) {
                modelStates.put(modelId, "loaded");
                log.info("Loaded {}{}", modelId, ttlSeconds != null ? " (TTL=" + ttlSeconds + "s)" : "");
                return true;
            }
            log.warn("Model {} not available on {}", modelId, name());
            return false;
        }
    }

    /**
     * Asks the server to unload. Servers without an unload endpoint manage memory themselves,
     * so the local state is marked unloaded either way.
     */
    @Override
    public boolean unload(String modelId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", modelId);
        if (postAccepted("/api/v1/models/unload", payload, DISCOVERY_TIMEOUT)) {
            log.info("Unloaded {} from {}", modelId, name());
        }
        modelStates.put(modelId, "unloaded");
        return true;
    }
}
