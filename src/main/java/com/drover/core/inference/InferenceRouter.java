package com.drover.core.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Single entry point for inference. Resolves logical model keys to a backend and model id,
 * then delegates to that backend.
 * <p>
 * Resolution is a direct lookup: the first configured mapping for a key wins. An unmapped key is
 * treated as a raw model id on the default backend (the one named {@code default}, else the first
 * enabled one).
 */
@Service
public class InferenceRouter {

    private static final Logger log = LoggerFactory.getLogger(InferenceRouter.class);

    public static final String DEFAULT_BACKEND = "default";

    private final Map<String, InferenceBackend> backends = new LinkedHashMap<>();
    private final List<InferenceProperties.ModelMapping> mappings;
    private final int defaultMaxTokens;
    private final double defaultTemperature;

    @Autowired
    public InferenceRouter(InferenceProperties properties, ObjectMapper objectMapper) {
        this(createBackends(properties.getBackends(), objectMapper), properties);
    }

    public InferenceRouter(List<InferenceBackend> backendList, InferenceProperties properties) {
        for (InferenceBackend backend : backendList) {
            backends.putIfAbsent(backend.name(), backend);
        }
        this.mappings = List.copyOf(properties.getModels());
        this.defaultMaxTokens = properties.getDefaultMaxTokens();
        this.defaultTemperature = properties.getDefaultTemperature();
        log.info("Inference router ready: backends={}, model keys={}", backends.keySet(),
                mappings.stream().map(InferenceProperties.ModelMapping::getKey).toList());
    }

    static List<InferenceBackend> createBackends(List<InferenceProperties.Backend> configs, ObjectMapper objectMapper) {
        var result = new ArrayList<InferenceBackend>();
        for (var cfg : configs) {
            if (!cfg.isEnabled()) {
                log.info("Backend {} disabled, skipping", cfg.getName());
                continue;
            }
            switch (cfg.getType().toLowerCase()) {
                case OpenAiCompatBackend.TYPE -> result.add(new OpenAiCompatBackend(cfg.getName(), cfg.getUrl(),
                        cfg.getApiKey(), cfg.getMaxSlots(), cfg.getTimeout(), objectMapper));
                case OllamaBackend.TYPE -> result.add(new OllamaBackend(cfg.getName(), cfg.getUrl(),
                        cfg.getMaxSlots(), cfg.getTimeout(), objectMapper));
                case LlamaCppBackend.TYPE -> result.add(new LlamaCppBackend(cfg.getName(), cfg.getUrl(),
                        cfg.getMaxSlots(), cfg.getTimeout(), objectMapper));
                default -> log.warn("Unknown backend type '{}' for backend {}, skipping", cfg.getType(), cfg.getName());
            }
        }
        return result;
    }

    /**
     * Where a model key ends up.
     *
     * @param backend     serving backend
     * @param modelId     backend-specific model id
     * @param maxTokens   default generation limit for the key
     * @param temperature default temperature for the key
     */
    public record ResolvedModel(InferenceBackend backend, String modelId, int maxTokens, double temperature) {}

    public ResolvedModel resolve(String modelKey) {
        for (var mapping : mappings) {
            if (mapping.getKey().equals(modelKey)) {
                InferenceBackend backend = backends.get(mapping.getBackend());
                if (backend == null) {
                    log.warn("Model key {} maps to unknown backend {}, using default", modelKey, mapping.getBackend());
                    backend = defaultBackend();
                }
                if (backend == null) break;
                return new ResolvedModel(backend, mapping.getModelId(),
                        mapping.getMaxTokens() != null ? mapping.getMaxTokens() : defaultMaxTokens,
                        mapping.getTemperature() != null ? mapping.getTemperature() : defaultTemperature);
            }
        }
        InferenceBackend fallback = defaultBackend();
        if (fallback == null) {
            throw new UnknownModelException(modelKey);
        }
        return new ResolvedModel(fallback, modelKey, defaultMaxTokens, defaultTemperature);
    }

    private InferenceBackend defaultBackend() {
        InferenceBackend named = backends.get(DEFAULT_BACKEND);
        if (named != null) {
            return named;
        }
        return backends.values().stream().findFirst().orElse(null);
    }

    public Collection<InferenceBackend> backends() {
        return List.copyOf(backends.values());
    }

    public List<String> modelKeys() {
        return mappings.stream().map(InferenceProperties.ModelMapping::getKey).distinct().toList();
    }

    // --- Discovery ---

    /**
     * Queries every backend concurrently. Failing backends are logged and listed in
     * {@link ModelInventory#errors()}; this method never throws.
     */
    public ModelInventory discoverModels() {
        Map<String, CompletableFuture<List<ModelInfo>>> futures = new LinkedHashMap<>();
        for (InferenceBackend backend : backends.values()) {
            futures.put(backend.name(), CompletableFuture.supplyAsync(backend::discoverModels));
        }
        var models = new ArrayList<ModelInfo>();
        var errors = new LinkedHashMap<String, String>();
        futures.forEach((name, future) -> {
            try {
                for (ModelInfo info : future.join()) {
                    models.add(info.withBackend(name));
                }
            } catch (Exception e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Model discovery failed for backend {}: {}", name, cause.getMessage());
                errors.put(name, String.valueOf(cause.getMessage()));
            }
        });
        return new ModelInventory(models, errors);
    }

    /**
     * Discovery against one backend.
     *
     * @throws IllegalArgumentException if no backend has that name
     */
    public ModelInventory discoverModels(String backendName) {
        InferenceBackend backend = backends.get(backendName);
        if (backend == null) {
            throw new IllegalArgumentException("Unknown backend: " + backendName);
        }
        try {
            return new ModelInventory(backend.discoverModels().stream().map(m -> m.withBackend(backendName)).toList(),
                    Map.of());
        } catch (InferenceException e) {
            log.warn("Model discovery failed for backend {}: {}", backendName, e.getMessage());
            return new ModelInventory(List.of(), Map.of(backendName, String.valueOf(e.getMessage())));
        }
    }

    // --- Completion ---

    /**
     * One-shot completion.
     *
     * @throws BackendUnavailableException if the backend is unreachable or errors
     * @throws InferenceTimeoutException   if the call exceeds its timeout
     */
    public ChatResponse callLlm(String modelKey, ChatRequest request) {
        ResolvedModel resolved = resolve(modelKey);
        ChatRequest effective = withDefaults(request, resolved);
        long start = System.currentTimeMillis();
        ChatResponse response = resolved.backend().call(resolved.modelId(), effective);
        log.debug("callLlm {} -> {}/{} finished in {}ms ({}, {} tokens)", modelKey, resolved.backend().name(),
                resolved.modelId(), System.currentTimeMillis() - start, response.finishReason(),
                response.usage().totalTokens());
        return response;
    }

    public ChatResponse callLlm(String modelKey, List<ChatMessage> messages) {
        return callLlm(modelKey, ChatRequest.of(messages));
    }

    /**
     * Starts a streaming completion. Fragments are produced lazily as the caller iterates.
     */
    public TokenStream callLlmStream(String modelKey, ChatRequest request) {
        ResolvedModel resolved = resolve(modelKey);
        return resolved.backend().stream(resolved.modelId(), withDefaults(request, resolved));
    }

    /**
     * Streams a completion, handing every fragment to {@code onChunk} in generation order.
     *
     * @return the concatenation of all fragments
     */
    public String callLlmStream(String modelKey, ChatRequest request, Consumer<String> onChunk) {
        try (TokenStream stream = callLlmStream(modelKey, request)) {
            return stream.collect(onChunk);
        }
    }

    private ChatRequest withDefaults(ChatRequest request, ResolvedModel resolved) {
        return request.withSampling(
                request.maxTokens() != null ? request.maxTokens() : resolved.maxTokens(),
                request.temperature() != null ? request.temperature() : resolved.temperature());
    }

    /**
     * Embeds texts, one vector per input in input order.
     */
    public List<float[]> embed(String modelKey, List<String> texts, Duration timeout) {
        if (texts.isEmpty()) {
            return List.of();
        }
        ResolvedModel resolved = resolve(modelKey);
        List<float[]> vectors = resolved.backend().embed(resolved.modelId(), texts, timeout);
        if (vectors.size() != texts.size()) {
            throw new InferenceException("Backend %s returned %d vectors for %d texts"
                    .formatted(resolved.backend().name(), vectors.size(), texts.size()));
        }
        return vectors;
    }

    // --- Lifecycle (best effort) ---

    public boolean loadModel(String modelKey, Integer ttlSeconds) {
        try {
            ResolvedModel resolved = resolve(modelKey);
            return resolved.backend().load(resolved.modelId(), ttlSeconds);
        } catch (Exception e) {
            log.warn("Failed to load {}: {}", modelKey, e.getMessage());
            return false;
        }
    }

    public boolean unloadModel(String modelKey) {
        try {
            ResolvedModel resolved = resolve(modelKey);
            return resolved.backend().unload(resolved.modelId());
        } catch (Exception e) {
            log.warn("Failed to unload {}: {}", modelKey, e.getMessage());
            return false;
        }
    }

    public boolean downloadModel(String modelKey) {
        try {
            ResolvedModel resolved = resolve(modelKey);
            boolean ok = resolved.backend().download(resolved.modelId());
            if (!ok) {
                log.warn("Download of {} not completed by backend {}", resolved.modelId(), resolved.backend().name());
            }
            return ok;
        } catch (Exception e) {
            log.warn("Failed to download {}: {}", modelKey, e.getMessage());
            return false;
        }
    }

    public String modelState(String modelKey) {
        ResolvedModel resolved = resolve(modelKey);
        return resolved.backend().modelState(resolved.modelId());
    }

    // --- Admission control ---

    public boolean hasSlot(String modelKey) {
        ResolvedModel resolved = resolve(modelKey);
        return resolved.backend().slots().hasSlot(resolved.modelId());
    }

    /**
     * Takes a slot for the model without waiting.
     *
     * @return false if the model already has its full number of in-flight calls
     */
    public boolean acquireSlot(String modelKey) {
        ResolvedModel resolved = resolve(modelKey);
        boolean acquired = resolved.backend().slots().tryAcquire(resolved.modelId());
        if (!acquired) {
            log.debug("Slot rejected for {} ({} in use)", modelKey, resolved.backend().slots().inUse(resolved.modelId()));
        }
        return acquired;
    }

    public void releaseSlot(String modelKey) {
        ResolvedModel resolved = resolve(modelKey);
        resolved.backend().slots().release(resolved.modelId());
    }
}
