package com.drover.core.inference;

import java.time.Duration;
import java.util.List;

/**
 * Adapter over one family of model servers. The router only ever talks to backends through
 * this interface, so a new server family is added by implementing it.
 */
public interface InferenceBackend {

    /** Configured name, e.g. "default" or "ollama-gpu". */
    String name();

    /** Backend family: "openai", "ollama" or "llamacpp". */
    String type();

    /**
     * Lists the models this backend can serve.
     *
     * @throws BackendUnavailableException if the server cannot be queried
     */
    List<ModelInfo> discoverModels();

    ChatResponse call(String modelId, ChatRequest request);

    /**
     * Starts a streaming completion. The returned stream must be closed or fully drained.
     */
    TokenStream stream(String modelId, ChatRequest request);

    List<float[]> embed(String modelId, List<String> texts, Duration timeout);

    /**
     * Loads a model into memory.
     *
     * @param ttlSeconds idle time after which the server may evict it (nullable)
     * @return true if the model is loaded and ready
     */
    boolean load(String modelId, Integer ttlSeconds);

    boolean unload(String modelId);

    /** Pulls model weights onto the server. Unsupported by default. */
    default boolean download(String modelId) {
        return false;
    }

    /** Last known state of a model: "loaded", "downloaded", "unloaded" or "unknown". */
    String modelState(String modelId);

    ModelSlots slots();
}
