package com.drover.core.inference;

import java.util.List;

/**
 * A model reported by a backend during discovery.
 *
 * @param id           backend model id
 * @param backend      name of the backend that reported it
 * @param state        "loaded", "downloaded" or "unknown"
 * @param capabilities e.g. "chat", "embedding"
 * @param sizeBytes    on-disk size when reported, else 0
 */
public record ModelInfo(String id, String backend, String state, List<String> capabilities, long sizeBytes) {

    public ModelInfo {
        capabilities = capabilities == null || capabilities.isEmpty() ? List.of("chat") : List.copyOf(capabilities);
    }

    public ModelInfo withBackend(String backendName) {
        return new ModelInfo(id, backendName, state, capabilities, sizeBytes);
    }
}
