package com.drover.core.inference;

import java.util.List;
import java.util.Map;

/**
 * Result of model discovery across backends. Backends that failed are listed in {@code errors}.
 *
 * @param models discovered models
 * @param errors backend name to failure message
 */
public record ModelInventory(List<ModelInfo> models, Map<String, String> errors) {

    public static final ModelInventory EMPTY = new ModelInventory(List.of(), Map.of());

    public ModelInventory {
        models = models == null ? List.of() : List.copyOf(models);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    public List<ModelInfo> forBackend(String backend) {
        return models.stream().filter(m -> backend.equals(m.backend())).toList();
    }
}
