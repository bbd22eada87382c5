package com.drover.core.inference;

/**
 * Thrown when a model key cannot be resolved to any configured backend.
 */
public class UnknownModelException extends InferenceException {

    public UnknownModelException(String modelKey) {
        super("No backend available for model key '%s'".formatted(modelKey));
    }
}
