package com.drover.core.inference;

/**
 * Thrown when a model has no free slot for another in-flight call.
 */
public class AdmissionRejectedException extends InferenceException {

    private final String modelKey;

    public AdmissionRejectedException(String modelKey) {
        super("No free slot for model '%s'".formatted(modelKey));
        this.modelKey = modelKey;
    }

    public String getModelKey() {
        return modelKey;
    }
}
