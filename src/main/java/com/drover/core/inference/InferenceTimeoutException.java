package com.drover.core.inference;

public class InferenceTimeoutException extends InferenceException {

    public InferenceTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
