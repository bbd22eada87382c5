package com.drover.core.inference;

/**
 * Thrown when a backend cannot be reached or answers with an error status.
 */
public class BackendUnavailableException extends InferenceException {

    private final String backend;
    private final int statusCode;

    public BackendUnavailableException(String backend, String message) {
        this(backend, -1, message, null);
    }

    public BackendUnavailableException(String backend, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
        this.statusCode = statusCode;
    }

    public String getBackend() {
        return backend;
    }

    /** HTTP status, or -1 when the backend was unreachable. */
    public int getStatusCode() {
        return statusCode;
    }
}
