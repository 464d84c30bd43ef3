package com.medscript.safety;

/**
 * Failure of a single call to the inference endpoint.
 *
 * Subclasses decide whether another attempt can succeed; the orchestrator
 * only looks at {@link #isRetryable()}.
 */
public abstract class InferenceException extends RuntimeException {

    protected InferenceException(String message) {
        super(message);
    }

    protected InferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
