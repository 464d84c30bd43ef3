package com.medscript.safety;

/**
 * Network failure or timeout before a usable response arrived.
 */
public class TransportException extends InferenceException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
