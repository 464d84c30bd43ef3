package com.medscript.safety;

/**
 * Non-success HTTP status or a response envelope of unexpected shape.
 */
public class ProtocolException extends InferenceException {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
