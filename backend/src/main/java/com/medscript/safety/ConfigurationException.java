package com.medscript.safety;

/**
 * Missing or invalid credential. Retrying cannot fix it.
 */
public class ConfigurationException extends InferenceException {

    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
