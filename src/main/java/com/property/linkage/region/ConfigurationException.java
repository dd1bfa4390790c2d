package com.property.linkage.region;

/**
 * Runtime exception thrown when region configuration is missing or invalid.
 * Fatal: a run aborts before any matching begins.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
