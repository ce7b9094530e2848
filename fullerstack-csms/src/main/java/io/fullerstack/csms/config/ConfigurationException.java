package io.fullerstack.csms.config;

/**
 * Thrown when a configuration value is missing or malformed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
