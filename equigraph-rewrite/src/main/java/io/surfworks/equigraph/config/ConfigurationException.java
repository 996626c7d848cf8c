package io.surfworks.equigraph.config;

/**
 * Thrown when a configuration source exists but cannot be read or parsed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
