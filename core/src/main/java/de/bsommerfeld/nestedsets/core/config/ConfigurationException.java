package de.bsommerfeld.nestedsets.core.config;

/**
 * Thrown when a configuration file exists but cannot be read or written.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
