package net.spookly.dimensions.config;

/**
 * Raised when the configuration document cannot be read, parsed or validated.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
