package de.bsommerfeld.phrasesync.core.config;

/**
 * Thrown when the configuration cannot be read, written or is unusable.
 * Configuration is vital at startup, so callers are expected to fail fast.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
