package de.bsommerfeld.folio.core.config;

/**
 * Thrown when the configuration file is unreadable or holds invalid values.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
