package com.civics.ingest.config;

/**
 * Invalid or incomplete configuration, e.g. an enabled provider without an API key.
 * Fatal to the run that detects it.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
