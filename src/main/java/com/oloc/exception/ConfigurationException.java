package com.oloc.exception;

/**
 * Exception thrown when mapping tables or calculator settings are invalid.
 * Results in fail-fast when a calculator is built.
 */
public class ConfigurationException extends OlocException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
