package com.genenet.rbn.api;

/**
 * Invalid experiment or generator parameters. Raised before any simulation
 * starts.
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
