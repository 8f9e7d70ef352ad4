package com.streamfleet.controlplane.config;

/**
 * Thrown when a component is constructed with an invalid configuration.
 * <p>
 * This is a programmer error: it is raised at construction time and never
 * from a background loop or the routing path.
 * </p>
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
