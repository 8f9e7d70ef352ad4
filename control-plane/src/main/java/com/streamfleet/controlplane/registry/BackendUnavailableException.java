package com.streamfleet.controlplane.registry;

/**
 * The discovery backend could not be reached or answered with an unexpected status.
 */
public class BackendUnavailableException extends RuntimeException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
