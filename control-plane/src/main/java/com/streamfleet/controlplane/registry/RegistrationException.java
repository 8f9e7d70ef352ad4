package com.streamfleet.controlplane.registry;

/**
 * The discovery backend refused or failed to register an instance.
 * Registration is not retried internally.
 */
public class RegistrationException extends RuntimeException {

    public RegistrationException(String message) {
        super(message);
    }

    public RegistrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
