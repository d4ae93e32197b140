package com.tasklane.backend.global.error;

/**
 * Missing or unusable security configuration. Thrown while the application context is
 * being built so the process refuses to start instead of serving requests.
 */
public class ConfigurationFailureException extends RuntimeException {

    public ConfigurationFailureException(String message) {
        super(message);
    }

    public ConfigurationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
