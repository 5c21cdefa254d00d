package com.secureapi.exception;

/**
 * Signals a missing or invalid setting (credential, endpoint) detected while the application
 * context is being built. It is fatal: the process does not start.
 */
public class ConfigurationException extends SecureApiException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
