package com.secureapi.exception;

/**
 * Thrown when the remote OpenAPI document cannot be fetched or parsed. Startup aborts, no tool
 * is ever exposed from a partially loaded document.
 */
public class UpstreamFetchException extends SecureApiException {

    public UpstreamFetchException(String message) {
        super(message);
    }

    public UpstreamFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
