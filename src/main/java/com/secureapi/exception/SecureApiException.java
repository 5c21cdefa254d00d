package com.secureapi.exception;

/**
 * A custom runtime exception for application-specific errors within the Secure API Agent.
 * <p>
 * This exception is used to signal errors that occur while building the tool catalog or while
 * invoking a bound tool. Transport failures of the signing client are deliberately not wrapped
 * in this type; they reach the caller as the underlying WebClient or Reactor exception.
 */
public class SecureApiException extends RuntimeException {

    /**
     * Constructs a new SecureApiException with the specified detail message.
     *
     * @param message The detail message, which is saved for later retrieval by the
     *                {@link #getMessage()} method.
     */
    public SecureApiException(String message) {
        super(message);
    }

    /**
     * Constructs a new SecureApiException with the specified detail message and cause.
     *
     * @param message The detail message.
     * @param cause   The cause. A {@code null} value is permitted, and indicates that the cause
     *                is nonexistent or unknown.
     */
    public SecureApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
