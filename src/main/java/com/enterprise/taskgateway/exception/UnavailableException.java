package com.enterprise.taskgateway.exception;

/**
 * Exception thrown when a backend cannot be reached or refuses work.
 * Retryable by the caller with backoff.
 */
public class UnavailableException extends GatewayException {

    public UnavailableException(String message) {
        super(ErrorKind.UNAVAILABLE, message);
    }

    public UnavailableException(String message, Throwable cause) {
        super(ErrorKind.UNAVAILABLE, message, cause);
    }

    protected UnavailableException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
