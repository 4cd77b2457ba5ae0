package com.enterprise.taskgateway.exception;

/**
 * Exception thrown when a request payload is rejected before or by the backend
 */
public class InvalidArgumentException extends GatewayException {

    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }

    public InvalidArgumentException(String message, Throwable cause) {
        super(ErrorKind.INVALID_ARGUMENT, message, cause);
    }
}
