package com.enterprise.taskgateway.exception;

/**
 * Catch-all for failures outside the named vocabulary
 */
public class InternalException extends GatewayException {

    public InternalException(String message) {
        super(ErrorKind.INTERNAL, message);
    }

    public InternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, cause);
    }
}
