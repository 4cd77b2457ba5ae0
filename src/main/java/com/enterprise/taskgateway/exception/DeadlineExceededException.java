package com.enterprise.taskgateway.exception;

/**
 * Exception thrown when a call does not complete before its deadline
 */
public class DeadlineExceededException extends GatewayException {

    public DeadlineExceededException(String message) {
        super(ErrorKind.DEADLINE_EXCEEDED, message);
    }

    public DeadlineExceededException(String message, Throwable cause) {
        super(ErrorKind.DEADLINE_EXCEEDED, message, cause);
    }
}
