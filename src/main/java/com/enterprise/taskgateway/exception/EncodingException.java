package com.enterprise.taskgateway.exception;

/**
 * Thrown when a value cannot be written in wire form: a missing field or enum, or a message beyond the size cap.
 */
public class EncodingException extends GatewayException {

    public EncodingException(String message) {
        super(ErrorKind.ENCODING_ERROR, message);
    }

    public EncodingException(String message, Throwable cause) {
        super(ErrorKind.ENCODING_ERROR, message, cause);
    }
}
