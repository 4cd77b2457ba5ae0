package com.enterprise.taskgateway.exception;

/**
 * Thrown when a byte sequence is not a valid wire record: truncated, oversized, or carrying an unknown discriminant.
 */
public class DecodingException extends GatewayException {

    public DecodingException(String message) {
        super(ErrorKind.DECODING_ERROR, message);
    }

    public DecodingException(String message, Throwable cause) {
        super(ErrorKind.DECODING_ERROR, message, cause);
    }
}
