package com.enterprise.taskgateway.exception;

/**
 * Thrown for calls that were in flight on a transport handle when the pool
 * retired it after a fatal fault. Still an {@link UnavailableException}, so
 * callers handling the RPC vocabulary need no extra branch.
 */
public class TransportException extends UnavailableException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT_ERROR, message, null);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_ERROR, message, cause);
    }
}
