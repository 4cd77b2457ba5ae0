package com.enterprise.taskgateway.exception;

/**
 * The fixed error vocabulary surfaced to callers of the gateway, whichever
 * dispatch pattern served the request.
 */
public enum ErrorKind {
    ENCODING_ERROR(false),
    DECODING_ERROR(false),
    TRANSPORT_ERROR(true),
    NOT_FOUND(false),
    INVALID_ARGUMENT(false),
    UNAVAILABLE(true),
    DEADLINE_EXCEEDED(true),
    UNROUTABLE_REQUEST(false),
    INTERNAL(false);

    private final boolean retryable;

    ErrorKind(boolean retryable) {
        this.retryable = retryable;
    }

    /**
     * Whether a caller may retry the failed operation with backoff.
     * The core itself never retries.
     */
    public boolean isRetryable() {
        return retryable;
    }
}
