package com.enterprise.taskgateway.router;

/**
 * Operation requested by a caller
 */
public enum Operation {
    QUERY,
    CREATE,
    GET,
    LIST,
    LIST_STREAM,
    UPDATE,
    DELETE,
    PUBLISH,
    INVOKE,
    STREAM;

    /**
     * Whether the operation delivers partial results before it completes
     */
    public boolean isStreaming() {
        return this == LIST_STREAM || this == STREAM;
    }
}
