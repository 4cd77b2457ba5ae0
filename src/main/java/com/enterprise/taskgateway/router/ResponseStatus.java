package com.enterprise.taskgateway.router;

/**
 * Outcome reported to the caller
 */
public enum ResponseStatus {
    /** The result is final */
    COMPLETED,
    /** The work was handed off and will finish asynchronously */
    ACCEPTED,
    FAILED
}
