package com.enterprise.taskgateway.router;

/**
 * Lifecycle of a request inside the router
 */
public enum RequestState {
    RECEIVED,
    CLASSIFIED,
    DISPATCHED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Allowed moves: RECEIVED to CLASSIFIED, CLASSIFIED to DISPATCHED,
     * DISPATCHED to a terminal state, and any non-terminal state to FAILED.
     */
    public boolean canTransitionTo(RequestState next) {
        switch (this) {
            case RECEIVED:
                return next == CLASSIFIED || next == FAILED;
            case CLASSIFIED:
                return next == DISPATCHED || next == FAILED;
            case DISPATCHED:
                return next == COMPLETED || next == FAILED;
            default:
                return false;
        }
    }
}
