package com.enterprise.taskgateway.collaborator;

/**
 * Raised by an {@link AgentEndpoint} when the agent answered with an error status
 */
public class AgentException extends Exception {

    private final int statusCode;

    public AgentException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
