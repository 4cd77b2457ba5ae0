package com.enterprise.taskgateway.exception;

/**
 * Exception thrown when no dispatch pattern matches a request
 */
public class UnroutableRequestException extends GatewayException {

    private final String targetDomain;
    private final String operation;

    public UnroutableRequestException(String targetDomain, String operation, String reason) {
        super(ErrorKind.UNROUTABLE_REQUEST,
            "Cannot route " + operation + " on '" + targetDomain + "': " + reason);
        this.targetDomain = targetDomain;
        this.operation = operation;
    }

    public String getTargetDomain() {
        return targetDomain;
    }

    public String getOperation() {
        return operation;
    }
}
