package com.enterprise.taskgateway.exception;

/**
 * Exception thrown when the addressed record does not exist
 */
public class NotFoundException extends GatewayException {

    private final String resourceId;

    public NotFoundException(String resourceId) {
        super(ErrorKind.NOT_FOUND, "Not found: " + resourceId);
        this.resourceId = resourceId;
    }

    public NotFoundException(String resourceId, String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
        this.resourceId = resourceId;
    }

    public String getResourceId() {
        return resourceId;
    }
}
