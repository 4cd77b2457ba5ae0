package com.enterprise.taskgateway.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every failure the gateway core reports.
 * The {@link ErrorKind} is the primary discriminant; the context map carries
 * supplementary details such as the raw transport status.
 */
public class GatewayException extends Exception {

    private final ErrorKind kind;
    private final Map<String, String> context = new LinkedHashMap<>();

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public Map<String, String> getContext() {
        return Collections.unmodifiableMap(context);
    }

    /**
     * Attach a supplementary detail. Returns this exception for chaining.
     */
    public GatewayException withContext(String key, String value) {
        if (key != null && value != null) {
            context.put(key, value);
        }
        return this;
    }
}
