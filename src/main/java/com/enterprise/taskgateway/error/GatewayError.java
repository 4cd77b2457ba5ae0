package com.enterprise.taskgateway.error;

import com.enterprise.taskgateway.exception.ErrorKind;
import com.enterprise.taskgateway.exception.GatewayException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The error half of a gateway response
 */
public class GatewayError {

    private final ErrorKind kind;
    private final String message;
    private final Map<String, String> context;

    public GatewayError(ErrorKind kind, String message, Map<String, String> context) {
        this.kind = kind;
        this.message = message;
        this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static GatewayError of(GatewayException exception) {
        return new GatewayError(exception.getKind(), exception.getMessage(), exception.getContext());
    }

    @JsonProperty("kind")
    public ErrorKind getKind() { return kind; }

    @JsonProperty("message")
    public String getMessage() { return message; }

    @JsonProperty("retryable")
    public boolean isRetryable() { return kind.isRetryable(); }

    @JsonProperty("context")
    public Map<String, String> getContext() { return context; }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
