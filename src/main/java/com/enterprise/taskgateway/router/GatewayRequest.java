package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.rpc.CancellationToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.time.Duration;
import java.util.UUID;

/**
 * An inbound request addressed to a target domain
 */
public class GatewayRequest {

    private final String requestId;
    private final Operation operation;
    private final String targetDomain;
    private final JsonNode payload;
    private final CallerContext caller;
    private final Duration deadline;
    private final CancellationToken cancellationToken;

    private GatewayRequest(Builder builder) {
        this.requestId = builder.requestId != null ? builder.requestId : UUID.randomUUID().toString();
        this.operation = builder.operation;
        this.targetDomain = builder.targetDomain;
        this.payload = builder.payload != null ? builder.payload : NullNode.getInstance();
        this.caller = builder.caller != null ? builder.caller : CallerContext.anonymous();
        this.deadline = builder.deadline;
        this.cancellationToken = builder.cancellationToken;
    }

    public String getRequestId() { return requestId; }
    public Operation getOperation() { return operation; }
    public String getTargetDomain() { return targetDomain; }
    public JsonNode getPayload() { return payload; }
    public CallerContext getCaller() { return caller; }
    /** Time budget from receipt; null means the pattern's default */
    public Duration getDeadline() { return deadline; }
    public CancellationToken getCancellationToken() { return cancellationToken; }

    @Override
    public String toString() {
        return "GatewayRequest{id=" + requestId + ", operation=" + operation + ", domain=" + targetDomain + "}";
    }

    public static Builder builder(Operation operation, String targetDomain) {
        return new Builder().operation(operation).targetDomain(targetDomain);
    }

    /**
     * Builder for creating GatewayRequest instances
     */
    public static class Builder {
        private String requestId;
        private Operation operation;
        private String targetDomain;
        private JsonNode payload;
        private CallerContext caller;
        private Duration deadline;
        private CancellationToken cancellationToken;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder operation(Operation operation) {
            this.operation = operation;
            return this;
        }

        public Builder targetDomain(String targetDomain) {
            this.targetDomain = targetDomain;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder caller(CallerContext caller) {
            this.caller = caller;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public GatewayRequest build() {
            if (operation == null) {
                throw new IllegalArgumentException("Operation is required");
            }
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("Deadline must be positive");
            }
            return new GatewayRequest(this);
        }
    }
}
