package com.enterprise.taskgateway.rpc;

import java.time.Duration;

/**
 * Per-call options. Unset values fall back to the client configuration.
 */
public class RpcCallOptions {

    private static final RpcCallOptions DEFAULTS = new Builder().build();

    private final Duration deadline;
    private final Boolean compress;
    private final CancellationToken cancellationToken;
    private final String requestId;

    private RpcCallOptions(Duration deadline, Boolean compress, CancellationToken cancellationToken,
                           String requestId) {
        this.deadline = deadline;
        this.compress = compress;
        this.cancellationToken = cancellationToken;
        this.requestId = requestId;
    }

    public static RpcCallOptions defaults() {
        return DEFAULTS;
    }

    public static RpcCallOptions withDeadline(Duration deadline) {
        return builder().deadline(deadline).build();
    }

    public Duration getDeadline() { return deadline; }
    public Boolean getCompress() { return compress; }
    public CancellationToken getCancellationToken() { return cancellationToken; }
    /** Sent as {@code x-request-id}; null sends none */
    public String getRequestId() { return requestId; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration deadline;
        private Boolean compress;
        private CancellationToken cancellationToken;
        private String requestId;

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder compress(boolean compress) {
            this.compress = compress;
            return this;
        }

        public Builder cancellationToken(CancellationToken cancellationToken) {
            this.cancellationToken = cancellationToken;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public RpcCallOptions build() {
            if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
                throw new IllegalArgumentException("Deadline must be positive");
            }
            return new RpcCallOptions(deadline, compress, cancellationToken, requestId);
        }
    }
}
