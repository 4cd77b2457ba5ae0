package com.enterprise.taskgateway.queue;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.UUID;

/**
 * Envelope published for side-effect work. Consumers read it as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobDescriptor {

    private final UUID jobId;
    private final String type;
    private final String requestId;
    private final String callerId;
    private final JsonNode payload;
    private final Instant enqueuedAt;

    @JsonCreator
    public JobDescriptor(@JsonProperty("job_id") UUID jobId,
                         @JsonProperty("type") String type,
                         @JsonProperty("request_id") String requestId,
                         @JsonProperty("caller_id") String callerId,
                         @JsonProperty("payload") JsonNode payload,
                         @JsonProperty("enqueued_at") Instant enqueuedAt) {
        this.jobId = jobId;
        this.type = type;
        this.requestId = requestId;
        this.callerId = callerId;
        this.payload = payload;
        this.enqueuedAt = enqueuedAt;
    }

    @JsonProperty("job_id")
    public UUID getJobId() { return jobId; }

    @JsonProperty("type")
    public String getType() { return type; }

    @JsonProperty("request_id")
    public String getRequestId() { return requestId; }

    @JsonProperty("caller_id")
    public String getCallerId() { return callerId; }

    @JsonProperty("payload")
    public JsonNode getPayload() { return payload; }

    @JsonProperty("enqueued_at")
    public Instant getEnqueuedAt() { return enqueuedAt; }
}
