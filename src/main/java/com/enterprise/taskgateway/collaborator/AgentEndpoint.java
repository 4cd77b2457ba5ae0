package com.enterprise.taskgateway.collaborator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * An AI agent reachable over the network
 */
public interface AgentEndpoint {

    CompletableFuture<AgentReply> invoke(JsonNode payload);

    /**
     * Invoke and forward partial output to the sink as it arrives. The
     * returned reply carries the final output.
     */
    CompletableFuture<AgentReply> stream(JsonNode payload, Consumer<AgentChunk> sink);

    /**
     * Invoke on behalf of a gateway request. Endpoints that can carry the
     * request id to the agent override this.
     */
    default CompletableFuture<AgentReply> invoke(JsonNode payload, String requestId) {
        return invoke(payload);
    }

    default CompletableFuture<AgentReply> stream(JsonNode payload, String requestId, Consumer<AgentChunk> sink) {
        return stream(payload, sink);
    }
}
