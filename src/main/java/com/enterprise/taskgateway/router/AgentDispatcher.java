package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.collaborator.AgentEndpoint;
import com.enterprise.taskgateway.exception.UnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Delegates reasoning work to an agent; STREAM forwards partial output as it arrives
 */
public class AgentDispatcher implements Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(AgentDispatcher.class);

    private final AgentEndpoint endpoint;
    private final ObjectMapper objectMapper;

    public AgentDispatcher(AgentEndpoint endpoint, ObjectMapper objectMapper) {
        this.endpoint = endpoint;
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchPattern pattern() {
        return DispatchPattern.AGENT_INVOKE;
    }

    @Override
    public CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        if (endpoint == null) {
            return CompletableFuture.failedFuture(new UnavailableException("No agent endpoint is configured"));
        }

        logger.debug("Request {} invoking agent ({})", request.getRequestId(), request.getOperation());
        if (request.getOperation() == Operation.STREAM) {
            return DispatchFutures.linked(
                endpoint.stream(request.getPayload(), request.getRequestId(),
                    chunk -> chunkSink.accept(objectMapper.<JsonNode>valueToTree(chunk))),
                reply -> objectMapper.<JsonNode>valueToTree(reply));
        }
        return DispatchFutures.linked(endpoint.invoke(request.getPayload(), request.getRequestId()),
            reply -> objectMapper.<JsonNode>valueToTree(reply));
    }
}
