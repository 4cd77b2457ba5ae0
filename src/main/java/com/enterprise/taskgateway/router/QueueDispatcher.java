package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.collaborator.QueuePublisher;
import com.enterprise.taskgateway.queue.JobDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Publishes side-effect work as a job descriptor on the domain's subject and
 * answers with the broker acknowledgment.
 */
public class QueueDispatcher implements Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(QueueDispatcher.class);

    private final QueuePublisher publisher;
    private final ObjectMapper objectMapper;

    public QueueDispatcher(QueuePublisher publisher, ObjectMapper objectMapper) {
        this.publisher = publisher;
        this.objectMapper = objectMapper;
    }

    @Override
    public DispatchPattern pattern() {
        return DispatchPattern.QUEUE_PUBLISH;
    }

    @Override
    public CompletableFuture<JsonNode> dispatch(GatewayRequest request, Consumer<JsonNode> chunkSink) {
        String subject = request.getTargetDomain();
        JsonNode payload = request.getPayload();
        JobDescriptor job = new JobDescriptor(
            UUID.randomUUID(),
            payload.path("type").asText(subject),
            request.getRequestId(),
            request.getCaller().getCallerId(),
            payload,
            Instant.now());

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(job);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(e);
        }

        logger.debug("Request {} publishing job {} to {}", request.getRequestId(), job.getJobId(), subject);
        return publisher.publish(subject, bytes).thenApply(ack -> {
            ObjectNode result = objectMapper.createObjectNode();
            result.put("job_id", job.getJobId().toString());
            result.put("subject", ack.getSubject());
            result.put("sequence", ack.getSequence());
            return result;
        });
    }
}
