package com.enterprise.taskgateway.router;

import com.enterprise.taskgateway.collaborator.QueuePublisher;
import com.enterprise.taskgateway.monitoring.GatewayMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;

/**
 * Announces task mutations on the event subject. Publishing is best effort:
 * failures are logged and counted, never returned to the caller.
 */
public class TaskEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(TaskEventPublisher.class);

    public static final String TASK_CREATED = "task.created";
    public static final String TASK_UPDATED = "task.updated";
    public static final String TASK_DELETED = "task.deleted";

    private final QueuePublisher publisher;
    private final String subject;
    private final ObjectMapper objectMapper;
    private final GatewayMetrics metrics;

    public TaskEventPublisher(QueuePublisher publisher, String subject, ObjectMapper objectMapper,
                              GatewayMetrics metrics) {
        this.publisher = publisher;
        this.subject = subject;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    /**
     * @param task the task snapshot, or null for deletions
     */
    public void publish(String eventType, UUID taskId, JsonNode task, String requestId) {
        ObjectNode event = objectMapper.createObjectNode();
        event.put("event_id", UUID.randomUUID().toString());
        event.put("type", eventType);
        event.put("task_id", taskId.toString());
        event.put("request_id", requestId);
        event.put("occurred_at", Instant.now().toString());
        if (task != null) {
            event.set("task", task);
        }

        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            logger.warn("Could not serialize {} event for task {}", eventType, taskId, e);
            metrics.recordTaskEventDropped();
            return;
        }

        publisher.publish(subject, bytes).whenComplete((ack, error) -> {
            if (error != null) {
                logger.warn("Failed to publish {} event for task {}: {}", eventType, taskId, error.getMessage());
                metrics.recordTaskEventDropped();
            } else {
                logger.debug("Published {} event for task {} as #{}", eventType, taskId, ack.getSequence());
            }
        });
    }
}
