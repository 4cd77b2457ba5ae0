package com.enterprise.taskgateway.collaborator;

import java.util.concurrent.CompletableFuture;

/**
 * Hands messages to a broker for asynchronous processing
 */
public interface QueuePublisher extends AutoCloseable {

    /**
     * Publish a message. The future completes once the broker has accepted it,
     * or fails with a {@link PublishException}.
     */
    CompletableFuture<PublishAck> publish(String subject, byte[] payload);

    @Override
    default void close() {
    }
}
