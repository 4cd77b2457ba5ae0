package com.enterprise.taskgateway.queue;

/**
 * A message held in the local outbox
 */
public class QueuedMessage {

    private final long sequence;
    private final String subject;
    private final byte[] payload;

    public QueuedMessage(long sequence, String subject, byte[] payload) {
        this.sequence = sequence;
        this.subject = subject;
        this.payload = payload;
    }

    public long getSequence() { return sequence; }
    public String getSubject() { return subject; }
    public byte[] getPayload() { return payload; }
}
