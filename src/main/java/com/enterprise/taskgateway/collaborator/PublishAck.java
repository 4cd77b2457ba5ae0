package com.enterprise.taskgateway.collaborator;

/**
 * Broker acknowledgment of a published message
 */
public class PublishAck {

    private final String subject;
    private final long sequence;

    public PublishAck(String subject, long sequence) {
        this.subject = subject;
        this.sequence = sequence;
    }

    public String getSubject() { return subject; }
    public long getSequence() { return sequence; }

    @Override
    public String toString() {
        return "PublishAck{subject='" + subject + "', sequence=" + sequence + "}";
    }
}
