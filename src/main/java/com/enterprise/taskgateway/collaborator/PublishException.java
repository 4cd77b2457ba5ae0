package com.enterprise.taskgateway.collaborator;

/**
 * Raised by a {@link QueuePublisher} when the broker does not accept a message
 */
public class PublishException extends Exception {

    private final String subject;
    private final boolean rejected;

    public PublishException(String subject, String message, boolean rejected) {
        super(message);
        this.subject = subject;
        this.rejected = rejected;
    }

    public PublishException(String subject, String message, boolean rejected, Throwable cause) {
        super(message, cause);
        this.subject = subject;
        this.rejected = rejected;
    }

    public String getSubject() {
        return subject;
    }

    /**
     * True when the broker negatively acknowledged the message
     */
    public boolean isRejected() {
        return rejected;
    }
}
