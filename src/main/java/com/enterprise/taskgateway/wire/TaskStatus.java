package com.enterprise.taskgateway.wire;

/**
 * Workflow status of a task (TODO -> IN_PROGRESS -> DONE in the domain model).
 * Zero is reserved for {@link #UNSPECIFIED}.
 */
public enum TaskStatus {
    UNSPECIFIED(0),
    TODO(1),
    IN_PROGRESS(2),
    DONE(3);

    private final int discriminant;

    TaskStatus(int discriminant) {
        this.discriminant = discriminant;
    }

    public int discriminant() {
        return discriminant;
    }

    /**
     * @return the member for the discriminant, or null when it is not recognized
     */
    public static TaskStatus fromDiscriminant(int discriminant) {
        for (TaskStatus status : values()) {
            if (status.discriminant == discriminant) {
                return status;
            }
        }
        return null;
    }
}
