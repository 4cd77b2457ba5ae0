package com.enterprise.taskgateway.wire;

/**
 * Task priority. Carried on the wire as a single-byte discriminant;
 * zero is reserved for {@link #UNSPECIFIED}.
 */
public enum Priority {
    UNSPECIFIED(0),
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    URGENT(4);

    private final int discriminant;

    Priority(int discriminant) {
        this.discriminant = discriminant;
    }

    public int discriminant() {
        return discriminant;
    }

    /**
     * @return the member for the discriminant, or null when it is not recognized
     */
    public static Priority fromDiscriminant(int discriminant) {
        for (Priority priority : values()) {
            if (priority.discriminant == discriminant) {
                return priority;
            }
        }
        return null;
    }
}
