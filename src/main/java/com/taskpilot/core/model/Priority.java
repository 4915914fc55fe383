package com.taskpilot.core.model;

/**
 * Task priority, ordered from most to least urgent.
 */
public enum Priority {
    URGENT(0),
    HIGH(1),
    MEDIUM(2),
    LOW(3),
    UNKNOWN(9);

    private final int rank;

    Priority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    /**
     * Lenient parse: case-insensitive, {@link #UNKNOWN} for null, blank or unrecognised values.
     */
    public static Priority fromString(String value) {
        String normalized = TaskState.normalize(value);
        for (Priority priority : values()) {
            if (priority != UNKNOWN && priority.name().equalsIgnoreCase(normalized)) {
                return priority;
            }
        }
        return UNKNOWN;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
