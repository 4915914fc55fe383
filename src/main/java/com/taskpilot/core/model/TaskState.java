package com.taskpilot.core.model;

import java.util.Locale;
import java.util.Map;

/**
 * Lifecycle bucket of a task, derived from the raw status string reported by the
 * orchestration service.
 */
public enum TaskState {
    DONE,
    BLOCKED,
    ACTIVE,
    TODO;

    private static final Map<String, TaskState> CLASSIFICATION = Map.ofEntries(
            Map.entry("done", DONE),
            Map.entry("completed", DONE),
            Map.entry("cancelled", DONE),
            Map.entry("archived", DONE),
            Map.entry("deleted", DONE),
            Map.entry("blocked", BLOCKED),
            Map.entry("at_risk", BLOCKED),
            Map.entry("in_progress", ACTIVE),
            Map.entry("active", ACTIVE),
            Map.entry("running", ACTIVE),
            Map.entry("queued", ACTIVE),
            Map.entry("retry_pending", ACTIVE)
    );

    /**
     * Classifies a raw status. Unknown values and null fall back to {@link #TODO}.
     */
    public static TaskState classify(String rawStatus) {
        return CLASSIFICATION.getOrDefault(normalize(rawStatus), TODO);
    }

    /** Trimmed, lower-cased form of a raw status; empty for null. */
    public static String normalize(String rawStatus) {
        return rawStatus == null ? "" : rawStatus.trim().toLowerCase(Locale.ROOT);
    }
}
