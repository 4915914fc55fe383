package com.taskpilot.orchestration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An activity entry reported to the orchestration service.
 *
 * @param message     human readable line
 * @param phase       lifecycle phase shown on the activity stream
 * @param level       severity
 * @param progressPct job progress, null to omit
 * @param nextStep    suggested follow-up, null to omit
 * @param metadata    structured details; job id and plan reference are added by the reporter
 */
public record ProgressEvent(
    String message,
    Phase phase,
    Level level,
    Integer progressPct,
    String nextStep,
    Map<String, Object> metadata
) {

    public enum Phase {
        INTENT, EXECUTION, BLOCKED, REVIEW, COMPLETED;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public enum Level {
        INFO, WARN, ERROR;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    public ProgressEvent {
        phase = phase == null ? Phase.EXECUTION : phase;
        level = level == null ? Level.INFO : level;
        metadata = metadata == null ? Map.of() : new LinkedHashMap<>(metadata);
    }

    public static ProgressEvent of(String message, Phase phase, Level level, Integer progressPct,
                                   Map<String, Object> metadata) {
        return new ProgressEvent(message, phase, level, progressPct, null, metadata);
    }

    public ProgressEvent withNextStep(String step) {
        return new ProgressEvent(message, phase, level, progressPct, step, metadata);
    }
}
