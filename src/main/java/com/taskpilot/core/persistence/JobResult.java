package com.taskpilot.core.persistence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum JobResult {
    RUNNING,
    COMPLETED,
    COMPLETED_WITH_BLOCKERS,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static JobResult fromWire(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
