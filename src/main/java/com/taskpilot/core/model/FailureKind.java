package com.taskpilot.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an attempt did not succeed.
 */
public enum FailureKind {
    EXIT_CODE,
    TIMEOUT,
    LOG_STALL,
    MCP_HANDSHAKE,
    SPAWN_ERROR,
    GUARD_RATE_LIMITED,
    GUARD_BLOCKED,
    EXHAUSTED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static FailureKind fromWire(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase());
    }
}
