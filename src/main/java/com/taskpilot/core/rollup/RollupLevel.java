package com.taskpilot.core.rollup;

/**
 * Container level a rollup is computed for. Both levels share one derivation rule but
 * report it in their own status vocabulary.
 */
public enum RollupLevel {
    MILESTONE("planned", "in_progress", "at_risk", "completed"),
    WORKSTREAM("not_started", "active", "blocked", "done");

    private final String initial;
    private final String progressing;
    private final String atRisk;
    private final String complete;

    RollupLevel(String initial, String progressing, String atRisk, String complete) {
        this.initial = initial;
        this.progressing = progressing;
        this.atRisk = atRisk;
        this.complete = complete;
    }

    public String initialStatus() { return initial; }
    public String progressingStatus() { return progressing; }
    public String atRiskStatus() { return atRisk; }
    public String completeStatus() { return complete; }

    public String wireName() {
        return name().toLowerCase();
    }
}
