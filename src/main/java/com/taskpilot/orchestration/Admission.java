package com.taskpilot.orchestration;

/**
 * Spawn admission verdict for one dispatch attempt.
 *
 * @param outcome allowed, retryable denial or terminal denial
 * @param reason  denial or degradation reason, null for a clean allow
 * @param result  raw check result, null when the check did not complete
 */
public record Admission(Outcome outcome, String reason, SpawnGuardResult result) {

    public enum Outcome { ALLOWED, RETRYABLE_DENIAL, TERMINAL_DENIAL }

    public static Admission allowed(SpawnGuardResult result) {
        return new Admission(Outcome.ALLOWED, null, result);
    }

    /** Allowed although the check could not be completed. */
    public static Admission failedOpen(String reason) {
        return new Admission(Outcome.ALLOWED, reason, null);
    }

    public static Admission retryable(String reason, SpawnGuardResult result) {
        return new Admission(Outcome.RETRYABLE_DENIAL, reason, result);
    }

    public static Admission terminal(String reason, SpawnGuardResult result) {
        return new Admission(Outcome.TERMINAL_DENIAL, reason, result);
    }

    public boolean isAllowed() {
        return outcome == Outcome.ALLOWED;
    }
}
