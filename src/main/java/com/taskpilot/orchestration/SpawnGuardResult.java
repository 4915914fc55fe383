package com.taskpilot.orchestration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response of the spawn admission check.
 *
 * @param allowed       overall verdict
 * @param modelTier     model tier the service would assign, informational
 * @param checks        individual check outcomes
 * @param blockedReason human readable denial reason, null when allowed
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SpawnGuardResult(boolean allowed, String modelTier, Checks checks, String blockedReason) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Checks(RateLimit rateLimit, QualityGate qualityGate, TaskAssigned taskAssigned) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RateLimit(boolean passed, int current, int max) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record QualityGate(boolean passed, double score, double threshold) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskAssigned(boolean passed, String taskId, String status) {}

    /**
     * True when the only failing check is the rate limit, i.e. waiting may help.
     * Missing checks count as passed.
     */
    public boolean isRateLimitedOnly() {
        if (allowed || checks == null) {
            return false;
        }
        boolean rateLimited = checks.rateLimit() != null && !checks.rateLimit().passed();
        boolean qualityOk = checks.qualityGate() == null || checks.qualityGate().passed();
        boolean assignedOk = checks.taskAssigned() == null || checks.taskAssigned().passed();
        return rateLimited && qualityOk && assignedOk;
    }
}
