package com.taskpilot.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consults the orchestration service's admission check before a worker is spawned and
 * turns the answer into an {@link Admission}.
 * <p>
 * A failing rate limit alone is retryable; a failing quality gate or task assignment is
 * terminal. When the check cannot be completed the {@link GuardMode} decides.
 */
public class SpawnGuard {

    private static final Logger log = LoggerFactory.getLogger(SpawnGuard.class);

    private final OrchestrationClient client;
    private final GuardMode mode;

    public SpawnGuard(OrchestrationClient client, GuardMode mode) {
        this.client = client;
        this.mode = mode;
    }

    public Admission admit(String domain, String taskId) {
        SpawnGuardResult result;
        try {
            result = client.checkSpawnGuard(domain, taskId);
        } catch (SpawnGuardUnsupportedException e) {
            return onCheckFailure("spawn guard endpoint unsupported (HTTP " + e.statusCode() + ")", taskId);
        } catch (RuntimeException e) {
            return onCheckFailure("spawn guard call failed: " + e.getMessage(), taskId);
        }

        if (result == null) {
            return onCheckFailure("spawn guard returned no result", taskId);
        }
        if (result.allowed()) {
            log.debug("Spawn guard allowed {} (domain {}, tier {})", taskId, domain, result.modelTier());
            return Admission.allowed(result);
        }

        String reason = result.blockedReason() != null && !result.blockedReason().isBlank()
                ? result.blockedReason()
                : describeFailedChecks(result);
        if (result.isRateLimitedOnly()) {
            log.info("Spawn guard rate-limited {}: {}", taskId, reason);
            return Admission.retryable(reason, result);
        }
        log.warn("Spawn guard blocked {}: {}", taskId, reason);
        return Admission.terminal(reason, result);
    }

    private Admission onCheckFailure(String reason, String taskId) {
        if (mode == GuardMode.STRICT) {
            log.warn("{} for {}; strict mode, deferring spawn", reason, taskId);
            return Admission.retryable(reason, null);
        }
        log.warn("{} for {}; failing open", reason, taskId);
        return Admission.failedOpen(reason);
    }

    static String describeFailedChecks(SpawnGuardResult result) {
        SpawnGuardResult.Checks checks = result.checks();
        if (checks == null) {
            return "spawn denied";
        }
        StringBuilder sb = new StringBuilder();
        if (checks.rateLimit() != null && !checks.rateLimit().passed()) {
            sb.append("rate limit ").append(checks.rateLimit().current()).append('/').append(checks.rateLimit().max());
        }
        if (checks.qualityGate() != null && !checks.qualityGate().passed()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append("quality gate score ").append(checks.qualityGate().score())
                    .append(" below ").append(checks.qualityGate().threshold());
        }
        if (checks.taskAssigned() != null && !checks.taskAssigned().passed()) {
            if (sb.length() > 0) sb.append("; ");
            sb.append("task not assignable (status ").append(checks.taskAssigned().status()).append(')');
        }
        return sb.length() == 0 ? "spawn denied" : sb.toString();
    }
}
