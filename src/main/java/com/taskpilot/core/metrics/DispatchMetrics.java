package com.taskpilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for dispatch jobs.
 */
@Service
public class DispatchMetrics {

    private final MeterRegistry registry;

    public DispatchMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDispatch(String domain) {
        Counter.builder("taskpilot.dispatch.spawned")
                .tag("domain", domain)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "succeeded", "retry" or "blocked"
     */
    public void recordAttempt(String outcome, long elapsedMs) {
        Timer.builder("taskpilot.dispatch.attempt.duration")
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(elapsedMs));
    }

    public void recordFailure(String failureKind) {
        Counter.builder("taskpilot.dispatch.failures")
                .tag("kind", failureKind)
                .register(registry)
                .increment();
    }

    public void recordWatchdogKill(String reason, boolean forceful) {
        Counter.builder("taskpilot.dispatch.watchdog.kills")
                .description("Workers terminated by the watchdog")
                .tag("reason", reason)
                .tag("signal", forceful ? "kill" : "term")
                .register(registry)
                .increment();
    }

    public void recordGuardDenial(String outcome) {
        Counter.builder("taskpilot.dispatch.guard.denials")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordThrottle() {
        Counter.builder("taskpilot.dispatch.throttled")
                .description("Ticks where the resource guard held back new spawns")
                .register(registry)
                .increment();
    }

    public void recordRunningWorkers(int count) {
        DistributionSummary.builder("taskpilot.dispatch.running_workers")
                .register(registry)
                .record(count);
    }

    public void recordJobResult(String result, long elapsedMs) {
        Counter.builder("taskpilot.dispatch.jobs")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder("taskpilot.dispatch.job.duration")
                .tag("result", result)
                .register(registry)
                .record(Duration.ofMillis(elapsedMs));
    }
}
