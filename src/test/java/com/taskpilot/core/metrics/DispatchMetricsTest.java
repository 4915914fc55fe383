package com.taskpilot.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DispatchMetricsTest {

    private SimpleMeterRegistry registry;
    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new DispatchMetrics(registry);
    }

    @Test
    @DisplayName("counts dispatches per domain")
    void dispatches() {
        metrics.recordDispatch("engineering");
        metrics.recordDispatch("engineering");
        metrics.recordDispatch("design");

        assertEquals(2.0, registry.get("taskpilot.dispatch.spawned").tag("domain", "engineering").counter().count());
        assertEquals(1.0, registry.get("taskpilot.dispatch.spawned").tag("domain", "design").counter().count());
    }

    @Test
    @DisplayName("records attempt duration by outcome")
    void attempts() {
        metrics.recordAttempt("succeeded", 1500);

        var timer = registry.get("taskpilot.dispatch.attempt.duration").tag("outcome", "succeeded").timer();
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("tags watchdog kills with reason and signal")
    void watchdogKills() {
        metrics.recordWatchdogKill("timeout", false);
        metrics.recordWatchdogKill("timeout", true);

        assertEquals(1.0, registry.get("taskpilot.dispatch.watchdog.kills")
                .tag("reason", "timeout").tag("signal", "term").counter().count());
        assertEquals(1.0, registry.get("taskpilot.dispatch.watchdog.kills")
                .tag("reason", "timeout").tag("signal", "kill").counter().count());
    }

    @Test
    @DisplayName("records failures, guard denials and throttles")
    void counters() {
        metrics.recordFailure("exit_code");
        metrics.recordGuardDenial("rate_limited");
        metrics.recordThrottle();
        metrics.recordThrottle();

        assertEquals(1.0, registry.get("taskpilot.dispatch.failures").tag("kind", "exit_code").counter().count());
        assertEquals(1.0, registry.get("taskpilot.dispatch.guard.denials").tag("outcome", "rate_limited").counter().count());
        assertEquals(2.0, registry.get("taskpilot.dispatch.throttled").counter().count());
    }

    @Test
    @DisplayName("records job result count and duration")
    void jobResult() {
        metrics.recordJobResult("completed_with_blockers", 60_000);

        assertEquals(1.0, registry.get("taskpilot.dispatch.jobs").tag("result", "completed_with_blockers").counter().count());
        assertEquals(1, registry.get("taskpilot.dispatch.job.duration").timer().count());
    }

    @Test
    @DisplayName("summarises running worker counts")
    void runningWorkers() {
        metrics.recordRunningWorkers(3);
        metrics.recordRunningWorkers(1);

        var summary = registry.get("taskpilot.dispatch.running_workers").summary();
        assertEquals(2, summary.count());
        assertEquals(3.0, summary.max());
    }
}
