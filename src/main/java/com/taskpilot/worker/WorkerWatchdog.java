package com.taskpilot.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Stops workers that run too long or stop writing to their log.
 * <p>
 * Progress is judged by the log file's modification time, since the OS appends worker
 * output directly. The first trigger sends a graceful terminate and records the reason;
 * a worker still alive after the grace period is killed forcefully.
 */
public class WorkerWatchdog {

    private static final Logger log = LoggerFactory.getLogger(WorkerWatchdog.class);

    /** A signal the sweep sent. */
    public record Action(RunningWorker worker, KillReason reason, boolean forceful) {}

    private final Duration timeout;
    private final Duration logStall;
    private final Duration killGrace;

    public WorkerWatchdog(Duration timeout, Duration logStall, Duration killGrace) {
        this.timeout = timeout;
        this.logStall = logStall;
        this.killGrace = killGrace;
    }

    /**
     * Timeout takes precedence when both limits are exceeded. A limit of zero or less is
     * disabled.
     */
    public Optional<KillReason> evaluate(Duration elapsed, Duration idle) {
        if (enabled(timeout) && elapsed.compareTo(timeout) > 0) {
            return Optional.of(KillReason.TIMEOUT);
        }
        if (enabled(logStall) && idle.compareTo(logStall) > 0) {
            return Optional.of(KillReason.LOG_STALL);
        }
        return Optional.empty();
    }

    public List<Action> sweep(Collection<RunningWorker> running, Instant now) {
        List<Action> actions = new ArrayList<>();
        for (RunningWorker worker : running) {
            switch (worker.killState()) {
                case NONE -> {
                    Duration elapsed = Duration.between(worker.startedAt(), now);
                    Duration idle = Duration.between(lastLogActivity(worker), now);
                    evaluate(elapsed, idle).ifPresent(reason -> {
                        String detail = reason.describe(reason == KillReason.TIMEOUT ? timeout : logStall);
                        log.warn("{} for {} (pid {}), sending SIGTERM", detail, worker.task().id(),
                                worker.handle().pid());
                        worker.markTerminated(reason, detail, now.plus(killGrace));
                        worker.handle().terminate();
                        actions.add(new Action(worker, reason, false));
                    });
                }
                case SIGTERM_SENT -> {
                    if (!now.isBefore(worker.graceDeadline()) && worker.handle().isAlive()) {
                        log.warn("Worker {} (pid {}) ignored SIGTERM for {}s, sending SIGKILL",
                                worker.task().id(), worker.handle().pid(), killGrace.toSeconds());
                        worker.markKilled();
                        worker.handle().kill();
                        actions.add(new Action(worker, worker.forcedFailure(), true));
                    }
                }
                case SIGKILL_SENT -> {
                    // waiting for the exit notification
                }
            }
        }
        return actions;
    }

    private static boolean enabled(Duration limit) {
        return !limit.isZero() && !limit.isNegative();
    }

    Instant lastLogActivity(RunningWorker worker) {
        Path logPath = worker.logPath();
        if (logPath != null) {
            try {
                Instant modified = Files.getLastModifiedTime(logPath).toInstant();
                if (modified.isAfter(worker.startedAt())) {
                    return modified;
                }
            } catch (IOException e) {
                log.debug("No log activity for {} yet: {}", worker.task().id(), e.getMessage());
            }
        }
        return worker.startedAt();
    }

    public Duration timeout() {
        return timeout;
    }

    public Duration logStall() {
        return logStall;
    }
}
