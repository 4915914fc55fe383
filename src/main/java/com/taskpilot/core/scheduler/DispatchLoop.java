package com.taskpilot.core.scheduler;

import com.taskpilot.core.events.DispatchEvent;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.logging.MdcContext;
import com.taskpilot.core.metrics.DispatchMetrics;
import com.taskpilot.core.model.FailureKind;
import com.taskpilot.core.model.Task;
import com.taskpilot.core.persistence.JobResult;
import com.taskpilot.core.persistence.JobState;
import com.taskpilot.core.persistence.JobStateStore;
import com.taskpilot.core.resource.ThrottleDecision;
import com.taskpilot.core.rollup.Rollup;
import com.taskpilot.core.rollup.RollupAggregator;
import com.taskpilot.core.rollup.RollupChange;
import com.taskpilot.core.rollup.RollupLevel;
import com.taskpilot.orchestration.Admission;
import com.taskpilot.orchestration.ProgressEvent;
import com.taskpilot.orchestration.Reporter;
import com.taskpilot.orchestration.SpawnGuard;
import com.taskpilot.worker.HandshakeFailureDetector;
import com.taskpilot.worker.RunningWorker;
import com.taskpilot.worker.WorkerHandle;
import com.taskpilot.worker.WorkerWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Supplier;

/**
 * The control loop of one dispatch job.
 *
 * <p>Each tick samples the resource guard, fills free worker slots from the queue, drains
 * exit notifications, runs the watchdog sweep and emits a heartbeat when one is due. The
 * loop ends once nothing is queued and nothing is running.
 *
 * <p>Per task: {@code queued -> dispatching -> running -> succeeded | retry_pending | blocked}.
 * Retries re-enter the queue with a backoff delay; blocked is terminal for the job.
 *
 * <p>All state is owned by the calling thread. Process exits arrive on JDK reaper threads
 * and are handed over through a concurrent queue only.
 */
public class DispatchLoop {

    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    static final List<String> DECISION_OPTIONS = List.of(
            "Retry the task as is",
            "Adjust the task scope and retry",
            "Cancel the task");

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /** Services the loop drives. */
    public record Collaborators(
        WorkerLauncher launcher,
        Reporter reporter,
        SpawnGuard spawnGuard,
        WorkerWatchdog watchdog,
        Supplier<ThrottleDecision> resourceCheck,
        RollupAggregator rollups,
        JobStateStore store,
        EventBus eventBus,
        DispatchMetrics metrics,
        Clock clock,
        Sleeper sleeper
    ) {}

    record Completion(String taskId, int attempt, int exitCode, boolean dryRun) {}

    private final DispatchOptions options;
    private final JobState state;
    private final Path stateFile;
    private final DispatchPlan plan;
    private final Collaborators deps;
    private final RetryPolicy retryPolicy;
    private final String jobId;

    private final List<QueueItem> pending = new ArrayList<>();
    private final Map<String, RunningWorker> running = new LinkedHashMap<>();
    private final ConcurrentLinkedQueue<Completion> completions = new ConcurrentLinkedQueue<>();
    private final Map<String, Task> tasksById = new HashMap<>();
    private final Map<String, Integer> attempts;
    private final Set<String> completed = new LinkedHashSet<>();
    private final Set<String> blocked = new LinkedHashSet<>();
    private final Set<String> decisionsRequested = new LinkedHashSet<>();

    private boolean throttled;
    private Instant lastHeartbeat;

    public DispatchLoop(DispatchOptions options, JobState state, Path stateFile, DispatchPlan plan,
                        Collaborators deps) {
        this.options = options;
        this.state = state;
        this.stateFile = stateFile;
        this.plan = plan;
        this.deps = deps;
        this.retryPolicy = options.retryPolicy();
        this.jobId = state.getJobId();
        this.attempts = new HashMap<>(plan.priorAttempts());
        this.completed.addAll(plan.skippedDone());
        this.blocked.addAll(plan.skippedBlocked());
        for (Task task : plan.queue()) {
            tasksById.put(task.id(), task);
            pending.add(new QueueItem(task, null));
        }
    }

    /**
     * Runs the job to completion.
     *
     * @throws InterruptedException when interrupted while waiting between ticks; running
     *                              workers are asked to stop and the state is persisted first,
     *                              leaving the job resumable
     * @throws RuntimeException     when a tick fails, for example because the state file cannot
     *                              be written; running workers are stopped and the job is
     *                              recorded as failed as far as the state file allows
     */
    public JobOutcome run() throws InterruptedException {
        MdcContext.setJob(jobId);
        Instant started = deps.clock().instant();
        try {
            while (true) {
                tick();
                if (pending.isEmpty() && running.isEmpty() && completions.isEmpty()) {
                    break;
                }
                deps.sleeper().sleep(options.pollInterval());
            }
            return finish(started);
        } catch (InterruptedException e) {
            log.warn("Dispatch interrupted, stopping {} running worker(s)", running.size());
            stopWorkers();
            persistQuietly(e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Dispatch loop failed, stopping {} running worker(s): {}", running.size(), e.getMessage(), e);
            stopWorkers();
            recordFailure(e);
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    void tick() {
        if (!checkResources()) {
            dispatchEligible();
        }
        drainCompletions();
        sweepWatchdog();
        heartbeatIfDue();
    }

    // -- resource guard --

    private boolean checkResources() {
        if (!options.resourceGuardEnabled()) {
            return false;
        }
        ThrottleDecision decision = deps.resourceCheck().get();
        if (decision.throttle() != throttled) {
            throttled = decision.throttle();
            if (throttled) {
                log.warn("Throttling new spawns: {}", decision.summary());
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("event", "resource_throttle");
                metadata.put("reasons", decision.reasons());
                metadata.put("load_ratio", decision.loadRatio());
                metadata.put("free_mem_ratio", decision.freeMemRatio());
                report("throttle activity", () -> deps.reporter().emit(ProgressEvent.of(
                        "Throttling new workers: " + decision.summary(), ProgressEvent.Phase.EXECUTION,
                        ProgressEvent.Level.WARN, progressPct(), metadata)));
                publish(DispatchEvent.JOB_THROTTLED, null, metadata);
            } else {
                log.info("Resource pressure cleared, resuming spawns");
            }
        }
        if (throttled) {
            deps.metrics().recordThrottle();
        }
        return throttled;
    }

    // -- dispatch --

    private void dispatchEligible() {
        while (running.size() < options.concurrency()) {
            int index = nextEligible(deps.clock().instant());
            if (index < 0) {
                return;
            }
            Task task = pending.remove(index).task();
            int used = attempts.getOrDefault(task.id(), 0);
            if (used >= options.maxAttempts()) {
                MdcContext.setTask(jobId, task.id(), used);
                try {
                    deps.metrics().recordFailure(FailureKind.EXHAUSTED.wireName());
                    block(task, used, null, FailureKind.EXHAUSTED,
                            "No attempts left (%d/%d used by earlier runs)".formatted(used, options.maxAttempts()), null);
                    persist();
                } finally {
                    MdcContext.clearTask();
                }
                continue;
            }
            int attempt = used + 1;
            attempts.put(task.id(), attempt);
            MdcContext.setTask(jobId, task.id(), attempt);
            try {
                dispatch(task, attempt);
            } finally {
                MdcContext.clearTask();
            }
        }
    }

    private int nextEligible(Instant now) {
        for (int i = 0; i < pending.size(); i++) {
            if (pending.get(i).isEligible(now)) {
                return i;
            }
        }
        return -1;
    }

    private void dispatch(Task task, int attempt) {
        if (!options.dryRun()) {
            Admission admission = deps.spawnGuard().admit(task.domain(), task.id());
            if (!admission.isAllowed()) {
                deps.metrics().recordGuardDenial(admission.outcome().name().toLowerCase());
                if (admission.outcome() == Admission.Outcome.RETRYABLE_DENIAL) {
                    handleFailure(task, attempt, null, FailureKind.GUARD_RATE_LIMITED,
                            "Spawn guard deferred: " + admission.reason(), null, Duration.ZERO);
                } else {
                    block(task, attempt, null, FailureKind.GUARD_BLOCKED,
                            "Spawn guard blocked: " + admission.reason(), null);
                }
                persist();
                return;
            }
        }

        Path logPath = deps.launcher().logPath(task, attempt);
        log.info("Dispatching {} (attempt {}/{})", task.summary(), attempt, options.maxAttempts());

        Map<String, Object> metadata = taskMetadata(task, attempt);
        metadata.put("event", "dispatch");
        metadata.put("log_path", String.valueOf(logPath));
        report("dispatch activity", () -> deps.reporter().emit(ProgressEvent.of(
                "Dispatching %s (attempt %d/%d).".formatted(task.summary(), attempt, options.maxAttempts()),
                ProgressEvent.Phase.EXECUTION, ProgressEvent.Level.INFO, progressPct(), metadata)));
        if (options.autoComplete()) {
            pushStatus(task, "in_progress", attempt, "Dispatched by " + jobId, statusMetadata("in_progress", logPath));
        }
        state.recordTask(task.id(), new JobState.TaskRecord("running", attempt, null, String.valueOf(logPath),
                null, null, null));
        publish(DispatchEvent.TASK_DISPATCHED, task.id(), Map.of("attempt", attempt, "title", task.title()));
        deps.metrics().recordDispatch(task.domain());

        if (options.dryRun()) {
            completions.add(new Completion(task.id(), attempt, 0, true));
            persist();
            return;
        }

        WorkerHandle handle;
        try {
            handle = deps.launcher().launch(task, attempt, completed.size());
        } catch (IOException | RuntimeException e) {
            log.error("Failed to start worker for {}: {}", task.id(), e.getMessage(), e);
            handleFailure(task, attempt, null, FailureKind.SPAWN_ERROR,
                    "Failed to start worker: " + e.getMessage(), logPath, Duration.ZERO);
            persist();
            return;
        }

        RunningWorker worker = new RunningWorker(task, attempt, handle, deps.clock().instant());
        running.put(task.id(), worker);
        state.getActiveWorkers().put(task.id(), new JobState.ActiveWorker(handle.pid(), attempt,
                worker.startedAt(), String.valueOf(handle.logPath())));
        handle.onExit().whenComplete((code, error) ->
                completions.add(new Completion(task.id(), attempt, code == null ? -1 : code, false)));
        persist();
    }

    // -- completion --

    private void drainCompletions() {
        Completion completion;
        while ((completion = completions.poll()) != null) {
            MdcContext.setTask(jobId, completion.taskId(), completion.attempt());
            try {
                handleCompletion(completion);
            } finally {
                MdcContext.clearTask();
            }
        }
    }

    private void handleCompletion(Completion completion) {
        Task task = tasksById.get(completion.taskId());
        RunningWorker worker = null;
        if (!completion.dryRun()) {
            worker = running.get(completion.taskId());
            if (worker == null || worker.attempt() != completion.attempt()) {
                log.warn("Ignoring exit of stale attempt {} for {}", completion.attempt(), completion.taskId());
                return;
            }
            running.remove(completion.taskId());
            state.getActiveWorkers().remove(completion.taskId());
        }

        Instant now = deps.clock().instant();
        int attempt = completion.attempt();
        int exitCode = completion.exitCode();
        Path logPath = worker != null ? worker.logPath() : deps.launcher().logPath(task, attempt);
        Duration elapsed = worker != null ? Duration.between(worker.startedAt(), now) : Duration.ZERO;

        Optional<String> handshake = completion.dryRun()
                ? Optional.empty()
                : HandshakeFailureDetector.scanLog(logPath);

        if (worker != null && worker.forcedFailure() != null) {
            handleFailure(task, attempt, exitCode, worker.forcedFailure().failureKind(),
                    worker.forcedFailureDetail(), logPath, elapsed);
        } else if (handshake.isPresent()) {
            handleFailure(task, attempt, exitCode, FailureKind.MCP_HANDSHAKE,
                    "MCP handshake failure detected in worker log: " + handshake.get(), logPath, elapsed);
        } else if (exitCode != 0) {
            handleFailure(task, attempt, exitCode, FailureKind.EXIT_CODE,
                    "Worker exited with code " + exitCode, logPath, elapsed);
        } else {
            succeed(task, attempt, exitCode, logPath, elapsed);
        }
        persist();
    }

    private void succeed(Task task, int attempt, int exitCode, Path logPath, Duration elapsed) {
        completed.add(task.id());
        state.setCompleted(completed.size());
        state.recordTask(task.id(), new JobState.TaskRecord("done", attempt, exitCode, String.valueOf(logPath),
                deps.clock().instant(), null, null));
        log.info("Task {} succeeded in {}s", task.summary(), elapsed.toSeconds());

        if (options.autoComplete()) {
            Map<String, Object> metadata = statusMetadata("done", logPath);
            metadata.put("exit_code", exitCode);
            pushStatus(task, "done", attempt, "Worker success from " + jobId, metadata);
        }
        Map<String, Object> metadata = taskMetadata(task, attempt);
        metadata.put("event", "success");
        metadata.put("exit_code", exitCode);
        metadata.put("duration_s", elapsed.toSeconds());
        report("success activity", () -> deps.reporter().emit(ProgressEvent.of(
                "Completed %s (attempt %d).".formatted(task.summary(), attempt),
                ProgressEvent.Phase.REVIEW, ProgressEvent.Level.INFO, progressPct(), metadata)));
        publish(DispatchEvent.TASK_SUCCEEDED, task.id(), Map.of("attempt", attempt, "title", task.title()));
        deps.metrics().recordAttempt("succeeded", elapsed.toMillis());
    }

    private void handleFailure(Task task, int attempt, Integer exitCode, FailureKind kind, String reason,
                               Path logPath, Duration elapsed) {
        deps.metrics().recordFailure(kind.wireName());
        if (!retryPolicy.isRetryable(attempt)) {
            deps.metrics().recordAttempt("blocked", elapsed.toMillis());
            block(task, attempt, exitCode, kind, reason, logPath);
            return;
        }

        Duration delay = retryPolicy.backoff(attempt);
        Instant now = deps.clock().instant();
        pending.add(new QueueItem(task, now.plus(delay)));
        state.recordTask(task.id(), new JobState.TaskRecord("retry_pending", attempt, exitCode,
                logPath == null ? null : logPath.toString(), now, kind, reason));
        log.warn("Task {} failed ({}): {}; retry in {}s", task.id(), kind.wireName(), reason, delay.toSeconds());

        Map<String, Object> metadata = taskMetadata(task, attempt);
        metadata.put("event", "retry");
        metadata.put("failure_kind", kind.wireName());
        metadata.put("reason", reason);
        metadata.put("retry_in_s", delay.toSeconds());
        if (exitCode != null) {
            metadata.put("exit_code", exitCode);
        }
        report("retry activity", () -> deps.reporter().emit(ProgressEvent.of(
                "Retry scheduled for %s in %ds (attempt %d/%d): %s".formatted(task.summary(), delay.toSeconds(),
                        attempt, options.maxAttempts(), reason),
                ProgressEvent.Phase.BLOCKED, ProgressEvent.Level.WARN, progressPct(), metadata)));
        publish(DispatchEvent.TASK_RETRY_SCHEDULED, task.id(),
                Map.of("attempt", attempt, "reason", reason, "retryInSeconds", delay.toSeconds()));
        deps.metrics().recordAttempt("retry", elapsed.toMillis());
    }

    private void block(Task task, int attempt, Integer exitCode, FailureKind kind, String reason, Path logPath) {
        blocked.add(task.id());
        state.setFailed(blocked.size());
        state.recordTask(task.id(), new JobState.TaskRecord("blocked", attempt, exitCode,
                logPath == null ? null : logPath.toString(), deps.clock().instant(), kind, reason));
        log.error("Task {} blocked after {} attempt(s): {}", task.summary(), attempt, reason);

        if (options.autoComplete()) {
            Map<String, Object> metadata = statusMetadata("blocked", logPath);
            metadata.put("failure_kind", kind.wireName());
            pushStatus(task, "blocked", attempt,
                    "Worker failed after %d attempt(s) (%s)".formatted(attempt, reason), metadata);
        }
        Map<String, Object> metadata = taskMetadata(task, attempt);
        metadata.put("event", "failure");
        metadata.put("failure_kind", kind.wireName());
        metadata.put("reason", reason);
        if (exitCode != null) {
            metadata.put("exit_code", exitCode);
        }
        report("failure activity", () -> deps.reporter().emit(ProgressEvent.of(
                "Blocked %s after %d attempt(s): %s".formatted(task.summary(), attempt, reason),
                ProgressEvent.Phase.BLOCKED, ProgressEvent.Level.ERROR, progressPct(), metadata)
                .withNextStep("Review the worker log, resolve the blocker and rerun with --resume --retry-blocked.")));

        if (options.decisionOnBlock() && decisionsRequested.add(task.id())) {
            String summary = reason + (logPath == null ? "" : " (log: " + logPath + ")");
            report("decision request", () -> deps.reporter().requestDecision(task.id(),
                    "Unblock task: " + task.title(), summary, DECISION_OPTIONS, true));
        }
        publish(DispatchEvent.TASK_BLOCKED, task.id(),
                Map.of("attempt", attempt, "reason", reason, "failureKind", kind.wireName()));
    }

    // -- watchdog --

    private void sweepWatchdog() {
        if (running.isEmpty()) {
            return;
        }
        for (WorkerWatchdog.Action action : deps.watchdog().sweep(running.values(), deps.clock().instant())) {
            RunningWorker worker = action.worker();
            deps.metrics().recordWatchdogKill(action.reason().failureKind().wireName(), action.forceful());
            publish(DispatchEvent.WORKER_KILLED, worker.task().id(), Map.of(
                    "reason", action.reason().failureKind().wireName(),
                    "signal", action.forceful() ? "SIGKILL" : "SIGTERM",
                    "pid", worker.handle().pid()));
        }
    }

    // -- heartbeat --

    private void heartbeatIfDue() {
        Instant now = deps.clock().instant();
        if (lastHeartbeat != null && now.isBefore(lastHeartbeat.plus(options.heartbeatInterval()))) {
            return;
        }
        lastHeartbeat = now;
        int total = plan.totalTasks();
        String message = "Heartbeat: %d/%d completed, %d running, %d queued, %d blocked.".formatted(
                completed.size(), total, running.size(), pending.size(), blocked.size());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "heartbeat");
        metadata.put("completed", completed.size());
        metadata.put("total", total);
        metadata.put("running_task_ids", new ArrayList<>(running.keySet()));
        metadata.put("queued", pending.size());
        metadata.put("blocked", blocked.size());
        metadata.put("throttled", throttled);
        log.info(message);
        report("heartbeat activity", () -> deps.reporter().emit(ProgressEvent.of(message,
                ProgressEvent.Phase.EXECUTION,
                blocked.isEmpty() ? ProgressEvent.Level.INFO : ProgressEvent.Level.WARN,
                progressPct(), metadata)));
        publish(DispatchEvent.JOB_HEARTBEAT, null, metadata);
        deps.metrics().recordRunningWorkers(running.size());
        persist();
    }

    // -- termination --

    private JobOutcome finish(Instant started) {
        Instant now = deps.clock().instant();
        JobResult result = blocked.isEmpty() ? JobResult.COMPLETED : JobResult.COMPLETED_WITH_BLOCKERS;
        state.setCompleted(completed.size());
        state.setFailed(blocked.size());
        state.setResult(result);
        state.setFinishedAt(now);
        state.getActiveWorkers().clear();
        persist();

        int total = plan.totalTasks();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "job_complete");
        metadata.put("result", result.wireName());
        metadata.put("completed", completed.size());
        metadata.put("blocked", blocked.size());
        metadata.put("blocked_task_ids", new ArrayList<>(blocked));
        metadata.put("total", total);
        String message;
        String nextStep;
        if (result == JobResult.COMPLETED) {
            message = "Dispatch job completed: %d/%d tasks done.".formatted(completed.size(), total);
            nextStep = "Review delivered work and close out the initiative.";
        } else {
            message = "Dispatch job finished with blockers: %d/%d tasks done, %d blocked.".formatted(
                    completed.size(), total, blocked.size());
            nextStep = "Resolve blocked tasks and rerun with --resume --retry-blocked.";
        }
        log.info(message);
        report("final activity", () -> deps.reporter().emit(ProgressEvent.of(message,
                ProgressEvent.Phase.COMPLETED,
                result == JobResult.COMPLETED ? ProgressEvent.Level.INFO : ProgressEvent.Level.WARN,
                progressPct(), metadata).withNextStep(nextStep)));
        publish(DispatchEvent.JOB_COMPLETED, null, metadata);
        deps.metrics().recordJobResult(result.wireName(), Duration.between(started, now).toMillis());

        return new JobOutcome(jobId, result, total, completed.size(), blocked.size(), stateFile,
                deps.reporter().runId());
    }

    private void stopWorkers() {
        for (RunningWorker worker : running.values()) {
            try {
                worker.handle().terminate();
            } catch (RuntimeException e) {
                log.warn("Could not stop worker {} (pid {}): {}", worker.task().id(), worker.handle().pid(),
                        e.getMessage());
            }
        }
    }

    private void recordFailure(RuntimeException cause) {
        state.setCompleted(completed.size());
        state.setFailed(blocked.size());
        state.setResult(JobResult.FAILED);
        state.setFinishedAt(deps.clock().instant());
        persistQuietly(cause);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "job_failed");
        metadata.put("result", JobResult.FAILED.wireName());
        metadata.put("error", String.valueOf(cause.getMessage()));
        metadata.put("stopped_task_ids", new ArrayList<>(running.keySet()));
        metadata.put("completed", completed.size());
        metadata.put("blocked", blocked.size());
        report("failure activity", () -> deps.reporter().emit(ProgressEvent.of(
                "Dispatch job failed: " + cause.getMessage(), ProgressEvent.Phase.BLOCKED,
                ProgressEvent.Level.ERROR, progressPct(), metadata)
                .withNextStep("Fix the cause and rerun with --resume.")));
        publish(DispatchEvent.JOB_FAILED, null, metadata);
    }

    /**
     * Last-chance write while unwinding; a failure here is attached to the original error.
     */
    private void persistQuietly(Exception cause) {
        try {
            persist();
        } catch (RuntimeException e) {
            log.error("Could not persist job state to {}: {}", stateFile, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    // -- helpers --

    /**
     * Pushes a task status and, once the push is accepted, the rollups it affects.
     */
    private void pushStatus(Task task, String status, int attempt, String reason, Map<String, Object> metadata) {
        try {
            deps.reporter().taskStatus(task.id(), status, attempt, reason, metadata);
        } catch (RuntimeException e) {
            log.warn("Task status update failed ({} -> {}): {}", task.id(), status, e.getMessage());
            return;
        }
        deps.rollups().setStatus(task.id(), status);
        Instant now = deps.clock().instant();
        List<RollupChange> accepted = deps.rollups().sync(task, attempt, this::propagateRollup);
        for (RollupChange change : accepted) {
            state.recordRollup(change.current(), change.entityId(), now);
        }
    }

    private void propagateRollup(RollupChange change) {
        Rollup next = change.current();
        log.info("{} {} rollup: {}/{} done, status {}", change.level().wireName(), change.entityId(),
                next.done(), next.total(), next.status());
        if (change.level() == RollupLevel.MILESTONE) {
            deps.reporter().milestoneStatus(change);
        } else {
            deps.reporter().workstreamStatus(change);
        }
    }

    private Map<String, Object> taskMetadata(Task task, int attempt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("task_id", task.id());
        metadata.put("task_title", task.title());
        metadata.put("attempt", attempt);
        metadata.put("max_attempts", options.maxAttempts());
        metadata.put("domain", task.domain());
        if (task.workstreamId() != null) {
            metadata.put("workstream_id", task.workstreamId());
        }
        if (task.milestoneId() != null) {
            metadata.put("milestone_id", task.milestoneId());
        }
        return metadata;
    }

    private Map<String, Object> statusMetadata(String to, Path logPath) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "status_update");
        metadata.put("to", to);
        if (logPath != null) {
            metadata.put("log_path", logPath.toString());
        }
        return metadata;
    }

    private int progressPct() {
        return Rollup.percent(completed.size(), plan.totalTasks());
    }

    private void report(String what, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", what, e.getMessage());
        }
    }

    private void publish(String type, String taskId, Map<String, Object> payload) {
        deps.eventBus().publish(new DispatchEvent(type, jobId, taskId, payload, deps.clock().instant()));
    }

    private void persist() {
        deps.store().persist(stateFile, state);
    }
}
