package com.taskpilot.dispatch.cli;

import com.taskpilot.core.engine.DispatchEngine;
import com.taskpilot.core.engine.DispatchException;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.resource.ResourceThresholds;
import com.taskpilot.core.scheduler.DispatchOptions;
import com.taskpilot.core.scheduler.DispatchProperties;
import com.taskpilot.core.scheduler.JobOutcome;
import com.taskpilot.orchestration.GuardMode;
import com.taskpilot.worker.WorkerProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskpilot run --scope-id &lt;id&gt; [options]
 * <p>
 * Runs one dispatch job. Options left unset fall back to {@code taskpilot.dispatch.*} and
 * {@code taskpilot.worker.*} configuration. Exit code 0 when every task finished, 2 when
 * blockers remain, 1 when the job could not run.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Dispatch an initiative's tasks to workers")
@Component
public class RunCommand implements Callable<Integer> {

    static final int MIN_POLL_SECONDS = 1;
    static final int MIN_HEARTBEAT_SECONDS = 5;

    @Option(names = "--scope-id", defaultValue = "${env:TASKPILOT_SCOPE_ID}",
            description = "Initiative whose backlog is dispatched (env TASKPILOT_SCOPE_ID)")
    String scopeId;

    @Option(names = "--concurrency", description = "Maximum workers running at once")
    Integer concurrency;

    @Option(names = "--max-attempts", description = "Attempts per task before it is blocked")
    Integer maxAttempts;

    @Option(names = "--poll-seconds", description = "Seconds between loop ticks (min " + MIN_POLL_SECONDS + ")")
    Integer pollSeconds;

    @Option(names = "--heartbeat-seconds", description = "Seconds between heartbeats (min " + MIN_HEARTBEAT_SECONDS + ")")
    Integer heartbeatSeconds;

    @Option(names = "--worker-timeout-seconds", description = "Wall-clock limit per attempt, 0 disables")
    Integer workerTimeoutSeconds;

    @Option(names = "--log-stall-seconds", description = "Kill a worker whose log is idle this long, 0 disables")
    Integer logStallSeconds;

    @Option(names = "--kill-grace-seconds", description = "Wait between SIGTERM and SIGKILL")
    Integer killGraceSeconds;

    @Option(names = "--resource-guard", negatable = true, description = "Hold back spawns under host pressure")
    Boolean resourceGuard;

    @Option(names = "--max-load-ratio", description = "Load average per CPU above which spawns pause")
    Double maxLoadRatio;

    @Option(names = "--min-free-mem-mb", description = "Free memory below which spawns pause")
    Long minFreeMemMb;

    @Option(names = "--min-free-mem-ratio", description = "Free memory fraction below which spawns pause")
    Double minFreeMemRatio;

    @Option(names = "--workstream-ids", split = ",", description = "Only dispatch these workstreams")
    List<String> workstreamIds = new ArrayList<>();

    @Option(names = "--task-ids", split = ",", description = "Only dispatch these tasks (done tasks included)")
    List<String> taskIds = new ArrayList<>();

    @Option(names = "--include-done", description = "Dispatch tasks that are already done")
    boolean includeDone;

    @Option(names = "--max-tasks", defaultValue = "0", description = "Cap on queued tasks, 0 for no cap")
    int maxTasks;

    @Option(names = "--resume", description = "Continue a previous job from its state file")
    boolean resume;

    @Option(names = "--retry-blocked", description = "With --resume, dispatch previously blocked tasks again")
    boolean retryBlocked;

    @Option(names = "--dry-run", description = "Walk the queue without spawning workers, consulting the spawn guard or writing remotely")
    boolean dryRun;

    @Option(names = "--auto-complete", negatable = true, description = "Push task status transitions")
    Boolean autoComplete;

    @Option(names = "--decision-on-block", negatable = true, description = "Request a human decision for blocked tasks")
    Boolean decisionOnBlock;

    @Option(names = "--guard-mode", description = "Spawn guard failure handling: ${COMPLETION-CANDIDATES}")
    GuardMode guardMode;

    @Option(names = "--state-file", description = "Job state file (default <logs-dir>/<job-id>/job-state.json)")
    Path stateFile;

    @Option(names = "--logs-dir", description = "Directory for worker logs and job state")
    Path logsDir;

    @Option(names = "--plan-file", description = "Plan document referenced in worker prompts")
    Path planFile;

    @Option(names = "--job-config", description = "JSON file with per-workstream and per-task overrides")
    Path jobConfigFile;

    @Option(names = "--job-id", description = "Job id (default: generated, or the resumed job's id)")
    String jobId;

    @Option(names = "--correlation-id", description = "Correlation id reported until a run id is assigned")
    String correlationId;

    @Option(names = "--source-client", description = "Source client reported with activity")
    String sourceClient;

    @Option(names = "--agent-bin", description = "Execution agent executable")
    String agentBin;

    @Option(names = "--agent-args", split = ",", description = "Arguments placed before the prompt")
    List<String> agentArgs;

    private final DispatchEngine dispatchEngine;
    private final DispatchProperties dispatchProperties;
    private final WorkerProperties workerProperties;
    private final EventBus eventBus;

    public RunCommand(DispatchEngine dispatchEngine, DispatchProperties dispatchProperties,
                      WorkerProperties workerProperties, EventBus eventBus) {
        this.dispatchEngine = dispatchEngine;
        this.dispatchProperties = dispatchProperties;
        this.workerProperties = workerProperties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        DispatchOptions options;
        try {
            options = toOptions();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid options: " + e.getMessage());
            return 1;
        }
        if (agentBin != null) {
            workerProperties.setAgentBin(agentBin);
        }
        if (agentArgs != null) {
            workerProperties.setAgentArgs(new ArrayList<>(agentArgs));
        }

        ConsoleOutput.info("Dispatching scope " + options.scopeId()
                + (options.dryRun() ? " (dry run)" : "")
                + (options.resume() ? " (resume)" : ""));

        EventBus.Subscription subscription = eventBus.subscribe(ConsoleOutput::event);
        try {
            JobOutcome outcome = dispatchEngine.run(options);
            ConsoleOutput.outcome(outcome);
            return outcome.exitCode();
        } catch (DispatchException e) {
            ConsoleOutput.error("Dispatch failed: " + e.getMessage());
            String rootCause = rootCauseMessage(e);
            if (e.getCause() != null && !rootCause.equals(e.getMessage())) {
                ConsoleOutput.error("Cause: " + rootCause);
            }
            return 1;
        } finally {
            subscription.unsubscribe();
        }
    }

    /**
     * Resolves command line flags over configuration defaults.
     */
    DispatchOptions toOptions() {
        DispatchProperties.ResourceGuardSettings guard = dispatchProperties.getResourceGuard();
        long freeMb = minFreeMemMb != null ? minFreeMemMb : guard.getMinFreeMemMb();
        ResourceThresholds thresholds = new ResourceThresholds(
                maxLoadRatio != null ? maxLoadRatio : guard.getMaxLoadRatio(),
                freeMb * 1024 * 1024,
                minFreeMemRatio != null ? minFreeMemRatio : guard.getMinFreeMemRatio());

        int poll = Math.max(MIN_POLL_SECONDS,
                pollSeconds != null ? pollSeconds : dispatchProperties.getPollIntervalSeconds());
        int heartbeat = Math.max(MIN_HEARTBEAT_SECONDS,
                heartbeatSeconds != null ? heartbeatSeconds : dispatchProperties.getHeartbeatSeconds());
        String configuredStateFile = dispatchProperties.getStateFile();

        return DispatchOptions.builder()
                .scopeId(blankToNull(scopeId))
                .jobId(blankToNull(jobId))
                .correlationId(blankToNull(correlationId))
                .sourceClient(sourceClient != null ? sourceClient : dispatchProperties.getSourceClient())
                .concurrency(concurrency != null ? concurrency : dispatchProperties.getConcurrency())
                .maxAttempts(maxAttempts != null ? maxAttempts : dispatchProperties.getMaxAttempts())
                .pollInterval(Duration.ofSeconds(poll))
                .heartbeatInterval(Duration.ofSeconds(heartbeat))
                .workerTimeout(Duration.ofSeconds(workerTimeoutSeconds != null
                        ? workerTimeoutSeconds : workerProperties.getTimeoutSeconds()))
                .logStall(Duration.ofSeconds(logStallSeconds != null
                        ? logStallSeconds : workerProperties.getLogStallSeconds()))
                .killGrace(Duration.ofSeconds(killGraceSeconds != null
                        ? killGraceSeconds : workerProperties.getKillGraceSeconds()))
                .retryBase(Duration.ofMillis(dispatchProperties.getRetry().getBaseMs()))
                .retryCap(Duration.ofMillis(dispatchProperties.getRetry().getCapMs()))
                .resourceGuardEnabled(resourceGuard != null ? resourceGuard : guard.isEnabled())
                .thresholds(thresholds)
                .workstreamIds(new LinkedHashSet<>(workstreamIds))
                .taskIds(new LinkedHashSet<>(taskIds))
                .includeDone(includeDone)
                .maxTasks(maxTasks)
                .resume(resume)
                .retryBlocked(retryBlocked)
                .dryRun(dryRun)
                .autoComplete(autoComplete != null ? autoComplete : dispatchProperties.isAutoComplete())
                .decisionOnBlock(decisionOnBlock != null ? decisionOnBlock : dispatchProperties.isDecisionOnBlock())
                .guardMode(guardMode != null ? guardMode : dispatchProperties.getGuardMode())
                .stateFile(stateFile != null ? stateFile
                        : configuredStateFile == null || configuredStateFile.isBlank() ? null : Path.of(configuredStateFile))
                .logsDir(logsDir != null ? logsDir : Path.of(workerProperties.getLogsDir()))
                .planFile(planFile)
                .jobConfigFile(jobConfigFile)
                .build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
