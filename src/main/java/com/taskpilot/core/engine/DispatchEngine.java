package com.taskpilot.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.taskpilot.core.events.DispatchEvent;
import com.taskpilot.core.events.EventBus;
import com.taskpilot.core.logging.MdcContext;
import com.taskpilot.core.metrics.DispatchMetrics;
import com.taskpilot.core.model.Task;
import com.taskpilot.core.model.TaskState;
import com.taskpilot.core.model.WorkItem;
import com.taskpilot.core.persistence.JobResult;
import com.taskpilot.core.persistence.JobState;
import com.taskpilot.core.persistence.JobStateStore;
import com.taskpilot.core.persistence.JsonSupport;
import com.taskpilot.core.resource.HostMetricsSampler;
import com.taskpilot.core.resource.ResourceGuard;
import com.taskpilot.core.rollup.Rollup;
import com.taskpilot.core.rollup.RollupAggregator;
import com.taskpilot.core.scheduler.DispatchLoop;
import com.taskpilot.core.scheduler.DispatchOptions;
import com.taskpilot.core.scheduler.DispatchPlan;
import com.taskpilot.core.scheduler.JobOutcome;
import com.taskpilot.core.scheduler.TaskQueueBuilder;
import com.taskpilot.core.scheduler.WorkerLauncher;
import com.taskpilot.orchestration.IdempotencyKeys;
import com.taskpilot.orchestration.OrchestrationClient;
import com.taskpilot.orchestration.OrchestrationException;
import com.taskpilot.orchestration.OrchestrationProperties;
import com.taskpilot.orchestration.ProgressEvent;
import com.taskpilot.orchestration.Reporter;
import com.taskpilot.orchestration.SpawnGuard;
import com.taskpilot.worker.JobConfig;
import com.taskpilot.worker.JobContext;
import com.taskpilot.worker.WorkerHandle;
import com.taskpilot.worker.WorkerManager;
import com.taskpilot.worker.WorkerWatchdog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prepares and runs one dispatch job.
 * <p>
 * Validates the options, reads the plan and job config, fetches the scope's workstreams,
 * milestones and tasks, builds the queue, overlays a prior run's state when resuming,
 * seeds the rollups and hands everything to a {@link DispatchLoop}.
 */
@Service
public class DispatchEngine {

    private static final Logger log = LoggerFactory.getLogger(DispatchEngine.class);

    static final String STATE_FILE_NAME = "job-state.json";

    private final OrchestrationClient client;
    private final OrchestrationProperties orchestrationProperties;
    private final TaskQueueBuilder queueBuilder;
    private final WorkerManager workerManager;
    private final JobStateStore store;
    private final EventBus eventBus;
    private final DispatchMetrics metrics;
    private final HostMetricsSampler sampler;
    private final Clock clock;
    private final DispatchLoop.Sleeper sleeper;

    @Autowired
    public DispatchEngine(OrchestrationClient client, OrchestrationProperties orchestrationProperties,
                          TaskQueueBuilder queueBuilder, WorkerManager workerManager, JobStateStore store,
                          EventBus eventBus, DispatchMetrics metrics, HostMetricsSampler sampler, Clock clock) {
        this(client, orchestrationProperties, queueBuilder, workerManager, store, eventBus, metrics, sampler,
                clock, duration -> Thread.sleep(duration.toMillis()));
    }

    DispatchEngine(OrchestrationClient client, OrchestrationProperties orchestrationProperties,
                   TaskQueueBuilder queueBuilder, WorkerManager workerManager, JobStateStore store,
                   EventBus eventBus, DispatchMetrics metrics, HostMetricsSampler sampler, Clock clock,
                   DispatchLoop.Sleeper sleeper) {
        this.client = client;
        this.orchestrationProperties = orchestrationProperties;
        this.queueBuilder = queueBuilder;
        this.workerManager = workerManager;
        this.store = store;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.sampler = sampler;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Runs a dispatch job to completion.
     *
     * @throws DispatchException when the job cannot start or is interrupted
     */
    public JobOutcome run(DispatchOptions options) {
        validate(options);

        String planText = readPlan(options.planFile());
        String planHash = planText.isEmpty() ? "" : IdempotencyKeys.sha256Hex(planText);
        JobConfig jobConfig = readJobConfig(options.jobConfigFile());
        Path logsDir = options.logsDir().toAbsolutePath().normalize();

        JobState prior = null;
        Path stateFile = null;
        if (options.resume()) {
            stateFile = options.stateFile() != null
                    ? options.stateFile()
                    : logsDir.resolve(options.jobId()).resolve(STATE_FILE_NAME);
            prior = store.load(stateFile).orElse(null);
            if (prior == null) {
                log.warn("No prior job state at {}, starting fresh", stateFile);
            }
        }
        String jobId = options.jobId() != null ? options.jobId()
                : prior != null && prior.getJobId() != null ? prior.getJobId()
                : "dispatch-job-" + clock.millis();
        if (stateFile == null) {
            stateFile = options.stateFile() != null
                    ? options.stateFile()
                    : logsDir.resolve(jobId).resolve(STATE_FILE_NAME);
        }

        MdcContext.setJob(jobId);
        try {
            return runJob(options, jobId, stateFile, prior, planText, planHash, jobConfig, logsDir);
        } finally {
            MdcContext.clear();
        }
    }

    private JobOutcome runJob(DispatchOptions options, String jobId, Path stateFile, JobState prior,
                              String planText, String planHash, JobConfig jobConfig, Path logsDir) {
        String scopeId = options.scopeId();
        log.info("Starting dispatch job {} for scope {} (concurrency {}, max attempts {}, dry-run {})",
                jobId, scopeId, options.concurrency(), options.maxAttempts(), options.dryRun());

        Map<String, String> workstreamNames = names(fetch("workstream", scopeId));
        Map<String, String> milestoneTitles = names(fetch("milestone", scopeId));
        List<Task> fetched = new ArrayList<>();
        for (JsonNode node : fetch("task", scopeId)) {
            Task task = Task.fromEntity(node);
            if (task.id() != null) {
                fetched.add(withContainerNames(task, workstreamNames, milestoneTitles));
            }
        }
        log.info("Fetched {} workstreams, {} milestones, {} tasks",
                workstreamNames.size(), milestoneTitles.size(), fetched.size());

        List<Task> queue = queueBuilder.build(fetched, options.queueFilter());
        DispatchPlan plan = resumePlan(queue, prior, options);

        // Prior terminal states win over fetched statuses so resumed rollups match the earlier run
        List<Task> overlaid = new ArrayList<>(fetched.size());
        for (Task task : fetched) {
            overlaid.add(overlayPrior(task, prior));
        }

        String correlationId = options.correlationId() != null ? options.correlationId() : jobId;
        String planPath = options.planFile() == null ? null : options.planFile().toString();
        Reporter reporter = new Reporter(client, new Reporter.Settings(scopeId, jobId, correlationId,
                options.sourceClient(), planPath, planHash, options.dryRun()));

        Instant now = clock.instant();
        JobState state = prepareState(prior, jobId, scopeId, planPath, planHash, options, plan, now);

        RollupAggregator rollups = new RollupAggregator(overlaid, queue, milestoneTitles, workstreamNames);
        rollups.milestoneRollups().forEach((id, rollup) -> state.recordRollup(rollup, id, now));
        rollups.workstreamRollups().forEach((id, rollup) -> state.recordRollup(rollup, id, now));

        Path jobLogsDir = logsDir.resolve(jobId);
        try {
            Files.createDirectories(jobLogsDir);
        } catch (IOException e) {
            throw new DispatchException("Cannot create job log directory " + jobLogsDir, e);
        }
        store.persist(stateFile, state);

        if (plan.totalTasks() == 0) {
            return finishEmpty(options, jobId, state, stateFile, reporter);
        }
        emitStart(options, jobId, plan, queue, reporter);

        JobContext jobContext = new JobContext(jobId, scopeId, correlationId, planPath, planText, jobConfig,
                jobLogsDir, plan.totalTasks());
        WorkerLauncher launcher = new WorkerLauncher() {
            @Override
            public WorkerHandle launch(Task task, int attempt, int completedTasks) throws IOException {
                return workerManager.launch(jobContext, task, attempt, completedTasks);
            }

            @Override
            public Path logPath(Task task, int attempt) {
                return jobContext.logPath(task.id(), attempt);
            }
        };

        DispatchLoop loop = new DispatchLoop(options, state, stateFile, plan, new DispatchLoop.Collaborators(
                launcher,
                reporter,
                new SpawnGuard(client, options.guardMode()),
                new WorkerWatchdog(options.workerTimeout(), options.logStall(), options.killGrace()),
                () -> ResourceGuard.evaluate(sampler.sample(), options.thresholds()),
                rollups,
                store,
                eventBus,
                metrics,
                clock,
                sleeper));
        try {
            JobOutcome outcome = loop.run();
            log.info("Dispatch job {} finished: {} ({}/{} done, {} blocked)", jobId, outcome.result().wireName(),
                    outcome.completed(), outcome.totalTasks(), outcome.blocked());
            return outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Dispatch job " + jobId + " interrupted", e);
        } catch (RuntimeException e) {
            throw new DispatchException("Dispatch job " + jobId + " failed", e);
        }
    }

    void validate(DispatchOptions options) {
        if (options.scopeId() == null || options.scopeId().isBlank()) {
            throw new DispatchException("Scope id is required (--scope-id or TASKPILOT_SCOPE_ID)");
        }
        if (!options.dryRun() && !orchestrationProperties.hasApiKey()) {
            throw new DispatchException(
                    "Orchestration API key is required unless --dry-run (taskpilot.orchestration.api-key)");
        }
        if (options.retryBlocked() && !options.resume()) {
            throw new DispatchException("--retry-blocked requires --resume");
        }
        if (options.resume() && options.stateFile() == null && options.jobId() == null) {
            throw new DispatchException("--resume requires --state-file or --job-id");
        }
    }

    /**
     * Applies a prior run's outcome to the freshly built queue. Done tasks are skipped unless
     * re-selected by id; blocked tasks are skipped unless re-selected or retryBlocked is set.
     * Re-selected terminal tasks start over with fresh attempts.
     */
    static DispatchPlan resumePlan(List<Task> queue, JobState prior, DispatchOptions options) {
        if (prior == null) {
            return DispatchPlan.fresh(queue);
        }
        List<Task> remaining = new ArrayList<>();
        Map<String, Integer> priorAttempts = new HashMap<>();
        Set<String> skippedDone = new LinkedHashSet<>();
        Set<String> skippedBlocked = new LinkedHashSet<>();
        for (Task task : queue) {
            JobState.TaskRecord record = prior.taskRecord(task.id());
            boolean reselected = options.taskIds().contains(task.id());
            if (record == null) {
                remaining.add(task);
                continue;
            }
            TaskState priorState = TaskState.classify(record.status());
            if (priorState == TaskState.DONE) {
                if (reselected) {
                    remaining.add(task);
                } else {
                    skippedDone.add(task.id());
                }
            } else if (priorState == TaskState.BLOCKED) {
                if (reselected || options.retryBlocked()) {
                    remaining.add(task);
                } else {
                    skippedBlocked.add(task.id());
                }
            } else {
                remaining.add(task);
                priorAttempts.put(task.id(), record.attempts());
            }
        }
        log.info("Resuming: {} to dispatch, {} already done, {} still blocked",
                remaining.size(), skippedDone.size(), skippedBlocked.size());
        return new DispatchPlan(remaining, priorAttempts, skippedDone, skippedBlocked, queue.size());
    }

    private JobState prepareState(JobState prior, String jobId, String scopeId, String planPath, String planHash,
                                  DispatchOptions options, DispatchPlan plan, Instant now) {
        List<String> selected = new ArrayList<>(options.workstreamIds());
        if (prior == null) {
            return JobState.start(jobId, scopeId, planPath, planHash, selected, plan.totalTasks(), now);
        }
        if (!prior.getActiveWorkers().isEmpty()) {
            log.warn("Clearing {} worker(s) recorded as active by the previous run: {}",
                    prior.getActiveWorkers().size(), prior.getActiveWorkers().keySet());
            prior.getActiveWorkers().clear();
        }
        prior.setJobId(jobId);
        prior.setScopeId(scopeId);
        prior.setPlanPath(planPath);
        prior.setPlanHash(planHash);
        prior.setSelectedWorkstreamIds(selected);
        prior.setTotalTasks(plan.totalTasks());
        prior.setCompleted(plan.skippedDone().size());
        prior.setFailed(plan.skippedBlocked().size());
        prior.setSkipped(plan.skippedDone().size() + plan.skippedBlocked().size());
        prior.setResult(JobResult.RUNNING);
        prior.setFinishedAt(null);
        return prior;
    }

    private JobOutcome finishEmpty(DispatchOptions options, String jobId, JobState state, Path stateFile,
                                   Reporter reporter) {
        log.warn("No matching tasks to dispatch for scope {}", options.scopeId());
        state.setResult(JobResult.COMPLETED);
        state.setFinishedAt(clock.instant());
        store.persist(stateFile, state);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "job_complete");
        metadata.put("result", JobResult.COMPLETED.wireName());
        metadata.put("selected_workstreams", new ArrayList<>(options.workstreamIds()));
        metadata.put("selected_tasks", new ArrayList<>(options.taskIds()));
        try {
            reporter.emit(ProgressEvent.of("No matching tasks to dispatch.", ProgressEvent.Phase.COMPLETED,
                    ProgressEvent.Level.WARN, 100, metadata));
        } catch (OrchestrationException e) {
            log.warn("Final activity failed: {}", e.getMessage());
        }
        eventBus.publish(new DispatchEvent(DispatchEvent.JOB_COMPLETED, jobId, null, metadata, clock.instant()));
        return new JobOutcome(jobId, JobResult.COMPLETED, 0, 0, 0, stateFile, reporter.runId());
    }

    private void emitStart(DispatchOptions options, String jobId, DispatchPlan plan, List<Task> queue,
                           Reporter reporter) {
        Set<String> queuedWorkstreams = new LinkedHashSet<>();
        queue.forEach(task -> {
            if (task.workstreamId() != null) {
                queuedWorkstreams.add(task.workstreamId());
            }
        });
        List<String> emptyWorkstreams = new ArrayList<>();
        for (String wsId : options.workstreamIds()) {
            if (!queuedWorkstreams.contains(wsId)) {
                emptyWorkstreams.add(wsId);
            }
        }
        if (!emptyWorkstreams.isEmpty()) {
            log.warn("Selected workstreams without dispatchable tasks: {}", emptyWorkstreams);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("event", "job_start");
        metadata.put("total_tasks", plan.totalTasks());
        metadata.put("to_dispatch", plan.queue().size());
        metadata.put("concurrency", options.concurrency());
        metadata.put("max_attempts", options.maxAttempts());
        metadata.put("dry_run", options.dryRun());
        metadata.put("resume", options.resume());
        metadata.put("workstreams", new ArrayList<>(queuedWorkstreams));
        metadata.put("empty_workstreams", emptyWorkstreams);
        try {
            reporter.emit(ProgressEvent.of(
                    "Dispatch job started for %d task(s) across %d workstream(s).".formatted(
                            plan.totalTasks(), queuedWorkstreams.size()),
                    ProgressEvent.Phase.INTENT, ProgressEvent.Level.INFO,
                    Rollup.percent(plan.skippedDone().size(), plan.totalTasks()), metadata));
        } catch (OrchestrationException e) {
            log.warn("Start activity failed: {}", e.getMessage());
        }
        eventBus.publish(new DispatchEvent(DispatchEvent.JOB_STARTED, jobId, null, metadata, clock.instant()));
    }

    private List<JsonNode> fetch(String type, String scopeId) {
        Map<String, String> filters = new LinkedHashMap<>();
        filters.put("initiative_id", scopeId);
        filters.put("limit", String.valueOf(orchestrationProperties.getEntityPageLimit()));
        try {
            return client.listEntities(type, filters);
        } catch (OrchestrationException e) {
            throw new DispatchException("Failed to list " + type + " entities for scope " + scopeId
                    + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, String> names(List<JsonNode> nodes) {
        Map<String, String> names = new LinkedHashMap<>();
        for (JsonNode node : nodes) {
            WorkItem item = WorkItem.fromEntity(node);
            if (item.id() != null) {
                names.put(item.id(), item.name());
            }
        }
        return names;
    }

    private static Task withContainerNames(Task task, Map<String, String> workstreamNames,
                                           Map<String, String> milestoneTitles) {
        String wsName = task.workstreamName() != null ? task.workstreamName()
                : task.workstreamId() == null ? null : workstreamNames.get(task.workstreamId());
        String msTitle = task.milestoneTitle() != null ? task.milestoneTitle()
                : task.milestoneId() == null ? null : milestoneTitles.get(task.milestoneId());
        if (wsName == task.workstreamName() && msTitle == task.milestoneTitle()) {
            return task;
        }
        return new Task(task.id(), task.title(), task.status(), task.priority(), task.dueDate(), task.sequence(),
                task.workstreamId(), wsName, task.milestoneId(), msTitle, task.domain(), task.requiredSkills());
    }

    private static Task overlayPrior(Task task, JobState prior) {
        if (prior == null) {
            return task;
        }
        JobState.TaskRecord record = prior.taskRecord(task.id());
        if (record == null) {
            return task;
        }
        TaskState priorState = TaskState.classify(record.status());
        if (priorState == TaskState.DONE || priorState == TaskState.BLOCKED) {
            return task.withStatus(record.status());
        }
        return task;
    }

    private String readPlan(Path planFile) {
        if (planFile == null) {
            return "";
        }
        try {
            return Files.readString(planFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DispatchException("Cannot read plan file " + planFile, e);
        }
    }

    private JobConfig readJobConfig(Path jobConfigFile) {
        if (jobConfigFile == null) {
            return JobConfig.empty();
        }
        try {
            return JobConfig.load(jobConfigFile, JsonSupport.newMapper());
        } catch (IOException e) {
            throw new DispatchException("Cannot read job config " + jobConfigFile + ": " + e.getMessage(), e);
        }
    }
}
