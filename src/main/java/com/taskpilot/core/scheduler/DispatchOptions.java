package com.taskpilot.core.scheduler;

import com.taskpilot.core.resource.ResourceThresholds;
import com.taskpilot.orchestration.GuardMode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fully resolved settings of one dispatch job: configuration defaults with the run's
 * command line overrides applied. Immutable; build with {@link #builder()}.
 */
public final class DispatchOptions {

    private final String scopeId;
    private final String jobId;
    private final String correlationId;
    private final String sourceClient;
    private final int concurrency;
    private final int maxAttempts;
    private final Duration pollInterval;
    private final Duration heartbeatInterval;
    private final Duration workerTimeout;
    private final Duration logStall;
    private final Duration killGrace;
    private final Duration retryBase;
    private final Duration retryCap;
    private final boolean resourceGuardEnabled;
    private final ResourceThresholds thresholds;
    private final Set<String> workstreamIds;
    private final Set<String> taskIds;
    private final boolean includeDone;
    private final int maxTasks;
    private final boolean resume;
    private final boolean retryBlocked;
    private final boolean dryRun;
    private final boolean autoComplete;
    private final boolean decisionOnBlock;
    private final GuardMode guardMode;
    private final Path stateFile;
    private final Path logsDir;
    private final Path planFile;
    private final Path jobConfigFile;

    private DispatchOptions(Builder b) {
        this.scopeId = b.scopeId;
        this.jobId = b.jobId;
        this.correlationId = b.correlationId;
        this.sourceClient = b.sourceClient;
        this.concurrency = b.concurrency;
        this.maxAttempts = b.maxAttempts;
        this.pollInterval = b.pollInterval;
        this.heartbeatInterval = b.heartbeatInterval;
        this.workerTimeout = b.workerTimeout;
        this.logStall = b.logStall;
        this.killGrace = b.killGrace;
        this.retryBase = b.retryBase;
        this.retryCap = b.retryCap;
        this.resourceGuardEnabled = b.resourceGuardEnabled;
        this.thresholds = b.thresholds;
        this.workstreamIds = Set.copyOf(b.workstreamIds);
        this.taskIds = Set.copyOf(b.taskIds);
        this.includeDone = b.includeDone;
        this.maxTasks = b.maxTasks;
        this.resume = b.resume;
        this.retryBlocked = b.retryBlocked;
        this.dryRun = b.dryRun;
        this.autoComplete = b.autoComplete;
        this.decisionOnBlock = b.decisionOnBlock;
        this.guardMode = b.guardMode;
        this.stateFile = b.stateFile;
        this.logsDir = b.logsDir;
        this.planFile = b.planFile;
        this.jobConfigFile = b.jobConfigFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryBase, retryCap, maxAttempts);
    }

    public QueueFilter queueFilter() {
        return new QueueFilter(workstreamIds, taskIds, includeDone, maxTasks);
    }

    public String scopeId() { return scopeId; }
    public String jobId() { return jobId; }
    public String correlationId() { return correlationId; }
    public String sourceClient() { return sourceClient; }
    public int concurrency() { return concurrency; }
    public int maxAttempts() { return maxAttempts; }
    public Duration pollInterval() { return pollInterval; }
    public Duration heartbeatInterval() { return heartbeatInterval; }
    public Duration workerTimeout() { return workerTimeout; }
    public Duration logStall() { return logStall; }
    public Duration killGrace() { return killGrace; }
    public boolean resourceGuardEnabled() { return resourceGuardEnabled; }
    public ResourceThresholds thresholds() { return thresholds; }
    public Set<String> workstreamIds() { return workstreamIds; }
    public Set<String> taskIds() { return taskIds; }
    public boolean includeDone() { return includeDone; }
    public int maxTasks() { return maxTasks; }
    public boolean resume() { return resume; }
    public boolean retryBlocked() { return retryBlocked; }
    public boolean dryRun() { return dryRun; }
    public boolean autoComplete() { return autoComplete; }
    public boolean decisionOnBlock() { return decisionOnBlock; }
    public GuardMode guardMode() { return guardMode; }
    public Path stateFile() { return stateFile; }
    public Path logsDir() { return logsDir; }
    public Path planFile() { return planFile; }
    public Path jobConfigFile() { return jobConfigFile; }

    public static final class Builder {
        private String scopeId;
        private String jobId;
        private String correlationId;
        private String sourceClient = "taskpilot";
        private int concurrency = 4;
        private int maxAttempts = 2;
        private Duration pollInterval = Duration.ofSeconds(10);
        private Duration heartbeatInterval = Duration.ofSeconds(45);
        private Duration workerTimeout = Duration.ofSeconds(3600);
        private Duration logStall = Duration.ofSeconds(720);
        private Duration killGrace = Duration.ofSeconds(20);
        private Duration retryBase = RetryPolicy.DEFAULT_BASE;
        private Duration retryCap = RetryPolicy.DEFAULT_CAP;
        private boolean resourceGuardEnabled = true;
        private ResourceThresholds thresholds = ResourceThresholds.defaults();
        private Set<String> workstreamIds = new LinkedHashSet<>();
        private Set<String> taskIds = new LinkedHashSet<>();
        private boolean includeDone;
        private int maxTasks;
        private boolean resume;
        private boolean retryBlocked;
        private boolean dryRun;
        private boolean autoComplete = true;
        private boolean decisionOnBlock;
        private GuardMode guardMode = GuardMode.FAIL_OPEN;
        private Path stateFile;
        private Path logsDir = Path.of(".taskpilot-jobs");
        private Path planFile;
        private Path jobConfigFile;

        private Builder() {}

        public Builder scopeId(String scopeId) { this.scopeId = scopeId; return this; }
        public Builder jobId(String jobId) { this.jobId = jobId; return this; }
        public Builder correlationId(String correlationId) { this.correlationId = correlationId; return this; }
        public Builder sourceClient(String sourceClient) { this.sourceClient = sourceClient; return this; }
        public Builder concurrency(int concurrency) { this.concurrency = concurrency; return this; }
        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder pollInterval(Duration pollInterval) { this.pollInterval = pollInterval; return this; }
        public Builder heartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; return this; }
        public Builder workerTimeout(Duration workerTimeout) { this.workerTimeout = workerTimeout; return this; }
        public Builder logStall(Duration logStall) { this.logStall = logStall; return this; }
        public Builder killGrace(Duration killGrace) { this.killGrace = killGrace; return this; }
        public Builder retryBase(Duration retryBase) { this.retryBase = retryBase; return this; }
        public Builder retryCap(Duration retryCap) { this.retryCap = retryCap; return this; }
        public Builder resourceGuardEnabled(boolean enabled) { this.resourceGuardEnabled = enabled; return this; }
        public Builder thresholds(ResourceThresholds thresholds) { this.thresholds = thresholds; return this; }
        public Builder workstreamIds(Set<String> ids) { this.workstreamIds = new LinkedHashSet<>(ids); return this; }
        public Builder taskIds(Set<String> ids) { this.taskIds = new LinkedHashSet<>(ids); return this; }
        public Builder includeDone(boolean includeDone) { this.includeDone = includeDone; return this; }
        public Builder maxTasks(int maxTasks) { this.maxTasks = maxTasks; return this; }
        public Builder resume(boolean resume) { this.resume = resume; return this; }
        public Builder retryBlocked(boolean retryBlocked) { this.retryBlocked = retryBlocked; return this; }
        public Builder dryRun(boolean dryRun) { this.dryRun = dryRun; return this; }
        public Builder autoComplete(boolean autoComplete) { this.autoComplete = autoComplete; return this; }
        public Builder decisionOnBlock(boolean decisionOnBlock) { this.decisionOnBlock = decisionOnBlock; return this; }
        public Builder guardMode(GuardMode guardMode) { this.guardMode = guardMode; return this; }
        public Builder stateFile(Path stateFile) { this.stateFile = stateFile; return this; }
        public Builder logsDir(Path logsDir) { this.logsDir = logsDir; return this; }
        public Builder planFile(Path planFile) { this.planFile = planFile; return this; }
        public Builder jobConfigFile(Path jobConfigFile) { this.jobConfigFile = jobConfigFile; return this; }

        /**
         * @throws IllegalArgumentException when a count or interval is out of range
         */
        public DispatchOptions build() {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be at least 1");
            }
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            if (pollInterval.isNegative() || heartbeatInterval.isNegative()) {
                throw new IllegalArgumentException("intervals must not be negative");
            }
            return new DispatchOptions(this);
        }
    }
}
