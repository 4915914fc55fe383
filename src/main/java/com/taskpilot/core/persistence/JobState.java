package com.taskpilot.core.persistence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.taskpilot.core.model.FailureKind;
import com.taskpilot.core.rollup.Rollup;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Durable snapshot of a dispatch job, written after every meaningful transition so an
 * interrupted job can be resumed.
 * <p>
 * Owned by the dispatch loop; only {@link JobStateStore} writes it to disk.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobState {

    /** Per-task outcome of the most recent attempt. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskRecord(
        String status,
        int attempts,
        Integer exitCode,
        String logPath,
        Instant finishedAt,
        FailureKind failureKind,
        String reason
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ActiveWorker(long pid, int attempt, Instant startedAt, String logPath) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RollupSnapshot(
        int done,
        int blocked,
        int active,
        int todo,
        int total,
        int progressPct,
        String status,
        Instant updatedAt
    ) {
        public static RollupSnapshot of(Rollup rollup, Instant at) {
            return new RollupSnapshot(rollup.done(), rollup.blocked(), rollup.active(), rollup.todo(),
                    rollup.total(), rollup.progressPct(), rollup.status(), at);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Rollups {
        private Map<String, RollupSnapshot> milestones = new LinkedHashMap<>();
        private Map<String, RollupSnapshot> workstreams = new LinkedHashMap<>();

        public Map<String, RollupSnapshot> getMilestones() { return milestones; }
        public void setMilestones(Map<String, RollupSnapshot> milestones) { this.milestones = milestones; }
        public Map<String, RollupSnapshot> getWorkstreams() { return workstreams; }
        public void setWorkstreams(Map<String, RollupSnapshot> workstreams) { this.workstreams = workstreams; }
    }

    private String jobId;
    private String scopeId;
    private String planPath;
    private String planHash;
    private List<String> selectedWorkstreamIds = new ArrayList<>();
    private int totalTasks;
    private int completed;
    private int failed;
    private int skipped;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant finishedAt;
    private JobResult result = JobResult.RUNNING;
    private Map<String, TaskRecord> taskStates = new LinkedHashMap<>();
    private Map<String, ActiveWorker> activeWorkers = new LinkedHashMap<>();
    private Rollups rollups = new Rollups();

    public JobState() {}

    public static JobState start(String jobId, String scopeId, String planPath, String planHash,
                                 List<String> selectedWorkstreamIds, int totalTasks, Instant now) {
        JobState state = new JobState();
        state.jobId = jobId;
        state.scopeId = scopeId;
        state.planPath = planPath;
        state.planHash = planHash;
        state.selectedWorkstreamIds = new ArrayList<>(selectedWorkstreamIds);
        state.totalTasks = totalTasks;
        state.startedAt = now;
        state.updatedAt = now;
        return state;
    }

    public void recordTask(String taskId, TaskRecord record) {
        taskStates.put(taskId, record);
    }

    public TaskRecord taskRecord(String taskId) {
        return taskStates.get(taskId);
    }

    public void recordRollup(Rollup rollup, String entityId, Instant at) {
        Map<String, RollupSnapshot> target = switch (rollup.level()) {
            case MILESTONE -> rollups.getMilestones();
            case WORKSTREAM -> rollups.getWorkstreams();
        };
        target.put(entityId, RollupSnapshot.of(rollup, at));
    }

    @JsonIgnore
    public boolean isFinished() {
        return result != JobResult.RUNNING;
    }

    public String getJobId() { return jobId; }
    public void setJobId(String jobId) { this.jobId = jobId; }
    public String getScopeId() { return scopeId; }
    public void setScopeId(String scopeId) { this.scopeId = scopeId; }
    public String getPlanPath() { return planPath; }
    public void setPlanPath(String planPath) { this.planPath = planPath; }
    public String getPlanHash() { return planHash; }
    public void setPlanHash(String planHash) { this.planHash = planHash; }
    public List<String> getSelectedWorkstreamIds() { return selectedWorkstreamIds; }
    public void setSelectedWorkstreamIds(List<String> selectedWorkstreamIds) { this.selectedWorkstreamIds = selectedWorkstreamIds; }
    public int getTotalTasks() { return totalTasks; }
    public void setTotalTasks(int totalTasks) { this.totalTasks = totalTasks; }
    public int getCompleted() { return completed; }
    public void setCompleted(int completed) { this.completed = completed; }
    public int getFailed() { return failed; }
    public void setFailed(int failed) { this.failed = failed; }
    public int getSkipped() { return skipped; }
    public void setSkipped(int skipped) { this.skipped = skipped; }
    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public void setFinishedAt(Instant finishedAt) { this.finishedAt = finishedAt; }
    public JobResult getResult() { return result; }
    public void setResult(JobResult result) { this.result = result; }
    public Map<String, TaskRecord> getTaskStates() { return taskStates; }
    public void setTaskStates(Map<String, TaskRecord> taskStates) { this.taskStates = taskStates; }
    public Map<String, ActiveWorker> getActiveWorkers() { return activeWorkers; }
    public void setActiveWorkers(Map<String, ActiveWorker> activeWorkers) { this.activeWorkers = activeWorkers; }
    public Rollups getRollups() { return rollups; }
    public void setRollups(Rollups rollups) { this.rollups = rollups; }
}
