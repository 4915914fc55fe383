package com.taskpilot.core.rollup;

import com.taskpilot.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps milestone and workstream rollups in step with task transitions for one job.
 * <p>
 * Membership is taken from the full task set of the scope, while only containers
 * referenced by a queued task are tracked. The rollup computed at construction is the
 * initial last-propagated value, so nothing is propagated until a member task moves.
 * Not thread-safe; owned by the dispatch loop thread.
 */
public class RollupAggregator {

    private static final Logger log = LoggerFactory.getLogger(RollupAggregator.class);

    private final Map<String, String> statusByTaskId = new HashMap<>();
    private final Map<String, List<String>> taskIdsByMilestone = new HashMap<>();
    private final Map<String, List<String>> taskIdsByWorkstream = new HashMap<>();
    private final Map<String, String> milestoneNames;
    private final Map<String, String> workstreamNames;
    private final Map<String, Rollup> milestoneRollups = new LinkedHashMap<>();
    private final Map<String, Rollup> workstreamRollups = new LinkedHashMap<>();

    /**
     * @param allTasks        every task of the scope, with statuses already overlaid
     * @param trackedTasks    tasks in the dispatch queue; their containers are tracked
     * @param milestoneNames  display names by milestone id
     * @param workstreamNames display names by workstream id
     */
    public RollupAggregator(Collection<Task> allTasks, Collection<Task> trackedTasks,
                            Map<String, String> milestoneNames, Map<String, String> workstreamNames) {
        this.milestoneNames = milestoneNames == null ? Map.of() : Map.copyOf(milestoneNames);
        this.workstreamNames = workstreamNames == null ? Map.of() : Map.copyOf(workstreamNames);

        for (Task task : allTasks) {
            statusByTaskId.put(task.id(), task.status() == null ? "todo" : task.status());
            if (task.milestoneId() != null) {
                taskIdsByMilestone.computeIfAbsent(task.milestoneId(), k -> new ArrayList<>()).add(task.id());
            }
            if (task.workstreamId() != null) {
                taskIdsByWorkstream.computeIfAbsent(task.workstreamId(), k -> new ArrayList<>()).add(task.id());
            }
        }
        for (Task task : trackedTasks) {
            statusByTaskId.putIfAbsent(task.id(), task.status() == null ? "todo" : task.status());
            if (task.milestoneId() != null && !milestoneRollups.containsKey(task.milestoneId())) {
                milestoneRollups.put(task.milestoneId(), compute(RollupLevel.MILESTONE, task.milestoneId()));
            }
            if (task.workstreamId() != null && !workstreamRollups.containsKey(task.workstreamId())) {
                workstreamRollups.put(task.workstreamId(), compute(RollupLevel.WORKSTREAM, task.workstreamId()));
            }
        }
    }

    public void setStatus(String taskId, String rawStatus) {
        statusByTaskId.put(taskId, rawStatus);
    }

    public String statusOf(String taskId) {
        return statusByTaskId.get(taskId);
    }

    /**
     * Recomputes the parent milestone and workstream of {@code task} and hands each changed
     * rollup to {@code sink}. A rollup is recorded as propagated only when the sink returns
     * normally.
     *
     * @return the changes the sink accepted
     */
    public List<RollupChange> sync(Task task, int attempt, RollupSink sink) {
        List<RollupChange> accepted = new ArrayList<>(2);
        syncOne(RollupLevel.MILESTONE, task.milestoneId(), milestoneRollups, milestoneNames,
                task.id(), attempt, sink, accepted);
        syncOne(RollupLevel.WORKSTREAM, task.workstreamId(), workstreamRollups, workstreamNames,
                task.id(), attempt, sink, accepted);
        return accepted;
    }

    private void syncOne(RollupLevel level, String entityId, Map<String, Rollup> lastPropagated,
                         Map<String, String> names, String triggerTaskId, int attempt,
                         RollupSink sink, List<RollupChange> accepted) {
        if (entityId == null || !lastPropagated.containsKey(entityId)) {
            return;
        }
        Rollup previous = lastPropagated.get(entityId);
        Rollup next = compute(level, entityId);
        if (!next.differsFrom(previous)) {
            return;
        }
        RollupChange change = new RollupChange(entityId, names.getOrDefault(entityId, entityId),
                previous, next, triggerTaskId, attempt);
        try {
            sink.propagate(change);
            lastPropagated.put(entityId, next);
            accepted.add(change);
        } catch (RuntimeException e) {
            log.warn("{} rollup update failed ({}): {}", level.wireName(), entityId, e.getMessage());
        }
    }

    private Rollup compute(RollupLevel level, String entityId) {
        Map<String, List<String>> members = level == RollupLevel.MILESTONE ? taskIdsByMilestone : taskIdsByWorkstream;
        List<String> statuses = new ArrayList<>();
        for (String taskId : members.getOrDefault(entityId, List.of())) {
            statuses.add(statusByTaskId.get(taskId));
        }
        return Rollup.compute(level, statuses);
    }

    /** Last propagated milestone rollups by id. */
    public Map<String, Rollup> milestoneRollups() {
        return Collections.unmodifiableMap(milestoneRollups);
    }

    /** Last propagated workstream rollups by id. */
    public Map<String, Rollup> workstreamRollups() {
        return Collections.unmodifiableMap(workstreamRollups);
    }
}
