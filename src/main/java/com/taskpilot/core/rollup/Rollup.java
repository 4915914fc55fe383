package com.taskpilot.core.rollup;

import com.taskpilot.core.model.TaskState;

import java.util.Collection;

/**
 * Derived progress of a milestone or workstream. Always recomputed from member task
 * statuses, never patched in place.
 */
public record Rollup(
    RollupLevel level,
    int done,
    int blocked,
    int active,
    int todo,
    int total,
    int progressPct,
    String status
) {

    /**
     * Computes the rollup of a set of raw member statuses. The result does not depend on
     * the order of {@code rawStatuses}.
     */
    public static Rollup compute(RollupLevel level, Collection<String> rawStatuses) {
        int done = 0;
        int blocked = 0;
        int active = 0;
        int todo = 0;
        for (String raw : rawStatuses) {
            switch (TaskState.classify(raw)) {
                case DONE -> done++;
                case BLOCKED -> blocked++;
                case ACTIVE -> active++;
                case TODO -> todo++;
            }
        }
        int total = rawStatuses.size();
        return new Rollup(level, done, blocked, active, todo, total, percent(done, total),
                deriveStatus(level, done, blocked, active, total));
    }

    public static int percent(int done, int total) {
        if (total <= 0) {
            return 0;
        }
        long pct = Math.round(done * 100.0 / total);
        return (int) Math.max(0, Math.min(100, pct));
    }

    private static String deriveStatus(RollupLevel level, int done, int blocked, int active, int total) {
        if (total == 0) {
            return level.initialStatus();
        }
        if (done == total) {
            return level.completeStatus();
        }
        if (blocked > 0 && active == 0) {
            return level.atRiskStatus();
        }
        if (active > 0 || done > 0) {
            return level.progressingStatus();
        }
        return level.initialStatus();
    }

    public boolean isComplete() {
        return total > 0 && done == total;
    }

    public boolean isAtRisk() {
        return level.atRiskStatus().equals(status);
    }

    /** True when status, progress or any count differs from {@code previous}. */
    public boolean differsFrom(Rollup previous) {
        if (previous == null) {
            return true;
        }
        return !status.equals(previous.status)
                || progressPct != previous.progressPct
                || done != previous.done
                || blocked != previous.blocked
                || active != previous.active
                || todo != previous.todo
                || total != previous.total;
    }
}
