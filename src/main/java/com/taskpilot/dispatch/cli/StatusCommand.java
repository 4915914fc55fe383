package com.taskpilot.dispatch.cli;

import com.taskpilot.core.persistence.JobResult;
import com.taskpilot.core.persistence.JobState;
import com.taskpilot.core.persistence.JobStateStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * CLI command: taskpilot status &lt;state-file&gt;
 * <p>
 * Prints a persisted job snapshot: header, result, counts, per-task outcomes and rollups.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show a dispatch job's saved state")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Job state file")
    private Path stateFile;

    private final JobStateStore store;

    public StatusCommand(JobStateStore store) {
        this.store = store;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Optional<JobState> loaded = store.load(stateFile);
        if (loaded.isEmpty()) {
            ConsoleOutput.error("No readable job state at " + stateFile);
            return 1;
        }
        JobState state = loaded.get();

        System.out.println();
        System.out.println("JOB " + state.getJobId());
        System.out.println("Scope: " + state.getScopeId());
        if (state.getPlanPath() != null) {
            System.out.println("Plan: " + state.getPlanPath());
        }
        System.out.println("Started: " + state.getStartedAt() + "  Updated: " + state.getUpdatedAt()
                + (state.getFinishedAt() != null ? "  Finished: " + state.getFinishedAt() : ""));

        JobResult result = state.getResult();
        if (result == JobResult.COMPLETED) {
            ConsoleOutput.success("Result: " + result.wireName());
        } else if (result == JobResult.COMPLETED_WITH_BLOCKERS) {
            ConsoleOutput.warn("Result: " + result.wireName());
        } else if (result == JobResult.FAILED) {
            ConsoleOutput.error("Result: " + result.wireName());
        } else {
            ConsoleOutput.info("Result: " + (result == null ? "unknown" : result.wireName()));
        }
        ConsoleOutput.info(String.format("Tasks: %d total, %d completed, %d blocked, %d skipped",
                state.getTotalTasks(), state.getCompleted(), state.getFailed(), state.getSkipped()));

        if (!state.getTaskStates().isEmpty()) {
            System.out.println();
            System.out.println("TASKS:");
            for (Map.Entry<String, JobState.TaskRecord> entry : state.getTaskStates().entrySet()) {
                JobState.TaskRecord record = entry.getValue();
                System.out.printf("  %-24s %-14s attempts=%d%s%s%n", entry.getKey(), record.status(), record.attempts(),
                        record.exitCode() != null ? " exit=" + record.exitCode() : "",
                        record.reason() != null ? " " + record.reason() : "");
            }
        }

        if (!state.getActiveWorkers().isEmpty()) {
            System.out.println();
            System.out.println("ACTIVE WORKERS:");
            state.getActiveWorkers().forEach((taskId, worker) ->
                    System.out.printf("  %-24s pid=%d attempt=%d since %s%n", taskId, worker.pid(),
                            worker.attempt(), worker.startedAt()));
        }

        printRollups("MILESTONES:", state.getRollups().getMilestones());
        printRollups("WORKSTREAMS:", state.getRollups().getWorkstreams());
        return 0;
    }

    private static void printRollups(String heading, Map<String, JobState.RollupSnapshot> rollups) {
        if (rollups == null || rollups.isEmpty()) {
            return;
        }
        System.out.println();
        System.out.println(heading);
        rollups.forEach((id, r) -> System.out.printf("  %-24s %-12s %3d%% (%d/%d done, %d blocked, %d active)%n",
                id, r.status(), r.progressPct(), r.done(), r.total(), r.blocked(), r.active()));
    }
}
