package com.taskpilot.dispatch.cli;

import com.taskpilot.core.events.DispatchEvent;
import com.taskpilot.core.scheduler.JobOutcome;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for the Taskpilot CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) TASKPILOT v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [TASKPILOT]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    /**
     * One line per dispatch event, used as the live view of a running job.
     */
    public static void event(DispatchEvent event) {
        String prefix = switch (event.eventType()) {
            case DispatchEvent.JOB_STARTED -> "@|fg(cyan) [JOB]|@";
            case DispatchEvent.TASK_DISPATCHED -> "@|fg(blue) [DISPATCH]|@";
            case DispatchEvent.TASK_SUCCEEDED -> "@|fg(green) [DONE]|@";
            case DispatchEvent.TASK_RETRY_SCHEDULED -> "@|fg(yellow) [RETRY]|@";
            case DispatchEvent.TASK_BLOCKED -> "@|fg(red),bold [BLOCKED]|@";
            case DispatchEvent.WORKER_KILLED -> "@|fg(magenta) [WATCHDOG]|@";
            case DispatchEvent.JOB_THROTTLED -> "@|fg(yellow) [THROTTLE]|@";
            case DispatchEvent.JOB_HEARTBEAT -> "@|faint [HEARTBEAT]|@";
            case DispatchEvent.JOB_COMPLETED -> "@|bold [COMPLETE]|@";
            case DispatchEvent.JOB_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        StringBuilder line = new StringBuilder(prefix);
        if (event.taskId() != null) {
            line.append(' ').append(event.taskId());
        }
        line.append(' ').append(describe(event.payload()));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(line.toString()));
    }

    public static void outcome(JobOutcome outcome) {
        System.out.println("──────────────────────────────────");
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold Job " + outcome.jobId() + "|@"));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  Tasks: @|fg(green) " + outcome.completed() + " done|@ of " + outcome.totalTasks()
                        + (outcome.blocked() > 0 ? ", @|fg(red) " + outcome.blocked() + " blocked|@" : "")));
        System.out.println("  State: " + outcome.stateFile());
        if (outcome.runId() != null) {
            System.out.println("  Run:   " + outcome.runId());
        }
        if (outcome.blocked() > 0) {
            warn("Finished with blockers (" + outcome.result().wireName() + ")");
        } else {
            success("Finished (" + outcome.result().wireName() + ")");
        }
    }

    private static String describe(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        payload.forEach((key, value) -> {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(key).append('=').append(value);
        });
        return sb.toString();
    }
}
