package com.taskpilot.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Taskpilot.
 * Routes to subcommands: run, status.
 */
@Command(
        name = "taskpilot",
        mixinStandardHelpOptions = true,
        version = "Taskpilot 0.1.0",
        description = "Dispatches an initiative's backlog to supervised execution agents",
        subcommands = {
                RunCommand.class,
                StatusCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskpilotCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
