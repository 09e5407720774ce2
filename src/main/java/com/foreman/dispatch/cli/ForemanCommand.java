package com.foreman.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Foreman.
 * Routes to subcommands: state, tasks, status, circuit-breaker.
 */
@Command(
        name = "foreman",
        mixinStandardHelpOptions = true,
        version = "Foreman 0.1.0",
        description = "Task and session tracking for multi-phase development workflows",
        subcommands = {
                StateCommand.class,
                TasksCommand.class,
                StatusCommand.class,
                CircuitBreakerCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ForemanCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
