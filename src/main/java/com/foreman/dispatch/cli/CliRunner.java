package com.foreman.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    private final ForemanCommand foremanCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(ForemanCommand foremanCommand, IFactory factory) {
        this.foremanCommand = foremanCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        // Spring property overrides (--foreman.workspace-dir=...) are consumed by Boot, not picocli
        String[] commandArgs = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--foreman.") && !arg.startsWith("--spring."))
                .toArray(String[]::new);
        exitCode = commandLine(foremanCommand, factory).execute(commandArgs);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Builds the command line with case-insensitive enum options and exceptions
     * mapped to {@link ExitCodes}.
     */
    static CommandLine commandLine(ForemanCommand root, IFactory factory) {
        return new CommandLine(root, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    log.debug("Command '{}' failed", cmd.getCommandName(), ex);
                    ConsoleOutput.error(ex.getMessage() != null ? ex.getMessage() : ex.toString());
                    return ExitCodes.of(ex);
                });
    }
}
