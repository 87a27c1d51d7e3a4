package com.taskrunner.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

import java.util.Arrays;

/**
 * Runs one taskrunner subcommand per process and hands its exit code to Spring Boot.
 * {@code serve} is left to the embedded web server.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final int EXIT_FAILED = 1;

    private final TaskRunnerCommand taskRunnerCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(TaskRunnerCommand taskRunnerCommand, IFactory factory) {
        this.taskRunnerCommand = taskRunnerCommand;
        this.factory = factory;
    }

    /**
     * The configured command tree. Enum options accept any case, and an exception escaping a
     * subcommand becomes a one-line error with exit code {@value #EXIT_FAILED} instead of a stack trace.
     */
    static CommandLine commandLine(TaskRunnerCommand command, IFactory factory) {
        return new CommandLine(command, factory)
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((e, failed, parseResult) -> {
                    log.debug("Command '{}' failed", failed.getCommandName(), e);
                    ConsoleOutput.error(failed.getCommandName() + " failed: " + e.getMessage());
                    return EXIT_FAILED;
                });
    }

    @Override
    public void run(String... args) {
        if (Arrays.asList(args).contains("serve")) {
            return;
        }
        exitCode = commandLine(taskRunnerCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
