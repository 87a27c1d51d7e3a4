package com.taskrunner.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for taskrunner.
 */
@Command(
        name = "taskrunner",
        mixinStandardHelpOptions = true,
        version = "taskrunner 0.1.0",
        description = "Durable orchestration of coding-agent tasks on remote nodes",
        subcommands = {
                SubmitCommand.class,
                StatusCommand.class,
                ListCommand.class,
                CancelCommand.class,
                RetryCommand.class,
                NodesCommand.class,
                RecoverCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class TaskRunnerCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
