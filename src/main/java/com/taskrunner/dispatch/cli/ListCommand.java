package com.taskrunner.dispatch.cli;

import com.taskrunner.core.orchestrator.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "list", mixinStandardHelpOptions = true, description = "List a user's tasks")
@Component
public class ListCommand implements Runnable {

    @Option(names = {"--user", "-u"}, required = true, description = "Owner of the tasks")
    private String userId;

    private final TaskOrchestrator orchestrator;

    public ListCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var tasks = orchestrator.listTasks(userId);
        if (tasks.isEmpty()) {
            ConsoleOutput.info("No tasks for " + userId);
            return;
        }
        ConsoleOutput.taskHeader();
        tasks.forEach(ConsoleOutput::taskRow);
    }
}
