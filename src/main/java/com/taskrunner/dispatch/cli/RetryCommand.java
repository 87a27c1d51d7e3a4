package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.Task;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "retry", mixinStandardHelpOptions = true, description = "Retry a failed or cancelled task")
@Component
public class RetryCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskOrchestrator orchestrator;

    public RetryCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        try {
            Task task = orchestrator.retry(taskId);
            ConsoleOutput.success("Task " + task.id() + " queued again");
            return 0;
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
