package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.Task;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "cancel", mixinStandardHelpOptions = true, description = "Cancel a task")
@Component
public class CancelCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskOrchestrator orchestrator;

    public CancelCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        try {
            Task task = orchestrator.cancel(taskId);
            ConsoleOutput.success("Task " + task.id() + " cancelled");
            return 0;
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
