package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatusEvent;
import com.taskrunner.core.orchestrator.TaskNotFoundException;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: taskrunner status &lt;task-id&gt;
 * <p>
 * Shows the task, where it is in its execution, and its status history.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show task status")
@Component
public class StatusCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Task ID")
    private String taskId;

    private final TaskOrchestrator orchestrator;

    public StatusCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Task task;
        try {
            task = orchestrator.getTask(taskId);
        } catch (TaskNotFoundException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("TASK " + task.id());
        System.out.println("Title: " + ConsoleOutput.truncate(task.title(), 60));
        System.out.println("Repository: " + task.repository() + " (" + task.branch() + ")");
        ConsoleOutput.taskStatus(task.status());
        ConsoleOutput.info("Step: " + task.executionStep().wireName()
                + " (" + task.executionStep().description() + ")");
        if (task.nodeId() != null) {
            ConsoleOutput.info("Node: " + task.nodeId());
        }
        if (task.workspaceId() != null) {
            ConsoleOutput.info("Workspace: " + task.workspaceId());
        }
        if (task.outputPrUrl() != null) {
            ConsoleOutput.success("Pull request: " + task.outputPrUrl());
        }
        if (task.errorMessage() != null) {
            ConsoleOutput.error("Error: " + task.errorMessage());
        }

        var events = orchestrator.getEvents(taskId);
        if (!events.isEmpty()) {
            System.out.println();
            System.out.printf("  %-24s %-24s %-18s %s%n", "AT", "TRANSITION", "ACTOR", "REASON");
            System.out.println("  " + "-".repeat(90));
            for (TaskStatusEvent event : events) {
                String from = event.fromStatus() == null ? "" : event.fromStatus().wireName() + " -> ";
                System.out.printf("  %-24s %-24s %-18s %s%n", event.createdAt(),
                        from + event.toStatus().wireName(), event.actor(),
                        ConsoleOutput.truncate(event.reason(), 40));
            }
        }
        return 0;
    }
}
