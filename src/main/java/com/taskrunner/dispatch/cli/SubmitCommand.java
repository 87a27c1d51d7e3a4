package com.taskrunner.dispatch.cli;

import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskRequest;
import com.taskrunner.core.orchestrator.TaskOrchestrator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: taskrunner submit --user &lt;id&gt; --repo &lt;url&gt; &lt;prompt&gt;
 * <p>
 * Creates the task and arms its first continuation. A running server picks it up.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a task")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Instructions for the coding agent")
    private String prompt;

    @Option(names = {"--user", "-u"}, required = true, description = "Owner of the task")
    private String userId;

    @Option(names = {"--repo", "-r"}, required = true, description = "Repository to work on")
    private String repository;

    @Option(names = {"--title", "-t"}, description = "Short title")
    private String title;

    @Option(names = {"--branch", "-b"}, description = "Base branch (default: main)")
    private String branch;

    @Option(names = "--size", description = "Node size: ${COMPLETION-CANDIDATES}")
    private NodeSize size;

    @Option(names = "--location", description = "Node location (default: nbg1)")
    private String location;

    @Option(names = "--node", description = "Run on this node")
    private String preferredNodeId;

    @Option(names = "--priority", defaultValue = "0", description = "Priority (default: ${DEFAULT-VALUE})")
    private int priority;

    @Option(names = "--depends-on", split = ",", description = "Ids of tasks that must complete first")
    private List<String> dependsOn = new ArrayList<>();

    @Option(names = "--draft", description = "Create as a draft")
    private boolean draft;

    private final TaskOrchestrator orchestrator;

    public SubmitCommand(TaskOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        try {
            Task task = orchestrator.submit(new TaskRequest(userId, title, prompt, repository, branch, size,
                    location, preferredNodeId, priority, dependsOn, draft));
            ConsoleOutput.success("Task " + task.id() + " submitted");
            ConsoleOutput.taskStatus(task.status());
            return 0;
        } catch (RuntimeException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
