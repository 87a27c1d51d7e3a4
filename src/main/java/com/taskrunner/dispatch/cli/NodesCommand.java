package com.taskrunner.dispatch.cli;

import com.taskrunner.core.store.NodeStore;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "nodes", mixinStandardHelpOptions = true, description = "List a user's nodes")
@Component
public class NodesCommand implements Runnable {

    @Option(names = {"--user", "-u"}, required = true, description = "Owner of the nodes")
    private String userId;

    private final NodeStore nodeStore;

    public NodesCommand(NodeStore nodeStore) {
        this.nodeStore = nodeStore;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        var nodes = nodeStore.findByUser(userId);
        if (nodes.isEmpty()) {
            ConsoleOutput.info("No nodes for " + userId);
            return;
        }
        ConsoleOutput.nodeHeader();
        nodes.forEach(ConsoleOutput::nodeRow);
    }
}
