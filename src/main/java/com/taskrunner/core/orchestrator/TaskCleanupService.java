package com.taskrunner.core.orchestrator;

import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.core.node.NodeLifecycleConflictException;
import com.taskrunner.core.node.NodeLifecycleManager;
import com.taskrunner.core.retry.RetryPolicy;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.WorkspaceStore;
import com.taskrunner.remote.NodeAgentClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;

/**
 * Releases what a finished task was holding: its workspace and, for engine-provisioned
 * nodes, the node itself.
 * <p>
 * Safe to run any number of times for the same task, from the orchestrator's failure path
 * and from the recovery sweeper alike. The workspace is claimed with a conditional status
 * update, and only the caller that wins it talks to the node agent.
 */
@Service
public class TaskCleanupService {

    private static final Logger log = LoggerFactory.getLogger(TaskCleanupService.class);

    private static final EnumSet<WorkspaceStatus> STOPPABLE = EnumSet.of(
            WorkspaceStatus.CREATING, WorkspaceStatus.RUNNING, WorkspaceStatus.ERROR);

    public enum NodeOutcome { NONE, RETURNED_TO_POOL, STILL_IN_USE, DESTROYED }

    public record CleanupResult(boolean workspaceStopped, NodeOutcome nodeOutcome) {}

    private final WorkspaceStore workspaceStore;
    private final NodeStore nodeStore;
    private final NodeLifecycleManager lifecycle;
    private final NodeAgentClient agentClient;
    private final RetryPolicy retryPolicy;

    public TaskCleanupService(WorkspaceStore workspaceStore, NodeStore nodeStore, NodeLifecycleManager lifecycle,
                              NodeAgentClient agentClient, RetryPolicy retryPolicy) {
        this.workspaceStore = workspaceStore;
        this.nodeStore = nodeStore;
        this.lifecycle = lifecycle;
        this.agentClient = agentClient;
        this.retryPolicy = retryPolicy;
    }

    public CleanupResult cleanup(Task task) {
        Node node = task.nodeId() == null ? null : nodeStore.findById(task.nodeId()).orElse(null);

        boolean workspaceStopped = false;
        if (task.workspaceId() != null
                && workspaceStore.updateStatus(task.workspaceId(), STOPPABLE, WorkspaceStatus.STOPPED, null)) {
            workspaceStopped = true;
            stopRemoteWorkspace(node, task.workspaceId());
        }

        NodeOutcome nodeOutcome = releaseNode(task, node);
        log.info("Cleanup for task {}: workspace {}, node {}", task.id(),
                workspaceStopped ? "stopped" : "untouched", nodeOutcome.name().toLowerCase());
        return new CleanupResult(workspaceStopped, nodeOutcome);
    }

    private void stopRemoteWorkspace(Node node, String workspaceId) {
        if (node == null || node.ipAddress() == null
                || !(node.status() == NodeStatus.RUNNING || node.status() == NodeStatus.WARM)) {
            return;
        }
        try {
            retryPolicy.run("Stop workspace " + workspaceId, () -> agentClient.stopWorkspace(node, workspaceId));
        } catch (RuntimeException e) {
            // the node teardown timers still reclaim the machine
            log.error("Could not stop workspace {} on node {}", workspaceId, node.id(), e);
        }
    }

    private NodeOutcome releaseNode(Task task, Node node) {
        if (node == null) {
            return NodeOutcome.NONE;
        }
        boolean engineOwned = node.autoProvisioned() || node.id().equals(task.autoProvisionedNodeId());
        if (!engineOwned) {
            return NodeOutcome.NONE;
        }
        try {
            return switch (node.status()) {
                case PROVISIONING -> node.id().equals(task.autoProvisionedNodeId())
                        && lifecycle.destroy(node.id(), "task_cleanup")
                        ? NodeOutcome.DESTROYED : NodeOutcome.NONE;
                case RUNNING -> lifecycle.markIdle(node.id())
                        ? NodeOutcome.RETURNED_TO_POOL : NodeOutcome.STILL_IN_USE;
                default -> NodeOutcome.NONE;
            };
        } catch (NodeLifecycleConflictException e) {
            log.debug("Node {} changed state during cleanup: {}", node.id(), e.getMessage());
            return NodeOutcome.NONE;
        }
    }
}
