package com.taskrunner.core.node;

import com.taskrunner.core.model.NodeStatus;

/**
 * Thrown when a lifecycle request is not valid for the node's current status,
 * e.g. marking a node idle while it is being destroyed.
 */
public class NodeLifecycleConflictException extends RuntimeException {

    private final String nodeId;
    private final NodeStatus status;

    public NodeLifecycleConflictException(String nodeId, NodeStatus status, String action) {
        super("Cannot " + action + " node " + nodeId + " while it is " + status.wireName());
        this.nodeId = nodeId;
        this.status = status;
    }

    public String getNodeId() {
        return nodeId;
    }

    public NodeStatus getStatus() {
        return status;
    }
}
