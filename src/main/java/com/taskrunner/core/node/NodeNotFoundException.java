package com.taskrunner.core.node;

public class NodeNotFoundException extends RuntimeException {

    public NodeNotFoundException(String nodeId) {
        super("Node not found: " + nodeId);
    }
}
