package com.taskrunner.core.node;

/**
 * Thrown when a user already owns the maximum number of nodes and a new one would be needed.
 */
public class NodeLimitExceededException extends RuntimeException {

    private final int limit;

    public NodeLimitExceededException(int limit) {
        super("Maximum " + limit + " nodes allowed. Cannot auto-provision.");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
