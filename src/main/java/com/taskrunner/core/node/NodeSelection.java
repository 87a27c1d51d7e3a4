package com.taskrunner.core.node;

import com.taskrunner.core.model.Node;

/**
 * Result of one {@link NodeSelector} pass.
 *
 * @param node the claimed or reused node; {@code null} for every provisioning or limit outcome
 */
public record NodeSelection(Outcome outcome, Node node) {

    public enum Outcome {
        CLAIMED_WARM,
        REUSED_RUNNING,
        /** The user has no warm or running node at all. */
        PROVISION_NO_CANDIDATES,
        /** Running nodes exist but every one is unhealthy, full or overloaded. */
        PROVISION_ALL_AT_CAPACITY,
        NODE_LIMIT_REACHED
    }

    public static NodeSelection of(Outcome outcome) {
        return new NodeSelection(outcome, null);
    }

    public boolean hasNode() {
        return node != null;
    }

    public boolean requiresProvisioning() {
        return outcome == Outcome.PROVISION_NO_CANDIDATES || outcome == Outcome.PROVISION_ALL_AT_CAPACITY;
    }
}
