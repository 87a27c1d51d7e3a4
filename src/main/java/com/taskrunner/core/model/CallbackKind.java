package com.taskrunner.core.model;

/**
 * Kinds of inbound calls the remote execution agent makes about a workspace.
 */
public enum CallbackKind {
    WORKSPACE_READY,
    PROVISIONING_FAILED,
    AGENT_AWAITING_FOLLOWUP,
    AGENT_COMPLETED,
    AGENT_FAILED;

    /** Readiness callbacks are validated against the {@code workspace_ready} step. */
    public boolean isReadinessSignal() {
        return this == WORKSPACE_READY || this == PROVISIONING_FAILED;
    }
}
