package com.taskrunner.remote;

import com.taskrunner.core.model.Node;

/**
 * Client for the remote execution agent that runs on every node.
 * Workspace and session creation are asynchronous on the agent side: a successful
 * return only means the request was accepted.
 */
public interface NodeAgentClient {

    /** Health probe. Never throws; any failure reads as unreachable. */
    boolean reachable(Node node);

    void createWorkspace(Node node, WorkspaceRequest request);

    /**
     * Starts the coding agent inside a workspace. {@code sessionId} doubles as the
     * idempotency key so a retried call never starts a second session.
     */
    void createAgentSession(Node node, String workspaceId, String sessionId, String prompt);

    void stopWorkspace(Node node, String workspaceId);

    /**
     * @param callbackToken credential the agent presents on readiness and status callbacks
     * @param callbackUrl   base URL of this engine's callback endpoints
     */
    record WorkspaceRequest(
            String workspaceId,
            String taskId,
            String repository,
            String branch,
            String outputBranch,
            String callbackToken,
            String callbackUrl
    ) {}
}
