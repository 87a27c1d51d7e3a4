package com.taskrunner.core.model;

import java.time.Instant;
import java.util.List;

/**
 * A unit of work executed autonomously by a remote coding agent.
 * <p>
 * Mutated only by the orchestrator unit that owns it, or by the recovery sweeper
 * through conditional updates.
 */
public record Task(
        String id,
        String userId,
        String title,
        String prompt,
        String repository,
        String branch,
        NodeSize vmSize,
        String vmLocation,
        String preferredNodeId,
        int priority,
        TaskStatus status,
        ExecutionStep executionStep,
        String nodeId,
        String workspaceId,
        String sessionId,
        String autoProvisionedNodeId,
        String outputBranch,
        String outputPrUrl,
        String errorMessage,
        List<String> dependencies,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant completedAt
) {
    public Task {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Task withDependencies(List<String> dependencies) {
        return new Task(id, userId, title, prompt, repository, branch, vmSize, vmLocation,
                preferredNodeId, priority, status, executionStep, nodeId, workspaceId, sessionId,
                autoProvisionedNodeId, outputBranch, outputPrUrl, errorMessage, dependencies,
                createdAt, updatedAt, startedAt, completedAt);
    }
}
