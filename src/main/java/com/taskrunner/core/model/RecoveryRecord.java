package com.taskrunner.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Diagnostic snapshot persisted by the recovery sweeper for every stuck task it acts on.
 */
public record RecoveryRecord(
        String id,
        String taskId,
        TaskStatus taskStatus,
        ExecutionStep executionStep,
        Duration elapsed,
        Duration threshold,
        String reason,
        String workspaceId,
        WorkspaceStatus workspaceStatus,
        String nodeId,
        NodeStatus nodeStatus,
        NodeHealth nodeHealth,
        String autoProvisionedNodeId,
        int retryCount,
        Outcome outcome,
        Map<String, Object> details,
        Instant createdAt
) {
    public enum Outcome { FAILED, SKIPPED_OPTIMISTIC_LOCK, CLEANUP_ERROR }

    public RecoveryRecord withOutcome(Outcome outcome) {
        return new RecoveryRecord(id, taskId, taskStatus, executionStep, elapsed, threshold, reason,
                workspaceId, workspaceStatus, nodeId, nodeStatus, nodeHealth, autoProvisionedNodeId,
                retryCount, outcome, details, createdAt);
    }
}
