package com.taskrunner.core.model;

import java.time.Instant;

/**
 * Durable scratch state of the orchestrator unit for one task: how long the current
 * step has been running, how many transient retries it has used, and a readiness
 * callback parked because it arrived before its step.
 */
public record RunnerState(
        String taskId,
        int retryCount,
        Instant stepStartedAt,
        CallbackKind pendingSignal,
        String pendingWorkspaceId,
        String pendingDetail,
        Instant pendingSince
) {
    public static RunnerState initial(String taskId, Instant now) {
        return new RunnerState(taskId, 0, now, null, null, null, null);
    }

    public boolean hasPendingSignal() {
        return pendingSignal != null;
    }

    public RunnerState stepStarted(Instant now) {
        return new RunnerState(taskId, 0, now, pendingSignal, pendingWorkspaceId, pendingDetail, pendingSince);
    }

    public RunnerState withRetry(int retryCount) {
        return new RunnerState(taskId, retryCount, stepStartedAt, pendingSignal, pendingWorkspaceId,
                pendingDetail, pendingSince);
    }

    public RunnerState withPendingSignal(CallbackKind kind, String workspaceId, String detail, Instant now) {
        return new RunnerState(taskId, retryCount, stepStartedAt, kind, workspaceId, detail, now);
    }

    public RunnerState withoutPendingSignal() {
        return new RunnerState(taskId, retryCount, stepStartedAt, null, null, null, null);
    }
}
