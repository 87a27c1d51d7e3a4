package com.taskrunner.core.model;

import java.time.Instant;

public record Workspace(
        String id,
        String nodeId,
        String userId,
        String taskId,
        WorkspaceStatus status,
        String chatSessionId,
        String errorMessage,
        Instant createdAt,
        Instant updatedAt
) {}
