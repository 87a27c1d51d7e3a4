package com.taskrunner.core.model;

import java.time.Instant;

/**
 * Append-only audit entry written with every status change.
 *
 * @param fromStatus {@code null} for the creation event
 */
public record TaskStatusEvent(
        long id,
        String taskId,
        TaskStatus fromStatus,
        TaskStatus toStatus,
        String actor,
        String reason,
        Instant createdAt
) {}
