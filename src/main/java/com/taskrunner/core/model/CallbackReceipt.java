package com.taskrunner.core.model;

import java.time.Instant;

public record CallbackReceipt(
        long id,
        String taskId,
        String workspaceId,
        CallbackKind kind,
        CallbackDisposition disposition,
        String detail,
        Instant receivedAt
) {}
