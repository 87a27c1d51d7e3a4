package com.taskrunner.core.orchestrator;

import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.TaskStatus;

/**
 * What happened to an inbound callback, together with the task's state afterwards.
 */
public record CallbackResult(
        String taskId,
        CallbackDisposition disposition,
        TaskStatus status,
        ExecutionStep executionStep
) {}
