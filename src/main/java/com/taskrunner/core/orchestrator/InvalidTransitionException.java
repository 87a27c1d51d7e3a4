package com.taskrunner.core.orchestrator;

import com.taskrunner.core.model.TaskStatus;

/**
 * Thrown when a user command asks for a status change the task's current status does not allow.
 */
public class InvalidTransitionException extends RuntimeException {

    private final TaskStatus currentStatus;

    public InvalidTransitionException(String message, TaskStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }
}
