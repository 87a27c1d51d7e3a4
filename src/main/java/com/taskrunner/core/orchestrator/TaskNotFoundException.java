package com.taskrunner.core.orchestrator;

/**
 * Thrown when a task id (or workspace id) does not resolve to a task.
 */
public class TaskNotFoundException extends RuntimeException {
    public TaskNotFoundException(String message) {
        super(message);
    }
}
