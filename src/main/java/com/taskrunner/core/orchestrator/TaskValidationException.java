package com.taskrunner.core.orchestrator;

/**
 * Thrown when a submission or command carries invalid input.
 */
public class TaskValidationException extends RuntimeException {
    public TaskValidationException(String message) {
        super(message);
    }
}
