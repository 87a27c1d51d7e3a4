package com.taskrunner.core.orchestrator;

/**
 * Unrecoverable failure of the current step. The message becomes the task's error message.
 */
class StepFailedException extends RuntimeException {

    StepFailedException(String message) {
        super(message);
    }
}
