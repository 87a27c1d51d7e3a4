package com.taskrunner.core.orchestrator;

/**
 * A conditional update affected zero rows: another writer already moved the task on.
 * The current invocation stops without further side effects.
 */
class RaceLostException extends RuntimeException {

    RaceLostException(String message) {
        super(message);
    }
}
