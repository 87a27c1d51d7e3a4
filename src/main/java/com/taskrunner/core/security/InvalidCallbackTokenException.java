package com.taskrunner.core.security;

/**
 * Thrown when a callback or heartbeat credential is missing, invalid, expired, or scoped
 * to a different workspace or node.
 */
public class InvalidCallbackTokenException extends RuntimeException {
    public InvalidCallbackTokenException(String message) {
        super(message);
    }

    public InvalidCallbackTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
