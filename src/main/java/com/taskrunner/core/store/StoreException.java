package com.taskrunner.core.store;

/**
 * Unchecked wrapper for a failed database operation.
 */
public class StoreException extends RuntimeException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
