package com.taskrunner.remote;

/**
 * Thrown by provisioner and node agent clients.
 * <p>
 * Transient failures (network errors, timeouts, 5xx, 429) are retried with bounded
 * backoff; anything else fails the step straight away.
 */
public class RemoteCallException extends RuntimeException {

    private final boolean transientFailure;
    private final int statusCode;

    public RemoteCallException(String message, boolean transientFailure) {
        this(message, transientFailure, -1, null);
    }

    public RemoteCallException(String message, boolean transientFailure, int statusCode, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.statusCode = statusCode;
    }

    public static RemoteCallException forStatus(String operation, int statusCode, String body) {
        boolean transientFailure = statusCode == 429 || statusCode >= 500;
        return new RemoteCallException(operation + " failed (HTTP " + statusCode + "): " + body,
                transientFailure, statusCode, null);
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
