package com.taskrunner.core.model;

/**
 * What the owning unit did with an inbound callback.
 */
public enum CallbackDisposition {
    /** Matched the awaited step and was acted upon. */
    ACCEPTED,
    /** Arrived before the awaited step was reached; parked for a grace period. */
    DEFERRED,
    /** Replay of a callback for a step already passed. */
    DUPLICATE,
    /** Still premature when the grace period ran out. */
    DISCARDED,
    /** The task was already terminal. */
    IGNORED_TERMINAL,
    /** Refers to a workspace that is no longer the task's current one. */
    IGNORED_STALE
}
