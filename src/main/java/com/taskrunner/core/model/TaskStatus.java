package com.taskrunner.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of a {@link Task}.
 * <p>
 * Transitions are restricted to a fixed edge set. The only way out of a terminal
 * status is an explicit retry back to {@link #QUEUED}.
 */
public enum TaskStatus {
    DRAFT,
    QUEUED,
    DELEGATED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus target) {
        return allowedTargets().contains(target);
    }

    public Set<TaskStatus> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(QUEUED, CANCELLED);
            case QUEUED -> EnumSet.of(DELEGATED, FAILED, CANCELLED);
            case DELEGATED -> EnumSet.of(IN_PROGRESS, FAILED, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case FAILED, CANCELLED -> EnumSet.of(QUEUED);
            case COMPLETED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    /** Lower-case name used in the database and on the wire, e.g. {@code in_progress}. */
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskStatus fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public static Set<TaskStatus> active() {
        return EnumSet.of(QUEUED, DELEGATED, IN_PROGRESS);
    }
}
