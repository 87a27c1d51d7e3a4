package com.taskrunner.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Status of a {@link Workspace} on a node. */
public enum WorkspaceStatus {
    CREATING,
    RUNNING,
    ERROR,
    STOPPED;

    /** Whether the workspace still occupies its node. */
    public boolean isActive() {
        return this == CREATING || this == RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkspaceStatus fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
