package com.taskrunner.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered breadcrumb recording the last declared point of progress of a task.
 * <p>
 * Steps advance one at a time. The single permitted skip is
 * {@link #NODE_PROVISIONING}, which is only entered when no existing node could be used.
 */
public enum ExecutionStep {
    NODE_SELECTION(TaskStatus.QUEUED, "selecting a node"),
    NODE_PROVISIONING(TaskStatus.QUEUED, "provisioning a new node"),
    NODE_AGENT_READY(TaskStatus.QUEUED, "waiting for the node agent to become reachable"),
    WORKSPACE_CREATION(TaskStatus.DELEGATED, "creating the workspace"),
    WORKSPACE_READY(TaskStatus.DELEGATED, "waiting for workspace to become ready"),
    AGENT_SESSION(TaskStatus.DELEGATED, "starting the agent session"),
    RUNNING(TaskStatus.IN_PROGRESS, "agent is working"),
    AWAITING_FOLLOWUP(TaskStatus.IN_PROGRESS, "agent finished a turn and awaits follow-up");

    private final TaskStatus boundStatus;
    private final String description;

    ExecutionStep(TaskStatus boundStatus, String description) {
        this.boundStatus = boundStatus;
        this.description = description;
    }

    /** The task status a task must have while sitting on this step. */
    public TaskStatus boundStatus() {
        return boundStatus;
    }

    public String description() {
        return description;
    }

    public boolean canAdvanceTo(ExecutionStep next) {
        if (next.ordinal() == ordinal() + 1) {
            return true;
        }
        return this == NODE_SELECTION && next == NODE_AGENT_READY;
    }

    public boolean isBefore(ExecutionStep other) {
        return ordinal() < other.ordinal();
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStep fromWireName(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
