package com.taskrunner.core.scheduling;

import java.util.Objects;

/**
 * Identifies one alarm slot. Setting an alarm for a key replaces the previous one.
 */
public record AlarmKey(OwnerType ownerType, String ownerId, AlarmKind kind) {

    public AlarmKey {
        Objects.requireNonNull(ownerType, "ownerType must not be null");
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (kind.ownerType() != ownerType) {
            throw new IllegalArgumentException(kind + " alarms belong to " + kind.ownerType() + " owners");
        }
    }

    public static AlarmKey task(String taskId, AlarmKind kind) {
        return new AlarmKey(OwnerType.TASK, taskId, kind);
    }

    public static AlarmKey node(String nodeId, AlarmKind kind) {
        return new AlarmKey(OwnerType.NODE, nodeId, kind);
    }

    public String unitKey() {
        return ownerType.unitKey(ownerId);
    }
}
