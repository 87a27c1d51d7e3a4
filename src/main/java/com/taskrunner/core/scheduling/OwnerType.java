package com.taskrunner.core.scheduling;

import java.util.Locale;

/** Kind of entity that owns a serial execution unit and its alarms. */
public enum OwnerType {
    TASK,
    NODE;

    /** Mailbox key for one owner, e.g. {@code task:abc}. */
    public String unitKey(String ownerId) {
        return name().toLowerCase(Locale.ROOT) + ":" + ownerId;
    }
}
