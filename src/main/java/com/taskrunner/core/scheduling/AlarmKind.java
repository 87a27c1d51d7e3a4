package com.taskrunner.core.scheduling;

public enum AlarmKind {
    /** Re-invoke the task's step dispatcher. */
    CONTINUE(OwnerType.TASK),
    /** Re-check a readiness callback that arrived before its step. */
    CALLBACK_RECHECK(OwnerType.TASK),
    /** Destroy a node that stayed warm for too long. */
    WARM_TIMEOUT(OwnerType.NODE),
    /** Destroy a node that outlived its absolute lifetime. */
    MAX_LIFETIME(OwnerType.NODE),
    /** Retry a teardown that failed. */
    DESTROY_RETRY(OwnerType.NODE);

    private final OwnerType ownerType;

    AlarmKind(OwnerType ownerType) {
        this.ownerType = ownerType;
    }

    public OwnerType ownerType() {
        return ownerType;
    }
}
