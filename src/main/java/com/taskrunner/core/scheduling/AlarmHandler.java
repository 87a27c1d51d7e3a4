package com.taskrunner.core.scheduling;

/**
 * Receives alarm firings for one {@link OwnerType}. Always invoked inside the
 * owner's serial unit, so implementations need no locking of their own.
 */
@FunctionalInterface
public interface AlarmHandler {

    void onAlarm(AlarmKey key);
}
