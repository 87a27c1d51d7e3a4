package com.taskrunner.core.store;

import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.CallbackKind;
import com.taskrunner.core.model.CallbackReceipt;
import com.taskrunner.core.model.RunnerState;
import com.taskrunner.support.MutableClock;
import com.taskrunner.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunnerStateStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private RunnerStateStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new RunnerStateStore(TestDatabase.create(), clock);
        store.createTables();
    }

    @Test
    @DisplayName("save inserts the first time and updates afterwards")
    void saveUpserts() {
        store.save(RunnerState.initial("t-1", clock.instant()));
        store.save(RunnerState.initial("t-1", clock.instant()).withRetry(2)
                .withPendingSignal(CallbackKind.WORKSPACE_READY, "ws-1", null, clock.instant()));

        RunnerState state = store.find("t-1").orElseThrow();
        assertEquals(2, state.retryCount());
        assertEquals(CallbackKind.WORKSPACE_READY, state.pendingSignal());
        assertEquals("ws-1", state.pendingWorkspaceId());
        assertEquals(clock.instant(), state.pendingSince());
    }

    @Test
    @DisplayName("clearing the pending signal persists nulls")
    void clearPendingSignal() {
        RunnerState pending = RunnerState.initial("t-1", clock.instant())
                .withPendingSignal(CallbackKind.PROVISIONING_FAILED, "ws-1", "disk full", clock.instant());
        store.save(pending);
        store.save(pending.withoutPendingSignal());

        assertFalse(store.find("t-1").orElseThrow().hasPendingSignal());
        store.delete("t-1");
        assertTrue(store.find("t-1").isEmpty());
    }

    @Test
    @DisplayName("callback receipts are listed in arrival order")
    void callbackReceipts() {
        store.recordCallback("t-1", "ws-1", CallbackKind.WORKSPACE_READY, CallbackDisposition.DEFERRED, null);
        store.recordCallback("t-1", "ws-1", CallbackKind.WORKSPACE_READY, CallbackDisposition.ACCEPTED, null);
        store.recordCallback("t-2", "ws-2", CallbackKind.AGENT_FAILED, CallbackDisposition.DISCARDED, "oops");

        List<CallbackReceipt> receipts = store.findCallbacks("t-1");
        assertEquals(List.of(CallbackDisposition.DEFERRED, CallbackDisposition.ACCEPTED),
                receipts.stream().map(CallbackReceipt::disposition).toList());
        assertEquals(clock.instant(), receipts.get(0).receivedAt());
    }
}
