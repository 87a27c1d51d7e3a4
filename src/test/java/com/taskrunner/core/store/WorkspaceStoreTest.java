package com.taskrunner.core.store;

import com.taskrunner.core.model.Workspace;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.support.MutableClock;
import com.taskrunner.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceStoreTest {

    private final MutableClock clock = MutableClock.startingAt("2026-03-02T09:00:00Z");
    private WorkspaceStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new WorkspaceStore(TestDatabase.create(), clock);
        store.createTables();
    }

    private void insert(String id, String nodeId, WorkspaceStatus status) {
        var now = clock.instant();
        store.insert(new Workspace(id, nodeId, "alice", "t-" + id, status, null, null, now, now));
    }

    @Test
    @DisplayName("only creating and running workspaces count as active")
    void countActive() {
        insert("ws-1", "n-1", WorkspaceStatus.CREATING);
        insert("ws-2", "n-1", WorkspaceStatus.RUNNING);
        insert("ws-3", "n-1", WorkspaceStatus.ERROR);
        insert("ws-4", "n-1", WorkspaceStatus.STOPPED);
        insert("ws-5", "n-2", WorkspaceStatus.RUNNING);

        assertEquals(2, store.countActiveOnNode("n-1"));
        assertEquals(4, store.findByNode("n-1").size());
    }

    @Test
    @DisplayName("only one of two stoppers wins the conditional update")
    void stopIsClaimedOnce() {
        insert("ws-1", "n-1", WorkspaceStatus.RUNNING);
        var stoppable = EnumSet.of(WorkspaceStatus.CREATING, WorkspaceStatus.RUNNING, WorkspaceStatus.ERROR);

        assertTrue(store.updateStatus("ws-1", stoppable, WorkspaceStatus.STOPPED, null));
        assertFalse(store.updateStatus("ws-1", stoppable, WorkspaceStatus.STOPPED, null));
    }

    @Test
    @DisplayName("error message and chat session are persisted")
    void errorAndSession() {
        insert("ws-1", "n-1", WorkspaceStatus.CREATING);

        store.setChatSession("ws-1", "session-1");
        store.updateStatus("ws-1", EnumSet.of(WorkspaceStatus.CREATING), WorkspaceStatus.ERROR, "clone failed");

        Workspace workspace = store.findById("ws-1").orElseThrow();
        assertEquals(WorkspaceStatus.ERROR, workspace.status());
        assertEquals("clone failed", workspace.errorMessage());
        assertEquals("session-1", workspace.chatSessionId());
    }
}
