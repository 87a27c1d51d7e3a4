package com.taskrunner.core.recovery;

import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.RecoveryRecord;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.TaskStatusEvent;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.core.store.TaskStore;
import com.taskrunner.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class RecoverySweeperTest {

    private static final String USER = "alice";

    private final EngineFixture engine = new EngineFixture();

    private Task waitingForWorkspace() {
        Task task = engine.submit(USER);
        engine.drainAlarms();
        return engine.task(task.id());
    }

    @Test
    @DisplayName("tasks within their threshold are left alone")
    void withinThreshold() {
        waitingForWorkspace();
        engine.clock.advance(Duration.ofMinutes(5));

        assertTrue(engine.recoverySweeper.sweep().isEmpty());
    }

    @Nested
    @DisplayName("a task stuck waiting for its workspace")
    class StuckDelegated {

        @Test
        @DisplayName("is failed with a message naming its step and its resources")
        void failedWithDiagnostics() {
            Task task = waitingForWorkspace();
            engine.clock.advance(Duration.ofMinutes(6));

            List<RecoveryRecord> records = engine.recoverySweeper.sweep();

            assertEquals(1, records.size());
            RecoveryRecord record = records.get(0);
            assertEquals(RecoveryRecord.Outcome.FAILED, record.outcome());
            assertEquals(TaskStatus.DELEGATED, record.taskStatus());
            assertEquals(ExecutionStep.WORKSPACE_READY, record.executionStep());
            assertEquals(WorkspaceStatus.CREATING, record.workspaceStatus());
            assertEquals(NodeStatus.RUNNING, record.nodeStatus());
            assertTrue(record.reason().contains("'delegated' for 360s (threshold: 300s)"));
            assertTrue(record.reason().contains("workspace_ready"));
            assertTrue(record.reason().contains("creating"));

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals(record.reason(), failed.errorMessage());
            TaskStatusEvent last = engine.taskStore.findEvents(task.id()).get(2);
            assertEquals(RecoverySweeper.ACTOR, last.actor());
        }

        @Test
        @DisplayName("has its workspace stopped, its node returned and its alarms cleared")
        void cleansUp() {
            Task task = waitingForWorkspace();
            engine.clock.advance(Duration.ofMinutes(6));

            engine.recoverySweeper.sweep();

            assertEquals(WorkspaceStatus.STOPPED, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());
            assertEquals(NodeStatus.WARM, engine.node(task.nodeId()).status());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(task.id(), AlarmKind.CONTINUE)).isEmpty());
            assertEquals(1, engine.counter("taskrunner.recovery.actions", "outcome", "failed"));
        }

        @Test
        @DisplayName("is persisted as a recovery record")
        void persisted() {
            Task task = waitingForWorkspace();
            engine.clock.advance(Duration.ofMinutes(6));

            RecoveryRecord record = engine.recoverySweeper.sweep().get(0);

            assertEquals(List.of(record.id()),
                    engine.recoveryRecords.findByTask(task.id()).stream().map(RecoveryRecord::id).toList());
            assertEquals(USER, engine.recoveryRecords.findRecent(10).get(0).details().get("userId"));
        }
    }

    @Test
    @DisplayName("a sweep that loses the race to the orchestrator only records the attempt")
    void raceLost() {
        Task task = waitingForWorkspace();
        engine.clock.advance(Duration.ofMinutes(6));
        TaskStore racing = spy(engine.taskStore);
        doReturn(false).when(racing).finish(eq(task.id()), any(), eq(TaskStatus.FAILED), anyString(), any(), any(),
                anyString(), anyString());
        RecoverySweeper sweeper = new RecoverySweeper(racing, engine.workspaceStore, engine.nodeStore,
                engine.runnerStates, engine.recoveryRecords, engine.cleanupService, engine.alarms, engine.metrics,
                engine.clock, engine.properties);

        List<RecoveryRecord> records = sweeper.sweep();

        assertEquals(RecoveryRecord.Outcome.SKIPPED_OPTIMISTIC_LOCK, records.get(0).outcome());
        assertEquals(RecoveryRecord.Outcome.SKIPPED_OPTIMISTIC_LOCK,
                engine.recoveryRecords.findByTask(task.id()).get(0).outcome());
        assertEquals(TaskStatus.DELEGATED, engine.task(task.id()).status());
        assertEquals(WorkspaceStatus.CREATING, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());
        assertEquals(1, engine.counter("taskrunner.races.lost", "writer", "sweeper"));
    }

    @Test
    @DisplayName("a queued task that never got past node selection is failed after the queued threshold")
    void stuckQueued() {
        Task task = engine.submit(USER);
        engine.clock.advance(Duration.ofMinutes(6));

        RecoveryRecord record = engine.recoverySweeper.sweep().get(0);

        assertTrue(record.reason().contains("Last step: node_selection (selecting a node)"));
        assertNull(record.nodeId());
        assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
    }

    @Test
    @DisplayName("running tasks get the longer in-progress threshold")
    void inProgressThreshold() {
        Task task = waitingForWorkspace();
        engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());
        engine.drainAlarms();

        engine.clock.advance(Duration.ofHours(1));
        assertTrue(engine.recoverySweeper.sweep().isEmpty());

        engine.clock.advance(Duration.ofHours(1).plusSeconds(1));
        assertEquals(1, engine.recoverySweeper.sweep().size());
        assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
    }

    @Test
    @DisplayName("drafts and finished tasks are never swept")
    void onlyActiveStatuses() {
        assertThrows(IllegalArgumentException.class, () -> engine.recoverySweeper.thresholdFor(TaskStatus.DRAFT));
        assertEquals(Duration.ofHours(2), engine.recoverySweeper.thresholdFor(TaskStatus.IN_PROGRESS));
    }

    @Test
    @DisplayName("the continuation of a recovered task does nothing")
    void continuationAfterRecovery() {
        Task task = waitingForWorkspace();
        engine.clock.advance(Duration.ofMinutes(6));
        engine.recoverySweeper.sweep();

        engine.advance(Duration.ofMinutes(1));

        assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
        assertEquals(3, engine.taskStore.findEvents(task.id()).size());
    }
}
