package com.taskrunner.core.orchestrator;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.graph.DependencyCycleException;
import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.CallbackReceipt;
import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskRequest;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.TaskStatusEvent;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.core.node.NodeLimitExceededException;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.remote.NodeAgentClient;
import com.taskrunner.remote.Provisioner;
import com.taskrunner.remote.RemoteCallException;
import com.taskrunner.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TaskOrchestratorTest {

    private static final String USER = "alice";

    private final EngineFixture engine = new EngineFixture();

    /** Submits a task and drives it until it waits for its workspace to become ready. */
    private Task submitToWorkspaceReady() {
        Task task = engine.submit(USER);
        engine.drainAlarms();
        Task waiting = engine.task(task.id());
        assertEquals(TaskStatus.DELEGATED, waiting.status());
        assertEquals(ExecutionStep.WORKSPACE_READY, waiting.executionStep());
        return waiting;
    }

    private Task submitToRunning() {
        Task task = submitToWorkspaceReady();
        engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());
        engine.drainAlarms();
        return engine.task(task.id());
    }

    private static AgentStatusReport report(String status) {
        return new AgentStatusReport(status, null, null, null);
    }

    private static RemoteCallException transientFailure() {
        return RemoteCallException.forStatus("Create server", 503, "service unavailable");
    }

    @Nested
    @DisplayName("happy path")
    class HappyPath {

        @Test
        @DisplayName("a submitted task is queued at node selection")
        void submitQueues() {
            Task task = engine.submit(USER);

            assertEquals(TaskStatus.QUEUED, task.status());
            assertEquals(ExecutionStep.NODE_SELECTION, task.executionStep());
            assertEquals("main", task.branch());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(task.id(), AlarmKind.CONTINUE)).isPresent());
            assertEquals(1, engine.counter("taskrunner.tasks.submitted", "initial", "queued"));
        }

        @Test
        @DisplayName("without nodes the task provisions one and asks its agent for a workspace")
        void provisionsAndCreatesWorkspace() {
            Task task = submitToWorkspaceReady();

            assertNotNull(task.nodeId());
            assertEquals(task.nodeId(), task.autoProvisionedNodeId());
            assertEquals(NodeStatus.RUNNING, engine.node(task.nodeId()).status());
            assertEquals("task/" + task.id(), task.outputBranch());
            assertEquals(WorkspaceStatus.CREATING, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());

            ArgumentCaptor<NodeAgentClient.WorkspaceRequest> request =
                    ArgumentCaptor.forClass(NodeAgentClient.WorkspaceRequest.class);
            verify(engine.agentClient).createWorkspace(any(), request.capture());
            assertEquals(EngineFixture.REPOSITORY, request.getValue().repository());
            assertEquals("http://localhost:8080/api/v1/callbacks/workspaces/" + task.workspaceId(),
                    request.getValue().callbackUrl());
            assertEquals(task.id(), engine.tokenService.verifyCallback(
                    "Bearer " + request.getValue().callbackToken(), task.workspaceId()));
        }

        @Test
        @DisplayName("readiness starts the agent session and the task runs")
        void readinessStartsSession() {
            Task task = submitToWorkspaceReady();

            CallbackResult result = engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());
            assertEquals(CallbackDisposition.ACCEPTED, result.disposition());
            assertEquals(ExecutionStep.AGENT_SESSION, result.executionStep());

            engine.drainAlarms();

            Task running = engine.task(task.id());
            assertEquals(TaskStatus.IN_PROGRESS, running.status());
            assertEquals(ExecutionStep.RUNNING, running.executionStep());
            assertNotNull(running.sessionId());
            assertNotNull(running.startedAt());
            verify(engine.agentClient).createAgentSession(any(), eq(task.workspaceId()), eq(running.sessionId()),
                    eq("Fix the failing checkout test"));
            assertEquals(WorkspaceStatus.RUNNING, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());
        }

        @Test
        @DisplayName("a completed agent finishes the task and returns the node to the warm pool")
        void completion() {
            Task task = submitToRunning();

            CallbackResult result = engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(),
                    new AgentStatusReport("completed", "task/" + task.id(), "https://github.com/acme/shop/pull/7", null));

            assertEquals(CallbackDisposition.ACCEPTED, result.disposition());
            Task done = engine.task(task.id());
            assertEquals(TaskStatus.COMPLETED, done.status());
            assertEquals("https://github.com/acme/shop/pull/7", done.outputPrUrl());
            assertNotNull(done.completedAt());
            verify(engine.agentClient).stopWorkspace(any(), eq(task.workspaceId()));
            assertEquals(WorkspaceStatus.STOPPED, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());
            assertEquals(NodeStatus.WARM, engine.node(task.nodeId()).status());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.node(task.nodeId(), AlarmKind.WARM_TIMEOUT)).isPresent());

            List<TaskStatus> statuses = engine.orchestrator.getEvents(task.id()).stream()
                    .map(TaskStatusEvent::toStatus).toList();
            assertEquals(List.of(TaskStatus.QUEUED, TaskStatus.DELEGATED, TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED),
                    statuses);
            assertEquals(1, engine.counter("taskrunner.tasks.finished", "status", "completed"));
        }

        @Test
        @DisplayName("a second task reuses the warm node instead of provisioning")
        void warmReuse() {
            Task first = submitToRunning();
            engine.orchestrator.onAgentStatus(first.id(), first.workspaceId(), report("completed"));

            Task second = submitToWorkspaceReady();

            assertEquals(first.nodeId(), second.nodeId());
            assertNull(second.autoProvisionedNodeId());
            verify(engine.provisioner, times(1)).provision(any());
            assertEquals(NodeStatus.RUNNING, engine.node(second.nodeId()).status());
        }

        @Test
        @DisplayName("awaiting follow-up keeps the task running until the user completes it")
        void followUpThenComplete() {
            Task task = submitToRunning();

            CallbackResult first = engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(),
                    new AgentStatusReport("awaiting_followup", "task/" + task.id(), "https://github.com/acme/shop/pull/9", null));
            CallbackResult repeat = engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(),
                    report("awaiting_followup"));

            assertEquals(CallbackDisposition.ACCEPTED, first.disposition());
            assertEquals(CallbackDisposition.DUPLICATE, repeat.disposition());
            Task waiting = engine.task(task.id());
            assertEquals(TaskStatus.IN_PROGRESS, waiting.status());
            assertEquals(ExecutionStep.AWAITING_FOLLOWUP, waiting.executionStep());
            assertEquals("https://github.com/acme/shop/pull/9", waiting.outputPrUrl());

            Task completed = engine.orchestrator.complete(task.id());

            assertEquals(TaskStatus.COMPLETED, completed.status());
            assertEquals("https://github.com/acme/shop/pull/9", completed.outputPrUrl());
            assertEquals("user", engine.orchestrator.getEvents(task.id()).get(3).actor());
        }

        @Test
        @DisplayName("complete is only allowed while the agent awaits follow-up")
        void completeWhileRunning() {
            Task task = submitToRunning();

            assertThrows(InvalidTransitionException.class, () -> engine.orchestrator.complete(task.id()));
        }
    }

    @Nested
    @DisplayName("callbacks")
    class Callbacks {

        @Test
        @DisplayName("a replayed readiness callback is a duplicate")
        void duplicateReadiness() {
            Task task = submitToWorkspaceReady();
            engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());

            CallbackResult replay = engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());

            assertEquals(CallbackDisposition.DUPLICATE, replay.disposition());
            List<CallbackDisposition> dispositions = engine.orchestrator.getCallbacks(task.id()).stream()
                    .map(CallbackReceipt::disposition).toList();
            assertEquals(List.of(CallbackDisposition.ACCEPTED, CallbackDisposition.DUPLICATE), dispositions);
        }

        @Test
        @DisplayName("callbacks for a finished task are ignored")
        void terminalIgnored() {
            Task task = submitToRunning();
            engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(), report("completed"));

            assertEquals(CallbackDisposition.IGNORED_TERMINAL,
                    engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(), report("failed")).disposition());
            assertEquals(CallbackDisposition.IGNORED_TERMINAL,
                    engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId()).disposition());
            assertEquals(TaskStatus.COMPLETED, engine.task(task.id()).status());
        }

        @Test
        @DisplayName("callbacks for a workspace the task no longer uses are stale")
        void staleWorkspace() {
            Task task = submitToWorkspaceReady();

            CallbackResult result = engine.orchestrator.onWorkspaceReady(task.id(), "ws-from-an-earlier-attempt");

            assertEquals(CallbackDisposition.IGNORED_STALE, result.disposition());
            assertEquals(ExecutionStep.WORKSPACE_READY, engine.task(task.id()).executionStep());
        }

        @Test
        @DisplayName("readiness that arrives before its step is deferred and applied once the step is reached")
        void deferredThenApplied() {
            doThrow(RemoteCallException.forStatus("Create workspace", 502, "bad gateway"))
                    .doNothing()
                    .when(engine.agentClient).createWorkspace(any(), any());
            Task task = engine.submit(USER);
            engine.drainAlarms();
            Task early = engine.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_CREATION, early.executionStep());
            assertNotNull(early.workspaceId());

            CallbackResult deferred = engine.orchestrator.onWorkspaceReady(task.id(), early.workspaceId());
            assertEquals(CallbackDisposition.DEFERRED, deferred.disposition());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(task.id(), AlarmKind.CALLBACK_RECHECK)).isPresent());

            engine.advance(Duration.ofSeconds(2));

            Task running = engine.task(task.id());
            assertEquals(TaskStatus.IN_PROGRESS, running.status());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(task.id(), AlarmKind.CALLBACK_RECHECK)).isEmpty());
            assertFalse(engine.runnerStates.find(task.id()).orElseThrow().hasPendingSignal());
            List<CallbackDisposition> dispositions = engine.orchestrator.getCallbacks(task.id()).stream()
                    .map(CallbackReceipt::disposition).toList();
            assertEquals(List.of(CallbackDisposition.DEFERRED, CallbackDisposition.ACCEPTED), dispositions);
        }

        @Test
        @DisplayName("a deferred callback still premature after the grace period is discarded")
        void deferredThenDiscarded() {
            TaskRunnerProperties properties = new TaskRunnerProperties();
            properties.getOrchestrator().setCallbackGracePeriod(Duration.ofSeconds(1));
            EngineFixture shortGrace = new EngineFixture(properties);
            doThrow(RemoteCallException.forStatus("Create workspace", 502, "bad gateway"))
                    .doNothing()
                    .when(shortGrace.agentClient).createWorkspace(any(), any());
            Task task = shortGrace.submit(USER);
            shortGrace.drainAlarms();
            String workspaceId = shortGrace.task(task.id()).workspaceId();
            shortGrace.orchestrator.onWorkspaceReady(task.id(), workspaceId);

            shortGrace.advance(Duration.ofSeconds(1));
            shortGrace.advance(Duration.ofSeconds(1));

            Task waiting = shortGrace.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_READY, waiting.executionStep());
            List<CallbackDisposition> dispositions = shortGrace.orchestrator.getCallbacks(task.id()).stream()
                    .map(CallbackReceipt::disposition).toList();
            assertEquals(List.of(CallbackDisposition.DEFERRED, CallbackDisposition.DISCARDED), dispositions);
        }

        @Test
        @DisplayName("an agent report before the session started is discarded")
        void prematureAgentReport() {
            Task task = submitToWorkspaceReady();

            CallbackResult result = engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(), report("completed"));

            assertEquals(CallbackDisposition.DISCARDED, result.disposition());
            assertEquals(TaskStatus.DELEGATED, engine.task(task.id()).status());
        }

        @Test
        @DisplayName("a provisioning failure fails the task and marks the workspace in error")
        void provisioningFailed() {
            Task task = submitToWorkspaceReady();

            CallbackResult result = engine.orchestrator.onProvisioningFailed(task.id(), task.workspaceId(),
                    "git clone failed: repository not found");

            assertEquals(CallbackDisposition.ACCEPTED, result.disposition());
            assertEquals(TaskStatus.FAILED, result.status());
            assertEquals("git clone failed: repository not found", engine.task(task.id()).errorMessage());
            assertEquals(NodeStatus.WARM, engine.node(task.nodeId()).status());
        }

        @Test
        @DisplayName("an agent failure keeps the reason verbatim")
        void agentFailed() {
            Task task = submitToRunning();

            engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(),
                    new AgentStatusReport("failed", null, null, "Tests still failing: CheckoutTest#total"));

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("Tests still failing: CheckoutTest#total", failed.errorMessage());
            assertEquals(1, engine.counter("taskrunner.tasks.finished", "status", "failed"));
        }

        @Test
        @DisplayName("an unknown agent status is rejected")
        void unknownAgentStatus() {
            Task task = submitToRunning();

            assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.onAgentStatus(task.id(), task.workspaceId(), report("exploded")));
        }
    }

    @Nested
    @DisplayName("retries and timeouts")
    class RetriesAndTimeouts {

        @Test
        @DisplayName("a transient provisioning failure is retried after the backoff")
        void transientRetry() {
            doThrow(transientFailure())
                    .doReturn(new Provisioner.ProvisionedNode("srv-retry", "10.0.0.8"))
                    .when(engine.provisioner).provision(any());
            Task task = engine.submit(USER);

            engine.drainAlarms();
            assertEquals(ExecutionStep.NODE_PROVISIONING, engine.task(task.id()).executionStep());
            assertEquals(1, engine.runnerStates.find(task.id()).orElseThrow().retryCount());

            engine.advance(Duration.ofSeconds(2));

            Task waiting = engine.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_READY, waiting.executionStep());
            assertEquals(1, engine.nodesOf(USER).size());
            assertEquals("srv-retry", engine.node(waiting.nodeId()).providerId());
            assertEquals(1, engine.counter("taskrunner.step.retries", "step", "node_provisioning"));
        }

        @Test
        @DisplayName("a step that keeps failing transiently fails the task after the last attempt")
        void retriesExhausted() {
            doThrow(transientFailure()).when(engine.provisioner).provision(any());
            Task task = engine.submit(USER);

            engine.drainAlarms();
            engine.advance(Duration.ofSeconds(2));
            assertEquals(TaskStatus.QUEUED, engine.task(task.id()).status());
            engine.advance(Duration.ofSeconds(5));

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.errorMessage().startsWith("Step node_provisioning failed after 3 attempts"));
            verify(engine.provisioner, times(3)).provision(any());
            assertEquals(NodeStatus.STOPPED, engine.node(failed.autoProvisionedNodeId()).status());
        }

        @Test
        @DisplayName("a permanent failure fails the task at once")
        void permanentFailure() {
            doThrow(RemoteCallException.forStatus("Create server", 422, "server type unavailable"))
                    .when(engine.provisioner).provision(any());
            Task task = engine.submit(USER);

            engine.drainAlarms();

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.errorMessage().contains("server type unavailable"));
            verify(engine.provisioner, times(1)).provision(any());
        }

        @Test
        @DisplayName("a node agent that never answers fails the task after the readiness timeout")
        void nodeAgentTimeout() {
            doReturn(false).when(engine.agentClient).reachable(any());
            Task task = engine.submit(USER);
            engine.drainAlarms();

            for (int i = 0; i < 23; i++) {
                engine.advance(Duration.ofSeconds(5));
            }
            assertEquals(TaskStatus.QUEUED, engine.task(task.id()).status());
            engine.advance(Duration.ofSeconds(5));

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.errorMessage().contains("not reachable after 120s"));
            assertEquals(NodeStatus.WARM, engine.node(failed.nodeId()).status());
        }

        @Test
        @DisplayName("a workspace that never becomes ready fails the task after its timeout")
        void workspaceReadyTimeout() {
            Task task = submitToWorkspaceReady();

            for (int i = 0; i < 40; i++) {
                engine.advance(Duration.ofSeconds(15));
            }

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertTrue(failed.errorMessage().contains("not ready after 600s"));
            assertEquals(WorkspaceStatus.STOPPED, engine.workspaceStore.findById(task.workspaceId()).orElseThrow().status());
        }
    }

    @Nested
    @DisplayName("user commands")
    class UserCommands {

        @Test
        @DisplayName("cancel stops the task, its alarms and its workspace")
        void cancel() {
            Task task = submitToWorkspaceReady();

            Task cancelled = engine.orchestrator.cancel(task.id());

            assertEquals(TaskStatus.CANCELLED, cancelled.status());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(task.id(), AlarmKind.CONTINUE)).isEmpty());
            verify(engine.agentClient).stopWorkspace(any(), eq(task.workspaceId()));
            assertEquals(NodeStatus.WARM, engine.node(task.nodeId()).status());

            InvalidTransitionException thrown = assertThrows(InvalidTransitionException.class,
                    () -> engine.orchestrator.cancel(task.id()));
            assertEquals(TaskStatus.CANCELLED, thrown.getCurrentStatus());
        }

        @Test
        @DisplayName("retry restarts a cancelled task from node selection on the warm node")
        void retryAfterCancel() {
            Task task = submitToWorkspaceReady();
            engine.orchestrator.cancel(task.id());

            Task retried = engine.orchestrator.retry(task.id());
            assertEquals(TaskStatus.QUEUED, retried.status());
            assertEquals(ExecutionStep.NODE_SELECTION, retried.executionStep());
            assertNull(retried.workspaceId());
            assertNull(retried.errorMessage());

            engine.drainAlarms();

            Task again = engine.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_READY, again.executionStep());
            assertEquals(task.nodeId(), again.nodeId());
            assertNotEquals(task.workspaceId(), again.workspaceId());
            verify(engine.provisioner, times(1)).provision(any());

            assertEquals(CallbackDisposition.IGNORED_STALE,
                    engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId()).disposition());
        }

        @Test
        @DisplayName("only failed or cancelled tasks can be retried")
        void retryActiveTask() {
            Task task = engine.submit(USER);

            assertThrows(InvalidTransitionException.class, () -> engine.orchestrator.retry(task.id()));
        }

        @Test
        @DisplayName("unknown tasks are reported as not found")
        void unknownTask() {
            assertThrows(TaskNotFoundException.class, () -> engine.orchestrator.getTask("missing"));
            assertThrows(TaskNotFoundException.class, () -> engine.orchestrator.cancel("missing"));
        }

        @Test
        @DisplayName("a preferred running node is used without selection or provisioning")
        void preferredNode() {
            Node node = engine.insertNode(USER, NodeStatus.RUNNING);
            Task task = engine.orchestrator.submit(new TaskRequest(USER, "Pinned", "Bump the version",
                    EngineFixture.REPOSITORY, "release", null, null, node.id(), 0, List.of(), false));

            engine.drainAlarms();

            Task waiting = engine.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_READY, waiting.executionStep());
            assertEquals(node.id(), waiting.nodeId());
            assertNull(waiting.autoProvisionedNodeId());
            verify(engine.provisioner, never()).provision(any());
        }

        @Test
        @DisplayName("a preferred node that is not available fails the task")
        void preferredNodeMissing() {
            Task task = engine.orchestrator.submit(new TaskRequest(USER, null, "Bump the version",
                    EngineFixture.REPOSITORY, null, null, null, "no-such-node", 0, List.of(), false));

            engine.drainAlarms();

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("Preferred node is not available", failed.errorMessage());
        }

        @Test
        @DisplayName("a submission that would need a node beyond the user's limit is refused")
        void nodeLimit() {
            TaskRunnerProperties properties = new TaskRunnerProperties();
            properties.getNodes().setMaxNodesPerUser(1);
            EngineFixture limited = new EngineFixture(properties);
            limited.insertNode(USER, NodeStatus.RUNNING, 95.0, 95.0, true);

            assertThrows(NodeLimitExceededException.class, () -> limited.submit(USER));
            assertTrue(limited.orchestrator.listTasks(USER).isEmpty());
        }

        @Test
        @DisplayName("missing required fields are rejected")
        void validation() {
            assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.submit(TaskRequest.of(USER, "", "Fix it")));
            assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.submit(TaskRequest.of(USER, EngineFixture.REPOSITORY, " ")));
            assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.submit(TaskRequest.of(null, EngineFixture.REPOSITORY, "Fix it")));
        }
    }

    @Nested
    @DisplayName("dependencies")
    class Dependencies {

        private Task submitDependingOn(boolean draft, String... dependsOn) {
            return engine.orchestrator.submit(new TaskRequest(USER, null, "Follow-up work", EngineFixture.REPOSITORY,
                    null, null, null, null, 0, List.of(dependsOn), draft));
        }

        @Test
        @DisplayName("a task waiting on an unfinished dependency starts as a draft")
        void waitsAsDraft() {
            Task first = engine.submit(USER);

            Task second = submitDependingOn(false, first.id());

            assertEquals(TaskStatus.DRAFT, second.status());
            assertEquals(List.of(first.id()), second.dependencies());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.task(second.id(), AlarmKind.CONTINUE)).isEmpty());
            InvalidTransitionException thrown = assertThrows(InvalidTransitionException.class,
                    () -> engine.orchestrator.enqueue(second.id()));
            assertTrue(thrown.getMessage().contains(first.id()));
        }

        @Test
        @DisplayName("a draft is enqueued once its dependencies completed")
        void enqueueAfterCompletion() {
            Task first = submitToRunning();
            Task second = submitDependingOn(false, first.id());
            engine.orchestrator.onAgentStatus(first.id(), first.workspaceId(), report("completed"));

            Task queued = engine.orchestrator.enqueue(second.id());

            assertEquals(TaskStatus.QUEUED, queued.status());
            engine.drainAlarms();
            assertEquals(ExecutionStep.WORKSPACE_READY, engine.task(second.id()).executionStep());
        }

        @Test
        @DisplayName("dependencies on completed tasks do not hold the task back")
        void completedDependency() {
            Task first = submitToRunning();
            engine.orchestrator.onAgentStatus(first.id(), first.workspaceId(), report("completed"));

            assertEquals(TaskStatus.QUEUED, submitDependingOn(false, first.id()).status());
        }

        @Test
        @DisplayName("unknown dependencies and other users' tasks are rejected")
        void invalidDependencies() {
            Task foreign = engine.submit("bob");

            assertThrows(TaskValidationException.class, () -> submitDependingOn(false, "no-such-task"));
            assertThrows(TaskValidationException.class, () -> submitDependingOn(false, foreign.id()));
        }

        @Test
        @DisplayName("a dependency listed twice is stored once")
        void repeatedDependency() {
            Task first = engine.submit(USER);

            Task second = submitDependingOn(false, first.id(), first.id());

            assertEquals(List.of(first.id()), second.dependencies());
            assertEquals(List.of(first.id()), engine.task(second.id()).dependencies());
        }

        @Test
        @DisplayName("missing or blank dependency ids are a validation error")
        void emptyDependencyIds() {
            Task first = engine.submit(USER);

            TaskValidationException thrown = assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.submit(new TaskRequest(USER, null, "Follow-up work",
                            EngineFixture.REPOSITORY, null, null, null, null, 0, Arrays.asList(first.id(), null),
                            false)));
            assertTrue(thrown.getMessage().contains("depends_on"));
            assertThrows(TaskValidationException.class, () -> submitDependingOn(false, " "));
            assertEquals(1, engine.taskStore.findByUser(USER).size());
        }

        @Test
        @DisplayName("an edge that would close a cycle is rejected")
        void cycle() {
            Task first = submitDependingOn(true);
            Task second = submitDependingOn(true, first.id());

            DependencyCycleException thrown = assertThrows(DependencyCycleException.class,
                    () -> engine.orchestrator.addDependency(first.id(), second.id()));
            assertEquals(3, thrown.getCycle().size());
            assertTrue(thrown.getCycle().containsAll(List.of(first.id(), second.id())));
            assertTrue(engine.task(first.id()).dependencies().isEmpty());
        }

        @Test
        @DisplayName("adding a dependency is limited to drafts and idempotent")
        void addDependency() {
            Task base = engine.submit(USER);
            Task draft = submitDependingOn(true);

            engine.orchestrator.addDependency(draft.id(), base.id());
            Task updated = engine.orchestrator.addDependency(draft.id(), base.id());

            assertEquals(List.of(base.id()), updated.dependencies());
            assertThrows(InvalidTransitionException.class,
                    () -> engine.orchestrator.addDependency(base.id(), draft.id()));
            assertThrows(TaskValidationException.class,
                    () -> engine.orchestrator.addDependency(draft.id(), draft.id()));
        }
    }

    @Nested
    @DisplayName("other writers resolving the task mid-step")
    class OtherWriters {

        private void failFromOutside(String taskId) {
            assertTrue(engine.taskStore.finish(taskId, TaskStatus.DELEGATED, TaskStatus.FAILED, "stuck", null, null,
                    "recovery-sweeper", "stuck"));
        }

        @Test
        @DisplayName("a task failed while its agent session starts never reaches in_progress")
        void failedDuringSessionStart() {
            Task task = submitToWorkspaceReady();
            doAnswer(invocation -> {
                failFromOutside(task.id());
                return null;
            }).when(engine.agentClient).createAgentSession(any(), anyString(), anyString(), anyString());

            engine.orchestrator.onWorkspaceReady(task.id(), task.workspaceId());
            engine.drainAlarms();

            Task failed = engine.task(task.id());
            assertEquals(TaskStatus.FAILED, failed.status());
            assertEquals("stuck", failed.errorMessage());
            verify(engine.agentClient, times(1)).createAgentSession(any(), anyString(), anyString(), anyString());
            assertEquals(1, engine.counter("taskrunner.races.lost", "writer", "orchestrator"));
            assertTrue(engine.taskStore.findEvents(task.id()).stream()
                    .noneMatch(event -> event.toStatus() == TaskStatus.IN_PROGRESS));

            engine.advance(Duration.ofMinutes(5));

            assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
            verify(engine.agentClient, times(1)).createAgentSession(any(), anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("a workspace retry re-checks the task before asking the agent again")
        void failedBeforeWorkspaceRetry() {
            doThrow(transientFailure()).doNothing().when(engine.agentClient).createWorkspace(any(), any());
            Task task = engine.submit(USER);
            engine.drainAlarms();
            Task retrying = engine.task(task.id());
            assertEquals(ExecutionStep.WORKSPACE_CREATION, retrying.executionStep());
            assertNotNull(retrying.workspaceId());

            AtomicBoolean resolved = new AtomicBoolean();
            doAnswer(invocation -> {
                Object current = invocation.callRealMethod();
                if (resolved.compareAndSet(false, true)) {
                    failFromOutside(task.id());
                }
                return current;
            }).when(engine.taskStore).findById(task.id());

            engine.advance(Duration.ofSeconds(2));

            assertTrue(resolved.get());
            assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
            verify(engine.agentClient, times(1)).createWorkspace(any(), any());
            assertEquals(1, engine.counter("taskrunner.races.lost", "writer", "orchestrator"));
        }
    }

    @Test
    @DisplayName("a task finished outside its unit is left alone by its pending continuation")
    void continuationAfterExternalFailure() {
        Task task = submitToWorkspaceReady();
        engine.taskStore.finish(task.id(), TaskStatus.DELEGATED, TaskStatus.FAILED, "stuck", null, null,
                "recovery-sweeper", "stuck");

        engine.advance(Duration.ofSeconds(15));

        assertEquals(TaskStatus.FAILED, engine.task(task.id()).status());
        verify(engine.agentClient, never()).createAgentSession(any(), anyString(), anyString(), anyString());
    }
}
