package com.taskrunner.core.orchestrator;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.graph.TaskGraph;
import com.taskrunner.core.logging.MdcContext;
import com.taskrunner.core.metrics.TaskRunnerMetrics;
import com.taskrunner.core.model.CallbackDisposition;
import com.taskrunner.core.model.CallbackKind;
import com.taskrunner.core.model.CallbackReceipt;
import com.taskrunner.core.model.ExecutionStep;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.RunnerState;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskRequest;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.TaskStatusEvent;
import com.taskrunner.core.model.Workspace;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.core.node.NodeLifecycleConflictException;
import com.taskrunner.core.node.NodeLifecycleManager;
import com.taskrunner.core.node.NodeLimitExceededException;
import com.taskrunner.core.node.NodeSelection;
import com.taskrunner.core.node.NodeSelector;
import com.taskrunner.core.retry.RetryPolicy;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.core.scheduling.AlarmScheduler;
import com.taskrunner.core.scheduling.KeyedSerialExecutor;
import com.taskrunner.core.scheduling.OwnerType;
import com.taskrunner.core.security.JwtTokenService;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.RunnerStateStore;
import com.taskrunner.core.store.TaskStore;
import com.taskrunner.core.store.WorkspaceStore;
import com.taskrunner.remote.NodeAgentClient;
import com.taskrunner.remote.RemoteCallException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * Drives every task from submission to a terminal status.
 * <p>
 * Each task is one logical unit: all of its work (alarm continuations, callbacks, user
 * commands) runs in the task's mailbox {@code task:<id>}, one message at a time. Every
 * step first has its name persisted, then performs its action in a later invocation, and
 * ends by either arming the next {@code CONTINUE} alarm or waiting for a callback. Nothing
 * blocks the unit while a remote party is busy.
 * <p>
 * The recovery sweeper may fail a task concurrently. Every write here is conditional on
 * the expected status and step, and a write that affects no rows ends the invocation
 * without further side effects.
 */
@Service
public class TaskOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TaskOrchestrator.class);

    private static final String ACTOR = "orchestrator";
    private static final String USER = "user";

    private final TaskStore taskStore;
    private final RunnerStateStore runnerStates;
    private final NodeStore nodeStore;
    private final WorkspaceStore workspaceStore;
    private final NodeSelector selector;
    private final NodeLifecycleManager lifecycle;
    private final NodeAgentClient agentClient;
    private final TaskCleanupService cleanupService;
    private final AlarmScheduler alarms;
    private final KeyedSerialExecutor units;
    private final RetryPolicy retryPolicy;
    private final JwtTokenService tokenService;
    private final TaskRunnerMetrics metrics;
    private final Clock clock;
    private final TaskRunnerProperties properties;

    public TaskOrchestrator(TaskStore taskStore, RunnerStateStore runnerStates, NodeStore nodeStore,
                            WorkspaceStore workspaceStore, NodeSelector selector, NodeLifecycleManager lifecycle,
                            NodeAgentClient agentClient, TaskCleanupService cleanupService, AlarmScheduler alarms,
                            KeyedSerialExecutor units, RetryPolicy retryPolicy, JwtTokenService tokenService,
                            TaskRunnerMetrics metrics, Clock clock, TaskRunnerProperties properties) {
        this.taskStore = taskStore;
        this.runnerStates = runnerStates;
        this.nodeStore = nodeStore;
        this.workspaceStore = workspaceStore;
        this.selector = selector;
        this.lifecycle = lifecycle;
        this.agentClient = agentClient;
        this.cleanupService = cleanupService;
        this.alarms = alarms;
        this.units = units;
        this.retryPolicy = retryPolicy;
        this.tokenService = tokenService;
        this.metrics = metrics;
        this.clock = clock;
        this.properties = properties;
    }

    @PostConstruct
    public void registerAlarmHandler() {
        alarms.registerHandler(OwnerType.TASK, this::onAlarm);
    }

    // ── Submission ──────────────────────────────────────────────────────

    /**
     * Creates a task. It starts {@code queued} and is scheduled right away, unless it was
     * submitted as a draft or waits on dependencies that have not completed.
     *
     * @throws TaskValidationException    on missing fields or bad dependencies
     * @throws NodeLimitExceededException if running the task would need a node the user may not have
     */
    public Task submit(TaskRequest request) {
        validate(request);
        var settings = properties.getOrchestrator();
        NodeSize size = request.vmSize() != null ? request.vmSize() : settings.getDefaultSize();
        String location = isBlank(request.vmLocation()) ? settings.getDefaultLocation() : request.vmLocation();
        String branch = isBlank(request.branch()) ? settings.getDefaultBranch() : request.branch();

        if (request.preferredNodeId() == null
                && selector.preview(request.userId(), size, location).outcome()
                == NodeSelection.Outcome.NODE_LIMIT_REACHED) {
            throw new NodeLimitExceededException(properties.getNodes().getMaxNodesPerUser());
        }

        String taskId = UUID.randomUUID().toString();
        List<String> dependsOn = request.dependsOn();
        Map<String, TaskStatus> dependencyStatuses = checkDependencies(request.userId(), taskId, dependsOn);
        boolean waiting = dependencyStatuses.values().stream().anyMatch(status -> status != TaskStatus.COMPLETED);
        TaskStatus initial = request.draft() || waiting ? TaskStatus.DRAFT : TaskStatus.QUEUED;

        Instant now = clock.instant();
        Task task = new Task(taskId, request.userId(), request.title(), request.prompt(), request.repository(),
                branch, size, location, request.preferredNodeId(), request.priority(), initial,
                ExecutionStep.NODE_SELECTION, null, null, null, null, null, null, null, dependsOn,
                now, now, null, null);
        taskStore.insert(task, USER);
        metrics.recordTaskSubmitted(initial == TaskStatus.DRAFT);
        log.info("Task {} submitted by {} as {} ({} dependencies)", taskId, request.userId(), initial.wireName(),
                dependsOn.size());

        if (initial == TaskStatus.QUEUED) {
            start(taskId);
        }
        return getTask(taskId);
    }

    private void validate(TaskRequest request) {
        if (isBlank(request.userId())) {
            throw new TaskValidationException("userId is required");
        }
        if (isBlank(request.repository())) {
            throw new TaskValidationException("repository is required");
        }
        if (isBlank(request.prompt())) {
            throw new TaskValidationException("prompt is required");
        }
        if (request.dependsOn().stream().anyMatch(TaskOrchestrator::isBlank)) {
            throw new TaskValidationException("depends_on must not contain empty task ids");
        }
        int max = properties.getOrchestrator().getMaxDependenciesPerTask();
        if (request.dependsOn().size() > max) {
            throw new TaskValidationException("A task may depend on at most " + max + " tasks");
        }
    }

    private Map<String, TaskStatus> checkDependencies(String userId, String taskId, List<String> dependsOn) {
        for (String dependencyId : dependsOn) {
            Task dependency = taskStore.findById(dependencyId)
                    .orElseThrow(() -> new TaskValidationException("Dependency not found: " + dependencyId));
            if (!dependency.userId().equals(userId)) {
                throw new TaskValidationException("Dependency " + dependencyId + " belongs to another user");
            }
        }
        new TaskGraph(taskStore.findDependencyGraph(userId)).withEdges(taskId, dependsOn).requireAcyclic();
        return taskStore.findStatuses(dependsOn);
    }

    // ── User commands ───────────────────────────────────────────────────

    public Task cancel(String taskId) {
        return inUnit(taskId, () -> {
            Task task = getTask(taskId);
            if (task.isTerminal()) {
                throw new InvalidTransitionException(
                        "Task " + taskId + " is already " + task.status().wireName(), task.status());
            }
            if (!taskStore.finish(taskId, task.status(), TaskStatus.CANCELLED, null, null, null, USER,
                    "Cancelled by user")) {
                Task current = getTask(taskId);
                throw new InvalidTransitionException(
                        "Task " + taskId + " is already " + current.status().wireName(), current.status());
            }
            alarms.cancelAll(OwnerType.TASK, taskId);
            metrics.recordTaskResult(TaskStatus.CANCELLED.wireName());
            log.info("Task {} cancelled at step {}", taskId, task.executionStep().wireName());
            runCleanup(getTask(taskId));
            return getTask(taskId);
        });
    }

    /** Reactivates a failed or cancelled task from node selection. */
    public Task retry(String taskId) {
        return inUnit(taskId, () -> {
            Task task = getTask(taskId);
            if (task.status() != TaskStatus.FAILED && task.status() != TaskStatus.CANCELLED) {
                throw new InvalidTransitionException(
                        "Only failed or cancelled tasks can be retried; task " + taskId + " is "
                                + task.status().wireName(), task.status());
            }
            if (!taskStore.requeue(taskId, task.status(), USER, "Retried by user")) {
                throw new InvalidTransitionException("Task " + taskId + " changed while retrying", task.status());
            }
            alarms.cancelAll(OwnerType.TASK, taskId);
            log.info("Task {} retried", taskId);
            start(taskId);
            return getTask(taskId);
        });
    }

    /** Moves a draft to the queue once every dependency has completed. */
    public Task enqueue(String taskId) {
        return inUnit(taskId, () -> {
            Task task = getTask(taskId);
            if (task.status() != TaskStatus.DRAFT) {
                throw new InvalidTransitionException("Only draft tasks can be enqueued", task.status());
            }
            List<String> pending = taskStore.findStatuses(task.dependencies()).entrySet().stream()
                    .filter(entry -> entry.getValue() != TaskStatus.COMPLETED)
                    .map(Map.Entry::getKey)
                    .sorted()
                    .toList();
            if (!pending.isEmpty()) {
                throw new InvalidTransitionException("Dependencies not completed: " + String.join(", ", pending),
                        task.status());
            }
            if (!taskStore.enqueue(taskId, USER, "Enqueued by user")) {
                throw new InvalidTransitionException("Task " + taskId + " changed while enqueueing", task.status());
            }
            start(taskId);
            return getTask(taskId);
        });
    }

    public Task addDependency(String taskId, String dependsOnId) {
        return inUnit(taskId, () -> {
            Task task = getTask(taskId);
            if (task.status() != TaskStatus.DRAFT) {
                throw new InvalidTransitionException("Dependencies can only be added to draft tasks", task.status());
            }
            if (taskId.equals(dependsOnId)) {
                throw new TaskValidationException("A task cannot depend on itself");
            }
            if (task.dependencies().contains(dependsOnId)) {
                return task;
            }
            int max = properties.getOrchestrator().getMaxDependenciesPerTask();
            if (task.dependencies().size() >= max) {
                throw new TaskValidationException("A task may depend on at most " + max + " tasks");
            }
            checkDependencies(task.userId(), taskId, List.of(dependsOnId));
            taskStore.addDependency(taskId, dependsOnId);
            return getTask(taskId);
        });
    }

    /** Closes a task whose agent is waiting for follow-up. */
    public Task complete(String taskId) {
        return inUnit(taskId, () -> {
            Task task = getTask(taskId);
            if (task.status() != TaskStatus.IN_PROGRESS || task.executionStep() != ExecutionStep.AWAITING_FOLLOWUP) {
                throw new InvalidTransitionException("Only tasks awaiting follow-up can be completed", task.status());
            }
            if (!finishCompleted(task, null, null, USER, "Completed by user")) {
                throw new InvalidTransitionException("Task " + taskId + " changed while completing",
                        getTask(taskId).status());
            }
            return getTask(taskId);
        });
    }

    // ── Reads ───────────────────────────────────────────────────────────

    public Task getTask(String taskId) {
        return taskStore.findById(taskId).orElseThrow(() -> new TaskNotFoundException("Task not found: " + taskId));
    }

    public List<Task> listTasks(String userId) {
        return taskStore.findByUser(userId);
    }

    public List<TaskStatusEvent> getEvents(String taskId) {
        getTask(taskId);
        return taskStore.findEvents(taskId);
    }

    public List<CallbackReceipt> getCallbacks(String taskId) {
        return runnerStates.findCallbacks(taskId);
    }

    // ── Callbacks ───────────────────────────────────────────────────────

    public CallbackResult onWorkspaceReady(String taskId, String workspaceId) {
        return inUnit(taskId, () -> handleReadiness(taskId, workspaceId, CallbackKind.WORKSPACE_READY, null));
    }

    public CallbackResult onProvisioningFailed(String taskId, String workspaceId, String reason) {
        return inUnit(taskId, () -> handleReadiness(taskId, workspaceId, CallbackKind.PROVISIONING_FAILED, reason));
    }

    public CallbackResult onAgentStatus(String taskId, String workspaceId, AgentStatusReport report) {
        CallbackKind kind = report.kind();
        return inUnit(taskId, () -> handleAgentStatus(taskId, workspaceId, kind, report));
    }

    private CallbackResult handleReadiness(String taskId, String workspaceId, CallbackKind kind, String detail) {
        Task task = getTask(taskId);
        CallbackDisposition disposition;
        if (task.isTerminal()) {
            disposition = CallbackDisposition.IGNORED_TERMINAL;
        } else if (!workspaceId.equals(task.workspaceId())) {
            disposition = CallbackDisposition.IGNORED_STALE;
        } else if (task.executionStep() == ExecutionStep.WORKSPACE_READY) {
            disposition = applyReadiness(task, kind, detail, state(taskId).withoutPendingSignal());
        } else if (task.executionStep().isBefore(ExecutionStep.WORKSPACE_READY)) {
            Instant now = clock.instant();
            runnerStates.save(state(taskId).withPendingSignal(kind, workspaceId, detail, now));
            alarms.scheduleIn(AlarmKey.task(taskId, AlarmKind.CALLBACK_RECHECK),
                    properties.getOrchestrator().getCallbackGracePeriod());
            disposition = CallbackDisposition.DEFERRED;
        } else {
            disposition = CallbackDisposition.DUPLICATE;
        }
        return receipt(taskId, workspaceId, kind, disposition, detail);
    }

    /**
     * Acts on a readiness signal while the task sits on {@code workspace_ready}. Only the
     * recovery sweeper can move the task underneath, and it only ever fails it.
     */
    private CallbackDisposition applyReadiness(Task task, CallbackKind kind, String detail, RunnerState state) {
        try {
            if (kind == CallbackKind.WORKSPACE_READY) {
                workspaceStore.updateStatus(task.workspaceId(), EnumSet.of(WorkspaceStatus.CREATING),
                        WorkspaceStatus.RUNNING, null);
                advance(task, ExecutionStep.WORKSPACE_READY, ExecutionStep.AGENT_SESSION, state);
                log.info("Workspace {} ready", task.workspaceId());
            } else {
                String reason = isBlank(detail) ? "Workspace provisioning failed" : detail;
                workspaceStore.updateStatus(task.workspaceId(),
                        EnumSet.of(WorkspaceStatus.CREATING, WorkspaceStatus.RUNNING), WorkspaceStatus.ERROR, reason);
                runnerStates.save(state);
                failTask(task.id(), reason);
            }
            return CallbackDisposition.ACCEPTED;
        } catch (RaceLostException e) {
            metrics.recordRaceLost(ACTOR);
            log.info("Task {} was resolved while applying {}: {}", task.id(), kind, e.getMessage());
            return CallbackDisposition.IGNORED_TERMINAL;
        }
    }

    private void recheckDeferredCallback(String taskId) {
        RunnerState state = state(taskId);
        if (!state.hasPendingSignal()) {
            return;
        }
        Task task = getTask(taskId);
        CallbackKind kind = state.pendingSignal();
        String workspaceId = state.pendingWorkspaceId();
        String detail = state.pendingDetail();
        RunnerState cleared = state.withoutPendingSignal();

        CallbackDisposition disposition;
        if (task.isTerminal()) {
            runnerStates.save(cleared);
            disposition = CallbackDisposition.IGNORED_TERMINAL;
        } else if (!workspaceId.equals(task.workspaceId())) {
            runnerStates.save(cleared);
            disposition = CallbackDisposition.IGNORED_STALE;
        } else if (task.executionStep() == ExecutionStep.WORKSPACE_READY) {
            disposition = applyReadiness(task, kind, detail, cleared);
        } else if (task.executionStep().isBefore(ExecutionStep.WORKSPACE_READY)) {
            runnerStates.save(cleared);
            log.warn("Deferred {} for workspace {} still premature at {}, discarding", kind, workspaceId,
                    task.executionStep().wireName());
            disposition = CallbackDisposition.DISCARDED;
        } else {
            runnerStates.save(cleared);
            disposition = CallbackDisposition.DUPLICATE;
        }
        receipt(taskId, workspaceId, kind, disposition, detail);
    }

    private CallbackResult handleAgentStatus(String taskId, String workspaceId, CallbackKind kind,
                                             AgentStatusReport report) {
        Task task = getTask(taskId);
        String detail = kind == CallbackKind.AGENT_FAILED ? report.reason() : report.prUrl();
        CallbackDisposition disposition;
        if (task.isTerminal()) {
            disposition = CallbackDisposition.IGNORED_TERMINAL;
        } else if (!workspaceId.equals(task.workspaceId())) {
            disposition = CallbackDisposition.IGNORED_STALE;
        } else if (task.status() != TaskStatus.IN_PROGRESS) {
            log.warn("Agent reported {} before task {} was running (step {})", report.status(), taskId,
                    task.executionStep().wireName());
            disposition = CallbackDisposition.DISCARDED;
        } else {
            try {
                disposition = applyAgentStatus(task, kind, report);
            } catch (RaceLostException e) {
                metrics.recordRaceLost(ACTOR);
                log.info("Task {} was resolved while applying {}: {}", taskId, kind, e.getMessage());
                disposition = CallbackDisposition.IGNORED_TERMINAL;
            }
        }
        return receipt(taskId, workspaceId, kind, disposition, detail);
    }

    private CallbackDisposition applyAgentStatus(Task task, CallbackKind kind, AgentStatusReport report) {
        RunnerState state = state(task.id());
        switch (kind) {
            case AGENT_AWAITING_FOLLOWUP -> {
                taskStore.recordOutputs(task.id(), TaskStatus.IN_PROGRESS, report.outputBranch(), report.prUrl());
                if (task.executionStep() == ExecutionStep.AWAITING_FOLLOWUP) {
                    return CallbackDisposition.DUPLICATE;
                }
                moveStep(task, ExecutionStep.RUNNING, ExecutionStep.AWAITING_FOLLOWUP, state);
                log.info("Agent for task {} awaits follow-up", task.id());
                return CallbackDisposition.ACCEPTED;
            }
            case AGENT_COMPLETED -> {
                if (task.executionStep() == ExecutionStep.RUNNING) {
                    moveStep(task, ExecutionStep.RUNNING, ExecutionStep.AWAITING_FOLLOWUP, state);
                }
                if (!finishCompleted(task, report.outputBranch(), report.prUrl(), ACTOR, "Agent completed")) {
                    throw new RaceLostException("Task " + task.id() + " was resolved before completion");
                }
                return CallbackDisposition.ACCEPTED;
            }
            case AGENT_FAILED -> {
                failTask(task.id(), isBlank(report.reason()) ? "Agent reported failure" : report.reason());
                return CallbackDisposition.ACCEPTED;
            }
            default -> throw new IllegalArgumentException("Not an agent status: " + kind);
        }
    }

    private CallbackResult receipt(String taskId, String workspaceId, CallbackKind kind,
                                   CallbackDisposition disposition, String detail) {
        runnerStates.recordCallback(taskId, workspaceId, kind, disposition, detail);
        metrics.recordCallback(kind, disposition);
        log.info("Callback {} for workspace {}: {}", kind, workspaceId, disposition);
        Task task = getTask(taskId);
        return new CallbackResult(taskId, disposition, task.status(), task.executionStep());
    }

    // ── Step dispatcher ─────────────────────────────────────────────────

    /** Runs inside the task's mailbox; {@link AlarmScheduler} delivers it there. */
    void onAlarm(AlarmKey key) {
        MdcContext.setTask(key.ownerId());
        try {
            switch (key.kind()) {
                case CONTINUE -> continueTask(key.ownerId());
                case CALLBACK_RECHECK -> recheckDeferredCallback(key.ownerId());
                default -> log.warn("Unexpected alarm {} for task {}", key.kind(), key.ownerId());
            }
        } finally {
            MdcContext.clear();
        }
    }

    private void continueTask(String taskId) {
        Optional<Task> found = taskStore.findById(taskId);
        if (found.isEmpty()) {
            log.warn("Continuation for unknown task {}, dropping", taskId);
            return;
        }
        Task task = found.get();
        ExecutionStep step = task.executionStep();
        if (task.status() != step.boundStatus()) {
            log.debug("Task {} is {}, nothing to continue", taskId, task.status().wireName());
            return;
        }
        MdcContext.setStep(taskId, step.wireName());
        RunnerState state = state(taskId);
        try {
            switch (step) {
                case NODE_SELECTION -> selectNode(task, state);
                case NODE_PROVISIONING -> provisionNode(task, state);
                case NODE_AGENT_READY -> awaitNodeAgent(task, state);
                case WORKSPACE_CREATION -> createWorkspace(task, state);
                case WORKSPACE_READY -> awaitWorkspaceReady(task, state);
                case AGENT_SESSION -> startAgentSession(task, state);
                case RUNNING, AWAITING_FOLLOWUP -> log.debug("Task {} is driven by agent callbacks", taskId);
            }
        } catch (RaceLostException e) {
            log.info("Task {} moved on underneath step {}: {}", taskId, step.wireName(), e.getMessage());
            metrics.recordRaceLost(ACTOR);
        } catch (RemoteCallException e) {
            handleRemoteFailure(task, step, state, e);
        } catch (StepFailedException | NodeLimitExceededException | NodeLifecycleConflictException e) {
            failTask(taskId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error at step {} of task {}", step.wireName(), taskId, e);
            failTask(taskId, "Unexpected error at step " + step.wireName() + ": " + e.getMessage());
        }
    }

    private void handleRemoteFailure(Task task, ExecutionStep step, RunnerState state, RemoteCallException e) {
        if (retryPolicy.isRetryable(e)) {
            int attempt = state.retryCount() + 2;
            Optional<Duration> delay = retryPolicy.delayBeforeAttempt(attempt);
            if (delay.isPresent()) {
                log.warn("Step {} failed (attempt {}/{}), retrying in {}ms: {}", step.wireName(), attempt - 1,
                        retryPolicy.getMaxAttempts(), delay.get().toMillis(), e.getMessage());
                runnerStates.save(state.withRetry(state.retryCount() + 1));
                metrics.recordStepRetry(step);
                alarms.scheduleIn(AlarmKey.task(task.id(), AlarmKind.CONTINUE), delay.get());
                return;
            }
            failTask(task.id(), "Step " + step.wireName() + " failed after " + retryPolicy.getMaxAttempts()
                    + " attempts: " + e.getMessage());
            return;
        }
        failTask(task.id(), e.getMessage());
    }

    // ── Steps ───────────────────────────────────────────────────────────

    private void selectNode(Task task, RunnerState state) {
        if (task.preferredNodeId() != null) {
            String nodeId = task.preferredNodeId();
            Node node = nodeStore.findById(nodeId).filter(n -> n.userId().equals(task.userId())).orElse(null);
            boolean claimed = node != null && node.status() == NodeStatus.WARM && lifecycle.tryClaim(nodeId);
            if (node == null || !(claimed || node.status() == NodeStatus.RUNNING)) {
                throw new StepFailedException("Preferred node is not available");
            }
            useNode(task, state, nodeId, claimed);
            return;
        }

        NodeSelection selection = selector.select(task.userId(), task.vmSize(), task.vmLocation());
        switch (selection.outcome()) {
            case CLAIMED_WARM -> useNode(task, state, selection.node().id(), true);
            case REUSED_RUNNING -> useNode(task, state, selection.node().id(), false);
            case PROVISION_NO_CANDIDATES, PROVISION_ALL_AT_CAPACITY ->
                    advance(task, ExecutionStep.NODE_SELECTION, ExecutionStep.NODE_PROVISIONING, state);
            case NODE_LIMIT_REACHED ->
                    throw new NodeLimitExceededException(properties.getNodes().getMaxNodesPerUser());
        }
    }

    private void useNode(Task task, RunnerState state, String nodeId, boolean claimedWarm) {
        try {
            if (!taskStore.assignNode(task.id(), TaskStatus.QUEUED, ExecutionStep.NODE_SELECTION, nodeId, null)) {
                throw new RaceLostException("Task left node selection before node " + nodeId + " was assigned");
            }
            advance(task, ExecutionStep.NODE_SELECTION, ExecutionStep.NODE_AGENT_READY, state);
            log.info("Task {} runs on {} node {}", task.id(), claimedWarm ? "warm" : "running", nodeId);
        } catch (RaceLostException e) {
            if (claimedWarm) {
                lifecycle.markIdle(nodeId);
            }
            throw e;
        }
    }

    private void provisionNode(Task task, RunnerState state) {
        String nodeId = task.autoProvisionedNodeId();
        if (nodeId == null) {
            Node node = lifecycle.createNode(task.userId(), task.vmSize(), task.vmLocation());
            if (!taskStore.assignNode(task.id(), TaskStatus.QUEUED, ExecutionStep.NODE_PROVISIONING,
                    node.id(), node.id())) {
                lifecycle.destroy(node.id(), "abandoned");
                throw new RaceLostException("Task left provisioning before node " + node.id() + " was assigned");
            }
            nodeId = node.id();
        }
        lifecycle.provision(nodeId);
        advance(task, ExecutionStep.NODE_PROVISIONING, ExecutionStep.NODE_AGENT_READY, state);
    }

    private void awaitNodeAgent(Task task, RunnerState state) {
        Node node = requireRunningNode(task);
        if (agentClient.reachable(node)) {
            if (!taskStore.transition(task.id(), TaskStatus.QUEUED, TaskStatus.DELEGATED,
                    ExecutionStep.NODE_AGENT_READY, ExecutionStep.WORKSPACE_CREATION, ACTOR,
                    "Node agent on " + node.id() + " reachable")) {
                throw new RaceLostException("Task left queued before delegation");
            }
            stepEntered(ExecutionStep.NODE_AGENT_READY, state);
            alarms.scheduleNow(AlarmKey.task(task.id(), AlarmKind.CONTINUE));
            return;
        }
        Duration timeout = properties.getOrchestrator().getNodeAgentReadyTimeout();
        Duration waited = Duration.between(state.stepStartedAt(), clock.instant());
        if (waited.compareTo(timeout) >= 0) {
            throw new StepFailedException("Node agent on " + node.id() + " not reachable after "
                    + waited.toSeconds() + "s");
        }
        alarms.scheduleIn(AlarmKey.task(task.id(), AlarmKind.CONTINUE),
                properties.getOrchestrator().getNodeAgentPollInterval());
    }

    private void createWorkspace(Task task, RunnerState state) {
        Node node = requireRunningNode(task);
        String outputBranch = properties.getOrchestrator().getOutputBranchPrefix() + task.id();
        String workspaceId = task.workspaceId();
        if (workspaceId == null) {
            workspaceId = UUID.randomUUID().toString();
            Instant now = clock.instant();
            workspaceStore.insert(new Workspace(workspaceId, node.id(), task.userId(), task.id(),
                    WorkspaceStatus.CREATING, null, null, now, now));
            if (!taskStore.assignWorkspace(task.id(), TaskStatus.DELEGATED, ExecutionStep.WORKSPACE_CREATION,
                    workspaceId, outputBranch)) {
                workspaceStore.updateStatus(workspaceId, EnumSet.of(WorkspaceStatus.CREATING),
                        WorkspaceStatus.STOPPED, "Task resolved before the workspace was requested");
                throw new RaceLostException("Task left workspace creation before workspace was assigned");
            }
        } else {
            requireStillAt(task.id(), ExecutionStep.WORKSPACE_CREATION, "the workspace was requested again");
        }
        String callbackUrl = properties.getCallback().getBaseUrl() + "/api/v1/callbacks/workspaces/" + workspaceId;
        agentClient.createWorkspace(node, new NodeAgentClient.WorkspaceRequest(workspaceId, task.id(),
                task.repository(), task.branch(), outputBranch,
                tokenService.generateCallbackToken(task.id(), workspaceId), callbackUrl));
        advance(task, ExecutionStep.WORKSPACE_CREATION, ExecutionStep.WORKSPACE_READY, state);
    }

    private void awaitWorkspaceReady(Task task, RunnerState state) {
        if (state.hasPendingSignal() && task.workspaceId().equals(state.pendingWorkspaceId())) {
            CallbackKind kind = state.pendingSignal();
            String detail = state.pendingDetail();
            alarms.cancel(AlarmKey.task(task.id(), AlarmKind.CALLBACK_RECHECK));
            CallbackDisposition disposition = applyReadiness(task, kind, detail, state.withoutPendingSignal());
            receipt(task.id(), task.workspaceId(), kind, disposition, detail);
            return;
        }

        Workspace workspace = workspaceStore.findById(task.workspaceId())
                .orElseThrow(() -> new StepFailedException("Workspace " + task.workspaceId() + " no longer exists"));
        switch (workspace.status()) {
            case RUNNING -> advance(task, ExecutionStep.WORKSPACE_READY, ExecutionStep.AGENT_SESSION, state);
            case ERROR -> throw new StepFailedException(isBlank(workspace.errorMessage())
                    ? "Workspace " + workspace.id() + " failed" : workspace.errorMessage());
            case STOPPED -> throw new StepFailedException("Workspace " + workspace.id() + " was stopped");
            case CREATING -> {
                Duration timeout = properties.getOrchestrator().getWorkspaceReadyTimeout();
                Duration waited = Duration.between(state.stepStartedAt(), clock.instant());
                if (waited.compareTo(timeout) >= 0) {
                    throw new StepFailedException("Workspace " + workspace.id() + " not ready after "
                            + waited.toSeconds() + "s");
                }
                alarms.scheduleIn(AlarmKey.task(task.id(), AlarmKind.CONTINUE),
                        properties.getOrchestrator().getWorkspaceReadyPollInterval());
            }
        }
    }

    private void startAgentSession(Task task, RunnerState state) {
        Node node = requireRunningNode(task);
        String sessionId = task.sessionId();
        if (sessionId == null) {
            sessionId = UUID.randomUUID().toString();
            if (!taskStore.assignSession(task.id(), TaskStatus.DELEGATED, ExecutionStep.AGENT_SESSION, sessionId)) {
                throw new RaceLostException("Task left agent_session before the session was reserved");
            }
        } else {
            requireStillAt(task.id(), ExecutionStep.AGENT_SESSION, "the session was started");
        }

        agentClient.createAgentSession(node, task.workspaceId(), sessionId, task.prompt());
        workspaceStore.setChatSession(task.workspaceId(), sessionId);

        if (!taskStore.transition(task.id(), TaskStatus.DELEGATED, TaskStatus.IN_PROGRESS,
                ExecutionStep.AGENT_SESSION, ExecutionStep.RUNNING, ACTOR, "Agent session " + sessionId + " started")) {
            throw new RaceLostException("Task left delegated before it could start running");
        }
        stepEntered(ExecutionStep.AGENT_SESSION, state);
        log.info("Task {} running (session {})", task.id(), sessionId);
    }

    /** Re-reads the task before a step repeats a remote call it may already have made. */
    private void requireStillAt(String taskId, ExecutionStep step, String before) {
        Task current = getTask(taskId);
        if (current.status() != step.boundStatus() || current.executionStep() != step) {
            throw new RaceLostException("Task left " + step.wireName() + " before " + before);
        }
    }

    // ── Failure and completion ──────────────────────────────────────────

    /**
     * Fails the task with {@code reason} and releases its resources. A task that is already
     * terminal is left alone.
     */
    void failTask(String taskId, String reason) {
        Task task = getTask(taskId);
        if (task.isTerminal() || !task.status().canTransitionTo(TaskStatus.FAILED)) {
            return;
        }
        if (!taskStore.finish(taskId, task.status(), TaskStatus.FAILED, reason, null, null, ACTOR, reason)) {
            log.info("Task {} was resolved by another writer before it could fail", taskId);
            metrics.recordRaceLost(ACTOR);
            return;
        }
        log.warn("Task {} failed at step {}: {}", taskId, task.executionStep().wireName(), reason);
        alarms.cancelAll(OwnerType.TASK, taskId);
        metrics.recordTaskResult(TaskStatus.FAILED.wireName());
        runCleanup(getTask(taskId));
    }

    private boolean finishCompleted(Task task, String outputBranch, String prUrl, String actor, String reason) {
        if (!taskStore.finish(task.id(), TaskStatus.IN_PROGRESS, TaskStatus.COMPLETED, null, outputBranch, prUrl,
                actor, reason)) {
            return false;
        }
        alarms.cancelAll(OwnerType.TASK, task.id());
        metrics.recordTaskResult(TaskStatus.COMPLETED.wireName());
        log.info("Task {} completed", task.id());
        runCleanup(getTask(task.id()));
        return true;
    }

    private void runCleanup(Task task) {
        try {
            cleanupService.cleanup(task);
        } catch (RuntimeException e) {
            log.error("Cleanup for task {} failed; node timers remain as backstop", task.id(), e);
        }
    }

    // ── Internals ───────────────────────────────────────────────────────

    private void start(String taskId) {
        runnerStates.save(RunnerState.initial(taskId, clock.instant()));
        alarms.scheduleNow(AlarmKey.task(taskId, AlarmKind.CONTINUE));
    }

    /** Persists the next step, then arms an immediate continuation to perform it. */
    private void advance(Task task, ExecutionStep from, ExecutionStep to, RunnerState state) {
        moveStep(task, from, to, state);
        alarms.scheduleNow(AlarmKey.task(task.id(), AlarmKind.CONTINUE));
    }

    private void moveStep(Task task, ExecutionStep from, ExecutionStep to, RunnerState state) {
        if (!taskStore.advanceStep(task.id(), from.boundStatus(), from, to)) {
            throw new RaceLostException("Task left step " + from.wireName() + " before reaching " + to.wireName());
        }
        stepEntered(from, state);
        log.debug("Task {} step {} -> {}", task.id(), from.wireName(), to.wireName());
    }

    private void stepEntered(ExecutionStep finished, RunnerState state) {
        Instant now = clock.instant();
        if (state.stepStartedAt() != null) {
            metrics.recordStepDuration(finished, Duration.between(state.stepStartedAt(), now));
        }
        runnerStates.save(state.stepStarted(now));
    }

    private RunnerState state(String taskId) {
        return runnerStates.find(taskId).orElseGet(() -> RunnerState.initial(taskId, clock.instant()));
    }

    private Node requireRunningNode(Task task) {
        if (task.nodeId() == null) {
            throw new StepFailedException("No node assigned at step " + task.executionStep().wireName());
        }
        Node node = nodeStore.findById(task.nodeId())
                .orElseThrow(() -> new StepFailedException("Node " + task.nodeId() + " no longer exists"));
        if (node.status() != NodeStatus.RUNNING) {
            throw new StepFailedException("Node " + node.id() + " is " + node.status().wireName());
        }
        return node;
    }

    private <T> T inUnit(String taskId, Callable<T> work) {
        try {
            return units.submit(OwnerType.TASK.unitKey(taskId), () -> {
                MdcContext.setTask(taskId);
                try {
                    return work.call();
                } finally {
                    MdcContext.clear();
                }
            }).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
