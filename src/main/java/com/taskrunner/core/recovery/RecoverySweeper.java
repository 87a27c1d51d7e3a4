package com.taskrunner.core.recovery;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.logging.MdcContext;
import com.taskrunner.core.metrics.TaskRunnerMetrics;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.RecoveryRecord;
import com.taskrunner.core.model.RunnerState;
import com.taskrunner.core.model.Task;
import com.taskrunner.core.model.TaskStatus;
import com.taskrunner.core.model.Workspace;
import com.taskrunner.core.orchestrator.TaskCleanupService;
import com.taskrunner.core.scheduling.AlarmScheduler;
import com.taskrunner.core.scheduling.OwnerType;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.RecoveryRecordStore;
import com.taskrunner.core.store.RunnerStateStore;
import com.taskrunner.core.store.TaskStore;
import com.taskrunner.core.store.WorkspaceStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Finds tasks whose orchestrator stopped advancing and fails them.
 * <p>
 * A task is stuck when it has not been updated for longer than the threshold of its
 * status. The sweeper persists a {@link RecoveryRecord} describing what it saw, then fails
 * the task with the same conditional update the orchestrator uses. Losing that race means
 * the orchestrator is alive and moved the task on; the record is then marked
 * {@link RecoveryRecord.Outcome#SKIPPED_OPTIMISTIC_LOCK} and nothing else happens.
 */
@Service
public class RecoverySweeper {

    private static final Logger log = LoggerFactory.getLogger(RecoverySweeper.class);

    static final String ACTOR = "recovery-sweeper";

    private final TaskStore taskStore;
    private final WorkspaceStore workspaceStore;
    private final NodeStore nodeStore;
    private final RunnerStateStore runnerStates;
    private final RecoveryRecordStore recoveryRecords;
    private final TaskCleanupService cleanupService;
    private final AlarmScheduler alarms;
    private final TaskRunnerMetrics metrics;
    private final Clock clock;
    private final TaskRunnerProperties.Recovery settings;

    private ScheduledExecutorService scheduler;

    public RecoverySweeper(TaskStore taskStore, WorkspaceStore workspaceStore, NodeStore nodeStore,
                           RunnerStateStore runnerStates, RecoveryRecordStore recoveryRecords,
                           TaskCleanupService cleanupService, AlarmScheduler alarms, TaskRunnerMetrics metrics,
                           Clock clock, TaskRunnerProperties properties) {
        this.taskStore = taskStore;
        this.workspaceStore = workspaceStore;
        this.nodeStore = nodeStore;
        this.runnerStates = runnerStates;
        this.recoveryRecords = recoveryRecords;
        this.cleanupService = cleanupService;
        this.alarms = alarms;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = properties.getRecovery();
    }

    @PostConstruct
    void start() {
        if (!settings.isEnabled()) {
            log.debug("Recovery sweeper disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "recovery-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalSeconds = settings.getInterval().toSeconds();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Recovery sweeper started (interval={}s)", intervalSeconds);
    }

    @PreDestroy
    void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Recovery sweep failed", e);
        }
    }

    /**
     * One pass over every active task.
     *
     * @return one record per task the sweeper acted on
     */
    public List<RecoveryRecord> sweep() {
        long start = System.currentTimeMillis();
        Instant now = clock.instant();
        List<RecoveryRecord> results = new ArrayList<>();

        for (Task task : taskStore.findByStatuses(TaskStatus.active())) {
            Duration threshold = thresholdFor(task.status());
            Duration elapsed = Duration.between(task.updatedAt(), now);
            if (elapsed.compareTo(threshold) <= 0) {
                continue;
            }
            try {
                results.add(recover(task, elapsed, threshold, now));
            } catch (RuntimeException e) {
                log.error("Could not recover stuck task {}", task.id(), e);
            }
        }

        metrics.recordSweepDuration("recovery", System.currentTimeMillis() - start);
        if (!results.isEmpty()) {
            log.info("Recovery sweep acted on {} task(s)", results.size());
        }
        return results;
    }

    Duration thresholdFor(TaskStatus status) {
        return switch (status) {
            case QUEUED -> settings.getQueuedTimeout();
            case DELEGATED -> settings.getDelegatedTimeout();
            case IN_PROGRESS -> settings.getInProgressTimeout();
            default -> throw new IllegalArgumentException(status.wireName() + " tasks are never swept");
        };
    }

    private RecoveryRecord recover(Task task, Duration elapsed, Duration threshold, Instant now) {
        MdcContext.setTask(task.id());
        try {
            Workspace workspace = task.workspaceId() == null
                    ? null : workspaceStore.findById(task.workspaceId()).orElse(null);
            Node node = task.nodeId() == null ? null : nodeStore.findById(task.nodeId()).orElse(null);
            RunnerState state = runnerStates.find(task.id()).orElse(null);
            String reason = describe(task, elapsed, threshold, workspace, node);

            RecoveryRecord record = new RecoveryRecord(
                    UUID.randomUUID().toString(), task.id(), task.status(), task.executionStep(), elapsed, threshold,
                    reason, task.workspaceId(), workspace == null ? null : workspace.status(),
                    task.nodeId(), node == null ? null : node.status(), node == null ? null : node.health(),
                    task.autoProvisionedNodeId(), state == null ? 0 : state.retryCount(),
                    RecoveryRecord.Outcome.FAILED, details(task, workspace, node, state), now);
            recoveryRecords.insert(record);

            if (!taskStore.finish(task.id(), task.status(), TaskStatus.FAILED, reason, null, null, ACTOR, reason)) {
                log.info("Task {} moved on before the sweeper could fail it", task.id());
                recoveryRecords.updateOutcome(record.id(), RecoveryRecord.Outcome.SKIPPED_OPTIMISTIC_LOCK);
                metrics.recordRaceLost("sweeper");
                metrics.recordRecovery("skipped");
                return record.withOutcome(RecoveryRecord.Outcome.SKIPPED_OPTIMISTIC_LOCK);
            }
            log.warn("Recovered stuck task {}: {}", task.id(), reason);
            alarms.cancelAll(OwnerType.TASK, task.id());
            metrics.recordTaskResult(TaskStatus.FAILED.wireName());

            try {
                cleanupService.cleanup(taskStore.findById(task.id()).orElse(task));
            } catch (RuntimeException e) {
                log.error("Cleanup after recovering task {} failed", task.id(), e);
                recoveryRecords.updateOutcome(record.id(), RecoveryRecord.Outcome.CLEANUP_ERROR);
                metrics.recordRecovery("cleanup_error");
                return record.withOutcome(RecoveryRecord.Outcome.CLEANUP_ERROR);
            }
            metrics.recordRecovery("failed");
            return record;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * e.g. {@code Task stuck in 'delegated' for 312s (threshold: 300s). Last step: workspace_ready
     * (waiting for workspace to become ready). Workspace ws-1: creating. Node n-1: running}
     */
    static String describe(Task task, Duration elapsed, Duration threshold, Workspace workspace, Node node) {
        StringBuilder message = new StringBuilder()
                .append("Task stuck in '").append(task.status().wireName()).append("' for ")
                .append(elapsed.toSeconds()).append("s (threshold: ").append(threshold.toSeconds()).append("s). ")
                .append("Last step: ").append(task.executionStep().wireName())
                .append(" (").append(task.executionStep().description()).append(")");
        if (task.workspaceId() != null) {
            message.append(". Workspace ").append(task.workspaceId()).append(": ")
                    .append(workspace == null ? "missing" : workspace.status().wireName());
        }
        if (task.nodeId() != null) {
            message.append(". Node ").append(task.nodeId()).append(": ")
                    .append(node == null ? "missing" : node.status().wireName());
        }
        return message.toString();
    }

    private static Map<String, Object> details(Task task, Workspace workspace, Node node, RunnerState state) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", task.userId());
        details.put("stepDescription", task.executionStep().description());
        if (task.sessionId() != null) {
            details.put("sessionId", task.sessionId());
        }
        if (workspace != null && workspace.errorMessage() != null) {
            details.put("workspaceError", workspace.errorMessage());
        }
        if (node != null) {
            details.put("nodeAutoProvisioned", node.autoProvisioned());
            if (node.lastHeartbeatAt() != null) {
                details.put("nodeLastHeartbeatAt", node.lastHeartbeatAt().toString());
            }
        }
        if (state != null && state.hasPendingSignal()) {
            details.put("pendingSignal", state.pendingSignal().name());
        }
        return details;
    }
}
