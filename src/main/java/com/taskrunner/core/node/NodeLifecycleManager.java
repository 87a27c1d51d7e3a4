package com.taskrunner.core.node;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.logging.MdcContext;
import com.taskrunner.core.metrics.TaskRunnerMetrics;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.retry.RetryPolicy;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.core.scheduling.AlarmScheduler;
import com.taskrunner.core.scheduling.KeyedSerialExecutor;
import com.taskrunner.core.scheduling.OwnerType;
import com.taskrunner.core.security.JwtTokenService;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.TaskStore;
import com.taskrunner.core.store.WorkspaceStore;
import com.taskrunner.remote.Provisioner;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sole writer of node lifecycle state.
 * <p>
 * Every operation runs inside the node's own mailbox ({@code node:<id>}), so each node
 * behaves as one single-threaded lifecycle unit. Node mailboxes run on a dedicated pool:
 * task units may wait on a node operation, node units never wait on a task.
 * <p>
 * Leak defense is layered: a {@code WARM_TIMEOUT} alarm destroys a node left warm, the
 * {@link NodeCleanupSweeper} catches warm nodes whose alarm never fired, and a
 * {@code MAX_LIFETIME} alarm armed at creation destroys the node regardless of state.
 */
@Service
public class NodeLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(NodeLifecycleManager.class);

    private static final EnumSet<NodeStatus> LIVE = EnumSet.of(
            NodeStatus.PROVISIONING, NodeStatus.RUNNING, NodeStatus.WARM);

    private final NodeStore nodeStore;
    private final WorkspaceStore workspaceStore;
    private final TaskStore taskStore;
    private final Provisioner provisioner;
    private final AlarmScheduler alarms;
    private final RetryPolicy retryPolicy;
    private final JwtTokenService tokenService;
    private final TaskRunnerMetrics metrics;
    private final Clock clock;
    private final TaskRunnerProperties.Nodes settings;
    private final KeyedSerialExecutor nodeUnits;

    @Autowired
    public NodeLifecycleManager(NodeStore nodeStore, WorkspaceStore workspaceStore, TaskStore taskStore,
                                Provisioner provisioner, AlarmScheduler alarms, RetryPolicy retryPolicy,
                                JwtTokenService tokenService, TaskRunnerMetrics metrics, Clock clock,
                                TaskRunnerProperties properties) {
        this(nodeStore, workspaceStore, taskStore, provisioner, alarms, retryPolicy, tokenService, metrics, clock,
                properties, nodeWorkers(properties.getNodes().getWorkerThreads()));
    }

    public NodeLifecycleManager(NodeStore nodeStore, WorkspaceStore workspaceStore, TaskStore taskStore,
                                Provisioner provisioner, AlarmScheduler alarms, RetryPolicy retryPolicy,
                                JwtTokenService tokenService, TaskRunnerMetrics metrics, Clock clock,
                                TaskRunnerProperties properties, KeyedSerialExecutor nodeUnits) {
        this.nodeStore = nodeStore;
        this.workspaceStore = workspaceStore;
        this.taskStore = taskStore;
        this.provisioner = provisioner;
        this.alarms = alarms;
        this.retryPolicy = retryPolicy;
        this.tokenService = tokenService;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = properties.getNodes();
        this.nodeUnits = nodeUnits;
    }

    private static KeyedSerialExecutor nodeWorkers(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return new KeyedSerialExecutor(Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "node-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }));
    }

    @PostConstruct
    public void registerAlarmHandler() {
        alarms.registerHandler(OwnerType.NODE, this::onAlarm);
    }

    @PreDestroy
    void shutdown() {
        nodeUnits.shutdown();
    }

    // ── Creation and provisioning ───────────────────────────────────────

    /**
     * Creates the node row in {@code provisioning} and arms its absolute lifetime.
     *
     * @throws NodeLimitExceededException if the user already owns the maximum number of nodes
     */
    public Node createNode(String userId, NodeSize size, String location) {
        if (nodeStore.countOwnedByUser(userId) >= settings.getMaxNodesPerUser()) {
            throw new NodeLimitExceededException(settings.getMaxNodesPerUser());
        }
        Instant now = clock.instant();
        Node node = new Node(UUID.randomUUID().toString(), userId, NodeStatus.PROVISIONING, size, location,
                null, null, NodeHealth.HEALTHY, null, null, null, null, true, null, now, now);
        nodeStore.insert(node);
        alarms.schedule(AlarmKey.node(node.id(), AlarmKind.MAX_LIFETIME), now.plus(settings.getMaxLifetime()));
        log.info("Node {} created ({} in {}) for user {}", node.id(), size.wireName(), location, userId);
        return node;
    }

    /**
     * Asks the provisioner for the VM behind a {@code provisioning} node. Resumable: a node
     * whose provider handle is already recorded is not provisioned twice.
     *
     * @return the node, now {@code running}
     */
    public Node provision(String nodeId) {
        return call(nodeId, () -> {
            Node node = require(nodeId);
            if (node.status() == NodeStatus.RUNNING) {
                return node;
            }
            if (node.status() != NodeStatus.PROVISIONING) {
                throw new NodeLifecycleConflictException(nodeId, node.status(), "provision");
            }
            if (node.providerId() == null) {
                var created = provisioner.provision(new Provisioner.ProvisionRequest(nodeId, node.userId(),
                        node.size().wireName(), node.location(), tokenService.generateNodeToken(nodeId, node.userId())));
                nodeStore.setProviderId(nodeId, created.providerId(), created.ipAddress());
                node = require(nodeId);
            }
            if (!nodeStore.markProvisioned(nodeId, node.providerId(), node.ipAddress())) {
                throw new NodeLifecycleConflictException(nodeId, require(nodeId).status(), "provision");
            }
            metrics.recordNodeProvisioned(node.size().wireName());
            log.info("Node {} provisioned as {} ({})", nodeId, node.providerId(), node.ipAddress());
            return require(nodeId);
        });
    }

    // ── Warm pool ───────────────────────────────────────────────────────

    /**
     * Atomically takes a warm node out of the pool. Of any number of concurrent callers,
     * exactly one gets {@code true}. A node whose warm timeout has already run out is left
     * for teardown and never handed out.
     */
    public boolean tryClaim(String nodeId) {
        return call(nodeId, () -> {
            Optional<Node> node = nodeStore.findById(nodeId);
            if (node.isPresent() && warmExpired(node.get(), clock.instant())) {
                log.info("Warm node {} outlived its warm timeout, not claiming it", nodeId);
                return false;
            }
            if (!nodeStore.claimWarm(nodeId)) {
                return false;
            }
            alarms.cancel(AlarmKey.node(nodeId, AlarmKind.WARM_TIMEOUT));
            metrics.recordWarmClaim();
            log.info("Warm node {} claimed", nodeId);
            return true;
        });
    }

    /**
     * Returns a running node to the warm pool once nothing is using it any more and arms its
     * warm timeout. Already warm is a no-op.
     *
     * @return whether the node went warm
     * @throws NodeLifecycleConflictException if the node is provisioning, destroying or stopped
     */
    public boolean markIdle(String nodeId) {
        return call(nodeId, () -> {
            Node node = require(nodeId);
            switch (node.status()) {
                case WARM:
                    return false;
                case RUNNING:
                    if (workspaceStore.countActiveOnNode(nodeId) > 0 || taskStore.countActiveOnNode(nodeId) > 0) {
                        log.debug("Node {} still in use, staying running", nodeId);
                        return false;
                    }
                    if (!nodeStore.markWarm(nodeId)) {
                        return false;
                    }
                    alarms.scheduleIn(AlarmKey.node(nodeId, AlarmKind.WARM_TIMEOUT), settings.getWarmTimeout());
                    log.info("Node {} is idle, warm for up to {}m", nodeId, settings.getWarmTimeout().toMinutes());
                    return true;
                default:
                    throw new NodeLifecycleConflictException(nodeId, node.status(), "mark idle");
            }
        });
    }

    /** Puts a warm node that turned out to host active workspaces back to running. */
    public boolean reactivate(String nodeId) {
        return call(nodeId, () -> {
            if (!nodeStore.updateStatus(nodeId, List.of(NodeStatus.WARM), NodeStatus.RUNNING, null)) {
                return false;
            }
            alarms.cancel(AlarmKey.node(nodeId, AlarmKind.WARM_TIMEOUT));
            log.warn("Warm node {} had active workspaces, returned to running", nodeId);
            return true;
        });
    }

    // ── Teardown ────────────────────────────────────────────────────────

    /**
     * Tears the node down: {@code destroying}, provider teardown, then {@code stopped}.
     * A failed teardown leaves the node {@code destroying} with a {@code DESTROY_RETRY} alarm.
     *
     * @param trigger which mechanism asked for the teardown, for logs and metrics
     * @return whether the node is now stopped
     */
    public boolean destroy(String nodeId, String trigger) {
        return call(nodeId, () -> destroyInUnit(require(nodeId), trigger));
    }

    /**
     * Sweep-side teardown of a warm node. Re-reads the node inside its unit and only destroys it
     * when it is still warm, went warm before {@code cutoff} and hosts no active workspace.
     *
     * @return whether the node was torn down
     */
    public boolean destroyIfExpiredWarm(String nodeId, Instant cutoff) {
        return call(nodeId, () -> {
            Node node = require(nodeId);
            if (node.status() != NodeStatus.WARM || node.warmSince() == null || !node.warmSince().isBefore(cutoff)) {
                log.debug("Node {} is no longer an expired warm node ({}), skipping", nodeId, node.status());
                return false;
            }
            if (workspaceStore.countActiveOnNode(nodeId) > 0) {
                log.debug("Node {} picked up workspaces while warm, skipping", nodeId);
                return false;
            }
            return destroyInUnit(node, "warm_sweep");
        });
    }

    private boolean warmExpired(Node node, Instant now) {
        return node.status() == NodeStatus.WARM
                && node.warmSince() != null
                && !node.warmSince().plus(settings.getWarmTimeout()).isAfter(now);
    }

    // ── Health ──────────────────────────────────────────────────────────

    public Node recordHeartbeat(String nodeId, Double cpuPercent, Double memoryPercent) {
        return call(nodeId, () -> {
            require(nodeId);
            nodeStore.recordHeartbeat(nodeId, cpuPercent, memoryPercent, NodeHealth.HEALTHY);
            return require(nodeId);
        });
    }

    public boolean markStale(String nodeId) {
        return call(nodeId, () -> {
            boolean changed = nodeStore.updateHealth(nodeId, NodeHealth.STALE);
            if (changed) {
                log.warn("Node {} missed its heartbeats, marked stale", nodeId);
            }
            return changed;
        });
    }

    // ── Alarms ──────────────────────────────────────────────────────────

    void onAlarm(AlarmKey key) {
        call(key.ownerId(), () -> {
            handleAlarm(key);
            return null;
        });
    }

    private void handleAlarm(AlarmKey key) {
        Optional<Node> found = nodeStore.findById(key.ownerId());
        if (found.isEmpty()) {
            log.warn("Alarm {} for unknown node, dropping", key);
            return;
        }
        Node node = found.get();
        switch (key.kind()) {
            case WARM_TIMEOUT -> {
                if (node.status() != NodeStatus.WARM) {
                    log.debug("Node {} left the warm pool before its timeout", node.id());
                    return;
                }
                Instant due = node.warmSince() == null ? clock.instant() : node.warmSince().plus(settings.getWarmTimeout());
                if (due.isAfter(clock.instant())) {
                    alarms.schedule(key, due);
                    return;
                }
                destroyInUnit(node, "warm_timeout");
            }
            case MAX_LIFETIME -> {
                if (node.status() != NodeStatus.STOPPED) {
                    log.warn("Node {} reached its maximum lifetime ({}h)", node.id(), settings.getMaxLifetime().toHours());
                    destroyInUnit(node, "max_lifetime");
                }
            }
            case DESTROY_RETRY -> {
                if (node.status() == NodeStatus.DESTROYING) {
                    destroyInUnit(node, "destroy_retry");
                }
            }
            default -> log.warn("Unexpected alarm {} for node {}", key.kind(), node.id());
        }
    }

    private boolean destroyInUnit(Node node, String trigger) {
        String nodeId = node.id();
        if (node.status() == NodeStatus.STOPPED) {
            return true;
        }
        if (node.status() != NodeStatus.DESTROYING
                && !nodeStore.updateStatus(nodeId, LIVE, NodeStatus.DESTROYING, null)) {
            throw new NodeLifecycleConflictException(nodeId, require(nodeId).status(), "destroy");
        }
        alarms.cancel(AlarmKey.node(nodeId, AlarmKind.WARM_TIMEOUT));

        if (node.providerId() != null) {
            try {
                retryPolicy.run("Destroy node " + nodeId, () -> provisioner.destroy(node.providerId()));
            } catch (RuntimeException e) {
                log.error("Teardown of node {} failed, retrying in {}s", nodeId,
                        settings.getDestroyRetryDelay().toSeconds(), e);
                metrics.recordNodeDestroyFailure();
                alarms.scheduleIn(AlarmKey.node(nodeId, AlarmKind.DESTROY_RETRY), settings.getDestroyRetryDelay());
                return false;
            }
        }

        nodeStore.updateStatus(nodeId, List.of(NodeStatus.DESTROYING), NodeStatus.STOPPED, null);
        alarms.cancelAll(OwnerType.NODE, nodeId);
        metrics.recordNodeDestroyed(trigger);
        log.info("Node {} destroyed ({})", nodeId, trigger);
        return true;
    }

    // ── Internals ───────────────────────────────────────────────────────

    private Node require(String nodeId) {
        return nodeStore.findById(nodeId).orElseThrow(() -> new NodeNotFoundException(nodeId));
    }

    /** Runs {@code work} in the node's mailbox and waits for it. */
    private <T> T call(String nodeId, Callable<T> work) {
        try {
            return nodeUnits.submit(OwnerType.NODE.unitKey(nodeId), () -> {
                MdcContext.setNode(nodeId);
                try {
                    return work.call();
                } finally {
                    MdcContext.clearNode();
                }
            }).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
