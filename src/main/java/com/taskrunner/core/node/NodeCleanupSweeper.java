package com.taskrunner.core.node;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.metrics.TaskRunnerMetrics;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.WorkspaceStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic backstop for the node pool, independent of per-node alarms:
 * <ul>
 *   <li>warm nodes past their timeout (plus a grace period) whose own alarm never fired
 *       are destroyed, or returned to running if they still host workspaces;</li>
 *   <li>auto-provisioned nodes past their maximum lifetime are destroyed;</li>
 *   <li>nodes that stopped sending heartbeats are marked stale.</li>
 * </ul>
 * All writes go through {@link NodeLifecycleManager}.
 */
@Service
public class NodeCleanupSweeper {

    private static final Logger log = LoggerFactory.getLogger(NodeCleanupSweeper.class);

    private final NodeStore nodeStore;
    private final WorkspaceStore workspaceStore;
    private final NodeLifecycleManager lifecycle;
    private final TaskRunnerMetrics metrics;
    private final Clock clock;
    private final TaskRunnerProperties.Nodes settings;

    private ScheduledExecutorService scheduler;

    public record SweepResult(int destroyed, int reactivated, int markedStale, int failures) {}

    public NodeCleanupSweeper(NodeStore nodeStore, WorkspaceStore workspaceStore, NodeLifecycleManager lifecycle,
                              TaskRunnerMetrics metrics, Clock clock, TaskRunnerProperties properties) {
        this.nodeStore = nodeStore;
        this.workspaceStore = workspaceStore;
        this.lifecycle = lifecycle;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = properties.getNodes();
    }

    @PostConstruct
    void start() {
        if (!settings.isSweepEnabled()) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "node-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalSeconds = settings.getSweepInterval().toSeconds();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Node cleanup sweeper started (interval={}s)", intervalSeconds);
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
            log.error("Node cleanup sweep failed", e);
        }
    }

    public SweepResult sweep() {
        long start = System.currentTimeMillis();
        Instant now = clock.instant();
        int destroyed = 0;
        int reactivated = 0;
        int stale = 0;
        int failures = 0;

        Instant warmCutoff = now.minus(settings.getWarmTimeout()).minus(settings.getWarmSweepGrace());
        for (Node node : nodeStore.findWarmSince(warmCutoff)) {
            try {
                if (workspaceStore.countActiveOnNode(node.id()) > 0) {
                    if (lifecycle.reactivate(node.id())) {
                        reactivated++;
                    }
                } else if (lifecycle.destroyIfExpiredWarm(node.id(), warmCutoff)) {
                    destroyed++;
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Could not clean up expired warm node {}", node.id(), e);
            }
        }

        for (Node node : nodeStore.findAutoProvisionedCreatedBefore(now.minus(settings.getMaxLifetime()))) {
            try {
                if (lifecycle.destroy(node.id(), "lifetime_sweep")) {
                    destroyed++;
                }
            } catch (RuntimeException e) {
                failures++;
                log.error("Could not destroy node {} past its maximum lifetime", node.id(), e);
            }
        }

        Instant heartbeatCutoff = now.minus(settings.getHeartbeatStaleAfter());
        for (Node node : nodeStore.findByStatuses(EnumSet.of(NodeStatus.RUNNING, NodeStatus.WARM))) {
            if (node.health() == NodeHealth.HEALTHY && node.lastHeartbeatAt() != null
                    && node.lastHeartbeatAt().isBefore(heartbeatCutoff) && lifecycle.markStale(node.id())) {
                stale++;
            }
        }

        metrics.recordSweepDuration("nodes", System.currentTimeMillis() - start);
        if (destroyed + reactivated + stale + failures > 0) {
            log.info("Node sweep: {} destroyed, {} returned to running, {} stale, {} failed",
                    destroyed, reactivated, stale, failures);
        }
        return new SweepResult(destroyed, reactivated, stale, failures);
    }
}
