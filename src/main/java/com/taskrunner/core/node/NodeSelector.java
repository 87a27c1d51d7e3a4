package com.taskrunner.core.node;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.store.NodeStore;
import com.taskrunner.core.store.WorkspaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Decides where a task runs: a claimed warm node, the least loaded running node with
 * spare capacity, or a signal to provision a new one.
 * <p>
 * The selector never writes node state itself; warm claims go through
 * {@link NodeLifecycleManager#tryClaim(String)}.
 */
@Service
public class NodeSelector {

    private static final Logger log = LoggerFactory.getLogger(NodeSelector.class);

    private final NodeStore nodeStore;
    private final WorkspaceStore workspaceStore;
    private final NodeLifecycleManager lifecycle;
    private final Clock clock;
    private final TaskRunnerProperties.Nodes settings;

    public NodeSelector(NodeStore nodeStore, WorkspaceStore workspaceStore, NodeLifecycleManager lifecycle,
                        Clock clock, TaskRunnerProperties properties) {
        this.nodeStore = nodeStore;
        this.workspaceStore = workspaceStore;
        this.lifecycle = lifecycle;
        this.clock = clock;
        this.settings = properties.getNodes();
    }

    /** Full selection: the first warm candidate that can be claimed wins. */
    public NodeSelection select(String userId, NodeSize size, String location) {
        return run(userId, size, location, false);
    }

    /** Same decision without claiming anything, used to reject submissions up front. */
    public NodeSelection preview(String userId, NodeSize size, String location) {
        return run(userId, size, location, true);
    }

    private NodeSelection run(String userId, NodeSize size, String location, boolean dryRun) {
        Instant now = clock.instant();

        List<Node> warm = nodeStore.findByUserAndStatus(userId, NodeStatus.WARM).stream()
                .filter(node -> isFreshWarm(node, now))
                .sorted(warmPreference(size, location))
                .toList();
        for (Node candidate : warm) {
            if (dryRun) {
                return new NodeSelection(NodeSelection.Outcome.CLAIMED_WARM, candidate);
            }
            if (lifecycle.tryClaim(candidate.id())) {
                Node claimed = nodeStore.findById(candidate.id()).orElse(candidate);
                log.info("Selected warm node {} for user {}", claimed.id(), userId);
                return new NodeSelection(NodeSelection.Outcome.CLAIMED_WARM, claimed);
            }
            log.debug("Warm node {} was claimed by someone else", candidate.id());
        }

        List<Node> running = nodeStore.findByUserAndStatus(userId, NodeStatus.RUNNING);
        List<Node> eligible = running.stream()
                .filter(node -> hasCapacity(node, now))
                .toList();
        List<Node> ranked = rankByLoad(eligible, size, location, settings.getCpuWeight(), settings.getMemoryWeight());
        if (!ranked.isEmpty()) {
            Node chosen = ranked.get(0);
            log.info("Selected running node {} for user {} (load score {})", chosen.id(), userId,
                    chosen.hasMetrics() ? loadScore(chosen, settings.getCpuWeight(), settings.getMemoryWeight()) : "n/a");
            return new NodeSelection(NodeSelection.Outcome.REUSED_RUNNING, chosen);
        }

        if (nodeStore.countOwnedByUser(userId) >= settings.getMaxNodesPerUser()) {
            return NodeSelection.of(NodeSelection.Outcome.NODE_LIMIT_REACHED);
        }
        return NodeSelection.of(running.isEmpty()
                ? NodeSelection.Outcome.PROVISION_NO_CANDIDATES
                : NodeSelection.Outcome.PROVISION_ALL_AT_CAPACITY);
    }

    private boolean isFreshWarm(Node node, Instant now) {
        return node.warmSince() != null
                && node.warmSince().plus(settings.getWarmTimeout()).isAfter(now)
                && node.health() != NodeHealth.UNHEALTHY;
    }

    boolean hasCapacity(Node node, Instant now) {
        if (!isHealthy(node, now)) {
            return false;
        }
        if (node.cpuPercent() != null && node.cpuPercent() > settings.getCpuThresholdPercent()) {
            return false;
        }
        if (node.memoryPercent() != null && node.memoryPercent() > settings.getMemoryThresholdPercent()) {
            return false;
        }
        return workspaceStore.countActiveOnNode(node.id()) < settings.getMaxWorkspacesPerNode();
    }

    /** Healthy and, if the node ever reported, heard from within the staleness window. */
    private boolean isHealthy(Node node, Instant now) {
        if (node.health() != NodeHealth.HEALTHY) {
            return false;
        }
        return node.lastHeartbeatAt() == null
                || node.lastHeartbeatAt().plus(settings.getHeartbeatStaleAfter()).isAfter(now);
    }

    private static Comparator<Node> warmPreference(NodeSize size, String location) {
        return Comparator.comparing((Node node) -> node.size() != size)
                .thenComparing(node -> !Objects.equals(node.location(), location))
                .thenComparing(Node::warmSince, Comparator.reverseOrder());
    }

    // ── Ranking ─────────────────────────────────────────────────────────

    /** Weighted load, lower is better. Only meaningful when the node has reported metrics. */
    public static double loadScore(Node node, double cpuWeight, double memoryWeight) {
        return cpuWeight * node.cpuPercent() + memoryWeight * node.memoryPercent();
    }

    /**
     * Orders candidates best first: lowest load score (nodes without metrics last), then
     * location match, then size match, then oldest node. A {@code null} size or location
     * expresses no preference.
     */
    public static List<Node> rankByLoad(List<Node> candidates, NodeSize size, String location, double cpuWeight,
                                        double memoryWeight) {
        Comparator<Node> byScore = Comparator.comparingDouble(
                node -> node.hasMetrics() ? loadScore(node, cpuWeight, memoryWeight) : Double.MAX_VALUE);
        return candidates.stream()
                .sorted(byScore
                        .thenComparing(node -> location != null && !location.equals(node.location()))
                        .thenComparing(node -> size != null && node.size() != size)
                        .thenComparing(Node::createdAt))
                .toList();
    }
}
