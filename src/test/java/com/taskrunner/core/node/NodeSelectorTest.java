package com.taskrunner.core.node;

import com.taskrunner.core.config.TaskRunnerProperties;
import com.taskrunner.core.model.Node;
import com.taskrunner.core.model.NodeHealth;
import com.taskrunner.core.model.NodeSize;
import com.taskrunner.core.model.NodeStatus;
import com.taskrunner.core.model.Workspace;
import com.taskrunner.core.model.WorkspaceStatus;
import com.taskrunner.core.scheduling.AlarmKey;
import com.taskrunner.core.scheduling.AlarmKind;
import com.taskrunner.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodeSelectorTest {

    private static final String USER = "alice";

    @Nested
    @DisplayName("rankByLoad")
    class Ranking {

        private final Instant created = Instant.parse("2026-03-02T08:00:00Z");

        private Node node(String id, Double cpu, Double memory, String location, Instant createdAt) {
            return node(id, NodeSize.MEDIUM, cpu, memory, location, createdAt);
        }

        private Node node(String id, NodeSize size, Double cpu, Double memory, String location, Instant createdAt) {
            return new Node(id, USER, NodeStatus.RUNNING, size, location, "srv-" + id, "10.0.0.1",
                    NodeHealth.HEALTHY, cpu, memory, null, null, true, null, createdAt, createdAt);
        }

        @Test
        @DisplayName("the lowest weighted load wins")
        void lowestScoreFirst() {
            Node busy = node("busy", 90.0, 90.0, "nbg1", created);
            Node light = node("light", 50.0, 50.0, "nbg1", created);
            Node medium = node("medium", 70.0, 70.0, "nbg1", created);

            List<Node> ranked = NodeSelector.rankByLoad(List.of(busy, light, medium), NodeSize.MEDIUM,
                    "nbg1", 0.4, 0.6);

            assertEquals(List.of("light", "medium", "busy"), ranked.stream().map(Node::id).toList());
        }

        @Test
        @DisplayName("the score weighs memory more than CPU by default")
        void weightedScore() {
            assertEquals(0.4 * 80 + 0.6 * 20, NodeSelector.loadScore(node("n", 80.0, 20.0, "nbg1", created), 0.4, 0.6),
                    1e-9);
        }

        @Test
        @DisplayName("nodes that never reported metrics rank last")
        void missingMetricsLast() {
            Node silent = node("silent", null, null, "nbg1", created.minusSeconds(3600));
            Node loaded = node("loaded", 79.0, 84.0, "nbg1", created);

            List<Node> ranked = NodeSelector.rankByLoad(List.of(silent, loaded), NodeSize.MEDIUM, "nbg1", 0.4, 0.6);

            assertEquals("loaded", ranked.get(0).id());
        }

        @Test
        @DisplayName("equal scores prefer the requested location, then the oldest node")
        void tieBreakers() {
            Node elsewhere = node("elsewhere", 50.0, 50.0, "fsn1", created.minusSeconds(600));
            Node newer = node("newer", 50.0, 50.0, "nbg1", created);
            Node older = node("older", 50.0, 50.0, "nbg1", created.minusSeconds(60));

            List<Node> ranked = NodeSelector.rankByLoad(List.of(elsewhere, newer, older), NodeSize.MEDIUM,
                    "nbg1", 0.4, 0.6);

            assertEquals(List.of("older", "newer", "elsewhere"), ranked.stream().map(Node::id).toList());
        }

        @Test
        @DisplayName("among equal scores in the same location the requested size beats age")
        void sizeTieBreaker() {
            Node oldSmall = node("old-small", NodeSize.SMALL, 50.0, 50.0, "nbg1", created.minusSeconds(600));
            Node large = node("large", NodeSize.LARGE, 50.0, 50.0, "nbg1", created);
            Node elsewhereLarge = node("elsewhere-large", NodeSize.LARGE, 50.0, 50.0, "fsn1", created.minusSeconds(900));

            List<Node> ranked = NodeSelector.rankByLoad(List.of(oldSmall, elsewhereLarge, large), NodeSize.LARGE,
                    "nbg1", 0.4, 0.6);

            assertEquals(List.of("large", "old-small", "elsewhere-large"), ranked.stream().map(Node::id).toList());
            assertEquals(List.of("old-small", "large", "elsewhere-large"), NodeSelector.rankByLoad(
                    List.of(oldSmall, elsewhereLarge, large), null, "nbg1", 0.4, 0.6).stream().map(Node::id).toList());
        }
    }

    @Nested
    @DisplayName("select")
    class Select {

        private final EngineFixture engine = new EngineFixture();

        @Test
        @DisplayName("a user without nodes needs a new one")
        void noCandidates() {
            NodeSelection selection = engine.selector.select(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.PROVISION_NO_CANDIDATES, selection.outcome());
            assertTrue(selection.requiresProvisioning());
            assertFalse(selection.hasNode());
        }

        @Test
        @DisplayName("a warm node is claimed before any running node is reused")
        void warmBeforeRunning() {
            engine.insertNode(USER, NodeStatus.RUNNING, 10.0, 10.0, true);
            Node warm = engine.insertNode(USER, NodeStatus.WARM);
            engine.alarms.scheduleIn(AlarmKey.node(warm.id(), AlarmKind.WARM_TIMEOUT), Duration.ofMinutes(30));

            NodeSelection selection = engine.selector.select(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.CLAIMED_WARM, selection.outcome());
            assertEquals(warm.id(), selection.node().id());
            assertEquals(NodeStatus.RUNNING, engine.node(warm.id()).status());
            assertNull(engine.node(warm.id()).warmSince());
            assertTrue(engine.alarms.nextFireTime(AlarmKey.node(warm.id(), AlarmKind.WARM_TIMEOUT)).isEmpty());
            assertEquals(1, engine.counter("taskrunner.nodes.warm_claims"));
        }

        @Test
        @DisplayName("preview reports a warm node without claiming it")
        void previewDoesNotClaim() {
            Node warm = engine.insertNode(USER, NodeStatus.WARM);

            NodeSelection selection = engine.selector.preview(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.CLAIMED_WARM, selection.outcome());
            assertEquals(NodeStatus.WARM, engine.node(warm.id()).status());
        }

        @Test
        @DisplayName("warm nodes past their timeout are not handed out")
        void expiredWarmSkipped() {
            engine.insertNode(USER, NodeStatus.WARM);
            engine.clock.advance(Duration.ofMinutes(31));

            NodeSelection selection = engine.selector.select(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.PROVISION_NO_CANDIDATES, selection.outcome());
        }

        @Test
        @DisplayName("the least loaded running node is reused")
        void leastLoadedRunning() {
            engine.insertNode(USER, NodeStatus.RUNNING, 75.0, 80.0, true);
            Node light = engine.insertNode(USER, NodeStatus.RUNNING, 50.0, 50.0, true);
            engine.insertNode(USER, NodeStatus.RUNNING, 70.0, 70.0, false);

            NodeSelection selection = engine.selector.select(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.REUSED_RUNNING, selection.outcome());
            assertEquals(light.id(), selection.node().id());
        }

        @Test
        @DisplayName("other users' nodes are never considered")
        void otherUsersIgnored() {
            engine.insertNode("bob", NodeStatus.RUNNING, 10.0, 10.0, true);
            engine.insertNode("bob", NodeStatus.WARM);

            assertEquals(NodeSelection.Outcome.PROVISION_NO_CANDIDATES,
                    engine.selector.select(USER, NodeSize.MEDIUM, "nbg1").outcome());
        }

        @Test
        @DisplayName("overloaded nodes are at capacity")
        void overThreshold() {
            engine.insertNode(USER, NodeStatus.RUNNING, 95.0, 20.0, true);
            engine.insertNode(USER, NodeStatus.RUNNING, 20.0, 90.0, true);

            assertEquals(NodeSelection.Outcome.PROVISION_ALL_AT_CAPACITY,
                    engine.selector.select(USER, NodeSize.MEDIUM, "nbg1").outcome());
        }

        @Test
        @DisplayName("unhealthy nodes and nodes with stale heartbeats are skipped")
        void unhealthyAndStale() {
            Node unhealthy = engine.insertNode(USER, NodeStatus.RUNNING, 10.0, 10.0, true);
            engine.nodeStore.updateHealth(unhealthy.id(), NodeHealth.UNHEALTHY);
            Node quiet = engine.insertNode(USER, NodeStatus.RUNNING, 10.0, 10.0, true);
            engine.lifecycle.recordHeartbeat(quiet.id(), 10.0, 10.0);
            engine.clock.advance(Duration.ofMinutes(3));

            assertEquals(NodeSelection.Outcome.PROVISION_ALL_AT_CAPACITY,
                    engine.selector.select(USER, NodeSize.MEDIUM, "nbg1").outcome());
        }

        @Test
        @DisplayName("a node that never sent a heartbeat is not stale")
        void neverReportedIsHealthy() {
            Node node = engine.insertNode(USER, NodeStatus.RUNNING);
            engine.clock.advance(Duration.ofHours(1));

            assertTrue(engine.selector.hasCapacity(engine.node(node.id()), engine.clock.instant()));
        }

        @Test
        @DisplayName("a node hosting the maximum number of workspaces is full")
        void workspaceCapacity() {
            TaskRunnerProperties properties = new TaskRunnerProperties();
            properties.getNodes().setMaxWorkspacesPerNode(1);
            EngineFixture small = new EngineFixture(properties);
            Node node = small.insertNode(USER, NodeStatus.RUNNING, 10.0, 10.0, true);
            Instant now = small.clock.instant();
            small.workspaceStore.insert(new Workspace("ws-1", node.id(), USER, "t-1", WorkspaceStatus.RUNNING,
                    null, null, now, now));

            assertEquals(NodeSelection.Outcome.PROVISION_ALL_AT_CAPACITY,
                    small.selector.select(USER, NodeSize.MEDIUM, "nbg1").outcome());
        }

        @Test
        @DisplayName("a user at the node limit cannot get another node")
        void nodeLimit() {
            TaskRunnerProperties properties = new TaskRunnerProperties();
            properties.getNodes().setMaxNodesPerUser(2);
            EngineFixture limited = new EngineFixture(properties);
            limited.insertNode(USER, NodeStatus.RUNNING, 95.0, 95.0, true);
            limited.insertNode(USER, NodeStatus.PROVISIONING);

            NodeSelection selection = limited.selector.select(USER, NodeSize.MEDIUM, "nbg1");

            assertEquals(NodeSelection.Outcome.NODE_LIMIT_REACHED, selection.outcome());
            assertFalse(selection.requiresProvisioning());
        }
    }
}
