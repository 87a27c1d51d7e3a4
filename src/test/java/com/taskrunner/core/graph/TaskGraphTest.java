package com.taskrunner.core.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskGraphTest {

    @Test
    @DisplayName("a chain of dependencies has no cycle")
    void chainIsAcyclic() {
        TaskGraph graph = new TaskGraph(Map.of(
                "deploy", List.of("test"),
                "test", List.of("build")));

        assertTrue(graph.findCycle().isEmpty());
        assertDoesNotThrow(graph::requireAcyclic);
    }

    @Test
    @DisplayName("a diamond shares a dependency without forming a cycle")
    void diamondIsAcyclic() {
        TaskGraph graph = new TaskGraph(Map.of(
                "release", List.of("docs", "binaries"),
                "docs", List.of("build"),
                "binaries", List.of("build")));

        assertTrue(graph.findCycle().isEmpty());
    }

    @Test
    @DisplayName("an edge closing a loop is reported with the full path")
    void closingEdge() {
        TaskGraph graph = new TaskGraph(Map.of(
                "a", List.of("b"),
                "b", List.of("c")));

        TaskGraph withLoop = graph.withEdges("c", List.of("a"));

        List<String> cycle = withLoop.findCycle().orElseThrow();
        assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
        assertEquals(Set.of("a", "b", "c"), Set.copyOf(cycle));
        assertEquals(4, cycle.size());

        DependencyCycleException thrown = assertThrows(DependencyCycleException.class, withLoop::requireAcyclic);
        assertEquals(cycle, thrown.getCycle());
        assertTrue(thrown.getMessage().contains(" -> "));
    }

    @Test
    @DisplayName("a task depending on itself is a cycle")
    void selfLoop() {
        TaskGraph graph = TaskGraph.empty().withEdges("a", List.of("a"));

        assertEquals(List.of("a", "a"), graph.findCycle().orElseThrow());
    }

    @Test
    @DisplayName("withEdges leaves the original graph untouched")
    void withEdgesCopies() {
        TaskGraph graph = new TaskGraph(Map.of("a", List.of("b")));

        TaskGraph extended = graph.withEdges("a", List.of("c"));

        assertEquals(Set.of("b"), graph.dependenciesOf("a"));
        assertEquals(Set.of("b", "c"), extended.dependenciesOf("a"));
        assertEquals(Set.of(), extended.dependenciesOf("unknown"));
    }
}
