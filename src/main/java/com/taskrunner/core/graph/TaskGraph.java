package com.taskrunner.core.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable adjacency structure of task dependencies: each task id maps to the ids it
 * depends on. Used to reject edges that would introduce a cycle before they are stored.
 */
public final class TaskGraph {

    private enum Mark { VISITING, DONE }

    private final Map<String, Set<String>> edges;

    public TaskGraph(Map<String, ? extends Collection<String>> adjacency) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        adjacency.forEach((task, deps) -> copy.put(task, new LinkedHashSet<>(deps)));
        this.edges = copy;
    }

    public static TaskGraph empty() {
        return new TaskGraph(Map.of());
    }

    /** A copy of this graph with the extra edges {@code taskId -> dependsOn}. */
    public TaskGraph withEdges(String taskId, Collection<String> dependsOn) {
        Map<String, Set<String>> next = new LinkedHashMap<>(edges);
        Set<String> deps = new LinkedHashSet<>(next.getOrDefault(taskId, Set.of()));
        deps.addAll(dependsOn);
        next.put(taskId, deps);
        return new TaskGraph(next);
    }

    public Set<String> dependenciesOf(String taskId) {
        return Set.copyOf(edges.getOrDefault(taskId, Set.of()));
    }

    /**
     * Depth-first search for a cycle.
     *
     * @return the cycle as a path whose first and last element are the same id, if any
     */
    public Optional<List<String>> findCycle() {
        Map<String, Mark> marks = new HashMap<>();
        List<String> path = new ArrayList<>();
        for (String start : edges.keySet()) {
            if (!marks.containsKey(start)) {
                List<String> cycle = visit(start, marks, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    public void requireAcyclic() {
        findCycle().ifPresent(cycle -> {
            throw new DependencyCycleException(cycle);
        });
    }

    private List<String> visit(String node, Map<String, Mark> marks, List<String> path) {
        marks.put(node, Mark.VISITING);
        path.add(node);
        for (String next : edges.getOrDefault(node, Set.of())) {
            Mark mark = marks.get(next);
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                cycle.add(next);
                return cycle;
            }
            if (mark == null) {
                List<String> cycle = visit(next, marks, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        marks.put(node, Mark.DONE);
        return null;
    }
}
