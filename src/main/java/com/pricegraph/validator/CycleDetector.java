package com.pricegraph.validator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed cycle search. Nodes and successors are visited in lexicographic
 * order so the reported cycle is stable.
 */
public final class CycleDetector {

    private CycleDetector() {
    }

    /**
     * Find one cycle.
     *
     * @param nodeIds Nodes to start the search from
     * @param edges   Successors by node id; duplicates and self edges are allowed
     * @return the cycle as {@code [v, ..., v]}, or empty when the graph is acyclic
     */
    public static Optional<List<String>> findCycle(Collection<String> nodeIds, Map<String, List<String>> edges) {
        Map<String, List<String>> adjacency = new TreeMap<>();
        for (String id : nodeIds) {
            adjacency.put(id, new ArrayList<>());
        }
        for (Map.Entry<String, List<String>> entry : edges.entrySet()) {
            adjacency.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).addAll(entry.getValue());
        }
        for (List<String> successors : adjacency.values()) {
            Collections.sort(successors);
        }

        Search search = new Search(adjacency);
        for (String id : new TreeSet<>(nodeIds)) {
            if (!search.visited.contains(id)) {
                List<String> cycle = search.dfs(id);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private static final class Search {

        private final Map<String, List<String>> adjacency;
        private final Set<String> visited = new HashSet<>();
        private final Set<String> onStack = new HashSet<>();
        private final Map<String, String> parent = new HashMap<>();

        Search(Map<String, List<String>> adjacency) {
            this.adjacency = adjacency;
        }

        /**
         * Iterative DFS with an explicit frame stack so long chains do not
         * exhaust the thread stack.
         */
        List<String> dfs(String start) {
            Deque<Frame> stack = new ArrayDeque<>();
            enter(start, stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.successors.hasNext()) {
                    onStack.remove(frame.id);
                    stack.pop();
                    continue;
                }
                String v = frame.successors.next();
                if (!visited.contains(v)) {
                    parent.put(v, frame.id);
                    enter(v, stack);
                } else if (onStack.contains(v)) {
                    return reconstruct(frame.id, v);
                }
            }
            return null;
        }

        private void enter(String id, Deque<Frame> stack) {
            visited.add(id);
            onStack.add(id);
            stack.push(new Frame(id, adjacency.getOrDefault(id, List.of()).iterator()));
        }

        /** Back edge u -> v closes the cycle v -> ... -> u -> v. */
        private List<String> reconstruct(String u, String v) {
            List<String> cycle = new ArrayList<>();
            cycle.add(v);
            String cur = u;
            while (cur != null && !cur.equals(v)) {
                cycle.add(cur);
                cur = parent.get(cur);
            }
            cycle.add(v);
            Collections.reverse(cycle);
            return cycle;
        }

        private record Frame(String id, Iterator<String> successors) {
        }
    }
}
