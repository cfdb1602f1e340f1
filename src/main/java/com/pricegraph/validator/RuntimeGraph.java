package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.Severity;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The part of a tree that takes part in evaluation: ENABLED non-GROUP nodes
 * and the ENABLED edges between them. Shared by the publish and restore checks.
 */
final class RuntimeGraph {

    private static final Comparator<TreeEdge> BY_PRIORITY_THEN_ID = Comparator
            .comparingInt(TreeEdge::effectivePriority)
            .thenComparing(TreeEdge::id);

    private final PricingTree tree;
    private final Map<String, TreeNode> nodesById;
    private final Map<String, List<TreeEdge>> outgoing = new TreeMap<>();

    RuntimeGraph(PricingTree tree) {
        this.tree = tree;
        this.nodesById = tree.nodesById();
        for (TreeEdge edge : tree.edges()) {
            if (isRuntimeEdge(edge)) {
                outgoing.computeIfAbsent(edge.fromNodeId(), id -> new ArrayList<>()).add(edge);
            }
        }
        for (List<TreeEdge> edges : outgoing.values()) {
            edges.sort(BY_PRIORITY_THEN_ID);
        }
    }

    private boolean isRuntimeEdge(TreeEdge edge) {
        if (!edge.isEnabled() || edge.fromNodeId() == null || edge.toNodeId() == null) {
            return false;
        }
        TreeNode from = nodesById.get(edge.fromNodeId());
        TreeNode to = nodesById.get(edge.toNodeId());
        return from != null && to != null && from.isRuntime() && to.isRuntime();
    }

    Optional<Finding> cycleFinding() {
        List<String> nodeIds = new ArrayList<>();
        for (TreeNode node : tree.nodes()) {
            if (node.isRuntime()) {
                nodeIds.add(node.id());
            }
        }
        Map<String, List<String>> successors = new TreeMap<>();
        for (Map.Entry<String, List<TreeEdge>> entry : outgoing.entrySet()) {
            List<String> targets = new ArrayList<>();
            for (TreeEdge edge : entry.getValue()) {
                targets.add(edge.toNodeId());
            }
            successors.put(entry.getKey(), targets);
        }
        return CycleDetector.findCycle(nodeIds, successors)
                .map(cycle -> Finding.error(FindingCodes.GRAPH_CYCLE,
                        "Runtime dependency graph (ENABLED nodes/edges) must be acyclic", "tree", null,
                        Finding.context("cycle", cycle)));
    }

    /**
     * Nodes reachable from valid roots, skipping edges whose condition is
     * provably UNSAT.
     */
    Set<String> reachableFromRoots() {
        Set<String> reachable = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String rootId : tree.rootNodeIds()) {
            TreeNode root = nodesById.get(rootId);
            if (root != null && root.isRuntime() && reachable.add(rootId)) {
                queue.add(rootId);
            }
        }
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (TreeEdge edge : outgoing.getOrDefault(current, List.of())) {
                if (UnsatProver.isProvablyUnsat(edge.condition())) {
                    continue;
                }
                if (reachable.add(edge.toNodeId())) {
                    queue.add(edge.toNodeId());
                }
            }
        }
        return reachable;
    }

    /**
     * ENABLED INPUT nodes marked required that are not reachable.
     */
    List<Finding> unreachableRequiredInputs(Set<String> reachable) {
        List<Finding> findings = new ArrayList<>();
        for (TreeNode node : tree.nodes()) {
            if (isRequiredInput(node) && !reachable.contains(node.id())) {
                findings.add(Finding.error(FindingCodes.REQUIRED_INPUT_UNREACHABLE,
                        "Required INPUT node is unreachable from roots under potentially satisfiable conditions",
                        "tree.nodes[" + node.id() + "]", node.id(),
                        Finding.context("selectionKey", node.input().selectionKey())));
            }
        }
        return findings;
    }

    static boolean isRequiredInput(TreeNode node) {
        return node.isEnabled() && node.is(NodeType.INPUT) && node.input() != null && node.input().required();
    }

    /**
     * Same-source, same-priority ENABLED edges of which more than one may match.
     */
    static List<Finding> ambiguity(List<TreeEdge> edges, boolean strict) {
        Map<String, Map<Integer, List<TreeEdge>>> bySource = new TreeMap<>();
        for (TreeEdge edge : edges) {
            if (!edge.isEnabled() || edge.fromNodeId() == null || edge.toNodeId() == null) {
                continue;
            }
            bySource.computeIfAbsent(edge.fromNodeId(), id -> new TreeMap<>())
                    .computeIfAbsent(edge.effectivePriority(), p -> new ArrayList<>())
                    .add(edge);
        }

        List<Finding> findings = new ArrayList<>();
        Severity severity = strict ? Severity.ERROR : Severity.WARNING;
        for (Map.Entry<String, Map<Integer, List<TreeEdge>>> source : bySource.entrySet()) {
            for (Map.Entry<Integer, List<TreeEdge>> bucket : source.getValue().entrySet()) {
                List<String> candidates = new ArrayList<>();
                for (TreeEdge edge : bucket.getValue()) {
                    if (!UnsatProver.isProvablyUnsat(edge.condition())) {
                        candidates.add(edge.id());
                    }
                }
                if (candidates.size() <= 1) {
                    continue;
                }
                candidates.sort(Comparator.naturalOrder());
                findings.add(Finding.of(severity, FindingCodes.EDGE_AMBIGUOUS_MATCH,
                        "Multiple outgoing edges can match with the same priority", "tree.edges", null,
                        Finding.context("fromNodeId", source.getKey(), "priority", bucket.getKey(),
                                "edgeIds", candidates)));
            }
        }
        return findings;
    }
}
