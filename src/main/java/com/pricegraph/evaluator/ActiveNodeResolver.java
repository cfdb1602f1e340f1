package com.pricegraph.evaluator;

import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Walks the tree from its roots to find the nodes active for a set of selections.
 * <p>
 * Rules:
 * - Roots that are unknown, not ENABLED or GROUP are skipped
 * - Only ENABLED edges between ENABLED, non-GROUP nodes are followed
 * - Outgoing edges are bucketed by priority, lowest first
 * - Within a bucket edges are tried in id order; the first whose condition
 *   holds (or that has none) wins and the others are ignored
 * - Every bucket gets its own winner, so a node may activate several children
 */
public class ActiveNodeResolver {

    private static final Logger log = LoggerFactory.getLogger(ActiveNodeResolver.class);

    private static final Comparator<TreeEdge> BY_ID = Comparator.comparing(TreeEdge::id);

    /**
     * Resolve the active node ids.
     *
     * @param tree    Tree to walk
     * @param context Evaluation context for edge conditions
     * @return active node ids in activation order
     */
    public Set<String> resolve(PricingTree tree, EvaluationContext context) {
        Map<String, TreeNode> nodesById = tree.nodesById();
        Map<String, List<TreeEdge>> outgoing = outgoingEdges(tree, nodesById);

        Set<String> active = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        for (String rootId : tree.rootNodeIds()) {
            TreeNode root = nodesById.get(rootId);
            if (root == null || !root.isRuntime()) {
                log.trace("Skipping root '{}'", rootId);
                continue;
            }
            if (active.add(rootId)) {
                queue.add(rootId);
            }
        }

        while (!queue.isEmpty()) {
            String current = queue.poll();
            Map<Integer, List<TreeEdge>> byPriority = new TreeMap<>();
            for (TreeEdge edge : outgoing.getOrDefault(current, List.of())) {
                byPriority.computeIfAbsent(edge.effectivePriority(), p -> new ArrayList<>()).add(edge);
            }

            for (Map.Entry<Integer, List<TreeEdge>> bucket : byPriority.entrySet()) {
                List<TreeEdge> candidates = bucket.getValue();
                candidates.sort(BY_ID);
                for (TreeEdge edge : candidates) {
                    boolean matches = ExpressionEvaluator.test(edge.condition(), context);
                    log.trace("Node '{}', priority {}, edge '{}': condition = {}",
                            current, bucket.getKey(), edge.id(), matches);
                    if (!matches) {
                        continue;
                    }
                    if (active.add(edge.toNodeId())) {
                        queue.add(edge.toNodeId());
                    }
                    // first match per priority
                    break;
                }
            }
        }

        log.debug("Resolved {} active node(s) for tree {}", active.size(), tree.id());
        return active;
    }

    private static Map<String, List<TreeEdge>> outgoingEdges(PricingTree tree, Map<String, TreeNode> nodesById) {
        Map<String, List<TreeEdge>> outgoing = new HashMap<>();
        for (TreeEdge edge : tree.edges()) {
            if (!edge.isEnabled()) {
                continue;
            }
            TreeNode from = nodesById.get(edge.fromNodeId());
            TreeNode to = nodesById.get(edge.toNodeId());
            if (from == null || to == null || !from.isRuntime() || !to.isRuntime()) {
                continue;
            }
            outgoing.computeIfAbsent(edge.fromNodeId(), id -> new ArrayList<>()).add(edge);
        }
        return outgoing;
    }
}
