package com.pricegraph.evaluator;

import com.pricegraph.exception.EvaluationException;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.expression.RefCollector;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;

/**
 * Evaluates the active COMPUTE nodes in dependency order and stores their
 * outputs on the context.
 * <p>
 * Order is a Kahn topological sort over nodeOutputRef dependencies with a
 * lexicographically sorted ready queue, so the order is stable across runs.
 * Dependencies on inactive nodes are ignored; they read as null.
 */
public class ComputeEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ComputeEvaluator.class);

    /**
     * @throws EvaluationException if a node has no expression, does not declare
     *                             exactly one output, produces a non-finite number,
     *                             or the dependencies form a cycle
     */
    public void evaluate(PricingTree tree, Set<String> activeNodeIds, EvaluationContext context) {
        Map<String, TreeNode> computeNodes = new TreeMap<>();
        for (TreeNode node : tree.nodes()) {
            if (node.isEnabled() && node.is(NodeType.COMPUTE) && activeNodeIds.contains(node.id())) {
                computeNodes.put(node.id(), node);
            }
        }

        Map<String, String> outputKeys = new HashMap<>();
        for (TreeNode node : computeNodes.values()) {
            if (node.compute() == null || node.compute().expression() == null) {
                throw new EvaluationException("Compute node '" + node.id() + "' has invalid expression");
            }
            String outputKey = node.compute().singleOutputKey();
            if (outputKey == null) {
                throw new EvaluationException("Compute node '" + node.id() + "' must define exactly 1 output key");
            }
            outputKeys.put(node.id(), outputKey);
        }

        for (String nodeId : order(computeNodes)) {
            ExpressionSpec expr = computeNodes.get(nodeId).compute().expression();
            Object value = ExpressionEvaluator.evaluate(expr, context);
            if (value instanceof Number n && !Double.isFinite(n.doubleValue())) {
                throw new EvaluationException("Compute node '" + nodeId + "' produced non-finite value " + n);
            }
            context.putComputeOutput(nodeId, outputKeys.get(nodeId), value);
            log.trace("Compute '{}'.{} = {}", nodeId, outputKeys.get(nodeId), value);
        }
    }

    private static List<String> order(Map<String, TreeNode> computeNodes) {
        Map<String, Set<String>> dependents = new HashMap<>();
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : computeNodes.keySet()) {
            dependents.put(id, new LinkedHashSet<>());
            inDegree.put(id, 0);
        }

        for (TreeNode node : computeNodes.values()) {
            Set<String> deps = new LinkedHashSet<>(RefCollector.nodeOutputTargets(node.compute().expression()));
            for (String dep : deps) {
                if (!computeNodes.containsKey(dep)) {
                    continue;
                }
                dependents.get(dep).add(node.id());
                inDegree.merge(node.id(), 1, Integer::sum);
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String dependent : dependents.get(id)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != computeNodes.size()) {
            throw new EvaluationException("Compute dependency cycle detected during evaluation");
        }
        return order;
    }
}
