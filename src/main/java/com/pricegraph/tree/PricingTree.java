package com.pricegraph.tree;

import com.pricegraph.finding.Finding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of a pricing graph, produced by
 * {@link com.pricegraph.ingest.TreeParser}.
 *
 * @param id             Tree version id, may be null
 * @param status         Tree status as written (DRAFT, ACTIVE, ...), may be null
 * @param rootNodeIds    Entry points in declaration order
 * @param nodes          Nodes in declaration order; duplicate ids are kept
 * @param edges          Edges in declaration order; duplicate ids are kept
 * @param meta           Base pricing block
 * @param ingestFindings Shape problems found while parsing
 */
public record PricingTree(
        String id,
        String status,
        List<String> rootNodeIds,
        List<TreeNode> nodes,
        List<TreeEdge> edges,
        PricingMeta meta,
        List<Finding> ingestFindings
) {

    public PricingTree {
        rootNodeIds = List.copyOf(rootNodeIds);
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        ingestFindings = List.copyOf(ingestFindings);
    }

    public boolean isDraft() {
        return "DRAFT".equals(status);
    }

    public boolean isActive() {
        return "ACTIVE".equals(status);
    }

    /**
     * Nodes by id. When ids repeat the last declaration wins.
     */
    public Map<String, TreeNode> nodesById() {
        Map<String, TreeNode> byId = new LinkedHashMap<>();
        for (TreeNode node : nodes) {
            byId.put(node.id(), node);
        }
        return byId;
    }

    public boolean hasIngestErrors() {
        return ingestFindings.stream().anyMatch(Finding::isError);
    }

    /**
     * Copy of this tree with the given nodes and edges forced to ENABLED.
     */
    public PricingTree withEnabled(Set<String> nodeIds, Set<String> edgeIds) {
        List<TreeNode> newNodes = new ArrayList<>(nodes.size());
        for (TreeNode node : nodes) {
            newNodes.add(nodeIds.contains(node.id()) ? node.withStatus(EntityStatus.ENABLED) : node);
        }
        List<TreeEdge> newEdges = new ArrayList<>(edges.size());
        for (TreeEdge edge : edges) {
            newEdges.add(edgeIds.contains(edge.id()) ? edge.withStatus(EntityStatus.ENABLED) : edge);
        }
        return new PricingTree(id, status, rootNodeIds, newNodes, newEdges, meta, ingestFindings);
    }
}
