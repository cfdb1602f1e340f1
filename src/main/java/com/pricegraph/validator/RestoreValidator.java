package com.pricegraph.validator;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ingest.JsonValues;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.symbol.SymbolTableBuilder;
import com.pricegraph.symbol.SymbolTableResult;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;
import com.pricegraph.typecheck.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Checks bringing DELETED nodes and edges back into a DRAFT tree.
 * <p>
 * Restored ids are treated as ENABLED, then the graph is re-checked:
 * - key and selection key collisions that involve a restored node
 * - edge conditions still type check
 * - no ENABLED edge points at a DELETED endpoint
 * - runtime cycles, ambiguous edges and required INPUT reachability
 */
public class RestoreValidator implements TreeValidator {

    private static final Logger log = LoggerFactory.getLogger(RestoreValidator.class);

    private final RestoreChangeSet changeSet;
    private final ValidationPolicy policy;
    private final EnvKeys envKeys;

    public RestoreValidator(RestoreChangeSet changeSet, ValidationPolicy policy, EnvKeys envKeys) {
        this.changeSet = changeSet;
        this.policy = policy;
        this.envKeys = envKeys;
    }

    @Override
    public ValidationResult validate(PricingTree original) {
        List<Finding> findings = new ArrayList<>();
        if (!"DRAFT".equals(JsonValues.upper(original.status()))) {
            findings.add(Finding.error(FindingCodes.RESTORE_NOT_IN_DRAFT, "Restore is allowed only in DRAFT trees",
                    "tree.status", null, Finding.context("status", original.status())));
        }

        PricingTree tree = original.withEnabled(changeSet.restoredNodeIds(), changeSet.restoredEdgeIds());
        SymbolTableResult symbols = SymbolTableBuilder.build(tree, envKeys);
        findings.addAll(tree.ingestFindings());
        findings.addAll(symbols.findings());

        findings.addAll(collisions(tree, TreeNode::key, FindingCodes.RESTORE_KEY_COLLISION,
                "node.key", "key", "collides with existing node.key"));
        findings.addAll(collisions(tree, node -> node.is(NodeType.INPUT) ? node.input().selectionKey() : null,
                FindingCodes.RESTORE_SELECTION_KEY_COLLISION,
                "INPUT.selectionKey", "selectionKey", "collides with existing selectionKey"));

        Map<String, TreeNode> nodesById = tree.nodesById();
        for (TreeEdge edge : tree.edges()) {
            String edgePath = "tree.edges[" + edge.id() + "]";
            if (edge.condition() != null) {
                findings.addAll(TypeChecker.checkCondition(edge.condition(), symbols.table(),
                        edgePath + ".condition", edge.id()).findings());
            }
            if (!edge.isEnabled() || edge.fromNodeId() == null || edge.toNodeId() == null) {
                continue;
            }
            TreeNode from = nodesById.get(edge.fromNodeId());
            TreeNode to = nodesById.get(edge.toNodeId());
            if ((from != null && from.isDeleted()) || (to != null && to.isDeleted())) {
                findings.add(Finding.error(FindingCodes.RESTORE_EDGE_TO_DELETED,
                        "Restored/ENABLED edges must not point to DELETED endpoints", edgePath, edge.id(),
                        Finding.context("fromNodeId", edge.fromNodeId(), "toNodeId", edge.toNodeId(),
                                "fromStatus", from != null ? from.status().name() : null,
                                "toStatus", to != null ? to.status().name() : null)));
            }
        }

        RuntimeGraph graph = new RuntimeGraph(tree);
        graph.cycleFinding().ifPresent(findings::add);
        findings.addAll(RuntimeGraph.ambiguity(tree.edges(), policy.ambiguousEdgesStrict()));
        findings.addAll(graph.unreachableRequiredInputs(graph.reachableFromRoots()));

        if (changeSet.isEmpty()) {
            findings.add(Finding.warning(FindingCodes.RESTORE_EMPTY_CHANGESET,
                    "RestoreChangeSet is empty (no restoredNodeIds/restoredEdgeIds)", "restore", null));
        }

        ValidationResult result = ValidationResult.of(findings);
        log.debug("Restore validation of tree {} ({} node(s), {} edge(s)): ok={}", tree.id(),
                changeSet.restoredNodeIds().size(), changeSet.restoredEdgeIds().size(), result.ok());
        return result;
    }

    /**
     * Collisions among non-DELETED nodes that involve at least one restored node.
     */
    private List<Finding> collisions(PricingTree tree, Function<TreeNode, String> keyOf, String code,
                                     String label, String contextKey, String suffix) {
        Map<String, List<String>> byKey = new TreeMap<>();
        for (TreeNode node : tree.nodes()) {
            String key = node.isDeleted() ? null : keyOf.apply(node);
            if (key != null) {
                byKey.computeIfAbsent(key, k -> new ArrayList<>()).add(node.id());
            }
        }

        Set<String> restored = changeSet.restoredNodeIds();
        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, List<String>> entry : byKey.entrySet()) {
            List<String> ids = entry.getValue();
            if (ids.size() <= 1 || ids.stream().noneMatch(restored::contains)) {
                continue;
            }
            List<String> sorted = new ArrayList<>(ids);
            sorted.sort(null);
            findings.add(Finding.error(code, "Restoring " + label + " '" + entry.getKey() + "' " + suffix,
                    "tree.nodes", null, Finding.context(contextKey, entry.getKey(), "nodeIds", sorted)));
        }
        return findings;
    }
}
