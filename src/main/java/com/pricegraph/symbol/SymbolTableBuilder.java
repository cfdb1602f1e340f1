package com.pricegraph.symbol;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.ref.ValueType;
import com.pricegraph.tree.ComputeSpec;
import com.pricegraph.tree.InputSpec;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scans tree nodes into a {@link SymbolTable}.
 * <p>
 * Every node with a known type is registered regardless of status. An INPUT
 * without a selection key is skipped silently (the validator reports it); an
 * INPUT with an unknown value type is reported and left out, so refs to it
 * resolve as unresolved rather than being type-checked.
 */
public final class SymbolTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(SymbolTableBuilder.class);

    private SymbolTableBuilder() {
    }

    public static SymbolTableResult build(PricingTree tree, EnvKeys envKeys) {
        List<Finding> findings = new ArrayList<>();
        Map<String, NodeType> nodeTypes = new HashMap<>();
        Map<String, InputSymbol> inputs = new HashMap<>();
        Map<String, ComputeSymbol> computes = new HashMap<>();

        for (TreeNode node : tree.nodes()) {
            String base = "tree.nodes[" + node.id() + "]";
            if (node.type() == null) {
                if (!node.isDeleted()) {
                    findings.add(Finding.error(FindingCodes.TREE_NODE_TYPE_UNKNOWN,
                            "Node '" + node.id() + "' has unknown type", base + ".type", node.id(),
                            Finding.context("nodeId", node.id())));
                }
                continue;
            }
            nodeTypes.put(node.id(), node.type());

            if (node.is(NodeType.INPUT)) {
                InputSpec input = node.input();
                if (input.selectionKey() == null) {
                    continue;
                }
                if (input.valueType() == null) {
                    findings.add(Finding.error(FindingCodes.INPUT_TYPE_UNKNOWN,
                            "INPUT '" + node.id() + "' selectionKey '" + input.selectionKey()
                                    + "' has unknown value type",
                            base + ".input.valueType", node.id(),
                            Finding.context("nodeId", node.id(), "selectionKey", input.selectionKey())));
                    continue;
                }
                inputs.put(input.selectionKey(), new InputSymbol(node.id(), input.selectionKey(),
                        input.valueType(), input.hasDefault(), input.enumInput(), input.enumOptions()));
            } else if (node.is(NodeType.COMPUTE)) {
                computes.put(node.id(), computeSymbol(node, findings));
            }
        }

        log.trace("Built symbol table: {} nodes, {} inputs, {} computes",
                nodeTypes.size(), inputs.size(), computes.size());
        return new SymbolTableResult(new SymbolTable(nodeTypes, inputs, computes, envKeys), findings);
    }

    private static ComputeSymbol computeSymbol(TreeNode node, List<Finding> findings) {
        ComputeSpec compute = node.compute();
        String path = "tree.nodes[" + node.id() + "].compute.outputs";
        Map<String, ValueType> typed = new LinkedHashMap<>();
        for (Map.Entry<String, ValueType> output : compute.outputs().entrySet()) {
            if (output.getValue() != null) {
                typed.put(output.getKey(), output.getValue());
            } else if (!node.isDeleted()) {
                findings.add(Finding.error(FindingCodes.COMPUTE_OUTPUT_INVALID,
                        "Compute output '" + output.getKey() + "' has unknown type",
                        path + "." + output.getKey(), node.id(),
                        Finding.context("outputKey", output.getKey())));
            }
        }
        if (!node.isDeleted() && compute.outputs().size() != 1) {
            findings.add(Finding.error(FindingCodes.COMPUTE_OUTPUT_INVALID,
                    "COMPUTE node '" + node.id() + "' must define exactly 1 output key",
                    path, node.id(),
                    Finding.context("outputKeys", new ArrayList<>(compute.outputs().keySet()))));
        }
        return new ComputeSymbol(node.id(), Map.copyOf(typed));
    }
}
