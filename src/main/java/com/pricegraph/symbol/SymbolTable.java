package com.pricegraph.symbol;

import com.pricegraph.ref.EnvKeys;
import com.pricegraph.tree.NodeType;

import java.util.Map;

/**
 * Lookup tables used by ref resolution and type checking.
 *
 * @param nodeTypesById       Type of every node with a known type
 * @param inputBySelectionKey INPUT symbols by selection key
 * @param computeByNodeId     COMPUTE symbols by node id
 * @param envKeys             Env keys an envRef may name
 */
public record SymbolTable(
        Map<String, NodeType> nodeTypesById,
        Map<String, InputSymbol> inputBySelectionKey,
        Map<String, ComputeSymbol> computeByNodeId,
        EnvKeys envKeys
) {

    public SymbolTable {
        nodeTypesById = Map.copyOf(nodeTypesById);
        inputBySelectionKey = Map.copyOf(inputBySelectionKey);
        computeByNodeId = Map.copyOf(computeByNodeId);
    }

    public InputSymbol input(String selectionKey) {
        return selectionKey == null ? null : inputBySelectionKey.get(selectionKey);
    }

    public NodeType nodeType(String nodeId) {
        return nodeId == null ? null : nodeTypesById.get(nodeId);
    }

    public ComputeSymbol compute(String nodeId) {
        return nodeId == null ? null : computeByNodeId.get(nodeId);
    }
}
