package com.pricegraph.typecheck;

import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.ExprContext;
import com.pricegraph.ref.InferredType;
import com.pricegraph.ref.Ref;
import com.pricegraph.ref.RefContract;
import com.pricegraph.ref.RefKind;
import com.pricegraph.ref.RefVisitor;
import com.pricegraph.ref.ValueType;
import com.pricegraph.symbol.ComputeSymbol;
import com.pricegraph.symbol.InputSymbol;
import com.pricegraph.symbol.SymbolTable;
import com.pricegraph.tree.NodeType;

import java.util.List;
import java.util.Map;

/**
 * Checks that a ref is legal in its context and points at something that exists.
 * <p>
 * Rules:
 * - Context legality is checked first; an illegal ref is not resolved further
 * - selectionRef/effectiveRef need a known INPUT selection key
 * - nodeOutputRef must target a declared output of a COMPUTE node
 * - envRef must name an allowlisted env key
 * - constants must be scalar
 */
public final class RefResolver {

    private RefResolver() {
    }

    /**
     * Resolve a ref.
     *
     * @param ref      Ref to resolve
     * @param context  Context the enclosing expression is evaluated in
     * @param table    Symbol table of the tree
     * @param path     Path of the ref itself (usually {@code <expr>.ref})
     * @param entityId Owning node or edge id, may be null
     * @return findings, empty when the ref resolves
     */
    public static List<Finding> resolve(Ref ref, ExprContext context, SymbolTable table,
                                        String path, String entityId) {
        if (!RefContract.isAllowed(ref.kind(), context)) {
            if (ref.kind() == RefKind.PRICEBOOK) {
                return List.of(Finding.error(FindingCodes.PRICEBOOK_REF_FORBIDDEN_CONTEXT,
                        "pricebookRef is not allowed in " + context + " context", path, entityId,
                        Finding.context("ctx", context.name())));
            }
            return List.of(Finding.error(FindingCodes.REF_FORBIDDEN_CONTEXT,
                    "Ref kind '" + ref.kind() + "' is not allowed in " + context + " context", path, entityId,
                    Finding.context("ctx", context.name(), "refKind", ref.kind().toString())));
        }
        return ref.accept(new Resolution(table, path, entityId));
    }

    /**
     * Static type of a ref's runtime value. Refs that do not resolve infer NULL.
     */
    public static InferredType inferType(Ref ref, SymbolTable table) {
        return ref.accept(new Inference(table));
    }

    // ========================================================================
    // Resolution
    // ========================================================================

    private static final class Resolution implements RefVisitor<List<Finding>> {

        private final SymbolTable table;
        private final String path;
        private final String entityId;

        Resolution(SymbolTable table, String path, String entityId) {
            this.table = table;
            this.path = path;
            this.entityId = entityId;
        }

        @Override
        public List<Finding> visitConstant(Ref.Constant ref) {
            if (RefContract.constantValueToType(ref.value()) == ValueType.JSON) {
                return List.of(Finding.error(FindingCodes.EXPR_TYPE_MISMATCH,
                        "constant value must be NUMBER|BOOLEAN|TEXT|NULL", path, entityId,
                        Finding.context("actualType", "JSON")));
            }
            return List.of();
        }

        @Override
        public List<Finding> visitSelection(Ref.Selection ref) {
            return selectionKey(ref.kind().toString(), ref.selectionKey());
        }

        @Override
        public List<Finding> visitEffective(Ref.Effective ref) {
            return selectionKey(ref.kind().toString(), ref.selectionKey());
        }

        private List<Finding> selectionKey(String refKind, String selectionKey) {
            if (isBlank(selectionKey)) {
                return List.of(unresolved("Invalid selectionKey for " + refKind,
                        Finding.context("refKind", refKind)));
            }
            if (table.input(selectionKey) == null) {
                return List.of(unresolved("Unresolved selectionKey '" + selectionKey + "'",
                        Finding.context("refKind", refKind, "selectionKey", selectionKey)));
            }
            return List.of();
        }

        @Override
        public List<Finding> visitNodeOutput(Ref.NodeOutput ref) {
            String nodeId = ref.nodeId();
            String outputKey = ref.outputKey();
            if (isBlank(nodeId) || isBlank(outputKey)) {
                return List.of(unresolved("Invalid nodeOutputRef address",
                        Finding.context("refKind", ref.kind().toString())));
            }

            NodeType nodeType = table.nodeType(nodeId);
            if (nodeType == null) {
                return List.of(unresolved("Unresolved nodeId '" + nodeId + "'",
                        Finding.context("refKind", ref.kind().toString(), "nodeId", nodeId)));
            }
            switch (nodeType) {
                case GROUP:
                    return List.of(Finding.error(FindingCodes.GROUP_NODE_REFERENCED,
                            "GROUP node '" + nodeId + "' cannot be referenced", path, entityId,
                            Finding.context("nodeId", nodeId)));
                case EFFECT:
                    return List.of(Finding.error(FindingCodes.EFFECT_REF_FORBIDDEN,
                            "EFFECT outputs cannot be referenced", path, entityId,
                            Finding.context("nodeId", nodeId, "outputKey", outputKey)));
                case COMPUTE:
                    break;
                default:
                    return List.of(Finding.error(FindingCodes.NODE_OUTPUT_REF_INVALID_TARGET,
                            "nodeOutputRef must target a COMPUTE node (got " + nodeType + ")", path, entityId,
                            Finding.context("nodeId", nodeId, "nodeType", nodeType.name())));
            }

            ComputeSymbol compute = table.compute(nodeId);
            if (compute == null || !compute.outputs().containsKey(outputKey)) {
                return List.of(unresolved("Unresolved compute output '" + outputKey + "' on node '" + nodeId + "'",
                        Finding.context("nodeId", nodeId, "outputKey", outputKey)));
            }
            return List.of();
        }

        @Override
        public List<Finding> visitEnv(Ref.Env ref) {
            if (isBlank(ref.envKey())) {
                return List.of(unresolved("Invalid envKey for envRef",
                        Finding.context("refKind", ref.kind().toString())));
            }
            if (!table.envKeys().contains(ref.envKey())) {
                return List.of(unresolved("Unresolved envKey '" + ref.envKey() + "'",
                        Finding.context("envKey", ref.envKey())));
            }
            return List.of();
        }

        @Override
        public List<Finding> visitPricebook(Ref.Pricebook ref) {
            if (isBlank(ref.key())) {
                return List.of(unresolved("Invalid pricebook key",
                        Finding.context("refKind", ref.kind().toString())));
            }
            return List.of();
        }

        @Override
        public List<Finding> visitOptionValueParam(Ref.OptionValueParam ref) {
            return optionParam(ref.kind().toString(), ref.selectionKey(), ref.paramPath());
        }

        @Override
        public List<Finding> visitOptionValueParamJson(Ref.OptionValueParamJson ref) {
            return optionParam(ref.kind().toString(), ref.selectionKey(), ref.paramPath());
        }

        private List<Finding> optionParam(String refKind, String selectionKey, String paramPath) {
            List<Finding> keyFindings = selectionKey(refKind, selectionKey);
            if (!keyFindings.isEmpty()) {
                return keyFindings;
            }
            if (isBlank(paramPath)) {
                return List.of(unresolved("Invalid paramPath for " + refKind,
                        Finding.context("refKind", refKind, "selectionKey", selectionKey)));
            }
            return List.of();
        }

        private Finding unresolved(String message, Map<String, Object> context) {
            return Finding.error(FindingCodes.EXPR_REF_UNRESOLVED, message, path, entityId, context);
        }
    }

    // ========================================================================
    // Inference
    // ========================================================================

    private static final class Inference implements RefVisitor<InferredType> {

        private final SymbolTable table;

        Inference(SymbolTable table) {
            this.table = table;
        }

        @Override
        public InferredType visitConstant(Ref.Constant ref) {
            ValueType type = RefContract.constantValueToType(ref.value());
            return type == ValueType.NULL ? InferredType.UNKNOWN : InferredType.of(type);
        }

        @Override
        public InferredType visitSelection(Ref.Selection ref) {
            InputSymbol symbol = table.input(ref.selectionKey());
            if (symbol == null || symbol.type() == ValueType.NULL) {
                return InferredType.UNKNOWN;
            }
            // a raw selection may be missing at runtime
            return InferredType.nullable(symbol.type());
        }

        @Override
        public InferredType visitEffective(Ref.Effective ref) {
            InputSymbol symbol = table.input(ref.selectionKey());
            if (symbol == null || symbol.type() == ValueType.NULL) {
                return InferredType.UNKNOWN;
            }
            return new InferredType(symbol.type(), !symbol.hasDefault());
        }

        @Override
        public InferredType visitNodeOutput(Ref.NodeOutput ref) {
            ComputeSymbol compute = table.compute(ref.nodeId());
            ValueType type = compute == null ? null : compute.outputs().get(ref.outputKey());
            if (type == null || type == ValueType.NULL) {
                return InferredType.UNKNOWN;
            }
            return InferredType.of(type);
        }

        @Override
        public InferredType visitEnv(Ref.Env ref) {
            return InferredType.of(ValueType.NUMBER);
        }

        @Override
        public InferredType visitPricebook(Ref.Pricebook ref) {
            return InferredType.of(ValueType.NUMBER);
        }

        @Override
        public InferredType visitOptionValueParam(Ref.OptionValueParam ref) {
            return new InferredType(ValueType.NUMBER, !ref.hasDefault());
        }

        @Override
        public InferredType visitOptionValueParamJson(Ref.OptionValueParamJson ref) {
            return new InferredType(ValueType.JSON, !ref.hasDefault());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
