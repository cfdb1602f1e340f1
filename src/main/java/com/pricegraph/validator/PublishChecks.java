package com.pricegraph.validator;

import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.expression.RefCollector;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.Severity;
import com.pricegraph.ingest.JsonValues;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.ref.ExprContext;
import com.pricegraph.ref.InferredType;
import com.pricegraph.ref.ValueType;
import com.pricegraph.symbol.SymbolTable;
import com.pricegraph.symbol.SymbolTableBuilder;
import com.pricegraph.symbol.SymbolTableResult;
import com.pricegraph.tree.ChildItemEffect;
import com.pricegraph.tree.EffectOutput;
import com.pricegraph.tree.EntityStatus;
import com.pricegraph.tree.InputSpec;
import com.pricegraph.tree.MaterialEffect;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.NumberConstraints;
import com.pricegraph.tree.PriceComponent;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;
import com.pricegraph.typecheck.TypeCheckResult;
import com.pricegraph.typecheck.TypeChecker;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * One pass of the publish rules over a tree.
 * <p>
 * Findings are split in two buckets. {@code structural} holds what makes a tree
 * unusable in any state: ingest and symbol problems, duplicate ids, broken edge
 * endpoints and priorities, and type errors. {@code publishOnly} holds the
 * readiness rules a draft may still violate.
 */
final class PublishChecks {

    private static final Set<String> PRICE_KINDS = Set.of("FLAT", "PER_UNIT", "PER_OVERAGE", "TIERED");
    private static final Set<String> CHILD_KINDS = Set.of("inlineSku", "productRef");
    private static final Set<String> INVOICE_VISIBILITIES = Set.of("hidden", "rollup", "separateLine");

    /**
     * @param structural  Problems that block saving
     * @param publishOnly Problems that only block publishing
     */
    record Report(List<Finding> structural, List<Finding> publishOnly) {
    }

    private final PricingTree tree;
    private final ValidationPolicy policy;
    private final Map<String, TreeNode> nodesById;
    private final SymbolTable table;
    private final List<Finding> structural = new ArrayList<>();
    private final List<Finding> publishOnly = new ArrayList<>();

    PublishChecks(PricingTree tree, ValidationPolicy policy, EnvKeys envKeys) {
        this.tree = tree;
        this.policy = policy;
        this.nodesById = tree.nodesById();
        SymbolTableResult symbols = SymbolTableBuilder.build(tree, envKeys);
        this.table = symbols.table();
        structural.addAll(tree.ingestFindings());
        structural.addAll(symbols.findings());
    }

    Report run() {
        checkStatus();
        checkDuplicateIds();
        checkRoots();
        checkNodeKeys();
        checkSelectionKeys();
        checkInputConstraints();
        checkEdges();
        publishOnly.addAll(RuntimeGraph.ambiguity(tree.edges(), policy.ambiguousEdgesStrict()));

        RuntimeGraph graph = new RuntimeGraph(tree);
        graph.cycleFinding().ifPresent(publishOnly::add);

        for (TreeNode node : tree.nodes()) {
            if (node.isDeleted() || node.type() == null) {
                continue;
            }
            switch (node.type()) {
                case COMPUTE -> checkCompute(node);
                case PRICE -> checkPrice(node);
                case EFFECT -> checkEffect(node);
                case GROUP -> {
                    if (node.isEnabled()) {
                        publishOnly.add(Finding.info(FindingCodes.GROUP_NODE_IGNORED,
                                "GROUP nodes are excluded from runtime evaluation", nodePath(node), node.id()));
                    }
                }
                default -> {
                    // INPUT payloads are covered by the selection key and constraint checks
                }
            }
        }

        checkComputeDependencies();
        checkReachability(graph);
        return new Report(structural, publishOnly);
    }

    // ========================================================================
    // Tree level
    // ========================================================================

    private void checkStatus() {
        if (!"DRAFT".equals(JsonValues.upper(tree.status()))) {
            publishOnly.add(Finding.error(FindingCodes.TREE_STATUS_INVALID,
                    "Tree status must be DRAFT at time of publish", "tree.status", null,
                    Finding.context("status", tree.status())));
        }
    }

    private void checkDuplicateIds() {
        List<String> duplicateNodes = duplicates(tree.nodes().stream().map(TreeNode::id).toList());
        if (!duplicateNodes.isEmpty()) {
            structural.add(Finding.error(FindingCodes.TREE_DUPLICATE_IDS, "Node IDs must be unique",
                    "tree.nodes", null, Finding.context("duplicateNodeIds", duplicateNodes)));
        }
        List<String> duplicateEdges = duplicates(tree.edges().stream().map(TreeEdge::id).toList());
        if (!duplicateEdges.isEmpty()) {
            structural.add(Finding.error(FindingCodes.TREE_DUPLICATE_IDS, "Edge IDs must be unique",
                    "tree.edges", null, Finding.context("duplicateEdgeIds", duplicateEdges)));
        }
    }

    private static List<String> duplicates(List<String> ids) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new TreeSet<>();
        for (String id : ids) {
            if (!seen.add(id)) {
                duplicates.add(id);
            }
        }
        return new ArrayList<>(duplicates);
    }

    private void checkRoots() {
        if (tree.rootNodeIds().isEmpty()) {
            publishOnly.add(Finding.error(FindingCodes.TREE_NO_ROOTS,
                    "rootNodeIds must exist and include at least one ENABLED runtime node", "tree.rootNodeIds"));
            return;
        }

        int validRoots = 0;
        for (String rootId : tree.rootNodeIds()) {
            TreeNode root = nodesById.get(rootId);
            if (root == null) {
                publishOnly.add(Finding.error(FindingCodes.TREE_ROOT_INVALID,
                        "Root node '" + rootId + "' does not exist", "tree.rootNodeIds", rootId));
            } else if (!root.isEnabled()) {
                publishOnly.add(Finding.error(FindingCodes.TREE_ROOT_INVALID, "Root node must be ENABLED",
                        "tree.nodes[" + rootId + "].status", rootId,
                        Finding.context("status", root.status().name())));
            } else if (root.is(NodeType.GROUP)) {
                publishOnly.add(Finding.error(FindingCodes.TREE_ROOT_INVALID, "Root node cannot be GROUP",
                        "tree.nodes[" + rootId + "].type", rootId));
            } else {
                validRoots++;
            }
        }
        if (validRoots == 0) {
            publishOnly.add(Finding.error(FindingCodes.TREE_NO_ROOTS,
                    "rootNodeIds must include at least one ENABLED runtime node", "tree.rootNodeIds"));
        }
    }

    private void checkNodeKeys() {
        Map<String, List<String>> byKey = new TreeMap<>();
        for (TreeNode node : tree.nodes()) {
            if (!node.isDeleted() && node.key() != null) {
                byKey.computeIfAbsent(node.key(), k -> new ArrayList<>()).add(node.id());
            }
        }
        for (Map.Entry<String, List<String>> entry : byKey.entrySet()) {
            if (entry.getValue().size() > 1) {
                publishOnly.add(Finding.error(FindingCodes.TREE_KEY_COLLISION,
                        "node.key '" + entry.getKey() + "' collides across nodes", "tree.nodes", null,
                        Finding.context("key", entry.getKey(), "nodeIds", sorted(entry.getValue()))));
            }
        }
    }

    // ========================================================================
    // Inputs
    // ========================================================================

    private void checkSelectionKeys() {
        Map<String, List<String>> byKey = new TreeMap<>();
        for (TreeNode node : liveInputs()) {
            String selectionKey = node.input().selectionKey();
            if (selectionKey == null) {
                publishOnly.add(Finding.error(FindingCodes.INPUT_MISSING_SELECTION_KEY,
                        "INPUT must define selectionKey", nodePath(node) + ".input.selectionKey", node.id()));
                continue;
            }
            byKey.computeIfAbsent(selectionKey, k -> new ArrayList<>()).add(node.id());
        }
        for (Map.Entry<String, List<String>> entry : byKey.entrySet()) {
            if (entry.getValue().size() > 1) {
                publishOnly.add(Finding.error(FindingCodes.SELECTION_KEY_COLLISION,
                        "INPUT.selectionKey '" + entry.getKey() + "' collides across INPUT nodes", "tree.nodes", null,
                        Finding.context("selectionKey", entry.getKey(), "nodeIds", sorted(entry.getValue()))));
            }
        }
    }

    private void checkInputConstraints() {
        for (TreeNode node : liveInputs()) {
            InputSpec input = node.input();
            String base = nodePath(node) + ".input";
            String declaredType = JsonValues.upper(input.rawValueType());
            if ("NUMBER".equals(declaredType)) {
                checkNumberInput(node, input, base);
            } else if ("BOOLEAN".equals(declaredType)) {
                if (input.defaultValue() != null && !(input.defaultValue() instanceof Boolean)) {
                    publishOnly.add(Finding.error(FindingCodes.INPUT_CONSTRAINT_INVALID,
                            "BOOLEAN default must be a boolean", base + ".defaultValue", node.id(),
                            Finding.context("defaultValue", input.defaultValue())));
                }
            } else if ("ENUM".equals(declaredType) && input.enumOptions() != null) {
                checkEnumOptions(node, input.enumOptions(), base + ".constraints.enum.options");
            }
        }
    }

    private void checkNumberInput(TreeNode node, InputSpec input, String base) {
        NumberConstraints number = input.number();
        if (number.min() != null && number.max() != null && number.min() > number.max()) {
            publishOnly.add(Finding.error(FindingCodes.INPUT_CONSTRAINT_INVALID,
                    "NUMBER constraints require min <= max", base + ".constraints.number", node.id(),
                    Finding.context("min", number.min(), "max", number.max())));
        }
        if (number.step() != null && !(number.step() > 0)) {
            publishOnly.add(Finding.error(FindingCodes.INPUT_CONSTRAINT_INVALID,
                    "NUMBER constraints require step > 0", base + ".constraints.number.step", node.id(),
                    Finding.context("step", number.step())));
        }
        Double defaultValue = JsonValues.finiteNumber(input.defaultValue());
        if (defaultValue != null && !number.contains(defaultValue)) {
            Map<String, Object> context = Finding.context(
                    "defaultValue", input.defaultValue(), "min", number.min(), "max", number.max());
            if (input.required()) {
                publishOnly.add(Finding.error(FindingCodes.DEFAULT_OUT_OF_RANGE,
                        "Default value is out of range for required input", base + ".defaultValue", node.id(),
                        context));
            } else {
                publishOnly.add(Finding.warning(FindingCodes.DEFAULT_OUT_OF_RANGE,
                        "Default value is out of range", base + ".defaultValue", node.id(), context));
            }
        }
    }

    private void checkEnumOptions(TreeNode node, List<Object> options, String path) {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < options.size(); i++) {
            String value = optionValue(options.get(i));
            if (value.isBlank()) {
                publishOnly.add(Finding.error(FindingCodes.INPUT_CONSTRAINT_INVALID,
                        "ENUM option values must be non-empty strings", path + "[" + i + "]", node.id()));
            } else if (seen.contains(value)) {
                publishOnly.add(Finding.error(FindingCodes.INPUT_CONSTRAINT_INVALID,
                        "ENUM option values must be unique", path, node.id(), Finding.context("value", value)));
            }
            seen.add(value);
        }
    }

    private static String optionValue(Object option) {
        Map<String, Object> map = JsonValues.asMap(option);
        if (map != null) {
            return map.get("value") instanceof String s ? s : "";
        }
        return option instanceof String s ? s : "";
    }

    private List<TreeNode> liveInputs() {
        List<TreeNode> inputs = new ArrayList<>();
        for (TreeNode node : tree.nodes()) {
            if (!node.isDeleted() && node.is(NodeType.INPUT)) {
                inputs.add(node);
            }
        }
        return inputs;
    }

    // ========================================================================
    // Edges
    // ========================================================================

    private void checkEdges() {
        for (TreeEdge edge : tree.edges()) {
            String edgePath = "tree.edges[" + edge.id() + "]";
            if (edge.fromNodeId() == null || edge.toNodeId() == null) {
                structural.add(Finding.error(FindingCodes.EDGE_MISSING_ENDPOINT,
                        "Edge must define fromNodeId and toNodeId", edgePath, edge.id()));
                continue;
            }

            TreeNode from = nodesById.get(edge.fromNodeId());
            TreeNode to = nodesById.get(edge.toNodeId());
            if (from == null || to == null) {
                structural.add(Finding.error(FindingCodes.EDGE_MISSING_ENDPOINT, "Edge endpoints must exist",
                        edgePath, edge.id(),
                        Finding.context("fromNodeId", edge.fromNodeId(), "toNodeId", edge.toNodeId())));
            }
            if (edge.fromNodeId().equals(edge.toNodeId())) {
                structural.add(Finding.error(FindingCodes.EDGE_SELF_LOOP, "Edge fromNodeId must not equal toNodeId",
                        edgePath, edge.id(), Finding.context("nodeId", edge.fromNodeId())));
            }
            if (edge.priority() == null) {
                structural.add(Finding.error(FindingCodes.EDGE_INVALID_PRIORITY, "priority must be integer >= 0",
                        edgePath + ".priority", edge.id(), Finding.context("priority", edge.rawPriority())));
            }
            if (edge.condition() != null) {
                structural.addAll(TypeChecker.checkCondition(edge.condition(), table,
                        edgePath + ".condition", edge.id()).findings());
            }

            if (edge.isEnabled()) {
                checkEnabledEdge(edge, from, to, edgePath);
            }
        }
    }

    private void checkEnabledEdge(TreeEdge edge, TreeNode from, TreeNode to, String edgePath) {
        if (isDeleted(from) || isDeleted(to)) {
            publishOnly.add(Finding.error(FindingCodes.EDGE_STATUS_INVALID,
                    "ENABLED edges cannot reference DELETED nodes", edgePath, edge.id()));
        }
        if (isGroup(from) || isGroup(to)) {
            publishOnly.add(Finding.error(FindingCodes.EDGE_STATUS_INVALID,
                    "ENABLED edges cannot connect to GROUP nodes", edgePath, edge.id()));
        }
        if (isDisabled(from) || isDisabled(to)) {
            publishOnly.add(Finding.error(FindingCodes.EDGE_STATUS_INVALID,
                    "If either endpoint is DISABLED, the edge must be DISABLED", edgePath, edge.id(),
                    Finding.context("fromStatus", statusName(from), "toStatus", statusName(to))));
        }
    }

    // ========================================================================
    // Node payloads
    // ========================================================================

    private void checkCompute(TreeNode node) {
        String path = nodePath(node) + ".compute.expression";
        ExpressionSpec expr = node.compute() != null ? node.compute().expression() : null;
        if (expr == null) {
            if (!hasIngestFindingUnder(path)) {
                structural.add(Finding.error(FindingCodes.EXPR_PARSE_FAIL,
                        "ExpressionSpec is not a valid AST object", path, node.id()));
            }
            return;
        }
        TypeCheckResult checked = TypeChecker.checkExpression(expr, ExprContext.COMPUTE, table, path, node.id());
        structural.addAll(checked.findings());
        checkComputeOutputType(node, checked.inferred(), path);
        publishOnly.addAll(DivByZeroAnalyzer.analyze(expr, policy.divByZeroStrict(), path, node.id()));
    }

    /**
     * nodeOutputRef consumers see the declared output type as non-null, so the
     * expression must produce exactly that.
     */
    private void checkComputeOutputType(TreeNode node, InferredType inferred, String path) {
        String outputKey = node.compute().singleOutputKey();
        ValueType declared = outputKey != null ? node.compute().outputs().get(outputKey) : null;
        if (declared == null || InferredType.UNKNOWN.equals(inferred)) {
            return;
        }
        if (inferred.type() != declared) {
            structural.add(Finding.error(FindingCodes.EXPR_TYPE_MISMATCH,
                    "COMPUTE expression type does not match declared output type", path, node.id(),
                    Finding.context("outputKey", outputKey, "expected", declared.name(),
                            "actual", inferred.typeName())));
        } else if (inferred.nullable()) {
            structural.add(Finding.error(FindingCodes.EXPR_TYPE_MISMATCH,
                    "COMPUTE expression may be null; use coalesce to give output '" + outputKey + "' a value",
                    path, node.id(),
                    Finding.context("outputKey", outputKey, "expected", declared.name(),
                            "actual", inferred.typeName())));
        }
    }

    private void checkPrice(TreeNode node) {
        if (node.price() == null) {
            return;
        }
        String base = nodePath(node) + ".price";
        for (PriceComponent component : node.price().components()) {
            checkComponent(node, component, base + ".components[" + component.index() + "]");
        }
        for (MaterialEffect effect : node.price().materialEffects()) {
            checkMaterial(node, effect, base + ".materialEffects[" + effect.index() + "]");
        }
        for (ChildItemEffect effect : node.price().childItemEffects()) {
            checkChildItem(node, effect, base + ".childItemEffects[" + effect.index() + "]");
        }
    }

    private void checkComponent(TreeNode node, PriceComponent c, String cPath) {
        String kind = c.kind();
        if (kind == null || !PRICE_KINDS.contains(kind)) {
            publishOnly.add(Finding.error(FindingCodes.PRICE_COMPONENT_INVALID,
                    "PriceComponent.kind must be one of FLAT|PER_UNIT|PER_OVERAGE|TIERED", cPath + ".kind", node.id(),
                    Finding.context("kind", c.rawKind())));
            return;
        }

        switch (kind) {
            case "FLAT" -> requireField(node, c, cPath, "unitPriceRef");
            case "PER_UNIT" -> {
                requireField(node, c, cPath, "quantityRef");
                requireField(node, c, cPath, "unitPriceRef");
            }
            case "PER_OVERAGE" -> {
                requireField(node, c, cPath, "quantityRef");
                requireField(node, c, cPath, "overageBaseRef");
                requireField(node, c, cPath, "unitPriceRef");
            }
            default -> {
                requireField(node, c, cPath, "quantityRef");
                requireField(node, c, cPath, "tiers");
                List<Object> tiers = JsonValues.asList(c.tiers());
                if (tiers == null || tiers.isEmpty()) {
                    publishOnly.add(Finding.error(FindingCodes.PRICE_COMPONENT_INVALID,
                            "TIERED components require non-empty tiers", cPath + ".tiers", node.id()));
                }
            }
        }

        checkPriceNumber(node, c, cPath, "quantityRef", c.quantityRef());
        checkPriceNumber(node, c, cPath, "unitPriceRef", c.unitPriceRef());
        checkPriceNumber(node, c, cPath, "overageBaseRef", c.overageBaseRef());

        if (c.appliesWhen() != null) {
            checkCondition(c.appliesWhen(), cPath + ".appliesWhen", node.id());
        }
    }

    private void requireField(TreeNode node, PriceComponent c, String cPath, String field) {
        if (!c.declares(field)) {
            publishOnly.add(Finding.error(FindingCodes.PRICE_COMPONENT_INVALID,
                    "Missing required field '" + field + "' for " + c.kind(), cPath, node.id(),
                    Finding.context("kind", c.kind(), "field", field)));
        }
    }

    private void checkPriceNumber(TreeNode node, PriceComponent c, String cPath, String field, ExpressionSpec expr) {
        // a declared but malformed expression was reported at ingest
        if (!c.declares(field) || expr == null) {
            return;
        }
        String path = cPath + "." + field;
        InferredType inferred = checkNumberExpression(expr, ExprContext.PRICE, path, node.id());
        if (!inferred.isNonNull(ValueType.NUMBER)) {
            publishOnly.add(Finding.error(FindingCodes.PRICE_REF_UNRESOLVED,
                    field + " must resolve to non-null NUMBER", path, node.id(), inferredContext(inferred)));
        }

        if (!"quantityRef".equals(field)) {
            return;
        }
        Double negative = negativeLiteral(expr);
        if (negative != null) {
            publishOnly.add(Finding.error(FindingCodes.PRICE_NEGATIVE_QUANTITY,
                    "quantityRef cannot be a negative literal", path, node.id(), Finding.context("value", negative)));
        } else if (isSubOrMul(expr)) {
            publishOnly.add(Finding.of(policy.negativeQuantityStrict() ? Severity.ERROR : Severity.WARNING,
                    FindingCodes.PRICE_NEGATIVE_QUANTITY,
                    "quantityRef may produce negative quantities; clamp/guard recommended", path, node.id(), null));
        }
    }

    private void checkMaterial(TreeNode node, MaterialEffect e, String ePath) {
        if (!JsonValues.isNonEmptyString(e.skuRef())) {
            publishOnly.add(Finding.error(FindingCodes.MATERIAL_EFFECT_INVALID,
                    "MaterialEffect.skuRef must be a non-empty string", ePath + ".skuRef", node.id()));
        }
        if (!JsonValues.isNonEmptyString(e.uom())) {
            publishOnly.add(Finding.error(FindingCodes.MATERIAL_EFFECT_INVALID,
                    "MaterialEffect.uom must be a non-empty string", ePath + ".uom", node.id()));
        }

        if (!e.qtyDeclared()) {
            publishOnly.add(Finding.error(FindingCodes.MATERIAL_EFFECT_INVALID, "MaterialEffect.qtyRef is required",
                    ePath, node.id(), Finding.context("field", "qtyRef")));
        } else if (e.qtyRef() != null) {
            checkEffectQuantity(node, e.qtyRef(), ePath + ".qtyRef",
                    FindingCodes.MATERIAL_QTY_REF_INVALID, FindingCodes.MATERIAL_NEGATIVE_QUANTITY);
        }

        if (e.appliesWhen() != null) {
            checkCondition(e.appliesWhen(), ePath + ".appliesWhen", node.id());
            if (UnsatProver.isProvablyUnsat(e.appliesWhen())) {
                publishOnly.add(Finding.warning(FindingCodes.MATERIAL_EFFECT_UNREACHABLE,
                        "MaterialEffect.appliesWhen is provably UNSAT (effect will never apply)",
                        ePath + ".appliesWhen", node.id()));
            }
        }
    }

    private void checkChildItem(TreeNode node, ChildItemEffect e, String ePath) {
        if (!(e.kind() instanceof String kind && CHILD_KINDS.contains(kind))) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                    "ChildItemEffect.kind must be 'inlineSku' or 'productRef'", ePath + ".kind", node.id()));
        }
        if (!JsonValues.isNonEmptyString(e.title())) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                    "ChildItemEffect.title must be a non-empty string", ePath + ".title", node.id()));
        }
        if ("inlineSku".equals(e.kind()) && !JsonValues.isNonEmptyString(e.skuRef())) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                    "ChildItemEffect.skuRef is required when kind='inlineSku'", ePath + ".skuRef", node.id()));
        }
        if (e.childProductId() != null && !JsonValues.isNonEmptyString(e.childProductId())) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                    "ChildItemEffect.childProductId must be a non-empty string when provided",
                    ePath + ".childProductId", node.id()));
        }
        if (e.invoiceVisibility() != null && !INVOICE_VISIBILITIES.contains(e.invoiceVisibility())) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                    "ChildItemEffect.invoiceVisibility must be 'hidden', 'rollup', or 'separateLine'",
                    ePath + ".invoiceVisibility", node.id()));
        }

        if (!e.qtyDeclared()) {
            publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID, "ChildItemEffect.qtyRef is required",
                    ePath, node.id(), Finding.context("field", "qtyRef")));
        } else if (e.qtyRef() != null) {
            checkEffectQuantity(node, e.qtyRef(), ePath + ".qtyRef",
                    FindingCodes.CHILD_ITEM_QTY_REF_INVALID, FindingCodes.CHILD_ITEM_NEGATIVE_QUANTITY);
        }

        if (e.unitPriceRef() != null) {
            String path = ePath + ".unitPriceRef";
            InferredType inferred = checkNumberExpression(e.unitPriceRef(), ExprContext.PRICE, path, node.id());
            if (!inferred.isNonNull(ValueType.NUMBER)) {
                publishOnly.add(Finding.error(FindingCodes.CHILD_ITEM_UNIT_PRICE_REF_INVALID,
                        "unitPriceRef must resolve to non-null NUMBER (cents)", path, node.id(),
                        inferredContext(inferred)));
            }
        }

        if (e.appliesWhen() != null) {
            checkCondition(e.appliesWhen(), ePath + ".appliesWhen", node.id());
            if (UnsatProver.isProvablyUnsat(e.appliesWhen())) {
                publishOnly.add(Finding.warning(FindingCodes.CHILD_ITEM_EFFECT_UNREACHABLE,
                        "ChildItemEffect.appliesWhen is provably UNSAT (effect will never apply)",
                        ePath + ".appliesWhen", node.id()));
            }
        }
    }

    /**
     * Material and child item quantities: non-null NUMBER, and never a
     * negative literal or a top-level sub/mul.
     */
    private void checkEffectQuantity(TreeNode node, ExpressionSpec qtyRef, String path,
                                     String invalidCode, String negativeCode) {
        InferredType inferred = checkNumberExpression(qtyRef, ExprContext.COMPUTE, path, node.id());
        if (!inferred.isNonNull(ValueType.NUMBER)) {
            publishOnly.add(Finding.error(invalidCode, "qtyRef must resolve to non-null NUMBER", path, node.id(),
                    inferredContext(inferred)));
        }
        Double negative = negativeLiteral(qtyRef);
        if (negative != null) {
            publishOnly.add(Finding.error(negativeCode, "qtyRef cannot be a negative literal", path, node.id(),
                    Finding.context("value", negative)));
        } else if (isSubOrMul(qtyRef)) {
            publishOnly.add(Finding.error(negativeCode, "qtyRef may produce negative quantities; clamp/guard required",
                    path, node.id()));
        }
    }

    private void checkEffect(TreeNode node) {
        if (node.effect() == null) {
            return;
        }
        Set<String> seenKeys = new HashSet<>();
        for (EffectOutput output : node.effect().outputs()) {
            String oPath = nodePath(node) + ".effect.outputs[" + output.index() + "]";
            if (!JsonValues.isNonEmptyString(output.key())) {
                publishOnly.add(Finding.error(FindingCodes.EFFECT_OUTPUT_INVALID,
                        "EFFECT output.key must be a non-empty string", oPath + ".key", node.id()));
            } else if (!seenKeys.add((String) output.key())) {
                publishOnly.add(Finding.error(FindingCodes.EFFECT_OUTPUT_INVALID,
                        "EFFECT output keys must be unique within node", nodePath(node) + ".effect.outputs", node.id(),
                        Finding.context("key", output.key())));
            }

            if (output.valueRef() != null) {
                String path = oPath + ".valueRef";
                structural.addAll(TypeChecker.checkExpression(output.valueRef(), ExprContext.EFFECT, table,
                        path, node.id()).findings());
                publishOnly.addAll(DivByZeroAnalyzer.analyze(output.valueRef(), policy.divByZeroStrict(),
                        path, node.id()));
            }
        }
    }

    private InferredType checkNumberExpression(ExpressionSpec expr, ExprContext context, String path, String entityId) {
        TypeCheckResult result = TypeChecker.checkExpression(expr, context, table, path, entityId);
        structural.addAll(result.findings());
        publishOnly.addAll(DivByZeroAnalyzer.analyze(expr, policy.divByZeroStrict(), path, entityId));
        return result.inferred();
    }

    private void checkCondition(ConditionRule rule, String path, String entityId) {
        structural.addAll(TypeChecker.checkCondition(rule, table, path, entityId).findings());
    }

    // ========================================================================
    // Graph
    // ========================================================================

    private void checkComputeDependencies() {
        Set<String> computeIds = new TreeSet<>();
        for (TreeNode node : tree.nodes()) {
            if (!node.isDeleted() && node.is(NodeType.COMPUTE)) {
                computeIds.add(node.id());
            }
        }
        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        for (TreeNode node : tree.nodes()) {
            if (!computeIds.contains(node.id()) || node.isDeleted() || node.compute() == null
                    || node.compute().expression() == null) {
                continue;
            }
            for (String target : RefCollector.nodeOutputTargets(node.compute().expression())) {
                if (computeIds.contains(target)) {
                    dependencies.computeIfAbsent(node.id(), id -> new ArrayList<>()).add(target);
                }
            }
        }
        CycleDetector.findCycle(computeIds, dependencies).ifPresent(cycle -> publishOnly.add(
                Finding.error(FindingCodes.EXPR_COMPUTE_DEP_CYCLE,
                        "Compute dependency graph (nodeOutputRef usage) must be acyclic", "tree", null,
                        Finding.context("cycle", cycle))));
    }

    private void checkReachability(RuntimeGraph graph) {
        Set<String> reachable = graph.reachableFromRoots();
        publishOnly.addAll(graph.unreachableRequiredInputs(reachable));

        Map<String, List<TreeEdge>> incoming = new TreeMap<>();
        for (TreeEdge edge : tree.edges()) {
            if (edge.isEnabled() && edge.fromNodeId() != null && edge.toNodeId() != null) {
                incoming.computeIfAbsent(edge.toNodeId(), id -> new ArrayList<>()).add(edge);
            }
        }

        for (TreeNode node : tree.nodes()) {
            if (!RuntimeGraph.isRequiredInput(node) || !reachable.contains(node.id())) {
                continue;
            }
            String selectionKey = node.input().selectionKey();
            List<TreeEdge> gates = incoming.getOrDefault(node.id(), List.of());
            if (selectionKey == null || gates.isEmpty()) {
                continue;
            }
            boolean selfGated = gates.stream()
                    .filter(edge -> !UnsatProver.isProvablyUnsat(edge.condition()))
                    .allMatch(edge -> edge.condition() != null
                            && RefCollector.readsSelectionKey(edge.condition(), selectionKey));
            if (selfGated) {
                publishOnly.add(Finding.error(FindingCodes.REQUIRED_INPUT_CIRCULAR_VISIBILITY,
                        "Required INPUT is gated only by conditions that reference itself (circular visibility)",
                        nodePath(node), node.id(),
                        Finding.context("selectionKey", selectionKey, "circular", true)));
            }
        }

        for (TreeNode node : tree.nodes()) {
            if (node.isRuntime() && !reachable.contains(node.id()) && !RuntimeGraph.isRequiredInput(node)) {
                publishOnly.add(Finding.warning(FindingCodes.NODE_UNREACHABLE,
                        "Node is ENABLED but unreachable from roots under potentially satisfiable conditions",
                        nodePath(node), node.id()));
            }
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private boolean hasIngestFindingUnder(String path) {
        return tree.ingestFindings().stream()
                .anyMatch(f -> f.path() != null && (f.path().equals(path) || f.path().startsWith(path + ".")));
    }

    private static String nodePath(TreeNode node) {
        return "tree.nodes[" + node.id() + "]";
    }

    private static Double negativeLiteral(ExpressionSpec expr) {
        if (expr instanceof ExpressionSpec.Literal literal && literal.value() instanceof Number n
                && n.doubleValue() < 0) {
            return n.doubleValue();
        }
        return null;
    }

    private static boolean isSubOrMul(ExpressionSpec expr) {
        return expr instanceof ExpressionSpec.Binary binary
                && (binary.operator() == ExpressionSpec.BinaryOp.SUB || binary.operator() == ExpressionSpec.BinaryOp.MUL);
    }

    private static Map<String, Object> inferredContext(InferredType inferred) {
        return Finding.context("inferred", Finding.context("type", inferred.type().name(),
                "nullable", inferred.nullable()));
    }

    private static List<String> sorted(List<String> ids) {
        List<String> copy = new ArrayList<>(ids);
        copy.sort(null);
        return copy;
    }

    private static boolean isDeleted(TreeNode node) {
        return node != null && node.isDeleted();
    }

    private static boolean isDisabled(TreeNode node) {
        return node != null && node.status() == EntityStatus.DISABLED;
    }

    private static boolean isGroup(TreeNode node) {
        return node != null && node.is(NodeType.GROUP);
    }

    private static String statusName(TreeNode node) {
        return node != null ? node.status().name() : null;
    }
}
