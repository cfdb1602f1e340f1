package com.pricegraph.evaluator;

import com.pricegraph.discount.DiscountConfig;
import com.pricegraph.discount.DiscountContext;
import com.pricegraph.discount.DiscountEngine;
import com.pricegraph.discount.DiscountResult;
import com.pricegraph.exception.EvaluationException;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.finding.Finding;
import com.pricegraph.ingest.JsonValues;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.ref.ExprContext;
import com.pricegraph.ref.ValueType;
import com.pricegraph.symbol.SymbolTable;
import com.pricegraph.symbol.SymbolTableBuilder;
import com.pricegraph.tree.ChildItemEffect;
import com.pricegraph.tree.MaterialEffect;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.PriceComponent;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.TreeNode;
import com.pricegraph.typecheck.TypeCheckResult;
import com.pricegraph.typecheck.TypeChecker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a tree for one set of selections: active nodes, COMPUTE outputs,
 * then price lines, material effects or child item proposals.
 * <p>
 * Evaluation is pure; calling it twice with the same inputs gives equal results.
 */
public class PricingEngine {

    private static final Logger log = LoggerFactory.getLogger(PricingEngine.class);

    private static final Comparator<MaterialLine> MATERIAL_ORDER = Comparator
            .comparing(MaterialLine::sourceNodeId)
            .thenComparingInt(MaterialLine::effectIndex);

    private static final Comparator<ChildItemProposal> CHILD_ITEM_ORDER = Comparator
            .comparing(ChildItemProposal::sourceNodeId)
            .thenComparingInt(ChildItemProposal::effectIndex);

    private static final Set<String> CHILD_ITEM_KINDS = Set.of("inlineSku", "productRef");
    private static final Set<String> INVOICE_VISIBILITIES = Set.of("hidden", "rollup", "separateLine");

    private final EnvKeys envKeys;
    private final ActiveNodeResolver activeNodeResolver;
    private final ComputeEvaluator computeEvaluator;

    public PricingEngine(EnvKeys envKeys) {
        this(envKeys, new ActiveNodeResolver(), new ComputeEvaluator());
    }

    public PricingEngine(EnvKeys envKeys, ActiveNodeResolver activeNodeResolver, ComputeEvaluator computeEvaluator) {
        this.envKeys = envKeys;
        this.activeNodeResolver = activeNodeResolver;
        this.computeEvaluator = computeEvaluator;
    }

    /** Context, active nodes and COMPUTE outputs shared by all outputs of one call. */
    private record Evaluation(PricingTree tree, EvaluationContext context, Set<String> activeNodeIds) {

        List<TreeNode> activePriceNodes() {
            List<TreeNode> nodes = new ArrayList<>();
            for (TreeNode node : tree.nodes()) {
                if (node.isEnabled() && node.is(NodeType.PRICE) && activeNodeIds.contains(node.id())
                        && node.price() != null) {
                    nodes.add(node);
                }
            }
            return nodes;
        }
    }

    private Evaluation prepare(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                               PricingOptions options) {
        if (tree.hasIngestErrors()) {
            List<Finding> errors = tree.ingestFindings().stream().filter(Finding::isError).toList();
            throw new TreeIngestException("Tree " + tree.id() + " has " + errors.size() + " ingest error(s)", errors);
        }
        PricingOptions opts = options != null ? options : PricingOptions.defaults();
        EvaluationContext context = EvaluationContext.create(tree, selections, env, opts.pricebook());
        Set<String> active = activeNodeResolver.resolve(tree, context);
        computeEvaluator.evaluate(tree, active, context);
        return new Evaluation(tree, context, active);
    }

    // ========================================================================
    // Price
    // ========================================================================

    /**
     * Price a tree.
     *
     * @throws TreeIngestException if the tree could not be ingested cleanly
     * @throws EvaluationException on non-numeric operands, non-finite amounts or compute cycles
     */
    public PricingResult price(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                               PricingOptions options) {
        PricingOptions opts = options != null ? options : PricingOptions.defaults();
        Evaluation evaluation = prepare(tree, selections, env, opts);
        EvaluationContext context = evaluation.context();

        List<BreakdownLine> raw = new ArrayList<>();
        for (TreeNode node : evaluation.activePriceNodes()) {
            for (PriceComponent component : node.price().components()) {
                BreakdownLine line = priceComponent(node.id(), component, context);
                if (line != null) {
                    raw.add(line);
                }
            }
        }

        Object productQtyRaw = context.env("quantity");
        double productQty = productQtyRaw instanceof Number n && Double.isFinite(n.doubleValue()) ? n.doubleValue() : 0;
        DiscountContext discountContext = new DiscountContext(opts.customerTier(), productQty);

        List<BreakdownLine> breakdown = new ArrayList<>();
        long addOnCents = 0;
        for (BreakdownLine line : raw) {
            if (line.discount() == null || line.unitPriceCents() == null) {
                breakdown.add(line);
                addOnCents += line.amountCents();
                continue;
            }

            DiscountConfig resolved = line.discount()
                    .withResolvedTiers(ref -> ExpressionEvaluator.resolveRef(ref, context));
            double qty = line.quantity() != null ? line.quantity() : 1;
            DiscountResult discounted = DiscountEngine.apply(qty, line.unitPriceCents(), resolved, discountContext);
            BreakdownLine updated = line.discounted(discounted.unitPriceCents(), discounted.amountCents(),
                    discounted.debug());
            if (updated.amountCents() != 0) {
                breakdown.add(updated);
            }
            addOnCents += updated.amountCents();
        }

        BasePriceCalculator.BasePrice base = BasePriceCalculator.compute(tree.meta(), context.env());
        addOnCents += base.cents();
        if (base.cents() != 0) {
            Long unit = base.quantity() != 0 ? Math.round(base.cents() / base.quantity()) : null;
            breakdown.add(0, new BreakdownLine(BreakdownLine.BASE_NODE_ID, 0, BreakdownLine.BASE_PRICE_KIND,
                    base.cents(), base.quantity(), unit, null, null));
        }

        log.debug("Priced tree {}: {} active node(s), {} line(s), addOnCents={}",
                tree.id(), evaluation.activeNodeIds().size(), breakdown.size(), addOnCents);
        return new PricingResult(addOnCents, breakdown);
    }

    private static BreakdownLine priceComponent(String nodeId, PriceComponent component, EvaluationContext context) {
        if (!ExpressionEvaluator.test(component.appliesWhen(), context)) {
            return null;
        }
        String kind = component.kind();
        if (kind == null || kind.isEmpty()) {
            return null;
        }

        double unitPrice = component.unitPriceRef() == null ? 0
                : number(component.unitPriceRef(), context, "PRICE '" + nodeId + "' unitPriceRef must be NUMBER");

        double amount;
        Double quantity = null;
        switch (kind) {
            case "FLAT":
                amount = unitPrice;
                break;
            case "PER_UNIT":
                quantity = number(component.quantityRef(), context,
                        "PRICE '" + nodeId + "' quantityRef must be NUMBER");
                amount = quantity * unitPrice;
                break;
            case "PER_OVERAGE": {
                double qty = number(component.quantityRef(), context,
                        "PRICE '" + nodeId + "' quantityRef must be NUMBER");
                double included = number(component.overageBaseRef(), context,
                        "PRICE '" + nodeId + "' overageBaseRef must be NUMBER");
                quantity = Math.max(qty - included, 0);
                amount = quantity * unitPrice;
                break;
            }
            default:
                log.trace("Skipping unsupported component kind {} on node '{}'", kind, nodeId);
                return null;
        }

        if (!Double.isFinite(amount)) {
            throw new EvaluationException("PRICE '" + nodeId + "' produced invalid amount");
        }
        long rounded = Math.round(amount);
        if (rounded == 0) {
            return null;
        }
        Long unitPriceCents = unitPrice != 0 ? Math.round(unitPrice) : null;
        return new BreakdownLine(nodeId, component.index(), kind, rounded, quantity, unitPriceCents,
                component.discount(), null);
    }

    // ========================================================================
    // Material effects
    // ========================================================================

    /**
     * Materials consumed for the given selections, sorted by source node then effect index.
     * Effects with a missing sku, uom or quantity are skipped, as are non-positive quantities.
     */
    public List<MaterialLine> materials(PricingTree tree, Map<String, ?> selections, Map<String, ?> env,
                                        PricingOptions options) {
        Evaluation evaluation = prepare(tree, selections, env, options);
        SymbolTable table = SymbolTableBuilder.build(tree, envKeys).table();

        List<MaterialLine> materials = new ArrayList<>();
        for (TreeNode node : evaluation.activePriceNodes()) {
            for (MaterialEffect effect : node.price().materialEffects()) {
                if (!JsonValues.isNonEmptyString(effect.skuRef()) || !JsonValues.isNonEmptyString(effect.uom())
                        || effect.qtyRef() == null) {
                    continue;
                }
                String path = "tree.nodes[" + node.id() + "].price.materialEffects[" + effect.index() + "]";
                String label = "MATERIAL '" + node.id() + "'[" + effect.index() + "]";

                requireNumberType(effect.qtyRef(), ExprContext.COMPUTE, table, path + ".qtyRef", node.id(),
                        label + " qtyRef");
                if (!gate(effect.appliesWhen(), table, path + ".appliesWhen", node.id(), label,
                        evaluation.context())) {
                    continue;
                }

                double qty = number(effect.qtyRef(), evaluation.context(), label + " qtyRef must be NUMBER");
                if (!Double.isFinite(qty)) {
                    throw new EvaluationException(label + " produced invalid quantity");
                }
                if (qty <= 0) {
                    log.trace("{} dropped with quantity {}", label, qty);
                    continue;
                }
                materials.add(new MaterialLine((String) effect.skuRef(), qty, (String) effect.uom(),
                        node.id(), effect.index()));
            }
        }

        materials.sort(MATERIAL_ORDER);
        log.debug("Tree {} produced {} material line(s)", tree.id(), materials.size());
        return materials;
    }

    // ========================================================================
    // Child item proposals
    // ========================================================================

    /**
     * Child line items proposed for the given selections, sorted by source node then effect index.
     */
    public List<ChildItemProposal> childItemProposals(PricingTree tree, Map<String, ?> selections,
                                                      Map<String, ?> env, PricingOptions options) {
        Evaluation evaluation = prepare(tree, selections, env, options);
        SymbolTable table = SymbolTableBuilder.build(tree, envKeys).table();
        EvaluationContext context = evaluation.context();

        List<ChildItemProposal> proposals = new ArrayList<>();
        for (TreeNode node : evaluation.activePriceNodes()) {
            for (ChildItemEffect effect : node.price().childItemEffects()) {
                if (!(effect.kind() instanceof String kind) || !CHILD_ITEM_KINDS.contains(kind)) {
                    continue;
                }
                if (!JsonValues.isNonEmptyString(effect.title())) {
                    continue;
                }
                boolean inlineSku = kind.equals("inlineSku");
                if (inlineSku && !JsonValues.isNonEmptyString(effect.skuRef())) {
                    continue;
                }
                if (!inlineSku && effect.childProductId() != null
                        && !JsonValues.isNonEmptyString(effect.childProductId())) {
                    continue;
                }
                if (effect.qtyRef() == null) {
                    continue;
                }

                String path = "tree.nodes[" + node.id() + "].price.childItemEffects[" + effect.index() + "]";
                String label = "CHILD_ITEM '" + node.id() + "'[" + effect.index() + "]";
                if (!gate(effect.appliesWhen(), table, path + ".appliesWhen", node.id(), label, context)) {
                    continue;
                }

                requireNumberType(effect.qtyRef(), ExprContext.COMPUTE, table, path + ".qtyRef", node.id(),
                        label + " qtyRef");
                double qty = number(effect.qtyRef(), context, label + " qtyRef must be NUMBER");
                if (!Double.isFinite(qty)) {
                    throw new EvaluationException(label + " produced invalid quantity");
                }
                if (qty <= 0) {
                    log.trace("{} dropped with quantity {}", label, qty);
                    continue;
                }

                Long unitPriceCents = null;
                Long amountCents = null;
                if (effect.unitPriceRef() != null) {
                    requireNumberType(effect.unitPriceRef(), ExprContext.PRICE, table, path + ".unitPriceRef",
                            node.id(), label + " unitPriceRef");
                    double unitPrice = number(effect.unitPriceRef(), context,
                            label + " unitPriceRef must be NUMBER (cents)");
                    amountCents = Math.round(qty * unitPrice);
                    unitPriceCents = Math.round(unitPrice);
                }

                String visibility = effect.invoiceVisibility() instanceof String v && INVOICE_VISIBILITIES.contains(v)
                        ? v : "rollup";
                String childProductId = !inlineSku && JsonValues.isNonEmptyString(effect.childProductId())
                        ? (String) effect.childProductId() : null;
                proposals.add(new ChildItemProposal(kind, (String) effect.title(),
                        inlineSku ? (String) effect.skuRef() : null, childProductId,
                        qty, unitPriceCents, amountCents, visibility, node.id(), effect.index()));
            }
        }

        proposals.sort(CHILD_ITEM_ORDER);
        log.debug("Tree {} produced {} child item proposal(s)", tree.id(), proposals.size());
        return proposals;
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    /**
     * Type check then evaluate an effect gate. A null gate always applies.
     */
    private static boolean gate(ConditionRule appliesWhen, SymbolTable table, String path, String nodeId,
                                String label, EvaluationContext context) {
        if (appliesWhen == null) {
            return true;
        }
        TypeCheckResult result = TypeChecker.checkCondition(appliesWhen, table, path, nodeId);
        if (result.hasErrors()) {
            throw new EvaluationException(label + " appliesWhen invalid: " + firstError(result));
        }
        return ExpressionEvaluator.test(appliesWhen, context);
    }

    private static void requireNumberType(ExpressionSpec expr, ExprContext exprContext, SymbolTable table,
                                          String path, String nodeId, String label) {
        TypeCheckResult result = TypeChecker.checkExpression(expr, exprContext, table, path, nodeId);
        if (result.hasErrors()) {
            throw new EvaluationException(label + " invalid: " + firstError(result));
        }
        if (!result.inferred().isNonNull(ValueType.NUMBER)) {
            throw new EvaluationException(label + " must be non-null NUMBER (got "
                    + result.inferred().typeName() + ")");
        }
    }

    private static String firstError(TypeCheckResult result) {
        return result.findings().stream()
                .filter(Finding::isError)
                .findFirst()
                .map(f -> f.path() + ": " + f.message())
                .orElse("");
    }

    private static double number(ExpressionSpec expr, EvaluationContext context, String message) {
        if (expr == null) {
            throw new EvaluationException(message);
        }
        return ExpressionEvaluator.number(ExpressionEvaluator.evaluate(expr, context), message);
    }
}
