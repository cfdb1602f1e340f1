package com.pricegraph.ingest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegraph.discount.DiscountConfig;
import com.pricegraph.discount.DiscountMethod;
import com.pricegraph.discount.DiscountScope;
import com.pricegraph.discount.VolumeTrigger;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.Ref;
import com.pricegraph.ref.ValueType;
import com.pricegraph.tree.BaseRates;
import com.pricegraph.tree.ChildItemEffect;
import com.pricegraph.tree.ComputeSpec;
import com.pricegraph.tree.EffectOutput;
import com.pricegraph.tree.EffectSpec;
import com.pricegraph.tree.EntityStatus;
import com.pricegraph.tree.InputSpec;
import com.pricegraph.tree.MaterialEffect;
import com.pricegraph.tree.NodeType;
import com.pricegraph.tree.NumberConstraints;
import com.pricegraph.tree.PriceComponent;
import com.pricegraph.tree.PriceSpec;
import com.pricegraph.tree.PricingMeta;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.tree.RateTier;
import com.pricegraph.tree.TreeEdge;
import com.pricegraph.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static com.pricegraph.ingest.JsonValues.asList;
import static com.pricegraph.ingest.JsonValues.asMap;
import static com.pricegraph.ingest.JsonValues.getNumber;
import static com.pricegraph.ingest.JsonValues.getString;

/**
 * Single ingest step from loosely shaped tree JSON to {@link PricingTree}.
 * <p>
 * Accepts nodes and edges as arrays or as id-keyed objects, the {@code data}
 * payload alias, and the legacy field aliases. Shape problems are recorded as
 * ingest findings; problems inside DELETED nodes are not reported.
 */
public final class TreeParser {

    private static final Logger log = LoggerFactory.getLogger(TreeParser.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private TreeParser() {
    }

    /**
     * Parse tree JSON text.
     *
     * @throws TreeIngestException if the text is not valid JSON or not an object
     */
    public static PricingTree parse(String json) {
        Object raw;
        try {
            raw = objectMapper.readValue(json, Object.class);
        } catch (JsonProcessingException e) {
            throw new TreeIngestException("Invalid tree JSON: " + e.getOriginalMessage(), e);
        }
        return parseValue(raw);
    }

    public static PricingTree parse(JsonNode json) {
        return parseValue(json == null ? null : objectMapper.convertValue(json, Object.class));
    }

    public static PricingTree parse(Map<String, ?> json) {
        return parseValue(json);
    }

    /**
     * Parse an already-decoded JSON value (String, JsonNode or Map).
     *
     * @throws TreeIngestException if the value is not a JSON object
     */
    public static PricingTree parseValue(Object raw) {
        if (raw instanceof String json) {
            return parse(json);
        }
        if (raw instanceof JsonNode node) {
            return parse(node);
        }
        Map<String, Object> tree = asMap(JsonValues.normalize(raw));
        if (tree == null) {
            Finding finding = Finding.error(FindingCodes.TREE_INVALID, "Tree must be an object", "tree");
            throw new TreeIngestException("Tree must be an object", List.of(finding));
        }

        List<Finding> findings = new ArrayList<>();
        List<TreeNode> nodes = parseNodes(tree.get("nodes"), findings);
        List<TreeEdge> edges = parseEdges(tree.get("edges"), findings);
        List<String> roots = parseRoots(tree.get("rootNodeIds"));
        PricingMeta meta = parseMeta(tree.get("meta"));

        Object id = JsonValues.firstPresent(tree, "id", "treeVersionId");
        Object status = tree.get("status");

        PricingTree parsed = new PricingTree(
                id instanceof String s ? s : null,
                status instanceof String s ? s : null,
                roots, nodes, edges, meta, findings);
        log.debug("Ingested tree {}: {} nodes, {} edges, {} ingest findings",
                parsed.id(), nodes.size(), edges.size(), findings.size());
        return parsed;
    }

    // ========================================================================
    // Nodes
    // ========================================================================

    private static List<TreeNode> parseNodes(Object raw, List<Finding> findings) {
        List<TreeNode> out = new ArrayList<>();
        List<Object> list = asList(raw);
        if (list != null) {
            for (Object item : list) {
                Map<String, Object> rec = asMap(item);
                if (rec == null) {
                    continue;
                }
                String id = getString(rec, "id");
                if (id == null) {
                    id = getString(rec, "nodeId");
                }
                if (id != null) {
                    out.add(parseNode(id, rec, findings));
                }
            }
            return out;
        }
        Map<String, Object> map = asMap(raw);
        if (map != null) {
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                Map<String, Object> rec = asMap(entry.getValue());
                if (rec == null) {
                    continue;
                }
                String id = getString(rec, "id");
                if (id == null && !entry.getKey().isEmpty()) {
                    id = entry.getKey();
                }
                if (id != null) {
                    out.add(parseNode(id, rec, findings));
                }
            }
        }
        return out;
    }

    private static TreeNode parseNode(String id, Map<String, Object> rec, List<Finding> treeFindings) {
        EntityStatus status = EntityStatus.normalize(rec.get("status"));
        Object typeRaw = JsonValues.firstPresent(rec, "type", "nodeType", "kind");
        String rawType = typeRaw instanceof String s ? s : null;
        NodeType type = NodeType.parse(rawType);
        String key = getString(rec, "key");

        List<Finding> findings = new ArrayList<>();
        ExpressionParser parser = new ExpressionParser(findings, id);
        String base = "tree.nodes[" + id + "]";

        InputSpec input = null;
        ComputeSpec compute = null;
        PriceSpec price = null;
        EffectSpec effect = null;
        if (type == NodeType.INPUT) {
            input = parseInput(rec);
        } else if (type == NodeType.COMPUTE) {
            compute = parseCompute(rec, parser, base + ".compute");
        } else if (type == NodeType.PRICE) {
            price = parsePrice(payload(rec, "price"), parser, findings, id, base + ".price");
        } else if (type == NodeType.EFFECT) {
            effect = parseEffect(payload(rec, "effect"), parser, findings, id, base + ".effect");
        }

        if (status != EntityStatus.DELETED) {
            treeFindings.addAll(findings);
        }
        return new TreeNode(id, type, rawType, status, key, input, compute, price, effect);
    }

    private static Map<String, Object> payload(Map<String, Object> node, String field) {
        Map<String, Object> payload = asMap(node.get(field));
        return payload != null ? payload : asMap(node.get("data"));
    }

    private static InputSpec parseInput(Map<String, Object> node) {
        Map<String, Object> input = payload(node, "input");

        String selectionKey = getString(input, "selectionKey");
        if (selectionKey == null) {
            selectionKey = getString(input, "key");
        }
        if (selectionKey == null) {
            selectionKey = getString(node, "selectionKey");
        }

        Object typeRaw = JsonValues.firstPresent(input, "valueType", "type", "inputKind");
        if (typeRaw == null) {
            typeRaw = node.get("valueType");
        }
        String rawValueType = typeRaw instanceof String s ? s : null;
        boolean enumInput = "ENUM".equals(JsonValues.upper(rawValueType));
        ValueType valueType = enumInput ? ValueType.TEXT : ValueType.normalize(rawValueType);

        Map<String, Object> defaultSource = declaresDefault(input) ? input : declaresDefault(node) ? node : null;
        boolean hasDefault = defaultSource != null;
        Object defaultValue = null;
        if (hasDefault) {
            defaultValue = defaultSource.containsKey("defaultValue")
                    ? defaultSource.get("defaultValue") : defaultSource.get("default");
        }

        Map<String, Object> constraints = input != null ? asMap(input.get("constraints")) : null;
        Map<String, Object> requiredSource = asMap(JsonValues.firstPresent(input, "constraints", "constraint"));
        if (requiredSource == null) {
            requiredSource = asMap(JsonValues.firstPresent(node, "constraints", "constraint"));
        }
        Object requiredRaw = input != null && input.get("required") != null
                ? input.get("required")
                : requiredSource != null ? requiredSource.get("required") : null;
        boolean required = JsonValues.truthy(requiredRaw);

        return new InputSpec(selectionKey, rawValueType, valueType, enumInput, hasDefault, defaultValue,
                required, constraints, parseNumberConstraints(constraints), parseEnumOptions(input, constraints));
    }

    private static boolean declaresDefault(Map<String, Object> map) {
        return map != null && (map.containsKey("defaultValue") || map.containsKey("default"));
    }

    private static NumberConstraints parseNumberConstraints(Map<String, Object> constraints) {
        if (constraints == null) {
            return NumberConstraints.NONE;
        }
        Map<String, Object> number = asMap(constraints.get("number"));
        Map<String, Object> source = number != null ? number : constraints;
        return new NumberConstraints(getNumber(source, "min"), getNumber(source, "max"), getNumber(source, "step"));
    }

    private static List<Object> parseEnumOptions(Map<String, Object> input, Map<String, Object> constraints) {
        Map<String, Object> enumRec = constraints != null ? asMap(constraints.get("enum")) : null;
        Object options = enumRec != null ? enumRec.get("options") : null;
        if (options == null && constraints != null) {
            options = constraints.get("options");
        }
        if (options == null) {
            options = JsonValues.firstPresent(input, "options", "choices");
        }
        List<Object> list = asList(options);
        return list != null ? Collections.unmodifiableList(list) : null;
    }

    private static ComputeSpec parseCompute(Map<String, Object> node, ExpressionParser parser, String path) {
        Map<String, Object> compute = payload(node, "compute");
        Object exprRaw = compute == null ? null
                : compute.get("expression") != null ? compute.get("expression") : compute.get("expr");
        ExpressionSpec expression = parser.parseExpression(exprRaw, path + ".expression");

        Map<String, ValueType> outputs = new LinkedHashMap<>();
        Map<String, Object> declared = asMap(JsonValues.firstPresent(compute, "outputs", "outputSchema"));
        if (declared != null) {
            for (Map.Entry<String, Object> entry : declared.entrySet()) {
                Map<String, Object> rec = asMap(entry.getValue());
                Object typeRaw = rec != null ? rec.get("type") : entry.getValue();
                outputs.put(entry.getKey(), typeRaw instanceof String s ? ValueType.normalize(s) : null);
            }
        }
        if (outputs.isEmpty()) {
            Object outputType = JsonValues.firstPresent(compute, "outputType");
            if (outputType == null) {
                outputType = node.get("outputType");
            }
            ValueType single = outputType instanceof String s ? ValueType.normalize(s) : null;
            if (single != null) {
                outputs.put("value", single);
            }
        }
        return new ComputeSpec(expression, Collections.unmodifiableMap(outputs));
    }

    // ========================================================================
    // PRICE payload
    // ========================================================================

    private static PriceSpec parsePrice(Map<String, Object> price, ExpressionParser parser,
                                        List<Finding> findings, String nodeId, String path) {
        if (price == null) {
            return PriceSpec.EMPTY;
        }
        List<PriceComponent> components = new ArrayList<>();
        List<Object> rawComponents = asList(price.get("components"));
        if (rawComponents != null) {
            for (int i = 0; i < rawComponents.size(); i++) {
                String cPath = path + ".components[" + i + "]";
                Map<String, Object> c = asMap(rawComponents.get(i));
                if (c == null) {
                    findings.add(Finding.error(FindingCodes.PRICE_COMPONENT_INVALID,
                            "PriceComponent must be an object", cPath, nodeId));
                    continue;
                }
                components.add(parseComponent(i, c, parser, cPath));
            }
        }

        List<MaterialEffect> materials = new ArrayList<>();
        List<Object> rawMaterials = asList(price.get("materialEffects"));
        if (rawMaterials != null) {
            for (int i = 0; i < rawMaterials.size(); i++) {
                String ePath = path + ".materialEffects[" + i + "]";
                Map<String, Object> e = asMap(rawMaterials.get(i));
                if (e == null) {
                    findings.add(Finding.error(FindingCodes.MATERIAL_EFFECT_INVALID,
                            "MaterialEffect must be an object", ePath, nodeId));
                    continue;
                }
                boolean qtyDeclared = e.containsKey("qtyRef");
                materials.add(new MaterialEffect(i, e.get("skuRef"), e.get("uom"),
                        qtyDeclared ? parser.parseExpression(e.get("qtyRef"), ePath + ".qtyRef") : null,
                        condition(e, "appliesWhen", parser, ePath),
                        qtyDeclared));
            }
        }

        List<ChildItemEffect> children = new ArrayList<>();
        List<Object> rawChildren = asList(price.get("childItemEffects"));
        if (rawChildren != null) {
            for (int i = 0; i < rawChildren.size(); i++) {
                String ePath = path + ".childItemEffects[" + i + "]";
                Map<String, Object> e = asMap(rawChildren.get(i));
                if (e == null) {
                    findings.add(Finding.error(FindingCodes.CHILD_ITEM_EFFECT_INVALID,
                            "ChildItemEffect must be an object", ePath, nodeId));
                    continue;
                }
                boolean qtyDeclared = e.containsKey("qtyRef");
                children.add(new ChildItemEffect(i, e.get("kind"), e.get("title"), e.get("skuRef"),
                        e.get("childProductId"), e.get("invoiceVisibility"),
                        qtyDeclared ? parser.parseExpression(e.get("qtyRef"), ePath + ".qtyRef") : null,
                        expression(e, "unitPriceRef", parser, ePath),
                        condition(e, "appliesWhen", parser, ePath),
                        qtyDeclared));
            }
        }
        return new PriceSpec(List.copyOf(components), List.copyOf(materials), List.copyOf(children));
    }

    private static PriceComponent parseComponent(int index, Map<String, Object> c, ExpressionParser parser,
                                                 String cPath) {
        Object rawKind = c.get("kind");
        Object title = c.get("title");
        return new PriceComponent(
                index,
                JsonValues.upper(rawKind),
                rawKind,
                title instanceof String s ? s : null,
                expression(c, "quantityRef", parser, cPath),
                expression(c, "unitPriceRef", parser, cPath),
                expression(c, "overageBaseRef", parser, cPath),
                c.get("tiers"),
                condition(c, "appliesWhen", parser, cPath),
                parseDiscount(asMap(c.get("discount")), parser, cPath + ".discount"),
                Collections.unmodifiableSet(new LinkedHashSet<>(c.keySet())));
    }

    /** Present keys are parsed even when null so that a null slot is reported. */
    private static ExpressionSpec expression(Map<String, Object> rec, String field, ExpressionParser parser,
                                             String path) {
        if (!rec.containsKey(field)) {
            return null;
        }
        return parser.parseExpression(rec.get(field), path + "." + field);
    }

    /** A null condition means unconditional. */
    private static ConditionRule condition(Map<String, Object> rec, String field, ExpressionParser parser,
                                           String path) {
        Object raw = rec.get(field);
        return raw == null ? null : parser.parseCondition(raw, path + "." + field);
    }

    private static DiscountConfig parseDiscount(Map<String, Object> d, ExpressionParser parser, String path) {
        if (d == null) {
            return null;
        }
        Object eligible = d.get("discountEligible");
        return DiscountConfig.builder()
                .discountEligible(eligible == null ? null : JsonValues.truthy(eligible))
                .scope(DiscountScope.fromWire(d.get("discountScope")))
                .volumeTrigger(VolumeTrigger.fromWire(d.get("volumeTrigger")))
                .method(DiscountMethod.fromWire(d.get("discountMethod")))
                .customerTierPercentByTier(asMap(d.get("customerTierPercentByTier")))
                .customerTierCentsOffPerUnitByTier(asMap(d.get("customerTierCentsOffPerUnitByTier")))
                .customerTierUnitPriceCentsByTier(asMap(d.get("customerTierUnitPriceCentsByTier")))
                .volumePercentTiers(asList(d.get("volumePercentTiers")))
                .volumeCentsOffPerUnitTiers(asList(d.get("volumeCentsOffPerUnitTiers")))
                .volumeUnitPriceCentsTiers(asList(d.get("volumeUnitPriceCentsTiers")))
                .volumePercentTiersRef(ref(d, "volumePercentTiersRef", parser, path))
                .volumeCentsOffPerUnitTiersRef(ref(d, "volumeCentsOffPerUnitTiersRef", parser, path))
                .volumeUnitPriceCentsTiersRef(ref(d, "volumeUnitPriceCentsTiersRef", parser, path))
                .build();
    }

    private static Ref ref(Map<String, Object> rec, String field, ExpressionParser parser, String path) {
        Object raw = rec.get(field);
        return raw == null ? null : parser.parseRef(raw, path + "." + field);
    }

    // ========================================================================
    // EFFECT payload
    // ========================================================================

    private static EffectSpec parseEffect(Map<String, Object> effect, ExpressionParser parser,
                                          List<Finding> findings, String nodeId, String path) {
        List<Object> rawOutputs = effect != null ? asList(effect.get("outputs")) : null;
        if (rawOutputs == null) {
            return EffectSpec.EMPTY;
        }
        List<EffectOutput> outputs = new ArrayList<>();
        for (int i = 0; i < rawOutputs.size(); i++) {
            String oPath = path + ".outputs[" + i + "]";
            Map<String, Object> o = asMap(rawOutputs.get(i));
            if (o == null) {
                findings.add(Finding.error(FindingCodes.EFFECT_OUTPUT_INVALID,
                        "EFFECT output must be an object", oPath, nodeId));
                continue;
            }
            outputs.add(new EffectOutput(i, o.get("key"), parser.parseExpression(o.get("valueRef"), oPath + ".valueRef")));
        }
        return new EffectSpec(List.copyOf(outputs));
    }

    // ========================================================================
    // Edges, roots, meta
    // ========================================================================

    private static List<TreeEdge> parseEdges(Object raw, List<Finding> findings) {
        List<TreeEdge> out = new ArrayList<>();
        List<Object> list = asList(raw);
        if (list != null) {
            for (Object item : list) {
                Map<String, Object> rec = asMap(item);
                if (rec == null) {
                    continue;
                }
                String id = getString(rec, "id");
                if (id == null) {
                    id = getString(rec, "edgeId");
                }
                if (id != null) {
                    out.add(parseEdge(id, rec, findings));
                }
            }
            return out;
        }
        Map<String, Object> map = asMap(raw);
        if (map != null) {
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                Map<String, Object> rec = asMap(entry.getValue());
                if (rec == null) {
                    continue;
                }
                String id = getString(rec, "id");
                if (id == null && !entry.getKey().isEmpty()) {
                    id = entry.getKey();
                }
                if (id != null) {
                    out.add(parseEdge(id, rec, findings));
                }
            }
        }
        return out;
    }

    private static TreeEdge parseEdge(String id, Map<String, Object> rec, List<Finding> treeFindings) {
        EntityStatus status = EntityStatus.normalize(rec.get("status"));
        Object rawPriority = rec.get("priority");
        Integer priority;
        if (!rec.containsKey("priority")) {
            priority = 0;
        } else if (rawPriority instanceof Number n && Double.isFinite(n.doubleValue())
                && n.doubleValue() >= 0 && n.doubleValue() == Math.rint(n.doubleValue())
                && n.doubleValue() <= Integer.MAX_VALUE) {
            priority = (int) n.doubleValue();
        } else {
            priority = null;
        }

        List<Finding> findings = new ArrayList<>();
        ConditionRule condition = null;
        if (rec.get("condition") != null) {
            condition = new ExpressionParser(findings, id)
                    .parseCondition(rec.get("condition"), "tree.edges[" + id + "].condition");
        }
        if (status != EntityStatus.DELETED) {
            treeFindings.addAll(findings);
        }
        return new TreeEdge(id, status, getString(rec, "fromNodeId"), getString(rec, "toNodeId"),
                priority, rawPriority, condition);
    }

    private static List<String> parseRoots(Object raw) {
        List<Object> list = asList(raw);
        if (list == null) {
            return List.of();
        }
        List<String> roots = new ArrayList<>();
        for (Object item : list) {
            if (JsonValues.isNonEmptyString(item)) {
                roots.add((String) item);
            }
        }
        return roots;
    }

    private static PricingMeta parseMeta(Object raw) {
        Map<String, Object> meta = asMap(raw);
        if (meta == null) {
            return PricingMeta.ABSENT;
        }
        Map<String, Object> pricingV2 = asMap(meta.get("pricingV2"));
        if (pricingV2 == null) {
            return new PricingMeta(true, false, null, List.of(), List.of());
        }
        Map<String, Object> base = asMap(pricingV2.get("base"));
        BaseRates rates = base == null ? null : new BaseRates(
                numberOrZero(base, "perSqftCents"),
                numberOrZero(base, "perPieceCents"),
                numberOrZero(base, "minimumChargeCents"));
        return new PricingMeta(true, true, rates,
                parseRateTiers(pricingV2.get("qtyTiers"), "minQty"),
                parseRateTiers(pricingV2.get("sqftTiers"), "minSqft"));
    }

    private static List<RateTier> parseRateTiers(Object raw, String thresholdField) {
        List<Object> list = asList(raw);
        if (list == null) {
            return List.of();
        }
        List<RateTier> tiers = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> t = asMap(item);
            if (t == null) {
                continue;
            }
            tiers.add(new RateTier(numberOrZero(t, thresholdField),
                    getNumber(t, "perSqftCents"), getNumber(t, "perPieceCents"), getNumber(t, "minimumChargeCents")));
        }
        return List.copyOf(tiers);
    }

    private static double numberOrZero(Map<String, Object> map, String key) {
        Double value = getNumber(map, key);
        return value != null ? value : 0;
    }
}
