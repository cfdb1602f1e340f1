package com.pricegraph.evaluator;

import com.pricegraph.TestJson;
import com.pricegraph.discount.PricingTier;
import com.pricegraph.exception.EvaluationException;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.tree.PricingTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PricingEngine.
 */
class PricingEngineTest {

    private PricingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PricingEngine(EnvKeys.defaults());
    }

    // ========================================================================
    // Option-driven pricing
    // ========================================================================

    @Test
    @DisplayName("Should price banner material by weight and sides with volume tiers")
    void shouldPriceBanner() {
        PricingTree tree = TestJson.fixture("banner");
        Map<String, Object> env = Map.of("sqft", 10, "quantity", 5);

        assertEquals(4500, engine.price(tree, Map.of("weight", "13OZ", "sides", "SS"), env, null).addOnCents());
        assertEquals(6000, engine.price(tree, Map.of("weight", "18OZ", "sides", "SS"), env, null).addOnCents());
        assertEquals(7000, engine.price(tree, Map.of("weight", "13OZ", "sides", "DS"), env, null).addOnCents());
    }

    @Test
    @DisplayName("Should report the discount trace on the breakdown line")
    void shouldTraceDiscount() {
        PricingResult result = engine.price(TestJson.fixture("banner"), Map.of("weight", "13OZ"),
                Map.of("sqft", 10, "quantity", 5), PricingOptions.defaults());

        assertEquals(1, result.breakdown().size());
        BreakdownLine line = result.breakdown().get(0);
        assertEquals("price_root", line.nodeId());
        assertEquals(0, line.componentIndex());
        assertEquals("PER_UNIT", line.kind());
        assertEquals(50.0, line.quantity());
        assertEquals(90L, line.unitPriceCents());
        assertEquals(4500, line.amountCents());
        assertEquals(5000, line.discountDebug().amountCentsBeforeDiscount());
        assertEquals(100, line.discountDebug().unitPriceCentsBeforeDiscount());
    }

    @Test
    @DisplayName("Should fall back to the option param default without a weight")
    void shouldUseParamDefault() {
        PricingResult result = engine.price(TestJson.fixture("banner"), Map.of(),
                Map.of("sqft", 10, "quantity", 5), null);

        assertEquals(0, result.addOnCents());
        assertTrue(result.breakdown().isEmpty());
    }

    @Test
    @DisplayName("Should give equal results for repeated calls")
    void shouldBeIdempotent() {
        PricingTree tree = TestJson.fixture("banner");
        Map<String, Object> selections = Map.of("weight", "18OZ", "sides", "DS");
        Map<String, Object> env = Map.of("sqft", 4, "quantity", 30);

        assertEquals(engine.price(tree, selections, env, null), engine.price(tree, selections, env, null));
    }

    // ========================================================================
    // Computed quantities
    // ========================================================================

    @Test
    @DisplayName("Should charge grommets over the included count")
    void shouldPriceGrommetOverage() {
        PricingTree tree = TestJson.fixture("grommet");
        Map<String, Object> env = Map.of("widthIn", 24, "heightIn", 48);

        assertEquals(0, engine.price(tree, Map.of(), env, null).addOnCents());
        assertEquals(100, engine.price(tree, Map.of("grommetSpacingIn", 12), env, null).addOnCents());
        assertEquals(0, engine.price(tree, Map.of("grommets", false, "grommetSpacingIn", 12), env, null)
                .addOnCents());
    }

    @Test
    @DisplayName("Should derive grommet materials from the computed count")
    void shouldEmitGrommetMaterials() {
        PricingTree tree = TestJson.fixture("grommet");
        Map<String, Object> env = Map.of("widthIn", 24, "heightIn", 48);

        List<MaterialLine> materials = engine.materials(tree, Map.of(), env, null);

        assertEquals(List.of(new MaterialLine("GROMMET-BRASS-10", 6.0, "ea", "grommet_price", 0)), materials);
        assertTrue(engine.materials(tree, Map.of("grommets", false), env, null).isEmpty());
    }

    @Test
    @DisplayName("Should propose extrusion child items only when enabled")
    void shouldProposeExtrusion() {
        PricingTree tree = TestJson.fixture("extrusion");
        Map<String, Object> env = Map.of("perimeterIn", 25);

        List<ChildItemProposal> proposals = engine.childItemProposals(tree, Map.of("extrusionEnabled", true), env, null);

        assertEquals(1, proposals.size());
        ChildItemProposal proposal = proposals.get(0);
        assertEquals("inlineSku", proposal.kind());
        assertEquals("EXT-FRAME-12", proposal.skuRef());
        assertNull(proposal.childProductId());
        assertEquals(3.0, proposal.qty());
        assertEquals(450L, proposal.unitPriceCents());
        assertEquals(1350L, proposal.amountCents());
        assertEquals("separateLine", proposal.invoiceVisibility());
        assertEquals("extrusion_price", proposal.sourceNodeId());

        assertTrue(engine.childItemProposals(tree, Map.of(), env, null).isEmpty());
        assertEquals(1, engine.materials(tree, Map.of("extrusionEnabled", true), env, null).size());
        assertEquals(0, engine.price(tree, Map.of("extrusionEnabled", true), env, null).addOnCents());
    }

    @Test
    @DisplayName("Should drop non-positive material quantities")
    void shouldDropNonPositiveMaterials() {
        List<MaterialLine> materials = engine.materials(TestJson.fixture("extrusion"),
                Map.of("extrusionEnabled", true), Map.of("perimeterIn", 0), null);

        assertTrue(materials.isEmpty());
    }

    // ========================================================================
    // Discounts
    // ========================================================================

    @Test
    @DisplayName("Should only discount eligible components")
    void shouldRespectDiscountEligibility() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [
                    {'kind': 'PER_UNIT',
                     'quantityRef': {'op': 'literal', 'value': 10},
                     'unitPriceRef': {'op': 'literal', 'value': 1000},
                     'discount': {'discountScope': 'volume', 'volumeTrigger': 'componentQty',
                                  'discountMethod': 'percentage',
                                  'volumePercentTiers': [{'minQty': 1, 'percentOff': 10}]}},
                    {'kind': 'PER_UNIT',
                     'quantityRef': {'op': 'literal', 'value': 10},
                     'unitPriceRef': {'op': 'literal', 'value': 25},
                     'discount': {'discountEligible': false, 'discountScope': 'volume',
                                  'volumeTrigger': 'componentQty', 'discountMethod': 'percentage',
                                  'volumePercentTiers': [{'minQty': 1, 'percentOff': 10}]}}
                  ]}}],
                  'edges': []
                }
                """);

        PricingResult result = engine.price(tree, Map.of(), Map.of(), null);

        assertEquals(9250, result.addOnCents());
        assertEquals(List.of(9000L, 250L), result.breakdown().stream().map(BreakdownLine::amountCents).toList());
        assertNull(result.breakdown().get(1).discountDebug());
    }

    @Test
    @DisplayName("Should apply the customer tier step before the volume step")
    void shouldApplyTierThenVolume() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [
                    {'kind': 'PER_UNIT',
                     'quantityRef': {'op': 'literal', 'value': 10},
                     'unitPriceRef': {'op': 'literal', 'value': 100},
                     'discount': {'discountScope': 'customerTier+volume', 'volumeTrigger': 'productQty',
                                  'discountMethod': 'percentage',
                                  'customerTierPercentByTier': {'wholesale': 10},
                                  'volumePercentTiers': [{'minQty': 10, 'percentOff': 10}]}}
                  ]}}],
                  'edges': []
                }
                """);

        PricingResult result = engine.price(tree, Map.of(), Map.of("quantity", 10),
                PricingOptions.forTier(PricingTier.WHOLESALE));

        BreakdownLine line = result.breakdown().get(0);
        assertEquals(810, result.addOnCents());
        assertEquals(81L, line.unitPriceCents());
        assertEquals(100, line.discountDebug().unitPriceCentsBeforeDiscount());
        assertEquals(81, line.discountDebug().unitPriceCentsAfterDiscount());
        assertEquals(90, line.discountDebug().tierStep().unitPriceCentsAfterTier());
    }

    // ========================================================================
    // Base price and pricebook
    // ========================================================================

    @Test
    @DisplayName("Should prepend the base price line")
    void shouldPrependBasePrice() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'meta': {'pricingV2': {'base': {'perPieceCents': 500, 'minimumChargeCents': 300}}},
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [
                    {'kind': 'FLAT', 'unitPriceRef': {'op': 'ref', 'ref': {'kind': 'pricebookRef', 'key': 'SETUP'}}}
                  ]}}],
                  'edges': []
                }
                """);

        PricingResult result = engine.price(tree, Map.of(), Map.of("quantity", 2),
                PricingOptions.withPricebook(Map.of("SETUP", 1500)));

        assertEquals(2500, result.addOnCents());
        BreakdownLine base = result.breakdown().get(0);
        assertEquals(BreakdownLine.BASE_NODE_ID, base.nodeId());
        assertEquals(BreakdownLine.BASE_PRICE_KIND, base.kind());
        assertEquals(1000, base.amountCents());
        assertEquals(500L, base.unitPriceCents());
        assertEquals("FLAT", result.breakdown().get(1).kind());
        assertNull(result.breakdown().get(1).quantity());

        PricingResult zeroQty = engine.price(tree, Map.of(), Map.of("quantity", 0),
                PricingOptions.withPricebook(Map.of("SETUP", 1500)));
        assertEquals(300, zeroQty.breakdown().get(0).amountCents());
        assertNull(zeroQty.breakdown().get(0).unitPriceCents());
    }

    // ========================================================================
    // Failures
    // ========================================================================

    @Test
    @DisplayName("Should refuse to evaluate a tree with ingest errors")
    void shouldRejectIngestErrors() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['c'],
                  'nodes': [{'id': 'c', 'type': 'COMPUTE', 'compute': {
                    'expression': {'op': 'pow'}, 'outputs': {'v': {'type': 'NUMBER'}}}}],
                  'edges': []
                }
                """);

        TreeIngestException ex = assertThrows(TreeIngestException.class,
                () -> engine.price(tree, Map.of(), Map.of(), null));
        assertFalse(ex.getFindings().isEmpty());
    }

    @Test
    @DisplayName("Should fail on compute cycles at evaluation time")
    void shouldFailOnComputeCycle() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['c1', 'c2'],
                  'nodes': [
                    {'id': 'c1', 'type': 'COMPUTE', 'compute': {
                      'expression': {'op': 'ref', 'ref': {'kind': 'nodeOutputRef', 'nodeId': 'c2', 'outputKey': 'v'}},
                      'outputs': {'v': {'type': 'NUMBER'}}}},
                    {'id': 'c2', 'type': 'COMPUTE', 'compute': {
                      'expression': {'op': 'ref', 'ref': {'kind': 'nodeOutputRef', 'nodeId': 'c1', 'outputKey': 'v'}},
                      'outputs': {'v': {'type': 'NUMBER'}}}}
                  ],
                  'edges': []
                }
                """);

        EvaluationException ex = assertThrows(EvaluationException.class,
                () -> engine.price(tree, Map.of(), Map.of(), null));
        assertEquals("Compute dependency cycle detected during evaluation", ex.getMessage());
    }

    @Test
    @DisplayName("Should fail on non-finite amounts")
    void shouldFailOnNonFiniteAmount() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [
                    {'kind': 'PER_UNIT',
                     'quantityRef': {'op': 'div', 'left': {'op': 'literal', 'value': 1},
                                     'right': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}}},
                     'unitPriceRef': {'op': 'literal', 'value': 10}}
                  ]}}],
                  'edges': []
                }
                """);

        assertThrows(EvaluationException.class, () -> engine.price(tree, Map.of(), Map.of("sqft", 0), null));
    }

    @Test
    @DisplayName("Should fail when a compute node produces a non-finite number")
    void shouldFailOnNonFiniteCompute() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['c'],
                  'nodes': [
                    {'id': 'c', 'type': 'COMPUTE', 'compute': {
                      'expression': {'op': 'div', 'left': {'op': 'literal', 'value': 1},
                                     'right': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'quantity'}}},
                      'outputs': {'perUnit': {'type': 'NUMBER'}}}},
                    {'id': 'p', 'type': 'PRICE', 'price': {'components': [
                      {'kind': 'FLAT', 'unitPriceRef': {'op': 'literal', 'value': 100}}]}}
                  ],
                  'edges': [{'id': 'e1', 'fromNodeId': 'c', 'toNodeId': 'p'}]
                }
                """);

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> engine.price(tree, Map.of(), Map.of("quantity", 0), null));
        assertEquals("Compute node 'c' produced non-finite value Infinity", e.getMessage());
        assertEquals(100, engine.price(tree, Map.of(), Map.of("quantity", 4), null).addOnCents());
    }

    @Test
    @DisplayName("Should fail on non-finite material quantities")
    void shouldFailOnNonFiniteMaterialQty() {
        PricingTree tree = TestJson.tree("""
                {
                  'rootNodeIds': ['p'],
                  'nodes': [{'id': 'p', 'type': 'PRICE', 'price': {'components': [], 'materialEffects': [
                    {'skuRef': 'INK-CMYK', 'uom': 'ml',
                     'qtyRef': {'op': 'div', 'left': {'op': 'literal', 'value': 1},
                                'right': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}}}}
                  ]}}],
                  'edges': []
                }
                """);

        EvaluationException e = assertThrows(EvaluationException.class,
                () -> engine.materials(tree, Map.of(), Map.of("sqft", 0), null));
        assertEquals("MATERIAL 'p'[0] produced invalid quantity", e.getMessage());
    }
}
