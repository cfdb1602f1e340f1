package com.pricegraph.engine;

import com.pricegraph.TestJson;
import com.pricegraph.config.EngineSettings;
import com.pricegraph.evaluator.PricingOptions;
import com.pricegraph.exception.TreeIngestException;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.tree.PricingTree;
import com.pricegraph.validator.EvalPurpose;
import com.pricegraph.validator.ValidationMode;
import com.pricegraph.validator.ValidationPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultPriceGraphEngine.
 */
class DefaultPriceGraphEngineTest {

    private PriceGraphEngine engine;

    @BeforeEach
    void setUp() {
        engine = PriceGraphEngineFactory.createDefault();
    }

    // ========================================================================
    // Ingest and validation
    // ========================================================================

    @Test
    @DisplayName("Should ingest JSON text and validate it for publish")
    void shouldIngestAndValidate() {
        PricingTree tree = engine.ingest(TestJson.fixtureText("grommet"));

        assertEquals("tree-grommet-v1", tree.id());
        assertTrue(engine.validate(tree, ValidationMode.publish()).ok());
        assertTrue(engine.validate((Object) TestJson.fixtureText("grommet"), ValidationMode.publish()).ok());
    }

    @Test
    @DisplayName("Should turn a non-object tree into a failed result")
    void shouldReportNonObjectTree() {
        ValidationResult result = engine.validate((Object) List.of(1, 2), ValidationMode.draft());

        assertFalse(result.ok());
        assertTrue(result.hasError(FindingCodes.TREE_INVALID));
        assertThrows(TreeIngestException.class, () -> engine.ingest(List.of(1, 2)));
    }

    @Test
    @DisplayName("Should report malformed JSON text as an invalid tree")
    void shouldReportMalformedJson() {
        ValidationResult result = engine.validate((Object) "{not json", ValidationMode.draft());

        assertFalse(result.ok());
        assertEquals(FindingCodes.TREE_INVALID, result.errors().get(0).code());
    }

    @Test
    @DisplayName("Should apply the configured validation policy")
    void shouldApplyPolicy() {
        String tree = """
                {'status': 'DRAFT', 'rootNodeIds': ['c'],
                 'nodes': [{'id': 'c', 'type': 'COMPUTE', 'compute': {
                   'expression': {'op': 'div',
                     'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'widthIn'}},
                     'right': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'heightIn'}}},
                   'outputs': {'v': {'type': 'NUMBER'}}}}],
                 'edges': []}
                """;
        PriceGraphEngine strict = PriceGraphEngineFactory.create(
                new EngineSettings("strict", ValidationPolicy.strict(), EnvKeys.defaults()));

        assertTrue(engine.validate(TestJson.tree(tree), ValidationMode.publish()).ok());
        assertTrue(strict.validate(TestJson.tree(tree), ValidationMode.publish())
                .hasError(FindingCodes.EXPR_DIV_BY_ZERO_UNGUARDED));
    }

    @Test
    @DisplayName("Should gate evaluation on tree status")
    void shouldGateEvaluation() {
        PricingTree draft = TestJson.fixture("grommet");

        assertFalse(engine.validate(draft, ValidationMode.evalGate(EvalPurpose.PERSIST)).ok());
        assertTrue(engine.validate(draft, ValidationMode.evalGate(EvalPurpose.PREVIEW)).ok());
    }

    // ========================================================================
    // Evaluation
    // ========================================================================

    @Test
    @DisplayName("Should delegate pricing, materials and child items")
    void shouldEvaluate() {
        PricingTree banner = TestJson.fixture("banner");
        PricingTree extrusion = TestJson.fixture("extrusion");

        assertEquals(6000, engine.price(banner, Map.of("weight", "18OZ"), Map.of("sqft", 10, "quantity", 5),
                PricingOptions.defaults()).addOnCents());
        assertEquals(1, engine.materials(extrusion, Map.of("extrusionEnabled", true),
                Map.of("perimeterIn", 25), null).size());
        assertEquals(1, engine.childItemProposals(extrusion, Map.of("extrusionEnabled", true),
                Map.of("perimeterIn", 25), null).size());
    }

    @Test
    @DisplayName("Should sign wrapped and flat selections alike")
    void shouldSignSelections() {
        String flat = engine.signature("tv1", Map.of("size", "L", "qty", 2), Map.of("widthIn", 24));
        String wrapped = engine.signature("tv1",
                Map.of("explicitSelections", Map.of("qty", 2.0, "size", "L")), Map.of("widthIn", 24));

        assertEquals(flat, wrapped);
        assertNotEquals(flat, engine.signature("tv1", Map.of("size", "L", "qty", 2), null));
    }
}
