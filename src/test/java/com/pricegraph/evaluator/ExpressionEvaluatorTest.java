package com.pricegraph.evaluator;

import com.pricegraph.TestJson;
import com.pricegraph.exception.EvaluationException;
import com.pricegraph.tree.PricingTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExpressionEvaluator.
 */
class ExpressionEvaluatorTest {

    private PricingTree tree;
    private EvaluationContext context;

    @BeforeEach
    void setUp() {
        tree = TestJson.fixture("banner");
        context = EvaluationContext.create(tree, Map.of("weight", "18OZ"),
                Map.of("sqft", 10, "quantity", 5), Map.of("VINYL", 325));
    }

    private Object eval(String json) {
        return ExpressionEvaluator.evaluate(TestJson.expr(json), context);
    }

    private boolean test(String json) {
        return ExpressionEvaluator.test(TestJson.condition(json), context);
    }

    // ========================================================================
    // Arithmetic
    // ========================================================================

    @Test
    @DisplayName("Should evaluate arithmetic over env refs")
    void shouldEvaluateArithmetic() {
        Object value = eval("""
                {'op': 'add',
                 'left': {'op': 'mul',
                          'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}},
                          'right': {'op': 'literal', 'value': 3}},
                 'right': {'op': 'literal', 'value': 2}}
                """);

        assertEquals(32.0, value);
    }

    @Test
    @DisplayName("Should evaluate rounding helpers")
    void shouldEvaluateRounding() {
        assertEquals(3.0, eval("{'op': 'ceil', 'x': {'op': 'literal', 'value': 2.1}}"));
        assertEquals(2.0, eval("{'op': 'floor', 'x': {'op': 'literal', 'value': 2.9}}"));
        assertEquals(4.0, eval("{'op': 'abs', 'arg': {'op': 'literal', 'value': -4}}"));
        assertEquals(1.3, eval("""
                {'op': 'round', 'x': {'op': 'literal', 'value': 1.25}, 'digits': {'op': 'literal', 'value': 1}}
                """));
        assertEquals(10.0, eval("""
                {'op': 'clamp', 'x': {'op': 'literal', 'value': 50},
                 'lo': {'op': 'literal', 'value': 1}, 'hi': {'op': 'literal', 'value': 10}}
                """));
    }

    @Test
    @DisplayName("Should fail on non-numeric arithmetic operands")
    void shouldFailOnNonNumericOperand() {
        EvaluationException ex = assertThrows(EvaluationException.class, () -> eval("""
                {'op': 'add', 'left': {'op': 'literal', 'value': 'x'}, 'right': {'op': 'literal', 'value': 1}}
                """));

        assertEquals("add(): left must be NUMBER", ex.getMessage());
    }

    @Test
    @DisplayName("Should not throw on division by zero")
    void shouldDivideByZeroToInfinity() {
        Object value = eval("{'op': 'div', 'left': {'op': 'literal', 'value': 1}, 'right': {'op': 'literal', 'value': 0}}");

        assertEquals(Double.POSITIVE_INFINITY, value);
    }

    // ========================================================================
    // Text, coalesce and branching
    // ========================================================================

    @Test
    @DisplayName("Should concat with canonical number formatting")
    void shouldConcat() {
        Object value = eval("""
                {'op': 'concat', 'args': [
                  {'op': 'literal', 'value': 'w='},
                  {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}},
                  {'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'missing'}}]}
                """);

        assertEquals("w=10", value);
    }

    @Test
    @DisplayName("Should return the first non-null coalesce argument")
    void shouldCoalesce() {
        Object value = eval("""
                {'op': 'coalesce', 'args': [
                  {'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'sides'}},
                  {'op': 'literal', 'value': 'fallback'}]}
                """);

        assertEquals("fallback", value);
    }

    @Test
    @DisplayName("Should branch on if")
    void shouldBranch() {
        Object value = eval("""
                {'op': 'if',
                 'cond': {'op': 'gt', 'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'quantity'}},
                          'right': {'op': 'literal', 'value': 3}},
                 'then': {'op': 'literal', 'value': 'bulk'},
                 'else': {'op': 'literal', 'value': 'single'}}
                """);

        assertEquals("bulk", value);
    }

    // ========================================================================
    // Refs
    // ========================================================================

    @Test
    @DisplayName("Should fall back to the input default for effectiveRef only")
    void shouldResolveEffectiveDefaults() {
        assertEquals("SS", eval("{'op': 'ref', 'ref': {'kind': 'effectiveRef', 'selectionKey': 'sides'}}"));
        assertNull(eval("{'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'sides'}}"));
    }

    @Test
    @DisplayName("Should read option parameters for the effective selection")
    void shouldResolveOptionParam() {
        assertEquals(120, ((Number) eval("""
                {'op': 'ref', 'ref': {'kind': 'optionValueParamRef', 'selectionKey': 'weight',
                  'paramPath': 'pricingParams.baseUnitPriceCentsPerSqftSS'}}
                """)).intValue());
        assertEquals(7.0, eval("""
                {'op': 'ref', 'ref': {'kind': 'optionValueParamRef', 'selectionKey': 'weight',
                  'paramPath': 'pricingParams.missing', 'defaultValue': 7}}
                """));
        assertInstanceOf(java.util.List.class, eval("""
                {'op': 'ref', 'ref': {'kind': 'optionValueParamJsonRef', 'selectionKey': 'weight',
                  'paramPath': 'pricingParams.ssVolumeUnitPriceCentsTiers'}}
                """));
    }

    @Test
    @DisplayName("Should resolve pricebook values")
    void shouldResolvePricebook() {
        assertEquals(325, ((Number) eval("{'op': 'ref', 'ref': {'kind': 'pricebookRef', 'key': 'VINYL'}}")).intValue());
        assertNull(eval("{'op': 'ref', 'ref': {'kind': 'pricebookRef', 'key': 'MESH'}}"));
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    @Test
    @DisplayName("Should treat a null condition as true")
    void shouldTreatNullConditionAsTrue() {
        assertTrue(ExpressionEvaluator.test(null, context));
    }

    @Test
    @DisplayName("Should compare numbers by value and strings strictly")
    void shouldCompareStrictly() {
        assertTrue(test("""
                {'op': 'EQ', 'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}},
                 'right': {'op': 'literal', 'value': 10.0}}
                """));
        assertFalse(test("""
                {'op': 'EQ', 'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'sqft'}},
                 'right': {'op': 'literal', 'value': '10'}}
                """));
    }

    @Test
    @DisplayName("Should evaluate junctions, IN and EXISTS")
    void shouldEvaluateJunctions() {
        assertTrue(test("""
                {'op': 'AND', 'args': [
                  {'op': 'IN', 'value': {'op': 'ref', 'ref': {'kind': 'effectiveRef', 'selectionKey': 'weight'}},
                   'options': [{'op': 'literal', 'value': '13OZ'}, {'op': 'literal', 'value': '18OZ'}]},
                  {'op': 'NOT', 'arg': {'op': 'EXISTS',
                   'value': {'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'sides'}}}}]}
                """));
        assertFalse(test("""
                {'op': 'OR', 'args': [
                  {'op': 'GT', 'left': {'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'quantity'}},
                   'right': {'op': 'literal', 'value': 5}}]}
                """));
    }

    @Test
    @DisplayName("Should fail ordering comparisons on missing values")
    void shouldFailOrderingOnNull() {
        assertThrows(EvaluationException.class, () -> test("""
                {'op': 'GT', 'left': {'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'sides'}},
                 'right': {'op': 'literal', 'value': 1}}
                """));
    }
}
