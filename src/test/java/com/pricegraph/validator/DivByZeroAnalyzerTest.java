package com.pricegraph.validator;

import com.pricegraph.TestJson;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DivByZeroAnalyzer.
 */
class DivByZeroAnalyzerTest {

    private static final String WIDTH = "{'op': 'ref', 'ref': {'kind': 'envRef', 'envKey': 'widthIn'}}";
    private static final String SPACING =
            "{'op': 'ref', 'ref': {'kind': 'selectionRef', 'selectionKey': 'spacing'}}";

    private static List<Finding> analyze(String json, boolean strict) {
        return DivByZeroAnalyzer.analyze(TestJson.expr(json), strict, "expr", "c1");
    }

    private static String div(String left, String right) {
        return "{'op': 'div', 'left': " + left + ", 'right': " + right + "}";
    }

    private static String literal(Object value) {
        return "{'op': 'literal', 'value': " + value + "}";
    }

    @Test
    @DisplayName("Should reject division by literal zero regardless of policy")
    void shouldRejectLiteralZero() {
        List<Finding> findings = analyze(div(WIDTH, literal(0)), false);

        assertEquals(1, findings.size());
        assertEquals(FindingCodes.EXPR_DIV_BY_ZERO_UNGUARDED, findings.get(0).code());
        assertEquals(Severity.ERROR, findings.get(0).severity());
        assertEquals("Division by literal zero is not allowed", findings.get(0).message());
        assertEquals("expr", findings.get(0).path());
        assertEquals("c1", findings.get(0).entityId());
    }

    @Test
    @DisplayName("Should accept non-zero literal denominators")
    void shouldAcceptNonZeroLiteral() {
        assertTrue(analyze(div(WIDTH, literal(12)), true).isEmpty());
    }

    @Test
    @DisplayName("Should warn on unguarded denominators and error when strict")
    void shouldFlagUnguarded() {
        List<Finding> loose = analyze(div(WIDTH, SPACING), false);
        List<Finding> strict = analyze(div(WIDTH, SPACING), true);

        assertEquals(Severity.WARNING, loose.get(0).severity());
        assertEquals(Severity.ERROR, strict.get(0).severity());
        assertEquals("Division denominator may be zero; guard required (if/eq-zero or clamp)",
                loose.get(0).message());
    }

    @Test
    @DisplayName("Should recognize the if/eq-zero guard in either operand order")
    void shouldRecognizeIfGuard() {
        String guarded = "{'op': 'if', 'cond': {'op': 'eq', 'left': " + SPACING + ", 'right': " + literal(0) + "},"
                + " 'then': " + literal(0) + ", 'else': " + div(WIDTH, SPACING) + "}";
        String swapped = "{'op': 'if', 'cond': {'op': 'eq', 'left': " + literal(0) + ", 'right': " + SPACING + "},"
                + " 'then': " + literal(0) + ", 'else': " + div(WIDTH, SPACING) + "}";

        assertTrue(analyze(guarded, true).isEmpty());
        assertTrue(analyze(swapped, true).isEmpty());
    }

    @Test
    @DisplayName("Should not accept a guard that tests a different expression")
    void shouldRejectMismatchedGuard() {
        String wrong = "{'op': 'if', 'cond': {'op': 'eq', 'left': " + WIDTH + ", 'right': " + literal(0) + "},"
                + " 'then': " + literal(0) + ", 'else': " + div(WIDTH, SPACING) + "}";

        List<Finding> findings = analyze(wrong, false);

        assertEquals(1, findings.size());
        assertEquals("expr.else", findings.get(0).path());
    }

    @Test
    @DisplayName("Should recognize clamp with a positive lower bound")
    void shouldRecognizeClampGuard() {
        String clamped = "{'op': 'clamp', 'x': " + SPACING + ", 'lo': " + literal(1) + ", 'hi': " + literal(100) + "}";
        String zeroLo = "{'op': 'clamp', 'x': " + SPACING + ", 'lo': " + literal(0) + ", 'hi': " + literal(100) + "}";

        assertTrue(analyze(div(WIDTH, clamped), true).isEmpty());
        assertEquals(1, analyze(div(WIDTH, zeroLo), true).size());
    }

    @Test
    @DisplayName("Should report nested divisions at their own paths")
    void shouldReportNestedPaths() {
        String nested = "{'op': 'ceil', 'x': " + div(WIDTH, SPACING) + "}";

        List<Finding> findings = analyze(nested, false);

        assertEquals("expr.x", findings.get(0).path());
    }

    @Test
    @DisplayName("Should find divisions under every operator")
    void shouldWalkAllOperators() {
        String d = div(WIDTH, SPACING);
        String expr = "{'op': 'add',"
                + " 'left': {'op': 'coalesce', 'args': [" + SPACING + ", " + d + "]},"
                + " 'right': {'op': 'round', 'x': {'op': 'abs', 'arg': " + d + "}, 'digits': " + literal(2) + "}}";
        String logical = "{'op': 'and', 'args': [{'op': 'not', 'arg': {'op': 'gt', 'left': " + d
                + ", 'right': " + literal(1) + "}}]}";

        List<String> paths = analyze(expr, false).stream().map(Finding::path).toList();
        List<String> logicalPaths = analyze(logical, false).stream().map(Finding::path).toList();

        assertEquals(List.of("expr.left.args[1]", "expr.right.x.arg"), paths);
        assertEquals(List.of("expr.args[0].arg.left"), logicalPaths);
    }
}
