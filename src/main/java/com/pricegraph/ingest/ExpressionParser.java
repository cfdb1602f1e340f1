package com.pricegraph.ingest;

import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.Ref;
import com.pricegraph.ref.RefKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns wire-format expressions, conditions and refs into AST records.
 * <p>
 * Malformed input never throws: a finding is recorded at the exact path and
 * the malformed slot parses as null. Ref fields are read leniently (a
 * non-string key becomes null) so that the ref resolver can report them.
 */
public final class ExpressionParser {

    private final List<Finding> findings;
    private final String entityId;

    /**
     * @param findings sink for parse findings
     * @param entityId node or edge id attached to every finding, may be null
     */
    public ExpressionParser(List<Finding> findings, String entityId) {
        this.findings = findings;
        this.entityId = entityId;
    }

    /**
     * Parse a single expression, throwing on malformed input. Intended for
     * building trees in code.
     *
     * @throws IllegalArgumentException if the value is not a well-formed expression
     */
    public static ExpressionSpec expression(Object raw) {
        List<Finding> sink = new ArrayList<>();
        ExpressionSpec expr = new ExpressionParser(sink, null).parseExpression(JsonValues.normalize(raw), "expr");
        if (expr == null || !sink.isEmpty()) {
            throw new IllegalArgumentException("Malformed expression: " + describe(sink));
        }
        return expr;
    }

    /**
     * Parse a single condition, throwing on malformed input.
     *
     * @throws IllegalArgumentException if the value is not a well-formed condition
     */
    public static ConditionRule condition(Object raw) {
        List<Finding> sink = new ArrayList<>();
        ConditionRule rule = new ExpressionParser(sink, null).parseCondition(JsonValues.normalize(raw), "condition");
        if (rule == null || !sink.isEmpty()) {
            throw new IllegalArgumentException("Malformed condition: " + describe(sink));
        }
        return rule;
    }

    private static String describe(List<Finding> sink) {
        return sink.isEmpty() ? "not an AST object" : sink.get(0).path() + ": " + sink.get(0).message();
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public ExpressionSpec parseExpression(Object raw, String path) {
        Map<String, Object> map = JsonValues.asMap(raw);
        if (map == null || !(map.get("op") instanceof String op)) {
            fail(FindingCodes.EXPR_PARSE_FAIL, "ExpressionSpec is not a valid AST object", path);
            return null;
        }

        switch (op) {
            case "literal":
                return new ExpressionSpec.Literal(map.get("value"));
            case "ref": {
                Ref ref = parseRef(map.get("ref"), path + ".ref");
                return ref == null ? null : new ExpressionSpec.RefExpr(ref);
            }
            case "and":
            case "or": {
                List<ExpressionSpec> args = parseArgs(map, path);
                if (args == null) {
                    return null;
                }
                ExpressionSpec.LogicalOp logical = op.equals("and")
                        ? ExpressionSpec.LogicalOp.AND : ExpressionSpec.LogicalOp.OR;
                return new ExpressionSpec.Logical(logical, args);
            }
            case "not": {
                ExpressionSpec arg = parseExpression(map.get("arg"), path + ".arg");
                return arg == null ? null : new ExpressionSpec.Not(arg);
            }
            case "coalesce":
            case "concat": {
                List<ExpressionSpec> args = parseArgs(map, path);
                if (args == null) {
                    return null;
                }
                ExpressionSpec.VariadicOp variadic = op.equals("coalesce")
                        ? ExpressionSpec.VariadicOp.COALESCE : ExpressionSpec.VariadicOp.CONCAT;
                return new ExpressionSpec.Variadic(variadic, args);
            }
            case "abs": {
                String field = map.containsKey("arg") ? "arg" : "x";
                ExpressionSpec x = parseExpression(map.get(field), path + "." + field);
                return x == null ? null : new ExpressionSpec.Unary(ExpressionSpec.UnaryOp.ABS, x);
            }
            case "floor":
            case "ceil":
            case "exists":
            case "strlen": {
                ExpressionSpec x = parseExpression(map.get("x"), path + ".x");
                if (x == null) {
                    return null;
                }
                ExpressionSpec.UnaryOp unary = ExpressionSpec.UnaryOp.valueOf(op.toUpperCase(Locale.ROOT));
                return new ExpressionSpec.Unary(unary, x);
            }
            case "clamp": {
                ExpressionSpec x = parseExpression(map.get("x"), path + ".x");
                ExpressionSpec lo = parseExpression(map.get("lo"), path + ".lo");
                ExpressionSpec hi = parseExpression(map.get("hi"), path + ".hi");
                return x == null || lo == null || hi == null ? null : new ExpressionSpec.Clamp(x, lo, hi);
            }
            case "round": {
                ExpressionSpec x = parseExpression(map.get("x"), path + ".x");
                ExpressionSpec digits = null;
                if (map.get("digits") != null) {
                    digits = parseExpression(map.get("digits"), path + ".digits");
                    if (digits == null) {
                        return null;
                    }
                }
                return x == null ? null : new ExpressionSpec.Round(x, digits);
            }
            case "if": {
                ExpressionSpec cond = parseExpression(map.get("cond"), path + ".cond");
                ExpressionSpec then = parseExpression(map.get("then"), path + ".then");
                ExpressionSpec otherwise = parseExpression(map.get("else"), path + ".else");
                return cond == null || then == null || otherwise == null
                        ? null : new ExpressionSpec.If(cond, then, otherwise);
            }
            default:
                break;
        }

        ExpressionSpec.BinaryOp binary = binaryOp(op);
        if (binary == null) {
            fail(FindingCodes.EXPR_PARSE_FAIL, "Unknown ExpressionSpec op '" + op + "'", path);
            return null;
        }
        ExpressionSpec left = parseExpression(map.get("left"), path + ".left");
        ExpressionSpec right = parseExpression(map.get("right"), path + ".right");
        return left == null || right == null ? null : new ExpressionSpec.Binary(binary, left, right);
    }

    private List<ExpressionSpec> parseArgs(Map<String, Object> map, String path) {
        List<Object> rawArgs = JsonValues.asList(map.get("args"));
        if (rawArgs == null) {
            fail(FindingCodes.EXPR_PARSE_FAIL, "ExpressionSpec.args must be an array", path + ".args");
            return null;
        }
        List<ExpressionSpec> args = new ArrayList<>(rawArgs.size());
        boolean ok = true;
        for (int i = 0; i < rawArgs.size(); i++) {
            ExpressionSpec arg = parseExpression(rawArgs.get(i), path + ".args[" + i + "]");
            if (arg == null) {
                ok = false;
            }
            args.add(arg);
        }
        return ok ? args : null;
    }

    private static ExpressionSpec.BinaryOp binaryOp(String op) {
        for (ExpressionSpec.BinaryOp candidate : ExpressionSpec.BinaryOp.values()) {
            if (candidate.wire().equals(op)) {
                return candidate;
            }
        }
        return null;
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    public ConditionRule parseCondition(Object raw, String path) {
        Map<String, Object> map = JsonValues.asMap(raw);
        if (map == null || !(map.get("op") instanceof String op)) {
            fail(FindingCodes.EDGE_CONDITION_INVALID, "ConditionRule is not a valid AST object", path);
            return null;
        }

        switch (op) {
            case "AND":
            case "OR": {
                List<Object> rawArgs = JsonValues.asList(map.get("args"));
                if (rawArgs == null) {
                    fail(FindingCodes.EDGE_CONDITION_INVALID, "ConditionRule.args must be an array", path + ".args");
                    return null;
                }
                List<ConditionRule> args = new ArrayList<>(rawArgs.size());
                boolean ok = true;
                for (int i = 0; i < rawArgs.size(); i++) {
                    ConditionRule arg = parseCondition(rawArgs.get(i), path + ".args[" + i + "]");
                    ok &= arg != null;
                    args.add(arg);
                }
                if (!ok) {
                    return null;
                }
                ConditionRule.JunctionOp junction = op.equals("AND")
                        ? ConditionRule.JunctionOp.AND : ConditionRule.JunctionOp.OR;
                return new ConditionRule.Junction(junction, args);
            }
            case "NOT": {
                ConditionRule arg = parseCondition(map.get("arg"), path + ".arg");
                return arg == null ? null : new ConditionRule.Negation(arg);
            }
            case "EXISTS": {
                ExpressionSpec value = parseExpression(map.get("value"), path + ".value");
                return value == null ? null : new ConditionRule.Exists(value);
            }
            case "IN": {
                ExpressionSpec value = parseExpression(map.get("value"), path + ".value");
                List<Object> rawOptions = JsonValues.asList(map.get("options"));
                if (rawOptions == null) {
                    fail(FindingCodes.EDGE_CONDITION_INVALID, "IN requires an options array", path + ".options");
                    return null;
                }
                List<ExpressionSpec> options = new ArrayList<>(rawOptions.size());
                boolean ok = value != null;
                for (int i = 0; i < rawOptions.size(); i++) {
                    ExpressionSpec option = parseExpression(rawOptions.get(i), path + ".options[" + i + "]");
                    ok &= option != null;
                    options.add(option);
                }
                return ok ? new ConditionRule.In(value, options) : null;
            }
            default:
                break;
        }

        ConditionRule.ComparisonOp comparison = comparisonOp(op);
        if (comparison == null) {
            fail(FindingCodes.EDGE_CONDITION_INVALID, "Unknown ConditionRule op '" + op + "'", path);
            return null;
        }
        ExpressionSpec left = parseExpression(map.get("left"), path + ".left");
        ExpressionSpec right = parseExpression(map.get("right"), path + ".right");
        return left == null || right == null ? null : new ConditionRule.Comparison(comparison, left, right);
    }

    private static ConditionRule.ComparisonOp comparisonOp(String op) {
        for (ConditionRule.ComparisonOp candidate : ConditionRule.ComparisonOp.values()) {
            if (candidate.name().equals(op)) {
                return candidate;
            }
        }
        return null;
    }

    // ========================================================================
    // Refs
    // ========================================================================

    public Ref parseRef(Object raw, String path) {
        Map<String, Object> map = JsonValues.asMap(raw);
        if (map == null) {
            fail(FindingCodes.EXPR_PARSE_FAIL, "Ref is not a valid object", path);
            return null;
        }
        RefKind kind = map.get("kind") instanceof String s ? RefKind.fromWire(s) : null;
        if (kind == null) {
            fail(FindingCodes.EXPR_PARSE_FAIL, "Unknown ref kind '" + map.get("kind") + "'", path + ".kind");
            return null;
        }

        return switch (kind) {
            case CONSTANT -> new Ref.Constant(map.get("value"));
            case SELECTION -> new Ref.Selection(string(map, "selectionKey"));
            case EFFECTIVE -> new Ref.Effective(string(map, "selectionKey"));
            case NODE_OUTPUT -> new Ref.NodeOutput(string(map, "nodeId"), string(map, "outputKey"));
            case ENV -> new Ref.Env(string(map, "envKey"));
            case PRICEBOOK -> new Ref.Pricebook(string(map, "key"));
            case OPTION_VALUE_PARAM -> new Ref.OptionValueParam(string(map, "selectionKey"),
                    string(map, "paramPath"), map.get("defaultValue"), map.get("defaultValue") != null);
            case OPTION_VALUE_PARAM_JSON -> new Ref.OptionValueParamJson(string(map, "selectionKey"),
                    string(map, "paramPath"), map.get("defaultValue"), map.get("defaultValue") != null);
        };
    }

    private static String string(Map<String, Object> map, String key) {
        return map.get(key) instanceof String s ? s : null;
    }

    private void fail(String code, String message, String path) {
        findings.add(Finding.error(code, message, path, entityId));
    }
}
