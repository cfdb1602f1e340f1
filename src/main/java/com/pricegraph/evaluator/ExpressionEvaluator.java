package com.pricegraph.evaluator;

import com.pricegraph.exception.EvaluationException;
import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ConditionVisitor;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.expression.ExpressionVisitor;
import com.pricegraph.ingest.JsonValues;
import com.pricegraph.ref.Ref;
import com.pricegraph.ref.RefVisitor;
import com.pricegraph.signature.Canonicalizer;

import java.util.List;
import java.util.Map;

/**
 * Runtime semantics of expressions, conditions and refs.
 * <p>
 * Equality is strict: numbers compare numerically, strings and booleans by
 * value, everything else by identity; there is no cross-type coercion.
 * Logical operators use truthiness. Numeric operators fail with
 * {@link EvaluationException} when an operand is not a finite number.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
    }

    public static Object evaluate(ExpressionSpec expr, EvaluationContext ctx) {
        return expr.accept(new ExpressionEval(ctx));
    }

    /**
     * Evaluate a condition. A null rule is unconditionally true.
     */
    public static boolean test(ConditionRule rule, EvaluationContext ctx) {
        return rule == null || rule.accept(new ConditionEval(ctx));
    }

    public static Object resolveRef(Ref ref, EvaluationContext ctx) {
        return ref.accept(new RefEval(ctx));
    }

    static boolean strictEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number x && b instanceof Number y) {
            return x.doubleValue() == y.doubleValue();
        }
        if (a instanceof String || a instanceof Boolean) {
            return a.equals(b);
        }
        return a == b;
    }

    static double number(Object value, String message) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        throw new EvaluationException(message);
    }

    static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            return Canonicalizer.formatNumber(n);
        }
        return String.valueOf(value);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static final class ExpressionEval implements ExpressionVisitor<Object> {

        private final EvaluationContext ctx;

        ExpressionEval(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        private Object eval(ExpressionSpec expr) {
            return expr.accept(this);
        }

        private double num(ExpressionSpec expr, String message) {
            return number(eval(expr), message);
        }

        @Override
        public Object visitLiteral(ExpressionSpec.Literal expr) {
            return expr.value();
        }

        @Override
        public Object visitRef(ExpressionSpec.RefExpr expr) {
            return resolveRef(expr.ref(), ctx);
        }

        @Override
        public Object visitLogical(ExpressionSpec.Logical expr) {
            boolean and = expr.operator() == ExpressionSpec.LogicalOp.AND;
            for (ExpressionSpec arg : expr.args()) {
                boolean value = JsonValues.truthy(eval(arg));
                if (and && !value) {
                    return false;
                }
                if (!and && value) {
                    return true;
                }
            }
            return and;
        }

        @Override
        public Object visitNot(ExpressionSpec.Not expr) {
            return !JsonValues.truthy(eval(expr.arg()));
        }

        @Override
        public Object visitBinary(ExpressionSpec.Binary expr) {
            String op = expr.op();
            if (expr.operator().isEquality()) {
                boolean equal = strictEquals(eval(expr.left()), eval(expr.right()));
                return expr.operator() == ExpressionSpec.BinaryOp.EQ ? equal : !equal;
            }

            double left = num(expr.left(), op + "(): left must be NUMBER");
            double right = num(expr.right(), op + "(): right must be NUMBER");
            switch (expr.operator()) {
                case LT:
                    return left < right;
                case LTE:
                    return left <= right;
                case GT:
                    return left > right;
                case GTE:
                    return left >= right;
                case ADD:
                    return left + right;
                case SUB:
                    return left - right;
                case MUL:
                    return left * right;
                case DIV:
                    return left / right;
                case MOD:
                    return left % right;
                case MIN:
                    return Math.min(left, right);
                case MAX:
                    return Math.max(left, right);
                default:
                    throw new EvaluationException("Unsupported operator '" + op + "'");
            }
        }

        @Override
        public Object visitUnary(ExpressionSpec.Unary expr) {
            switch (expr.operator()) {
                case EXISTS:
                    return eval(expr.x()) != null;
                case STRLEN:
                    return (double) text(eval(expr.x())).length();
                case ABS:
                    return Math.abs(num(expr.x(), "abs(): arg must be NUMBER"));
                case FLOOR:
                    return Math.floor(num(expr.x(), "floor(): x must be NUMBER"));
                case CEIL:
                    return Math.ceil(num(expr.x(), "ceil(): x must be NUMBER"));
                default:
                    throw new EvaluationException("Unsupported operator '" + expr.op() + "'");
            }
        }

        @Override
        public Object visitClamp(ExpressionSpec.Clamp expr) {
            double x = num(expr.x(), "clamp(): x must be NUMBER");
            double lo = num(expr.lo(), "clamp(): lo must be NUMBER");
            double hi = num(expr.hi(), "clamp(): hi must be NUMBER");
            return Math.min(Math.max(x, lo), hi);
        }

        @Override
        public Object visitRound(ExpressionSpec.Round expr) {
            double x = num(expr.x(), "round(): x must be NUMBER");
            double digits = expr.digits() == null ? 0 : num(expr.digits(), "round(): digits must be NUMBER");
            double pow = Math.pow(10, digits);
            return Math.floor(x * pow + 0.5) / pow;
        }

        @Override
        public Object visitIf(ExpressionSpec.If expr) {
            return JsonValues.truthy(eval(expr.cond())) ? eval(expr.then()) : eval(expr.otherwise());
        }

        @Override
        public Object visitVariadic(ExpressionSpec.Variadic expr) {
            if (expr.operator() == ExpressionSpec.VariadicOp.CONCAT) {
                StringBuilder out = new StringBuilder();
                for (ExpressionSpec arg : expr.args()) {
                    out.append(text(eval(arg)));
                }
                return out.toString();
            }
            for (ExpressionSpec arg : expr.args()) {
                Object value = eval(arg);
                if (value != null) {
                    return value;
                }
            }
            return null;
        }
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    private static final class ConditionEval implements ConditionVisitor<Boolean> {

        private final EvaluationContext ctx;

        ConditionEval(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public Boolean visitJunction(ConditionRule.Junction rule) {
            boolean and = rule.operator() == ConditionRule.JunctionOp.AND;
            for (ConditionRule arg : rule.args()) {
                boolean value = arg.accept(this);
                if (and && !value) {
                    return false;
                }
                if (!and && value) {
                    return true;
                }
            }
            return and;
        }

        @Override
        public Boolean visitNegation(ConditionRule.Negation rule) {
            return !rule.arg().accept(this);
        }

        @Override
        public Boolean visitExists(ConditionRule.Exists rule) {
            return evaluate(rule.value(), ctx) != null;
        }

        @Override
        public Boolean visitComparison(ConditionRule.Comparison rule) {
            String op = rule.op();
            if (rule.operator().isEquality()) {
                boolean equal = strictEquals(evaluate(rule.left(), ctx), evaluate(rule.right(), ctx));
                return rule.operator() == ConditionRule.ComparisonOp.EQ ? equal : !equal;
            }
            double left = number(evaluate(rule.left(), ctx), op + ".left must be NUMBER");
            double right = number(evaluate(rule.right(), ctx), op + ".right must be NUMBER");
            switch (rule.operator()) {
                case GT:
                    return left > right;
                case GTE:
                    return left >= right;
                case LT:
                    return left < right;
                default:
                    return left <= right;
            }
        }

        @Override
        public Boolean visitIn(ConditionRule.In rule) {
            Object value = evaluate(rule.value(), ctx);
            for (ExpressionSpec option : rule.options()) {
                if (strictEquals(evaluate(option, ctx), value)) {
                    return true;
                }
            }
            return false;
        }
    }

    // ========================================================================
    // Refs
    // ========================================================================

    private static final class RefEval implements RefVisitor<Object> {

        private final EvaluationContext ctx;

        RefEval(EvaluationContext ctx) {
            this.ctx = ctx;
        }

        @Override
        public Object visitConstant(Ref.Constant ref) {
            return ref.value();
        }

        @Override
        public Object visitSelection(Ref.Selection ref) {
            return isBlank(ref.selectionKey()) ? null : ctx.selection(ref.selectionKey());
        }

        @Override
        public Object visitEffective(Ref.Effective ref) {
            return isBlank(ref.selectionKey()) ? null : ctx.effective(ref.selectionKey());
        }

        @Override
        public Object visitNodeOutput(Ref.NodeOutput ref) {
            if (isBlank(ref.nodeId()) || isBlank(ref.outputKey())) {
                return null;
            }
            return ctx.computeOutput(ref.nodeId(), ref.outputKey());
        }

        @Override
        public Object visitEnv(Ref.Env ref) {
            return isBlank(ref.envKey()) ? null : ctx.env(ref.envKey());
        }

        @Override
        public Object visitPricebook(Ref.Pricebook ref) {
            return isBlank(ref.key()) ? null : ctx.pricebook(ref.key());
        }

        @Override
        public Object visitOptionValueParam(Ref.OptionValueParam ref) {
            Object value = optionParam(ref.selectionKey(), ref.paramPath());
            if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
                return value;
            }
            return ref.defaultValue();
        }

        @Override
        public Object visitOptionValueParamJson(Ref.OptionValueParamJson ref) {
            Object value = optionParam(ref.selectionKey(), ref.paramPath());
            return value != null ? value : ref.defaultValue();
        }

        /**
         * Walk {@code paramPath} on the option whose {@code value} equals the
         * effective selection. Returns null when any step is missing.
         */
        private Object optionParam(String selectionKey, String paramPath) {
            if (isBlank(selectionKey) || isBlank(paramPath)) {
                return null;
            }
            if (!(ctx.effective(selectionKey) instanceof String selected)) {
                return null;
            }
            List<Object> options = ctx.enumOptions(selectionKey);
            if (options == null) {
                return null;
            }

            Map<String, Object> matched = null;
            for (Object option : options) {
                Map<String, Object> map = JsonValues.asMap(option);
                if (map != null && selected.equals(map.get("value"))) {
                    matched = map;
                    break;
                }
            }
            if (matched == null) {
                return null;
            }

            Object cursor = matched;
            boolean walked = false;
            for (String part : paramPath.split("\\.")) {
                String segment = part.trim();
                if (segment.isEmpty()) {
                    continue;
                }
                Map<String, Object> map = JsonValues.asMap(cursor);
                if (map == null) {
                    return null;
                }
                cursor = map.get(segment);
                walked = true;
            }
            return walked ? cursor : null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
