package com.pricegraph.expression;

import com.pricegraph.ref.Ref;
import com.pricegraph.ref.RefVisitor;
import com.pricegraph.signature.Canonicalizer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts AST nodes back to plain JSON values (maps, lists, scalars). The
 * canonical form of that value is the structural key used to compare
 * sub-expressions.
 */
public final class AstJson {

    private static final ExprToJson EXPR = new ExprToJson();
    private static final RuleToJson RULE = new RuleToJson();
    private static final RefToJson REF = new RefToJson();

    private AstJson() {
    }

    public static Object toJson(ExpressionSpec expr) {
        return expr == null ? null : expr.accept(EXPR);
    }

    public static Object toJson(ConditionRule rule) {
        return rule == null ? null : rule.accept(RULE);
    }

    public static Object toJson(Ref ref) {
        return ref == null ? null : ref.accept(REF);
    }

    /**
     * Structural key of an expression: equal for structurally equal ASTs.
     */
    public static String key(ExpressionSpec expr) {
        return Canonicalizer.canonicalize(toJson(expr));
    }

    private static Map<String, Object> node(String op) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("op", op);
        return map;
    }

    private static List<Object> exprs(List<ExpressionSpec> args) {
        List<Object> out = new ArrayList<>(args.size());
        for (ExpressionSpec arg : args) {
            out.add(toJson(arg));
        }
        return out;
    }

    private static final class ExprToJson implements ExpressionVisitor<Object> {

        @Override
        public Object visitLiteral(ExpressionSpec.Literal expr) {
            Map<String, Object> map = node(expr.op());
            map.put("value", expr.value());
            return map;
        }

        @Override
        public Object visitRef(ExpressionSpec.RefExpr expr) {
            Map<String, Object> map = node(expr.op());
            map.put("ref", toJson(expr.ref()));
            return map;
        }

        @Override
        public Object visitLogical(ExpressionSpec.Logical expr) {
            Map<String, Object> map = node(expr.op());
            map.put("args", exprs(expr.args()));
            return map;
        }

        @Override
        public Object visitNot(ExpressionSpec.Not expr) {
            Map<String, Object> map = node(expr.op());
            map.put("arg", toJson(expr.arg()));
            return map;
        }

        @Override
        public Object visitBinary(ExpressionSpec.Binary expr) {
            Map<String, Object> map = node(expr.op());
            map.put("left", toJson(expr.left()));
            map.put("right", toJson(expr.right()));
            return map;
        }

        @Override
        public Object visitUnary(ExpressionSpec.Unary expr) {
            Map<String, Object> map = node(expr.op());
            map.put(expr.operator() == ExpressionSpec.UnaryOp.ABS ? "arg" : "x", toJson(expr.x()));
            return map;
        }

        @Override
        public Object visitClamp(ExpressionSpec.Clamp expr) {
            Map<String, Object> map = node(expr.op());
            map.put("x", toJson(expr.x()));
            map.put("lo", toJson(expr.lo()));
            map.put("hi", toJson(expr.hi()));
            return map;
        }

        @Override
        public Object visitRound(ExpressionSpec.Round expr) {
            Map<String, Object> map = node(expr.op());
            map.put("x", toJson(expr.x()));
            if (expr.digits() != null) {
                map.put("digits", toJson(expr.digits()));
            }
            return map;
        }

        @Override
        public Object visitIf(ExpressionSpec.If expr) {
            Map<String, Object> map = node(expr.op());
            map.put("cond", toJson(expr.cond()));
            map.put("then", toJson(expr.then()));
            map.put("else", toJson(expr.otherwise()));
            return map;
        }

        @Override
        public Object visitVariadic(ExpressionSpec.Variadic expr) {
            Map<String, Object> map = node(expr.op());
            map.put("args", exprs(expr.args()));
            return map;
        }
    }

    private static final class RuleToJson implements ConditionVisitor<Object> {

        @Override
        public Object visitJunction(ConditionRule.Junction rule) {
            Map<String, Object> map = node(rule.op());
            List<Object> args = new ArrayList<>();
            for (ConditionRule arg : rule.args()) {
                args.add(toJson(arg));
            }
            map.put("args", args);
            return map;
        }

        @Override
        public Object visitNegation(ConditionRule.Negation rule) {
            Map<String, Object> map = node(rule.op());
            map.put("arg", toJson(rule.arg()));
            return map;
        }

        @Override
        public Object visitExists(ConditionRule.Exists rule) {
            Map<String, Object> map = node(rule.op());
            map.put("value", toJson(rule.value()));
            return map;
        }

        @Override
        public Object visitComparison(ConditionRule.Comparison rule) {
            Map<String, Object> map = node(rule.op());
            map.put("left", toJson(rule.left()));
            map.put("right", toJson(rule.right()));
            return map;
        }

        @Override
        public Object visitIn(ConditionRule.In rule) {
            Map<String, Object> map = node(rule.op());
            map.put("value", toJson(rule.value()));
            map.put("options", exprs(rule.options()));
            return map;
        }
    }

    private static final class RefToJson implements RefVisitor<Object> {

        private static Map<String, Object> ref(Ref ref) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("kind", ref.kind().wireName());
            return map;
        }

        @Override
        public Object visitConstant(Ref.Constant ref) {
            Map<String, Object> map = ref(ref);
            map.put("value", ref.value());
            return map;
        }

        @Override
        public Object visitSelection(Ref.Selection ref) {
            Map<String, Object> map = ref(ref);
            map.put("selectionKey", ref.selectionKey());
            return map;
        }

        @Override
        public Object visitEffective(Ref.Effective ref) {
            Map<String, Object> map = ref(ref);
            map.put("selectionKey", ref.selectionKey());
            return map;
        }

        @Override
        public Object visitNodeOutput(Ref.NodeOutput ref) {
            Map<String, Object> map = ref(ref);
            map.put("nodeId", ref.nodeId());
            map.put("outputKey", ref.outputKey());
            return map;
        }

        @Override
        public Object visitEnv(Ref.Env ref) {
            Map<String, Object> map = ref(ref);
            map.put("envKey", ref.envKey());
            return map;
        }

        @Override
        public Object visitPricebook(Ref.Pricebook ref) {
            Map<String, Object> map = ref(ref);
            map.put("key", ref.key());
            return map;
        }

        @Override
        public Object visitOptionValueParam(Ref.OptionValueParam ref) {
            Map<String, Object> map = ref(ref);
            map.put("selectionKey", ref.selectionKey());
            map.put("paramPath", ref.paramPath());
            if (ref.hasDefault()) {
                map.put("defaultValue", ref.defaultValue());
            }
            return map;
        }

        @Override
        public Object visitOptionValueParamJson(Ref.OptionValueParamJson ref) {
            Map<String, Object> map = ref(ref);
            map.put("selectionKey", ref.selectionKey());
            map.put("paramPath", ref.paramPath());
            if (ref.hasDefault()) {
                map.put("defaultValue", ref.defaultValue());
            }
            return map;
        }
    }
}
