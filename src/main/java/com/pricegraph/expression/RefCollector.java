package com.pricegraph.expression;

import com.pricegraph.ref.Ref;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every ref leaf of an expression or condition, in walk order.
 */
public final class RefCollector implements ExpressionVisitor<Void>, ConditionVisitor<Void> {

    private final List<Ref> refs = new ArrayList<>();

    private RefCollector() {
    }

    public static List<Ref> collect(ExpressionSpec expr) {
        RefCollector collector = new RefCollector();
        if (expr != null) {
            expr.accept(collector);
        }
        return collector.refs;
    }

    public static List<Ref> collect(ConditionRule rule) {
        RefCollector collector = new RefCollector();
        if (rule != null) {
            rule.accept(collector);
        }
        return collector.refs;
    }

    /**
     * Node ids targeted by {@code nodeOutputRef} leaves.
     */
    public static List<String> nodeOutputTargets(ExpressionSpec expr) {
        List<String> ids = new ArrayList<>();
        for (Ref ref : collect(expr)) {
            if (ref instanceof Ref.NodeOutput out && out.nodeId() != null) {
                ids.add(out.nodeId());
            }
        }
        return ids;
    }

    /**
     * True when the rule reads the given selection key through a selection or
     * effective ref.
     */
    public static boolean readsSelectionKey(ConditionRule rule, String selectionKey) {
        for (Ref ref : collect(rule)) {
            if (ref instanceof Ref.Selection sel && selectionKey.equals(sel.selectionKey())) {
                return true;
            }
            if (ref instanceof Ref.Effective eff && selectionKey.equals(eff.selectionKey())) {
                return true;
            }
        }
        return false;
    }

    private void walk(ExpressionSpec expr) {
        if (expr != null) {
            expr.accept(this);
        }
    }

    private void walkAll(List<ExpressionSpec> exprs) {
        for (ExpressionSpec expr : exprs) {
            walk(expr);
        }
    }

    @Override
    public Void visitLiteral(ExpressionSpec.Literal expr) {
        return null;
    }

    @Override
    public Void visitRef(ExpressionSpec.RefExpr expr) {
        refs.add(expr.ref());
        return null;
    }

    @Override
    public Void visitLogical(ExpressionSpec.Logical expr) {
        walkAll(expr.args());
        return null;
    }

    @Override
    public Void visitNot(ExpressionSpec.Not expr) {
        walk(expr.arg());
        return null;
    }

    @Override
    public Void visitBinary(ExpressionSpec.Binary expr) {
        walk(expr.left());
        walk(expr.right());
        return null;
    }

    @Override
    public Void visitUnary(ExpressionSpec.Unary expr) {
        walk(expr.x());
        return null;
    }

    @Override
    public Void visitClamp(ExpressionSpec.Clamp expr) {
        walk(expr.x());
        walk(expr.lo());
        walk(expr.hi());
        return null;
    }

    @Override
    public Void visitRound(ExpressionSpec.Round expr) {
        walk(expr.x());
        walk(expr.digits());
        return null;
    }

    @Override
    public Void visitIf(ExpressionSpec.If expr) {
        walk(expr.cond());
        walk(expr.then());
        walk(expr.otherwise());
        return null;
    }

    @Override
    public Void visitVariadic(ExpressionSpec.Variadic expr) {
        walkAll(expr.args());
        return null;
    }

    @Override
    public Void visitJunction(ConditionRule.Junction rule) {
        for (ConditionRule arg : rule.args()) {
            arg.accept(this);
        }
        return null;
    }

    @Override
    public Void visitNegation(ConditionRule.Negation rule) {
        rule.arg().accept(this);
        return null;
    }

    @Override
    public Void visitExists(ConditionRule.Exists rule) {
        walk(rule.value());
        return null;
    }

    @Override
    public Void visitComparison(ConditionRule.Comparison rule) {
        walk(rule.left());
        walk(rule.right());
        return null;
    }

    @Override
    public Void visitIn(ConditionRule.In rule) {
        walk(rule.value());
        walkAll(rule.options());
        return null;
    }
}
