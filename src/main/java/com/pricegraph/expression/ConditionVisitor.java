package com.pricegraph.expression;

/**
 * Exhaustive visitor over {@link ConditionRule} variants.
 */
public interface ConditionVisitor<R> {

    R visitJunction(ConditionRule.Junction rule);

    R visitNegation(ConditionRule.Negation rule);

    R visitExists(ConditionRule.Exists rule);

    R visitComparison(ConditionRule.Comparison rule);

    R visitIn(ConditionRule.In rule);
}
