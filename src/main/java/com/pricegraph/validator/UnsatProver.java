package com.pricegraph.validator;

import com.pricegraph.expression.AstJson;
import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.signature.Canonicalizer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort proof that a condition can never hold.
 * <p>
 * Rules:
 * - IN with no options is UNSAT
 * - OR is UNSAT when it has arguments and all of them are UNSAT
 * - AND is UNSAT when two EQ arguments pin the same expression to different
 *   literals, when GT/GTE and LT/LTE literal bounds on the same expression are
 *   disjoint, or when any nested argument is UNSAT
 * <p>
 * This is a heuristic. "Not UNSAT" only means no proof was found.
 */
public final class UnsatProver {

    private UnsatProver() {
    }

    public static boolean isProvablyUnsat(ConditionRule rule) {
        if (rule instanceof ConditionRule.In in) {
            return in.options().isEmpty();
        }
        if (!(rule instanceof ConditionRule.Junction junction) || junction.args().isEmpty()) {
            return false;
        }
        if (junction.operator() == ConditionRule.JunctionOp.OR) {
            return junction.args().stream().allMatch(UnsatProver::isProvablyUnsat);
        }
        return conjunctionUnsat(junction.args());
    }

    private static boolean conjunctionUnsat(List<ConditionRule> args) {
        Map<String, Set<String>> pinned = new HashMap<>();
        Map<String, Double> lower = new HashMap<>();
        Map<String, Double> upper = new HashMap<>();

        for (ConditionRule arg : args) {
            if (arg instanceof ConditionRule.Comparison cmp) {
                switch (cmp.operator()) {
                    case EQ -> {
                        String rightLiteral = literalKey(cmp.right());
                        String leftLiteral = literalKey(cmp.left());
                        if (rightLiteral != null) {
                            pinned.computeIfAbsent(AstJson.key(cmp.left()), k -> new HashSet<>()).add(rightLiteral);
                        } else if (leftLiteral != null) {
                            pinned.computeIfAbsent(AstJson.key(cmp.right()), k -> new HashSet<>()).add(leftLiteral);
                        }
                    }
                    case GT, GTE -> {
                        Double bound = literalNumber(cmp.right());
                        if (bound != null) {
                            lower.merge(AstJson.key(cmp.left()), bound, Math::max);
                        }
                    }
                    case LT, LTE -> {
                        Double bound = literalNumber(cmp.right());
                        if (bound != null) {
                            upper.merge(AstJson.key(cmp.left()), bound, Math::min);
                        }
                    }
                    default -> {
                        // NEQ never contradicts on its own
                    }
                }
                continue;
            }
            if (isProvablyUnsat(arg)) {
                return true;
            }
        }

        for (Set<String> literals : pinned.values()) {
            if (literals.size() > 1) {
                return true;
            }
        }
        for (Map.Entry<String, Double> entry : lower.entrySet()) {
            Double hi = upper.get(entry.getKey());
            if (hi != null && entry.getValue() > hi) {
                return true;
            }
        }
        return false;
    }

    private static String literalKey(ExpressionSpec expr) {
        if (expr instanceof ExpressionSpec.Literal literal) {
            return Canonicalizer.canonicalize(literal.value());
        }
        return null;
    }

    private static Double literalNumber(ExpressionSpec expr) {
        if (expr instanceof ExpressionSpec.Literal literal
                && literal.value() instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        return null;
    }
}
