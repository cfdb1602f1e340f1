package com.pricegraph.expression;

import java.util.List;

/**
 * Boolean rule AST used by edge conditions and {@code appliesWhen} gates.
 */
public sealed interface ConditionRule {

    /**
     * Wire name of the operator (e.g. {@code AND}, {@code IN}).
     */
    String op();

    <R> R accept(ConditionVisitor<R> visitor);

    record Junction(JunctionOp operator, List<ConditionRule> args) implements ConditionRule {
        public Junction {
            args = List.copyOf(args);
        }

        public String op() {
            return operator.name();
        }

        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitJunction(this);
        }
    }

    record Negation(ConditionRule arg) implements ConditionRule {
        public String op() {
            return "NOT";
        }

        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitNegation(this);
        }
    }

    record Exists(ExpressionSpec value) implements ConditionRule {
        public String op() {
            return "EXISTS";
        }

        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitExists(this);
        }
    }

    record Comparison(ComparisonOp operator, ExpressionSpec left, ExpressionSpec right) implements ConditionRule {
        public String op() {
            return operator.name();
        }

        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }

    record In(ExpressionSpec value, List<ExpressionSpec> options) implements ConditionRule {
        public In {
            options = List.copyOf(options);
        }

        public String op() {
            return "IN";
        }

        public <R> R accept(ConditionVisitor<R> visitor) {
            return visitor.visitIn(this);
        }
    }

    enum JunctionOp {
        AND, OR
    }

    enum ComparisonOp {
        EQ, NEQ, GT, GTE, LT, LTE;

        public boolean isEquality() {
            return this == EQ || this == NEQ;
        }
    }
}
