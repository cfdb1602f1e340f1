package com.pricegraph.expression;

import com.pricegraph.ref.Ref;

import java.util.List;
import java.util.Locale;

/**
 * Immutable expression AST. Operand field names follow the JSON wire shape.
 */
public sealed interface ExpressionSpec {

    /**
     * Wire name of the operator (e.g. {@code add}, {@code coalesce}).
     */
    String op();

    <R> R accept(ExpressionVisitor<R> visitor);

    record Literal(Object value) implements ExpressionSpec {
        public String op() {
            return "literal";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record RefExpr(Ref ref) implements ExpressionSpec {
        public String op() {
            return "ref";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitRef(this);
        }
    }

    record Logical(LogicalOp operator, List<ExpressionSpec> args) implements ExpressionSpec {
        public Logical {
            args = List.copyOf(args);
        }

        public String op() {
            return operator.wire();
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitLogical(this);
        }
    }

    record Not(ExpressionSpec arg) implements ExpressionSpec {
        public String op() {
            return "not";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    record Binary(BinaryOp operator, ExpressionSpec left, ExpressionSpec right) implements ExpressionSpec {
        public String op() {
            return operator.wire();
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(UnaryOp operator, ExpressionSpec x) implements ExpressionSpec {
        public String op() {
            return operator.wire();
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Clamp(ExpressionSpec x, ExpressionSpec lo, ExpressionSpec hi) implements ExpressionSpec {
        public String op() {
            return "clamp";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitClamp(this);
        }
    }

    /** {@code digits} may be null, meaning zero. */
    record Round(ExpressionSpec x, ExpressionSpec digits) implements ExpressionSpec {
        public String op() {
            return "round";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitRound(this);
        }
    }

    record If(ExpressionSpec cond, ExpressionSpec then, ExpressionSpec otherwise) implements ExpressionSpec {
        public String op() {
            return "if";
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record Variadic(VariadicOp operator, List<ExpressionSpec> args) implements ExpressionSpec {
        public Variadic {
            args = List.copyOf(args);
        }

        public String op() {
            return operator.wire();
        }

        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVariadic(this);
        }
    }

    enum LogicalOp {
        AND, OR;

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum BinaryOp {
        EQ, NE, LT, LTE, GT, GTE, ADD, SUB, MUL, DIV, MOD, MIN, MAX;

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }

        public boolean isEquality() {
            return this == EQ || this == NE;
        }

        public boolean isComparison() {
            return this == LT || this == LTE || this == GT || this == GTE;
        }
    }

    enum UnaryOp {
        ABS, FLOOR, CEIL, EXISTS, STRLEN;

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    enum VariadicOp {
        COALESCE, CONCAT;

        public String wire() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    // Convenience factories, mostly for building trees in code

    static ExpressionSpec literal(Object value) {
        return new Literal(value);
    }

    static ExpressionSpec ref(Ref ref) {
        return new RefExpr(ref);
    }

    static ExpressionSpec binary(BinaryOp op, ExpressionSpec left, ExpressionSpec right) {
        return new Binary(op, left, right);
    }
}
