package com.pricegraph.expression;

/**
 * Exhaustive visitor over {@link ExpressionSpec} variants. Adding an operator
 * means adding a method here, which every walk must then implement.
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(ExpressionSpec.Literal expr);

    R visitRef(ExpressionSpec.RefExpr expr);

    R visitLogical(ExpressionSpec.Logical expr);

    R visitNot(ExpressionSpec.Not expr);

    R visitBinary(ExpressionSpec.Binary expr);

    R visitUnary(ExpressionSpec.Unary expr);

    R visitClamp(ExpressionSpec.Clamp expr);

    R visitRound(ExpressionSpec.Round expr);

    R visitIf(ExpressionSpec.If expr);

    R visitVariadic(ExpressionSpec.Variadic expr);
}
