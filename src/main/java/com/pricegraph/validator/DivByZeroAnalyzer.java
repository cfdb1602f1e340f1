package com.pricegraph.validator;

import com.pricegraph.expression.AstJson;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.expression.ExpressionVisitor;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.Severity;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Flags {@code div} nodes whose denominator may be zero.
 * <p>
 * A literal zero denominator is always an ERROR. Non-zero numeric literals are
 * safe. Two guard shapes are recognized:
 * <pre>
 *   if(eq(d, 0), 0, div(x, d))      // either operand order of eq
 *   div(x, clamp(d, lo, hi))        // lo a literal number above 0
 * </pre>
 * Anything else is reported as ERROR under a strict policy, WARNING otherwise.
 * Paths follow the wire field names, e.g. {@code ...expression.else.right}.
 */
public final class DivByZeroAnalyzer {

    private DivByZeroAnalyzer() {
    }

    public static List<Finding> analyze(ExpressionSpec expr, boolean strict, String path, String entityId) {
        Walk walk = new Walk(strict, entityId);
        walk.visit(expr, path);
        return walk.findings;
    }

    private static final class Walk implements ExpressionVisitor<Void> {

        private final boolean strict;
        private final String entityId;
        private final List<Finding> findings = new ArrayList<>();
        private final Set<String> guardedPaths = new HashSet<>();
        private String path;

        Walk(boolean strict, String entityId) {
            this.strict = strict;
            this.entityId = entityId;
        }

        void visit(ExpressionSpec expr, String at) {
            if (expr == null) {
                return;
            }
            String parent = path;
            path = at;
            try {
                expr.accept(this);
            } finally {
                path = parent;
            }
        }

        private void visitAll(List<ExpressionSpec> args, String at) {
            for (int i = 0; i < args.size(); i++) {
                visit(args.get(i), at + "[" + i + "]");
            }
        }

        @Override
        public Void visitLiteral(ExpressionSpec.Literal expr) {
            return null;
        }

        @Override
        public Void visitRef(ExpressionSpec.RefExpr expr) {
            return null;
        }

        @Override
        public Void visitLogical(ExpressionSpec.Logical expr) {
            visitAll(expr.args(), path + ".args");
            return null;
        }

        @Override
        public Void visitNot(ExpressionSpec.Not expr) {
            visit(expr.arg(), path + ".arg");
            return null;
        }

        @Override
        public Void visitBinary(ExpressionSpec.Binary expr) {
            if (expr.operator() == ExpressionSpec.BinaryOp.DIV) {
                checkDivision(expr.right(), path);
            }
            visit(expr.left(), path + ".left");
            visit(expr.right(), path + ".right");
            return null;
        }

        @Override
        public Void visitUnary(ExpressionSpec.Unary expr) {
            String field = expr.operator() == ExpressionSpec.UnaryOp.ABS ? ".arg" : ".x";
            visit(expr.x(), path + field);
            return null;
        }

        @Override
        public Void visitClamp(ExpressionSpec.Clamp expr) {
            visit(expr.x(), path + ".x");
            visit(expr.lo(), path + ".lo");
            visit(expr.hi(), path + ".hi");
            return null;
        }

        @Override
        public Void visitRound(ExpressionSpec.Round expr) {
            visit(expr.x(), path + ".x");
            visit(expr.digits(), path + ".digits");
            return null;
        }

        @Override
        public Void visitIf(ExpressionSpec.If expr) {
            markGuarded(expr, path);
            visit(expr.cond(), path + ".cond");
            visit(expr.then(), path + ".then");
            visit(expr.otherwise(), path + ".else");
            return null;
        }

        @Override
        public Void visitVariadic(ExpressionSpec.Variadic expr) {
            visitAll(expr.args(), path + ".args");
            return null;
        }

        private void checkDivision(ExpressionSpec denominator, String at) {
            if (isLiteralZero(denominator)) {
                findings.add(Finding.error(FindingCodes.EXPR_DIV_BY_ZERO_UNGUARDED,
                        "Division by literal zero is not allowed", at, entityId));
                return;
            }
            if (guardedPaths.contains(at) || isNonZeroLiteral(denominator) || isPositiveClamp(denominator)) {
                return;
            }
            findings.add(Finding.of(strict ? Severity.ERROR : Severity.WARNING,
                    FindingCodes.EXPR_DIV_BY_ZERO_UNGUARDED,
                    "Division denominator may be zero; guard required (if/eq-zero or clamp)",
                    at, entityId, null));
        }

        /**
         * Marks {@code <path>.else} when the if tests its own else-branch
         * denominator against zero and yields literal zero.
         */
        private void markGuarded(ExpressionSpec.If ifExpr, String at) {
            if (!(ifExpr.otherwise() instanceof ExpressionSpec.Binary div)
                    || div.operator() != ExpressionSpec.BinaryOp.DIV) {
                return;
            }
            if (isEqZero(ifExpr.cond(), div.right()) && isLiteralZero(ifExpr.then())) {
                guardedPaths.add(at + ".else");
            }
        }

        private static boolean isEqZero(ExpressionSpec cond, ExpressionSpec denominator) {
            if (!(cond instanceof ExpressionSpec.Binary eq) || eq.operator() != ExpressionSpec.BinaryOp.EQ) {
                return false;
            }
            String key = AstJson.key(denominator);
            return (key.equals(AstJson.key(eq.left())) && isLiteralZero(eq.right()))
                    || (key.equals(AstJson.key(eq.right())) && isLiteralZero(eq.left()));
        }
    }

    private static boolean isLiteralZero(ExpressionSpec expr) {
        return expr instanceof ExpressionSpec.Literal literal
                && literal.value() instanceof Number n && n.doubleValue() == 0;
    }

    private static boolean isNonZeroLiteral(ExpressionSpec expr) {
        return expr instanceof ExpressionSpec.Literal literal
                && literal.value() instanceof Number n && Double.isFinite(n.doubleValue()) && n.doubleValue() != 0;
    }

    private static boolean isPositiveClamp(ExpressionSpec expr) {
        return expr instanceof ExpressionSpec.Clamp clamp
                && clamp.lo() instanceof ExpressionSpec.Literal lo
                && lo.value() instanceof Number n && n.doubleValue() > 0;
    }
}
