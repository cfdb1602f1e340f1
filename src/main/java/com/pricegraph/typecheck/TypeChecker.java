package com.pricegraph.typecheck;

import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ConditionVisitor;
import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.expression.ExpressionVisitor;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.ref.ExprContext;
import com.pricegraph.ref.InferredType;
import com.pricegraph.ref.RefContract;
import com.pricegraph.ref.ValueType;
import com.pricegraph.symbol.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static type checker for expressions and condition rules.
 * <p>
 * Every operand is checked even after an earlier operand failed, so a single
 * pass reports all problems. Refs are resolved on the way down; a ref that
 * does not resolve infers NULL and the enclosing operator reports its own
 * mismatch as well.
 */
public final class TypeChecker {

    private static final Logger log = LoggerFactory.getLogger(TypeChecker.class);

    private TypeChecker() {
    }

    /**
     * Type check an expression.
     *
     * @param expr     Expression to check
     * @param context  Context deciding which refs are legal
     * @param table    Symbol table of the tree
     * @param path     Path of the expression (e.g. {@code tree.nodes[n1].compute.expression})
     * @param entityId Owning node or edge id, may be null
     */
    public static TypeCheckResult checkExpression(ExpressionSpec expr, ExprContext context, SymbolTable table,
                                                  String path, String entityId) {
        List<Finding> findings = new ArrayList<>();
        InferredType inferred = new ExpressionCheck(context, table, entityId, findings, path).check(expr);
        log.trace("Checked {} as {} with {} finding(s)", path, inferred.typeName(), findings.size());
        return new TypeCheckResult(inferred, findings);
    }

    /**
     * Type check a condition rule. Operand expressions are checked in CONDITION context.
     */
    public static TypeCheckResult checkCondition(ConditionRule rule, SymbolTable table, String path, String entityId) {
        List<Finding> findings = new ArrayList<>();
        rule.accept(new ConditionCheck(table, entityId, findings, path));
        return new TypeCheckResult(InferredType.of(ValueType.BOOLEAN), findings);
    }

    private static Finding mismatch(String message, String path, String entityId, Map<String, Object> context) {
        return Finding.error(FindingCodes.EXPR_TYPE_MISMATCH, message, path, entityId, context);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static final class ExpressionCheck implements ExpressionVisitor<InferredType> {

        private final ExprContext context;
        private final SymbolTable table;
        private final String entityId;
        private final List<Finding> findings;
        private final String path;

        ExpressionCheck(ExprContext context, SymbolTable table, String entityId, List<Finding> findings, String path) {
            this.context = context;
            this.table = table;
            this.entityId = entityId;
            this.findings = findings;
            this.path = path;
        }

        InferredType check(ExpressionSpec expr) {
            return expr.accept(this);
        }

        private InferredType child(ExpressionSpec expr, String segment) {
            return expr.accept(new ExpressionCheck(context, table, entityId, findings, path + "." + segment));
        }

        /**
         * Check a child operand and require it to be a non-null {@code expected}.
         */
        private void require(ExpressionSpec expr, String segment, ValueType expected, String message,
                             Map<String, Object> extra) {
            InferredType actual = child(expr, segment);
            requireType(actual, path + "." + segment, expected, message, extra);
        }

        private void requireType(InferredType actual, String at, ValueType expected, String message,
                                 Map<String, Object> extra) {
            if (actual.isNonNull(expected)) {
                return;
            }
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("expected", expected.name());
            context.put("actual", actual.typeName());
            if (extra != null) {
                context.putAll(extra);
            }
            findings.add(mismatch(message, at, entityId, context));
        }

        @Override
        public InferredType visitLiteral(ExpressionSpec.Literal expr) {
            ValueType type = RefContract.constantValueToType(expr.value());
            return type == ValueType.NULL ? InferredType.UNKNOWN : InferredType.of(type);
        }

        @Override
        public InferredType visitRef(ExpressionSpec.RefExpr expr) {
            List<Finding> resolved = RefResolver.resolve(expr.ref(), context, table, path + ".ref", entityId);
            findings.addAll(resolved);
            if (!resolved.isEmpty()) {
                return InferredType.UNKNOWN;
            }
            return RefResolver.inferType(expr.ref(), table);
        }

        @Override
        public InferredType visitLogical(ExpressionSpec.Logical expr) {
            String op = expr.op();
            for (int i = 0; i < expr.args().size(); i++) {
                require(expr.args().get(i), "args[" + i + "]", ValueType.BOOLEAN,
                        op + "() requires BOOLEAN operands", Finding.context("op", op));
            }
            return InferredType.of(ValueType.BOOLEAN);
        }

        @Override
        public InferredType visitNot(ExpressionSpec.Not expr) {
            require(expr.arg(), "arg", ValueType.BOOLEAN, "not() requires BOOLEAN operand",
                    Finding.context("op", "not"));
            return InferredType.of(ValueType.BOOLEAN);
        }

        @Override
        public InferredType visitBinary(ExpressionSpec.Binary expr) {
            String op = expr.op();
            ExpressionSpec.BinaryOp operator = expr.operator();

            if (operator.isEquality()) {
                InferredType left = child(expr.left(), "left");
                InferredType right = child(expr.right(), "right");
                if (left.type() != right.type()) {
                    findings.add(mismatch(op + "() requires operands of the same type", path, entityId,
                            Finding.context("left", left.typeName(), "right", right.typeName(), "op", op)));
                }
                return InferredType.of(ValueType.BOOLEAN);
            }

            String message = operator.isComparison()
                    ? op + "() requires NUMBER operands"
                    : op + "() requires NUMBER operands (use coalesce/exists for nullable refs)";
            require(expr.left(), "left", ValueType.NUMBER, message, Finding.context("op", op));
            require(expr.right(), "right", ValueType.NUMBER, message, Finding.context("op", op));
            return InferredType.of(operator.isComparison() ? ValueType.BOOLEAN : ValueType.NUMBER);
        }

        @Override
        public InferredType visitUnary(ExpressionSpec.Unary expr) {
            String op = expr.op();
            switch (expr.operator()) {
                case EXISTS:
                    child(expr.x(), "x");
                    return InferredType.of(ValueType.BOOLEAN);
                case STRLEN:
                    require(expr.x(), "x", ValueType.TEXT, "strlen() requires TEXT", null);
                    return InferredType.of(ValueType.NUMBER);
                default:
                    require(expr.x(), "x", ValueType.NUMBER, op + "() requires NUMBER operand",
                            Finding.context("op", op));
                    return InferredType.of(ValueType.NUMBER);
            }
        }

        @Override
        public InferredType visitClamp(ExpressionSpec.Clamp expr) {
            require(expr.x(), "x", ValueType.NUMBER, "clamp() requires NUMBER args", null);
            require(expr.lo(), "lo", ValueType.NUMBER, "clamp() requires NUMBER args", null);
            require(expr.hi(), "hi", ValueType.NUMBER, "clamp() requires NUMBER args", null);
            return InferredType.of(ValueType.NUMBER);
        }

        @Override
        public InferredType visitRound(ExpressionSpec.Round expr) {
            require(expr.x(), "x", ValueType.NUMBER, "round() requires NUMBER x", null);
            if (expr.digits() != null) {
                require(expr.digits(), "digits", ValueType.NUMBER, "round() requires NUMBER digits", null);
            }
            return InferredType.of(ValueType.NUMBER);
        }

        @Override
        public InferredType visitIf(ExpressionSpec.If expr) {
            require(expr.cond(), "cond", ValueType.BOOLEAN, "if() requires BOOLEAN condition",
                    Finding.context("op", "if"));
            InferredType then = child(expr.then(), "then");
            InferredType otherwise = child(expr.otherwise(), "else");
            if (then.type() != otherwise.type()) {
                findings.add(mismatch("if() then/else must have the same type", path, entityId,
                        Finding.context("then", then.typeName(), "else", otherwise.typeName())));
            }
            if (then.type() == ValueType.NULL) {
                return InferredType.UNKNOWN;
            }
            return new InferredType(then.type(), then.nullable() || otherwise.nullable());
        }

        @Override
        public InferredType visitVariadic(ExpressionSpec.Variadic expr) {
            if (expr.operator() == ExpressionSpec.VariadicOp.CONCAT) {
                for (int i = 0; i < expr.args().size(); i++) {
                    require(expr.args().get(i), "args[" + i + "]", ValueType.TEXT, "concat() requires TEXT args", null);
                }
                return InferredType.of(ValueType.TEXT);
            }
            return coalesce(expr.args());
        }

        private InferredType coalesce(List<ExpressionSpec> args) {
            if (args.isEmpty()) {
                findings.add(Finding.error(FindingCodes.EXPR_PARSE_FAIL,
                        "coalesce() requires at least one argument", path, entityId));
                return InferredType.UNKNOWN;
            }

            List<InferredType> types = new ArrayList<>();
            for (int i = 0; i < args.size(); i++) {
                types.add(child(args.get(i), "args[" + i + "]"));
            }

            ValueType chosen = null;
            for (InferredType t : types) {
                if (t.type() != ValueType.NULL) {
                    chosen = t.type();
                    break;
                }
            }
            if (chosen == null) {
                return InferredType.UNKNOWN;
            }

            boolean anyNonNull = false;
            for (InferredType t : types) {
                if (t.type() == ValueType.NULL) {
                    continue;
                }
                if (t.type() != chosen) {
                    findings.add(mismatch("coalesce() requires compatible argument types", path, entityId,
                            Finding.context("expectedBase", chosen.name(), "actualBase", t.type().name())));
                    break;
                }
            }
            for (InferredType t : types) {
                if (t.type() != ValueType.NULL && !t.nullable()) {
                    anyNonNull = true;
                }
            }
            return new InferredType(chosen, !anyNonNull);
        }
    }

    // ========================================================================
    // Conditions
    // ========================================================================

    private static final class ConditionCheck implements ConditionVisitor<Void> {

        private final SymbolTable table;
        private final String entityId;
        private final List<Finding> findings;
        private final String path;

        ConditionCheck(SymbolTable table, String entityId, List<Finding> findings, String path) {
            this.table = table;
            this.entityId = entityId;
            this.findings = findings;
            this.path = path;
        }

        private void child(ConditionRule rule, String segment) {
            rule.accept(new ConditionCheck(table, entityId, findings, path + "." + segment));
        }

        private InferredType operand(ExpressionSpec expr, String at) {
            return new ExpressionCheck(ExprContext.CONDITION, table, entityId, findings, at).check(expr);
        }

        @Override
        public Void visitJunction(ConditionRule.Junction rule) {
            for (int i = 0; i < rule.args().size(); i++) {
                child(rule.args().get(i), "args[" + i + "]");
            }
            return null;
        }

        @Override
        public Void visitNegation(ConditionRule.Negation rule) {
            child(rule.arg(), "arg");
            return null;
        }

        @Override
        public Void visitExists(ConditionRule.Exists rule) {
            operand(rule.value(), path + ".value");
            return null;
        }

        @Override
        public Void visitComparison(ConditionRule.Comparison rule) {
            String op = rule.op();
            InferredType left = operand(rule.left(), path + ".left");
            InferredType right = operand(rule.right(), path + ".right");

            if (rule.operator().isEquality()) {
                if (left.type() != right.type()) {
                    findings.add(mismatch(op + " requires operands of the same type", path, entityId,
                            Finding.context("left", left.typeName(), "right", right.typeName(), "op", op)));
                }
                return null;
            }

            if (!left.isNonNull(ValueType.NUMBER)) {
                findings.add(mismatch(op + " requires non-null NUMBER left operand", path + ".left", entityId,
                        Finding.context("actual", left.typeName())));
            }
            if (!right.isNonNull(ValueType.NUMBER)) {
                findings.add(mismatch(op + " requires non-null NUMBER right operand", path + ".right", entityId,
                        Finding.context("actual", right.typeName())));
            }
            return null;
        }

        @Override
        public Void visitIn(ConditionRule.In rule) {
            InferredType value = operand(rule.value(), path + ".value");
            for (int i = 0; i < rule.options().size(); i++) {
                String at = path + ".options[" + i + "]";
                InferredType option = operand(rule.options().get(i), at);
                if (option.type() != value.type()) {
                    findings.add(mismatch("IN requires option types to match value type", at, entityId,
                            Finding.context("value", value.typeName(), "option", option.typeName())));
                }
            }
            return null;
        }
    }
}
