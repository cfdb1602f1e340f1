package com.pricegraph.ref;

/**
 * A typed pointer into the selections, the graph, the environment or the
 * pricebook. Every variant is walked through {@link RefVisitor}.
 */
public sealed interface Ref {

    RefKind kind();

    <R> R accept(RefVisitor<R> visitor);

    /** Inline scalar value. */
    record Constant(Object value) implements Ref {
        public RefKind kind() {
            return RefKind.CONSTANT;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    /** Raw user selection, absent when the user did not choose. */
    record Selection(String selectionKey) implements Ref {
        public RefKind kind() {
            return RefKind.SELECTION;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitSelection(this);
        }
    }

    /** User selection, falling back to the input's declared default. */
    record Effective(String selectionKey) implements Ref {
        public RefKind kind() {
            return RefKind.EFFECTIVE;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitEffective(this);
        }
    }

    /** Declared output of a COMPUTE node. */
    record NodeOutput(String nodeId, String outputKey) implements Ref {
        public RefKind kind() {
            return RefKind.NODE_OUTPUT;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitNodeOutput(this);
        }
    }

    record Env(String envKey) implements Ref {
        public RefKind kind() {
            return RefKind.ENV;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitEnv(this);
        }
    }

    record Pricebook(String key) implements Ref {
        public RefKind kind() {
            return RefKind.PRICEBOOK;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitPricebook(this);
        }
    }

    /**
     * Numeric parameter stored on the selected option of an ENUM input,
     * addressed by a dotted path (e.g. {@code pricingParams.baseCents}).
     */
    record OptionValueParam(String selectionKey, String paramPath, Object defaultValue, boolean hasDefault)
            implements Ref {
        public RefKind kind() {
            return RefKind.OPTION_VALUE_PARAM;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitOptionValueParam(this);
        }
    }

    /** Same as {@link OptionValueParam} but returns any JSON value. */
    record OptionValueParamJson(String selectionKey, String paramPath, Object defaultValue, boolean hasDefault)
            implements Ref {
        public RefKind kind() {
            return RefKind.OPTION_VALUE_PARAM_JSON;
        }

        public <R> R accept(RefVisitor<R> visitor) {
            return visitor.visitOptionValueParamJson(this);
        }
    }
}
