package com.pricegraph.ref;

/**
 * Statically inferred type of an expression: base type plus nullability.
 *
 * @param type     Base type
 * @param nullable Whether the value may be null at runtime
 */
public record InferredType(ValueType type, boolean nullable) {

    public static final InferredType UNKNOWN = new InferredType(ValueType.NULL, true);

    public static InferredType of(ValueType type) {
        return new InferredType(type, false);
    }

    public static InferredType nullable(ValueType type) {
        return new InferredType(type, true);
    }

    public boolean isNonNull(ValueType expected) {
        return type == expected && !nullable;
    }

    /**
     * Display name used in findings, e.g. {@code NUMBER|NULL}.
     */
    public String typeName() {
        return nullable && type != ValueType.NULL ? type + "|NULL" : type.name();
    }
}
