package com.pricegraph.ref;

import java.util.Locale;

/**
 * Scalar value types of the pricing DSL.
 */
public enum ValueType {
    NUMBER,
    BOOLEAN,
    TEXT,
    JSON,
    NULL;

    /**
     * Parse a declared type name. STRING is accepted as an alias of TEXT.
     *
     * @return the type, or null when the name is not recognized
     */
    public static ValueType normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "NUMBER" -> NUMBER;
            case "BOOLEAN" -> BOOLEAN;
            case "TEXT", "STRING" -> TEXT;
            case "JSON" -> JSON;
            case "NULL" -> NULL;
            default -> null;
        };
    }
}
