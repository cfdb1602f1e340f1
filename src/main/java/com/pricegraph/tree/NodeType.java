package com.pricegraph.tree;

import java.util.Locale;

/**
 * Node kinds. GROUP nodes are editor-only and never take part in evaluation.
 */
public enum NodeType {
    INPUT,
    COMPUTE,
    PRICE,
    EFFECT,
    GROUP;

    /**
     * Parse a declared type, accepting the legacy {@code question},
     * {@code computed} and {@code group} kind aliases.
     *
     * @return the type, or null when unknown
     */
    public static NodeType parse(String raw) {
        if (raw == null) {
            return null;
        }
        String name = raw.trim().toUpperCase(Locale.ROOT);
        return switch (name) {
            case "INPUT", "QUESTION" -> INPUT;
            case "COMPUTE", "COMPUTED" -> COMPUTE;
            case "PRICE" -> PRICE;
            case "EFFECT" -> EFFECT;
            case "GROUP" -> GROUP;
            default -> null;
        };
    }
}
