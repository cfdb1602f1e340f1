package com.pricegraph.tree;

import java.util.Locale;

/**
 * Lifecycle status of a node or edge.
 */
public enum EntityStatus {
    ENABLED,
    DISABLED,
    DELETED;

    /**
     * Missing or unknown values normalize to ENABLED.
     */
    public static EntityStatus normalize(Object raw) {
        if (!(raw instanceof String s)) {
            return ENABLED;
        }
        return switch (s.toUpperCase(Locale.ROOT)) {
            case "DISABLED" -> DISABLED;
            case "DELETED" -> DELETED;
            default -> ENABLED;
        };
    }
}
