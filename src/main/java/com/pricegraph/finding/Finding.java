package com.pricegraph.finding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured, severity-tagged diagnostic produced by validation and type checking.
 *
 * @param code     Stable machine-readable code (e.g. PBV2_E_EXPR_TYPE_MISMATCH)
 * @param severity ERROR, WARNING or INFO
 * @param message  Human-readable message
 * @param path     JSON-pointer-like location (e.g. tree.nodes[n1].compute.expression.left)
 * @param entityId Node or edge id the finding belongs to, may be null
 * @param context  Extra structured details, may be null
 */
public record Finding(
        String code,
        Severity severity,
        String message,
        String path,
        String entityId,
        Map<String, Object> context
) {

    public static Finding error(String code, String message, String path) {
        return new Finding(code, Severity.ERROR, message, path, null, null);
    }

    public static Finding error(String code, String message, String path, String entityId) {
        return new Finding(code, Severity.ERROR, message, path, entityId, null);
    }

    public static Finding error(String code, String message, String path, String entityId,
                                Map<String, Object> context) {
        return new Finding(code, Severity.ERROR, message, path, entityId, context);
    }

    public static Finding warning(String code, String message, String path, String entityId) {
        return new Finding(code, Severity.WARNING, message, path, entityId, null);
    }

    public static Finding warning(String code, String message, String path, String entityId,
                                  Map<String, Object> context) {
        return new Finding(code, Severity.WARNING, message, path, entityId, context);
    }

    public static Finding info(String code, String message, String path, String entityId) {
        return new Finding(code, Severity.INFO, message, path, entityId, null);
    }

    public static Finding of(Severity severity, String code, String message, String path, String entityId,
                             Map<String, Object> context) {
        return new Finding(code, severity, message, path, entityId, context);
    }

    public Finding withSeverity(Severity newSeverity) {
        return new Finding(code, newSeverity, message, path, entityId, context);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Build an insertion-ordered context map from alternating keys and values.
     * Null values are kept.
     */
    public static Map<String, Object> context(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("context requires key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
