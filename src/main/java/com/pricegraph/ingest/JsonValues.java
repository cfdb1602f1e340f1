package com.pricegraph.ingest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Helpers for reading plain JSON values (maps, lists, strings, numbers,
 * booleans, null) as produced by Jackson.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Deep copy with every number widened to {@link Double} and maps kept in
     * insertion order. Non-string map keys are stringified.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(normalize(item));
            }
            return out;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    public static List<Object> asList(Object value) {
        return value instanceof List<?> ? (List<Object>) value : null;
    }

    public static boolean isNonEmptyString(Object value) {
        return value instanceof String s && !s.trim().isEmpty();
    }

    /**
     * @return the value when it is a non-blank string, otherwise null
     */
    public static String getString(Map<String, Object> map, String key) {
        if (map == null) {
            return null;
        }
        Object value = map.get(key);
        return isNonEmptyString(value) ? (String) value : null;
    }

    /**
     * @return the value when it is a finite number, otherwise null
     */
    public static Double getNumber(Map<String, Object> map, String key) {
        if (map == null) {
            return null;
        }
        return finiteNumber(map.get(key));
    }

    public static Double finiteNumber(Object value) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        return null;
    }

    /**
     * First value present under any of the keys, or null.
     */
    public static Object firstPresent(Map<String, Object> map, String... keys) {
        if (map == null) {
            return null;
        }
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /**
     * JavaScript-style truthiness: null, false, 0, NaN and "" are false.
     */
    public static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    public static String upper(Object value) {
        return value instanceof String s ? s.toUpperCase(Locale.ROOT) : null;
    }
}
