package com.pricegraph.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pricegraph.exception.CanonicalizationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic JSON serialization: object keys sorted, no whitespace,
 * integral numbers without a fraction. Anything that is not plain JSON is
 * rejected rather than coerced.
 */
public final class Canonicalizer {

    static final int MAX_DEPTH = 100;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private Canonicalizer() {
    }

    /**
     * Canonicalize a JSON-shaped value.
     *
     * @param value null, Boolean, String, Number, List, array, Map with string keys or JsonNode
     * @return canonical JSON text
     * @throws CanonicalizationException if the value is not plain finite JSON or nests deeper than 100
     */
    public static String canonicalize(Object value) {
        StringBuilder out = new StringBuilder();
        write(normalize(value), out, 0);
        return out.toString();
    }

    /**
     * Check that a value is plain finite JSON without serializing it.
     */
    public static void assertJsonValue(Object value) {
        canonicalize(value);
    }

    private static Object normalize(Object value) {
        if (value instanceof JsonNode node) {
            return objectMapper.convertValue(node, Object.class);
        }
        return value;
    }

    private static void write(Object value, StringBuilder out, int depth) {
        if (depth > MAX_DEPTH) {
            throw new CanonicalizationException("Signature input too deep");
        }
        if (value == null) {
            out.append("null");
        } else if (value instanceof Boolean b) {
            out.append(b ? "true" : "false");
        } else if (value instanceof String s) {
            out.append(quote(s));
        } else if (value instanceof Number n) {
            out.append(formatNumber(n));
        } else if (value instanceof Map<?, ?> map) {
            writeObject(map, out, depth);
        } else if (value instanceof Collection<?> list) {
            writeArray(new ArrayList<>(list), out, depth);
        } else if (value instanceof Object[] array) {
            writeArray(List.of(array), out, depth);
        } else if (value instanceof JsonNode node) {
            write(normalize(node), out, depth);
        } else {
            throw new CanonicalizationException(
                    "Signature input contains non-JSON value of type " + value.getClass().getName());
        }
    }

    private static void writeObject(Map<?, ?> map, StringBuilder out, int depth) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new CanonicalizationException("Signature input must be plain JSON objects with string keys");
            }
            sorted.put(key, entry.getValue());
        }
        out.append('{');
        boolean first = true;
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            if (!first) {
                out.append(',');
            }
            first = false;
            out.append(quote(entry.getKey())).append(':');
            write(entry.getValue(), out, depth + 1);
        }
        out.append('}');
    }

    private static void writeArray(List<?> list, StringBuilder out, int depth) {
        out.append('[');
        for (int i = 0; i < list.size(); i++) {
            if (i > 0) {
                out.append(',');
            }
            write(list.get(i), out, depth + 1);
        }
        out.append(']');
    }

    private static String quote(String s) {
        try {
            return objectMapper.writeValueAsString(s);
        } catch (JsonProcessingException e) {
            throw new CanonicalizationException("Failed to encode string", e);
        }
    }

    public static String formatNumber(Number n) {
        if (n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || n instanceof BigInteger) {
            return n.toString();
        }
        if (n instanceof BigDecimal bd) {
            return formatDouble(bd.doubleValue());
        }
        return formatDouble(n.doubleValue());
    }

    private static String formatDouble(double d) {
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new CanonicalizationException("Signature input contains non-finite number");
        }
        if (d == 0) {
            return "0";
        }
        double abs = Math.abs(d);
        if (abs >= 1e-6 && abs < 1e21) {
            BigDecimal exact = new BigDecimal(Double.toString(d)).stripTrailingZeros();
            return exact.scale() <= 0 ? exact.toBigInteger().toString() : exact.toPlainString();
        }
        // Exponent form: 1e-7, 1.5e+21
        BigDecimal exact = new BigDecimal(Double.toString(d)).stripTrailingZeros();
        int exponent = exact.precision() - exact.scale() - 1;
        BigDecimal mantissa = exact.movePointLeft(exponent).stripTrailingZeros();
        String sign = exponent < 0 ? "-" : "+";
        return mantissa.toPlainString() + "e" + sign + Math.abs(exponent);
    }
}
