package com.pricegraph.discount;

import java.util.Map;

/**
 * One row of a volume tier table.
 *
 * @param minQty       Threshold, inclusive
 * @param value        Percent off, cents off per unit or unit price, depending on the method
 * @param customerTier Customer tier the row is restricted to, null when unrestricted
 */
public record VolumeTier(double minQty, Double value, String customerTier) {

    /**
     * Read a tier row from plain JSON.
     *
     * @param raw        the row, expected to be a map
     * @param valueField field holding the adjustment (e.g. {@code percentOff})
     * @return the tier, or null when the row is not an object or has no usable non-negative minQty
     */
    public static VolumeTier fromJson(Object raw, String valueField) {
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Double minQty = coerceNonNegative(map.get("minQty"));
        if (minQty == null) {
            return null;
        }
        Double value = coerceNumber(map.get(valueField));
        Object tier = map.get("customerTier");
        String customerTier = tier instanceof String s && !s.isEmpty() ? s : null;
        return new VolumeTier(minQty, value, customerTier);
    }

    static Double coerceNumber(Object value) {
        double n;
        if (value instanceof Number number) {
            n = number.doubleValue();
        } else if (value instanceof String s) {
            try {
                n = Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(n) ? n : null;
    }

    static Double coerceNonNegative(Object value) {
        Double n = coerceNumber(value);
        return n == null || n < 0 ? null : n;
    }
}
