package com.pricegraph.discount;

/**
 * How a tier or volume step adjusts the unit price.
 */
public enum DiscountMethod {
    /** Percent off the running unit price, clamped to [0, 100]. */
    PERCENTAGE("percentage"),
    /** Fixed cents off per unit, never below zero. */
    FIXED_PER_UNIT("fixedPerUnit"),
    /** Unit price replaced by a table value. */
    TIER_TABLE("tierTable");

    private final String wireName;

    DiscountMethod(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Unknown or missing values fall back to {@link #PERCENTAGE}.
     */
    public static DiscountMethod fromWire(Object name) {
        for (DiscountMethod method : values()) {
            if (method.wireName.equals(name)) {
                return method;
            }
        }
        return PERCENTAGE;
    }
}
