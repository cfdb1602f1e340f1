package com.pricegraph.discount;

/**
 * Quantity the volume step compares against tier thresholds.
 */
public enum VolumeTrigger {
    COMPONENT_QTY("componentQty"),
    PRODUCT_QTY("productQty");

    private final String wireName;

    VolumeTrigger(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Unknown or missing values fall back to {@link #PRODUCT_QTY}.
     */
    public static VolumeTrigger fromWire(Object name) {
        for (VolumeTrigger trigger : values()) {
            if (trigger.wireName.equals(name)) {
                return trigger;
            }
        }
        return PRODUCT_QTY;
    }
}
