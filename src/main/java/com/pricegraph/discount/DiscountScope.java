package com.pricegraph.discount;

/**
 * Which discount steps a component participates in.
 */
public enum DiscountScope {
    NONE("none"),
    CUSTOMER_TIER("customerTier"),
    VOLUME("volume"),
    CUSTOMER_TIER_AND_VOLUME("customerTier+volume");

    private final String wireName;

    DiscountScope(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean includesCustomerTier() {
        return this == CUSTOMER_TIER || this == CUSTOMER_TIER_AND_VOLUME;
    }

    public boolean includesVolume() {
        return this == VOLUME || this == CUSTOMER_TIER_AND_VOLUME;
    }

    /**
     * Unknown or missing values mean no discount.
     */
    public static DiscountScope fromWire(Object name) {
        for (DiscountScope scope : values()) {
            if (scope.wireName.equals(name)) {
                return scope;
            }
        }
        return NONE;
    }
}
