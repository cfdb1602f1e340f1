package com.pricegraph.discount;

/**
 * Customer pricing tier supplied by the caller's pricing context.
 */
public enum PricingTier {
    DEFAULT("default"),
    WHOLESALE("wholesale"),
    RETAIL("retail");

    private final String wireName;

    PricingTier(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @return the tier, or null when the name is not a known tier
     */
    public static PricingTier fromWire(String name) {
        for (PricingTier tier : values()) {
            if (tier.wireName.equals(name)) {
                return tier;
            }
        }
        return null;
    }
}
