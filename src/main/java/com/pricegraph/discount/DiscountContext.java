package com.pricegraph.discount;

/**
 * Caller-side facts the discount steps depend on.
 *
 * @param customerTier Customer tier, null when the caller has none
 * @param productQty   Product quantity used by the productQty volume trigger
 */
public record DiscountContext(PricingTier customerTier, double productQty) {

    public static DiscountContext none() {
        return new DiscountContext(null, 0);
    }
}
