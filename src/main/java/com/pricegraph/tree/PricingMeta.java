package com.pricegraph.tree;

import java.util.List;

/**
 * Base pricing block from {@code meta.pricingV2}.
 *
 * @param metaPresent      Whether the tree has a {@code meta} object
 * @param pricingV2Present Whether {@code meta.pricingV2} is an object
 * @param base             Base rates, null when {@code base} is not an object
 * @param qtyTiers         Quantity tiers in declaration order
 * @param sqftTiers        Area tiers in declaration order
 */
public record PricingMeta(
        boolean metaPresent,
        boolean pricingV2Present,
        BaseRates base,
        List<RateTier> qtyTiers,
        List<RateTier> sqftTiers
) {

    public static final PricingMeta ABSENT = new PricingMeta(false, false, null, List.of(), List.of());
}
