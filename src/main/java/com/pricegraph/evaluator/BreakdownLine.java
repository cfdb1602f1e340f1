package com.pricegraph.evaluator;

import com.pricegraph.discount.DiscountConfig;
import com.pricegraph.discount.DiscountDebug;

/**
 * One priced line of a pricing result.
 *
 * @param nodeId         PRICE node id, or {@code __base__} for the base price line
 * @param componentIndex Index of the component within its node
 * @param kind           FLAT, PER_UNIT, PER_OVERAGE or BASE_PRICE_V2
 * @param amountCents    Line amount in cents
 * @param quantity       Quantity priced, null for FLAT lines
 * @param unitPriceCents Unit price in cents, null when zero
 * @param discount       Discount config of the component, may be null
 * @param discountDebug  Discount trace, null when no discount step ran
 */
public record BreakdownLine(
        String nodeId,
        int componentIndex,
        String kind,
        long amountCents,
        Double quantity,
        Long unitPriceCents,
        DiscountConfig discount,
        DiscountDebug discountDebug
) {

    public static final String BASE_NODE_ID = "__base__";
    public static final String BASE_PRICE_KIND = "BASE_PRICE_V2";

    BreakdownLine discounted(long newUnitPriceCents, long newAmountCents, DiscountDebug debug) {
        return new BreakdownLine(nodeId, componentIndex, kind, newAmountCents, quantity,
                newUnitPriceCents, discount, debug);
    }
}
