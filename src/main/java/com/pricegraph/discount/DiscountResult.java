package com.pricegraph.discount;

/**
 * Discounted amounts for one component. {@code debug} is null when no discount ran.
 */
public record DiscountResult(long unitPriceCents, long amountCents, DiscountDebug debug) {
}
