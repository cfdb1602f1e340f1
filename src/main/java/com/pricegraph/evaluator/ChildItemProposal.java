package com.pricegraph.evaluator;

/**
 * Child line item proposed for the configured product.
 *
 * @param kind              {@code inlineSku} or {@code productRef}
 * @param title             Display title
 * @param skuRef            SKU for inlineSku items, else null
 * @param childProductId    Product id for productRef items, may be null
 * @param qty               Quantity, always positive
 * @param unitPriceCents    Rounded unit price, null without a unitPriceRef
 * @param amountCents       Rounded {@code qty * unitPrice}, null without a unitPriceRef
 * @param invoiceVisibility {@code hidden}, {@code rollup} or {@code separateLine}
 * @param sourceNodeId      PRICE node that declared the effect
 * @param effectIndex       Index within the node's {@code childItemEffects}; stable per tree
 */
public record ChildItemProposal(
        String kind,
        String title,
        String skuRef,
        String childProductId,
        double qty,
        Long unitPriceCents,
        Long amountCents,
        String invoiceVisibility,
        String sourceNodeId,
        int effectIndex
) {
}
