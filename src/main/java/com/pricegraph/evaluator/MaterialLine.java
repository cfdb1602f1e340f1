package com.pricegraph.evaluator;

/**
 * Material consumed by the configured product.
 *
 * @param skuRef       Material SKU
 * @param qty          Quantity, always positive
 * @param uom          Unit of measure
 * @param sourceNodeId PRICE node that declared the effect
 * @param effectIndex  Index within the node's {@code materialEffects}
 */
public record MaterialLine(String skuRef, double qty, String uom, String sourceNodeId, int effectIndex) {
}
