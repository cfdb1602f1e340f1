package com.pricegraph.tree;

import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;

/**
 * Material consumption declared on a PRICE node.
 *
 * @param index       Position within {@code price.materialEffects}
 * @param skuRef      Raw SKU reference, expected to be a non-empty string
 * @param uom         Raw unit of measure, expected to be a non-empty string
 * @param qtyRef      Quantity expression, null when missing or malformed
 * @param appliesWhen Gate condition, null means always
 * @param qtyDeclared Whether {@code qtyRef} was present on the wire
 */
public record MaterialEffect(
        int index,
        Object skuRef,
        Object uom,
        ExpressionSpec qtyRef,
        ConditionRule appliesWhen,
        boolean qtyDeclared
) {
}
