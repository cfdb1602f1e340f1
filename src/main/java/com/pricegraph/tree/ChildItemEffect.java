package com.pricegraph.tree;

import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;

/**
 * Child line item proposed by a PRICE node. String-like fields are kept raw
 * so shape errors can be reported precisely.
 *
 * @param index             Position within {@code price.childItemEffects}
 * @param kind              {@code inlineSku} or {@code productRef}
 * @param title             Display title
 * @param skuRef            SKU, required for inlineSku
 * @param childProductId    Optional product id
 * @param invoiceVisibility {@code hidden}, {@code rollup} or {@code separateLine}; null means rollup
 * @param qtyRef            Quantity expression, may be null
 * @param unitPriceRef      Unit price expression in cents, may be null
 * @param appliesWhen       Gate condition, null means always
 * @param qtyDeclared       Whether {@code qtyRef} was present on the wire
 */
public record ChildItemEffect(
        int index,
        Object kind,
        Object title,
        Object skuRef,
        Object childProductId,
        Object invoiceVisibility,
        ExpressionSpec qtyRef,
        ExpressionSpec unitPriceRef,
        ConditionRule appliesWhen,
        boolean qtyDeclared
) {
}
