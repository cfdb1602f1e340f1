package com.pricegraph.tree;

import com.pricegraph.discount.DiscountConfig;
import com.pricegraph.expression.ConditionRule;
import com.pricegraph.expression.ExpressionSpec;

import java.util.Set;

/**
 * One priced line rule of a PRICE node.
 *
 * @param index          Position within {@code price.components}
 * @param kind           Declared kind, uppercased; null when missing
 * @param rawKind        Declared kind as written
 * @param title          Display title, may be null
 * @param quantityRef    Quantity expression, may be null
 * @param unitPriceRef   Unit price expression in cents, may be null
 * @param overageBaseRef Included quantity for PER_OVERAGE, may be null
 * @param tiers          Raw TIERED rows, may be null
 * @param appliesWhen    Gate condition, null means always
 * @param discount       Discount config, may be null
 * @param declaredFields Field names present on the component
 */
public record PriceComponent(
        int index,
        String kind,
        Object rawKind,
        String title,
        ExpressionSpec quantityRef,
        ExpressionSpec unitPriceRef,
        ExpressionSpec overageBaseRef,
        Object tiers,
        ConditionRule appliesWhen,
        DiscountConfig discount,
        Set<String> declaredFields
) {

    public boolean declares(String field) {
        return declaredFields.contains(field);
    }
}
