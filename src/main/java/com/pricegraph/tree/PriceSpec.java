package com.pricegraph.tree;

import java.util.List;

/**
 * PRICE node payload. Malformed entries are absent from these lists and
 * reported as ingest findings instead.
 */
public record PriceSpec(
        List<PriceComponent> components,
        List<MaterialEffect> materialEffects,
        List<ChildItemEffect> childItemEffects
) {

    public static final PriceSpec EMPTY = new PriceSpec(List.of(), List.of(), List.of());
}
