package com.pricegraph.tree;

import java.util.List;

/**
 * EFFECT node payload.
 */
public record EffectSpec(List<EffectOutput> outputs) {

    public static final EffectSpec EMPTY = new EffectSpec(List.of());
}
