package com.pricegraph.tree;

import com.pricegraph.expression.ExpressionSpec;

/**
 * Named output of an EFFECT node.
 *
 * @param index    Position within {@code effect.outputs}
 * @param key      Raw key, expected to be a non-empty string
 * @param valueRef Value expression, null when missing or malformed
 */
public record EffectOutput(int index, Object key, ExpressionSpec valueRef) {
}
