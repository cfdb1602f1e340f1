package com.pricegraph.tree;

import com.pricegraph.expression.ExpressionSpec;
import com.pricegraph.ref.ValueType;

import java.util.Map;

/**
 * COMPUTE node payload.
 *
 * @param expression Parsed expression, null when missing or malformed
 * @param outputs    Declared outputs by key, in declaration order
 */
public record ComputeSpec(ExpressionSpec expression, Map<String, ValueType> outputs) {

    /**
     * The single output key, or null when the node does not declare exactly one.
     */
    public String singleOutputKey() {
        return outputs.size() == 1 ? outputs.keySet().iterator().next() : null;
    }
}
