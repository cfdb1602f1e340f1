package com.pricegraph.symbol;

import com.pricegraph.ref.ValueType;

import java.util.Map;

/**
 * Declared outputs of a COMPUTE node. Outputs with an unknown type are omitted.
 */
public record ComputeSymbol(String nodeId, Map<String, ValueType> outputs) {
}
