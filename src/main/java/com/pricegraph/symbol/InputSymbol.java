package com.pricegraph.symbol;

import com.pricegraph.ref.ValueType;

import java.util.List;

/**
 * Declared shape of an INPUT as seen by refs.
 *
 * @param nodeId       INPUT node id
 * @param selectionKey Selection key
 * @param type         Scalar type (ENUM inputs are TEXT)
 * @param hasDefault   Whether a default is declared
 * @param enumInput    Whether the input is an ENUM with option metadata
 * @param enumOptions  Raw ENUM options, may be null
 */
public record InputSymbol(
        String nodeId,
        String selectionKey,
        ValueType type,
        boolean hasDefault,
        boolean enumInput,
        List<Object> enumOptions
) {
}
