package com.pricegraph.tree;

import com.pricegraph.ref.ValueType;

import java.util.List;
import java.util.Map;

/**
 * INPUT node payload.
 *
 * @param selectionKey  Key selections are addressed by, null when missing
 * @param rawValueType  Declared type as written (e.g. {@code ENUM})
 * @param valueType     Scalar type; ENUM inputs are TEXT. Null when the declared type is unknown
 * @param enumInput     Whether the input was declared as ENUM
 * @param hasDefault    Whether a default was declared, even a null one
 * @param defaultValue  Declared default
 * @param required      {@code required} from the payload or its constraints
 * @param constraints   Raw constraints object, may be null
 * @param number        Numeric bounds, {@link NumberConstraints#NONE} when absent
 * @param enumOptions   Raw ENUM options (strings or objects with a {@code value}), may be null
 */
public record InputSpec(
        String selectionKey,
        String rawValueType,
        ValueType valueType,
        boolean enumInput,
        boolean hasDefault,
        Object defaultValue,
        boolean required,
        Map<String, Object> constraints,
        NumberConstraints number,
        List<Object> enumOptions
) {
}
