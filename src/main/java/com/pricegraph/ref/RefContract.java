package com.pricegraph.ref;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Which ref kinds are legal in which evaluation context.
 */
public final class RefContract {

    private static final Map<ExprContext, Set<RefKind>> ALLOWED = new EnumMap<>(ExprContext.class);

    static {
        Set<RefKind> dynamic = EnumSet.of(
                RefKind.CONSTANT,
                RefKind.SELECTION,
                RefKind.EFFECTIVE,
                RefKind.NODE_OUTPUT,
                RefKind.ENV,
                RefKind.OPTION_VALUE_PARAM,
                RefKind.OPTION_VALUE_PARAM_JSON);
        Set<RefKind> priced = EnumSet.copyOf(dynamic);
        priced.add(RefKind.PRICEBOOK);

        ALLOWED.put(ExprContext.INPUT, EnumSet.of(RefKind.CONSTANT));
        ALLOWED.put(ExprContext.COMPUTE, dynamic);
        ALLOWED.put(ExprContext.CONDITION, dynamic);
        ALLOWED.put(ExprContext.PRICE, priced);
        ALLOWED.put(ExprContext.EFFECT, priced);
    }

    private RefContract() {
    }

    public static boolean isAllowed(RefKind kind, ExprContext context) {
        return ALLOWED.get(context).contains(kind);
    }

    /**
     * Map a constant literal to its scalar type. Objects and arrays map to JSON.
     */
    public static ValueType constantValueToType(Object value) {
        if (value == null) {
            return ValueType.NULL;
        }
        if (value instanceof Number) {
            return ValueType.NUMBER;
        }
        if (value instanceof Boolean) {
            return ValueType.BOOLEAN;
        }
        if (value instanceof String) {
            return ValueType.TEXT;
        }
        return ValueType.JSON;
    }
}
