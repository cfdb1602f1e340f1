package com.pricegraph.validator;

/**
 * Severity knobs for checks that are warnings by default.
 *
 * @param ambiguousEdgesStrict   Report ambiguous same-priority edges as ERROR
 * @param divByZeroStrict        Report unguarded division as ERROR
 * @param negativeQuantityStrict Report possibly negative price quantities as ERROR
 */
public record ValidationPolicy(
        boolean ambiguousEdgesStrict,
        boolean divByZeroStrict,
        boolean negativeQuantityStrict
) {

    public static ValidationPolicy defaults() {
        return new ValidationPolicy(false, false, false);
    }

    public static ValidationPolicy strict() {
        return new ValidationPolicy(true, true, true);
    }
}
