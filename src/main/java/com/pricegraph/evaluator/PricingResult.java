package com.pricegraph.evaluator;

import java.util.List;

/**
 * @param addOnCents Total of all lines including the base price
 * @param breakdown  Base price line first (when non-zero), then component lines in declaration order
 */
public record PricingResult(long addOnCents, List<BreakdownLine> breakdown) {

    public PricingResult {
        breakdown = List.copyOf(breakdown);
    }
}
