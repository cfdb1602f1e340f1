package com.pricegraph.tree;

/**
 * Base price rates from {@code meta.pricingV2.base}. Non-numeric values read as 0.
 */
public record BaseRates(double perSqftCents, double perPieceCents, double minimumChargeCents) {

    public static final BaseRates ZERO = new BaseRates(0, 0, 0);

    public boolean allZero() {
        return perSqftCents == 0 && perPieceCents == 0 && minimumChargeCents == 0;
    }
}
