package com.pricegraph.tree;

/**
 * Quantity or area tier of the base price. Each override is null when the tier
 * leaves that rate unchanged.
 *
 * @param threshold          {@code minQty} or {@code minSqft}; non-numeric reads as 0
 * @param perSqftCents       Override, may be null
 * @param perPieceCents      Override, may be null
 * @param minimumChargeCents Override, may be null
 */
public record RateTier(double threshold, Double perSqftCents, Double perPieceCents, Double minimumChargeCents) {

    public BaseRates applyTo(BaseRates rates) {
        return new BaseRates(
                perSqftCents != null ? perSqftCents : rates.perSqftCents(),
                perPieceCents != null ? perPieceCents : rates.perPieceCents(),
                minimumChargeCents != null ? minimumChargeCents : rates.minimumChargeCents());
    }
}
