package com.pricegraph.evaluator;

import com.pricegraph.tree.BaseRates;
import com.pricegraph.tree.PricingMeta;
import com.pricegraph.tree.RateTier;

import java.util.List;
import java.util.Map;

/**
 * Base price from the tree's {@code meta.pricingV2} rates.
 * <p>
 * The best quantity tier (highest {@code minQty <= quantity}) overrides the base
 * rates first, then the best square-foot tier. Fields a tier leaves out keep the
 * previous value.
 */
public final class BasePriceCalculator {

    private BasePriceCalculator() {
    }

    /**
     * @param quantity product quantity
     * @param sqft     square footage
     * @param cents    rounded base price, 0 when there are no rates
     */
    public record BasePrice(double quantity, double sqft, long cents) {
    }

    /**
     * Compute the base price for an env map. Quantity defaults to 1; square
     * footage is {@code widthIn * heightIn / 144} when both are positive.
     */
    public static BasePrice compute(PricingMeta meta, Map<String, Object> env) {
        double quantity = finiteOr(env.get("quantity"), 1);
        double widthIn = finiteOr(env.get("widthIn"), 0);
        double heightIn = finiteOr(env.get("heightIn"), 0);
        double sqft = widthIn > 0 && heightIn > 0 ? widthIn * heightIn / 144 : 0;
        return new BasePrice(quantity, sqft, compute(meta, quantity, sqft));
    }

    public static long compute(PricingMeta meta, double quantity, double sqft) {
        if (meta == null || !meta.pricingV2Present()) {
            return 0;
        }

        BaseRates rates = meta.base() != null ? meta.base() : BaseRates.ZERO;
        RateTier qtyTier = bestTier(meta.qtyTiers(), quantity);
        if (qtyTier != null) {
            rates = qtyTier.applyTo(rates);
        }
        RateTier sqftTier = bestTier(meta.sqftTiers(), sqft);
        if (sqftTier != null) {
            rates = sqftTier.applyTo(rates);
        }

        double total = rates.perSqftCents() * sqft + rates.perPieceCents() * quantity;
        if (rates.minimumChargeCents() > 0 && total < rates.minimumChargeCents()) {
            total = rates.minimumChargeCents();
        }
        return Math.round(total);
    }

    /**
     * Tier with the highest threshold not above {@code value}; the first one wins a tie.
     */
    static RateTier bestTier(List<RateTier> tiers, double value) {
        RateTier best = null;
        for (RateTier tier : tiers) {
            if (tier.threshold() <= value && (best == null || tier.threshold() > best.threshold())) {
                best = tier;
            }
        }
        return best;
    }

    private static double finiteOr(Object value, double fallback) {
        if (value instanceof Number n && Double.isFinite(n.doubleValue())) {
            return n.doubleValue();
        }
        return fallback;
    }
}
