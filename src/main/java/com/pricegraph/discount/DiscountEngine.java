package com.pricegraph.discount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Applies the customer-tier step and then the volume step to one priced
 * component. Each step rewrites the unit price; the amount is recomputed from
 * the final unit price.
 */
public final class DiscountEngine {

    private static final Logger log = LoggerFactory.getLogger(DiscountEngine.class);

    private DiscountEngine() {
    }

    /**
     * @param quantity       component quantity, non-finite treated as 0
     * @param unitPriceCents unit price before discount, rounded first
     * @param config         discount config, may be null
     * @param context        caller tier and product quantity, may be null
     */
    public static DiscountResult apply(double quantity, double unitPriceCents,
                                       DiscountConfig config, DiscountContext context) {
        double qty = Double.isFinite(quantity) ? quantity : 0;
        long unit0 = Double.isFinite(unitPriceCents) ? Math.round(unitPriceCents) : 0;
        long baseAmount = Math.round(qty * unit0);

        if (config == null || !config.eligible() || config.scope() == null
                || config.scope() == DiscountScope.NONE) {
            return new DiscountResult(unit0, baseAmount, null);
        }

        DiscountScope scope = config.scope();
        DiscountMethod method = config.method() != null ? config.method() : DiscountMethod.PERCENTAGE;
        DiscountContext ctx = context != null ? context : DiscountContext.none();
        PricingTier customerTier = ctx.customerTier();

        long afterTier = unit0;
        DiscountDebug.TierStep tierStep = null;
        if (scope.includesCustomerTier() && customerTier != null) {
            afterTier = applyTierStep(unit0, method, config, customerTier);
            tierStep = new DiscountDebug.TierStep(customerTier, afterTier);
        }

        long afterVolume = afterTier;
        DiscountDebug.VolumeStep volumeStep = null;
        if (scope.includesVolume()) {
            VolumeTrigger trigger = config.volumeTrigger() != null ? config.volumeTrigger() : VolumeTrigger.PRODUCT_QTY;
            double productQty = Double.isFinite(ctx.productQty()) ? ctx.productQty() : 0;
            double triggerQty = trigger == VolumeTrigger.PRODUCT_QTY ? productQty : qty;
            if (triggerQty > 0) {
                afterVolume = applyVolumeStep(afterTier, method, config, triggerQty, customerTier);
                volumeStep = new DiscountDebug.VolumeStep(triggerQty, trigger, afterVolume);
            }
        }

        long finalAmount = Math.round(qty * afterVolume);
        if (log.isTraceEnabled()) {
            log.trace("Discount {} {}: unit {} -> {}, amount {} -> {}",
                    scope.wireName(), method.wireName(), unit0, afterVolume, baseAmount, finalAmount);
        }
        DiscountDebug debug = new DiscountDebug(baseAmount, finalAmount, unit0, afterVolume, tierStep, volumeStep);
        return new DiscountResult(afterVolume, finalAmount, debug);
    }

    private static long applyTierStep(long unit, DiscountMethod method, DiscountConfig config, PricingTier tier) {
        switch (method) {
            case TIER_TABLE -> {
                Double override = byTier(config.customerTierUnitPriceCentsByTier(), tier);
                return override != null ? Math.max(0, Math.round(override)) : unit;
            }
            case FIXED_PER_UNIT -> {
                Double centsOff = byTier(config.customerTierCentsOffPerUnitByTier(), tier);
                return centsOff != null ? Math.max(0, unit - Math.round(centsOff)) : unit;
            }
            default -> {
                Double percentOff = byTier(config.customerTierPercentByTier(), tier);
                return percentOff != null ? percentOff(unit, percentOff) : unit;
            }
        }
    }

    private static long applyVolumeStep(long unit, DiscountMethod method, DiscountConfig config,
                                        double triggerQty, PricingTier tier) {
        switch (method) {
            case TIER_TABLE -> {
                VolumeTier best = selectBestTier(config.volumeUnitPriceCentsTiers(), "unitPriceCents", triggerQty, tier);
                return best != null && best.value() != null ? Math.max(0, Math.round(best.value())) : unit;
            }
            case FIXED_PER_UNIT -> {
                VolumeTier best = selectBestTier(config.volumeCentsOffPerUnitTiers(), "centsOffPerUnit", triggerQty, tier);
                return best != null && best.value() != null ? Math.max(0, unit - Math.round(best.value())) : unit;
            }
            default -> {
                VolumeTier best = selectBestTier(config.volumePercentTiers(), "percentOff", triggerQty, tier);
                if (best == null) {
                    return unit;
                }
                return percentOff(unit, best.value() != null ? best.value() : 0);
            }
        }
    }

    private static long percentOff(long unit, double percent) {
        double p = Math.min(Math.max(percent, 0), 100);
        return Math.max(0, Math.round(unit * (1 - p / 100)));
    }

    private static Double byTier(Map<String, Object> byTier, PricingTier tier) {
        if (byTier == null) {
            return null;
        }
        return VolumeTier.coerceNumber(byTier.get(tier.wireName()));
    }

    /**
     * Highest threshold not above {@code qty}. Rows restricted to a customer
     * tier only match that tier; ties keep the first row.
     */
    static VolumeTier selectBestTier(List<?> rows, String valueField, double qty, PricingTier customerTier) {
        if (rows == null || rows.isEmpty()) {
            return null;
        }
        VolumeTier best = null;
        for (Object row : rows) {
            VolumeTier tier = VolumeTier.fromJson(row, valueField);
            if (tier == null || qty < tier.minQty()) {
                continue;
            }
            if (tier.customerTier() != null
                    && (customerTier == null || !tier.customerTier().equals(customerTier.wireName()))) {
                continue;
            }
            if (best == null || tier.minQty() > best.minQty()) {
                best = tier;
            }
        }
        return best;
    }
}
