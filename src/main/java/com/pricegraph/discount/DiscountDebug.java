package com.pricegraph.discount;

/**
 * Before/after trace of a discounted component.
 */
public record DiscountDebug(
        long amountCentsBeforeDiscount,
        long amountCentsAfterDiscount,
        long unitPriceCentsBeforeDiscount,
        long unitPriceCentsAfterDiscount,
        TierStep tierStep,
        VolumeStep volumeStep
) {

    public record TierStep(PricingTier customerTier, long unitPriceCentsAfterTier) {
    }

    public record VolumeStep(double triggerQty, VolumeTrigger volumeTrigger, long unitPriceCentsAfterVolume) {
    }
}
