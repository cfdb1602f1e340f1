package com.pricegraph.evaluator;

import com.pricegraph.discount.PricingTier;

import java.util.Map;

/**
 * Caller-supplied pricing inputs beyond selections and env.
 *
 * @param pricebook    Values for pricebookRef, may be null
 * @param customerTier Customer pricing tier for discounts, may be null
 */
public record PricingOptions(Map<String, ?> pricebook, PricingTier customerTier) {

    public static PricingOptions defaults() {
        return new PricingOptions(null, null);
    }

    public static PricingOptions withPricebook(Map<String, ?> pricebook) {
        return new PricingOptions(pricebook, null);
    }

    public static PricingOptions forTier(PricingTier customerTier) {
        return new PricingOptions(null, customerTier);
    }
}
