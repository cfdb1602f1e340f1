package com.pricegraph.discount;

import com.pricegraph.ref.Ref;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Per-component discount configuration. Tier tables are kept as plain JSON
 * rows; each table may instead be supplied through a ref resolved at pricing
 * time (e.g. an option parameter holding the table).
 *
 * @param discountEligible              false disables all discounting, null means eligible
 * @param scope                         which steps run
 * @param volumeTrigger                 quantity the volume step compares
 * @param method                        how a step adjusts the unit price
 * @param customerTierPercentByTier     percentage method, tier step
 * @param customerTierCentsOffPerUnitByTier fixedPerUnit method, tier step
 * @param customerTierUnitPriceCentsByTier  tierTable method, tier step
 * @param volumePercentTiers            percentage method, volume rows
 * @param volumeCentsOffPerUnitTiers    fixedPerUnit method, volume rows
 * @param volumeUnitPriceCentsTiers     tierTable method, volume rows
 * @param volumePercentTiersRef         ref supplying {@code volumePercentTiers}
 * @param volumeCentsOffPerUnitTiersRef ref supplying {@code volumeCentsOffPerUnitTiers}
 * @param volumeUnitPriceCentsTiersRef  ref supplying {@code volumeUnitPriceCentsTiers}
 */
public record DiscountConfig(
        Boolean discountEligible,
        DiscountScope scope,
        VolumeTrigger volumeTrigger,
        DiscountMethod method,
        Map<String, Object> customerTierPercentByTier,
        Map<String, Object> customerTierCentsOffPerUnitByTier,
        Map<String, Object> customerTierUnitPriceCentsByTier,
        List<?> volumePercentTiers,
        List<?> volumeCentsOffPerUnitTiers,
        List<?> volumeUnitPriceCentsTiers,
        Ref volumePercentTiersRef,
        Ref volumeCentsOffPerUnitTiersRef,
        Ref volumeUnitPriceCentsTiersRef
) {

    public boolean eligible() {
        return discountEligible == null || discountEligible;
    }

    /**
     * Fill tier tables that are absent from their refs. A ref whose value is
     * not a list leaves the table absent.
     */
    public DiscountConfig withResolvedTiers(Function<Ref, Object> resolver) {
        return new DiscountConfig(discountEligible, scope, volumeTrigger, method,
                customerTierPercentByTier, customerTierCentsOffPerUnitByTier, customerTierUnitPriceCentsByTier,
                resolve(volumePercentTiers, volumePercentTiersRef, resolver),
                resolve(volumeCentsOffPerUnitTiers, volumeCentsOffPerUnitTiersRef, resolver),
                resolve(volumeUnitPriceCentsTiers, volumeUnitPriceCentsTiersRef, resolver),
                volumePercentTiersRef, volumeCentsOffPerUnitTiersRef, volumeUnitPriceCentsTiersRef);
    }

    private static List<?> resolve(List<?> tiers, Ref ref, Function<Ref, Object> resolver) {
        if (tiers != null || ref == null) {
            return tiers;
        }
        return resolver.apply(ref) instanceof List<?> list ? list : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Boolean discountEligible;
        private DiscountScope scope = DiscountScope.NONE;
        private VolumeTrigger volumeTrigger = VolumeTrigger.PRODUCT_QTY;
        private DiscountMethod method = DiscountMethod.PERCENTAGE;
        private Map<String, Object> customerTierPercentByTier;
        private Map<String, Object> customerTierCentsOffPerUnitByTier;
        private Map<String, Object> customerTierUnitPriceCentsByTier;
        private List<?> volumePercentTiers;
        private List<?> volumeCentsOffPerUnitTiers;
        private List<?> volumeUnitPriceCentsTiers;
        private Ref volumePercentTiersRef;
        private Ref volumeCentsOffPerUnitTiersRef;
        private Ref volumeUnitPriceCentsTiersRef;

        private Builder() {
        }

        public Builder discountEligible(Boolean discountEligible) {
            this.discountEligible = discountEligible;
            return this;
        }

        public Builder scope(DiscountScope scope) {
            this.scope = scope;
            return this;
        }

        public Builder volumeTrigger(VolumeTrigger volumeTrigger) {
            this.volumeTrigger = volumeTrigger;
            return this;
        }

        public Builder method(DiscountMethod method) {
            this.method = method;
            return this;
        }

        public Builder customerTierPercentByTier(Map<String, Object> byTier) {
            this.customerTierPercentByTier = byTier;
            return this;
        }

        public Builder customerTierCentsOffPerUnitByTier(Map<String, Object> byTier) {
            this.customerTierCentsOffPerUnitByTier = byTier;
            return this;
        }

        public Builder customerTierUnitPriceCentsByTier(Map<String, Object> byTier) {
            this.customerTierUnitPriceCentsByTier = byTier;
            return this;
        }

        public Builder volumePercentTiers(List<?> tiers) {
            this.volumePercentTiers = tiers;
            return this;
        }

        public Builder volumeCentsOffPerUnitTiers(List<?> tiers) {
            this.volumeCentsOffPerUnitTiers = tiers;
            return this;
        }

        public Builder volumeUnitPriceCentsTiers(List<?> tiers) {
            this.volumeUnitPriceCentsTiers = tiers;
            return this;
        }

        public Builder volumePercentTiersRef(Ref ref) {
            this.volumePercentTiersRef = ref;
            return this;
        }

        public Builder volumeCentsOffPerUnitTiersRef(Ref ref) {
            this.volumeCentsOffPerUnitTiersRef = ref;
            return this;
        }

        public Builder volumeUnitPriceCentsTiersRef(Ref ref) {
            this.volumeUnitPriceCentsTiersRef = ref;
            return this;
        }

        public DiscountConfig build() {
            return new DiscountConfig(discountEligible, scope, volumeTrigger, method,
                    customerTierPercentByTier, customerTierCentsOffPerUnitByTier, customerTierUnitPriceCentsByTier,
                    volumePercentTiers, volumeCentsOffPerUnitTiers, volumeUnitPriceCentsTiers,
                    volumePercentTiersRef, volumeCentsOffPerUnitTiersRef, volumeUnitPriceCentsTiersRef);
        }
    }
}
