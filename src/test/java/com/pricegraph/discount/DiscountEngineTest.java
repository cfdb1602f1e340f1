package com.pricegraph.discount;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiscountEngine.
 */
class DiscountEngineTest {

    private static Map<String, Object> row(double minQty, String field, double value) {
        return Map.of("minQty", minQty, field, value);
    }

    // ========================================================================
    // No-op configurations
    // ========================================================================

    @Test
    @DisplayName("Should pass through without a config")
    void shouldPassThroughWithoutConfig() {
        DiscountResult result = DiscountEngine.apply(3, 99.6, null, null);

        assertEquals(100, result.unitPriceCents());
        assertEquals(300, result.amountCents());
        assertNull(result.debug());
    }

    @Test
    @DisplayName("Should pass through when ineligible or scope is none")
    void shouldPassThroughWhenDisabled() {
        DiscountConfig ineligible = DiscountConfig.builder()
                .discountEligible(false)
                .scope(DiscountScope.VOLUME)
                .volumePercentTiers(List.of(row(0, "percentOff", 50)))
                .build();
        DiscountConfig none = DiscountConfig.builder().build();

        assertNull(DiscountEngine.apply(10, 100, ineligible, DiscountContext.none()).debug());
        assertEquals(1000, DiscountEngine.apply(10, 100, none, DiscountContext.none()).amountCents());
    }

    // ========================================================================
    // Customer tier step
    // ========================================================================

    @Test
    @DisplayName("Should apply fixed cents off per tier without going negative")
    void shouldApplyFixedTierDiscount() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.CUSTOMER_TIER)
                .method(DiscountMethod.FIXED_PER_UNIT)
                .customerTierCentsOffPerUnitByTier(Map.of("wholesale", 30, "retail", 500))
                .build();

        assertEquals(70, DiscountEngine.apply(2, 100, config,
                new DiscountContext(PricingTier.WHOLESALE, 0)).unitPriceCents());
        assertEquals(0, DiscountEngine.apply(2, 100, config,
                new DiscountContext(PricingTier.RETAIL, 0)).unitPriceCents());
    }

    @Test
    @DisplayName("Should skip the tier step without a customer tier")
    void shouldSkipTierStepWithoutTier() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.CUSTOMER_TIER)
                .customerTierPercentByTier(Map.of("wholesale", 10))
                .build();

        DiscountResult result = DiscountEngine.apply(1, 100, config, DiscountContext.none());

        assertEquals(100, result.unitPriceCents());
        assertNull(result.debug().tierStep());
        assertNull(result.debug().volumeStep());
    }

    @Test
    @DisplayName("Should override the unit price from the tier table")
    void shouldOverrideFromTierTable() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.CUSTOMER_TIER)
                .method(DiscountMethod.TIER_TABLE)
                .customerTierUnitPriceCentsByTier(Map.of("default", 85))
                .build();

        DiscountResult result = DiscountEngine.apply(4, 100, config, new DiscountContext(PricingTier.DEFAULT, 0));

        assertEquals(85, result.unitPriceCents());
        assertEquals(340, result.amountCents());
        assertEquals(PricingTier.DEFAULT, result.debug().tierStep().customerTier());
    }

    // ========================================================================
    // Volume step
    // ========================================================================

    @Test
    @DisplayName("Should pick the highest eligible volume tier")
    void shouldPickHighestVolumeTier() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.VOLUME)
                .volumeTrigger(VolumeTrigger.COMPONENT_QTY)
                .volumePercentTiers(List.of(row(10, "percentOff", 5), row(50, "percentOff", 20),
                        row(25, "percentOff", 10)))
                .build();

        DiscountResult result = DiscountEngine.apply(30, 100, config, DiscountContext.none());

        assertEquals(90, result.unitPriceCents());
        assertEquals(2700, result.amountCents());
        assertEquals(30.0, result.debug().volumeStep().triggerQty());
    }

    @Test
    @DisplayName("Should use product quantity for the productQty trigger")
    void shouldUseProductQuantity() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.VOLUME)
                .volumeTrigger(VolumeTrigger.PRODUCT_QTY)
                .volumePercentTiers(List.of(row(100, "percentOff", 50)))
                .build();

        assertEquals(100, DiscountEngine.apply(1, 100, config, new DiscountContext(null, 99)).unitPriceCents());
        assertEquals(50, DiscountEngine.apply(1, 100, config, new DiscountContext(null, 100)).unitPriceCents());
        assertNull(DiscountEngine.apply(1, 100, config, DiscountContext.none()).debug().volumeStep());
    }

    @Test
    @DisplayName("Should clamp percentages to 0..100")
    void shouldClampPercent() {
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.VOLUME)
                .volumeTrigger(VolumeTrigger.COMPONENT_QTY)
                .volumePercentTiers(List.of(row(0, "percentOff", 150)))
                .build();

        assertEquals(0, DiscountEngine.apply(5, 100, config, DiscountContext.none()).unitPriceCents());
    }

    @Test
    @DisplayName("Should only match tier-restricted rows for that customer tier")
    void shouldRestrictRowsByCustomerTier() {
        List<Object> rows = List.of(
                row(0, "unitPriceCents", 95),
                Map.of("minQty", 5, "unitPriceCents", 70, "customerTier", "wholesale"));
        DiscountConfig config = DiscountConfig.builder()
                .scope(DiscountScope.VOLUME)
                .volumeTrigger(VolumeTrigger.COMPONENT_QTY)
                .method(DiscountMethod.TIER_TABLE)
                .volumeUnitPriceCentsTiers(rows)
                .build();

        assertEquals(70, DiscountEngine.apply(10, 100, config,
                new DiscountContext(PricingTier.WHOLESALE, 0)).unitPriceCents());
        assertEquals(95, DiscountEngine.apply(10, 100, config,
                new DiscountContext(PricingTier.RETAIL, 0)).unitPriceCents());
    }

    @Test
    @DisplayName("Should ignore malformed tier rows")
    void shouldIgnoreMalformedRows() {
        List<Object> rows = List.of("nope", Map.of("minQty", -1, "percentOff", 90),
                Map.of("minQty", "2", "percentOff", "25"));

        VolumeTier best = DiscountEngine.selectBestTier(rows, "percentOff", 10, null);

        assertEquals(new VolumeTier(2, 25.0, null), best);
    }
}
