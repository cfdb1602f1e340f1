package com.pricegraph.validator;

import com.pricegraph.TestJson;
import com.pricegraph.finding.Finding;
import com.pricegraph.finding.FindingCodes;
import com.pricegraph.finding.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BasePriceValidator.
 */
class BasePriceValidatorTest {

    private BasePriceValidator validator;

    @BeforeEach
    void setUp() {
        validator = new BasePriceValidator();
    }

    private Finding onlyError(String json) {
        ValidationResult result = validator.validate(TestJson.tree(json));
        assertEquals(1, result.errors().size());
        assertEquals(FindingCodes.BASE_PRICE_MISSING, result.errors().get(0).code());
        return result.errors().get(0);
    }

    @Test
    @DisplayName("Should report each missing level of the base pricing block")
    void shouldReportMissingLevels() {
        assertEquals("tree.meta", onlyError("{'nodes': [], 'edges': []}").path());
        assertEquals("tree.meta.pricingV2", onlyError("{'meta': {}, 'nodes': [], 'edges': []}").path());
        assertEquals("tree.meta.pricingV2.base",
                onlyError("{'meta': {'pricingV2': {}}, 'nodes': [], 'edges': []}").path());
    }

    @Test
    @DisplayName("Should require a non-zero rate")
    void shouldRequireNonZeroRate() {
        Finding finding = onlyError("""
                {'meta': {'pricingV2': {'base': {'perSqftCents': 0}}}, 'nodes': [], 'edges': []}
                """);

        assertTrue(finding.message().startsWith("Base pricing requires at least one non-zero value"));
    }

    @Test
    @DisplayName("Should accept any non-zero rate")
    void shouldAcceptConfiguredBase() {
        ValidationResult result = validator.validate(TestJson.tree("""
                {'meta': {'pricingV2': {'base': {'minimumChargeCents': 2500}}}, 'nodes': [], 'edges': []}
                """));

        assertTrue(result.ok());
        assertTrue(result.findings().isEmpty());
    }
}
