package com.pricegraph.config;

import com.pricegraph.exception.ConfigurationException;
import com.pricegraph.validator.ValidationPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    // ========================================================================
    // Loading
    // ========================================================================

    @Test
    @DisplayName("Should load the bundled classpath configuration")
    void shouldLoadClasspathConfig() {
        EngineSettings settings = ConfigLoader.load("classpath:pricegraph.yaml");

        assertEquals("pricegraph", settings.name());
        assertEquals(ValidationPolicy.defaults(), settings.validationPolicy());
        assertTrue(settings.envKeys().contains("perimeterIn"));
        assertEquals(5, settings.envKeys().keys().size());
    }

    @Test
    @DisplayName("Should load a strict test configuration")
    void shouldLoadStrictConfig() {
        EngineSettings settings = ConfigLoader.load("classpath:pricegraph-strict.yaml");

        assertEquals("strict-test", settings.name());
        assertTrue(settings.validationPolicy().ambiguousEdgesStrict());
        assertTrue(settings.validationPolicy().divByZeroStrict());
        assertFalse(settings.validationPolicy().negativeQuantityStrict());
        assertTrue(settings.envKeys().contains("shipZone"));
    }

    @Test
    @DisplayName("Should accept settings at the document root")
    void shouldAcceptRootSettings() {
        EngineSettings settings = ConfigLoader.load(yaml("""
                name: flat
                validation:
                  negative-quantity-strict: "true"
                """));

        assertEquals("flat", settings.name());
        assertTrue(settings.validationPolicy().negativeQuantityStrict());
        assertTrue(settings.envKeys().contains("sqft"));
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty section")
    void shouldDefaultEmptySection() {
        EngineSettings settings = ConfigLoader.load(yaml("pricegraph:\n"));

        assertEquals(EngineSettings.defaults(), settings);
    }

    // ========================================================================
    // Errors
    // ========================================================================

    @Test
    @DisplayName("Should reject missing files")
    void shouldRejectMissingFile() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertTrue(e.getMessage().startsWith("Failed to load configuration from: "));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(" "));
    }

    @Test
    @DisplayName("Should reject malformed documents")
    void shouldRejectMalformedDocuments() {
        assertEquals("Configuration file is empty",
                assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml(""))).getMessage());
        assertEquals("Configuration root must be a mapping",
                assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml("- a\n- b\n"))).getMessage());
        assertEquals("Configuration file is not valid YAML",
                assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml("a: [1, 2"))).getMessage());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThrows(ConfigurationException.class,
                () -> ConfigLoader.load(yaml("validation:\n  div-by-zero-strict: maybe\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml("env-keys: widthIn\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml("env-keys: [widthIn, '']\n")));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load(yaml("pricegraph: 3\n")));
    }
}
