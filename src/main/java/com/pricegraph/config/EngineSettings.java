package com.pricegraph.config;

import com.pricegraph.ref.EnvKeys;
import com.pricegraph.validator.ValidationPolicy;

/**
 * Engine-wide settings loaded from YAML.
 *
 * @param name             Engine name, used in logs
 * @param validationPolicy Severity knobs for the structural validator
 * @param envKeys          Environment keys an envRef may name
 */
public record EngineSettings(
        String name,
        ValidationPolicy validationPolicy,
        EnvKeys envKeys
) {

    public EngineSettings {
        if (name == null || name.isBlank()) {
            name = "pricegraph";
        }
        if (validationPolicy == null) {
            validationPolicy = ValidationPolicy.defaults();
        }
        if (envKeys == null) {
            envKeys = EnvKeys.defaults();
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings("pricegraph", ValidationPolicy.defaults(), EnvKeys.defaults());
    }
}
