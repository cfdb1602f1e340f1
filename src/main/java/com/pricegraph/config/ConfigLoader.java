package com.pricegraph.config;

import com.pricegraph.exception.ConfigurationException;
import com.pricegraph.ref.EnvKeys;
import com.pricegraph.validator.ValidationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads engine settings from YAML files.
 * <p>
 * Example:
 * <pre>
 * pricegraph:
 *   name: storefront
 *   env-keys: [widthIn, heightIn, quantity, sqft, perimeterIn]
 *   validation:
 *     ambiguous-edges-strict: false
 *     div-by-zero-strict: false
 *     negative-quantity-strict: false
 * </pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load settings from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded settings
     * @throws ConfigurationException if the file is missing, empty or malformed
     */
    public static EngineSettings load(String path) {
        log.info("Loading PriceGraph configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Parse settings from a YAML stream.
     */
    public static EngineSettings load(InputStream inputStream) {
        return parseYaml(inputStream);
    }

    private static Resource getResource(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigurationException("Configuration path is required");
        }
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static EngineSettings parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration file is not valid YAML", e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map<?, ?>)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Settings may sit at the root or under a 'pricegraph' key
        Map<String, Object> engineConfig = root.containsKey("pricegraph")
                ? asSection(root.get("pricegraph"), "pricegraph")
                : root;

        String name = getString(engineConfig, "name", "pricegraph");
        List<String> envKeyList = getStringList(engineConfig, "env-keys");
        EnvKeys envKeys = envKeyList == null ? EnvKeys.defaults() : EnvKeys.of(envKeyList);
        ValidationPolicy policy = parseValidationPolicy(engineConfig.get("validation"));

        EngineSettings settings = new EngineSettings(name, policy, envKeys);

        log.info("Loaded PriceGraph configuration: {} with {} env keys, policy: {}",
                name, envKeys.keys().size(), policy);

        return settings;
    }

    private static ValidationPolicy parseValidationPolicy(Object value) {
        if (value == null) {
            return ValidationPolicy.defaults();
        }
        Map<String, Object> validation = asSection(value, "validation");
        return new ValidationPolicy(
                getBoolean(validation, "ambiguous-edges-strict", false),
                getBoolean(validation, "div-by-zero-strict", false),
                getBoolean(validation, "negative-quantity-strict", false));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asSection(Object value, String key) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?>)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    // ========================================================================
    // Helper methods
    // ========================================================================

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new ConfigurationException("'" + key + "' must be true or false, got: " + value);
    }

    private static List<String> getStringList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + key + "' must be a list");
        }
        List<String> result = new ArrayList<>();
        for (Object item : list) {
            if (item == null || item.toString().isBlank()) {
                throw new ConfigurationException("'" + key + "' must not contain blank entries");
            }
            result.add(item.toString().trim());
        }
        return result;
    }
}
