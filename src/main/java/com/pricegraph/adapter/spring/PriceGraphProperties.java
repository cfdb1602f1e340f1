package com.pricegraph.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for PriceGraph.
 */
@ConfigurationProperties(prefix = "pricegraph")
public class PriceGraphProperties {

    /**
     * Whether the PriceGraph engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the engine settings file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:pricegraph.yaml";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }
}
