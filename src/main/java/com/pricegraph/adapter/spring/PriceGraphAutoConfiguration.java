package com.pricegraph.adapter.spring;

import com.pricegraph.config.ConfigLoader;
import com.pricegraph.config.EngineSettings;
import com.pricegraph.engine.PriceGraphEngine;
import com.pricegraph.engine.PriceGraphEngineFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for PriceGraph.
 */
@Configuration
@ConditionalOnProperty(prefix = "pricegraph", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PriceGraphProperties.class)
public class PriceGraphAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PriceGraphAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EngineSettings priceGraphEngineSettings(PriceGraphProperties properties) {
        log.info("Loading PriceGraph configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceGraphEngine priceGraphEngine(EngineSettings settings) {
        log.info("Creating PriceGraphEngine: {}", settings.name());
        return PriceGraphEngineFactory.create(settings);
    }
}
