package com.pricegraph.adapter.spring;

import com.pricegraph.config.EngineSettings;
import com.pricegraph.engine.PriceGraphEngine;
import com.pricegraph.spring.EnablePriceGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PriceGraphAutoConfiguration.
 */
class PriceGraphAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PriceGraphAutoConfiguration.class));

    @Test
    @DisplayName("Should create the engine from the bundled configuration")
    void shouldCreateEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(PriceGraphEngine.class);
            assertThat(context.getBean(EngineSettings.class).name()).isEqualTo("pricegraph");
        });
    }

    @Test
    @DisplayName("Should honor a custom config path")
    void shouldUseConfigPath() {
        contextRunner
                .withPropertyValues("pricegraph.config-path=classpath:pricegraph-strict.yaml")
                .run(context -> {
                    EngineSettings settings = context.getBean(EngineSettings.class);
                    assertThat(settings.name()).isEqualTo("strict-test");
                    assertThat(settings.validationPolicy().divByZeroStrict()).isTrue();
                });
    }

    @Test
    @DisplayName("Should back off when disabled")
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("pricegraph.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(PriceGraphEngine.class));
    }

    @Test
    @DisplayName("Should fail to start with a missing config file")
    void shouldFailOnMissingConfig() {
        contextRunner
                .withPropertyValues("pricegraph.config-path=classpath:missing.yaml")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Should keep user-defined settings")
    void shouldKeepUserSettings() {
        contextRunner
                .withBean(EngineSettings.class, EngineSettings::defaults)
                .withPropertyValues("pricegraph.config-path=classpath:missing.yaml")
                .run(context -> assertThat(context).hasSingleBean(PriceGraphEngine.class));
    }

    @Test
    @DisplayName("Should wire the engine through @EnablePriceGraph")
    void shouldEnableThroughAnnotation() {
        new ApplicationContextRunner()
                .withUserConfiguration(AnnotatedConfiguration.class)
                .run(context -> assertThat(context).hasSingleBean(PriceGraphEngine.class));
    }

    @Configuration
    @EnablePriceGraph
    static class AnnotatedConfiguration {
    }
}
