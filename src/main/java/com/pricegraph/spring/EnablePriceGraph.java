package com.pricegraph.spring;

import com.pricegraph.adapter.spring.PriceGraphAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Registers the {@code PriceGraphEngine} and its {@code EngineSettings} beans
 * from a plain {@code @Configuration} class, for contexts that do not run
 * Spring Boot auto-configuration.
 * <pre>
 * &#64;Configuration
 * &#64;EnablePriceGraph
 * class QuoteConfig {
 *     &#64;Bean
 *     QuoteService quoteService(PriceGraphEngine engine) {
 *         return new QuoteService(engine);
 *     }
 * }
 * </pre>
 * Settings are read from {@code pricegraph.config-path}, defaulting to
 * {@code classpath:pricegraph.yaml}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(PriceGraphAutoConfiguration.class)
public @interface EnablePriceGraph {
}
