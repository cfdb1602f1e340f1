package com.pricegraph.engine;

import com.pricegraph.config.ConfigLoader;
import com.pricegraph.config.EngineSettings;

/**
 * Factory for creating PriceGraphEngine instances.
 */
public final class PriceGraphEngineFactory {

    private PriceGraphEngineFactory() {
    }

    public static PriceGraphEngine create(EngineSettings settings) {
        return new DefaultPriceGraphEngine(settings);
    }

    public static PriceGraphEngine create(String configPath) {
        return create(ConfigLoader.load(configPath));
    }

    public static PriceGraphEngine createDefault() {
        return create(EngineSettings.defaults());
    }
}
