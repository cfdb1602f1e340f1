package com.pricegraph.ref;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Allowlist of environment keys an {@code envRef} may name. Passed explicitly
 * to the symbol table builder and the evaluator.
 *
 * @param keys Allowed keys, in declaration order
 */
public record EnvKeys(Set<String> keys) {

    public static final Set<String> CANONICAL = Set.of("widthIn", "heightIn", "quantity", "sqft", "perimeterIn");

    public EnvKeys {
        keys = Set.copyOf(new LinkedHashSet<>(keys));
    }

    public static EnvKeys defaults() {
        return new EnvKeys(CANONICAL);
    }

    public static EnvKeys of(Collection<String> keys) {
        return new EnvKeys(new LinkedHashSet<>(keys));
    }

    public boolean contains(String key) {
        return key != null && keys.contains(key);
    }
}
