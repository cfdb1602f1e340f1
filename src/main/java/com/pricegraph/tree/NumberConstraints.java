package com.pricegraph.tree;

/**
 * Declared bounds of a NUMBER input. Each bound is null when not declared.
 */
public record NumberConstraints(Double min, Double max, Double step) {

    public static final NumberConstraints NONE = new NumberConstraints(null, null, null);

    public boolean contains(double value) {
        return (min == null || value >= min) && (max == null || value <= max);
    }
}
