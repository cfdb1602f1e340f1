package com.pricegraph.finding;

/**
 * Finding severity. Rank drives the stable sort order of validation results.
 */
public enum Severity {
    ERROR(0),
    WARNING(1),
    INFO(2);

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
