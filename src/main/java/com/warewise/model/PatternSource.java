package com.warewise.model;

/**
 * Where a {@link PatternSet} came from. Only {@link #DEFAULT_FALLBACK} is a guess.
 */
public enum PatternSource {
    CANONICAL_TEMPLATE("canonical_template"),
    ZONE_BASED_TEMPLATE("zone_based_template"),
    DEFAULT_FALLBACK("default_fallback");

    private final String label;

    PatternSource(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
