package com.e2eq.composite.core;

/**
 * Upper bounds for a single resolution call.
 *
 * @param maxDepth      deepest nesting of expanded documents below the top-level document
 * @param maxExpansions total documents expanded in one call, across all branches
 */
public record ExpansionLimits(int maxDepth, int maxExpansions) {

    public static final int DEFAULT_MAX_DEPTH = 32;
    public static final int DEFAULT_MAX_EXPANSIONS = 1000;

    public ExpansionLimits {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        if (maxExpansions < 1) throw new IllegalArgumentException("maxExpansions must be at least 1, was " + maxExpansions);
    }

    public static ExpansionLimits defaults() {
        return new ExpansionLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_EXPANSIONS);
    }
}
