package com.e2eq.composite.core;

/**
 * A token the expander left unexpanded, and why.
 */
public record ExpansionIssue(Kind kind, String documentId, String tokenKey, String reference, String message) {

    public enum Kind {
        UNRESOLVED_TOKEN,
        INVALID_REFERENCE,
        EMPTY_GROUP,
        MISSING_DOCUMENT,
        CYCLE_SUPPRESSED,
        DEPTH_LIMIT,
        EXPANSION_LIMIT
    }
}
