package com.e2eq.composite.core;

import java.util.List;
import java.util.Map;

/**
 * Result of expanding a document body.
 *
 * @param text                    the body with every resolvable token substituted
 * @param resolvedGroupReferences group picks made during the call, keyed by the document whose
 *                                token was resolved and then by token key; callers may persist
 *                                them as direct references, the engine never does
 * @param issues                  tokens left in place, in the order they were met
 * @param documentsExpanded       number of referenced documents expanded
 */
public record Expansion(String text,
                        Map<String, Map<String, String>> resolvedGroupReferences,
                        List<ExpansionIssue> issues,
                        int documentsExpanded) {

    public Expansion {
        resolvedGroupReferences = resolvedGroupReferences == null ? Map.of() : Map.copyOf(resolvedGroupReferences);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean isComplete() {
        return issues.isEmpty();
    }
}
