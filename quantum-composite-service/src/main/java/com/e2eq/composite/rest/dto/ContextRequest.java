package com.e2eq.composite.rest.dto;

import java.util.List;

/**
 * Prompt-context request. Null options fall back to the configured defaults.
 */
public record ContextRequest(
        String primaryDocumentId,
        List<String> additionalDocumentIds,
        Boolean includeRelated,
        Integer maxTokens,
        List<String> preferredTypes) {
}
