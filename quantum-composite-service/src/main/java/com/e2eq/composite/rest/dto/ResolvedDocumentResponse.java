package com.e2eq.composite.rest.dto;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.core.Expansion;
import com.e2eq.composite.core.ExpansionIssue;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolvedDocumentResponse(
        DocumentResponse document,
        String resolvedContent,
        Map<String, Map<String, String>> resolvedGroupReferences,
        List<ExpansionIssue> issues,
        int documentsExpanded,
        boolean complete) {

    public static ResolvedDocumentResponse of(Document document, Expansion expansion) {
        return new ResolvedDocumentResponse(DocumentResponse.from(document), expansion.text(),
                expansion.resolvedGroupReferences(), expansion.issues(), expansion.documentsExpanded(),
                expansion.isComplete());
    }
}
