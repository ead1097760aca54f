package com.e2eq.composite.rest.dto;

import com.e2eq.composite.core.Document;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentResponse(
        String id,
        String projectId,
        String title,
        String content,
        Map<String, String> components,
        String groupId,
        String documentType,
        boolean composite,
        Instant createdAt) {

    public static DocumentResponse from(Document document) {
        if (document == null) return null;
        return new DocumentResponse(document.id(), document.projectId(), document.title(), document.content(),
                document.components(), document.groupId(), document.documentType(), document.isComposite(),
                document.createdAt());
    }
}
