package com.e2eq.composite.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a stored document as seen by the resolution engine.
 *
 * <p>{@code components} maps token keys found in {@code content} to reference strings
 * (a document id, or {@code group:<groupId>[:<type>]}). A document with an empty
 * component map can still be expanded when callers pass global overrides.</p>
 */
public record Document(String id,
                       String projectId,
                       String title,
                       String content,
                       Map<String, String> components,
                       String groupId,
                       String documentType,
                       Instant createdAt) {

    public Document {
        Objects.requireNonNull(id, "id");
        content = content == null ? "" : content;
        components = components == null || components.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(components));
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public boolean isComposite() {
        return !components.isEmpty();
    }

    public boolean belongsTo(String project) {
        return project == null || project.equals(projectId);
    }

    public Document withComponents(Map<String, String> newComponents) {
        return new Document(id, projectId, title, content, newComponents, groupId, documentType, createdAt);
    }
}
