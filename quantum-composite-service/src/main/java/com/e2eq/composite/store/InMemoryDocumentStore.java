package com.e2eq.composite.store;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.core.GroupSelector;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed catalog used when no other {@link DocumentCatalog} bean is present.
 * Documents are immutable records, so readers always see a consistent snapshot of each one.
 */
public class InMemoryDocumentStore implements DocumentCatalog {

    private final Map<String, Document> documents = new ConcurrentHashMap<>();

    @Override
    public Optional<Document> getDocument(String documentId) {
        if (documentId == null) return Optional.empty();
        return Optional.ofNullable(documents.get(documentId));
    }

    @Override
    public List<Document> getGroupMembers(String groupId) {
        if (groupId == null) return List.of();
        return documents.values().stream()
                .filter(d -> groupId.equals(d.groupId()))
                .sorted(GroupSelector.OLDEST_FIRST)
                .toList();
    }

    @Override
    public List<Document> listByProject(String projectId) {
        return documents.values().stream()
                .filter(d -> Objects.equals(projectId, d.projectId()))
                .sorted(GroupSelector.OLDEST_FIRST)
                .toList();
    }

    @Override
    public Document save(Document document) {
        Objects.requireNonNull(document, "document");
        documents.put(document.id(), document);
        return document;
    }

    @Override
    public boolean delete(String documentId) {
        return documentId != null && documents.remove(documentId) != null;
    }

    public int size() {
        return documents.size();
    }

    public void clear() {
        documents.clear();
    }
}
