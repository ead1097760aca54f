package com.e2eq.composite.service;

import com.e2eq.composite.core.CycleValidator;
import com.e2eq.composite.core.CycleViolation;
import com.e2eq.composite.core.Document;
import com.e2eq.composite.core.Expansion;
import com.e2eq.composite.core.GroupSelector;
import com.e2eq.composite.core.RecursiveExpander;
import com.e2eq.composite.exceptions.CyclicReferenceException;
import com.e2eq.composite.rest.dto.DocumentRequest;
import com.e2eq.composite.store.DocumentCatalog;
import com.e2eq.composite.store.InMemoryDocumentStore;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reads, resolves and writes composite documents. Every write that carries a component map passes
 * the cycle validator first; a rejected write leaves the catalog untouched. Validation and the save
 * that follows it run under one lock.
 */
@ApplicationScoped
public class CompositeDocumentService {

    private final DocumentCatalog catalog;
    private final RecursiveExpander expander;
    private final CycleValidator validator;
    private final Object writeLock = new Object();

    @Inject
    public CompositeDocumentService(DocumentCatalog catalog, RecursiveExpander expander, CycleValidator validator) {
        this.catalog = catalog;
        this.expander = expander;
        this.validator = validator;
    }

    public Optional<Document> findDocument(String documentId) {
        return catalog.getDocument(documentId);
    }

    public Document getDocument(String documentId) {
        return catalog.getDocument(documentId)
                .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));
    }

    public Document getDocument(String projectId, String documentId) {
        return catalog.getDocument(documentId)
                .filter(d -> d.belongsTo(projectId))
                .orElseThrow(() -> new NotFoundException("Document not found in project " + projectId + ": " + documentId));
    }

    public ResolvedDocument resolve(String documentId, Map<String, String> overrides) {
        Document document = getDocument(documentId);
        return new ResolvedDocument(document, expander.resolve(document, overrides));
    }

    public Expansion resolve(Document document, Map<String, String> overrides) {
        return expander.resolve(document, overrides);
    }

    /**
     * Checks a proposed component map without writing anything. {@code projectId} defaults to the
     * stored document's project when the document exists.
     *
     * @throws BadRequestException when no project is given and the document does not exist
     */
    public Optional<CycleViolation> validate(String documentId, String projectId, Map<String, String> components) {
        String project = projectId;
        if (project == null) {
            project = catalog.getDocument(documentId)
                    .map(Document::projectId)
                    .orElseThrow(() -> new BadRequestException("projectId is required to validate unknown document " + documentId));
        }
        return validator.findCycle(documentId, components, project);
    }

    public Document create(String projectId, DocumentRequest request) {
        if (request == null || request.getTitle() == null || request.getTitle().isBlank()) {
            throw new BadRequestException("Title is required");
        }
        String id = UUID.randomUUID().toString();
        Document document;
        synchronized (writeLock) {
            if (request.getComponents() != null) {
                validator.validate(id, request.getComponents(), projectId);
            }
            document = new Document(id, projectId, request.getTitle(), request.getContent(),
                    request.getComponents(), request.getGroupId(), request.getDocumentType(), Instant.now());
            catalog.save(document);
        }
        Log.debugf("Created document %s in project %s", id, projectId);
        return document;
    }

    public Document update(String projectId, String documentId, DocumentRequest request) {
        if (request == null) {
            throw new BadRequestException("Request body is required");
        }
        Document updated;
        synchronized (writeLock) {
            if (request.getComponents() != null) {
                validator.validate(documentId, request.getComponents(), projectId);
            }
            Document current = getDocument(projectId, documentId);
            String title = request.getTitle() == null || request.getTitle().isBlank() ? current.title() : request.getTitle();
            updated = new Document(documentId, current.projectId(), title, request.getContent(),
                    request.getComponents(), request.getGroupId(), request.getDocumentType(), current.createdAt());
            catalog.save(updated);
        }
        Log.debugf("Updated document %s in project %s", documentId, projectId);
        return updated;
    }

    /**
     * Saves a batch of documents whose ids are already assigned. The batch is staged over the
     * catalog's current documents of the same projects and every component map is checked against
     * that staged graph, so documents of the batch may reference each other. Nothing is saved
     * unless the whole batch passes.
     *
     * @throws CyclicReferenceException for the first document whose component map closes a cycle
     */
    public List<Document> importDocuments(Collection<Document> batch) {
        if (batch == null || batch.isEmpty()) return List.of();
        synchronized (writeLock) {
            InMemoryDocumentStore staged = new InMemoryDocumentStore();
            batch.stream()
                    .map(Document::projectId)
                    .distinct()
                    .forEach(project -> catalog.listByProject(project).forEach(staged::save));
            batch.forEach(staged::save);

            CycleValidator stagedValidator = new CycleValidator(staged);
            for (Document document : batch) {
                if (document.isComposite()) {
                    stagedValidator.validate(document.id(), document.components(), document.projectId());
                }
            }
            batch.forEach(catalog::save);
        }
        Log.debugf("Imported %d documents", batch.size());
        return List.copyOf(batch);
    }

    /**
     * Picks the member a {@code group:<groupId>[:<preferredType>]} reference would expand to and
     * resolves it without overrides.
     *
     * @throws NotFoundException when the group has no members in the project
     */
    public GroupResolution resolveGroup(String projectId, String groupId, String preferredType) {
        List<Document> members = catalog.getGroupMembers(groupId).stream()
                .filter(d -> d.belongsTo(projectId))
                .toList();
        Optional<String> type = preferredType == null || preferredType.isBlank()
                ? Optional.empty()
                : Optional.of(preferredType);
        Document selected = GroupSelector.select(groupId, type, members)
                .orElseThrow(() -> new NotFoundException("No documents found in group " + groupId));
        Expansion expansion = expander.resolve(selected, Map.of());
        return new GroupResolution(selected, expansion.text(), groupId, true, GroupSelector.availableTypes(members));
    }
}
