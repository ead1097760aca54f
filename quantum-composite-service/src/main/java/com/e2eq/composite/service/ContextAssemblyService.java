package com.e2eq.composite.service;

import com.e2eq.composite.config.CompositeConfig;
import com.e2eq.composite.core.Document;
import com.e2eq.composite.core.Reference;
import com.e2eq.composite.store.DocumentCatalog;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the text block handed to a language model: the primary document, any explicitly
 * requested documents, then related documents, each resolved and formatted as a section while the
 * approximate token budget allows.
 */
@ApplicationScoped
public class ContextAssemblyService {

    static final String PRIMARY = "Primary Document";
    static final String ADDITIONAL = "Additional Context";
    static final String RELATED = "Related Context";
    static final String SECTION_SEPARATOR = "\n\n";

    public record ContextOptions(boolean includeRelated, int maxTokens, List<String> preferredTypes) {
        public ContextOptions {
            preferredTypes = preferredTypes == null ? List.of() : List.copyOf(preferredTypes);
        }
    }

    public record AssembledContext(String context, List<String> documentsUsed, int tokenCount) {
        public AssembledContext {
            documentsUsed = List.copyOf(documentsUsed);
        }
    }

    @Inject
    DocumentCatalog catalog;

    @Inject
    CompositeDocumentService documents;

    @Inject
    CompositeConfig config;

    public ContextOptions defaultOptions() {
        return new ContextOptions(true, config.context().maxTokens(), List.of());
    }

    /**
     * @throws NotFoundException when the primary document is not in the project
     */
    public AssembledContext assemble(String projectId, String primaryDocumentId, List<String> additionalDocumentIds,
                                     ContextOptions options) {
        ContextOptions opts = options == null ? defaultOptions() : options;
        Document primary = documents.getDocument(projectId, primaryDocumentId);

        StringBuilder context = new StringBuilder();
        List<String> used = new ArrayList<>();
        used.add(primary.id());

        String primarySection = format(primary, PRIMARY);
        context.append(primarySection);
        int tokens = estimateTokens(primarySection);

        if (additionalDocumentIds != null) {
            for (String id : additionalDocumentIds) {
                if (tokens >= opts.maxTokens()) break;
                Document doc = catalog.getDocument(id).filter(d -> d.belongsTo(projectId)).orElse(null);
                if (doc == null) {
                    Log.debugf("Context for %s: additional document %s not found in project %s", primaryDocumentId, id, projectId);
                    continue;
                }
                tokens = appendSection(context, used, doc, ADDITIONAL, tokens, opts.maxTokens());
            }
        }

        if (opts.includeRelated() && tokens < opts.maxTokens()) {
            for (Document doc : findRelated(projectId, primary, used, opts.preferredTypes())) {
                if (tokens >= opts.maxTokens()) break;
                tokens = appendSection(context, used, doc, RELATED, tokens, opts.maxTokens());
            }
        }

        Log.debugf("Assembled context for %s: %d documents, ~%d tokens", primaryDocumentId, used.size(), tokens);
        return new AssembledContext(context.toString(), used, tokens);
    }

    private int appendSection(StringBuilder context, List<String> used, Document doc, String label, int tokens, int maxTokens) {
        String section = format(doc, label);
        int sectionTokens = estimateTokens(section);
        if (tokens + sectionTokens > maxTokens) {
            return tokens;
        }
        context.append(SECTION_SEPARATOR).append(section);
        used.add(doc.id());
        return tokens + sectionTokens;
    }

    /**
     * Same-group members, then documents of the preferred types, then documents the primary
     * references directly; capped at the configured related limit.
     */
    List<Document> findRelated(String projectId, Document primary, List<String> exclude, List<String> preferredTypes) {
        Set<String> excluded = new LinkedHashSet<>(exclude);
        Map<String, Document> related = new LinkedHashMap<>();

        if (primary.groupId() != null) {
            catalog.getGroupMembers(primary.groupId()).stream()
                    .filter(d -> d.belongsTo(projectId) && !excluded.contains(d.id()))
                    .forEach(d -> related.putIfAbsent(d.id(), d));
        }
        if (!preferredTypes.isEmpty()) {
            catalog.listByProject(projectId).stream()
                    .filter(d -> d.documentType() != null && preferredTypes.contains(d.documentType()))
                    .filter(d -> !excluded.contains(d.id()))
                    .forEach(d -> related.putIfAbsent(d.id(), d));
        }
        for (Entry<String, String> component : primary.components().entrySet()) {
            Reference.parse(component.getValue())
                    .filter(Reference.Direct.class::isInstance)
                    .map(r -> ((Reference.Direct) r).documentId())
                    .filter(id -> !excluded.contains(id))
                    .flatMap(catalog::getDocument)
                    .filter(d -> d.belongsTo(projectId))
                    .ifPresent(d -> related.putIfAbsent(d.id(), d));
        }

        Comparator<Document> relevance = Comparator
                .comparing((Document d) -> !sameGroup(primary, d))
                .thenComparing(d -> !preferredTypes.contains(Objects.toString(d.documentType(), "")));
        return related.values().stream()
                .sorted(relevance)
                .limit(config.context().relatedLimit())
                .toList();
    }

    private static boolean sameGroup(Document primary, Document other) {
        return primary.groupId() != null && primary.groupId().equals(other.groupId());
    }

    String format(Document document, String label) {
        StringBuilder out = new StringBuilder();
        out.append("=== ").append(label).append(": ").append(document.title()).append(" ===\n");
        if (document.documentType() != null && !document.documentType().isBlank()) {
            out.append("Type: ").append(document.documentType()).append('\n');
        }
        out.append("Content:\n").append(documents.resolve(document, Map.of()).text());
        return out.toString();
    }

    static int estimateTokens(String text) {
        return (text.length() + 3) / 4;
    }
}
