package com.e2eq.composite.core;

import com.e2eq.composite.exceptions.CyclicReferenceException;
import com.e2eq.composite.spi.DocumentStore;
import org.jboss.logging.Logger;

import java.util.*;

/**
 * Write-time check that a proposed component map keeps the reference graph acyclic.
 *
 * <p>Depth-first search from every proposed reference, looking for a path back to the edited
 * document. Nodes are white (unseen), gray (on the current search path) or black (fully explored).
 * Reaching the edited document, or re-entering a gray node, is a cycle; black nodes are skipped.
 * Node colours are kept for the whole call, so each document is fetched at most once.</p>
 *
 * <p>Group references are expanded to every member of the group, not only the member a read would
 * select, so a write is rejected if any member could close a cycle. Missing documents, and
 * documents of other projects, contribute no path.</p>
 */
public final class CycleValidator {

    private static final Logger LOG = Logger.getLogger(CycleValidator.class);

    private final DocumentStore store;

    public CycleValidator(DocumentStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * @throws CyclicReferenceException if {@code proposedComponents} would close a cycle
     */
    public void validate(String editedDocumentId, Map<String, String> proposedComponents, String projectId) {
        Optional<CycleViolation> violation = findCycle(editedDocumentId, proposedComponents, projectId);
        if (violation.isPresent()) {
            CycleViolation v = violation.get();
            if (v.existingCycleAt().isPresent()) {
                LOG.infof("Rejecting component map of document %s: %s reaches the stored cycle through %s",
                        editedDocumentId, v.offendingDocumentId(), v.existingCycleAt().get());
            } else {
                LOG.infof("Rejecting component map of document %s: %s", editedDocumentId, v.message());
            }
            throw new CyclicReferenceException(violation.get());
        }
    }

    /**
     * Returns the first cycle found, or empty if the proposed map is safe.
     */
    public Optional<CycleViolation> findCycle(String editedDocumentId, Map<String, String> proposedComponents, String projectId) {
        Objects.requireNonNull(editedDocumentId, "editedDocumentId");
        if (proposedComponents == null || proposedComponents.isEmpty()) return Optional.empty();

        Search search = new Search(editedDocumentId, projectId);
        for (String raw : proposedComponents.values()) {
            Optional<Reference> parsed = Reference.parse(raw);
            if (parsed.isEmpty()) continue;
            Reference ref = parsed.get();
            if (ref instanceof Reference.Group group) {
                for (Document member : members(group.groupId(), projectId)) {
                    if (search.hasPath(member.id())) {
                        return Optional.of(new CycleViolation(editedDocumentId, raw, member.id(),
                                Optional.of(group.groupId()), search.reentered()));
                    }
                }
            } else {
                String targetId = ((Reference.Direct) ref).documentId();
                if (search.hasPath(targetId)) {
                    return Optional.of(new CycleViolation(editedDocumentId, raw, targetId, Optional.empty(), search.reentered()));
                }
            }
        }
        return Optional.empty();
    }

    private List<Document> members(String groupId, String projectId) {
        return store.getGroupMembers(groupId).stream()
                .filter(d -> d.belongsTo(projectId))
                .toList();
    }

    private final class Search {
        final String target;
        final String projectId;
        final Set<String> gray = new HashSet<>();
        final Set<String> black = new HashSet<>();
        String reentered;

        Search(String target, String projectId) {
            this.target = target;
            this.projectId = projectId;
        }

        Optional<String> reentered() {
            return Optional.ofNullable(reentered);
        }

        boolean hasPath(String start) {
            Deque<Node> stack = new ArrayDeque<>();
            if (enter(start, stack)) return true;
            while (!stack.isEmpty()) {
                Node top = stack.peek();
                if (top.successors.hasNext()) {
                    if (enter(top.successors.next(), stack)) return true;
                } else {
                    stack.pop();
                    gray.remove(top.id);
                    black.add(top.id);
                }
            }
            return false;
        }

        /** Returns true on a cycle signal; otherwise pushes the node if it still needs exploring. */
        private boolean enter(String id, Deque<Node> stack) {
            if (id.equals(target)) return true;
            if (gray.contains(id)) {
                reentered = id;
                return true;
            }
            if (black.contains(id)) return false;
            Optional<Document> doc = store.getDocument(id).filter(d -> d.belongsTo(projectId));
            if (doc.isEmpty()) {
                black.add(id);
                return false;
            }
            gray.add(id);
            stack.push(new Node(id, successors(doc.get()).iterator()));
            return false;
        }

        private List<String> successors(Document doc) {
            List<String> out = new ArrayList<>();
            for (String raw : doc.components().values()) {
                Optional<Reference> parsed = Reference.parse(raw);
                if (parsed.isEmpty()) continue;
                if (parsed.get() instanceof Reference.Group group) {
                    for (Document member : members(group.groupId(), projectId)) out.add(member.id());
                } else {
                    out.add(((Reference.Direct) parsed.get()).documentId());
                }
            }
            return out;
        }
    }

    private record Node(String id, Iterator<String> successors) {}
}
