package com.e2eq.composite.core;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Chooses the member of a group that a {@code group:} reference stands for.
 *
 * <p>Order of preference: a member with the preferred document type, then the conventional
 * representative (member id equals group id), then the oldest member. Members are compared by
 * creation time and then id, so the pick does not depend on the order the store returned them.</p>
 */
public final class GroupSelector {
    private GroupSelector() {}

    public static final Comparator<Document> OLDEST_FIRST =
            Comparator.comparing(Document::createdAt).thenComparing(Document::id);

    public static Optional<Document> select(String groupId, Optional<String> preferredType, Collection<Document> members) {
        if (members == null || members.isEmpty()) return Optional.empty();
        List<Document> ordered = members.stream()
                .filter(Objects::nonNull)
                .sorted(OLDEST_FIRST)
                .toList();
        if (ordered.isEmpty()) return Optional.empty();

        if (preferredType != null && preferredType.isPresent()) {
            String type = preferredType.get();
            Optional<Document> typed = ordered.stream()
                    .filter(d -> type.equals(d.documentType()))
                    .findFirst();
            if (typed.isPresent()) return typed;
        }
        Optional<Document> representative = ordered.stream()
                .filter(d -> d.id().equals(groupId))
                .findFirst();
        if (representative.isPresent()) return representative;
        return Optional.of(ordered.get(0));
    }

    public static Optional<Document> select(Reference.Group reference, Collection<Document> members) {
        return select(reference.groupId(), reference.preferredType(), members);
    }

    /**
     * Distinct non-blank document types present in the group, sorted.
     */
    public static List<String> availableTypes(Collection<Document> members) {
        TreeSet<String> types = new TreeSet<>();
        if (members != null) {
            for (Document d : members) {
                if (d != null && d.documentType() != null && !d.documentType().isBlank()) {
                    types.add(d.documentType());
                }
            }
        }
        return List.copyOf(types);
    }
}
