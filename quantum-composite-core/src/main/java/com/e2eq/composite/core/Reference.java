package com.e2eq.composite.core;

import java.util.Objects;
import java.util.Optional;

/**
 * A parsed component reference. Stored documents carry references as strings; they are parsed
 * once here so the rest of the engine only branches on the two variants.
 *
 * <ul>
 *   <li>{@code <documentId>} parses to {@link Direct}</li>
 *   <li>{@code group:<groupId>} and {@code group:<groupId>:<preferredType>} parse to {@link Group}</li>
 * </ul>
 */
public interface Reference {

    String GROUP_PREFIX = "group:";

    /** Canonical string form, identical to what is stored in component maps. */
    String wireFormat();

    /**
     * Parses a stored reference value. Blank values, and group references without a group id,
     * yield an empty result.
     */
    static Optional<Reference> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        if (!raw.startsWith(GROUP_PREFIX)) {
            return Optional.of(new Direct(raw));
        }
        String[] parts = raw.split(":", -1);
        String groupId = parts.length > 1 ? parts[1] : "";
        if (groupId.isBlank()) return Optional.empty();
        String preferredType = parts.length > 2 ? parts[2] : null;
        return Optional.of(new Group(groupId, Optional.ofNullable(preferredType).filter(t -> !t.isBlank())));
    }

    static boolean isGroupReference(String raw) {
        return raw != null && raw.startsWith(GROUP_PREFIX);
    }

    record Direct(String documentId) implements Reference {
        public Direct {
            Objects.requireNonNull(documentId, "documentId");
        }

        @Override
        public String wireFormat() {
            return documentId;
        }
    }

    record Group(String groupId, Optional<String> preferredType) implements Reference {
        public Group {
            Objects.requireNonNull(groupId, "groupId");
            preferredType = preferredType == null ? Optional.empty() : preferredType;
        }

        @Override
        public String wireFormat() {
            return GROUP_PREFIX + groupId + preferredType.map(t -> ":" + t).orElse("");
        }
    }
}
