package com.e2eq.composite.spi;

import com.e2eq.composite.core.Document;

import java.util.List;
import java.util.Optional;

/**
 * Read side of the document store consumed by the resolution engine.
 * Implementations can be backed by a database, a remote API, in-memory maps, or others.
 *
 * <p>The engine never assumes exclusive access: a document returned here may be changed by
 * another writer right after it is fetched, and the engine resolves against what it got.</p>
 */
public interface DocumentStore {

    Optional<Document> getDocument(String documentId);

    /**
     * All documents whose group id equals {@code groupId}. Ordering is not significant;
     * callers that need a deterministic pick go through {@code GroupSelector}.
     */
    List<Document> getGroupMembers(String groupId);
}
