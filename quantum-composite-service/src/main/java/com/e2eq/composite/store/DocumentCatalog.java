package com.e2eq.composite.store;

import com.e2eq.composite.core.Document;
import com.e2eq.composite.spi.DocumentStore;

import java.util.List;

/**
 * The document store as seen by the service layer: the engine's read operations plus the
 * project listing used by context assembly and the writes gated by cycle validation.
 */
public interface DocumentCatalog extends DocumentStore {

    /**
     * All documents of a project, oldest first.
     */
    List<Document> listByProject(String projectId);

    Document save(Document document);

    boolean delete(String documentId);
}
