package com.e2eq.composite.runtime;

import com.e2eq.composite.config.CompositeConfig;
import com.e2eq.composite.core.Document;
import com.e2eq.composite.exceptions.CompositeResolutionException;
import com.e2eq.composite.exceptions.CyclicReferenceException;
import com.e2eq.composite.service.CompositeDocumentService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.logging.Log;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;

import java.io.InputStream;
import java.util.List;

/**
 * Loads documents from a classpath JSON array into the catalog. Runs at startup when
 * {@code quantum.composite.store.seed} is set.
 */
@ApplicationScoped
public class DocumentSeedLoader {

    @Inject
    CompositeConfig config;

    @Inject
    CompositeDocumentService documents;

    @Inject
    ObjectMapper mapper;

    void onStart(@Observes StartupEvent event) {
        config.store().seed().ifPresent(this::load);
    }

    /**
     * Reads {@code resource} and saves every document in it. Component maps are cycle-checked as one
     * batch first; a cyclic seed saves nothing.
     *
     * @return the number of documents saved
     * @throws CompositeResolutionException when the resource is missing, not a JSON array of documents,
     *                                      or its component maps form a cycle
     */
    public int load(String resource) {
        String path = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) {
                throw new CompositeResolutionException("Seed resource not found on classpath: " + resource);
            }
            List<Document> seed = mapper.readValue(in, new TypeReference<List<Document>>() {});
            documents.importDocuments(seed);
            Log.infof("Seeded %d composite documents from %s", seed.size(), resource);
            return seed.size();
        } catch (CompositeResolutionException e) {
            throw e;
        } catch (CyclicReferenceException e) {
            throw new CompositeResolutionException("Seed " + resource + " rejected: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new CompositeResolutionException("Failed to load seed documents from " + resource, e);
        }
    }
}
