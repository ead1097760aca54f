package com.e2eq.composite.runtime;

import com.e2eq.composite.config.CompositeConfig;
import com.e2eq.composite.core.CycleValidator;
import com.e2eq.composite.core.ExpansionLimits;
import com.e2eq.composite.core.RecursiveExpander;
import com.e2eq.composite.store.DocumentCatalog;
import com.e2eq.composite.store.InMemoryDocumentStore;
import io.quarkus.arc.DefaultBean;
import io.quarkus.logging.Log;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Wires the resolution engine into CDI. The engine classes are plain Java; this producer hands them
 * the active {@link DocumentCatalog} and the configured limits. Applications with a real document
 * store provide their own {@link DocumentCatalog} bean, which replaces the in-memory default.
 */
@ApplicationScoped
public class CompositeEngineProducers {

    @Inject
    CompositeConfig config;

    @Produces
    @DefaultBean
    @Singleton
    public DocumentCatalog documentCatalog() {
        Log.info("CompositeEngineProducers: no DocumentCatalog provided, using the in-memory store");
        return new InMemoryDocumentStore();
    }

    @Produces
    @Singleton
    public RecursiveExpander recursiveExpander(DocumentCatalog catalog) {
        ExpansionLimits limits = new ExpansionLimits(config.maxDepth(), config.maxExpansions());
        Log.infof("Composite expansion limits: maxDepth=%d, maxExpansions=%d", limits.maxDepth(), limits.maxExpansions());
        return new RecursiveExpander(catalog, limits);
    }

    @Produces
    @Singleton
    public CycleValidator cycleValidator(DocumentCatalog catalog) {
        return new CycleValidator(catalog);
    }
}
