package com.e2eq.composite.core;

import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;

/**
 * Picks the reference a token points to, consulting in order:
 * <ol>
 *   <li>the namespaced override {@code <currentDocumentId>.<tokenKey>}</li>
 *   <li>the global override {@code <tokenKey>}</li>
 *   <li>the document's own component map</li>
 * </ol>
 * A blank value in one layer falls through to the next.
 */
public final class ReferenceResolver {
    private ReferenceResolver() {}

    private static final Logger LOG = Logger.getLogger(ReferenceResolver.class);

    public static String namespacedKey(String documentId, String tokenKey) {
        return documentId + "." + tokenKey;
    }

    /**
     * Raw reference string for the token, before parsing.
     */
    public static Optional<String> lookup(String tokenKey,
                                          String currentDocumentId,
                                          Map<String, String> localComponents,
                                          Map<String, String> overrides) {
        if (tokenKey == null) return Optional.empty();
        Map<String, String> ov = overrides == null ? Map.of() : overrides;
        if (currentDocumentId != null) {
            String namespaced = ov.get(namespacedKey(currentDocumentId, tokenKey));
            if (namespaced != null && !namespaced.isBlank()) return Optional.of(namespaced);
        }
        String global = ov.get(tokenKey);
        if (global != null && !global.isBlank()) return Optional.of(global);
        String local = localComponents == null ? null : localComponents.get(tokenKey);
        if (local != null && !local.isBlank()) return Optional.of(local);
        return Optional.empty();
    }

    public static Optional<Reference> resolve(String tokenKey,
                                              String currentDocumentId,
                                              Map<String, String> localComponents,
                                              Map<String, String> overrides) {
        Optional<String> raw = lookup(tokenKey, currentDocumentId, localComponents, overrides);
        if (raw.isEmpty()) {
            LOG.warnf("No reference for token '%s' in document %s", tokenKey, currentDocumentId);
            return Optional.empty();
        }
        Optional<Reference> parsed = Reference.parse(raw.get());
        if (parsed.isEmpty()) {
            LOG.warnf("Invalid reference '%s' for token '%s' in document %s", raw.get(), tokenKey, currentDocumentId);
        }
        return parsed;
    }
}
