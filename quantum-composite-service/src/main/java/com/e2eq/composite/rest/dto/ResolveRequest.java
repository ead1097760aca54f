package com.e2eq.composite.rest.dto;

import java.util.Map;

/**
 * Caller overrides for a resolution. Keys are either a bare token key or
 * {@code <documentId>.<tokenKey>}.
 */
public record ResolveRequest(Map<String, String> overrides) {
}
