package com.e2eq.composite.rest.dto;

import java.util.Map;

/**
 * A proposed component map for a document. {@code projectId} defaults to the stored document's project.
 */
public record ValidateRequest(String projectId, Map<String, String> components) {
}
