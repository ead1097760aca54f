package com.e2eq.composite.rest.dto;

import java.util.Map;

public record PresetRequest(String name, String documentId, Map<String, String> overrides) {
}
