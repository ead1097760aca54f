package com.e2eq.composite.rest.dto;

import com.e2eq.composite.service.Preset;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresetResponse(
        String id,
        String projectId,
        String name,
        String documentId,
        String documentTitle,
        Map<String, String> overrides,
        Instant createdAt) {

    public static PresetResponse of(Preset preset, String documentTitle) {
        return new PresetResponse(preset.getId(), preset.getProjectId(), preset.getName(), preset.getDocumentId(),
                documentTitle, preset.getOverrides(), preset.getCreatedAt());
    }
}
