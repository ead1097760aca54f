package com.e2eq.composite.rest.dto;

import com.e2eq.composite.service.GroupResolution;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupResolutionResponse(
        DocumentResponse document,
        String resolvedContent,
        String groupId,
        boolean selectedFromGroup,
        List<String> availableTypes) {

    public static GroupResolutionResponse from(GroupResolution resolution) {
        return new GroupResolutionResponse(DocumentResponse.from(resolution.document()),
                resolution.resolvedContent(), resolution.groupId(), resolution.selectedFromGroup(),
                resolution.availableTypes());
    }
}
