package com.e2eq.composite.rest.dto;

import com.e2eq.composite.core.CycleViolation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(boolean valid, String error, String offendingDocumentId, String groupId) {

    public static ValidationResponse of(Optional<CycleViolation> violation) {
        return violation
                .map(v -> new ValidationResponse(false, v.message(), v.offendingDocumentId(), v.groupId().orElse(null)))
                .orElseGet(() -> new ValidationResponse(true, null, null, null));
    }
}
