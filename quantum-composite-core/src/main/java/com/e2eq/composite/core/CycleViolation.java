package com.e2eq.composite.core;

import java.util.Optional;

/**
 * Describes why a proposed component map was rejected.
 *
 * @param editedDocumentId    document whose component map was being written
 * @param reference           the proposed reference value that closes the cycle, as written
 * @param offendingDocumentId document reached through {@code reference} that leads back
 * @param groupId             group the offending document was reached through, if any
 * @param existingCycleAt     set when the search re-entered a document of a cycle already stored,
 *                            one that does not pass through the edited document
 */
public record CycleViolation(String editedDocumentId,
                             String reference,
                             String offendingDocumentId,
                             Optional<String> groupId,
                             Optional<String> existingCycleAt) {

    public CycleViolation {
        groupId = groupId == null ? Optional.empty() : groupId;
        existingCycleAt = existingCycleAt == null ? Optional.empty() : existingCycleAt;
    }

    public CycleViolation(String editedDocumentId, String reference, String offendingDocumentId, Optional<String> groupId) {
        this(editedDocumentId, reference, offendingDocumentId, groupId, Optional.empty());
    }

    public String message() {
        if (groupId.isPresent()) {
            return "Cyclic dependency detected: Group " + groupId.get() + " contains document "
                    + offendingDocumentId + " that would create a circular reference";
        }
        return "Cyclic dependency detected: Document " + offendingDocumentId + " would create a circular reference";
    }
}
