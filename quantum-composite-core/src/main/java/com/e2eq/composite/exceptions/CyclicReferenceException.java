package com.e2eq.composite.exceptions;

import com.e2eq.composite.core.CycleViolation;

/**
 * Thrown when a component map would make the document reference graph cyclic.
 * <p>
 * Raised before anything is written; the rejected write is never partially applied.
 * </p>
 */
public class CyclicReferenceException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient CycleViolation violation;

    public CyclicReferenceException(CycleViolation violation) {
        super(violation.message());
        this.violation = violation;
    }

    public CycleViolation getViolation() {
        return violation;
    }

    /**
     * The document whose component map was rejected.
     */
    public String getEditedDocumentId() {
        return violation.editedDocumentId();
    }

    /**
     * The referenced document that leads back to the edited document.
     */
    public String getOffendingDocumentId() {
        return violation.offendingDocumentId();
    }

    /**
     * The group the offending document was reached through, or null for a direct reference.
     */
    public String getGroupId() {
        return violation.groupId().orElse(null);
    }
}
