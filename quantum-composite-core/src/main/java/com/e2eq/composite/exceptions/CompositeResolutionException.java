package com.e2eq.composite.exceptions;

/**
 * Raised when composite documents cannot be loaded or stored, as opposed to being merely
 * unresolvable (which the expander tolerates).
 */
public class CompositeResolutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public CompositeResolutionException(String message) {
        super(message);
    }

    public CompositeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
