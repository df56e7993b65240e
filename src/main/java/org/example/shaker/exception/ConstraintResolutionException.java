package org.example.shaker.exception;

/**
 * Exception thrown when a well-formed constraint cannot be satisfied
 * by the tags or branches a repository offers.
 */
public class ConstraintResolutionException extends ShakerException {

    public ConstraintResolutionException(String message) {
        super(message);
    }

    public ConstraintResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
