package org.example.shaker.exception;

/**
 * Exception thrown when cloning, checking out or linking a formula fails.
 */
public class MaterializationException extends ShakerException {

    public MaterializationException(String message) {
        super(message);
    }

    public MaterializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
