package org.example.shaker.exception;

/**
 * Exception thrown when a constraint string does not match any recognised shape.
 */
public class ConstraintFormatException extends ShakerException {

    public ConstraintFormatException(String message) {
        super(message);
    }

    public ConstraintFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
