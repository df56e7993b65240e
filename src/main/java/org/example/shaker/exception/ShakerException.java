package org.example.shaker.exception;

/**
 * Base exception for all salt-shaker errors.
 */
public class ShakerException extends Exception {

    public ShakerException(String message) {
        super(message);
    }

    public ShakerException(String message, Throwable cause) {
        super(message, cause);
    }
}
