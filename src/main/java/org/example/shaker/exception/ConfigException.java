package org.example.shaker.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a manifest, lockfile or plugin configuration is malformed.
 */
public class ConfigException extends ShakerException {

    private final List<String> validationErrors;

    public ConfigException(String message) {
        super(message);
        this.validationErrors = Collections.emptyList();
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.validationErrors = Collections.emptyList();
    }

    public ConfigException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
