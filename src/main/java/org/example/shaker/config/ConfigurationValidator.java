package org.example.shaker.config;

import org.example.shaker.exception.ConfigException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates plugin configuration parameters.
 * Throws ConfigException if validation fails.
 */
public class ConfigurationValidator {

    /**
     * Host names as used in {@code git@<host>:org/name.git}.
     */
    private static final Pattern HOST_PATTERN = Pattern.compile("^[a-zA-Z0-9.-]+(:[0-9]+)?$");

    /**
     * Validates the plugin configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(ShakerConfiguration config) {
        List<String> errors = new ArrayList<>();

        if (config.getRootDirectory() == null) {
            errors.add("rootDirectory is required");
        }

        validateName(config.getMetadataFilename(), "metadataFilename", errors);
        validateName(config.getRequirementsFilename(), "requirementsFilename", errors);
        validateName(config.getVendorDirectory(), "vendorDirectory", errors);
        validateName(config.getCloneDirectory(), "cloneDirectory", errors);
        validateName(config.getSaltRoot(), "saltRoot", errors);

        if (!isBlank(config.getCloneDirectory()) && config.getCloneDirectory().equals(config.getSaltRoot())) {
            errors.add("cloneDirectory and saltRoot must differ, but both were: " + config.getSaltRoot());
        }

        validateUrl(config.getGithubApiUrl(), "githubApiUrl", errors);
        validateUrl(config.getGithubRawUrl(), "githubRawUrl", errors);

        if (isBlank(config.getGitHost())) {
            errors.add("gitHost is required");
        } else if (!HOST_PATTERN.matcher(config.getGitHost()).matches()) {
            errors.add("gitHost must be a plain host name, but was: " + config.getGitHost());
        }

        if (config.getMaxTagCount() < 1) {
            errors.add("maxTagCount must be >= 1, but was: " + config.getMaxTagCount());
        }

        if (config.getRetryAttempts() < 1) {
            errors.add("retryAttempts must be >= 1, but was: " + config.getRetryAttempts());
        }

        if (config.getRetryBackoffMs() < 0) {
            errors.add("retryBackoffMs must be >= 0, but was: " + config.getRetryBackoffMs());
        }

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigException if validation fails
     */
    public void validateOrThrow(ShakerConfiguration config) throws ConfigException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Invalid plugin configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateName(String value, String field, List<String> errors) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        } else if (value.contains("/") || value.contains("\\")) {
            errors.add(field + " must be a single path element, but was: " + value);
        } else if (value.equals(".") || value.equals("..")) {
            errors.add(field + " must not be '.' or '..'");
        }
    }

    private void validateUrl(String value, String field, List<String> errors) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        } else if (!value.startsWith("http://") && !value.startsWith("https://")) {
            errors.add(field + " must start with http:// or https://, but was: " + value);
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
