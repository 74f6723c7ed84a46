package org.example.sdkgraph.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when configuration validation fails.
 */
public class ConfigurationException extends SdkGraphException {

    private final List<String> validationErrors;

    public ConfigurationException(String message) {
        this(message, Collections.emptyList());
    }

    public ConfigurationException(String message, List<String> validationErrors) {
        super(message);
        this.validationErrors = List.copyOf(validationErrors);
    }

    public List<String> getValidationErrors() {
        return validationErrors;
    }
}
