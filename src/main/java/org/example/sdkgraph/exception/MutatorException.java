package org.example.sdkgraph.exception;

import org.example.sdkgraph.graph.ModuleError;

import java.util.List;

/**
 * Exception thrown when a pipeline run finished with module errors.
 */
public class MutatorException extends SdkGraphException {

    private final List<ModuleError> errors;

    public MutatorException(String message, List<ModuleError> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    public List<ModuleError> getErrors() {
        return errors;
    }
}
