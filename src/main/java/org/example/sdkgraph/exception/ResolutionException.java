package org.example.sdkgraph.exception;

/**
 * Exception thrown when the module graph cannot be built or walked,
 * e.g. a declared dependency names an undefined module or the graph has a cycle.
 */
public class ResolutionException extends SdkGraphException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
