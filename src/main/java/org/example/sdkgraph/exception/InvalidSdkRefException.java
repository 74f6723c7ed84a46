package org.example.sdkgraph.exception;

/**
 * Exception thrown when a string cannot be parsed as an SDK reference.
 */
public class InvalidSdkRefException extends SdkGraphException {

    private final String input;

    public InvalidSdkRefException(String input, String message) {
        super(message);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
