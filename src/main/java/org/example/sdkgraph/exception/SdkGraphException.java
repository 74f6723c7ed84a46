package org.example.sdkgraph.exception;

/**
 * Base exception for all SDK graph plugin errors.
 */
public class SdkGraphException extends Exception {

    public SdkGraphException(String message) {
        super(message);
    }

    public SdkGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
