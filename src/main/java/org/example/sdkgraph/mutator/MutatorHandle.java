package org.example.sdkgraph.mutator;

/**
 * Returned when registering a per-module pass, to tune how it runs.
 */
public interface MutatorHandle {

    /**
     * Lets modules of the same level be visited concurrently.
     */
    MutatorHandle parallel();
}
