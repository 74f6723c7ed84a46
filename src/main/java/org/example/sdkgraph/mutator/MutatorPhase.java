package org.example.sdkgraph.mutator;

/**
 * Ordered phases of a pipeline. Passes run phase by phase, then in registration order.
 */
public enum MutatorPhase {

    /**
     * Inheritance of properties from defaults modules.
     */
    DEFAULTS,

    /**
     * Passes that add dependencies before packages are split into variants.
     */
    PRE_DEPS,

    /**
     * Packaging passes that create per-package variants and set SDK requirements.
     */
    PACKAGING,

    /**
     * Passes that must observe the packaging variants.
     */
    POST_DEPS
}
