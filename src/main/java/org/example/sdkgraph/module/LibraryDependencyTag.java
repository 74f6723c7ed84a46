package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DependencyTag;

/**
 * How a library links against another library.
 */
public enum LibraryDependencyTag implements DependencyTag {

    /**
     * Linked into the dependent; always ends up in the same package.
     */
    STATIC,

    /**
     * Linked at runtime through stubs; crosses the package boundary.
     */
    SHARED;

    @Override
    public String toString() {
        return name().toLowerCase() + " lib";
    }
}
