package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DependencyTag;

/**
 * Why a package depends on a module.
 */
public enum PackageContentTag implements DependencyTag {

    NATIVE_SHARED_LIB,
    JAVA_LIB,

    /**
     * Used by the package but provided by another one at runtime.
     */
    EXTERNAL_LIB;

    @Override
    public String toString() {
        return "package " + name().toLowerCase().replace('_', ' ');
    }
}
