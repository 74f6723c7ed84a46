package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.graph.ModuleNode;

/**
 * Capability of a module bundled into a deployable unit.
 */
public interface CoPackaging {

    /**
     * Returns true if the dependency reached through {@code tag} ends up in the same
     * deployable unit as this module.
     */
    boolean isCoPackagedWith(ModuleNode dependency, DependencyTag tag);
}
