package org.example.sdkgraph.mutator;

import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleNode;

/**
 * Gives a {@link GraphMutator} direct access to the graph.
 */
public interface GraphMutatorContext {

    ModuleGraph getGraph();

    String getPassName();

    void moduleError(ModuleNode module, String format, Object... args);
}
