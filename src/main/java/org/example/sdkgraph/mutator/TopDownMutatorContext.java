package org.example.sdkgraph.mutator;

/**
 * Context of a top-down pass. Top-down passes may update direct dependencies but never
 * change the shape of the graph.
 */
public interface TopDownMutatorContext extends MutatorContext {
}
