package org.example.sdkgraph.mutator;

/**
 * A pass that restructures the whole graph at once, e.g. to split modules into variants.
 * Runs on a single thread.
 */
@FunctionalInterface
public interface GraphMutator {

    void mutate(GraphMutatorContext ctx);
}
