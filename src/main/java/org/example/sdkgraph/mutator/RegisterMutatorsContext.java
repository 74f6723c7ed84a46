package org.example.sdkgraph.mutator;

/**
 * Collects the passes of one phase, in order.
 */
public interface RegisterMutatorsContext {

    MutatorHandle bottomUp(String name, BottomUpMutator mutator);

    MutatorHandle topDown(String name, TopDownMutator mutator);

    void graph(String name, GraphMutator mutator);
}
