package org.example.sdkgraph.mutator;

/**
 * A pass that visits every module after all of its dependencies.
 */
@FunctionalInterface
public interface BottomUpMutator {

    void mutate(BottomUpMutatorContext ctx);
}
