package org.example.sdkgraph.mutator;

/**
 * A pass that visits every module after all of its dependents.
 */
@FunctionalInterface
public interface TopDownMutator {

    void mutate(TopDownMutatorContext ctx);
}
