package org.example.sdkgraph.mutator;

import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.DependencyTag;

import java.util.List;
import java.util.function.Predicate;

/**
 * Context of a bottom-up pass. Edge changes requested here are applied once the whole
 * pass has finished, so no module of the same pass observes them.
 */
public interface BottomUpMutatorContext extends MutatorContext {

    /**
     * Adds edges from the visited module to the named modules.
     * An unknown name is reported as an error on the visited module.
     */
    void addDependencies(DependencyTag tag, List<String> names);

    default void addDependency(DependencyTag tag, String name) {
        addDependencies(tag, List.of(name));
    }

    /**
     * Adds an edge from the named module to the visited module.
     */
    void addReverseDependency(DependencyTag tag, String name);

    /**
     * Points every edge that targets a module named {@code name} in the visited
     * module's variant at the visited module.
     */
    default void replaceDependencies(String name) {
        replaceDependenciesIf(name, edge -> true);
    }

    /**
     * Like {@link #replaceDependencies(String)}, but only for the edges accepted by
     * {@code filter}.
     */
    void replaceDependenciesIf(String name, Predicate<Dependency> filter);
}
