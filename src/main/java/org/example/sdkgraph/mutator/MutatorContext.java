package org.example.sdkgraph.mutator;

import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.ModuleNode;

import java.util.List;
import java.util.function.Consumer;

/**
 * The view a per-module pass has of the graph while visiting one module.
 *
 * <p>Errors are recorded against the visited module and do not stop the traversal.</p>
 */
public interface MutatorContext {

    ModuleNode getModule();

    default String getModuleName() {
        return getModule().getName();
    }

    String getPassName();

    /**
     * Returns the outgoing edges of the visited module.
     */
    List<Dependency> getDirectDependencies();

    /**
     * Visits each direct dependency once per edge.
     */
    default void visitDirectDeps(Consumer<ModuleNode> visitor) {
        getDirectDependencies().forEach(d -> visitor.accept(d.getTarget()));
    }

    /**
     * Runs {@code action} once every module of the pass was visited, on the calling
     * thread and in visiting order. Errors it reports are recorded against the
     * visited module.
     */
    void afterPass(Runnable action);

    void moduleError(String format, Object... args);

    void propertyError(String property, String format, Object... args);

    boolean hasErrors();
}
