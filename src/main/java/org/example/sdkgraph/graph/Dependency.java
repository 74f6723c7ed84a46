package org.example.sdkgraph.graph;

import java.util.Objects;

/**
 * Represents a dependency relationship between two modules.
 * This is an edge in the module graph.
 */
public class Dependency {

    private final ModuleNode source;
    private final ModuleNode target;
    private final DependencyTag tag;

    /**
     * Creates a new Dependency.
     *
     * @param source the source module (dependent)
     * @param target the target module (dependency)
     * @param tag    why the edge exists
     */
    public Dependency(ModuleNode source, ModuleNode target, DependencyTag tag) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.tag = Objects.requireNonNull(tag, "tag cannot be null");
    }

    public ModuleNode getSource() {
        return source;
    }

    public ModuleNode getTarget() {
        return target;
    }

    public DependencyTag getTag() {
        return tag;
    }

    /**
     * Returns a copy of this edge pointing at another target.
     */
    public Dependency withTarget(ModuleNode newTarget) {
        return new Dependency(source, newTarget, tag);
    }

    /**
     * Returns a string representation of this dependency edge.
     */
    public String getEdgeDescription() {
        return source.getId() + " -> " + target.getId() + " (" + tag + ")";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Dependency that = (Dependency) o;
        return Objects.equals(source, that.source) &&
               Objects.equals(target, that.target) &&
               Objects.equals(tag, that.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target, tag);
    }

    @Override
    public String toString() {
        return getEdgeDescription();
    }
}
