package org.example.sdkgraph.graph;

/**
 * Marker for the reason a dependency edge exists.
 * Every edge in a {@link ModuleGraph} carries exactly one tag.
 */
public interface DependencyTag {
}
