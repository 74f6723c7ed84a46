package org.example.sdkgraph.graph;

/**
 * Tag for edges from a module to the defaults module it inherits properties from.
 */
public final class DefaultsDependencyTag implements DependencyTag {

    public static final DefaultsDependencyTag INSTANCE = new DefaultsDependencyTag();

    private DefaultsDependencyTag() {
    }

    @Override
    public String toString() {
        return "defaults";
    }
}
