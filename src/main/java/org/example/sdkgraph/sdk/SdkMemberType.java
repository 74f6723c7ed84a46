package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.mutator.BottomUpMutatorContext;

import java.util.List;

/**
 * A kind of module that can be listed as an SDK member.
 */
public interface SdkMemberType {

    String getName();

    /**
     * Adds dependencies from the module in {@code ctx} to each named member, under {@code tag}.
     */
    void addDependencies(BottomUpMutatorContext ctx, DependencyTag tag, List<String> names);
}
