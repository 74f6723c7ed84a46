package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.mutator.BottomUpMutator;
import org.example.sdkgraph.mutator.BottomUpMutatorContext;
import org.example.sdkgraph.sdk.MemberListProperty;
import org.example.sdkgraph.sdk.MemberListRegistry;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkProperties;

import java.util.List;
import java.util.Objects;

/**
 * Step 1: creates dependencies from an SDK module to its members.
 */
public class MemberMutator implements BottomUpMutator {

    private final MemberListRegistry registry;

    public MemberMutator(MemberListRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    @Override
    public void mutate(BottomUpMutatorContext ctx) {
        if (!(ctx.getModule() instanceof SdkModule)) {
            return;
        }
        SdkProperties properties = ((SdkModule) ctx.getModule()).getProperties();
        for (MemberListProperty property : registry.getProperties()) {
            List<String> names = property.getMemberNames(properties);
            if (!names.isEmpty()) {
                property.getMemberType().addDependencies(ctx, property.getDependencyTag(), names);
            }
        }
    }
}
