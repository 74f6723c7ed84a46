package org.example.sdkgraph;

import org.example.sdkgraph.module.DefaultsMutator;
import org.example.sdkgraph.module.PackagingVariantMutator;
import org.example.sdkgraph.mutator.MutatorPhase;
import org.example.sdkgraph.mutator.MutatorPipeline;
import org.example.sdkgraph.sdk.MemberListRegistry;
import org.example.sdkgraph.sdk.mutator.SdkMutators;

/**
 * Assembles the standard SDK pipeline.
 */
public final class BuildPipelines {

    private BuildPipelines() {
    }

    public static MutatorPipeline standard(int parallelism) {
        return standard(parallelism, MemberListRegistry.defaultRegistry());
    }

    /**
     * Defaults, SDK membership, per-package variants, then SDK requirements.
     */
    public static MutatorPipeline standard(int parallelism, MemberListRegistry registry) {
        return MutatorPipeline.builder()
                .parallelism(parallelism)
                .register(MutatorPhase.DEFAULTS, ctx -> ctx.topDown(DefaultsMutator.NAME, new DefaultsMutator()).parallel())
                .register(MutatorPhase.PRE_DEPS, ctx -> SdkMutators.registerPreDepsMutators(ctx, registry))
                .register(MutatorPhase.PACKAGING, ctx -> ctx.graph(PackagingVariantMutator.NAME, new PackagingVariantMutator()))
                .register(MutatorPhase.POST_DEPS, SdkMutators::registerPostDepsMutators)
                .build();
    }
}
