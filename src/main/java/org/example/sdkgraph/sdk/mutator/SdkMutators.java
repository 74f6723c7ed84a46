package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.mutator.RegisterMutatorsContext;
import org.example.sdkgraph.sdk.MemberListRegistry;

/**
 * Registers the SDK passes.
 *
 * <p>The post-deps passes must run after the packaging passes: packages and their
 * dependencies (including the dependencies on SDK members) are split into per-package
 * variants before the requirements are set, since different packages can use different
 * versions of the same SDK.</p>
 */
public final class SdkMutators {

    public static final String MEMBER = "SdkMember";
    public static final String MEMBER_DEPS = "SdkMember_deps";
    public static final String MEMBER_INTER_VERSION = "SdkMemberInterVersion";
    public static final String DEPS = "SdkDepsMutator";
    public static final String DEPS_REPLACE = "SdkDepsReplaceMutator";
    public static final String REQUIREMENT_CHECK = "SdkRequirementCheck";

    private SdkMutators() {
    }

    /**
     * Registers the passes that assign SDK membership and link member versions.
     */
    public static void registerPreDepsMutators(RegisterMutatorsContext ctx, MemberListRegistry registry) {
        ctx.bottomUp(MEMBER, new MemberMutator(registry)).parallel();
        ctx.topDown(MEMBER_DEPS, new MemberDepsMutator(registry)).parallel();
        ctx.bottomUp(MEMBER_INTER_VERSION, new MemberInterVersionMutator()).parallel();
    }

    /**
     * Registers the passes that propagate, apply and check SDK requirements.
     */
    public static void registerPostDepsMutators(RegisterMutatorsContext ctx) {
        ctx.topDown(DEPS, new SdkDepsMutator()).parallel();
        ctx.bottomUp(DEPS_REPLACE, new SdkDepsReplaceMutator()).parallel();
        ctx.topDown(REQUIREMENT_CHECK, new SdkRequirementsMutator()).parallel();
    }
}
