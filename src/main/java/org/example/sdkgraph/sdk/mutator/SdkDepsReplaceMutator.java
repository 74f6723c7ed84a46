package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.mutator.BottomUpMutator;
import org.example.sdkgraph.mutator.BottomUpMutatorContext;
import org.example.sdkgraph.sdk.SdkAware;
import org.example.sdkgraph.sdk.SdkMemberDependencyTag;
import org.example.sdkgraph.sdk.SdkRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step 5: where version V of an SDK is required, the member of that version is used
 * instead of the unversioned (in-development) member.
 */
public class SdkDepsReplaceMutator implements BottomUpMutator {

    private static final Logger log = LoggerFactory.getLogger(SdkDepsReplaceMutator.class);

    @Override
    public void mutate(BottomUpMutatorContext ctx) {
        ctx.getModule().sdkAware()
                .filter(SdkAware::isInAnySdk)
                .ifPresent(m -> {
                    SdkRef sdk = m.getContainingSdk();
                    if (!sdk.isUnversioned() && m.getRequiredSdks().contains(sdk)) {
                        // Only edges to the member in this module's variant are replaced; other
                        // packages have their own variants and are not affected. Membership
                        // edges of SDKs keep pointing at the member they list.
                        log.debug("Using {} for {} in variant '{}'",
                                ctx.getModule().getId(), m.getMemberName(), ctx.getModule().getVariant());
                        ctx.replaceDependenciesIf(m.getMemberName(),
                                edge -> !(edge.getTag() instanceof SdkMemberDependencyTag));
                    }
                });
    }
}
