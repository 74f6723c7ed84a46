package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.mutator.BottomUpMutator;
import org.example.sdkgraph.mutator.BottomUpMutatorContext;
import org.example.sdkgraph.sdk.SdkAware;
import org.example.sdkgraph.sdk.SdkMemberVersionedDependencyTag;
import org.example.sdkgraph.sdk.SdkRef;

/**
 * Step 3: creates dependencies from the unversioned SDK member to the snapshot versions of
 * the same member.
 *
 * <p>With these edges the versioned copies are split into the variants of every package
 * that reaches the unversioned member. If packages A and B both reference {@code libfoo}
 * of sdk {@code mysdk}, A can be built with {@code libfoo} of {@code mysdk@11} and B with
 * the one of {@code mysdk@12}.</p>
 */
public class MemberInterVersionMutator implements BottomUpMutator {

    @Override
    public void mutate(BottomUpMutatorContext ctx) {
        ctx.getModule().sdkAware()
                .filter(SdkAware::isInAnySdk)
                .ifPresent(m -> {
                    SdkRef sdk = m.getContainingSdk();
                    if (!sdk.isUnversioned()) {
                        String memberName = m.getMemberName();
                        ctx.addReverseDependency(
                                new SdkMemberVersionedDependencyTag(memberName, sdk.getVersion()), memberName);
                    }
                });
    }
}
