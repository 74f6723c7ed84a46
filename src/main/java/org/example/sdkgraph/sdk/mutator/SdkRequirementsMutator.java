package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.graph.DefaultsDependencyTag;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.mutator.TopDownMutator;
import org.example.sdkgraph.mutator.TopDownMutatorContext;
import org.example.sdkgraph.sdk.CoPackaging;
import org.example.sdkgraph.sdk.SdkAware;
import org.example.sdkgraph.sdk.SdkRef;
import org.example.sdkgraph.sdk.SdkRefs;

import java.util.Optional;

/**
 * Step 6: ensures that every dependency from outside a package comes from one of the
 * SDKs the package requires.
 */
public class SdkRequirementsMutator implements TopDownMutator {

    @Override
    public void mutate(TopDownMutatorContext ctx) {
        Optional<SdkAware> self = ctx.getModule().sdkAware();
        Optional<CoPackaging> packaging = ctx.getModule().coPackaging();
        if (self.isEmpty() || packaging.isEmpty()) {
            return;
        }
        SdkRefs requiredSdks = self.get().getRequiredSdks();
        if (requiredSdks.isEmpty()) {
            return;
        }

        for (Dependency dep : ctx.getDirectDependencies()) {
            if (dep.getTag() == DefaultsDependencyTag.INSTANCE) {
                // a dependency on defaults is always fine
                continue;
            }
            Optional<SdkAware> other = dep.getTarget().sdkAware();
            if (other.isEmpty()) {
                continue;
            }
            SdkAware sa = other.get();
            if (!packaging.get().isCoPackagedWith(dep.getTarget(), dep.getTag())
                    && !requiredSdks.contains(sa.getContainingSdk())) {
                ctx.moduleError("depends on \"%s\" %s that isn't part of the required SDKs: %s",
                        sa.getName(), describeSdk(sa.getContainingSdk()), requiredSdks);
            }
        }
    }

    private static String describeSdk(SdkRef sdk) {
        return sdk.isNone() ? "(not in any SDK)" : "(in SDK \"" + sdk + "\")";
    }
}
