package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.mutator.TopDownMutator;
import org.example.sdkgraph.mutator.TopDownMutatorContext;
import org.example.sdkgraph.sdk.SdkAware;
import org.example.sdkgraph.sdk.SdkRefs;

/**
 * Step 4: ripples the SDK requirements of root modules like packages down to their
 * descendants.
 */
public class SdkDepsMutator implements TopDownMutator {

    @Override
    public void mutate(TopDownMutatorContext ctx) {
        ctx.getModule().sdkAware().ifPresent(m -> {
            // packages report the SDKs they were declared to use
            SdkRefs requiredSdks = m.getRequiredSdks();
            if (requiredSdks.isEmpty()) {
                return;
            }
            ctx.visitDirectDeps(dep -> dep.sdkAware().ifPresent(d -> d.buildWithSdks(requiredSdks)));
        });
    }
}
