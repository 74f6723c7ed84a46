package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DefaultsDependencyTag;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.mutator.TopDownMutator;
import org.example.sdkgraph.mutator.TopDownMutatorContext;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the member lists of defaults modules to the SDKs that list them,
 * in the order the SDK lists them.
 */
public class DefaultsMutator implements TopDownMutator {

    public static final String NAME = "defaults";

    @Override
    public void mutate(TopDownMutatorContext ctx) {
        if (!(ctx.getModule() instanceof SdkModule)) {
            return;
        }
        SdkModule sdk = (SdkModule) ctx.getModule();
        List<SdkProperties> defaults = new ArrayList<>();
        for (Dependency dep : ctx.getDirectDependencies()) {
            if (dep.getTag() != DefaultsDependencyTag.INSTANCE) {
                continue;
            }
            if (dep.getTarget() instanceof DefaultsModule) {
                defaults.add(((DefaultsModule) dep.getTarget()).getProperties());
            } else {
                ctx.propertyError("defaults", "module \"%s\" is not a defaults module", dep.getTarget().getName());
            }
        }
        if (!defaults.isEmpty()) {
            sdk.applyDefaults(defaults);
        }
    }
}
