package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.exception.InvalidSdkRefException;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.mutator.TopDownMutator;
import org.example.sdkgraph.mutator.TopDownMutatorContext;
import org.example.sdkgraph.sdk.MemberListRegistry;
import org.example.sdkgraph.sdk.SdkAware;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Step 2: records that the members of an SDK module belong to it.
 *
 * <p>The SDK's own name is checked first. An SDK with an invalid name does not claim
 * any members. Claims are applied after the pass in visiting order, so when several
 * SDKs list the same module the one visited first keeps it.</p>
 */
public class MemberDepsMutator implements TopDownMutator {

    private static final Logger log = LoggerFactory.getLogger(MemberDepsMutator.class);

    private final MemberListRegistry registry;

    public MemberDepsMutator(MemberListRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }

    @Override
    public void mutate(TopDownMutatorContext ctx) {
        if (!(ctx.getModule() instanceof SdkModule)) {
            return;
        }
        SdkModule sdk = (SdkModule) ctx.getModule();
        Optional<SdkRef> parsed = parseOwnName(ctx, sdk);
        if (parsed.isEmpty()) {
            return;
        }
        SdkRef mySdkRef = parsed.get();

        List<SdkAware> members = new ArrayList<>();
        for (Dependency dep : ctx.getDirectDependencies()) {
            if (registry.isMembershipTag(dep.getTag())) {
                dep.getTarget().sdkAware().ifPresent(members::add);
            }
        }
        // SDKs on the same level may claim the same member; claims are settled in visiting order
        ctx.afterPass(() -> claim(ctx, mySdkRef, members));
    }

    private void claim(TopDownMutatorContext ctx, SdkRef mySdkRef, List<SdkAware> members) {
        for (SdkAware m : members) {
            if (m.makeMemberOf(mySdkRef)) {
                log.debug("{} is a member of {}", m.getName(), mySdkRef);
            } else {
                ctx.moduleError("module \"%s\" is already a member of sdk \"%s\", cannot also be a member of \"%s\"",
                        m.getName(), m.getContainingSdk(), mySdkRef);
            }
        }
    }

    private Optional<SdkRef> parseOwnName(TopDownMutatorContext ctx, SdkModule sdk) {
        SdkRef ref;
        try {
            ref = SdkRef.parse(sdk.getName());
        } catch (InvalidSdkRefException e) {
            ctx.propertyError("name", "%s", e.getMessage());
            return Optional.empty();
        }
        if (sdk.isSnapshot() && ref.isUnversioned()) {
            ctx.propertyError("name", "sdk_snapshot should be named as <name>@<version>. "
                    + "Was the build description modified by hand?");
        }
        if (!sdk.isSnapshot() && !ref.isUnversioned()) {
            ctx.propertyError("name", "sdk shouldn't be named as <name>@<version>.");
        }
        return ctx.hasErrors() ? Optional.empty() : Optional.of(ref);
    }
}
