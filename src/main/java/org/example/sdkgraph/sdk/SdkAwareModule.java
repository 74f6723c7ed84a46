package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.ModuleNode;

import java.util.Optional;

/**
 * Base class for modules that can be members of an SDK.
 *
 * <p>Passes running in parallel may write to the same module through several
 * dependents, so all SDK state is guarded by the instance lock.</p>
 */
public abstract class SdkAwareModule extends ModuleNode implements SdkAware {

    private final String sdkMemberName;
    private SdkRef containingSdk = SdkRef.NONE;
    private SdkRefs requiredSdks = SdkRefs.empty();

    /**
     * @param sdkMemberName the member name of a versioned copy, or null to use the module name
     */
    protected SdkAwareModule(String name, String variant, String sdkMemberName) {
        super(name, variant);
        this.sdkMemberName = sdkMemberName == null || sdkMemberName.isBlank() ? null : sdkMemberName;
    }

    @Override
    public Optional<SdkAware> sdkAware() {
        return Optional.of(this);
    }

    @Override
    public String getMemberName() {
        return sdkMemberName != null ? sdkMemberName : getName();
    }

    protected String getDeclaredSdkMemberName() {
        return sdkMemberName;
    }

    @Override
    public synchronized boolean isInAnySdk() {
        return !containingSdk.isNone();
    }

    @Override
    public synchronized SdkRef getContainingSdk() {
        return containingSdk;
    }

    @Override
    public synchronized boolean makeMemberOf(SdkRef sdk) {
        if (sdk.isNone()) {
            throw new IllegalArgumentException("cannot make " + getId() + " a member of no SDK");
        }
        if (containingSdk.isNone()) {
            containingSdk = sdk;
            return true;
        }
        return containingSdk.equals(sdk);
    }

    @Override
    public synchronized SdkRefs getRequiredSdks() {
        return requiredSdks;
    }

    @Override
    public synchronized void buildWithSdks(SdkRefs sdks) {
        requiredSdks = requiredSdks.union(sdks);
    }

    @Override
    protected void copyStateTo(ModuleNode copy) {
        super.copyStateTo(copy);
        SdkAwareModule target = (SdkAwareModule) copy;
        synchronized (this) {
            target.containingSdk = containingSdk;
            target.requiredSdks = requiredSdks;
        }
    }
}
