package org.example.sdkgraph.sdk;

/**
 * Capability of a module that can be a member of an SDK.
 *
 * <p>The containing SDK is assigned at most once. The required SDK set only grows.
 * Both are written by the mutator passes, never by the module itself.</p>
 */
public interface SdkAware {

    String getName();

    /**
     * Returns the name this module is known by inside an SDK.
     * A versioned copy of {@code libfoo} reports {@code libfoo} here.
     */
    String getMemberName();

    boolean isInAnySdk();

    /**
     * Returns the SDK this module belongs to, or {@link SdkRef#NONE}.
     */
    SdkRef getContainingSdk();

    /**
     * Records membership of an SDK.
     *
     * @return false if the module already belongs to a different SDK; the earlier
     *         membership is kept
     */
    boolean makeMemberOf(SdkRef sdk);

    SdkRefs getRequiredSdks();

    /**
     * Adds SDKs this module must be built against.
     */
    void buildWithSdks(SdkRefs sdks);
}
