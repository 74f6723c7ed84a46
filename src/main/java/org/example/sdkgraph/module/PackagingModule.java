package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.graph.ModuleNode;
import org.example.sdkgraph.sdk.CoPackaging;
import org.example.sdkgraph.sdk.SdkAwareModule;
import org.example.sdkgraph.sdk.SdkRefs;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A deployable package bundling libraries, optionally built against fixed SDK versions.
 */
public class PackagingModule extends SdkAwareModule implements CoPackaging {

    public static final String VARIANT_PREFIX = "package:";

    private final SdkRefs usesSdks;
    private final List<String> nativeSharedLibs;
    private final List<String> javaLibs;
    private final List<String> externalLibs;

    public PackagingModule(String name, String variant, SdkRefs usesSdks, List<String> nativeSharedLibs,
                           List<String> javaLibs, List<String> externalLibs) {
        super(name, variant, null);
        this.usesSdks = Objects.requireNonNull(usesSdks, "usesSdks cannot be null");
        this.nativeSharedLibs = nativeSharedLibs == null ? List.of() : List.copyOf(nativeSharedLibs);
        this.javaLibs = javaLibs == null ? List.of() : List.copyOf(javaLibs);
        this.externalLibs = externalLibs == null ? List.of() : List.copyOf(externalLibs);
    }

    @Override
    public String getTypeName() {
        return "package";
    }

    /**
     * The SDKs this package was declared to be built against.
     */
    public SdkRefs getUsesSdks() {
        return usesSdks;
    }

    public List<String> getNativeSharedLibs() {
        return nativeSharedLibs;
    }

    public List<String> getJavaLibs() {
        return javaLibs;
    }

    public List<String> getExternalLibs() {
        return externalLibs;
    }

    /**
     * Returns the variant its contents are copied into.
     */
    public String getPackageVariant() {
        return VARIANT_PREFIX + getName();
    }

    @Override
    public synchronized SdkRefs getRequiredSdks() {
        return usesSdks.union(super.getRequiredSdks());
    }

    @Override
    public Optional<CoPackaging> coPackaging() {
        return Optional.of(this);
    }

    @Override
    public boolean isCoPackagedWith(ModuleNode dependency, DependencyTag tag) {
        return tag != PackageContentTag.EXTERNAL_LIB;
    }

    @Override
    protected ModuleNode newVariant(String newVariant) {
        return new PackagingModule(getName(), newVariant, usesSdks, nativeSharedLibs, javaLibs, externalLibs);
    }
}
