package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.graph.ModuleNode;
import org.example.sdkgraph.sdk.CoPackaging;
import org.example.sdkgraph.sdk.SdkAwareModule;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A library that can be listed as an SDK member.
 *
 * <p>A frozen copy of a member carries the member's name in {@code sdkMemberName},
 * e.g. module {@code mysdk_libfoo@11} with member name {@code libfoo}.</p>
 */
public class LibraryModule extends SdkAwareModule implements CoPackaging {

    private final LibraryKind kind;
    private final List<String> staticLibs;
    private final List<String> sharedLibs;

    public LibraryModule(String name, LibraryKind kind) {
        this(name, DEFAULT_VARIANT, kind, null, List.of(), List.of());
    }

    public LibraryModule(String name, String variant, LibraryKind kind, String sdkMemberName,
                         List<String> staticLibs, List<String> sharedLibs) {
        super(name, variant, sdkMemberName);
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.staticLibs = staticLibs == null ? List.of() : List.copyOf(staticLibs);
        this.sharedLibs = sharedLibs == null ? List.of() : List.copyOf(sharedLibs);
    }

    /**
     * Creates a new LibraryModule using the builder pattern.
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String getTypeName() {
        return kind.getTypeName();
    }

    public LibraryKind getKind() {
        return kind;
    }

    public List<String> getStaticLibs() {
        return staticLibs;
    }

    public List<String> getSharedLibs() {
        return sharedLibs;
    }

    @Override
    public Optional<CoPackaging> coPackaging() {
        return Optional.of(this);
    }

    /**
     * Shared libraries are reached through stubs and live outside the package.
     */
    @Override
    public boolean isCoPackagedWith(ModuleNode dependency, DependencyTag tag) {
        return tag != LibraryDependencyTag.SHARED;
    }

    @Override
    protected ModuleNode newVariant(String newVariant) {
        return new LibraryModule(getName(), newVariant, kind, getDeclaredSdkMemberName(), staticLibs, sharedLibs);
    }

    /**
     * Builder for LibraryModule.
     */
    public static class Builder {
        private String name;
        private String variant = DEFAULT_VARIANT;
        private LibraryKind kind = LibraryKind.NATIVE_SHARED;
        private String sdkMemberName;
        private List<String> staticLibs = List.of();
        private List<String> sharedLibs = List.of();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder kind(LibraryKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder sdkMemberName(String sdkMemberName) {
            this.sdkMemberName = sdkMemberName;
            return this;
        }

        public Builder staticLibs(List<String> staticLibs) {
            this.staticLibs = staticLibs;
            return this;
        }

        public Builder sharedLibs(List<String> sharedLibs) {
            this.sharedLibs = sharedLibs;
            return this;
        }

        public LibraryModule build() {
            return new LibraryModule(name, variant, kind, sdkMemberName, staticLibs, sharedLibs);
        }
    }
}
