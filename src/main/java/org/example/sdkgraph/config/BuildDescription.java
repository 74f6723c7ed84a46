package org.example.sdkgraph.config;

import java.util.ArrayList;
import java.util.List;

/**
 * All module declarations of one build.
 */
public class BuildDescription {

    private final List<SdkDeclaration> sdks;
    private final List<LibraryDeclaration> libraries;
    private final List<PackageDeclaration> packages;
    private final List<DefaultsDeclaration> defaults;

    private BuildDescription(Builder builder) {
        this.sdks = List.copyOf(builder.sdks);
        this.libraries = List.copyOf(builder.libraries);
        this.packages = List.copyOf(builder.packages);
        this.defaults = List.copyOf(builder.defaults);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SdkDeclaration> getSdks() {
        return sdks;
    }

    public List<LibraryDeclaration> getLibraries() {
        return libraries;
    }

    public List<PackageDeclaration> getPackages() {
        return packages;
    }

    public List<DefaultsDeclaration> getDefaults() {
        return defaults;
    }

    public int getDeclarationCount() {
        return sdks.size() + libraries.size() + packages.size() + defaults.size();
    }

    @Override
    public String toString() {
        return "BuildDescription{" +
                "sdks=" + sdks.size() +
                ", libraries=" + libraries.size() +
                ", packages=" + packages.size() +
                ", defaults=" + defaults.size() +
                '}';
    }

    /**
     * Builder for BuildDescription.
     */
    public static class Builder {
        private final List<SdkDeclaration> sdks = new ArrayList<>();
        private final List<LibraryDeclaration> libraries = new ArrayList<>();
        private final List<PackageDeclaration> packages = new ArrayList<>();
        private final List<DefaultsDeclaration> defaults = new ArrayList<>();

        public Builder sdks(List<SdkDeclaration> sdks) {
            if (sdks != null) {
                this.sdks.addAll(sdks);
            }
            return this;
        }

        public Builder sdk(SdkDeclaration sdk) {
            this.sdks.add(sdk);
            return this;
        }

        public Builder libraries(List<LibraryDeclaration> libraries) {
            if (libraries != null) {
                this.libraries.addAll(libraries);
            }
            return this;
        }

        public Builder library(LibraryDeclaration library) {
            this.libraries.add(library);
            return this;
        }

        public Builder packages(List<PackageDeclaration> packages) {
            if (packages != null) {
                this.packages.addAll(packages);
            }
            return this;
        }

        public Builder pkg(PackageDeclaration pkg) {
            this.packages.add(pkg);
            return this;
        }

        public Builder defaults(List<DefaultsDeclaration> defaults) {
            if (defaults != null) {
                this.defaults.addAll(defaults);
            }
            return this;
        }

        public Builder defaults(DefaultsDeclaration defaults) {
            this.defaults.add(defaults);
            return this;
        }

        public BuildDescription build() {
            return new BuildDescription(this);
        }
    }
}
