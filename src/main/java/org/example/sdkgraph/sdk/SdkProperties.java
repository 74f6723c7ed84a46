package org.example.sdkgraph.sdk;

import java.util.*;

/**
 * The member lists declared by an SDK. Immutable.
 */
public final class SdkProperties {

    private static final SdkProperties EMPTY = builder().build();

    private final List<String> nativeSharedLibs;
    private final List<String> javaHeaderLibs;
    private final List<String> javaLibs;
    private final List<String> stubsSources;

    private SdkProperties(Builder builder) {
        this.nativeSharedLibs = List.copyOf(builder.nativeSharedLibs);
        this.javaHeaderLibs = List.copyOf(builder.javaHeaderLibs);
        this.javaLibs = List.copyOf(builder.javaLibs);
        this.stubsSources = List.copyOf(builder.stubsSources);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SdkProperties empty() {
        return EMPTY;
    }

    /**
     * The native shared libraries in this SDK.
     */
    public List<String> getNativeSharedLibs() {
        return nativeSharedLibs;
    }

    /**
     * The java header libraries in this SDK, for libraries provided separately at runtime.
     */
    public List<String> getJavaHeaderLibs() {
        return javaHeaderLibs;
    }

    /**
     * The java implementation libraries in this SDK.
     */
    public List<String> getJavaLibs() {
        return javaLibs;
    }

    /**
     * The stub sources in this SDK.
     */
    public List<String> getStubsSources() {
        return stubsSources;
    }

    public int getMemberCount() {
        return nativeSharedLibs.size() + javaHeaderLibs.size() + javaLibs.size() + stubsSources.size();
    }

    /**
     * Returns new properties with the given defaults placed before this module's own entries.
     * Names already listed by an earlier source are not repeated.
     */
    public SdkProperties withDefaults(List<SdkProperties> defaults) {
        Builder merged = builder();
        for (SdkProperties d : defaults) {
            merged.append(d);
        }
        merged.append(this);
        return merged.build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SdkProperties that = (SdkProperties) o;
        return nativeSharedLibs.equals(that.nativeSharedLibs) &&
               javaHeaderLibs.equals(that.javaHeaderLibs) &&
               javaLibs.equals(that.javaLibs) &&
               stubsSources.equals(that.stubsSources);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nativeSharedLibs, javaHeaderLibs, javaLibs, stubsSources);
    }

    @Override
    public String toString() {
        return "SdkProperties{" +
                "native_shared_libs=" + nativeSharedLibs +
                ", java_header_libs=" + javaHeaderLibs +
                ", java_libs=" + javaLibs +
                ", stubs_sources=" + stubsSources +
                '}';
    }

    /**
     * Builder for SdkProperties.
     */
    public static class Builder {
        private final Set<String> nativeSharedLibs = new LinkedHashSet<>();
        private final Set<String> javaHeaderLibs = new LinkedHashSet<>();
        private final Set<String> javaLibs = new LinkedHashSet<>();
        private final Set<String> stubsSources = new LinkedHashSet<>();

        public Builder nativeSharedLibs(Collection<String> names) {
            addAll(nativeSharedLibs, names);
            return this;
        }

        public Builder javaHeaderLibs(Collection<String> names) {
            addAll(javaHeaderLibs, names);
            return this;
        }

        public Builder javaLibs(Collection<String> names) {
            addAll(javaLibs, names);
            return this;
        }

        public Builder stubsSources(Collection<String> names) {
            addAll(stubsSources, names);
            return this;
        }

        private Builder append(SdkProperties other) {
            return nativeSharedLibs(other.nativeSharedLibs)
                    .javaHeaderLibs(other.javaHeaderLibs)
                    .javaLibs(other.javaLibs)
                    .stubsSources(other.stubsSources);
        }

        private static void addAll(Set<String> target, Collection<String> names) {
            if (names != null) {
                names.stream()
                        .filter(Objects::nonNull)
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .forEach(target::add);
            }
        }

        public SdkProperties build() {
            return new SdkProperties(this);
        }
    }
}
