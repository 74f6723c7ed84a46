package org.example.sdkgraph.config;

import org.example.sdkgraph.sdk.SdkProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Member lists shared by SDK and defaults declarations.
 */
public abstract class MemberListDeclaration {

    /**
     * Module name.
     */
    private String name;

    /**
     * Native shared libraries.
     */
    private List<String> nativeSharedLibs = new ArrayList<>();

    /**
     * Java libraries provided separately at runtime.
     */
    private List<String> javaHeaderLibs = new ArrayList<>();

    /**
     * Java implementation libraries.
     */
    private List<String> javaLibs = new ArrayList<>();

    private List<String> stubsSources = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getNativeSharedLibs() {
        return nativeSharedLibs;
    }

    public void setNativeSharedLibs(List<String> nativeSharedLibs) {
        this.nativeSharedLibs = nativeSharedLibs != null ? nativeSharedLibs : new ArrayList<>();
    }

    public List<String> getJavaHeaderLibs() {
        return javaHeaderLibs;
    }

    public void setJavaHeaderLibs(List<String> javaHeaderLibs) {
        this.javaHeaderLibs = javaHeaderLibs != null ? javaHeaderLibs : new ArrayList<>();
    }

    public List<String> getJavaLibs() {
        return javaLibs;
    }

    public void setJavaLibs(List<String> javaLibs) {
        this.javaLibs = javaLibs != null ? javaLibs : new ArrayList<>();
    }

    public List<String> getStubsSources() {
        return stubsSources;
    }

    public void setStubsSources(List<String> stubsSources) {
        this.stubsSources = stubsSources != null ? stubsSources : new ArrayList<>();
    }

    /**
     * Returns all member lists keyed by their property name, for validation messages.
     */
    public List<NamedList> memberLists() {
        return List.of(
                new NamedList("nativeSharedLibs", nativeSharedLibs),
                new NamedList("javaHeaderLibs", javaHeaderLibs),
                new NamedList("javaLibs", javaLibs),
                new NamedList("stubsSources", stubsSources));
    }

    public SdkProperties toSdkProperties() {
        return SdkProperties.builder()
                .nativeSharedLibs(nativeSharedLibs)
                .javaHeaderLibs(javaHeaderLibs)
                .javaLibs(javaLibs)
                .stubsSources(stubsSources)
                .build();
    }

    /**
     * A list property and its name.
     */
    public static final class NamedList {
        private final String name;
        private final List<String> values;

        public NamedList(String name, List<String> values) {
            this.name = name;
            this.values = values;
        }

        public String getName() {
            return name;
        }

        public List<String> getValues() {
            return values;
        }
    }
}
