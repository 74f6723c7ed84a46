package org.example.sdkgraph.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares a library module.
 */
public class LibraryDeclaration {

    private String name;

    /**
     * One of native_shared, java_header, java_library, stubs_sources.
     * Default: native_shared
     */
    private String kind = "native_shared";

    /**
     * Member name of a frozen copy, e.g. "libfoo" for "mysdk_libfoo@11".
     */
    private String sdkMemberName;

    private List<String> staticLibs = new ArrayList<>();

    private List<String> sharedLibs = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSdkMemberName() {
        return sdkMemberName;
    }

    public void setSdkMemberName(String sdkMemberName) {
        this.sdkMemberName = sdkMemberName;
    }

    public List<String> getStaticLibs() {
        return staticLibs;
    }

    public void setStaticLibs(List<String> staticLibs) {
        this.staticLibs = staticLibs != null ? staticLibs : new ArrayList<>();
    }

    public List<String> getSharedLibs() {
        return sharedLibs;
    }

    public void setSharedLibs(List<String> sharedLibs) {
        this.sharedLibs = sharedLibs != null ? sharedLibs : new ArrayList<>();
    }
}
