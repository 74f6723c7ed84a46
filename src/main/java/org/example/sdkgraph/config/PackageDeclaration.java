package org.example.sdkgraph.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares a deployable package.
 */
public class PackageDeclaration {

    private String name;

    /**
     * SDKs the package is built against, as name@version.
     */
    private List<String> usesSdks = new ArrayList<>();

    private List<String> nativeSharedLibs = new ArrayList<>();

    private List<String> javaLibs = new ArrayList<>();

    /**
     * Libraries used by the package but not bundled with it.
     */
    private List<String> externalLibs = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getUsesSdks() {
        return usesSdks;
    }

    public void setUsesSdks(List<String> usesSdks) {
        this.usesSdks = usesSdks != null ? usesSdks : new ArrayList<>();
    }

    public List<String> getNativeSharedLibs() {
        return nativeSharedLibs;
    }

    public void setNativeSharedLibs(List<String> nativeSharedLibs) {
        this.nativeSharedLibs = nativeSharedLibs != null ? nativeSharedLibs : new ArrayList<>();
    }

    public List<String> getJavaLibs() {
        return javaLibs;
    }

    public void setJavaLibs(List<String> javaLibs) {
        this.javaLibs = javaLibs != null ? javaLibs : new ArrayList<>();
    }

    public List<String> getExternalLibs() {
        return externalLibs;
    }

    public void setExternalLibs(List<String> externalLibs) {
        this.externalLibs = externalLibs != null ? externalLibs : new ArrayList<>();
    }
}
