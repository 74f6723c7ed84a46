package org.example.sdkgraph.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Declares an SDK or, with {@code snapshot} set, a frozen snapshot of one.
 *
 * <pre>
 * &lt;sdk&gt;
 *   &lt;name&gt;mysdk&lt;/name&gt;
 *   &lt;nativeSharedLibs&gt;&lt;nativeSharedLib&gt;libfoo&lt;/nativeSharedLib&gt;&lt;/nativeSharedLibs&gt;
 * &lt;/sdk&gt;
 * </pre>
 */
public class SdkDeclaration extends MemberListDeclaration {

    private boolean snapshot;

    /**
     * Names of defaults modules to inherit member lists from.
     */
    private List<String> defaults = new ArrayList<>();

    public boolean isSnapshot() {
        return snapshot;
    }

    public void setSnapshot(boolean snapshot) {
        this.snapshot = snapshot;
    }

    public List<String> getDefaults() {
        return defaults;
    }

    public void setDefaults(List<String> defaults) {
        this.defaults = defaults != null ? defaults : new ArrayList<>();
    }
}
