package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An SDK: a logical group of modules (native libraries, java libraries, stub sources)
 * which packages can choose to build with.
 *
 * <p>A snapshot is a frozen copy of an SDK and must be named {@code <name>@<version>};
 * an in-development SDK must not carry a version.</p>
 */
public class SdkModule extends ModuleNode {

    private static final Logger log = LoggerFactory.getLogger(SdkModule.class);

    private final boolean snapshot;
    private final List<String> defaults;
    private SdkProperties properties;
    private boolean defaultsApplied;
    private Path snapshotFile;

    protected SdkModule(String name, String variant, boolean snapshot,
                        SdkProperties properties, List<String> defaults) {
        super(name, variant);
        this.snapshot = snapshot;
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
        this.defaults = defaults == null ? List.of() : List.copyOf(defaults);
    }

    /**
     * Creates an in-development SDK.
     */
    public static SdkModule sdk(String name, SdkProperties properties) {
        return sdk(name, properties, List.of());
    }

    public static SdkModule sdk(String name, SdkProperties properties, List<String> defaults) {
        return new SdkModule(name, DEFAULT_VARIANT, false, properties, defaults);
    }

    /**
     * Creates a versioned snapshot of an SDK.
     */
    public static SdkModule snapshot(String name, SdkProperties properties) {
        return snapshot(name, properties, List.of());
    }

    public static SdkModule snapshot(String name, SdkProperties properties, List<String> defaults) {
        return new SdkModule(name, DEFAULT_VARIANT, true, properties, defaults);
    }

    @Override
    public String getTypeName() {
        return snapshot ? "sdk_snapshot" : "sdk";
    }

    public boolean isSnapshot() {
        return snapshot;
    }

    public synchronized SdkProperties getProperties() {
        return properties;
    }

    /**
     * Names of the defaults modules this SDK inherits member lists from.
     */
    public List<String> getDefaults() {
        return defaults;
    }

    /**
     * Prepends the member lists of the given defaults. Can only happen once.
     */
    public synchronized void applyDefaults(List<SdkProperties> defaultProperties) {
        if (defaultsApplied) {
            throw new IllegalStateException("defaults already applied to " + getId());
        }
        properties = properties.withDefaults(defaultProperties);
        defaultsApplied = true;
    }

    /**
     * Builds the snapshot artifact of an in-development SDK. A snapshot SDK is a frozen
     * copy already, so nothing is built for it.
     *
     * @throws IOException if the snapshot builder fails
     */
    public void generateBuildActions(SnapshotBuilder builder) throws IOException {
        if (snapshot) {
            log.debug("Skipping snapshot generation for sdk_snapshot {}", getId());
            return;
        }
        Path file = builder.buildSnapshot(this);
        synchronized (this) {
            snapshotFile = file;
        }
        log.info("Built snapshot of {} at {}", getId(), file);
    }

    public synchronized Optional<Path> getSnapshotFile() {
        return Optional.ofNullable(snapshotFile);
    }

    @Override
    protected ModuleNode newVariant(String newVariant) {
        return new SdkModule(getName(), newVariant, snapshot, getProperties(), defaults);
    }
}
