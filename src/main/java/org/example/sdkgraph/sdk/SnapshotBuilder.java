package org.example.sdkgraph.sdk;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Serializes an SDK into a frozen snapshot artifact.
 */
@FunctionalInterface
public interface SnapshotBuilder {

    /**
     * Builds the snapshot of the given SDK.
     *
     * @return the path of the written artifact
     * @throws IOException if the artifact cannot be written
     */
    Path buildSnapshot(SdkModule sdk) throws IOException;
}
