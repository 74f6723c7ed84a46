package org.example.sdkgraph.module;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of library modules that can be SDK members.
 */
public enum LibraryKind {

    NATIVE_SHARED("native_shared"),
    JAVA_HEADER("java_header"),
    JAVA_IMPL("java_library"),
    STUBS_SOURCES("stubs_sources");

    private final String typeName;

    LibraryKind(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the name used for this kind in a build description.
     */
    public String getTypeName() {
        return typeName;
    }

    public static Optional<LibraryKind> fromTypeName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(k -> k.typeName.equals(normalized))
                .findFirst();
    }
}
