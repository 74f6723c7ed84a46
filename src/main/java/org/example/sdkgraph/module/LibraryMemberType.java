package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.mutator.BottomUpMutatorContext;
import org.example.sdkgraph.sdk.SdkMemberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * SDK member type for library modules of one {@link LibraryKind}.
 */
public final class LibraryMemberType implements SdkMemberType {

    private static final Logger log = LoggerFactory.getLogger(LibraryMemberType.class);

    private static final Map<LibraryKind, LibraryMemberType> INSTANCES = new EnumMap<>(LibraryKind.class);

    static {
        for (LibraryKind kind : LibraryKind.values()) {
            INSTANCES.put(kind, new LibraryMemberType(kind));
        }
    }

    private final LibraryKind kind;

    private LibraryMemberType(LibraryKind kind) {
        this.kind = kind;
    }

    public static LibraryMemberType of(LibraryKind kind) {
        return INSTANCES.get(kind);
    }

    public LibraryKind getKind() {
        return kind;
    }

    @Override
    public String getName() {
        return kind.getTypeName();
    }

    @Override
    public void addDependencies(BottomUpMutatorContext ctx, DependencyTag tag, List<String> names) {
        log.debug("{}: adding {} members {}", ctx.getModule().getId(), kind.getTypeName(), names);
        ctx.addDependencies(tag, names);
    }

    @Override
    public String toString() {
        return "LibraryMemberType{" + kind.getTypeName() + "}";
    }
}
