package org.example.sdkgraph.sdk;

import org.apache.maven.artifact.versioning.ComparableVersion;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An immutable set of SDK references, kept in insertion order.
 */
public final class SdkRefs implements Iterable<SdkRef> {

    private static final SdkRefs EMPTY = new SdkRefs(Collections.emptySet());

    /**
     * Orders by name, then by version using Maven version semantics.
     */
    private static final Comparator<SdkRef> DISPLAY_ORDER = Comparator
            .comparing(SdkRef::getName)
            .thenComparing(ref -> new ComparableVersion(ref.getVersion()));

    private final Set<SdkRef> refs;

    private SdkRefs(Set<SdkRef> refs) {
        this.refs = refs;
    }

    public static SdkRefs empty() {
        return EMPTY;
    }

    public static SdkRefs of(SdkRef... refs) {
        return of(Arrays.asList(refs));
    }

    public static SdkRefs of(Collection<SdkRef> refs) {
        if (refs.isEmpty()) {
            return EMPTY;
        }
        return new SdkRefs(Collections.unmodifiableSet(new LinkedHashSet<>(refs)));
    }

    public boolean contains(SdkRef ref) {
        return refs.contains(ref);
    }

    /**
     * Returns the union of both sets. Returns {@code this} when nothing is added.
     */
    public SdkRefs union(SdkRefs other) {
        if (refs.containsAll(other.refs)) {
            return this;
        }
        Set<SdkRef> merged = new LinkedHashSet<>(refs);
        merged.addAll(other.refs);
        return new SdkRefs(Collections.unmodifiableSet(merged));
    }

    public boolean containsAll(SdkRefs other) {
        return refs.containsAll(other.refs);
    }

    public boolean isEmpty() {
        return refs.isEmpty();
    }

    public int size() {
        return refs.size();
    }

    public Set<SdkRef> asSet() {
        return refs;
    }

    public Stream<SdkRef> stream() {
        return refs.stream();
    }

    @Override
    public Iterator<SdkRef> iterator() {
        return refs.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return refs.equals(((SdkRefs) o).refs);
    }

    @Override
    public int hashCode() {
        return refs.hashCode();
    }

    @Override
    public String toString() {
        return refs.stream()
                .sorted(DISPLAY_ORDER)
                .map(SdkRef::toString)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
