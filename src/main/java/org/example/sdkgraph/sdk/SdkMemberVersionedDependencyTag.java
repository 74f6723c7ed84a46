package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.DependencyTag;

import java.util.Objects;

/**
 * Tag for edges from an in-development SDK member to a frozen version of the same member,
 * e.g. {@code libfoo -> mysdk_libfoo@11}.
 */
public final class SdkMemberVersionedDependencyTag implements DependencyTag {

    private final String member;
    private final String version;

    public SdkMemberVersionedDependencyTag(String member, String version) {
        this.member = Objects.requireNonNull(member, "member cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
    }

    public String getMember() {
        return member;
    }

    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SdkMemberVersionedDependencyTag that = (SdkMemberVersionedDependencyTag) o;
        return member.equals(that.member) && version.equals(that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(member, version);
    }

    @Override
    public String toString() {
        return "versioned member " + member + SdkRef.VERSION_SEPARATOR + version;
    }
}
