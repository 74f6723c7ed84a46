package org.example.sdkgraph.sdk;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Describes one SDK property that lists members, e.g. {@code java_header_libs}.
 */
public final class MemberListProperty {

    private final String name;
    private final Function<SdkProperties, List<String>> getter;
    private final SdkMemberType memberType;
    private SdkMemberDependencyTag dependencyTag;

    /**
     * @param name       the name of the property as used in a build description
     * @param getter     reads the list of member names
     * @param memberType the type of member referenced in the list
     */
    public MemberListProperty(String name, Function<SdkProperties, List<String>> getter, SdkMemberType memberType) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.getter = Objects.requireNonNull(getter, "getter cannot be null");
        this.memberType = Objects.requireNonNull(memberType, "memberType cannot be null");
    }

    public String getName() {
        return name;
    }

    public List<String> getMemberNames(SdkProperties properties) {
        return getter.apply(properties);
    }

    public SdkMemberType getMemberType() {
        return memberType;
    }

    /**
     * Returns the tag used for edges to items in this list.
     *
     * @throws IllegalStateException if the property was never registered
     */
    public SdkMemberDependencyTag getDependencyTag() {
        if (dependencyTag == null) {
            throw new IllegalStateException("member list property " + name + " is not registered");
        }
        return dependencyTag;
    }

    void bindDependencyTag() {
        if (dependencyTag != null) {
            throw new IllegalStateException("member list property " + name + " is already registered");
        }
        dependencyTag = new SdkMemberDependencyTag(this);
    }

    @Override
    public String toString() {
        return name + " (" + memberType.getName() + ")";
    }
}
