package org.example.sdkgraph.sdk;

import org.example.sdkgraph.graph.DependencyTag;

/**
 * Tag for edges from an SDK to the members listed in one of its member-list properties.
 * There is one instance per property; equality is identity.
 */
public final class SdkMemberDependencyTag implements DependencyTag {

    private final MemberListProperty memberListProperty;

    SdkMemberDependencyTag(MemberListProperty memberListProperty) {
        this.memberListProperty = memberListProperty;
    }

    public MemberListProperty getMemberListProperty() {
        return memberListProperty;
    }

    @Override
    public String toString() {
        return "sdk member (" + memberListProperty.getName() + ")";
    }
}
