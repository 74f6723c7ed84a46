package org.example.sdkgraph.sdk;

import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.module.LibraryMemberType;

import java.util.*;

/**
 * The fixed table of member-list properties an SDK supports.
 *
 * <p>A registry binds one dependency tag to each of its properties when it is
 * created and is read-only afterwards. Passes receive it by reference.</p>
 */
public final class MemberListRegistry {

    private final List<MemberListProperty> properties;
    private final Map<String, MemberListProperty> propertiesByName;

    public MemberListRegistry(List<MemberListProperty> properties) {
        Map<String, MemberListProperty> byName = new LinkedHashMap<>();
        for (MemberListProperty property : properties) {
            if (byName.putIfAbsent(property.getName(), property) != null) {
                throw new IllegalArgumentException("duplicate member list property: " + property.getName());
            }
        }
        properties.forEach(MemberListProperty::bindDependencyTag);
        this.properties = List.copyOf(properties);
        this.propertiesByName = Collections.unmodifiableMap(byName);
    }

    /**
     * Returns the registry of the built-in member kinds.
     */
    public static MemberListRegistry defaultRegistry() {
        return DefaultHolder.INSTANCE;
    }

    public List<MemberListProperty> getProperties() {
        return properties;
    }

    public Optional<MemberListProperty> findProperty(String name) {
        return Optional.ofNullable(propertiesByName.get(name));
    }

    public boolean isMembershipTag(Object tag) {
        return tag instanceof SdkMemberDependencyTag
                && properties.contains(((SdkMemberDependencyTag) tag).getMemberListProperty());
    }

    @Override
    public String toString() {
        return "MemberListRegistry" + properties;
    }

    // Built on first use so that loading the member types does not require this table.
    private static final class DefaultHolder {
        // Ordered by package, then by name within the package.
        static final MemberListRegistry INSTANCE = new MemberListRegistry(List.of(
                // Native members
                new MemberListProperty("native_shared_libs",
                        SdkProperties::getNativeSharedLibs,
                        LibraryMemberType.of(LibraryKind.NATIVE_SHARED)),
                // Java members
                new MemberListProperty("java_header_libs",
                        SdkProperties::getJavaHeaderLibs,
                        LibraryMemberType.of(LibraryKind.JAVA_HEADER)),
                new MemberListProperty("java_libs",
                        SdkProperties::getJavaLibs,
                        LibraryMemberType.of(LibraryKind.JAVA_IMPL)),
                new MemberListProperty("stubs_sources",
                        SdkProperties::getStubsSources,
                        LibraryMemberType.of(LibraryKind.STUBS_SOURCES))
        ));
    }
}
