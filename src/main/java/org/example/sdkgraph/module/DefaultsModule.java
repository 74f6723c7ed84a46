package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.ModuleNode;
import org.example.sdkgraph.sdk.SdkProperties;

import java.util.Objects;

/**
 * Holds SDK member lists shared by several SDKs.
 */
public class DefaultsModule extends ModuleNode {

    private final SdkProperties properties;

    public DefaultsModule(String name, SdkProperties properties) {
        this(name, DEFAULT_VARIANT, properties);
    }

    private DefaultsModule(String name, String variant, SdkProperties properties) {
        super(name, variant);
        this.properties = Objects.requireNonNull(properties, "properties cannot be null");
    }

    @Override
    public String getTypeName() {
        return "sdk_defaults";
    }

    public SdkProperties getProperties() {
        return properties;
    }

    @Override
    protected ModuleNode newVariant(String newVariant) {
        return new DefaultsModule(getName(), newVariant, properties);
    }
}
