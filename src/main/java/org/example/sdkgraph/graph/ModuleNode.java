package org.example.sdkgraph.graph;

import org.example.sdkgraph.sdk.CoPackaging;
import org.example.sdkgraph.sdk.SdkAware;

import java.util.Objects;
import java.util.Optional;

/**
 * A node in the module graph, identified by its name and variant.
 *
 * <p>The default variant is the empty string. Per-package copies of a module
 * share its name and differ only in their variant.</p>
 */
public abstract class ModuleNode {

    public static final String DEFAULT_VARIANT = "";

    private final String name;
    private final String variant;

    protected ModuleNode(String name, String variant) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.variant = Objects.requireNonNull(variant, "variant cannot be null");
    }

    public String getName() {
        return name;
    }

    public String getVariant() {
        return variant;
    }

    public boolean isDefaultVariant() {
        return variant.isEmpty();
    }

    /**
     * Returns the unique identifier: the name, followed by the variant in braces when not default.
     */
    public String getId() {
        return isDefaultVariant() ? name : name + "{" + variant + "}";
    }

    /**
     * Returns the module type as written in a build description, e.g. "sdk" or "library".
     */
    public abstract String getTypeName();

    /**
     * Returns this node's SDK capability, if it can be a member of an SDK.
     */
    public Optional<SdkAware> sdkAware() {
        return Optional.empty();
    }

    /**
     * Returns this node's co-packaging capability, if it belongs to a deployable unit.
     */
    public Optional<CoPackaging> coPackaging() {
        return Optional.empty();
    }

    /**
     * Creates a copy of this module in another variant. Edges are not copied.
     */
    public final ModuleNode copyForVariant(String newVariant) {
        if (variant.equals(newVariant)) {
            throw new IllegalArgumentException(getId() + " is already in variant " + newVariant);
        }
        ModuleNode copy = newVariant(newVariant);
        copyStateTo(copy);
        return copy;
    }

    protected abstract ModuleNode newVariant(String newVariant);

    /**
     * Copies mutable state gathered by earlier passes into a freshly created variant.
     */
    protected void copyStateTo(ModuleNode copy) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ModuleNode that = (ModuleNode) o;
        return Objects.equals(name, that.name) &&
               Objects.equals(variant, that.variant);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, variant);
    }

    @Override
    public String toString() {
        return getTypeName() + " " + getId();
    }
}
