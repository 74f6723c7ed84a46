package org.example.sdkgraph.module;

import org.example.sdkgraph.graph.DefaultsDependencyTag;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleNode;
import org.example.sdkgraph.mutator.GraphMutator;
import org.example.sdkgraph.mutator.GraphMutatorContext;
import org.example.sdkgraph.sdk.SdkModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits the modules used by every package into a variant of their own.
 *
 * <p>For a package {@code P}, every module reachable from {@code P} is copied into variant
 * {@code package:P}. That includes modules reached through edges that are not co-packaged,
 * such as external libraries, since the SDK requirements of {@code P} flow into them too.
 * The copies keep their outgoing edges, pointed at the other copies where possible, and
 * {@code P} is rewired onto them. Default variants are never given the requirements of a
 * package, so two packages never share a pinned module.</p>
 */
public class PackagingVariantMutator implements GraphMutator {

    public static final String NAME = "packaging_variants";

    private static final Logger log = LoggerFactory.getLogger(PackagingVariantMutator.class);

    @Override
    public void mutate(GraphMutatorContext ctx) {
        ModuleGraph graph = ctx.getGraph();
        for (ModuleNode module : graph.getModules()) {
            if (module instanceof PackagingModule && module.isDefaultVariant()) {
                split(ctx, (PackagingModule) module);
            }
        }
    }

    private void split(GraphMutatorContext ctx, PackagingModule pkg) {
        ModuleGraph graph = ctx.getGraph();
        String variant = pkg.getPackageVariant();
        Set<ModuleNode> contents = collectContents(graph, pkg);

        Map<ModuleNode, ModuleNode> copies = new LinkedHashMap<>();
        for (ModuleNode original : contents) {
            if (graph.findModule(original.getName(), variant).isPresent()) {
                ctx.moduleError(pkg, "variant %s of \"%s\" already exists", variant, original.getName());
                return;
            }
            copies.put(original, original.copyForVariant(variant));
        }
        copies.values().forEach(graph::addModule);

        for (Map.Entry<ModuleNode, ModuleNode> entry : copies.entrySet()) {
            for (Dependency dep : graph.getDependenciesFrom(entry.getKey())) {
                ModuleNode target = copies.getOrDefault(dep.getTarget(), dep.getTarget());
                graph.addDependency(entry.getValue(), dep.getTag(), target);
            }
        }
        graph.retargetDependencies(pkg, copies);

        log.debug("Package {}: created {} module variant(s)", pkg.getName(), copies.size());
    }

    /**
     * Walks every edge from the package. Other packages, SDKs and defaults modules are
     * never copied.
     */
    private Set<ModuleNode> collectContents(ModuleGraph graph, PackagingModule pkg) {
        Set<ModuleNode> contents = new LinkedHashSet<>();
        Deque<ModuleNode> queue = new ArrayDeque<>();
        queue.add(pkg);
        while (!queue.isEmpty()) {
            ModuleNode current = queue.poll();
            for (Dependency dep : graph.getDependenciesFrom(current)) {
                ModuleNode target = dep.getTarget();
                if (dep.getTag() == DefaultsDependencyTag.INSTANCE
                        || target instanceof PackagingModule
                        || target instanceof SdkModule
                        || target instanceof DefaultsModule) {
                    continue;
                }
                if (contents.add(target)) {
                    queue.add(target);
                }
            }
        }
        return contents;
    }
}
