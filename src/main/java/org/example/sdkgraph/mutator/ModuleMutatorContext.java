package org.example.sdkgraph.mutator;

import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.DependencyTag;
import org.example.sdkgraph.graph.ModuleError;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Context handed to a per-module pass. Each visit gets its own instance, so the
 * errors and edge changes it gathers need no locking.
 */
class ModuleMutatorContext implements BottomUpMutatorContext, TopDownMutatorContext {

    private static final Logger log = LoggerFactory.getLogger(ModuleMutatorContext.class);

    private final ModuleGraph graph;
    private final ModuleNode module;
    private final String passName;
    private final List<Dependency> directDependencies;
    private final List<ModuleError> errors = new ArrayList<>();
    private final List<EdgeChange> edgeChanges = new ArrayList<>();

    ModuleMutatorContext(ModuleGraph graph, ModuleNode module, String passName) {
        this.graph = graph;
        this.module = module;
        this.passName = passName;
        this.directDependencies = graph.getDependenciesFrom(module);
    }

    @Override
    public ModuleNode getModule() {
        return module;
    }

    @Override
    public String getPassName() {
        return passName;
    }

    @Override
    public List<Dependency> getDirectDependencies() {
        return directDependencies;
    }

    @Override
    public void moduleError(String format, Object... args) {
        errors.add(ModuleError.moduleError(module, passName, String.format(format, args)));
    }

    @Override
    public void propertyError(String property, String format, Object... args) {
        errors.add(ModuleError.propertyError(module, property, passName, String.format(format, args)));
    }

    @Override
    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public void afterPass(Runnable action) {
        edgeChanges.add(new EdgeChange(Objects.requireNonNull(action, "action cannot be null")));
    }

    @Override
    public void addDependencies(DependencyTag tag, List<String> names) {
        for (String name : names) {
            edgeChanges.add(new EdgeChange(EdgeChange.Kind.DEPENDENCY, tag, name));
        }
    }

    @Override
    public void addReverseDependency(DependencyTag tag, String name) {
        edgeChanges.add(new EdgeChange(EdgeChange.Kind.REVERSE_DEPENDENCY, tag, name));
    }

    @Override
    public void replaceDependenciesIf(String name, Predicate<Dependency> filter) {
        edgeChanges.add(new EdgeChange(name, Objects.requireNonNull(filter, "filter cannot be null")));
    }

    List<ModuleError> getErrors() {
        return errors;
    }

    /**
     * Applies the requested edge changes and deferred actions. Called on a single thread
     * once the pass finished.
     */
    void applyEdgeChanges() {
        for (EdgeChange change : edgeChanges) {
            switch (change.kind) {
                case DEPENDENCY -> graph.resolve(change.name, module.getVariant()).ifPresentOrElse(
                        target -> addEdge(module, target, change.tag),
                        () -> moduleError("depends on undefined module \"%s\"", change.name));
                case REVERSE_DEPENDENCY -> graph.resolve(change.name, module.getVariant()).ifPresentOrElse(
                        source -> addEdge(source, module, change.tag),
                        () -> moduleError("reverse dependency from undefined module \"%s\"", change.name));
                case REPLACEMENT -> {
                    int replaced = graph.replaceDependencies(module, change.name, change.filter);
                    log.debug("{}: replaced {} dependencies on {} with {}",
                            passName, replaced, change.name, module.getId());
                }
                case ACTION -> change.action.run();
            }
        }
        edgeChanges.clear();
    }

    private void addEdge(ModuleNode source, ModuleNode target, DependencyTag tag) {
        if (source.equals(target)) {
            moduleError("module \"%s\" cannot depend on itself", source.getId());
            return;
        }
        graph.addDependency(source, tag, target);
    }

    private static final class EdgeChange {
        enum Kind { DEPENDENCY, REVERSE_DEPENDENCY, REPLACEMENT, ACTION }

        private final Kind kind;
        private final DependencyTag tag;
        private final String name;
        private final Predicate<Dependency> filter;
        private final Runnable action;

        EdgeChange(Kind kind, DependencyTag tag, String name) {
            this(kind, tag, name, null, null);
        }

        EdgeChange(String name, Predicate<Dependency> filter) {
            this(Kind.REPLACEMENT, null, name, filter, null);
        }

        EdgeChange(Runnable action) {
            this(Kind.ACTION, null, null, null, action);
        }

        private EdgeChange(Kind kind, DependencyTag tag, String name, Predicate<Dependency> filter, Runnable action) {
            this.kind = kind;
            this.tag = tag;
            this.name = name;
            this.filter = filter;
            this.action = action;
        }
    }
}
