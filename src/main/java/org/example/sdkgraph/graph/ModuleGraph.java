package org.example.sdkgraph.graph;

import org.example.sdkgraph.exception.ResolutionException;

import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Represents a complete module graph.
 * Contains modules (nodes) and tagged dependencies (edges).
 *
 * <p>The graph is not thread-safe for writes. The mutator pipeline only reads it
 * while a pass runs and applies structural changes between passes.</p>
 */
public class ModuleGraph {

    private final Map<String, ModuleNode> modulesById;
    private final Map<ModuleNode, List<Dependency>> dependenciesBySource;

    public ModuleGraph() {
        this.modulesById = new LinkedHashMap<>();
        this.dependenciesBySource = new LinkedHashMap<>();
    }

    // Modification methods

    /**
     * Adds a module to the graph.
     *
     * @throws IllegalArgumentException if a module with the same name and variant exists
     */
    public void addModule(ModuleNode module) {
        Objects.requireNonNull(module, "module cannot be null");
        if (modulesById.putIfAbsent(module.getId(), module) != null) {
            throw new IllegalArgumentException("module \"" + module.getId() + "\" is already defined");
        }
        dependenciesBySource.put(module, new ArrayList<>());
    }

    /**
     * Adds a dependency edge. Both ends must already be in the graph.
     */
    public void addDependency(Dependency dependency) {
        requireMember(dependency.getSource());
        requireMember(dependency.getTarget());
        dependenciesBySource.get(dependency.getSource()).add(dependency);
    }

    public void addDependency(ModuleNode source, DependencyTag tag, ModuleNode target) {
        addDependency(new Dependency(source, target, tag));
    }

    /**
     * Points every edge whose target is named {@code targetName} and lives in the
     * replacement's variant at the replacement instead.
     *
     * @return the number of edges rewired
     */
    public int replaceDependencies(ModuleNode replacement, String targetName) {
        return replaceDependencies(replacement, targetName, edge -> true);
    }

    /**
     * Like {@link #replaceDependencies(ModuleNode, String)}, but only rewires the edges
     * accepted by {@code filter}.
     *
     * @return the number of edges rewired
     */
    public int replaceDependencies(ModuleNode replacement, String targetName, Predicate<Dependency> filter) {
        requireMember(replacement);
        Objects.requireNonNull(filter, "filter cannot be null");
        int replaced = 0;
        for (List<Dependency> edges : dependenciesBySource.values()) {
            ListIterator<Dependency> it = edges.listIterator();
            while (it.hasNext()) {
                Dependency edge = it.next();
                ModuleNode target = edge.getTarget();
                if (target.getName().equals(targetName)
                        && target.getVariant().equals(replacement.getVariant())
                        && !target.equals(replacement)
                        && !edge.getSource().equals(replacement)
                        && filter.test(edge)) {
                    it.set(edge.withTarget(replacement));
                    replaced++;
                }
            }
        }
        return replaced;
    }

    /**
     * Points the outgoing edges of {@code source} at new targets, keeping their tags.
     * Targets missing from {@code replacements} are left alone.
     *
     * @return the number of edges rewired
     */
    public int retargetDependencies(ModuleNode source, Map<ModuleNode, ModuleNode> replacements) {
        requireMember(source);
        replacements.values().forEach(this::requireMember);
        int replaced = 0;
        ListIterator<Dependency> it = dependenciesBySource.get(source).listIterator();
        while (it.hasNext()) {
            Dependency edge = it.next();
            ModuleNode replacement = replacements.get(edge.getTarget());
            if (replacement != null) {
                it.set(edge.withTarget(replacement));
                replaced++;
            }
        }
        return replaced;
    }

    // Query methods

    public List<ModuleNode> getModules() {
        return List.copyOf(modulesById.values());
    }

    public int getModuleCount() {
        return modulesById.size();
    }

    public int getDependencyCount() {
        return dependenciesBySource.values().stream().mapToInt(List::size).sum();
    }

    public List<Dependency> getDependencies() {
        return dependenciesBySource.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns the outgoing edges of a module, in insertion order.
     */
    public List<Dependency> getDependenciesFrom(ModuleNode source) {
        List<Dependency> edges = dependenciesBySource.get(source);
        return edges == null ? List.of() : List.copyOf(edges);
    }

    /**
     * Returns the edges targeting a module.
     */
    public List<Dependency> getDependenciesTo(ModuleNode target) {
        return dependenciesBySource.values().stream()
                .flatMap(List::stream)
                .filter(d -> d.getTarget().equals(target))
                .collect(Collectors.toList());
    }

    public boolean contains(ModuleNode module) {
        return modulesById.get(module.getId()) == module;
    }

    /**
     * Finds a module by name and variant.
     */
    public Optional<ModuleNode> findModule(String name, String variant) {
        String id = variant.isEmpty() ? name : name + "{" + variant + "}";
        return Optional.ofNullable(modulesById.get(id));
    }

    /**
     * Finds all variants of a module.
     */
    public List<ModuleNode> findVariants(String name) {
        return modulesById.values().stream()
                .filter(m -> m.getName().equals(name))
                .collect(Collectors.toList());
    }

    /**
     * Resolves a dependency by name for a module in the given variant:
     * the same variant if it exists, otherwise the default variant.
     */
    public Optional<ModuleNode> resolve(String name, String variant) {
        Optional<ModuleNode> exact = findModule(name, variant);
        if (exact.isPresent() || variant.isEmpty()) {
            return exact;
        }
        return findModule(name, ModuleNode.DEFAULT_VARIANT);
    }

    // Traversal order

    /**
     * Groups modules so that every module comes after all of its dependents.
     * Modules within one level do not depend on each other.
     *
     * @throws ResolutionException if the graph has a cycle
     */
    public List<List<ModuleNode>> topDownLevels() throws ResolutionException {
        return levels(true);
    }

    /**
     * Groups modules so that every module comes after all of its dependencies.
     *
     * @throws ResolutionException if the graph has a cycle
     */
    public List<List<ModuleNode>> bottomUpLevels() throws ResolutionException {
        return levels(false);
    }

    private List<List<ModuleNode>> levels(boolean parentsFirst) throws ResolutionException {
        // pending = number of edges that must be visited before the module
        Map<ModuleNode, Integer> pending = new LinkedHashMap<>();
        Map<ModuleNode, List<ModuleNode>> unlocks = new HashMap<>();
        for (ModuleNode module : modulesById.values()) {
            pending.put(module, 0);
            unlocks.put(module, new ArrayList<>());
        }
        for (Dependency edge : getDependencies()) {
            ModuleNode before = parentsFirst ? edge.getSource() : edge.getTarget();
            ModuleNode after = parentsFirst ? edge.getTarget() : edge.getSource();
            pending.merge(after, 1, Integer::sum);
            unlocks.get(before).add(after);
        }

        List<List<ModuleNode>> levels = new ArrayList<>();
        List<ModuleNode> current = pending.entrySet().stream()
                .filter(e -> e.getValue() == 0)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        int visited = 0;

        while (!current.isEmpty()) {
            levels.add(current);
            visited += current.size();
            Set<ModuleNode> next = new LinkedHashSet<>();
            for (ModuleNode module : current) {
                for (ModuleNode unlocked : unlocks.get(module)) {
                    if (pending.merge(unlocked, -1, Integer::sum) == 0) {
                        next.add(unlocked);
                    }
                }
            }
            current = new ArrayList<>(next);
        }

        if (visited != modulesById.size()) {
            String stuck = pending.entrySet().stream()
                    .filter(e -> e.getValue() > 0)
                    .map(e -> e.getKey().getId())
                    .collect(Collectors.joining(", "));
            throw new ResolutionException("dependency cycle detected involving: " + stuck);
        }
        return levels;
    }

    private void requireMember(ModuleNode module) {
        if (!contains(module)) {
            throw new IllegalArgumentException("module \"" + module.getId() + "\" is not in the graph");
        }
    }

    @Override
    public String toString() {
        return "ModuleGraph{" +
                "moduleCount=" + getModuleCount() +
                ", dependencyCount=" + getDependencyCount() +
                '}';
    }

    /**
     * Returns a detailed string representation of the graph.
     */
    public String toDetailedString() {
        StringBuilder sb = new StringBuilder();
        sb.append("ModuleGraph:\n");
        sb.append("  Modules (").append(getModuleCount()).append("):\n");
        for (ModuleNode module : modulesById.values()) {
            sb.append("    - ").append(module).append("\n");
        }
        sb.append("  Dependencies (").append(getDependencyCount()).append("):\n");
        for (Dependency dep : getDependencies()) {
            sb.append("    - ").append(dep.getEdgeDescription()).append("\n");
        }
        return sb.toString();
    }
}
