package org.example.sdkgraph.mutator;

import org.example.sdkgraph.graph.ModuleError;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of running a mutator pipeline over a module graph.
 */
public class PipelineResult {

    private final List<String> passes;
    private final int modulesVisited;
    private final List<ModuleError> errors;
    private final long executionTimeMs;

    private PipelineResult(Builder builder) {
        this.passes = List.copyOf(builder.passes);
        this.modulesVisited = builder.modulesVisited;
        this.errors = List.copyOf(builder.errors);
        this.executionTimeMs = builder.executionTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Names of the passes that ran, in order.
     */
    public List<String> getPasses() {
        return passes;
    }

    /**
     * Total number of module visits across all per-module passes.
     */
    public int getModulesVisited() {
        return modulesVisited;
    }

    public List<ModuleError> getErrors() {
        return errors;
    }

    public List<ModuleError> getErrorsFor(String moduleId) {
        return errors.stream()
                .filter(e -> e.getModuleId().equals(moduleId))
                .collect(Collectors.toList());
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("PipelineResult{success=%s, passes=%d, visits=%d, errors=%d, time=%dms}",
                isSuccess(), passes.size(), modulesVisited, errors.size(), executionTimeMs);
    }

    public static class Builder {
        private final List<String> passes = new ArrayList<>();
        private int modulesVisited;
        private final List<ModuleError> errors = new ArrayList<>();
        private long executionTimeMs;

        public Builder pass(String name) {
            passes.add(name);
            return this;
        }

        public Builder modulesVisited(int modulesVisited) {
            this.modulesVisited = modulesVisited;
            return this;
        }

        public Builder errors(List<ModuleError> moduleErrors) {
            errors.addAll(moduleErrors);
            return this;
        }

        public Builder executionTimeMs(long executionTimeMs) {
            this.executionTimeMs = executionTimeMs;
            return this;
        }

        public PipelineResult build() {
            return new PipelineResult(this);
        }
    }
}
