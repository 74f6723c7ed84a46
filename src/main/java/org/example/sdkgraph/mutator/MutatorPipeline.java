package org.example.sdkgraph.mutator;

import org.example.sdkgraph.exception.MutatorException;
import org.example.sdkgraph.exception.ResolutionException;
import org.example.sdkgraph.graph.ModuleError;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs registered passes over a module graph.
 *
 * <p>Execution model:</p>
 * <ul>
 *   <li>Passes run one at a time, in phase order and then registration order.
 *       A pass finishes for the whole graph before the next one starts.</li>
 *   <li>A per-module pass visits the graph level by level. Modules of one level never
 *       depend on each other and run concurrently when the pass is parallel.</li>
 *   <li>Edge changes requested by bottom-up passes are applied after the pass,
 *       on the calling thread, in visiting order.</li>
 *   <li>Module errors are collected and never stop the run.</li>
 * </ul>
 */
public class MutatorPipeline {

    private static final Logger log = LoggerFactory.getLogger(MutatorPipeline.class);

    private final List<Registration> registrations;
    private final int parallelism;

    private MutatorPipeline(Builder builder) {
        List<Registration> ordered = new ArrayList<>(builder.registrations);
        // stable sort keeps registration order inside a phase
        ordered.sort(Comparator.comparing(r -> r.phase));
        this.registrations = List.copyOf(ordered);
        this.parallelism = builder.parallelism;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the pass names in execution order.
     */
    public List<String> getPassNames() {
        List<String> names = new ArrayList<>();
        for (Registration r : registrations) {
            names.add(r.name);
        }
        return names;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs every pass over the graph.
     *
     * @return the result, including all module errors
     * @throws ResolutionException if the graph has a dependency cycle
     */
    public PipelineResult run(ModuleGraph graph) throws ResolutionException {
        long start = System.currentTimeMillis();
        PipelineResult.Builder result = PipelineResult.builder();
        AtomicInteger visits = new AtomicInteger();

        ExecutorService executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, new PassThreadFactory()) : null;
        try {
            for (Registration registration : registrations) {
                log.debug("Running pass {} ({}, {})", registration.name, registration.phase, registration.kind);
                List<ModuleError> errors = registration.kind == Kind.GRAPH
                        ? runGraphPass(graph, registration)
                        : runModulePass(graph, registration, executor, visits);
                if (!errors.isEmpty()) {
                    log.debug("Pass {} reported {} error(s)", registration.name, errors.size());
                }
                result.pass(registration.name).errors(errors);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        PipelineResult pipelineResult = result
                .modulesVisited(visits.get())
                .executionTimeMs(System.currentTimeMillis() - start)
                .build();
        log.info("Ran {} passes over {} modules: {} error(s)",
                pipelineResult.getPasses().size(), graph.getModuleCount(), pipelineResult.getErrors().size());
        return pipelineResult;
    }

    /**
     * Runs every pass and fails if any module error was reported.
     *
     * @throws ResolutionException if the graph has a dependency cycle
     * @throws MutatorException    if any pass reported module errors
     */
    public PipelineResult runOrThrow(ModuleGraph graph) throws ResolutionException, MutatorException {
        PipelineResult result = run(graph);
        if (!result.isSuccess()) {
            StringBuilder message = new StringBuilder("SDK pipeline failed with ")
                    .append(result.getErrors().size()).append(" error(s):");
            for (ModuleError error : result.getErrors()) {
                message.append("\n- ").append(error);
            }
            throw new MutatorException(message.toString(), result.getErrors());
        }
        return result;
    }

    private List<ModuleError> runGraphPass(ModuleGraph graph, Registration registration) {
        List<ModuleError> errors = new ArrayList<>();
        GraphMutatorContext ctx = new GraphMutatorContext() {
            @Override
            public ModuleGraph getGraph() {
                return graph;
            }

            @Override
            public String getPassName() {
                return registration.name;
            }

            @Override
            public void moduleError(ModuleNode module, String format, Object... args) {
                errors.add(ModuleError.moduleError(module, registration.name, String.format(format, args)));
            }
        };
        registration.graphMutator.mutate(ctx);
        return errors;
    }

    private List<ModuleError> runModulePass(ModuleGraph graph, Registration registration,
                                            ExecutorService executor, AtomicInteger visits)
            throws ResolutionException {
        List<List<ModuleNode>> levels = registration.kind == Kind.TOP_DOWN
                ? graph.topDownLevels()
                : graph.bottomUpLevels();

        List<ModuleMutatorContext> visited = new ArrayList<>();
        for (List<ModuleNode> level : levels) {
            List<ModuleMutatorContext> contexts = new ArrayList<>(level.size());
            for (ModuleNode module : level) {
                contexts.add(new ModuleMutatorContext(graph, module, registration.name));
            }
            if (executor != null && registration.parallel && contexts.size() > 1) {
                visitConcurrently(executor, registration, contexts);
            } else {
                contexts.forEach(ctx -> visit(registration, ctx));
            }
            visits.addAndGet(contexts.size());
            visited.addAll(contexts);
        }

        List<ModuleError> errors = new ArrayList<>();
        for (ModuleMutatorContext ctx : visited) {
            ctx.applyEdgeChanges();
            errors.addAll(ctx.getErrors());
        }
        return errors;
    }

    private void visitConcurrently(ExecutorService executor, Registration registration,
                                   List<ModuleMutatorContext> contexts) {
        List<Future<?>> futures = new ArrayList<>(contexts.size());
        for (ModuleMutatorContext ctx : contexts) {
            futures.add(executor.submit(() -> visit(registration, ctx)));
        }
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("pass " + registration.name + " interrupted");
            } catch (ExecutionException e) {
                throw new IllegalStateException("pass " + registration.name + " failed on module "
                        + contexts.get(i).getModule().getId(), e.getCause());
            }
        }
    }

    private void visit(Registration registration, ModuleMutatorContext ctx) {
        if (registration.kind == Kind.TOP_DOWN) {
            registration.topDownMutator.mutate(ctx);
        } else {
            registration.bottomUpMutator.mutate(ctx);
        }
    }

    private enum Kind { BOTTOM_UP, TOP_DOWN, GRAPH }

    private static final class Registration implements MutatorHandle {
        private final MutatorPhase phase;
        private final String name;
        private final Kind kind;
        private final BottomUpMutator bottomUpMutator;
        private final TopDownMutator topDownMutator;
        private final GraphMutator graphMutator;
        private boolean parallel;

        private Registration(MutatorPhase phase, String name, Kind kind, BottomUpMutator bottomUp,
                             TopDownMutator topDown, GraphMutator graphMutator) {
            this.phase = phase;
            this.name = name;
            this.kind = kind;
            this.bottomUpMutator = bottomUp;
            this.topDownMutator = topDown;
            this.graphMutator = graphMutator;
        }

        @Override
        public MutatorHandle parallel() {
            parallel = true;
            return this;
        }
    }

    private static final class PassThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "sdk-mutator-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /**
     * Builder for MutatorPipeline.
     */
    public static class Builder {
        private final List<Registration> registrations = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private int parallelism = 1;

        /**
         * Sets the number of threads used by parallel passes. 1 runs everything on the caller.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, but was: " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Registers the passes of one phase.
         */
        public Builder register(MutatorPhase phase, Consumer<RegisterMutatorsContext> registrar) {
            Objects.requireNonNull(phase, "phase cannot be null");
            registrar.accept(new RegisterMutatorsContext() {
                @Override
                public MutatorHandle bottomUp(String name, BottomUpMutator mutator) {
                    return add(new Registration(phase, name, Kind.BOTTOM_UP,
                            Objects.requireNonNull(mutator), null, null));
                }

                @Override
                public MutatorHandle topDown(String name, TopDownMutator mutator) {
                    return add(new Registration(phase, name, Kind.TOP_DOWN,
                            null, Objects.requireNonNull(mutator), null));
                }

                @Override
                public void graph(String name, GraphMutator mutator) {
                    add(new Registration(phase, name, Kind.GRAPH,
                            null, null, Objects.requireNonNull(mutator)));
                }
            });
            return this;
        }

        private Registration add(Registration registration) {
            if (!names.add(registration.name)) {
                throw new IllegalArgumentException("pass " + registration.name + " is already registered");
            }
            registrations.add(registration);
            return registration;
        }

        public MutatorPipeline build() {
            return new MutatorPipeline(this);
        }
    }
}
