package org.example.sdkgraph.mutator;

import org.example.sdkgraph.exception.MutatorException;
import org.example.sdkgraph.exception.ResolutionException;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.ModuleError;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleNode;
import org.example.sdkgraph.module.LibraryDependencyTag;
import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.module.LibraryModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MutatorPipeline.
 */
class MutatorPipelineTest {

    private ModuleGraph graph;
    private LibraryModule app;
    private LibraryModule libA;
    private LibraryModule libB;

    @BeforeEach
    void setUp() {
        graph = new ModuleGraph();
        app = new LibraryModule("app", LibraryKind.NATIVE_SHARED);
        libA = new LibraryModule("liba", LibraryKind.NATIVE_SHARED);
        libB = new LibraryModule("libb", LibraryKind.NATIVE_SHARED);
        graph.addModule(app);
        graph.addModule(libA);
        graph.addModule(libB);
        graph.addDependency(app, LibraryDependencyTag.STATIC, libA);
        graph.addDependency(libA, LibraryDependencyTag.STATIC, libB);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should run passes by phase, then by registration order")
        void shouldOrderByPhase() throws ResolutionException {
            List<String> ran = new ArrayList<>();
            MutatorPipeline pipeline = MutatorPipeline.builder()
                    .register(MutatorPhase.POST_DEPS, ctx -> ctx.graph("post", c -> ran.add("post")))
                    .register(MutatorPhase.PRE_DEPS, ctx -> {
                        ctx.graph("pre1", c -> ran.add("pre1"));
                        ctx.graph("pre2", c -> ran.add("pre2"));
                    })
                    .register(MutatorPhase.DEFAULTS, ctx -> ctx.graph("defaults", c -> ran.add("defaults")))
                    .register(MutatorPhase.PACKAGING, ctx -> ctx.graph("packaging", c -> ran.add("packaging")))
                    .build();

            PipelineResult result = pipeline.run(graph);

            assertThat(ran).containsExactly("defaults", "pre1", "pre2", "packaging", "post");
            assertThat(pipeline.getPassNames()).isEqualTo(ran);
            assertThat(result.getPasses()).isEqualTo(ran);
        }

        @Test
        @DisplayName("bottom-up passes should visit dependencies before dependents")
        void bottomUpShouldVisitDependenciesFirst() throws ResolutionException {
            List<String> visited = new ArrayList<>();
            MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.bottomUp("visit", c -> visited.add(c.getModuleName())))
                    .build()
                    .run(graph);

            assertThat(visited).containsExactly("libb", "liba", "app");
        }

        @Test
        @DisplayName("top-down passes should visit dependents before dependencies")
        void topDownShouldVisitDependentsFirst() throws ResolutionException {
            List<String> visited = new ArrayList<>();
            MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.topDown("visit", c -> visited.add(c.getModuleName())))
                    .build()
                    .run(graph);

            assertThat(visited).containsExactly("app", "liba", "libb");
        }

        @Test
        @DisplayName("should reject a pass name registered twice")
        void shouldRejectDuplicatePassName() {
            MutatorPipeline.Builder builder = MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.graph("same", c -> { }));

            assertThatThrownBy(() -> builder.register(MutatorPhase.POST_DEPS, ctx -> ctx.graph("same", c -> { })))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("same");
        }

        @Test
        @DisplayName("should reject parallelism below one")
        void shouldRejectInvalidParallelism() {
            assertThatThrownBy(() -> MutatorPipeline.builder().parallelism(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Edge Changes")
    class EdgeChanges {

        @Test
        @DisplayName("should apply added edges only after the pass")
        void shouldApplyAfterPass() throws ResolutionException {
            LibraryModule extra = new LibraryModule("extra", LibraryKind.NATIVE_SHARED);
            graph.addModule(extra);
            List<Integer> appEdgesSeen = new ArrayList<>();

            MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.bottomUp("add", c -> {
                        if (c.getModule().equals(libB)) {
                            c.addReverseDependency(LibraryDependencyTag.SHARED, "app");
                        }
                        if (c.getModule().equals(app)) {
                            appEdgesSeen.add(c.getDirectDependencies().size());
                            c.addDependency(LibraryDependencyTag.STATIC, "extra");
                        }
                    }))
                    .build()
                    .run(graph);

            assertThat(appEdgesSeen).containsExactly(1);
            assertThat(graph.getDependenciesFrom(app))
                    .extracting(Dependency::getTarget)
                    .containsExactlyInAnyOrder(libA, libB, extra);
        }

        @Test
        @DisplayName("should report undefined modules and self dependencies on the visited module")
        void shouldReportInvalidEdges() throws ResolutionException {
            PipelineResult result = MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.bottomUp("bad", c -> {
                        if (c.getModule().equals(libA)) {
                            c.addDependency(LibraryDependencyTag.STATIC, "nowhere");
                            c.addReverseDependency(LibraryDependencyTag.STATIC, "liba");
                            c.addReverseDependency(LibraryDependencyTag.STATIC, "ghost");
                        }
                    }))
                    .build()
                    .run(graph);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getErrorsFor("liba"))
                    .extracting(ModuleError::getMessage)
                    .containsExactly(
                            "depends on undefined module \"nowhere\"",
                            "module \"liba\" cannot depend on itself",
                            "reverse dependency from undefined module \"ghost\"");
            assertThat(graph.getDependencyCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("should keep visiting after an error")
        void shouldKeepVisiting() throws ResolutionException {
            List<String> visited = new ArrayList<>();
            PipelineResult result = MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.topDown("fails", c -> {
                        visited.add(c.getModuleName());
                        c.propertyError("name", "bad %s", c.getModuleName());
                    }))
                    .register(MutatorPhase.POST_DEPS, ctx -> ctx.topDown("next", c -> visited.add("next")))
                    .build()
                    .run(graph);

            assertThat(visited).containsExactly("app", "liba", "libb", "next", "next", "next");
            assertThat(result.getErrors()).hasSize(3);
            assertThat(result.getErrors().get(0))
                    .hasToString("module \"app\" [fails]: name: bad app");
        }

        @Test
        @DisplayName("runOrThrow should list every error")
        void runOrThrowShouldListErrors() {
            MutatorPipeline pipeline = MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.topDown("fails", c -> c.moduleError("broken")))
                    .build();

            assertThatThrownBy(() -> pipeline.runOrThrow(graph))
                    .isInstanceOf(MutatorException.class)
                    .hasMessageContaining("3 error(s)")
                    .satisfies(e -> assertThat(((MutatorException) e).getErrors()).hasSize(3));
        }

        @Test
        @DisplayName("should fail on a dependency cycle")
        void shouldFailOnCycle() {
            graph.addDependency(libB, LibraryDependencyTag.STATIC, app);
            MutatorPipeline pipeline = MutatorPipeline.builder()
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.topDown("visit", c -> { }))
                    .build();

            assertThatThrownBy(() -> pipeline.run(graph))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("dependency cycle");
        }
    }

    @Nested
    @DisplayName("Parallel Execution")
    class ParallelExecution {

        @Test
        @DisplayName("should visit every module exactly once per pass")
        void shouldVisitEveryModuleOnce() throws ResolutionException {
            ModuleGraph wide = new ModuleGraph();
            LibraryModule root = new LibraryModule("root", LibraryKind.NATIVE_SHARED);
            wide.addModule(root);
            for (int i = 0; i < 50; i++) {
                LibraryModule leaf = new LibraryModule("leaf" + i, LibraryKind.NATIVE_SHARED);
                wide.addModule(leaf);
                wide.addDependency(root, LibraryDependencyTag.STATIC, leaf);
            }
            Set<String> threads = ConcurrentHashMap.newKeySet();
            List<String> visited = Collections.synchronizedList(new ArrayList<>());

            PipelineResult result = MutatorPipeline.builder()
                    .parallelism(4)
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.bottomUp("visit", c -> {
                        threads.add(Thread.currentThread().getName());
                        visited.add(c.getModuleName());
                        if (!c.getModuleName().equals("root")) {
                            c.addReverseDependency(LibraryDependencyTag.SHARED, "root");
                        }
                    }).parallel())
                    .build()
                    .run(wide);

            assertThat(visited).hasSize(51).doesNotHaveDuplicates();
            assertThat(visited.get(50)).isEqualTo("root");
            assertThat(result.getModulesVisited()).isEqualTo(51);
            assertThat(wide.getDependencyCount()).isEqualTo(100);
            assertThat(threads).anyMatch(name -> name.startsWith("sdk-mutator-"));
        }

        @Test
        @DisplayName("should apply edge changes in visiting order")
        void shouldApplyInOrder() throws ResolutionException {
            ModuleGraph wide = new ModuleGraph();
            List<ModuleNode> leaves = new ArrayList<>();
            LibraryModule root = new LibraryModule("root", LibraryKind.NATIVE_SHARED);
            wide.addModule(root);
            for (int i = 0; i < 20; i++) {
                LibraryModule leaf = new LibraryModule("leaf" + i, LibraryKind.NATIVE_SHARED);
                wide.addModule(leaf);
                leaves.add(leaf);
            }

            MutatorPipeline.builder()
                    .parallelism(4)
                    .register(MutatorPhase.PRE_DEPS, ctx -> ctx.bottomUp("link", c -> {
                        if (!c.getModuleName().equals("root")) {
                            c.addReverseDependency(LibraryDependencyTag.STATIC, "root");
                        }
                    }).parallel())
                    .build()
                    .run(wide);

            assertThat(wide.getDependenciesFrom(root))
                    .extracting(Dependency::getTarget)
                    .containsExactlyElementsOf(leaves);
        }
    }
}
