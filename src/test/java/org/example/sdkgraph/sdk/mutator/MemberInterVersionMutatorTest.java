package org.example.sdkgraph.sdk.mutator;

import org.example.sdkgraph.exception.ResolutionException;
import org.example.sdkgraph.graph.Dependency;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.module.LibraryModule;
import org.example.sdkgraph.mutator.MutatorPhase;
import org.example.sdkgraph.mutator.MutatorPipeline;
import org.example.sdkgraph.mutator.PipelineResult;
import org.example.sdkgraph.sdk.MemberListRegistry;
import org.example.sdkgraph.sdk.SdkMemberVersionedDependencyTag;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkProperties;
import org.example.sdkgraph.sdk.SdkRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MemberInterVersionMutator.
 */
class MemberInterVersionMutatorTest {

    private ModuleGraph graph;
    private LibraryModule libfoo;

    @BeforeEach
    void setUp() {
        graph = new ModuleGraph();
        libfoo = new LibraryModule("libfoo", LibraryKind.NATIVE_SHARED);
        graph.addModule(libfoo);
        graph.addModule(SdkModule.sdk("mysdk", SdkProperties.builder().nativeSharedLibs(List.of("libfoo")).build()));
    }

    private LibraryModule frozen(String name, String variant) {
        LibraryModule module = LibraryModule.builder().name(name).variant(variant).sdkMemberName("libfoo").build();
        graph.addModule(module);
        return module;
    }

    private PipelineResult runPreDeps() throws ResolutionException {
        return MutatorPipeline.builder()
                .register(MutatorPhase.PRE_DEPS,
                        ctx -> SdkMutators.registerPreDepsMutators(ctx, MemberListRegistry.defaultRegistry()))
                .build()
                .run(graph);
    }

    @Test
    @DisplayName("should link the in-development member to each snapshot version")
    void shouldLinkVersions() throws ResolutionException {
        LibraryModule v11 = frozen("mysdk_libfoo@11", "");
        LibraryModule v12 = frozen("mysdk_libfoo@12", "");
        graph.addModule(SdkModule.snapshot("mysdk@11",
                SdkProperties.builder().nativeSharedLibs(List.of("mysdk_libfoo@11")).build()));
        graph.addModule(SdkModule.snapshot("mysdk@12",
                SdkProperties.builder().nativeSharedLibs(List.of("mysdk_libfoo@12")).build()));

        PipelineResult result = runPreDeps();

        assertThat(result.isSuccess()).isTrue();
        List<Dependency> edges = graph.getDependenciesFrom(libfoo);
        assertThat(edges).extracting(Dependency::getTarget).containsExactlyInAnyOrder(v11, v12);
        assertThat(edges).extracting(Dependency::getTag).containsExactlyInAnyOrder(
                new SdkMemberVersionedDependencyTag("libfoo", "11"),
                new SdkMemberVersionedDependencyTag("libfoo", "12"));
    }

    @Test
    @DisplayName("should not link members of the unversioned SDK")
    void shouldSkipUnversioned() throws ResolutionException {
        PipelineResult result = runPreDeps();

        assertThat(result.isSuccess()).isTrue();
        assertThat(graph.getDependenciesFrom(libfoo)).isEmpty();
    }

    @Test
    @DisplayName("should not link modules outside any SDK")
    void shouldSkipNonMembers() throws ResolutionException {
        LibraryModule loose = frozen("mysdk_libfoo@11", "");

        runPreDeps();

        assertThat(loose.isInAnySdk()).isFalse();
        assertThat(graph.getDependenciesTo(loose)).isEmpty();
    }

    @Test
    @DisplayName("should prefer the member in the same variant")
    void shouldPreferSameVariant() throws Exception {
        LibraryModule libfooCopy = LibraryModule.builder().name("libfoo").variant("package:P").build();
        graph.addModule(libfooCopy);
        LibraryModule v11Copy = frozen("mysdk_libfoo@11", "package:P");
        v11Copy.makeMemberOf(SdkRef.parse("mysdk@11"));

        MutatorPipeline.builder()
                .register(MutatorPhase.PRE_DEPS,
                        ctx -> ctx.bottomUp(SdkMutators.MEMBER_INTER_VERSION, new MemberInterVersionMutator()))
                .build()
                .run(graph);

        assertThat(graph.getDependenciesFrom(libfooCopy)).extracting(Dependency::getTarget).containsExactly(v11Copy);
        assertThat(graph.getDependenciesFrom(libfoo)).isEmpty();
    }

    @Test
    @DisplayName("a versioned member named like its member name cannot depend on itself")
    void shouldReportSelfLink() throws Exception {
        graph.addModule(SdkModule.snapshot("mysdk@11",
                SdkProperties.builder().javaLibs(List.of("core")).build()));
        graph.addModule(new LibraryModule("core", LibraryKind.JAVA_IMPL));

        PipelineResult result = runPreDeps();

        assertThat(result.getErrorsFor("core")).singleElement()
                .satisfies(e -> assertThat(e.getMessage()).isEqualTo("module \"core\" cannot depend on itself"));
    }
}
