package org.example.sdkgraph.graph;

import org.example.sdkgraph.config.BuildDescription;
import org.example.sdkgraph.config.DefaultsDeclaration;
import org.example.sdkgraph.config.LibraryDeclaration;
import org.example.sdkgraph.config.PackageDeclaration;
import org.example.sdkgraph.config.SdkDeclaration;
import org.example.sdkgraph.exception.ResolutionException;
import org.example.sdkgraph.module.DefaultsModule;
import org.example.sdkgraph.module.LibraryDependencyTag;
import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.module.LibraryModule;
import org.example.sdkgraph.module.PackageContentTag;
import org.example.sdkgraph.module.PackagingModule;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ModuleGraphLoader.
 */
class ModuleGraphLoaderTest {

    private ModuleGraphLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ModuleGraphLoader();
    }

    private static LibraryDeclaration library(String name) {
        LibraryDeclaration lib = new LibraryDeclaration();
        lib.setName(name);
        return lib;
    }

    private static SdkDeclaration sdk(String name, String... nativeLibs) {
        SdkDeclaration sdk = new SdkDeclaration();
        sdk.setName(name);
        sdk.setNativeSharedLibs(List.of(nativeLibs));
        return sdk;
    }

    @Test
    @DisplayName("should create one module per declaration")
    void shouldCreateModules() throws Exception {
        SdkDeclaration snapshot = sdk("mysdk@11", "mysdk_libfoo@11");
        snapshot.setSnapshot(true);
        LibraryDeclaration frozen = library("mysdk_libfoo@11");
        frozen.setSdkMemberName("libfoo");
        frozen.setKind("native_shared");
        LibraryDeclaration javaLib = library("core");
        javaLib.setKind("java_library");
        PackageDeclaration pkg = new PackageDeclaration();
        pkg.setName("P");
        pkg.setUsesSdks(List.of("mysdk@11"));

        ModuleGraph graph = loader.load(BuildDescription.builder()
                .sdk(sdk("mysdk", "libfoo"))
                .sdk(snapshot)
                .library(library("libfoo"))
                .library(frozen)
                .library(javaLib)
                .pkg(pkg)
                .build());

        assertThat(graph.getModuleCount()).isEqualTo(6);
        assertThat(graph.findModule("mysdk@11", "").orElseThrow())
                .isInstanceOf(SdkModule.class)
                .matches(m -> ((SdkModule) m).isSnapshot());
        LibraryModule frozenModule = (LibraryModule) graph.findModule("mysdk_libfoo@11", "").orElseThrow();
        assertThat(frozenModule.getMemberName()).isEqualTo("libfoo");
        assertThat(((LibraryModule) graph.findModule("core", "").orElseThrow()).getKind())
                .isEqualTo(LibraryKind.JAVA_IMPL);
        PackagingModule pkgModule = (PackagingModule) graph.findModule("P", "").orElseThrow();
        assertThat(pkgModule.getRequiredSdks().contains(SdkRef.parse("mysdk@11"))).isTrue();
    }

    @Test
    @DisplayName("should add declared edges but no membership edges")
    void shouldAddDeclaredEdges() throws Exception {
        LibraryDeclaration app = library("app");
        app.setStaticLibs(List.of("libstatic"));
        app.setSharedLibs(List.of("libshared"));
        PackageDeclaration pkg = new PackageDeclaration();
        pkg.setName("P");
        pkg.setNativeSharedLibs(List.of("app"));
        pkg.setExternalLibs(List.of("libshared"));

        ModuleGraph graph = loader.load(BuildDescription.builder()
                .sdk(sdk("mysdk", "libshared"))
                .library(app)
                .library(library("libstatic"))
                .library(library("libshared"))
                .pkg(pkg)
                .build());

        ModuleNode appNode = graph.findModule("app", "").orElseThrow();
        assertThat(graph.getDependenciesFrom(appNode))
                .extracting(Dependency::getTag)
                .containsExactly(LibraryDependencyTag.STATIC, LibraryDependencyTag.SHARED);
        ModuleNode pkgNode = graph.findModule("P", "").orElseThrow();
        assertThat(graph.getDependenciesFrom(pkgNode))
                .extracting(Dependency::getTag)
                .containsExactly(PackageContentTag.NATIVE_SHARED_LIB, PackageContentTag.EXTERNAL_LIB);
        assertThat(graph.getDependenciesFrom(graph.findModule("mysdk", "").orElseThrow())).isEmpty();
    }

    @Test
    @DisplayName("should link SDKs to their defaults")
    void shouldLinkDefaults() throws Exception {
        DefaultsDeclaration common = new DefaultsDeclaration();
        common.setName("common");
        common.setJavaLibs(List.of("core"));
        SdkDeclaration mysdk = sdk("mysdk");
        mysdk.setDefaults(List.of("common"));

        ModuleGraph graph = loader.load(BuildDescription.builder()
                .sdk(mysdk)
                .defaults(common)
                .build());

        Dependency edge = graph.getDependenciesFrom(graph.findModule("mysdk", "").orElseThrow()).get(0);
        assertThat(edge.getTag()).isSameAs(DefaultsDependencyTag.INSTANCE);
        assertThat(edge.getTarget()).isInstanceOf(DefaultsModule.class);
    }

    @Test
    @DisplayName("should report every undefined declared dependency")
    void shouldReportUndefinedDependencies() {
        LibraryDeclaration app = library("app");
        app.setStaticLibs(List.of("missing1"));
        PackageDeclaration pkg = new PackageDeclaration();
        pkg.setName("P");
        pkg.setJavaLibs(List.of("missing2"));

        assertThatThrownBy(() -> loader.load(BuildDescription.builder().library(app).pkg(pkg).build()))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("depends on undefined module \"missing1\"")
                .hasMessageContaining("depends on undefined module \"missing2\"");
    }

    @Test
    @DisplayName("should reject a name declared twice")
    void shouldRejectDuplicateName() {
        assertThatThrownBy(() -> loader.load(BuildDescription.builder()
                .library(library("libfoo"))
                .sdk(sdk("libfoo"))
                .build()))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("libfoo");
    }

    @Test
    @DisplayName("should reject an invalid SDK reference")
    void shouldRejectInvalidUsesSdks() {
        PackageDeclaration pkg = new PackageDeclaration();
        pkg.setName("P");
        pkg.setUsesSdks(List.of("mysdk@7x"));

        assertThatThrownBy(() -> loader.load(BuildDescription.builder().pkg(pkg).build()))
                .isInstanceOf(ResolutionException.class)
                .hasMessageContaining("version \"7x\" is neither a number nor \"current\"");
    }
}
