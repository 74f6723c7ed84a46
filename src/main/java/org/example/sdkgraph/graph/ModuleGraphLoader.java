package org.example.sdkgraph.graph;

import org.example.sdkgraph.config.BuildDescription;
import org.example.sdkgraph.config.DefaultsDeclaration;
import org.example.sdkgraph.config.LibraryDeclaration;
import org.example.sdkgraph.config.PackageDeclaration;
import org.example.sdkgraph.config.SdkDeclaration;
import org.example.sdkgraph.exception.InvalidSdkRefException;
import org.example.sdkgraph.exception.ResolutionException;
import org.example.sdkgraph.module.DefaultsModule;
import org.example.sdkgraph.module.LibraryDependencyTag;
import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.module.LibraryModule;
import org.example.sdkgraph.module.PackageContentTag;
import org.example.sdkgraph.module.PackagingModule;
import org.example.sdkgraph.sdk.SdkModule;
import org.example.sdkgraph.sdk.SdkRef;
import org.example.sdkgraph.sdk.SdkRefs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a module graph from a build description.
 *
 * <p>Only declared edges are added: library static and shared libraries, package
 * contents and SDK defaults. Membership edges from SDKs to their members are added
 * by the membership pass, which reports unknown members against the SDK.</p>
 */
public class ModuleGraphLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleGraphLoader.class);

    /**
     * Loads all declared modules and edges.
     *
     * @throws ResolutionException if a declared edge names an undefined module,
     *                             a name is declared twice or an SDK reference is invalid
     */
    public ModuleGraph load(BuildDescription build) throws ResolutionException {
        log.debug("Loading {}", build);
        ModuleGraph graph = new ModuleGraph();

        for (SdkDeclaration decl : build.getSdks()) {
            String name = decl.getName().trim();
            SdkModule sdk = decl.isSnapshot()
                    ? SdkModule.snapshot(name, decl.toSdkProperties(), decl.getDefaults())
                    : SdkModule.sdk(name, decl.toSdkProperties(), decl.getDefaults());
            addModule(graph, sdk);
        }
        for (DefaultsDeclaration decl : build.getDefaults()) {
            addModule(graph, new DefaultsModule(decl.getName().trim(), decl.toSdkProperties()));
        }
        for (LibraryDeclaration decl : build.getLibraries()) {
            addModule(graph, toLibrary(decl));
        }
        for (PackageDeclaration decl : build.getPackages()) {
            addModule(graph, toPackage(decl));
        }

        List<String> undefined = new ArrayList<>();
        for (ModuleNode module : graph.getModules()) {
            if (module instanceof SdkModule) {
                SdkModule sdk = (SdkModule) module;
                link(graph, sdk, "defaults", sdk.getDefaults(), DefaultsDependencyTag.INSTANCE, undefined);
            } else if (module instanceof LibraryModule) {
                LibraryModule lib = (LibraryModule) module;
                link(graph, lib, "staticLibs", lib.getStaticLibs(), LibraryDependencyTag.STATIC, undefined);
                link(graph, lib, "sharedLibs", lib.getSharedLibs(), LibraryDependencyTag.SHARED, undefined);
            } else if (module instanceof PackagingModule) {
                PackagingModule pkg = (PackagingModule) module;
                link(graph, pkg, "nativeSharedLibs", pkg.getNativeSharedLibs(),
                        PackageContentTag.NATIVE_SHARED_LIB, undefined);
                link(graph, pkg, "javaLibs", pkg.getJavaLibs(), PackageContentTag.JAVA_LIB, undefined);
                link(graph, pkg, "externalLibs", pkg.getExternalLibs(), PackageContentTag.EXTERNAL_LIB, undefined);
            }
        }

        if (!undefined.isEmpty()) {
            throw new ResolutionException("Undefined module references:\n- " + String.join("\n- ", undefined));
        }

        log.info("Loaded {} modules and {} dependencies", graph.getModuleCount(), graph.getDependencyCount());
        return graph;
    }

    private LibraryModule toLibrary(LibraryDeclaration decl) throws ResolutionException {
        LibraryKind kind = LibraryKind.fromTypeName(decl.getKind())
                .orElseThrow(() -> new ResolutionException(
                        "library \"" + decl.getName() + "\" has unknown kind: " + decl.getKind()));
        String memberName = decl.getSdkMemberName();
        return LibraryModule.builder()
                .name(decl.getName().trim())
                .kind(kind)
                .sdkMemberName(memberName == null || memberName.isBlank() ? null : memberName.trim())
                .staticLibs(trimAll(decl.getStaticLibs()))
                .sharedLibs(trimAll(decl.getSharedLibs()))
                .build();
    }

    private PackagingModule toPackage(PackageDeclaration decl) throws ResolutionException {
        List<SdkRef> refs = new ArrayList<>();
        for (String ref : decl.getUsesSdks()) {
            try {
                refs.add(SdkRef.parse(ref.trim()));
            } catch (InvalidSdkRefException e) {
                throw new ResolutionException("package \"" + decl.getName() + "\" usesSdks: " + e.getMessage(), e);
            }
        }
        return new PackagingModule(decl.getName().trim(), ModuleNode.DEFAULT_VARIANT,
                SdkRefs.of(refs),
                trimAll(decl.getNativeSharedLibs()),
                trimAll(decl.getJavaLibs()),
                trimAll(decl.getExternalLibs()));
    }

    private void addModule(ModuleGraph graph, ModuleNode module) throws ResolutionException {
        try {
            graph.addModule(module);
        } catch (IllegalArgumentException e) {
            throw new ResolutionException(e.getMessage(), e);
        }
    }

    private void link(ModuleGraph graph, ModuleNode source, String property, List<String> names,
                      DependencyTag tag, List<String> undefined) {
        for (String name : names) {
            Optional<ModuleNode> target = graph.findModule(name, ModuleNode.DEFAULT_VARIANT);
            if (target.isPresent()) {
                graph.addDependency(source, tag, target.get());
            } else {
                undefined.add(source.getTypeName() + " \"" + source.getName() + "\" " + property
                        + ": depends on undefined module \"" + name + "\"");
            }
        }
    }

    private static List<String> trimAll(List<String> names) {
        List<String> trimmed = new ArrayList<>(names.size());
        for (String name : names) {
            trimmed.add(name.trim());
        }
        return trimmed;
    }
}
