package org.example.sdkgraph.config;

import org.example.sdkgraph.exception.ConfigurationException;
import org.example.sdkgraph.exception.InvalidSdkRefException;
import org.example.sdkgraph.module.LibraryKind;
import org.example.sdkgraph.sdk.SdkRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Validates plugin configuration parameters.
 *
 * <p>SDK naming rules ({@code name@version} for snapshots only) are not checked here;
 * the membership pass reports them against the SDK module.</p>
 */
public class ConfigurationValidator {

    private static final List<String> VALID_KINDS = Arrays.stream(LibraryKind.values())
            .map(LibraryKind::getTypeName)
            .collect(Collectors.toList());

    /**
     * Validates the plugin configuration.
     *
     * @param config the configuration to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(PipelineConfiguration config) {
        List<String> errors = new ArrayList<>();

        if (config.getParallelism() < 1) {
            errors.add("parallelism must be >= 1, but was: " + config.getParallelism());
        }

        BuildDescription build = config.getBuildDescription();
        if (build == null) {
            errors.add("build description is required");
            return errors;
        }

        validateNames(build, errors);
        validateSdks(build.getSdks(), errors);
        validateDefaults(build.getDefaults(), errors);
        validateLibraries(build.getLibraries(), errors);
        validatePackages(build.getPackages(), errors);

        return errors;
    }

    /**
     * Validates configuration and throws exception if invalid.
     *
     * @param config the configuration to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(PipelineConfiguration config) throws ConfigurationException {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid plugin configuration:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateNames(BuildDescription build, List<String> errors) {
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        List<String> names = new ArrayList<>();
        build.getSdks().forEach(d -> names.add(d.getName()));
        build.getDefaults().forEach(d -> names.add(d.getName()));
        build.getLibraries().forEach(d -> names.add(d.getName()));
        build.getPackages().forEach(d -> names.add(d.getName()));

        for (String name : names) {
            if (isBlank(name)) {
                continue;
            }
            if (!seen.add(name) && reported.add(name)) {
                errors.add("module name " + name + " is declared more than once");
            }
        }
    }

    private void validateSdks(List<SdkDeclaration> sdks, List<String> errors) {
        for (int i = 0; i < sdks.size(); i++) {
            SdkDeclaration sdk = sdks.get(i);
            String prefix = "sdks[" + i + "]";
            if (isBlank(sdk.getName())) {
                errors.add(prefix + ".name is required");
            }
            validateMemberLists(sdk, prefix, errors);
            validateEntries(sdk.getDefaults(), prefix + ".defaults", errors);
        }
    }

    private void validateDefaults(List<DefaultsDeclaration> defaults, List<String> errors) {
        for (int i = 0; i < defaults.size(); i++) {
            DefaultsDeclaration decl = defaults.get(i);
            String prefix = "defaults[" + i + "]";
            if (isBlank(decl.getName())) {
                errors.add(prefix + ".name is required");
            }
            validateMemberLists(decl, prefix, errors);
        }
    }

    private void validateLibraries(List<LibraryDeclaration> libraries, List<String> errors) {
        for (int i = 0; i < libraries.size(); i++) {
            LibraryDeclaration lib = libraries.get(i);
            String prefix = "libraries[" + i + "]";
            if (isBlank(lib.getName())) {
                errors.add(prefix + ".name is required");
            }
            if (LibraryKind.fromTypeName(lib.getKind()).isEmpty()) {
                errors.add(prefix + ".kind must be one of: " + VALID_KINDS + ", but was: " + lib.getKind());
            }
            if (lib.getSdkMemberName() != null
                    && lib.getSdkMemberName().indexOf(SdkRef.VERSION_SEPARATOR) >= 0) {
                errors.add(prefix + ".sdkMemberName must not contain a version, but was: " + lib.getSdkMemberName());
            }
            validateEntries(lib.getStaticLibs(), prefix + ".staticLibs", errors);
            validateEntries(lib.getSharedLibs(), prefix + ".sharedLibs", errors);
        }
    }

    private void validatePackages(List<PackageDeclaration> packages, List<String> errors) {
        for (int i = 0; i < packages.size(); i++) {
            PackageDeclaration pkg = packages.get(i);
            String prefix = "packages[" + i + "]";
            if (isBlank(pkg.getName())) {
                errors.add(prefix + ".name is required");
            }
            for (String ref : pkg.getUsesSdks()) {
                if (isBlank(ref)) {
                    errors.add(prefix + ".usesSdks contains empty entry");
                    continue;
                }
                try {
                    SdkRef.parse(ref.trim());
                } catch (InvalidSdkRefException e) {
                    errors.add(prefix + ".usesSdks: " + e.getMessage());
                }
            }
            validateEntries(pkg.getNativeSharedLibs(), prefix + ".nativeSharedLibs", errors);
            validateEntries(pkg.getJavaLibs(), prefix + ".javaLibs", errors);
            validateEntries(pkg.getExternalLibs(), prefix + ".externalLibs", errors);
        }
    }

    private void validateMemberLists(MemberListDeclaration decl, String prefix, List<String> errors) {
        for (MemberListDeclaration.NamedList list : decl.memberLists()) {
            validateEntries(list.getValues(), prefix + "." + list.getName(), errors);
        }
    }

    private void validateEntries(List<String> entries, String listName, List<String> errors) {
        if (entries == null) return;

        for (String entry : entries) {
            if (isBlank(entry)) {
                errors.add(listName + " contains empty entry");
            }
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
