package org.example.sdkgraph;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;
import org.example.sdkgraph.config.BuildDescription;
import org.example.sdkgraph.config.ConfigurationValidator;
import org.example.sdkgraph.config.DefaultsDeclaration;
import org.example.sdkgraph.config.LibraryDeclaration;
import org.example.sdkgraph.config.PackageDeclaration;
import org.example.sdkgraph.config.PipelineConfiguration;
import org.example.sdkgraph.config.SdkDeclaration;
import org.example.sdkgraph.exception.ConfigurationException;
import org.example.sdkgraph.exception.SdkGraphException;
import org.example.sdkgraph.graph.ModuleError;
import org.example.sdkgraph.graph.ModuleGraph;
import org.example.sdkgraph.graph.ModuleGraphLoader;
import org.example.sdkgraph.mutator.MutatorPipeline;
import org.example.sdkgraph.mutator.PipelineResult;

import java.util.List;

/**
 * Assigns SDK membership, propagates SDK requirements through the declared modules
 * and checks that every package only reaches members of the SDKs it uses.
 *
 * Usage: mvn sdkgraph:check
 */
@Mojo(name = "check", threadSafe = true)
public class CheckSdkRequirementsMojo extends AbstractMojo {

    // ========== Build Description ==========

    /**
     * SDK and SDK snapshot declarations.
     */
    @Parameter
    private List<SdkDeclaration> sdks;

    /**
     * Library declarations.
     */
    @Parameter
    private List<LibraryDeclaration> libraries;

    /**
     * Package declarations.
     */
    @Parameter
    private List<PackageDeclaration> packages;

    /**
     * Member list defaults shared between SDKs.
     */
    @Parameter
    private List<DefaultsDeclaration> defaults;

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    // ========== Optional Configuration ==========

    /**
     * Number of threads used to visit independent modules.
     */
    @Parameter(property = "sdkgraph.parallelism", defaultValue = "1")
    private int parallelism;

    /**
     * Whether to fail the build when module errors are reported.
     */
    @Parameter(property = "sdkgraph.failOnError", defaultValue = "true")
    private boolean failOnError;

    @Parameter(property = "sdkgraph.skip", defaultValue = "false")
    private boolean skip;

    // ========== Execution ==========

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("SDK requirement check skipped");
            return;
        }

        logBanner();

        PipelineResult result;
        try {
            PipelineConfiguration config = buildConfiguration();

            validateConfiguration(config);

            logConfigurationSummary(config);

            result = executeCheck(config);

        } catch (ConfigurationException e) {
            // Configuration errors always fail the build (ignore failOnError)
            logError("Configuration validation failed", e);
            throw new MojoExecutionException("Plugin configuration is invalid: " + e.getMessage(), e);

        } catch (SdkGraphException e) {
            logError("Module graph could not be processed", e);
            throw new MojoExecutionException("SDK check failed: " + e.getMessage(), e);
        }

        logResult(result);

        if (result.isSuccess()) {
            logSuccess();
        } else {
            handleModuleErrors(result);
        }
    }

    /**
     * Builds the plugin configuration from Mojo parameters.
     */
    private PipelineConfiguration buildConfiguration() {
        BuildDescription build = BuildDescription.builder()
                .sdks(sdks)
                .libraries(libraries)
                .packages(packages)
                .defaults(defaults)
                .build();

        return PipelineConfiguration.builder()
                .buildDescription(build)
                .parallelism(parallelism)
                .failOnError(failOnError)
                .skip(skip)
                .build();
    }

    private void validateConfiguration(PipelineConfiguration config) throws ConfigurationException {
        ConfigurationValidator validator = new ConfigurationValidator();
        validator.validateOrThrow(config);
        getLog().debug("Configuration validated successfully");
    }

    /**
     * Loads the module graph and runs every pass over it.
     */
    private PipelineResult executeCheck(PipelineConfiguration config) throws SdkGraphException {
        getLog().info("Loading module graph...");
        ModuleGraph graph = new ModuleGraphLoader().load(config.getBuildDescription());
        getLog().info("Loaded " + graph.getModuleCount() + " modules, " + graph.getDependencyCount() + " dependencies");

        MutatorPipeline pipeline = BuildPipelines.standard(config.getParallelism());
        getLog().info("Running passes: " + pipeline.getPassNames());
        PipelineResult result = pipeline.run(graph);

        if (getLog().isDebugEnabled()) {
            getLog().debug(graph.toDetailedString());
        }
        return result;
    }

    /**
     * Fails the build or warns, based on the failOnError flag.
     */
    private void handleModuleErrors(PipelineResult result) throws MojoFailureException {
        getLog().error("============================================================");
        getLog().error("SDK check found " + result.getErrors().size() + " error(s):");
        for (ModuleError error : result.getErrors()) {
            getLog().error("  " + error);
        }
        getLog().error("============================================================");

        if (failOnError) {
            throw new MojoFailureException("SDK check failed with " + result.getErrors().size() + " error(s)");
        } else {
            getLog().warn("SDK check failed but continuing build (failOnError=false)");
        }
    }

    // ========== Logging ==========

    private void logBanner() {
        getLog().info("============================================================");
        getLog().info("SDK Graph Maven Plugin - SDK Requirement Check");
        if (project != null) {
            getLog().info("Project: " + project.getGroupId() + ":" + project.getArtifactId() + ":" + project.getVersion());
        }
        getLog().info("============================================================");
    }

    private void logConfigurationSummary(PipelineConfiguration config) {
        BuildDescription build = config.getBuildDescription();
        getLog().info("Configuration:");
        getLog().info("  SDKs: " + build.getSdks().size());
        getLog().info("  Libraries: " + build.getLibraries().size());
        getLog().info("  Packages: " + build.getPackages().size());
        if (!build.getDefaults().isEmpty()) {
            getLog().info("  Defaults: " + build.getDefaults().size());
        }
        getLog().info("  Parallelism: " + config.getParallelism());
        getLog().info("  Fail on error: " + config.isFailOnError());
        getLog().info("============================================================");
    }

    private void logResult(PipelineResult result) {
        getLog().info("============================================================");
        getLog().info("Check Results:");
        getLog().info("  Passes run: " + result.getPasses().size());
        getLog().info("  Module visits: " + result.getModulesVisited());
        getLog().info("  Errors: " + result.getErrors().size());
        getLog().info("  Execution time: " + result.getExecutionTimeMs() + "ms");
        getLog().info("============================================================");
    }

    private void logSuccess() {
        getLog().info("SDK check completed successfully");
    }

    private void logError(String message, Exception e) {
        getLog().error("============================================================");
        getLog().error("SDK Check Failed: " + message);
        getLog().error("============================================================");
        getLog().error("Error: " + e.getMessage());
        if (getLog().isDebugEnabled()) {
            getLog().debug("Stack trace:", e);
        }
        getLog().error("============================================================");
    }
}
