package org.example.sdkgraph.config;

import java.util.Objects;

/**
 * Plugin configuration model.
 * Contains all configuration parameters of the SDK graph plugin.
 */
public class PipelineConfiguration {

    /**
     * The declared modules.
     */
    private BuildDescription buildDescription;

    /**
     * Number of threads used by parallel passes.
     * Default: 1
     */
    private int parallelism = 1;

    /**
     * Whether to fail the build when the pipeline reports module errors.
     * Default: true
     */
    private boolean failOnError = true;

    /**
     * Whether to skip the check altogether.
     * Default: false
     */
    private boolean skip = false;

    public PipelineConfiguration() {
    }

    public static Builder builder() {
        return new Builder();
    }

    public BuildDescription getBuildDescription() {
        return buildDescription;
    }

    public void setBuildDescription(BuildDescription buildDescription) {
        this.buildDescription = buildDescription;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    public boolean isFailOnError() {
        return failOnError;
    }

    public void setFailOnError(boolean failOnError) {
        this.failOnError = failOnError;
    }

    public boolean isSkip() {
        return skip;
    }

    public void setSkip(boolean skip) {
        this.skip = skip;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineConfiguration that = (PipelineConfiguration) o;
        return parallelism == that.parallelism &&
                failOnError == that.failOnError &&
                skip == that.skip &&
                Objects.equals(buildDescription, that.buildDescription);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buildDescription, parallelism, failOnError, skip);
    }

    @Override
    public String toString() {
        return "PipelineConfiguration{" +
                "buildDescription=" + buildDescription +
                ", parallelism=" + parallelism +
                ", failOnError=" + failOnError +
                ", skip=" + skip +
                '}';
    }

    /**
     * Builder for PipelineConfiguration.
     */
    public static class Builder {
        private final PipelineConfiguration config = new PipelineConfiguration();

        public Builder buildDescription(BuildDescription buildDescription) {
            config.setBuildDescription(buildDescription);
            return this;
        }

        public Builder parallelism(int parallelism) {
            config.setParallelism(parallelism);
            return this;
        }

        public Builder failOnError(boolean failOnError) {
            config.setFailOnError(failOnError);
            return this;
        }

        public Builder skip(boolean skip) {
            config.setSkip(skip);
            return this;
        }

        public PipelineConfiguration build() {
            return config;
        }
    }
}
