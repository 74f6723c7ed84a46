package org.example.sdkgraph;

import org.example.sdkgraph.mutator.MutatorPipeline;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BuildPipelines.
 */
class BuildPipelinesTest {

    @Test
    @DisplayName("standard pipeline should run defaults, SDK membership, packaging, then SDK requirements")
    void shouldOrderPasses() {
        MutatorPipeline pipeline = BuildPipelines.standard(3);

        assertThat(pipeline.getParallelism()).isEqualTo(3);
        assertThat(pipeline.getPassNames()).containsExactly(
                "defaults",
                "SdkMember",
                "SdkMember_deps",
                "SdkMemberInterVersion",
                "packaging_variants",
                "SdkDepsMutator",
                "SdkDepsReplaceMutator",
                "SdkRequirementCheck");
    }
}
