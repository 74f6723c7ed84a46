package org.example.sdkgraph.sdk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SdkProperties.
 */
class SdkPropertiesTest {

    @Test
    @DisplayName("should trim entries and drop blank or null ones")
    void shouldNormalizeEntries() {
        SdkProperties props = SdkProperties.builder()
                .javaLibs(Arrays.asList(" core ", "", null, "   ", "extra"))
                .build();

        assertThat(props.getJavaLibs()).containsExactly("core", "extra");
    }

    @Test
    @DisplayName("should keep declaration order and drop duplicates")
    void shouldKeepOrder() {
        SdkProperties props = SdkProperties.builder()
                .nativeSharedLibs(List.of("libz", "liba", "libz"))
                .build();

        assertThat(props.getNativeSharedLibs()).containsExactly("libz", "liba");
    }

    @Test
    @DisplayName("should count members of all lists")
    void shouldCountMembers() {
        SdkProperties props = SdkProperties.builder()
                .nativeSharedLibs(List.of("libfoo"))
                .javaHeaderLibs(List.of("framework-stubs"))
                .javaLibs(List.of("core", "extra"))
                .stubsSources(List.of("api-stubs"))
                .build();

        assertThat(props.getMemberCount()).isEqualTo(5);
        assertThat(SdkProperties.empty().getMemberCount()).isZero();
    }

    @Test
    @DisplayName("withDefaults should place defaults first in list order")
    void withDefaultsShouldPrepend() {
        SdkProperties own = SdkProperties.builder().javaLibs(List.of("mine")).build();
        SdkProperties first = SdkProperties.builder().javaLibs(List.of("a")).stubsSources(List.of("s")).build();
        SdkProperties second = SdkProperties.builder().javaLibs(List.of("b", "mine")).build();

        SdkProperties merged = own.withDefaults(List.of(first, second));

        assertThat(merged.getJavaLibs()).containsExactly("a", "b", "mine");
        assertThat(merged.getStubsSources()).containsExactly("s");
        assertThat(own.getJavaLibs()).containsExactly("mine");
    }
}
