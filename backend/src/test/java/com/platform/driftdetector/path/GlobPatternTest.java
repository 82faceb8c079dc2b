package com.platform.driftdetector.path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GlobPatternTest {

    // =========================================================================
    //  Matching
    // =========================================================================

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("pattern without wildcard is an exact match")
        void exact() {
            GlobPattern pattern = GlobPattern.of("versioning.enabled");

            assertThat(pattern.isExact()).isTrue();
            assertThat(pattern.matches("versioning.enabled")).isTrue();
            assertThat(pattern.matches("versioning.enabledx")).isFalse();
            assertThat(pattern.matches("versioningXenabled")).isFalse();
        }

        @Test
        @DisplayName("* matches any run of characters, dots included")
        void star() {
            GlobPattern pattern = GlobPattern.of("*enabled");

            assertThat(pattern.matches("enabled")).isTrue();
            assertThat(pattern.matches("versioning.enabled")).isTrue();
            assertThat(pattern.matches("logging[0].enabled")).isTrue();
            assertThat(pattern.matches("enabled_at")).isFalse();
        }

        @Test
        @DisplayName("[*] matches any sequence index but nothing else")
        void anyIndex() {
            GlobPattern pattern = GlobPattern.of("ingress[*].cidr_blocks");

            assertThat(pattern.matches("ingress[0].cidr_blocks")).isTrue();
            assertThat(pattern.matches("ingress[12].cidr_blocks")).isTrue();
            assertThat(pattern.matches("ingress[x].cidr_blocks")).isFalse();
            assertThat(pattern.matches("ingress.cidr_blocks")).isFalse();
        }

        @Test
        @DisplayName("regex metacharacters in literals are matched literally")
        void literalMetacharacters() {
            GlobPattern pattern = GlobPattern.of("AWS::S3::*");

            assertThat(pattern.matches("AWS::S3::Bucket")).isTrue();
            assertThat(GlobPattern.of("a+b.*").matches("a+b.c")).isTrue();
            assertThat(GlobPattern.of("a+b.*").matches("aab.c")).isFalse();
        }

        @Test
        @DisplayName("matchesSubtree also accepts descendants of a matching path")
        void subtree() {
            GlobPattern pattern = GlobPattern.of("metadata.labels");

            assertThat(pattern.matchesSubtree("metadata.labels.app")).isTrue();
            assertThat(pattern.matchesSubtree("metadata.labels[\"app.kubernetes.io/name\"]")).isTrue();
            assertThat(pattern.matchesSubtree("metadata.name")).isFalse();
        }

        @Test
        @DisplayName("empty pattern is rejected")
        void empty() {
            assertThatThrownBy(() -> GlobPattern.of(""))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Specificity
    // =========================================================================

    @Nested
    @DisplayName("specificity")
    class Specificity {

        @Test
        @DisplayName("counts literal characters before the first wildcard")
        void literalPrefix() {
            assertThat(GlobPattern.of("aws_*").specificity()).isEqualTo(4);
            assertThat(GlobPattern.of("*").specificity()).isZero();
            assertThat(GlobPattern.of("tags").specificity()).isEqualTo(4);
        }

        @Test
        @DisplayName("the bracket of [*] is not part of the literal prefix")
        void indexWildcard() {
            assertThat(GlobPattern.of("ingress[*].cidr_blocks").specificity()).isEqualTo(7);
        }

        @Test
        @DisplayName("* alone is the match-all pattern")
        void matchAll() {
            assertThat(GlobPattern.of("*").isMatchAll()).isTrue();
            assertThat(GlobPattern.of("aws_*").isMatchAll()).isFalse();
        }
    }

    @Test
    @DisplayName("patterns are equal by their text")
    void equality() {
        assertThat(GlobPattern.of("a.*")).isEqualTo(GlobPattern.of("a.*"));
        assertThat(GlobPattern.of("a.*")).hasSameHashCodeAs(GlobPattern.of("a.*"));
        assertThat(GlobPattern.of("a.*").pattern()).isEqualTo("a.*");
    }
}
