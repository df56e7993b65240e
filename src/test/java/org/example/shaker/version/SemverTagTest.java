package org.example.shaker.version;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SemverTag.
 */
class SemverTagTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("should parse release tag")
        void shouldParseReleaseTag() {
            SemverTag tag = SemverTag.parse("v1.2.3");

            assertThat(tag.getMajor()).isEqualTo(1);
            assertThat(tag.getMinor()).isEqualTo(2);
            assertThat(tag.getPatch()).isEqualTo(3);
            assertThat(tag.getPostfix()).isNull();
            assertThat(tag.getVersion()).isEqualTo("1.2.3");
        }

        @Test
        @DisplayName("should parse semver prerelease tag")
        void shouldParseSemverPrerelease() {
            SemverTag tag = SemverTag.parse("v1.2.3-prerelease_tag1");

            assertThat(tag.getMajor()).isEqualTo(1);
            assertThat(tag.getPatch()).isEqualTo(3);
            assertThat(tag.getPostfix()).isEqualTo("prerelease_tag1");
        }

        @Test
        @DisplayName("should parse non-semver prerelease suffix")
        void shouldParseLenientPrerelease() {
            SemverTag tag = SemverTag.parse("v1.2.3rc1");

            assertThat(tag.getMinor()).isEqualTo(2);
            assertThat(tag.getPostfix()).isEqualTo("rc1");
            assertThat(tag.isPrerelease()).isTrue();
        }

        @ParameterizedTest
        @ValueSource(strings = {"v1.2.3ijidsja", "v3.3.3notsemver", "notathing", "v1.2", "master", ""})
        @DisplayName("should leave every field null for non-semver tags")
        void shouldLeaveFieldsNullForGarbage(String value) {
            SemverTag tag = SemverTag.parse(value);

            assertThat(tag.getMajor()).isNull();
            assertThat(tag.getMinor()).isNull();
            assertThat(tag.getPatch()).isNull();
            assertThat(tag.getPostfix()).isNull();
            assertThat(tag.isSemver()).isFalse();
        }

        @Test
        @DisplayName("should not treat tags without leading v as versions")
        void shouldRejectTagsWithoutV() {
            assertThat(SemverTag.parse("2.0.1").isSemver()).isFalse();
            assertThat(SemverTag.parse("2.2.2-prerelease").isSemver()).isFalse();
            assertThat(SemverTag.isTagRelease("1.0.0")).isFalse();
        }
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @ParameterizedTest
        @CsvSource({
                "v1.0.0, true, false",
                "v1.0.0-rc.1, false, true",
                "v1.0.0beta2, false, true",
                "v1.0.0junk, false, false",
                "my-branch, false, false"
        })
        @DisplayName("should classify release and prerelease tags")
        void shouldClassifyTags(String tag, boolean release, boolean prerelease) {
            assertThat(SemverTag.isTagRelease(tag)).isEqualTo(release);
            assertThat(SemverTag.isTagPrerelease(tag)).isEqualTo(prerelease);
        }
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("should order numerically on major, minor, patch")
        void shouldOrderNumerically() {
            List<SemverTag> tags = new ArrayList<>(List.of(
                    SemverTag.parse("v1.10.0"),
                    SemverTag.parse("v1.2.0"),
                    SemverTag.parse("v1.9.9"),
                    SemverTag.parse("v0.1.0")));

            Collections.sort(tags);

            assertThat(tags.stream().map(SemverTag::getTag).collect(Collectors.toList()))
                    .containsExactly("v0.1.0", "v1.2.0", "v1.9.9", "v1.10.0");
        }

        @Test
        @DisplayName("should sort prerelease below its release")
        void shouldSortPrereleaseBelowRelease() {
            assertThat(SemverTag.parse("v2.0.0-rc1")).isLessThan(SemverTag.parse("v2.0.0"));
            assertThat(SemverTag.parse("v2.0.0-rc1")).isGreaterThan(SemverTag.parse("v1.9.9"));
        }

        @Test
        @DisplayName("should refuse to order non-semver tags")
        void shouldRefuseToOrderGarbage() {
            assertThatThrownBy(() -> SemverTag.parse("master").compareTo(SemverTag.parse("v1.0.0")))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
