package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.enumerations.VersionComparison;
import com.lyshra.open.template.integration.exception.InvalidVersionFormatException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SemanticVersion}.
 */
class SemanticVersionTest {

    // ========================================================================
    // PARSING TESTS
    // ========================================================================

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("should parse all components")
        void shouldParseAllComponents() {
            SemanticVersion version = SemanticVersion.parse("1.2.3-beta.1+build.123");

            assertEquals(1, version.getMajor());
            assertEquals(2, version.getMinor());
            assertEquals(3, version.getPatch());
            assertEquals("beta.1", version.getPreRelease().orElseThrow());
            assertEquals("build.123", version.getBuildMetadata().orElseThrow());
            assertTrue(version.isPreRelease());
            assertFalse(version.isStable());
        }

        @Test
        @DisplayName("should parse plain release")
        void shouldParsePlainRelease() {
            SemanticVersion version = SemanticVersion.parse("10.0.7");

            assertTrue(version.getPreRelease().isEmpty());
            assertTrue(version.getBuildMetadata().isEmpty());
            assertTrue(version.isStable());
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.2.3", "0.0.0", "1.0.0-alpha", "1.0.0-rc.1", "2.1.0+20240101",
                "1.0.0-x-y.7+meta-data.1", "3.4.5-0.3.7"})
        @DisplayName("toVersionString should be the inverse of parse")
        void shouldRoundTrip(String text) {
            assertEquals(text, SemanticVersion.parse(text).toVersionString());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "1", "1.2", "1.2.3.4", "v1.2.3", "1.2.x", "-1.2.3", "1.2.3-", "1.2.3+",
                "1.2.3-beta..1", "01.2.3", " 1.2.3", "1.2.3-beta!"})
        @DisplayName("should reject malformed versions")
        void shouldRejectMalformed(String text) {
            InvalidVersionFormatException exception =
                    assertThrows(InvalidVersionFormatException.class, () -> SemanticVersion.parse(text));
            assertEquals(text, exception.getInput());
            assertFalse(SemanticVersion.isValid(text));
        }

        @ParameterizedTest
        @ValueSource(strings = {"1.0.0-alpha.01", "1.0.0-00", "1.0.0-rc.007"})
        @DisplayName("should reject numeric pre-release identifiers with leading zeros")
        void shouldRejectLeadingZeroPreReleaseIdentifiers(String text) {
            assertThrows(InvalidVersionFormatException.class, () -> SemanticVersion.parse(text));
        }

        @Test
        @DisplayName("should accept zero and alphanumeric identifiers starting with zero")
        void shouldAcceptZeroPrefixedAlphanumericIdentifiers() {
            SemanticVersion zero = SemanticVersion.parse("1.0.0-alpha.0");
            SemanticVersion alphanumeric = SemanticVersion.parse("1.0.0-alpha.01a");

            assertEquals("alpha.0", zero.getPreRelease().orElseThrow());
            assertEquals("alpha.01a", alphanumeric.getPreRelease().orElseThrow());
            assertTrue(zero.compareTo(alphanumeric) < 0);
        }

        @Test
        @DisplayName("equal precedence should imply equality and equal hash codes")
        void equalPrecedenceShouldImplyEquality() {
            SemanticVersion a = SemanticVersion.parse("1.0.0-alpha.1");
            SemanticVersion b = SemanticVersion.parse("1.0.0-alpha.1+build.9");

            assertEquals(0, a.compareTo(b));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertThrows(InvalidVersionFormatException.class, () -> SemanticVersion.parse(null));
        }

        @Test
        @DisplayName("should reject numeric parts beyond int range")
        void shouldRejectOverflow() {
            assertThrows(InvalidVersionFormatException.class, () -> SemanticVersion.parse("99999999999.0.0"));
        }
    }

    // ========================================================================
    // COMPARISON TESTS
    // ========================================================================

    @Nested
    @DisplayName("Comparison")
    class ComparisonTests {

        @Test
        @DisplayName("should compare numeric parts numerically")
        void shouldCompareNumerically() {
            assertEquals(VersionComparison.LESS_THAN, compare("1.2.3", "1.10.0"));
            assertEquals(VersionComparison.GREATER_THAN, compare("2.0.0", "1.99.99"));
            assertEquals(VersionComparison.LESS_THAN, compare("1.0.9", "1.0.10"));
            assertEquals(VersionComparison.EQUAL, compare("1.2.3", "1.2.3"));
        }

        @Test
        @DisplayName("release should outrank its pre-releases")
        void releaseShouldOutrankPreRelease() {
            assertEquals(VersionComparison.GREATER_THAN, compare("1.0.0", "1.0.0-rc.1"));
            assertEquals(VersionComparison.LESS_THAN, compare("1.0.0-alpha", "1.0.0"));
        }

        @Test
        @DisplayName("should follow SemVer pre-release precedence")
        void shouldFollowPreReleasePrecedence() {
            List<String> expected = List.of(
                    "1.0.0-alpha", "1.0.0-alpha.1", "1.0.0-alpha.beta", "1.0.0-beta",
                    "1.0.0-beta.2", "1.0.0-beta.11", "1.0.0-rc.1", "1.0.0");

            List<SemanticVersion> shuffled = expected.stream()
                    .map(SemanticVersion::parse)
                    .collect(Collectors.toCollection(ArrayList::new));
            Collections.reverse(shuffled);
            Collections.sort(shuffled);

            assertEquals(expected, shuffled.stream().map(SemanticVersion::toVersionString).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("numeric identifiers should rank below alphanumeric ones")
        void numericShouldRankBelowAlphanumeric() {
            assertEquals(VersionComparison.LESS_THAN, compare("1.0.0-1", "1.0.0--x"));
            assertEquals(VersionComparison.GREATER_THAN, compare("1.0.0-alpha.-", "1.0.0-alpha.9"));
        }

        @Test
        @DisplayName("should compare long numeric identifiers by magnitude")
        void shouldCompareLongNumericIdentifiers() {
            assertEquals(VersionComparison.LESS_THAN, compare("1.0.0-99999999999999999999", "1.0.0-100000000000000000000"));
        }

        @Test
        @DisplayName("should ignore build metadata in ordering and equality")
        void shouldIgnoreBuildMetadata() {
            SemanticVersion a = SemanticVersion.parse("1.2.3+build.1");
            SemanticVersion b = SemanticVersion.parse("1.2.3+build.2");

            assertEquals(VersionComparison.EQUAL, SemanticVersion.compare(a, b));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        @DisplayName("should be antisymmetric and transitive")
        void shouldBeTotalOrder() {
            List<SemanticVersion> versions = List.of("0.1.0", "1.0.0-alpha", "1.0.0", "1.0.1", "1.1.0-rc.1", "2.0.0")
                    .stream().map(SemanticVersion::parse).collect(Collectors.toList());

            for (SemanticVersion a : versions) {
                for (SemanticVersion b : versions) {
                    assertEquals(-a.compareTo(b), b.compareTo(a));
                    for (SemanticVersion c : versions) {
                        if (a.compareTo(b) < 0 && b.compareTo(c) < 0) {
                            assertTrue(a.compareTo(c) < 0);
                        }
                    }
                }
            }
        }

        private VersionComparison compare(String a, String b) {
            return SemanticVersion.compare(SemanticVersion.parse(a), SemanticVersion.parse(b));
        }
    }
}
