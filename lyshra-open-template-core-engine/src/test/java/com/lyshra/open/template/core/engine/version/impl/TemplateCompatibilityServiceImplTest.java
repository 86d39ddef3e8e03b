package com.lyshra.open.template.core.engine.version.impl;

import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.models.version.CompatibilityCheckResult;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import com.lyshra.open.template.integration.models.version.TemplateVersion;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import com.lyshra.open.template.integration.models.version.VersionRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TemplateCompatibilityServiceImplTest {

    private final TemplateCompatibilityServiceImpl service = new TemplateCompatibilityServiceImpl();

    @Nested
    @DisplayName("Compatibility")
    class CompatibilityTests {

        @Test
        @DisplayName("versions without declared ranges should be compatible")
        void noRanges() {
            CompatibilityCheckResult result = service.checkCompatibility(
                    TemplateVersion.of("t", "1.0.0"), TemplateVersion.of("t", "2.0.0"));

            assertTrue(result.isCompatible());
            assertTrue(result.getReason().isEmpty());
        }

        @Test
        @DisplayName("should reject a version outside the declared range and suggest an upgrade")
        void outsideRange() {
            TemplateVersion current = TemplateVersion.builder()
                    .templateId("t")
                    .version(SemanticVersion.parse("1.2.0"))
                    .compatibleWith(VersionRange.expression("^1.0.0"))
                    .migrationFrom(Map.of("2.0.0", "upgrade-to-2"))
                    .build();
            TemplateVersion next = TemplateVersion.of("t", "2.0.0");

            CompatibilityCheckResult result = service.checkCompatibility(current, next);

            assertFalse(result.isCompatible());
            assertEquals("Version 1.2.0 is not compatible with 2.0.0", result.getReason().orElseThrow());
            CompatibilityCheckResult.SuggestedUpgrade upgrade = result.getSuggestedUpgrade().orElseThrow();
            assertEquals("1.2.0", upgrade.from());
            assertEquals("2.0.0", upgrade.to());
            assertTrue(upgrade.migrationRequired());
        }

        @Test
        @DisplayName("should check the second version's range as well")
        void secondRange() {
            TemplateVersion old = TemplateVersion.of("t", "1.0.0");
            TemplateVersion strict = TemplateVersion.builder()
                    .templateId("t")
                    .version(SemanticVersion.parse("3.0.0"))
                    .compatibleWith(VersionRange.atLeast(SemanticVersion.of(2, 0, 0)))
                    .build();

            CompatibilityCheckResult result = service.checkCompatibility(old, strict);

            assertFalse(result.isCompatible());
            assertEquals("Version 3.0.0 is not compatible with 1.0.0", result.getReason().orElseThrow());
            assertFalse(result.getSuggestedUpgrade().orElseThrow().migrationRequired());
        }

        @Test
        @DisplayName("deprecated version should be compatible with a warning")
        void deprecatedWarning() {
            TemplateVersion deprecated = TemplateVersion.of("t", "1.0.0").deprecate("Use 1.1.0", "1.1.0");

            CompatibilityCheckResult result = service.checkCompatibility(TemplateVersion.of("t", "1.1.0"), deprecated);

            assertTrue(result.isCompatible());
            assertEquals("Warning: Version 1.0.0 is deprecated. Use 1.1.0", result.getReason().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("well-formed version should be valid")
        void valid() {
            assertTrue(service.validateVersion(TemplateVersion.of("t", "1.0.0")).isValid());
        }

        @Test
        @DisplayName("should accept date-only release dates")
        void dateOnly() {
            ITemplateVersion version = TemplateVersion.builder()
                    .templateId("t")
                    .version(SemanticVersion.of(1, 0, 0))
                    .releaseDate("2024-03-01")
                    .build();

            assertTrue(service.validateVersion(version).isValid());
        }

        @Test
        @DisplayName("should report bad range and release date")
        void invalid() {
            ITemplateVersion version = TemplateVersion.builder()
                    .templateId("t")
                    .version(SemanticVersion.of(1, 0, 0))
                    .compatibleWith(VersionRange.expression("^one"))
                    .releaseDate("last tuesday")
                    .build();

            ValidationResult result = service.validateVersion(version);

            assertFalse(result.isValid());
            assertEquals(2, result.getErrors().size());
            assertTrue(result.getErrors().get(0).startsWith("Invalid compatibility range: "));
            assertEquals("Invalid release date: last tuesday", result.getErrors().get(1));
        }
    }
}
