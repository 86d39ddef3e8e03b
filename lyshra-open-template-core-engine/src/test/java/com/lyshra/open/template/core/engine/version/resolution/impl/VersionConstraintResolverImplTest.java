package com.lyshra.open.template.core.engine.version.resolution.impl;

import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.core.engine.version.impl.TemplateVersionRegistryImpl;
import com.lyshra.open.template.integration.contract.version.IVersionRange;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import com.lyshra.open.template.integration.models.version.TemplateVersion;
import com.lyshra.open.template.integration.models.version.VersionRange;
import com.lyshra.open.template.integration.models.version.resolution.VersionConflict;
import com.lyshra.open.template.integration.models.version.resolution.VersionResolutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link VersionConstraintResolverImpl}.
 */
class VersionConstraintResolverImplTest {

    private TemplateVersionRegistryImpl registry;
    private VersionConstraintResolverImpl resolver;

    @BeforeEach
    void setUp() {
        TemplateVersioningOptions options = TemplateVersioningOptions.defaults();
        registry = new TemplateVersionRegistryImpl(options);
        resolver = new VersionConstraintResolverImpl(registry, options);

        for (String version : List.of("1.0.0", "1.1.0", "1.4.2", "2.0.0", "2.1.0-beta")) {
            registry.register(TemplateVersion.of("api", version));
        }
        registry.register(TemplateVersion.of("docs", "0.3.0"));
    }

    @Test
    @DisplayName("should pick the highest stable version satisfying every range")
    void shouldPickHighestSatisfying() {
        // Given
        Map<String, List<IVersionRange>> requirements = new LinkedHashMap<>();
        requirements.put("api", List.of(VersionRange.expression("^1.0.0"), VersionRange.expression(">=1.1.0")));
        requirements.put("docs", List.of(VersionRange.expression("~0.3.0")));

        // When
        VersionResolutionResult result = resolver.resolveVersions(requirements);

        // Then
        assertTrue(result.isSuccess());
        assertFalse(result.hasConflicts());
        assertEquals(List.of("api", "docs"), List.copyOf(result.getResolvedVersions().keySet()));
        assertEquals("1.4.2", result.getResolvedVersions().get("api").toVersionString());
        assertEquals("0.3.0", result.getResolvedVersions().get("docs").toVersionString());
    }

    @Test
    @DisplayName("should skip pre-releases unless allowed")
    void shouldSkipPreReleases() {
        Map<String, List<IVersionRange>> requirements = Map.of("api", List.of(VersionRange.expression(">=2.0.0")));

        assertEquals("2.0.0", resolver.resolveVersions(requirements).getResolvedVersions().get("api").toVersionString());

        TemplateVersioningOptions permissive = TemplateVersioningOptions.builder().allowPreRelease(true).build();
        VersionConstraintResolverImpl permissiveResolver = new VersionConstraintResolverImpl(registry, permissive);
        assertEquals("2.1.0-beta",
                permissiveResolver.resolveVersions(requirements).getResolvedVersions().get("api").toVersionString());
    }

    @Test
    @DisplayName("unsatisfiable and unknown templates should become conflicts")
    void shouldReportConflicts() {
        Map<String, List<IVersionRange>> requirements = new LinkedHashMap<>();
        requirements.put("api", List.of(VersionRange.expression("^1.0.0"), VersionRange.expression("^2.0.0")));
        requirements.put("docs", List.of(VersionRange.expression("~0.3.0")));
        requirements.put("ghost", List.of(VersionRange.exact("1.0.0")));

        VersionResolutionResult result = resolver.resolveVersions(requirements);

        assertFalse(result.isSuccess());
        assertTrue(result.getResolvedVersions().isEmpty());
        assertEquals(2, result.getConflicts().size());

        VersionConflict apiConflict = result.getConflicts().get(0);
        assertEquals("api", apiConflict.getTemplateId());
        assertEquals(2, apiConflict.getRequirements().size());
        assertEquals(VersionConflict.UNKNOWN_REQUESTER, apiConflict.getRequirements().get(0).requiredBy());
        assertEquals("ghost", result.getConflicts().get(1).getTemplateId());
    }

    @Test
    @DisplayName("should warn when the winner is deprecated")
    void shouldWarnOnDeprecatedWinner() {
        registry.register(TemplateVersion.builder()
                .templateId("legacy")
                .version(SemanticVersion.parse("1.0.0"))
                .build()
                .deprecate("Replaced by modern-template", null));

        VersionResolutionResult result = resolver.resolveVersions(
                Map.of("legacy", List.of(VersionRange.atLeast(SemanticVersion.of(1, 0, 0)))));

        assertTrue(result.isSuccess());
        assertEquals(List.of("legacy@1.0.0 is deprecated: Replaced by modern-template"), result.getWarnings());
    }

    @Test
    @DisplayName("resolution should be deterministic")
    void shouldBeDeterministic() {
        Map<String, List<IVersionRange>> requirements = Map.of("api", List.of(VersionRange.expression("<2.0.0")));

        VersionResolutionResult first = resolver.resolveVersions(requirements);
        VersionResolutionResult second = resolver.resolveVersions(requirements);

        assertEquals(first.getResolvedVersions(), second.getResolvedVersions());
    }
}
