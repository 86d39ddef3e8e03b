package com.lyshra.open.template.core.engine.version.resolution.impl;

import com.lyshra.open.template.core.engine.version.ITemplateVersionRegistry;
import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.core.engine.version.resolution.IVersionConstraintResolver;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRange;
import com.lyshra.open.template.integration.contract.version.IVersionRegistryEntry;
import com.lyshra.open.template.integration.models.version.resolution.VersionConflict;
import com.lyshra.open.template.integration.models.version.resolution.VersionResolutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Greedy resolver: for each template, the highest registered version satisfying every range wins.
 */
@Slf4j
public class VersionConstraintResolverImpl implements IVersionConstraintResolver {

    private final ITemplateVersionRegistry versionRegistry;
    private final TemplateVersioningOptions options;

    public VersionConstraintResolverImpl(ITemplateVersionRegistry versionRegistry, TemplateVersioningOptions options) {
        this.versionRegistry = versionRegistry;
        this.options = options;
    }

    @Override
    public VersionResolutionResult resolveVersions(Map<String, ? extends List<? extends IVersionRange>> requirements) {
        Map<String, ISemanticVersion> resolved = new LinkedHashMap<>();
        List<VersionConflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (Map.Entry<String, ? extends List<? extends IVersionRange>> requirement : requirements.entrySet()) {
            String templateId = requirement.getKey();
            List<? extends IVersionRange> ranges = requirement.getValue();

            Optional<ITemplateVersion> winner = versionRegistry.getRegistryEntry(templateId)
                    .flatMap(entry -> findSatisfying(entry, ranges));

            if (winner.isEmpty()) {
                log.debug("No version of template [{}] satisfies {}", templateId, ranges);
                conflicts.add(VersionConflict.unattributed(templateId, ranges));
                continue;
            }

            ITemplateVersion version = winner.get();
            resolved.put(templateId, version.getVersion());
            version.getDeprecation().ifPresent(deprecation -> warnings.add(
                    templateId + "@" + version.getVersion().toVersionString() + " is deprecated: " + deprecation.message()));
        }

        boolean success = conflicts.isEmpty();
        log.info("Resolved versions for [{}] templates, [{}] conflicts", requirements.size(), conflicts.size());
        return VersionResolutionResult.builder()
                .success(success)
                .resolvedVersions(success ? resolved : new LinkedHashMap<>())
                .conflicts(conflicts)
                .warnings(warnings)
                .build();
    }

    private Optional<ITemplateVersion> findSatisfying(IVersionRegistryEntry entry, List<? extends IVersionRange> ranges) {
        // Entry versions are in descending order
        return entry.getVersions().stream()
                .filter(v -> options.isAllowPreRelease() || v.getVersion().isStable())
                .filter(v -> ranges.stream().allMatch(range -> range.isSatisfiedBy(v.getVersion())))
                .findFirst();
    }
}
