package com.lyshra.open.template.integration.models.version.resolution;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of resolving one version per template across a set of requirements.
 * Resolved versions are only reported when no template conflicted.
 */
@Data
@Builder
public class VersionResolutionResult {

    private final boolean success;
    @Builder.Default
    private final Map<String, ISemanticVersion> resolvedVersions = new LinkedHashMap<>();
    @Builder.Default
    private final List<VersionConflict> conflicts = new ArrayList<>();
    @Builder.Default
    private final List<String> warnings = new ArrayList<>();

    public Map<String, ISemanticVersion> getResolvedVersions() {
        return Collections.unmodifiableMap(resolvedVersions);
    }

    public List<VersionConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public List<String> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
