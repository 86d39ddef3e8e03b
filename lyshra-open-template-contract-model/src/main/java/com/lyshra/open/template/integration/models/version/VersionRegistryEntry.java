package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRegistryEntry;
import lombok.Builder;
import lombok.Data;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of a template's registry entry.
 */
@Data
@Builder
public class VersionRegistryEntry implements IVersionRegistryEntry {

    private final String templateId;
    private final List<ITemplateVersion> versions;
    private final ISemanticVersion latest;
    private final ISemanticVersion latestStable;

    @Override
    public List<ITemplateVersion> getVersions() {
        return Collections.unmodifiableList(versions);
    }

    @Override
    public Optional<ISemanticVersion> getLatestStable() {
        return Optional.ofNullable(latestStable);
    }
}
