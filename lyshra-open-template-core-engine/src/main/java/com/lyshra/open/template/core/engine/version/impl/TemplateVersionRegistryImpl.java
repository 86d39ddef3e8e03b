package com.lyshra.open.template.core.engine.version.impl;

import com.lyshra.open.template.core.engine.version.ITemplateVersionRegistry;
import com.lyshra.open.template.core.engine.version.config.TemplateVersioningOptions;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRegistryEntry;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import com.lyshra.open.template.integration.models.version.VersionRegistryEntry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory template version registry.
 */
@Slf4j
public class TemplateVersionRegistryImpl implements ITemplateVersionRegistry {

    private static final Comparator<ITemplateVersion> DESCENDING =
            Comparator.comparing(ITemplateVersion::getVersion, Comparator.reverseOrder());

    private final Map<String, TemplateEntry> entries = new LinkedHashMap<>();
    private final TemplateVersioningOptions options;

    public TemplateVersionRegistryImpl() {
        this(TemplateVersioningOptions.defaults());
    }

    public TemplateVersionRegistryImpl(TemplateVersioningOptions options) {
        this.options = options;
    }

    @Override
    public void register(ITemplateVersion templateVersion) {
        String templateId = templateVersion.getTemplateId();
        TemplateEntry entry = entries.computeIfAbsent(templateId, k -> new TemplateEntry());

        entry.versions.add(templateVersion);
        // List.sort is stable, so duplicates keep registration order
        entry.versions.sort(DESCENDING);
        entry.latest = entry.versions.get(0).getVersion();
        entry.latestStable = entry.versions.stream()
                .map(ITemplateVersion::getVersion)
                .filter(ISemanticVersion::isStable)
                .findFirst()
                .orElse(null);

        log.info("Registered template [{}] version [{}]", templateId, templateVersion.getVersion().toVersionString());
    }

    @Override
    public Optional<ITemplateVersion> getVersion(String templateId, ISemanticVersion version) {
        TemplateEntry entry = entries.get(templateId);
        if (entry == null) {
            return Optional.empty();
        }
        return entry.versions.stream()
                .filter(v -> v.getVersion().compareTo(version) == 0)
                .findFirst();
    }

    @Override
    public Optional<ITemplateVersion> getVersion(String templateId, String versionString) {
        return getVersion(templateId, SemanticVersion.parse(versionString));
    }

    @Override
    public Optional<ITemplateVersion> getLatest(String templateId, boolean includePreRelease) {
        return getLatestVersion(templateId, includePreRelease)
                .flatMap(version -> getVersion(templateId, version));
    }

    @Override
    public Optional<ISemanticVersion> getLatestVersion(String templateId, boolean includePreRelease) {
        TemplateEntry entry = entries.get(templateId);
        if (entry == null) {
            return Optional.empty();
        }
        if (includePreRelease || options.isAllowPreRelease()) {
            return Optional.of(entry.latest);
        }
        return Optional.ofNullable(entry.latestStable);
    }

    @Override
    public Optional<IVersionRegistryEntry> getRegistryEntry(String templateId) {
        TemplateEntry entry = entries.get(templateId);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(VersionRegistryEntry.builder()
                .templateId(templateId)
                .versions(new ArrayList<>(entry.versions))
                .latest(entry.latest)
                .latestStable(entry.latestStable)
                .build());
    }

    @Override
    public Set<String> getTemplateIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    @Override
    public void clear() {
        entries.clear();
        log.info("Cleared template version registry");
    }

    private static final class TemplateEntry {
        private final List<ITemplateVersion> versions = new ArrayList<>();
        private ISemanticVersion latest;
        private ISemanticVersion latestStable;
    }
}
