package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRange;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Implementation of a registered template version.
 */
@Data
@Builder
public class TemplateVersion implements ITemplateVersion, Serializable {

    private static final long serialVersionUID = 1L;

    private final String templateId;
    private final ISemanticVersion version;
    private final IVersionRange compatibleWith;
    private final Deprecation deprecation;
    @Builder.Default
    private final Map<String, String> migrationFrom = new LinkedHashMap<>();
    @Builder.Default
    private final String releaseDate = Instant.now().toString();
    private final String changelog;
    @Builder.Default
    private final Map<String, IVersionRange> dependencies = new LinkedHashMap<>();

    @Override
    public Optional<IVersionRange> getCompatibleWith() {
        return Optional.ofNullable(compatibleWith);
    }

    @Override
    public Optional<Deprecation> getDeprecation() {
        return Optional.ofNullable(deprecation);
    }

    @Override
    public Map<String, String> getMigrationFrom() {
        return Collections.unmodifiableMap(migrationFrom);
    }

    @Override
    public Optional<String> getChangelog() {
        return Optional.ofNullable(changelog);
    }

    @Override
    public Map<String, IVersionRange> getDependencies() {
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Creates a plain template version released now.
     *
     * @param templateId template ID
     * @param version    version string
     * @return template version
     */
    public static TemplateVersion of(String templateId, String version) {
        return TemplateVersion.builder()
                .templateId(templateId)
                .version(SemanticVersion.parse(version))
                .build();
    }

    /**
     * Creates a deprecated copy of this version.
     *
     * @param message    deprecation message
     * @param replacedBy suggested replacement version, may be null
     * @return deprecated version
     */
    public TemplateVersion deprecate(String message, String replacedBy) {
        return TemplateVersion.builder()
                .templateId(this.templateId)
                .version(this.version)
                .compatibleWith(this.compatibleWith)
                .deprecation(Deprecation.of(message, replacedBy))
                .migrationFrom(new LinkedHashMap<>(this.migrationFrom))
                .releaseDate(this.releaseDate)
                .changelog(this.changelog)
                .dependencies(new LinkedHashMap<>(this.dependencies))
                .build();
    }
}
