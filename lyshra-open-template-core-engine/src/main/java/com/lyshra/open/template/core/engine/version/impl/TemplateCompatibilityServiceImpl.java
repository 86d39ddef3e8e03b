package com.lyshra.open.template.core.engine.version.impl;

import com.lyshra.open.template.core.engine.version.ITemplateCompatibilityService;
import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRange;
import com.lyshra.open.template.integration.models.version.CompatibilityCheckResult;
import com.lyshra.open.template.integration.models.version.SemanticVersion;
import com.lyshra.open.template.integration.models.version.ValidationResult;
import com.lyshra.open.template.integration.models.version.VersionRangeExpression;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Stateless compatibility and format checks for template versions.
 */
@Slf4j
public class TemplateCompatibilityServiceImpl implements ITemplateCompatibilityService {

    private static final ISemanticVersion PROBE_VERSION = SemanticVersion.of(1, 0, 0);
    private static final List<Function<String, Object>> RELEASE_DATE_PARSERS =
            List.of(Instant::parse, OffsetDateTime::parse, LocalDate::parse);

    @Override
    public CompatibilityCheckResult checkCompatibility(ITemplateVersion first, ITemplateVersion second) {
        Optional<CompatibilityCheckResult> rejected = checkDeclaredRange(first, second);
        if (rejected.isEmpty()) {
            rejected = checkDeclaredRange(second, first);
        }
        if (rejected.isPresent()) {
            log.debug("Template [{}] versions incompatible: {}", first.getTemplateId(), rejected.get().getReason().orElse(""));
            return rejected.get();
        }

        ITemplateVersion deprecated = first.isDeprecated() ? first : second.isDeprecated() ? second : null;
        if (deprecated != null) {
            return CompatibilityCheckResult.compatibleWithWarning(
                    "Warning: Version " + deprecated.getVersion().toVersionString() + " is deprecated. "
                            + deprecated.getDeprecation().map(ITemplateVersion.Deprecation::message).orElse(""));
        }
        return CompatibilityCheckResult.compatible();
    }

    private Optional<CompatibilityCheckResult> checkDeclaredRange(ITemplateVersion owner, ITemplateVersion other) {
        Optional<IVersionRange> range = owner.getCompatibleWith();
        if (range.isEmpty() || range.get().isSatisfiedBy(other.getVersion())) {
            return Optional.empty();
        }
        String ownerVersion = owner.getVersion().toVersionString();
        String otherVersion = other.getVersion().toVersionString();
        CompatibilityCheckResult.SuggestedUpgrade upgrade = new CompatibilityCheckResult.SuggestedUpgrade(
                ownerVersion, otherVersion, owner.getMigrationFrom().containsKey(otherVersion));
        return Optional.of(CompatibilityCheckResult.incompatible(
                "Version " + ownerVersion + " is not compatible with " + otherVersion, upgrade));
    }

    @Override
    public ValidationResult validateVersion(ITemplateVersion templateVersion) {
        List<String> errors = new ArrayList<>();

        try {
            SemanticVersion.parse(templateVersion.getVersion().toVersionString());
        } catch (IllegalArgumentException e) {
            errors.add("Invalid version format: " + e.getMessage());
        }

        Optional<String> expression = templateVersion.getCompatibleWith().flatMap(IVersionRange::getExpression);
        if (expression.isPresent()) {
            try {
                VersionRangeExpression.evaluate(PROBE_VERSION, expression.get());
            } catch (IllegalArgumentException e) {
                errors.add("Invalid compatibility range: " + e.getMessage());
            }
        }

        if (!isParsableDate(templateVersion.getReleaseDate())) {
            errors.add("Invalid release date: " + templateVersion.getReleaseDate());
        }

        return ValidationResult.of(errors);
    }

    private static boolean isParsableDate(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        for (Function<String, Object> parser : RELEASE_DATE_PARSERS) {
            try {
                parser.apply(text);
                return true;
            } catch (DateTimeParseException e) {
                log.trace("Release date [{}] did not parse: {}", text, e.getMessage());
            }
        }
        return false;
    }
}
