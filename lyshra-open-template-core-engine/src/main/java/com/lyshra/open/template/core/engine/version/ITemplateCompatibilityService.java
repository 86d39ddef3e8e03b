package com.lyshra.open.template.core.engine.version;

import com.lyshra.open.template.integration.contract.version.ITemplateVersion;
import com.lyshra.open.template.integration.models.version.CompatibilityCheckResult;
import com.lyshra.open.template.integration.models.version.ValidationResult;

/**
 * Checks template versions against each other and against the version format rules.
 * Neither operation throws; problems are reported in the returned results.
 */
public interface ITemplateCompatibilityService {

    /**
     * Checks two versions against each other's declared compatibility ranges.
     *
     * @param first  first version
     * @param second second version
     * @return compatibility outcome, with an upgrade suggestion when incompatible
     */
    CompatibilityCheckResult checkCompatibility(ITemplateVersion first, ITemplateVersion second);

    /**
     * Validates the version string, the compatibility expression and the release date.
     *
     * @param templateVersion version to validate
     * @return validation outcome
     */
    ValidationResult validateVersion(ITemplateVersion templateVersion);
}
