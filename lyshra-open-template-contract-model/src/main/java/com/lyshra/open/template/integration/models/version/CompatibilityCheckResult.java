package com.lyshra.open.template.integration.models.version;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Optional;

/**
 * Outcome of checking two template versions against each other's compatibility ranges.
 * A compatible result may still carry a reason, e.g. a deprecation warning.
 */
@Data
@Builder
public class CompatibilityCheckResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final boolean compatible;
    private final String reason;
    private final SuggestedUpgrade suggestedUpgrade;

    public Optional<String> getReason() {
        return Optional.ofNullable(reason);
    }

    public Optional<SuggestedUpgrade> getSuggestedUpgrade() {
        return Optional.ofNullable(suggestedUpgrade);
    }

    public static CompatibilityCheckResult compatible() {
        return CompatibilityCheckResult.builder().compatible(true).build();
    }

    public static CompatibilityCheckResult compatibleWithWarning(String reason) {
        return CompatibilityCheckResult.builder().compatible(true).reason(reason).build();
    }

    public static CompatibilityCheckResult incompatible(String reason, SuggestedUpgrade suggestedUpgrade) {
        return CompatibilityCheckResult.builder()
                .compatible(false)
                .reason(reason)
                .suggestedUpgrade(suggestedUpgrade)
                .build();
    }

    /**
     * Upgrade suggested for an incompatible pair.
     *
     * @param from              version to upgrade from
     * @param to                version to upgrade to
     * @param migrationRequired whether a migration is declared for the pair
     */
    public record SuggestedUpgrade(String from, String to, boolean migrationRequired) implements Serializable {
    }
}
