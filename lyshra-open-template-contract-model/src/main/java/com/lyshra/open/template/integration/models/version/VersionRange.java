package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.contract.version.IVersionRange;
import com.lyshra.open.template.integration.enumerations.VersionComparison;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Optional;

/**
 * Version range given as an exact version, an expression or a min/max window.
 * The expression is evaluated lazily, so a malformed one only fails when it is checked.
 */
@Data
@Builder
public class VersionRange implements IVersionRange, Serializable {

    private static final long serialVersionUID = 1L;

    private final ISemanticVersion exact;
    private final String expression;
    private final ISemanticVersion min;
    private final ISemanticVersion max;

    @Override
    public Optional<ISemanticVersion> getExact() {
        return Optional.ofNullable(exact);
    }

    @Override
    public Optional<String> getExpression() {
        return Optional.ofNullable(expression).filter(s -> !s.isBlank());
    }

    @Override
    public Optional<ISemanticVersion> getMin() {
        return Optional.ofNullable(min);
    }

    @Override
    public Optional<ISemanticVersion> getMax() {
        return Optional.ofNullable(max);
    }

    @Override
    public boolean isSatisfiedBy(ISemanticVersion version) {
        if (exact != null) {
            return SemanticVersion.compare(version, exact) == VersionComparison.EQUAL;
        }

        Optional<String> expr = getExpression();
        if (expr.isPresent()) {
            return VersionRangeExpression.evaluate(version, expr.get());
        }

        if (min != null && SemanticVersion.compare(version, min) == VersionComparison.LESS_THAN) {
            return false;
        }
        // max is exclusive
        return max == null || SemanticVersion.compare(version, max) == VersionComparison.LESS_THAN;
    }

    @Override
    public String toString() {
        if (exact != null) {
            return "=" + exact.toVersionString();
        }
        Optional<String> expr = getExpression();
        if (expr.isPresent()) {
            return expr.get().trim();
        }
        if (min == null && max == null) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        if (min != null) {
            sb.append(">=").append(min.toVersionString());
        }
        if (max != null) {
            if (sb.length() > 0) sb.append(' ');
            sb.append('<').append(max.toVersionString());
        }
        return sb.toString();
    }

    public static VersionRange exact(ISemanticVersion version) {
        return VersionRange.builder().exact(version).build();
    }

    public static VersionRange exact(String version) {
        return exact(SemanticVersion.parse(version));
    }

    /**
     * Creates a range from an expression such as {@code ^1.2.0} or {@code >=1.0.0}.
     *
     * @param expression range expression
     * @return range
     */
    public static VersionRange expression(String expression) {
        return VersionRange.builder().expression(expression).build();
    }

    /**
     * Creates a window range.
     *
     * @param min inclusive lower bound, or null
     * @param max exclusive upper bound, or null
     * @return range
     */
    public static VersionRange between(ISemanticVersion min, ISemanticVersion max) {
        return VersionRange.builder().min(min).max(max).build();
    }

    public static VersionRange atLeast(ISemanticVersion min) {
        return between(min, null);
    }

    public static VersionRange below(ISemanticVersion max) {
        return between(null, max);
    }
}
