package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.enumerations.VersionComparison;

/**
 * Evaluator for textual version range expressions.
 *
 * <p>Supported forms, matched after trimming surrounding whitespace:</p>
 * <ul>
 *   <li>{@code ^X.Y.Z} - changes that keep the left-most non-zero component</li>
 *   <li>{@code ~X.Y.Z} - patch-level changes within X.Y</li>
 *   <li>{@code >=}, {@code <=}, {@code >}, {@code <} - plain comparisons</li>
 *   <li>{@code X.Y.Z} - exact match</li>
 * </ul>
 */
public final class VersionRangeExpression {

    private VersionRangeExpression() {
        // Utility class
    }

    /**
     * Evaluates an expression against a version.
     *
     * @param version    version to test
     * @param expression range expression
     * @return true if the version satisfies the expression
     * @throws com.lyshra.open.template.integration.exception.InvalidVersionFormatException
     *         if the operand is not a valid version
     */
    public static boolean evaluate(ISemanticVersion version, String expression) {
        String expr = expression.trim();

        if (expr.startsWith("^")) {
            return satisfiesCaret(version, SemanticVersion.parse(expr.substring(1)));
        }
        if (expr.startsWith("~")) {
            return satisfiesTilde(version, SemanticVersion.parse(expr.substring(1)));
        }
        if (expr.startsWith(">=")) {
            return compare(version, expr.substring(2)) != VersionComparison.LESS_THAN;
        }
        if (expr.startsWith("<=")) {
            return compare(version, expr.substring(2)) != VersionComparison.GREATER_THAN;
        }
        if (expr.startsWith(">")) {
            return compare(version, expr.substring(1)) == VersionComparison.GREATER_THAN;
        }
        if (expr.startsWith("<")) {
            return compare(version, expr.substring(1)) == VersionComparison.LESS_THAN;
        }
        return SemanticVersion.compare(version, SemanticVersion.parse(expr)) == VersionComparison.EQUAL;
    }

    private static VersionComparison compare(ISemanticVersion version, String operand) {
        return SemanticVersion.compare(version, SemanticVersion.parse(operand.trim()));
    }

    private static boolean satisfiesCaret(ISemanticVersion version, SemanticVersion base) {
        if (SemanticVersion.compare(version, base) == VersionComparison.LESS_THAN) {
            return false;
        }
        if (base.getMajor() > 0) {
            return version.getMajor() == base.getMajor();
        }
        if (base.getMinor() > 0) {
            return version.getMajor() == 0 && version.getMinor() == base.getMinor();
        }
        // ^0.0.Z pins the exact patch
        return version.getMajor() == 0
                && version.getMinor() == 0
                && version.getPatch() == base.getPatch();
    }

    private static boolean satisfiesTilde(ISemanticVersion version, SemanticVersion base) {
        if (SemanticVersion.compare(version, base) == VersionComparison.LESS_THAN) {
            return false;
        }
        return version.getMajor() == base.getMajor() && version.getMinor() == base.getMinor();
    }
}
