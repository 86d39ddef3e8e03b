package com.lyshra.open.template.integration.contract.version;

import java.util.Optional;

/**
 * Constraint over template versions.
 *
 * <p>Exactly one form is populated per instance:</p>
 * <ul>
 *   <li>an exact version</li>
 *   <li>a range expression: {@code ^1.2.0}, {@code ~1.2.0}, {@code >=1.0.0}, {@code <=1.0.0},
 *       {@code >1.0.0}, {@code <2.0.0} or a bare exact version</li>
 *   <li>a window with an inclusive minimum and an exclusive maximum, either bound optional</li>
 * </ul>
 *
 * <p>Evaluation checks the exact form first, then the expression, then the window.</p>
 */
public interface IVersionRange {

    /**
     * Returns the exact version this range pins, if any.
     *
     * @return exact version
     */
    Optional<ISemanticVersion> getExact();

    /**
     * Returns the textual range expression, if any.
     *
     * @return range expression
     */
    Optional<String> getExpression();

    /**
     * Returns the inclusive lower bound of the window, if any.
     *
     * @return minimum version
     */
    Optional<ISemanticVersion> getMin();

    /**
     * Returns the exclusive upper bound of the window, if any.
     *
     * @return maximum version
     */
    Optional<ISemanticVersion> getMax();

    /**
     * Checks whether the given version satisfies this range.
     *
     * @param version version to test
     * @return true if the version lies within the range
     * @throws com.lyshra.open.template.integration.exception.InvalidVersionFormatException
     *         if the range expression is malformed
     */
    boolean isSatisfiedBy(ISemanticVersion version);
}
