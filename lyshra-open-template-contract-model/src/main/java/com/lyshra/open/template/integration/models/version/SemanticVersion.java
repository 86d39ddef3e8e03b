package com.lyshra.open.template.integration.models.version;

import com.lyshra.open.template.integration.contract.version.ISemanticVersion;
import com.lyshra.open.template.integration.enumerations.VersionComparison;
import com.lyshra.open.template.integration.exception.InvalidVersionFormatException;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version of a template, following SemVer 2.0.0 precedence.
 * Immutable value object; build metadata is ignored by {@link #compareTo} and {@link #equals}.
 */
@Data
@Builder
public class SemanticVersion implements ISemanticVersion, Serializable {

    private static final long serialVersionUID = 1L;

    // Numeric identifiers take no leading zeros
    private static final String PRE_RELEASE_IDENTIFIER = "(?:0|[1-9]\\d*|\\d*[A-Za-z-][0-9A-Za-z-]*)";

    private static final Pattern SEMVER_PATTERN = Pattern.compile(
            "^(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)" +
            "(?:-(" + PRE_RELEASE_IDENTIFIER + "(?:\\." + PRE_RELEASE_IDENTIFIER + ")*))?" +
            "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$"
    );

    private static final Pattern NUMERIC_IDENTIFIER = Pattern.compile("\\d+");

    private final int major;
    private final int minor;
    private final int patch;
    private final String preRelease;
    private final String buildMetadata;

    @Override
    public Optional<String> getPreRelease() {
        return Optional.ofNullable(preRelease).filter(s -> !s.isEmpty());
    }

    @Override
    public Optional<String> getBuildMetadata() {
        return Optional.ofNullable(buildMetadata).filter(s -> !s.isEmpty());
    }

    @Override
    public String toVersionString() {
        StringBuilder sb = new StringBuilder();
        sb.append(major).append('.').append(minor).append('.').append(patch);
        if (preRelease != null && !preRelease.isEmpty()) {
            sb.append('-').append(preRelease);
        }
        if (buildMetadata != null && !buildMetadata.isEmpty()) {
            sb.append('+').append(buildMetadata);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(ISemanticVersion other) {
        return compare(this, other).getSign();
    }

    /**
     * Totally orders two versions by SemVer precedence.
     *
     * @param a first version
     * @param b second version
     * @return how {@code a} relates to {@code b}
     */
    public static VersionComparison compare(ISemanticVersion a, ISemanticVersion b) {
        int result = Integer.compare(a.getMajor(), b.getMajor());
        if (result != 0) return VersionComparison.of(result);

        result = Integer.compare(a.getMinor(), b.getMinor());
        if (result != 0) return VersionComparison.of(result);

        result = Integer.compare(a.getPatch(), b.getPatch());
        if (result != 0) return VersionComparison.of(result);

        // A release outranks any of its pre-releases
        Optional<String> preA = a.getPreRelease();
        Optional<String> preB = b.getPreRelease();
        if (preA.isEmpty() && preB.isEmpty()) return VersionComparison.EQUAL;
        if (preA.isEmpty()) return VersionComparison.GREATER_THAN;
        if (preB.isEmpty()) return VersionComparison.LESS_THAN;

        return VersionComparison.of(comparePreRelease(preA.get(), preB.get()));
    }

    private static int comparePreRelease(String a, String b) {
        String[] partsA = a.split("\\.");
        String[] partsB = b.split("\\.");
        int length = Math.max(partsA.length, partsB.length);

        for (int i = 0; i < length; i++) {
            if (i >= partsA.length) return -1;
            if (i >= partsB.length) return 1;

            String partA = partsA[i];
            String partB = partsB[i];

            boolean numericA = NUMERIC_IDENTIFIER.matcher(partA).matches();
            boolean numericB = NUMERIC_IDENTIFIER.matcher(partB).matches();
            int result;
            if (numericA && numericB) {
                result = compareNumeric(partA, partB);
            } else if (numericA != numericB) {
                // Numeric identifiers rank below alphanumeric ones
                result = numericA ? -1 : 1;
            } else {
                result = partA.compareTo(partB);
            }
            if (result != 0) return result;
        }
        return 0;
    }

    // Identifiers may exceed long range; without leading zeros the longer digit string is larger
    private static int compareNumeric(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ISemanticVersion)) return false;
        ISemanticVersion that = (ISemanticVersion) o;
        return major == that.getMajor() &&
               minor == that.getMinor() &&
               patch == that.getPatch() &&
               Objects.equals(getPreRelease(), that.getPreRelease());
    }

    @Override
    public int hashCode() {
        return Objects.hash(major, minor, patch, getPreRelease().orElse(null));
    }

    @Override
    public String toString() {
        return toVersionString();
    }

    /**
     * Parses a version string into a SemanticVersion.
     *
     * @param versionString version string (e.g., "1.2.3-beta.1+build.123")
     * @return parsed version
     * @throws InvalidVersionFormatException if the string is not a valid semantic version
     */
    public static SemanticVersion parse(String versionString) {
        if (versionString == null) {
            throw new InvalidVersionFormatException(null);
        }
        Matcher matcher = SEMVER_PATTERN.matcher(versionString);
        if (!matcher.matches()) {
            throw new InvalidVersionFormatException(versionString);
        }

        try {
            return SemanticVersion.builder()
                    .major(Integer.parseInt(matcher.group(1)))
                    .minor(Integer.parseInt(matcher.group(2)))
                    .patch(Integer.parseInt(matcher.group(3)))
                    .preRelease(matcher.group(4))
                    .buildMetadata(matcher.group(5))
                    .build();
        } catch (NumberFormatException e) {
            throw new InvalidVersionFormatException(versionString);
        }
    }

    /**
     * Checks whether a string is a valid semantic version.
     *
     * @param versionString candidate string
     * @return true if {@link #parse} would accept it
     */
    public static boolean isValid(String versionString) {
        try {
            parse(versionString);
            return true;
        } catch (InvalidVersionFormatException e) {
            return false;
        }
    }

    public static SemanticVersion of(int major, int minor, int patch) {
        return SemanticVersion.builder()
                .major(major)
                .minor(minor)
                .patch(patch)
                .build();
    }
}
