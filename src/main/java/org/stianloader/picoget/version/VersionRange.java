package org.stianloader.picoget.version;

import java.util.Collection;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

// Based on https://learn.microsoft.com/en-us/nuget/concepts/package-versioning#version-ranges
public final class VersionRange {

    /**
     * Sentinel value for a range without any bounds - corresponding to an empty or absent
     * version string in a dependency declaration.
     */
    @NotNull
    public static final VersionRange ALL = new VersionRange(null, false, null, false);

    @NotNull
    public static VersionRange atLeast(@NotNull NuGetVersion minVersion) {
        return new VersionRange(minVersion, true, null, false);
    }

    @NotNull
    public static VersionRange exactly(@NotNull NuGetVersion version) {
        return new VersionRange(version, true, version, true);
    }

    /**
     * Parses a range in NuGet notation.
     *
     * <p><ul>
     * <li>"1.0" - x &gt;= 1.0 (a plain version is a minimum, not a pin)</li>
     * <li>"[1.0]" - x == 1.0</li>
     * <li>"(1.0,)" - x &gt; 1.0</li>
     * <li>"(,1.0]" - x &lt;= 1.0</li>
     * <li>"[1.0,2.0)" - 1.0 &lt;= x &lt; 2.0, and so on for the other bracket combinations</li>
     * <li>"" or null - {@link #ALL}</li>
     * </ul>
     *
     * @param string The string to parse
     * @return The parsed range
     * @throws IllegalArgumentException If the string is not a valid range
     */
    @NotNull
    public static VersionRange parse(@Nullable String string) {
        if (string == null) {
            return VersionRange.ALL;
        }
        String value = string.trim();
        if (value.isEmpty()) {
            return VersionRange.ALL;
        }

        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);

        if (first != '[' && first != '(') {
            NuGetVersion version = NuGetVersion.tryParse(value);
            if (version == null) {
                throw new IllegalArgumentException("Not a valid version range: \"" + string + "\"");
            }
            return VersionRange.atLeast(version);
        }

        if (value.length() < 3 || (last != ']' && last != ')')) {
            throw new IllegalArgumentException("Not a valid version range: \"" + string + "\"");
        }

        boolean minInclusive = first == '[';
        boolean maxInclusive = last == ']';
        String body = value.substring(1, value.length() - 1);
        int separator = body.indexOf(',');

        if (separator == -1) {
            // Only "[1.0]" is permitted, "(1.0)" or "[1.0)" have no sensible meaning
            NuGetVersion version = NuGetVersion.tryParse(body);
            if (!minInclusive || !maxInclusive || version == null) {
                throw new IllegalArgumentException("Not a valid version range: \"" + string + "\"");
            }
            return VersionRange.exactly(version);
        }

        if (body.indexOf(',', separator + 1) != -1) {
            throw new IllegalArgumentException("Too many bounds in version range: \"" + string + "\"");
        }

        String minText = body.substring(0, separator).trim();
        String maxText = body.substring(separator + 1).trim();

        if (minText.isEmpty() && maxText.isEmpty()) {
            throw new IllegalArgumentException("Version range has neither a lower nor an upper bound: \"" + string + "\"");
        }

        NuGetVersion minVersion = null;
        NuGetVersion maxVersion = null;
        if (!minText.isEmpty()) {
            minVersion = NuGetVersion.tryParse(minText);
            if (minVersion == null) {
                throw new IllegalArgumentException("Invalid lower bound in version range: \"" + string + "\"");
            }
        }
        if (!maxText.isEmpty()) {
            maxVersion = NuGetVersion.tryParse(maxText);
            if (maxVersion == null) {
                throw new IllegalArgumentException("Invalid upper bound in version range: \"" + string + "\"");
            }
        }

        return new VersionRange(minVersion, minInclusive && minVersion != null, maxVersion, maxInclusive && maxVersion != null);
    }

    @Nullable
    private final NuGetVersion minVersion;
    private final boolean minInclusive;
    @Nullable
    private final NuGetVersion maxVersion;
    private final boolean maxInclusive;

    public VersionRange(@Nullable NuGetVersion minVersion, boolean minInclusive, @Nullable NuGetVersion maxVersion, boolean maxInclusive) {
        this.minVersion = minVersion;
        this.minInclusive = minInclusive;
        this.maxVersion = maxVersion;
        this.maxInclusive = maxInclusive;
    }

    @Contract(pure = true)
    public boolean containsVersion(@NotNull NuGetVersion version) {
        NuGetVersion min = this.minVersion;
        if (min != null) {
            int cmp = version.compareTo(min);
            if (cmp < 0 || (cmp == 0 && !this.minInclusive)) {
                return false;
            }
        }
        NuGetVersion max = this.maxVersion;
        if (max != null) {
            int cmp = version.compareTo(max);
            if (cmp > 0 || (cmp == 0 && !this.maxInclusive)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionRange) {
            VersionRange other = (VersionRange) obj;
            return Objects.equals(other.minVersion, this.minVersion)
                    && Objects.equals(other.maxVersion, this.maxVersion)
                    && other.minInclusive == this.minInclusive
                    && other.maxInclusive == this.maxInclusive;
        }
        return false;
    }

    @Nullable
    @Contract(pure = true)
    public NuGetVersion getMaxVersion() {
        return this.maxVersion;
    }

    @Nullable
    @Contract(pure = true)
    public NuGetVersion getMinVersion() {
        return this.minVersion;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.minVersion, this.minInclusive, this.maxVersion, this.maxInclusive);
    }

    @Contract(pure = true)
    public boolean isMaxInclusive() {
        return this.maxInclusive;
    }

    @Contract(pure = true)
    public boolean isMinInclusive() {
        return this.minInclusive;
    }

    /**
     * Selects the newest version within this range.
     *
     * @param knownAvailable The versions to choose from
     * @return The highest version contained in the range, or null if no version lies within it
     */
    @Nullable
    public NuGetVersion selectFrom(@NotNull Collection<@NotNull NuGetVersion> knownAvailable) {
        NuGetVersion candidateVersion = null;
        for (NuGetVersion known : knownAvailable) {
            if ((candidateVersion == null || known.isNewerThan(candidateVersion)) && this.containsVersion(known)) {
                candidateVersion = known;
            }
        }
        return candidateVersion;
    }

    @Override
    public String toString() {
        NuGetVersion min = this.minVersion;
        NuGetVersion max = this.maxVersion;
        if (min == null && max == null) {
            return "(,)";
        } else if (min != null && max == null && this.minInclusive) {
            return min.toString();
        } else if (min != null && min.equals(max) && this.minInclusive && this.maxInclusive) {
            return "[" + min + "]";
        }

        StringBuilder builder = new StringBuilder();
        builder.append(this.minInclusive ? '[' : '(');
        if (min != null) {
            builder.append(min);
        }
        builder.append(", ");
        if (max != null) {
            builder.append(max);
        }
        builder.append(this.maxInclusive ? ']' : ')');
        return builder.toString();
    }
}
