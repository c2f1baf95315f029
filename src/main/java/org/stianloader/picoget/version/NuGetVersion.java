package org.stianloader.picoget.version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A parsed NuGet package version of the form <code>major[.minor[.patch[.revision]]][-release][+metadata]</code>.
 *
 * <p>Missing numeric components are treated as zero, so "1.0", "1.0.0" and "1.0.0.0" are equal.
 * Versions without a release label are newer than versions with one ("1.0" is newer than "1.0-beta").
 * Release labels are split at dots and compared label by label: numeric labels numerically,
 * numeric labels sort before alphanumeric ones, alphanumeric labels are compared case-insensitively,
 * and if all shared labels are equal the version with fewer labels is the older one.
 * Build metadata is kept in the {@link #getOriginText() origin text} but never takes part in comparisons.
 *
 * <p>As with package ids, the case of the release label carries no meaning for equality.
 */
public final class NuGetVersion implements Comparable<NuGetVersion> {

    private static final Pattern VERSION_PATTERN = Pattern.compile(
            "^(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:\\.(\\d+))?"
            + "(?:-([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?"
            + "(?:\\+([0-9A-Za-z-]+(?:\\.[0-9A-Za-z-]+)*))?$");

    @NotNull
    public static NuGetVersion parse(@NotNull String string) {
        NuGetVersion version = NuGetVersion.tryParse(string);
        if (version == null) {
            throw new IllegalArgumentException("Not a valid NuGet version: \"" + string + "\"");
        }
        return version;
    }

    @Nullable
    public static NuGetVersion tryParse(@Nullable String string) {
        if (string == null) {
            return null;
        }
        String trimmed = string.trim();
        Matcher matcher = NuGetVersion.VERSION_PATTERN.matcher(trimmed);
        if (!matcher.matches()) {
            return null;
        }

        int[] numbers = new int[4];
        for (int i = 0; i < numbers.length; i++) {
            String group = matcher.group(i + 1);
            if (group == null) {
                continue;
            }
            try {
                numbers[i] = Integer.parseInt(group);
            } catch (NumberFormatException e) {
                // Too large for an int
                return null;
            }
        }

        String release = matcher.group(5);
        List<@NotNull String> labels;
        if (release == null) {
            labels = Collections.emptyList();
        } else {
            labels = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(release.split("\\."))));
        }

        return new NuGetVersion(trimmed, numbers, labels);
    }

    private static boolean isNumeric(@NotNull String label) {
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @NotNull
    private static String stripLeadingZeros(@NotNull String numeric) {
        int i = 0;
        while (i < numeric.length() - 1 && numeric.charAt(i) == '0') {
            i++;
        }
        return numeric.substring(i);
    }

    private static int compareLabel(@NotNull String a, @NotNull String b) {
        boolean numericA = NuGetVersion.isNumeric(a);
        boolean numericB = NuGetVersion.isNumeric(b);
        if (numericA && numericB) {
            a = NuGetVersion.stripLeadingZeros(a);
            b = NuGetVersion.stripLeadingZeros(b);
            if (a.length() != b.length()) {
                return Integer.compare(a.length(), b.length());
            }
            return a.compareTo(b);
        } else if (numericA) {
            return -1;
        } else if (numericB) {
            return 1;
        }
        return a.compareToIgnoreCase(b);
    }

    @NotNull
    private final String originText;
    private final int @NotNull[] numbers;
    @NotNull
    private final List<@NotNull String> releaseLabels;

    private NuGetVersion(@NotNull String originText, int @NotNull[] numbers, @NotNull List<@NotNull String> releaseLabels) {
        this.originText = originText;
        this.numbers = numbers;
        this.releaseLabels = releaseLabels;
    }

    @Override
    @Contract(pure = true)
    public int compareTo(@NotNull NuGetVersion other) {
        for (int i = 0; i < this.numbers.length; i++) {
            int cmp = Integer.compare(this.numbers[i], other.numbers[i]);
            if (cmp != 0) {
                return cmp;
            }
        }

        if (this.releaseLabels.isEmpty()) {
            return other.releaseLabels.isEmpty() ? 0 : 1;
        } else if (other.releaseLabels.isEmpty()) {
            return -1;
        }

        int shared = Math.min(this.releaseLabels.size(), other.releaseLabels.size());
        for (int i = 0; i < shared; i++) {
            int cmp = NuGetVersion.compareLabel(this.releaseLabels.get(i), other.releaseLabels.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.releaseLabels.size(), other.releaseLabels.size());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof NuGetVersion) {
            return this.compareTo((NuGetVersion) obj) == 0;
        }
        return false;
    }

    /**
     * Obtains the version string as it was passed to {@link #parse(String)}, minus surrounding whitespace.
     * This is the text used for file names, as the normalized form may differ from what the index advertises.
     *
     * @return The origin text of this version
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Override
    public int hashCode() {
        int hash = Arrays.hashCode(this.numbers);
        for (String label : this.releaseLabels) {
            String key = NuGetVersion.isNumeric(label) ? NuGetVersion.stripLeadingZeros(label) : label.toLowerCase(Locale.ROOT);
            hash = 31 * hash + key.hashCode();
        }
        return hash;
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull NuGetVersion other) {
        return this.compareTo(Objects.requireNonNull(other, "other may not be null")) > 0;
    }

    @Contract(pure = true)
    public boolean isPrerelease() {
        return !this.releaseLabels.isEmpty();
    }

    /**
     * Obtains the normalized form of this version: three numeric components, the revision only if it is
     * not zero and the release label if present. Build metadata is dropped.
     *
     * @return The normalized version string
     */
    @NotNull
    @Contract(pure = true)
    public String toNormalizedString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.numbers[0]).append('.').append(this.numbers[1]).append('.').append(this.numbers[2]);
        if (this.numbers[3] != 0) {
            builder.append('.').append(this.numbers[3]);
        }
        if (!this.releaseLabels.isEmpty()) {
            builder.append('-').append(String.join(".", this.releaseLabels));
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        return this.originText;
    }
}
