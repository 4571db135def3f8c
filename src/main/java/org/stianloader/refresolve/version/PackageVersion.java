package org.stianloader.refresolve.version;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A semantic version as used by package registries. The version consists of up to four numeric
 * components (major, minor, patch and a legacy revision component), an optional dot-separated
 * prerelease label introduced by '-' and optional build metadata introduced by '+'.
 *
 * <p>Build metadata is kept for display purposes but takes no part in comparisons or equality.
 * Prerelease labels compare case-insensitively, numeric identifiers sort before alphanumeric ones
 * and a release always sorts after all of its prereleases.
 *
 * <p>The originally parsed text is retained in {@link #getOriginText()}, while {@link #toString()}
 * returns the normalized form which is also used for on-disk folder names.
 */
public final class PackageVersion implements Comparable<PackageVersion> {

    @NotNull
    private static final String @NotNull[] NO_LABELS = new String[0];

    @NotNull
    public static PackageVersion parse(@NotNull String string) {
        String text = string.trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Empty version string");
        }

        String metadata = null;
        int plus = text.indexOf('+');
        if (plus != -1) {
            metadata = text.substring(plus + 1);
            text = text.substring(0, plus);
        }

        String[] labels = PackageVersion.NO_LABELS;
        int dash = text.indexOf('-');
        if (dash != -1) {
            String release = text.substring(dash + 1);
            if (release.isEmpty()) {
                throw new IllegalArgumentException("Empty prerelease label in version \"" + string + "\"");
            }
            labels = release.split("\\.", -1);
            for (String label : labels) {
                if (label.isEmpty()) {
                    throw new IllegalArgumentException("Empty prerelease identifier in version \"" + string + "\"");
                }
            }
            text = text.substring(0, dash);
        }

        String[] parts = text.split("\\.", -1);
        if (parts.length > 4) {
            throw new IllegalArgumentException("Version \"" + string + "\" has more than four numeric components");
        }
        int[] numbers = new int[4];
        for (int i = 0; i < parts.length; i++) {
            try {
                numbers[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Version \"" + string + "\" has a non-numeric component \"" + parts[i] + "\"", e);
            }
            if (numbers[i] < 0) {
                throw new IllegalArgumentException("Version \"" + string + "\" has a negative component");
            }
        }

        return new PackageVersion(string, numbers[0], numbers[1], numbers[2], numbers[3], labels, metadata);
    }

    @Nullable
    public static PackageVersion tryParse(@Nullable String string) {
        if (string == null) {
            return null;
        }
        try {
            return PackageVersion.parse(string);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static int compareLabel(@NotNull String a, @NotNull String b) {
        boolean numericA = PackageVersion.isNumeric(a);
        boolean numericB = PackageVersion.isNumeric(b);
        if (numericA && numericB) {
            // Identifiers may exceed the range of an int, so compare by length first
            String trimmedA = PackageVersion.stripLeadingZeros(a);
            String trimmedB = PackageVersion.stripLeadingZeros(b);
            if (trimmedA.length() != trimmedB.length()) {
                return Integer.compare(trimmedA.length(), trimmedB.length());
            }
            return trimmedA.compareTo(trimmedB);
        } else if (numericA) {
            return -1;
        } else if (numericB) {
            return 1;
        }
        return a.compareToIgnoreCase(b);
    }

    private static boolean isNumeric(@NotNull String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    @NotNull
    private static String stripLeadingZeros(@NotNull String s) {
        int i = 0;
        while (i < s.length() - 1 && s.charAt(i) == '0') {
            i++;
        }
        return s.substring(i);
    }

    private final int major;
    private final int minor;
    private final int patch;
    private final int revision;
    @NotNull
    private final String @NotNull[] releaseLabels;
    @Nullable
    private final String metadata;
    @NotNull
    private final String originText;

    private PackageVersion(@NotNull String originText, int major, int minor, int patch, int revision, @NotNull String @NotNull[] releaseLabels, @Nullable String metadata) {
        this.originText = originText;
        this.major = major;
        this.minor = minor;
        this.patch = patch;
        this.revision = revision;
        this.releaseLabels = releaseLabels;
        this.metadata = metadata;
    }

    @Override
    public int compareTo(PackageVersion o) {
        int cmp = Integer.compare(this.major, o.major);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(this.minor, o.minor);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(this.patch, o.patch);
        if (cmp != 0) {
            return cmp;
        }
        cmp = Integer.compare(this.revision, o.revision);
        if (cmp != 0) {
            return cmp;
        }

        if (this.releaseLabels.length == 0 || o.releaseLabels.length == 0) {
            // A release is newer than any of its prereleases
            return Integer.compare(o.releaseLabels.length == 0 ? 0 : 1, this.releaseLabels.length == 0 ? 0 : 1);
        }

        int shared = Math.min(this.releaseLabels.length, o.releaseLabels.length);
        for (int i = 0; i < shared; i++) {
            cmp = PackageVersion.compareLabel(this.releaseLabels[i], o.releaseLabels[i]);
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(this.releaseLabels.length, o.releaseLabels.length);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof PackageVersion) {
            return this.compareTo((PackageVersion) obj) == 0;
        }
        return false;
    }

    @Contract(pure = true)
    public int getMajor() {
        return this.major;
    }

    @Nullable
    @Contract(pure = true)
    public String getMetadata() {
        return this.metadata;
    }

    @Contract(pure = true)
    public int getMinor() {
        return this.minor;
    }

    /**
     * Obtains the string this version was parsed from, as-is.
     *
     * @return The unmodified input of {@link #parse(String)}.
     */
    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    @Contract(pure = true)
    public int getPatch() {
        return this.patch;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getReleaseLabels() {
        List<@NotNull String> labels = new ArrayList<>(this.releaseLabels.length);
        Collections.addAll(labels, this.releaseLabels);
        return Collections.unmodifiableList(labels);
    }

    @Contract(pure = true)
    public int getRevision() {
        return this.revision;
    }

    @Override
    public int hashCode() {
        int hash = Objects.hash(this.major, this.minor, this.patch, this.revision);
        for (String label : this.releaseLabels) {
            hash = hash * 31 + label.toLowerCase(Locale.ROOT).hashCode();
        }
        return hash;
    }

    @Contract(pure = true)
    public boolean isNewerThan(@NotNull PackageVersion other) {
        return this.compareTo(other) > 0;
    }

    @Contract(pure = true)
    public boolean isPrerelease() {
        return this.releaseLabels.length != 0;
    }

    /**
     * Obtains the normalized version string. The revision component is only emitted when it is
     * not zero, build metadata is dropped.
     *
     * @return The normalized version string
     */
    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(this.major).append('.').append(this.minor).append('.').append(this.patch);
        if (this.revision != 0) {
            builder.append('.').append(this.revision);
        }
        if (this.releaseLabels.length != 0) {
            builder.append('-').append(String.join(".", this.releaseLabels));
        }
        return builder.toString();
    }
}
