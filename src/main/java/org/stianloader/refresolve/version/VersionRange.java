package org.stianloader.refresolve.version;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

// Based on https://learn.microsoft.com/en-us/nuget/concepts/package-versioning#version-ranges
public class VersionRange {

    // Basically an interval where the other bound is infinity.
    private static class Edge implements VersionSet {
        private final PackageVersion edgeVersion;
        private final EdgeType type;

        public Edge(PackageVersion edgeVersion, EdgeType type) {
            this.edgeVersion = edgeVersion;
            this.type = type;
        }

        @Override
        public boolean contains(PackageVersion version) {
            if (this.type == EdgeType.UP_TO) {
                return !version.isNewerThan(this.edgeVersion);
            } else if (this.type == EdgeType.UNDER) {
                return this.edgeVersion.isNewerThan(version);
            } else if (this.type == EdgeType.NOT_UNDER) {
                return !this.edgeVersion.isNewerThan(version);
            } else {
                // Type is EdgeType.ABOVE
                return version.isNewerThan(this.edgeVersion);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Edge) {
                Edge other = (Edge) obj;
                return other.edgeVersion.equals(this.edgeVersion) && other.type.equals(this.type);
            }
            return false;
        }

        @Override
        @Nullable
        public PackageVersion getLowerBound() {
            return this.type == EdgeType.NOT_UNDER || this.type == EdgeType.ABOVE ? this.edgeVersion : null;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.edgeVersion, this.type);
        }

        @Override
        public boolean isLowerBoundInclusive() {
            return this.type == EdgeType.NOT_UNDER;
        }

        @Override
        public String toString() {
            if (this.type == EdgeType.UP_TO) {
                return "(," + this.edgeVersion + ']';
            } else if (this.type == EdgeType.UNDER) {
                return "(," + this.edgeVersion + ')';
            } else if (this.type == EdgeType.NOT_UNDER) {
                return "[" + this.edgeVersion + ",)";
            } else {
                // Type is EdgeType.ABOVE
                return "(" + this.edgeVersion + ",)";
            }
        }
    }

    private enum EdgeType {
        UP_TO,     // x <= 1.0 - (,1.0]
        UNDER,     // x <  1.0 - (,1.0)
        NOT_UNDER, // x >= 1.0 - [1.0,) or 1.0
        ABOVE;     // x >  1.0 - (1.0,)
    }

    private static class Interval implements VersionSet {
        // lower bound is the oldest accepted version (for a closed interval that is)
        private final PackageVersion lowerBound;
        // upper bound is the newest accepted version (for a closed interval that is)
        private final PackageVersion upperBound;
        private final IntervalType type;

        public Interval(PackageVersion lowerBound, PackageVersion upperBound, IntervalType type) {
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
            this.type = type;
        }

        @Override
        public boolean contains(PackageVersion version) {
            if (this.type == IntervalType.CLOSED) {
                return !version.isNewerThan(this.upperBound) && !this.lowerBound.isNewerThan(version);
            } else if (this.type == IntervalType.UPPER_OPEN) {
                return this.upperBound.isNewerThan(version) && !this.lowerBound.isNewerThan(version);
            } else if (this.type == IntervalType.LOWER_OPEN) {
                return !version.isNewerThan(this.upperBound) && version.isNewerThan(this.lowerBound);
            } else {
                // type is IntervalType.BOTH_OPEN
                return version.isNewerThan(this.lowerBound) && this.upperBound.isNewerThan(version);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (obj instanceof Interval) {
                Interval other = (Interval) obj;
                return other.lowerBound.equals(this.lowerBound)
                        && other.upperBound.equals(this.upperBound)
                        && other.type.equals(this.type);
            }
            return false;
        }

        @Override
        @NotNull
        public PackageVersion getLowerBound() {
            return this.lowerBound;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.lowerBound, this.upperBound, this.type);
        }

        @Override
        public boolean isLowerBoundInclusive() {
            return this.type == IntervalType.CLOSED || this.type == IntervalType.UPPER_OPEN;
        }

        @Override
        public String toString() {
            if (this.type == IntervalType.CLOSED) {
                return '[' + this.lowerBound.toString() + ", " + this.upperBound + ']';
            } else if (this.type == IntervalType.UPPER_OPEN) {
                return '[' + this.lowerBound.toString() + ", " + this.upperBound + ')';
            } else if (this.type == IntervalType.LOWER_OPEN) {
                return '(' + this.lowerBound.toString() + ", " + this.upperBound + ']';
            } else {
                // type is IntervalType.BOTH_OPEN
                return '(' + this.lowerBound.toString() + ", " + this.upperBound + ')';
            }
        }
    }

    private enum IntervalType {
        BOTH_OPEN,   // a <  x <  b - (a,b)
        CLOSED,      // a <= x <= b - [a,b]
        UPPER_OPEN,  // a <= x <  b - [a,b)
        LOWER_OPEN;  // a <  x <= b - (a,b]
    }

    private static class PinnedVersion implements VersionSet {
        private final PackageVersion version;

        public PinnedVersion(PackageVersion version) {
            this.version = version;
        }

        @Override
        public boolean contains(PackageVersion version) {
            return this.version.compareTo(version) == 0;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof PinnedVersion && ((PinnedVersion) obj).version.equals(this.version);
        }

        @Override
        @NotNull
        public PackageVersion getLowerBound() {
            return this.version;
        }

        @Override
        public int hashCode() {
            return this.version.hashCode();
        }

        @Override
        public boolean isLowerBoundInclusive() {
            return true;
        }

        @Override
        public String toString() {
            return '[' + this.version.toString() + ']';
        }
    }

    private static interface VersionSet {
        boolean contains(PackageVersion version);

        @Nullable
        PackageVersion getLowerBound();

        boolean isLowerBoundInclusive();
    }

    /**
     * Sentinel value marking a version range which allows any version, corresponding to the
     * strings "", "*" and "(,)". As it has no lower bound, {@link #getMinVersion()} returns null.
     */
    @NotNull
    public static final VersionRange ALL = new VersionRange(Collections.emptyList());

    /**
     * Creates a range that only accepts the given version, that is "[version]".
     *
     * @param version The only version to accept
     * @return A pinned version range
     */
    @NotNull
    public static VersionRange exactly(@NotNull PackageVersion version) {
        return new VersionRange(Collections.singletonList(new PinnedVersion(Objects.requireNonNull(version, "version may not be null"))));
    }

    /**
     * Creates a range that accepts the given version and everything newer than it, that is "[version,)".
     * This is also the meaning of a plain version string such as "1.0.0".
     *
     * @param version The minimum (inclusive) version
     * @return A version range with an inclusive lower bound and no upper bound
     */
    @NotNull
    public static VersionRange atLeast(@NotNull PackageVersion version) {
        return new VersionRange(Collections.singletonList(new Edge(Objects.requireNonNull(version, "version may not be null"), EdgeType.NOT_UNDER)));
    }

    @NotNull
    public static VersionRange parse(@NotNull String string) {
        String token = string.trim();
        if (token.isEmpty() || token.equals("*") || token.equals("(,)")) {
            return VersionRange.ALL;
        }

        int first = token.codePointAt(0);
        if (first != '[' && first != '(') {
            // A plain version is an inclusive minimum, not a pin
            return VersionRange.atLeast(PackageVersion.parse(token));
        }

        int last = token.codePointAt(token.length() - 1);
        if (last != ']' && last != ')') {
            throw new IllegalArgumentException("Unterminated version range \"" + string + "\"");
        }
        boolean closedLeft = first == '[';
        boolean closedRight = last == ']';
        String inner = token.substring(1, token.length() - 1).trim();

        int separatorPos = inner.indexOf(',');
        if (separatorPos == -1) {
            if (closedLeft && closedRight && !inner.isEmpty()) {
                return VersionRange.exactly(PackageVersion.parse(inner));
            }
            throw new IllegalArgumentException("Invalid version range \"" + string + "\"");
        }
        if (inner.indexOf(',', separatorPos + 1) != -1) {
            throw new IllegalArgumentException("Version range \"" + string + "\" has more than two bounds");
        }

        String left = inner.substring(0, separatorPos).trim();
        String right = inner.substring(separatorPos + 1).trim();

        if (left.isEmpty() && right.isEmpty()) {
            return VersionRange.ALL;
        } else if (left.isEmpty()) {
            return new VersionRange(Collections.singletonList(new Edge(PackageVersion.parse(right), closedRight ? EdgeType.UP_TO : EdgeType.UNDER)));
        } else if (right.isEmpty()) {
            return new VersionRange(Collections.singletonList(new Edge(PackageVersion.parse(left), closedLeft ? EdgeType.NOT_UNDER : EdgeType.ABOVE)));
        }

        PackageVersion lower = PackageVersion.parse(left);
        PackageVersion upper = PackageVersion.parse(right);
        if (lower.isNewerThan(upper)) {
            throw new IllegalArgumentException("Lower bound of version range \"" + string + "\" exceeds its upper bound");
        }
        IntervalType type;
        if (closedLeft) {
            if (closedRight) {
                type = IntervalType.CLOSED;
            } else {
                type = IntervalType.UPPER_OPEN;
            }
        } else {
            if (closedRight) {
                type = IntervalType.LOWER_OPEN;
            } else {
                type = IntervalType.BOTH_OPEN;
            }
        }
        return new VersionRange(Collections.singletonList(new Interval(lower, upper, type)));
    }

    @NotNull
    private final List<@NotNull VersionSet> versionSets;

    private VersionRange(@NotNull List<@NotNull VersionSet> sets) {
        this.versionSets = Collections.unmodifiableList(new ArrayList<>(sets));
    }

    @Contract(pure = true)
    public boolean containsVersion(@NotNull PackageVersion version) {
        for (VersionSet set : this.versionSets) {
            if (!set.contains(version)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof VersionRange) {
            return ((VersionRange) obj).versionSets.equals(this.versionSets);
        }
        return false;
    }

    /**
     * Obtains the lowest version this range could possibly accept. For ranges with an exclusive
     * lower bound the bound itself is returned nonetheless, mirroring how package registries
     * pick the version a dependency is traversed with.
     *
     * <p>If the range is the intersection of multiple ranges, the highest lower bound is returned.
     *
     * @return The lower bound, or null if the range is not bounded below
     */
    @Nullable
    @Contract(pure = true)
    public PackageVersion getMinVersion() {
        PackageVersion min = null;
        for (VersionSet set : this.versionSets) {
            PackageVersion bound = set.getLowerBound();
            if (bound != null && (min == null || bound.isNewerThan(min))) {
                min = bound;
            }
        }
        return min;
    }

    @Override
    public int hashCode() {
        return this.versionSets.hashCode();
    }

    @NotNull
    @Contract(pure = true)
    public VersionRange intersect(@NotNull VersionRange range) {
        if (this == VersionRange.ALL) {
            return range;
        } else if (range == VersionRange.ALL) {
            return this;
        }

        List<@NotNull VersionSet> sets = new ArrayList<>(this.versionSets);
        for (VersionSet set : range.versionSets) {
            if (!sets.contains(set)) {
                sets.add(set);
            }
        }
        return new VersionRange(sets);
    }

    @Contract(pure = true)
    public boolean isMinInclusive() {
        PackageVersion min = this.getMinVersion();
        if (min == null) {
            return false;
        }
        for (VersionSet set : this.versionSets) {
            PackageVersion bound = set.getLowerBound();
            if (bound != null && bound.compareTo(min) == 0 && !set.isLowerBoundInclusive()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Selects the lowest version out of the given versions that lies within this range.
     *
     * @param candidates The versions to choose from
     * @return The lowest matching version, or null if none matches
     */
    @Nullable
    public PackageVersion selectLowest(@NotNull Collection<@NotNull PackageVersion> candidates) {
        PackageVersion selected = null;
        for (PackageVersion candidate : candidates) {
            if ((selected == null || selected.isNewerThan(candidate)) && this.containsVersion(candidate)) {
                selected = candidate;
            }
        }
        return selected;
    }

    @Override
    public String toString() {
        if (this.versionSets.isEmpty()) {
            return "(, )";
        }
        StringBuilder builder = new StringBuilder();
        for (VersionSet set : this.versionSets) {
            builder.append(set.toString());
            builder.append(" && ");
        }
        builder.setLength(builder.length() - 4);
        return builder.toString();
    }
}
