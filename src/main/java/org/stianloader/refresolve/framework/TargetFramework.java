package org.stianloader.refresolve.framework;

import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.version.PackageVersion;

/**
 * A compilation target such as ".NET Framework 4.7.2" or ".NET Standard 2.0". Target frameworks
 * are parsed from the short folder names used inside packages ("net472", "netstandard2.0",
 * "netcoreapp2.1", "net6.0") as well as from the long names used in package manifests
 * (".NETFramework4.5", ".NETStandard,Version=v2.0").
 *
 * <p>Other short names made of letters and an optional version, such as "win8" or "uap10.0",
 * parse into a {@link Family#GENERIC generic} framework identified by its letters. Names that fit
 * neither form parse into an {@link Family#UNSUPPORTED unsupported} framework, which is
 * compatible with nothing.
 */
public final class TargetFramework {

    public enum Family {
        NET_FRAMEWORK(".NETFramework"),
        NET_STANDARD(".NETStandard"),
        NET_CORE_APP(".NETCoreApp"),
        /**
         * Framework-agnostic assets, for example files placed directly in the "lib" folder.
         */
        AGNOSTIC("Any"),
        /**
         * A framework outside of the well-known families. Generic frameworks only relate to
         * frameworks of the same {@link TargetFramework#getIdentifier() identifier}.
         */
        GENERIC("Generic"),
        UNSUPPORTED("Unsupported");

        @NotNull
        private final String frameworkName;

        private Family(@NotNull String frameworkName) {
            this.frameworkName = frameworkName;
        }

        @NotNull
        @Contract(pure = true)
        public String getFrameworkName() {
            return this.frameworkName;
        }
    }

    @NotNull
    private static final PackageVersion EMPTY_VERSION = PackageVersion.parse("0.0");

    @NotNull
    public static final TargetFramework ANY = new TargetFramework(Family.AGNOSTIC, TargetFramework.EMPTY_VERSION, "any");

    /**
     * Parses a target framework moniker. Both the short folder form and the long form are accepted.
     * An empty string denotes {@link #ANY}.
     *
     * @param name The name to parse
     * @return The parsed framework, never null
     */
    @NotNull
    public static TargetFramework parse(@NotNull String name) {
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            return TargetFramework.ANY;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.equals("any") || lower.equals("agnostic")) {
            return TargetFramework.ANY;
        }
        if (lower.startsWith(".")) {
            return TargetFramework.parseLongName(trimmed, lower);
        }

        // Platform suffixes as in net6.0-windows do not matter for reference resolution
        int dash = lower.indexOf('-');
        if (dash != -1) {
            lower = lower.substring(0, dash);
        }

        if (lower.startsWith("netstandard")) {
            return TargetFramework.create(Family.NET_STANDARD, lower.substring("netstandard".length()), trimmed);
        } else if (lower.startsWith("netcoreapp")) {
            return TargetFramework.create(Family.NET_CORE_APP, lower.substring("netcoreapp".length()), trimmed);
        } else if (lower.startsWith("net")) {
            String version = lower.substring("net".length());
            if (version.indexOf('.') != -1) {
                // net5.0 and later are .NET Core under a new name
                PackageVersion parsed = PackageVersion.tryParse(version);
                if (parsed != null && parsed.getMajor() >= 5) {
                    return new TargetFramework(Family.NET_CORE_APP, parsed, trimmed);
                }
            }
            return TargetFramework.create(Family.NET_FRAMEWORK, version, trimmed);
        }
        return TargetFramework.parseGeneric(lower, trimmed);
    }

    @NotNull
    private static TargetFramework create(@NotNull Family family, @NotNull String version, @NotNull String origin) {
        PackageVersion parsed = TargetFramework.parseFrameworkVersion(version);
        if (parsed == null) {
            return new TargetFramework(Family.UNSUPPORTED, TargetFramework.EMPTY_VERSION, origin);
        }
        return new TargetFramework(family, parsed, origin);
    }

    @NotNull
    private static TargetFramework parseGeneric(@NotNull String lower, @NotNull String origin) {
        int split = 0;
        while (split < lower.length() && lower.charAt(split) >= 'a' && lower.charAt(split) <= 'z') {
            split++;
        }
        String identifier = lower.substring(0, split);
        PackageVersion version = split == 0 ? null : TargetFramework.parseFrameworkVersion(lower.substring(split));
        // Portable class library profiles have compatibility rules of their own
        if (version == null || identifier.equals("portable")) {
            return new TargetFramework(Family.UNSUPPORTED, TargetFramework.EMPTY_VERSION, origin);
        }
        return new TargetFramework(Family.GENERIC, identifier, version, origin);
    }

    @NotNull
    private static TargetFramework parseLongName(@NotNull String origin, @NotNull String lower) {
        Family family = null;
        String remainder = null;
        for (Family candidate : Family.values()) {
            String prefix = candidate.getFrameworkName().toLowerCase(Locale.ROOT);
            if (lower.startsWith(prefix)) {
                family = candidate;
                remainder = lower.substring(prefix.length());
                break;
            }
        }
        if (family == null || remainder == null) {
            return new TargetFramework(Family.UNSUPPORTED, TargetFramework.EMPTY_VERSION, origin);
        }
        remainder = remainder.trim();
        if (remainder.startsWith(",")) {
            remainder = remainder.substring(1).trim();
        }
        if (remainder.startsWith("version=")) {
            remainder = remainder.substring("version=".length());
        }
        if (remainder.startsWith("v")) {
            remainder = remainder.substring(1);
        }
        if (remainder.isEmpty()) {
            return new TargetFramework(family, TargetFramework.EMPTY_VERSION, origin);
        }
        PackageVersion version = PackageVersion.tryParse(remainder);
        if (version == null) {
            return new TargetFramework(Family.UNSUPPORTED, TargetFramework.EMPTY_VERSION, origin);
        }
        return new TargetFramework(family, version, origin);
    }

    /**
     * Parses the version part of a short folder name. Dotted versions are parsed as-is,
     * undotted ones use one digit per component ("472" is 4.7.2).
     */
    @Nullable
    private static PackageVersion parseFrameworkVersion(@NotNull String version) {
        if (version.isEmpty()) {
            return TargetFramework.EMPTY_VERSION;
        }
        if (version.indexOf('.') != -1) {
            return PackageVersion.tryParse(version);
        }
        StringBuilder dotted = new StringBuilder();
        for (int i = 0; i < version.length(); i++) {
            char c = version.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
            if (i != 0) {
                dotted.append('.');
            }
            dotted.append(c);
        }
        return PackageVersion.tryParse(dotted.toString());
    }

    @NotNull
    private final Family family;
    @NotNull
    private final String identifier;
    @NotNull
    private final PackageVersion version;
    @NotNull
    private final String originText;

    private TargetFramework(@NotNull Family family, @NotNull PackageVersion version, @NotNull String originText) {
        this(family, family.getFrameworkName(), version, originText);
    }

    private TargetFramework(@NotNull Family family, @NotNull String identifier, @NotNull PackageVersion version, @NotNull String originText) {
        this.family = family;
        this.identifier = identifier;
        this.version = version;
        this.originText = originText;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof TargetFramework) {
            TargetFramework other = (TargetFramework) obj;
            if (this.family == Family.UNSUPPORTED || other.family == Family.UNSUPPORTED) {
                return this.family == other.family && this.originText.equalsIgnoreCase(other.originText);
            }
            return this.isSameFramework(other) && other.version.equals(this.version);
        }
        return false;
    }

    @NotNull
    @Contract(pure = true)
    public Family getFamily() {
        return this.family;
    }

    /**
     * Obtains the name of the framework regardless of its version. This is the
     * {@link Family#getFrameworkName() family name} for the well-known families and the lowercase
     * letters of the moniker for {@link Family#GENERIC generic} frameworks.
     *
     * @return The framework identifier
     */
    @NotNull
    @Contract(pure = true)
    public String getIdentifier() {
        return this.identifier;
    }

    @NotNull
    @Contract(pure = true)
    public String getOriginText() {
        return this.originText;
    }

    /**
     * Obtains the canonical short folder name, for example "net472" or "netstandard2.0".
     *
     * @return The short folder name
     */
    @NotNull
    @Contract(pure = true)
    public String getShortFolderName() {
        switch (this.family) {
        case NET_FRAMEWORK: {
            StringBuilder builder = new StringBuilder("net").append(this.version.getMajor()).append(this.version.getMinor());
            if (this.version.getPatch() != 0) {
                builder.append(this.version.getPatch());
            }
            return builder.toString();
        }
        case NET_STANDARD:
            return "netstandard" + this.version.getMajor() + '.' + this.version.getMinor();
        case NET_CORE_APP:
            if (this.version.getMajor() >= 5) {
                return "net" + this.version.getMajor() + '.' + this.version.getMinor();
            }
            return "netcoreapp" + this.version.getMajor() + '.' + this.version.getMinor();
        case AGNOSTIC:
            return "any";
        case GENERIC: {
            if (this.version.equals(TargetFramework.EMPTY_VERSION)) {
                return this.identifier;
            }
            StringBuilder builder = new StringBuilder(this.identifier).append(this.version.getMajor());
            if (this.version.getMinor() != 0 || this.version.getPatch() != 0) {
                builder.append('.').append(this.version.getMinor());
            }
            if (this.version.getPatch() != 0) {
                builder.append('.').append(this.version.getPatch());
            }
            return builder.toString();
        }
        default:
            return this.originText;
        }
    }

    @NotNull
    @Contract(pure = true)
    public PackageVersion getVersion() {
        return this.version;
    }

    @Override
    public int hashCode() {
        if (this.family == Family.UNSUPPORTED) {
            return this.originText.toLowerCase(Locale.ROOT).hashCode();
        }
        return Objects.hash(this.family, this.identifier, this.version);
    }

    /**
     * Checks whether both frameworks are versions of the same framework, that is whether they share
     * family and identifier.
     *
     * @param other The framework to compare with
     * @return True if only the versions may differ
     */
    @Contract(pure = true)
    public boolean isSameFramework(@NotNull TargetFramework other) {
        return this.family == other.family && this.identifier.equals(other.identifier);
    }

    @Override
    @NotNull
    public String toString() {
        return this.getShortFolderName();
    }
}
