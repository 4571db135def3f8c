package org.stianloader.refresolve.framework;

import java.util.Collection;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.framework.TargetFramework.Family;
import org.stianloader.refresolve.version.PackageVersion;

/**
 * Decides which frameworks can consume assets built for other frameworks and picks the nearest
 * such asset framework for a compilation target.
 *
 * <p>Compatibility follows the rules of the .NET package ecosystem:
 * <ul>
 * <li>Within the same family, assets for the same or an older version are usable.</li>
 * <li>.NET Standard assets are usable by .NET Framework and .NET Core App targets that implement
 * that .NET Standard version.</li>
 * <li>Framework-agnostic assets are usable by every target.</li>
 * <li>Generic frameworks only consume assets of the same identifier, again for the same or an
 * older version.</li>
 * <li>Unsupported frameworks are not usable by anything, nor can they consume anything.</li>
 * </ul>
 *
 * <p>Among the compatible frameworks, those of the target's own family are preferred over
 * .NET Standard, which in turn is preferred over framework-agnostic assets. Within each tier the
 * highest version wins. This ordering is monotonic: adding a more specific compatible framework
 * never makes the result less specific.
 */
public class FrameworkReducer {

    @NotNull
    private static final PackageVersion NETSTANDARD_1_1 = PackageVersion.parse("1.1");
    @NotNull
    private static final PackageVersion NETSTANDARD_1_2 = PackageVersion.parse("1.2");
    @NotNull
    private static final PackageVersion NETSTANDARD_1_3 = PackageVersion.parse("1.3");
    @NotNull
    private static final PackageVersion NETSTANDARD_1_6 = PackageVersion.parse("1.6");
    @NotNull
    private static final PackageVersion NETSTANDARD_2_0 = PackageVersion.parse("2.0");
    @NotNull
    private static final PackageVersion NETSTANDARD_2_1 = PackageVersion.parse("2.1");

    @NotNull
    private static final PackageVersion NETFRAMEWORK_4_5 = PackageVersion.parse("4.5");
    @NotNull
    private static final PackageVersion NETFRAMEWORK_4_5_1 = PackageVersion.parse("4.5.1");
    @NotNull
    private static final PackageVersion NETFRAMEWORK_4_6 = PackageVersion.parse("4.6");
    @NotNull
    private static final PackageVersion NETFRAMEWORK_4_6_1 = PackageVersion.parse("4.6.1");

    @NotNull
    private static final PackageVersion NETCOREAPP_2_0 = PackageVersion.parse("2.0");
    @NotNull
    private static final PackageVersion NETCOREAPP_3_0 = PackageVersion.parse("3.0");

    /**
     * Obtains the highest .NET Standard version implemented by the given framework.
     *
     * @param target The implementing framework
     * @return The highest implemented .NET Standard version, or null if none
     */
    @Nullable
    @Contract(pure = true)
    public static PackageVersion getImplementedStandard(@NotNull TargetFramework target) {
        PackageVersion version = target.getVersion();
        if (target.getFamily() == Family.NET_STANDARD) {
            return version;
        } else if (target.getFamily() == Family.NET_FRAMEWORK) {
            if (FrameworkReducer.NETFRAMEWORK_4_5.isNewerThan(version)) {
                return null;
            } else if (FrameworkReducer.NETFRAMEWORK_4_5_1.isNewerThan(version)) {
                return FrameworkReducer.NETSTANDARD_1_1;
            } else if (FrameworkReducer.NETFRAMEWORK_4_6.isNewerThan(version)) {
                return FrameworkReducer.NETSTANDARD_1_2;
            } else if (FrameworkReducer.NETFRAMEWORK_4_6_1.isNewerThan(version)) {
                return FrameworkReducer.NETSTANDARD_1_3;
            }
            return FrameworkReducer.NETSTANDARD_2_0;
        } else if (target.getFamily() == Family.NET_CORE_APP) {
            if (FrameworkReducer.NETCOREAPP_2_0.isNewerThan(version)) {
                return FrameworkReducer.NETSTANDARD_1_6;
            } else if (FrameworkReducer.NETCOREAPP_3_0.isNewerThan(version)) {
                return FrameworkReducer.NETSTANDARD_2_0;
            }
            return FrameworkReducer.NETSTANDARD_2_1;
        }
        return null;
    }

    @Contract(pure = true)
    public boolean isCompatible(@NotNull TargetFramework target, @NotNull TargetFramework candidate) {
        if (target.getFamily() == Family.UNSUPPORTED || candidate.getFamily() == Family.UNSUPPORTED) {
            return false;
        }
        if (candidate.getFamily() == Family.AGNOSTIC) {
            return true;
        }
        if (candidate.isSameFramework(target)) {
            return !candidate.getVersion().isNewerThan(target.getVersion());
        }
        if (candidate.getFamily() == Family.NET_STANDARD) {
            PackageVersion implemented = FrameworkReducer.getImplementedStandard(target);
            return implemented != null && !candidate.getVersion().isNewerThan(implemented);
        }
        return false;
    }

    /**
     * Obtains the nearest framework out of a collection of candidates for the given target.
     * If multiple equal candidates exist, the first one is returned.
     *
     * @param target The framework to compile against
     * @param candidates The frameworks the available assets are built for
     * @return The nearest compatible candidate, or null if none is compatible
     */
    @Nullable
    public TargetFramework getNearest(@NotNull TargetFramework target, @NotNull Collection<@NotNull TargetFramework> candidates) {
        TargetFramework nearest = null;
        for (TargetFramework candidate : candidates) {
            if (!this.isCompatible(target, candidate)) {
                continue;
            }
            if (nearest == null || this.isNearer(target, candidate, nearest)) {
                nearest = candidate;
            }
        }
        return nearest;
    }

    private boolean isNearer(@NotNull TargetFramework target, @NotNull TargetFramework candidate, @NotNull TargetFramework current) {
        int candidateTier = FrameworkReducer.tier(target, candidate);
        int currentTier = FrameworkReducer.tier(target, current);
        if (candidateTier != currentTier) {
            return candidateTier < currentTier;
        }
        return candidate.getVersion().isNewerThan(current.getVersion());
    }

    private static int tier(@NotNull TargetFramework target, @NotNull TargetFramework candidate) {
        if (candidate.isSameFramework(target)) {
            return 0;
        } else if (candidate.getFamily() == Family.NET_STANDARD) {
            return 1;
        }
        return 2;
    }
}
