package org.stianloader.refresolve.packaging;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.framework.FrameworkSpecificGroup;
import org.stianloader.refresolve.framework.TargetFramework;

/**
 * Groups the contents of a package by the asset kind ("lib", "ref" or "framework") and by the
 * framework each asset applies to. Files placed directly in the "lib" folder apply to any
 * framework.
 *
 * <p>All file paths are relative to the package root and use '/' as the separator.
 */
public abstract class PackageReader {

    public static final String LIB_FOLDER = "lib";
    public static final String REF_FOLDER = "ref";

    @NotNull
    private static List<@NotNull FrameworkSpecificGroup> groupItems(@NotNull List<@NotNull String> files, @NotNull String folder) {
        Map<TargetFramework, List<@NotNull String>> grouped = new LinkedHashMap<>();
        String prefix = folder + '/';
        for (String file : files) {
            if (!file.toLowerCase(Locale.ROOT).startsWith(prefix) || file.endsWith("/")) {
                continue;
            }
            String remainder = file.substring(prefix.length());
            int slash = remainder.indexOf('/');
            TargetFramework framework;
            if (slash == -1) {
                framework = TargetFramework.ANY;
            } else {
                framework = TargetFramework.parse(remainder.substring(0, slash));
            }
            grouped.computeIfAbsent(framework, (ignored) -> new ArrayList<>()).add(file);
        }
        List<@NotNull FrameworkSpecificGroup> groups = new ArrayList<>();
        grouped.forEach((framework, items) -> groups.add(new FrameworkSpecificGroup(framework, items)));
        return groups;
    }

    /**
     * Obtains the relative paths of all files within the package.
     *
     * @return The files of the package
     * @throws IOException If the files could not be listed
     */
    @NotNull
    public abstract List<@NotNull String> getFiles() throws IOException;

    @NotNull
    public List<@NotNull FrameworkSpecificGroup> getFrameworkItems() throws IOException {
        NuspecReader nuspec = this.getNuspec();
        if (nuspec == null) {
            return Collections.emptyList();
        }
        return nuspec.getFrameworkAssemblyGroups();
    }

    @NotNull
    public List<@NotNull FrameworkSpecificGroup> getLibItems() throws IOException {
        return PackageReader.groupItems(this.getFiles(), PackageReader.LIB_FOLDER);
    }

    /**
     * Obtains the manifest of the package, if the package has one.
     *
     * @return The manifest, or null
     * @throws IOException If the manifest could not be read
     */
    @Nullable
    public abstract NuspecReader getNuspec() throws IOException;

    @NotNull
    public List<@NotNull FrameworkSpecificGroup> getRefItems() throws IOException {
        return PackageReader.groupItems(this.getFiles(), PackageReader.REF_FOLDER);
    }

    /**
     * Checks whether the package carries any compile-time assets, that is files below the
     * "lib" or "ref" folders.
     *
     * @return True if compile-time assets are present
     * @throws IOException If the files could not be listed
     */
    public boolean hasLibOrRef() throws IOException {
        for (String file : this.getFiles()) {
            String lower = file.toLowerCase(Locale.ROOT);
            if (lower.startsWith(PackageReader.LIB_FOLDER + '/') || lower.startsWith(PackageReader.REF_FOLDER + '/')) {
                return true;
            }
        }
        return false;
    }
}
