package org.stianloader.refresolve.packaging;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * A folder of installed packages laid out as "&lt;id&gt;/&lt;version&gt;/" in lower case, as used by
 * the global packages folder. A package counts as installed once one of the completion markers
 * NuGet writes exists: the {@value #METADATA_FILE_NAME} file, or the
 * "&lt;id&gt;.&lt;version&gt;.nupkg.sha512" hash file that older NuGet clients write instead.
 * A package directory without either marker is a leftover of an interrupted extraction.
 */
public class PackageFolder {

    public static final String METADATA_FILE_NAME = ".nupkg.metadata";

    @NotNull
    private final Path root;

    public PackageFolder(@NotNull Path root) {
        this.root = Objects.requireNonNull(root, "root may not be null").toAbsolutePath().normalize();
    }

    /**
     * Obtains the directory the given package is or would be installed in.
     *
     * @param identity The package
     * @return The package directory
     * @throws InvalidPathException If the resulting path is not valid on this file system
     */
    @NotNull
    public Path getPackageDirectory(@NotNull PackageIdentity identity) {
        return this.root.resolve(identity.lowerCaseId()).resolve(PackageFolder.getVersionFolderName(identity));
    }

    @NotNull
    @Contract(pure = true)
    public static String getVersionFolderName(@NotNull PackageIdentity identity) {
        return identity.version().toString().toLowerCase(Locale.ROOT);
    }

    @NotNull
    @Contract(pure = true)
    public static String getArchiveFileName(@NotNull PackageIdentity identity) {
        return identity.lowerCaseId() + "." + PackageFolder.getVersionFolderName(identity) + ".nupkg";
    }

    @NotNull
    @Contract(pure = true)
    public static String getHashFileName(@NotNull PackageIdentity identity) {
        return PackageFolder.getArchiveFileName(identity) + ".sha512";
    }

    /**
     * Obtains the installation directory of a package if the package is fully installed in this
     * folder. Paths that cannot be represented on this file system (for example because they are
     * too long) are treated as not installed.
     *
     * @param identity The package
     * @return The installation directory, or null if not installed
     */
    @Nullable
    public Path getInstalledPath(@NotNull PackageIdentity identity) {
        try {
            Path directory = this.getPackageDirectory(identity);
            if (Files.isRegularFile(directory.resolve(PackageFolder.METADATA_FILE_NAME))
                    || Files.isRegularFile(directory.resolve(PackageFolder.getHashFileName(identity)))) {
                LoggingAdapter.getDefaultLogger().debug(PackageFolder.class, "Found {} installed at {}", identity, directory);
                return directory;
            }
        } catch (InvalidPathException | SecurityException e) {
            LoggingAdapter.getDefaultLogger().debug(PackageFolder.class, "Unable to probe {} in {}", identity, this.root, e);
        }
        return null;
    }

    @NotNull
    @Contract(pure = true)
    public Path getRoot() {
        return this.root;
    }

    @Override
    @NotNull
    public String toString() {
        return "PackageFolder[" + this.root + "]";
    }
}
