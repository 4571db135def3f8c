package org.stianloader.refresolve.packaging;

import java.nio.file.Path;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.PackageIdentity;

/**
 * A package that is present on disk, together with the directory it is installed in.
 */
public final record InstalledPackage(@NotNull PackageIdentity identity, @NotNull Path directory) {
}
