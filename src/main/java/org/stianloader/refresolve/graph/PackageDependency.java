package org.stianloader.refresolve.graph;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.version.VersionRange;

/**
 * A dependency as declared by a package: the id of the required package and the range of versions
 * the declaring package accepts. Unlike {@link org.stianloader.refresolve.PackageIdentity} this does
 * not name a concrete version.
 */
public final record PackageDependency(@NotNull String id, @NotNull VersionRange range) {
}
