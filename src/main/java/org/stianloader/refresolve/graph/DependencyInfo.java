package org.stianloader.refresolve.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.repo.PackageRegistry;

/**
 * The dependencies a single package declares for a given target framework, together with the
 * registry which supplied that information. The registry is considered authoritative for the
 * package and is later used to download it.
 */
public class DependencyInfo {
    @NotNull
    private final PackageIdentity identity;
    @NotNull
    private final List<@NotNull PackageDependency> dependencies;
    @NotNull
    private final PackageRegistry source;

    public DependencyInfo(@NotNull PackageIdentity identity, @NotNull List<@NotNull PackageDependency> dependencies, @NotNull PackageRegistry source) {
        this.identity = Objects.requireNonNull(identity, "identity may not be null");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.source = Objects.requireNonNull(source, "source may not be null");
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull PackageDependency> getDependencies() {
        return this.dependencies;
    }

    @NotNull
    @Contract(pure = true)
    public PackageIdentity getIdentity() {
        return this.identity;
    }

    @NotNull
    @Contract(pure = true)
    public PackageRegistry getSource() {
        return this.source;
    }

    @Override
    @NotNull
    public String toString() {
        return "DependencyInfo[identity=" + this.identity + " source=" + this.source.getRegistryId() + " dependencies=" + this.dependencies + "]";
    }
}
