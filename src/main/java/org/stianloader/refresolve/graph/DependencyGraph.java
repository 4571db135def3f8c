package org.stianloader.refresolve.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.version.PackageVersion;

/**
 * The packages discovered while expanding the dependencies of a descriptor, in discovery order.
 * Each identity is recorded at most once.
 */
public class DependencyGraph {

    @NotNull
    private final Map<PackageIdentity, DependencyInfo> packages = new LinkedHashMap<>();

    @Contract(pure = true)
    public boolean contains(@NotNull PackageIdentity identity) {
        return this.packages.containsKey(identity);
    }

    @Nullable
    @Contract(pure = true)
    public DependencyInfo get(@NotNull PackageIdentity identity) {
        return this.packages.get(identity);
    }

    @NotNull
    @Contract(pure = true)
    public Set<@NotNull PackageIdentity> getIdentities() {
        return Collections.unmodifiableSet(this.packages.keySet());
    }

    @NotNull
    @Contract(pure = true)
    public Collection<@NotNull DependencyInfo> getPackages() {
        return Collections.unmodifiableCollection(this.packages.values());
    }

    /**
     * Obtains all versions of the package with the given id that are present in the graph.
     *
     * @param id The package id, compared without regard to case
     * @return The versions in ascending order
     */
    @NotNull
    public List<@NotNull PackageVersion> getVersions(@NotNull String id) {
        List<@NotNull PackageVersion> versions = new ArrayList<>();
        for (PackageIdentity identity : this.packages.keySet()) {
            if (identity.hasId(id) && !versions.contains(identity.version())) {
                versions.add(identity.version());
            }
        }
        Collections.sort(versions);
        return versions;
    }

    void put(@NotNull DependencyInfo info) {
        this.packages.putIfAbsent(info.getIdentity(), info);
    }

    @Contract(pure = true)
    public int size() {
        return this.packages.size();
    }

    @Override
    @NotNull
    public String toString() {
        return "DependencyGraph" + this.packages.keySet();
    }
}
