package org.stianloader.refresolve.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.logging.LoggingAdapter;
import org.stianloader.refresolve.repo.PackageRegistry;
import org.stianloader.refresolve.repo.RegistryCacheContext;
import org.stianloader.refresolve.version.PackageVersion;

/**
 * Builds the {@link DependencyGraph} of a set of packages by expanding their dependencies depth
 * first. Each dependency contributes the lowest version its range admits.
 *
 * <p>For every package the registries are asked in order and the first registry that knows the
 * package is recorded as its source. A package no registry knows is left out of the graph, which
 * is logged but does not fail the expansion. Packages are visited at most once, so cyclic
 * dependencies terminate.
 */
public class DependencyGraphResolver {

    @NotNull
    private final List<@NotNull PackageRegistry> registries;
    @NotNull
    private final TargetFramework targetFramework;

    public DependencyGraphResolver(@NotNull List<@NotNull PackageRegistry> registries, @NotNull TargetFramework targetFramework) {
        this.registries = Collections.unmodifiableList(new ArrayList<>(registries));
        this.targetFramework = Objects.requireNonNull(targetFramework, "targetFramework may not be null");
    }

    @NotNull
    private CompletableFuture<DependencyInfo> query(@NotNull PackageIdentity identity, int registryIndex, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        if (registryIndex >= this.registries.size()) {
            return CompletableFuture.completedFuture(null);
        }
        token.throwIfCancellationRequested();
        PackageRegistry registry = this.registries.get(registryIndex);
        return registry.getDependencyInfo(identity, this.targetFramework, cache, executor, token).thenCompose((info) -> {
            if (info != null) {
                LoggingAdapter.getDefaultLogger().debug(DependencyGraphResolver.class, "Registry {} provided {}", registry.getRegistryId(), identity);
                return CompletableFuture.completedFuture(info);
            }
            return this.query(identity, registryIndex + 1, cache, executor, token);
        });
    }

    /**
     * Expands the dependencies of the root package and the extra packages, in that order.
     *
     * @param root The package providing the reference assemblies, if any
     * @param packages The extra packages
     * @param cache The per-resolution resource cache passed to the registries
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the dependency graph
     */
    @NotNull
    public CompletableFuture<DependencyGraph> resolveAsync(@Nullable PackageIdentity root, @NotNull List<@NotNull PackageIdentity> packages, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        Deque<PackageIdentity> work = new ArrayDeque<>();
        for (int i = packages.size() - 1; i >= 0; i--) {
            work.push(packages.get(i));
        }
        if (root != null) {
            work.push(root);
        }
        DependencyGraph graph = new DependencyGraph();
        Set<PackageIdentity> missing = new HashSet<>();
        try {
            return this.step(work, graph, missing, cache, executor, token).thenApply((ignored) -> graph);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @NotNull
    private CompletableFuture<Void> step(@NotNull Deque<PackageIdentity> work, @NotNull DependencyGraph graph, @NotNull Set<PackageIdentity> missing, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        PackageIdentity identity;
        do {
            identity = work.poll();
            if (identity == null) {
                return CompletableFuture.completedFuture(null);
            }
        } while (graph.contains(identity) || missing.contains(identity));

        token.throwIfCancellationRequested();
        PackageIdentity current = identity;
        return this.query(current, 0, cache, executor, token).thenCompose((info) -> {
            if (info == null) {
                LoggingAdapter.getDefaultLogger().warn(DependencyGraphResolver.class, "No registry provides {}. It will be left out of the dependency graph", current);
                missing.add(current);
            } else {
                graph.put(info);
                List<@NotNull PackageDependency> dependencies = info.getDependencies();
                for (int i = dependencies.size() - 1; i >= 0; i--) {
                    PackageDependency dependency = dependencies.get(i);
                    PackageVersion minVersion = dependency.range().getMinVersion();
                    if (minVersion == null) {
                        LoggingAdapter.getDefaultLogger().warn(DependencyGraphResolver.class, "Dependency {} {} of {} has no lower bound and is skipped", dependency.id(), dependency.range(), current);
                        continue;
                    }
                    work.push(new PackageIdentity(dependency.id(), minVersion));
                }
            }
            return this.step(work, graph, missing, cache, executor, token);
        });
    }
}
