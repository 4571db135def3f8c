package org.stianloader.refresolve.repo;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.packaging.PackageArchive;

/**
 * A source of packages, such as a remote feed or a folder of package archives on the local disk.
 *
 * <p>Registries are queried in the order they were registered in the
 * {@link org.stianloader.refresolve.ReferenceAssemblyResolver}. The first registry that knows a
 * package becomes the authoritative source for that package, meaning that the package will later
 * be downloaded from that very registry and from no other.
 *
 * <p>Implementations must not block the calling thread. Any blocking work (such as network or
 * file I/O) should be moved to the supplied {@link Executor}. Implementations should check the
 * supplied {@link CancellationToken} at reasonable intervals and abort outstanding I/O once
 * cancellation is requested, completing the returned future with a
 * {@link java.util.concurrent.CancellationException}.
 */
public interface PackageRegistry {

    /**
     * Downloads the package archive of the given package.
     * If the package does not exist in this registry, the returned future completes exceptionally.
     *
     * <p>Downloaded resources may be stored in the supplied {@link RegistryCacheContext}, which only
     * lives as long as the current resolution.
     *
     * @param identity The package to download
     * @param cache The per-resolution resource cache
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the downloaded archive
     */
    @NotNull
    CompletableFuture<PackageArchive> download(@NotNull PackageIdentity identity, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token);

    /**
     * Obtains the dependencies the given package declares when consumed by the given target
     * framework. The dependency group nearest to the target framework is used. If the package is
     * not known to this registry, the returned future completes with null.
     *
     * @param identity The package to look up
     * @param targetFramework The framework the package is consumed by
     * @param cache The per-resolution resource cache
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the dependency information, or with null if the package is absent
     */
    @NotNull
    CompletableFuture<DependencyInfo> getDependencyInfo(@NotNull PackageIdentity identity, @NotNull TargetFramework targetFramework, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token);

    /**
     * Obtains the identifier of the registry. Used for logging and written into the completion
     * marker of extracted packages.
     *
     * @return The registry identifier
     */
    @NotNull
    @Contract(pure = true)
    String getRegistryId();
}
