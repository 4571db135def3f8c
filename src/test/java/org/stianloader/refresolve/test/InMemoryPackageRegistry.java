package org.stianloader.refresolve.test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.FrameworkReducer;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.internal.ConcurrencyUtil;
import org.stianloader.refresolve.packaging.NuspecReader;
import org.stianloader.refresolve.packaging.PackageArchive;
import org.stianloader.refresolve.repo.PackageRegistry;
import org.stianloader.refresolve.repo.RegistryCacheContext;

/**
 * A registry serving {@link TestPackage test packages} from memory, counting the requests it receives.
 */
public class InMemoryPackageRegistry implements PackageRegistry {

    @NotNull
    public final AtomicInteger downloads = new AtomicInteger();
    @NotNull
    public final AtomicInteger lookups = new AtomicInteger();
    @NotNull
    private final String id;
    @NotNull
    private final Map<PackageIdentity, byte[]> packages = new ConcurrentHashMap<>();
    @NotNull
    private final FrameworkReducer reducer = new FrameworkReducer();

    public InMemoryPackageRegistry(@NotNull String id) {
        this.id = id;
    }

    @NotNull
    public InMemoryPackageRegistry add(@NotNull TestPackage pkg) {
        this.packages.put(pkg.getIdentity(), pkg.toArchive());
        return this;
    }

    @Override
    @NotNull
    public CompletableFuture<PackageArchive> download(@NotNull PackageIdentity identity, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        return ConcurrencyUtil.schedule(() -> {
            this.downloads.incrementAndGet();
            byte[] data = this.packages.get(identity);
            if (data == null) {
                throw new FileNotFoundException(identity + " is not part of " + this.id);
            }
            return PackageArchive.read(data);
        }, executor, token);
    }

    @Override
    @NotNull
    public CompletableFuture<DependencyInfo> getDependencyInfo(@NotNull PackageIdentity identity, @NotNull TargetFramework targetFramework, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        return ConcurrencyUtil.schedule(() -> {
            this.lookups.incrementAndGet();
            byte[] data = this.packages.get(identity);
            if (data == null) {
                return null;
            }
            NuspecReader nuspec = PackageArchive.read(data).getNuspec();
            if (nuspec == null) {
                throw new UncheckedIOException(new IOException("No manifest in " + identity));
            }
            return new DependencyInfo(identity, nuspec.getDependencies(targetFramework, this.reducer), this);
        }, executor, token);
    }

    @Override
    @NotNull
    public String getRegistryId() {
        return this.id;
    }
}
