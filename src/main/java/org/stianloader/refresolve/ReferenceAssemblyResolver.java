package org.stianloader.refresolve;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.framework.FrameworkReducer;
import org.stianloader.refresolve.graph.DependencyGraph;
import org.stianloader.refresolve.graph.DependencyGraphResolver;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.internal.ConcurrencyUtil;
import org.stianloader.refresolve.internal.FileSystemSemaphore;
import org.stianloader.refresolve.logging.LoggingAdapter;
import org.stianloader.refresolve.packaging.InstalledPackage;
import org.stianloader.refresolve.packaging.PackageExtractor;
import org.stianloader.refresolve.packaging.PackageFolder;
import org.stianloader.refresolve.repo.PackageRegistry;
import org.stianloader.refresolve.repo.RegistryCacheContext;
import org.stianloader.refresolve.repo.URIPackageRegistry;
import org.stianloader.refresolve.resolve.PackageResolver;

/**
 * The environment in which {@link ReferenceAssemblies} are resolved: the package registries to
 * download from, the folder packages are extracted into and the shared global packages folder
 * that is probed before downloading anything.
 *
 * <p>Resolution runs in the following stages:
 * <ol>
 * <li>The dependency graph of the reference assembly package and the extra packages is built.</li>
 * <li>One version per extra package and transitive dependency is selected.</li>
 * <li>The selected packages are looked up in the local and global folders and downloaded and
 * extracted into the local folder where absent.</li>
 * <li>The assembly files of the installed packages are collected.</li>
 * </ol>
 *
 * <p>The local folder is guarded by a lock file named {@value #LOCK_FILE_NAME}, which is held
 * by {@link ReferenceAssemblies#resolveAsync(String, ReferenceAssemblyResolver, Executor, CancellationToken)}
 * for the duration of a resolution.
 */
public class ReferenceAssemblyResolver {

    public static final String LOCK_FILE_NAME = ".lock";
    public static final String NUGET_ORG_FLAT_CONTAINER = "https://api.nuget.org/v3-flatcontainer/";
    public static final String PACKAGES_FOLDER_PROPERTY = "refresolve.packages";

    /**
     * Creates a resolver extracting into "test-packages" within the temporary directory (or the
     * folder named by the {@value #PACKAGES_FOLDER_PROPERTY} system property), probing the global
     * packages folder of the current user and downloading from nuget.org.
     *
     * @return The newly created resolver
     */
    @NotNull
    public static ReferenceAssemblyResolver createDefault() {
        String localOverride = System.getProperty(ReferenceAssemblyResolver.PACKAGES_FOLDER_PROPERTY);
        Path local;
        if (localOverride != null && !localOverride.isEmpty()) {
            local = Paths.get(localOverride);
        } else {
            local = Paths.get(System.getProperty("java.io.tmpdir"), "test-packages");
        }

        String globalOverride = System.getenv("NUGET_PACKAGES");
        Path global;
        if (globalOverride != null && !globalOverride.isEmpty()) {
            global = Paths.get(globalOverride);
        } else {
            global = Paths.get(System.getProperty("user.home"), ".nuget", "packages");
        }

        return new ReferenceAssemblyResolver(local, global)
                .addRegistry(new URIPackageRegistry("nuget.org", URI.create(ReferenceAssemblyResolver.NUGET_ORG_FLAT_CONTAINER)));
    }

    @NotNull
    private final PackageExtractor extractor = new PackageExtractor();
    @Nullable
    private final PackageFolder globalFolder;
    @NotNull
    private final PackageFolder localFolder;
    @NotNull
    private final FrameworkReducer reducer = new FrameworkReducer();
    @NotNull
    private final List<@NotNull PackageRegistry> registries = new ArrayList<>();

    public ReferenceAssemblyResolver(@NotNull Path localFolder) {
        this(localFolder, null);
    }

    public ReferenceAssemblyResolver(@NotNull Path localFolder, @Nullable Path globalFolder) {
        this.localFolder = new PackageFolder(Objects.requireNonNull(localFolder, "localFolder may not be null"));
        this.globalFolder = globalFolder == null ? null : new PackageFolder(globalFolder);
    }

    @NotNull
    private CompletableFuture<InstalledPackage> acquire(@NotNull PackageIdentity identity, boolean root, @NotNull DependencyGraph graph,
            @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        Path installed = this.localFolder.getInstalledPath(identity);
        if (installed == null && this.globalFolder != null) {
            installed = this.globalFolder.getInstalledPath(identity);
        }
        if (installed != null) {
            return CompletableFuture.completedFuture(new InstalledPackage(identity, installed));
        }

        DependencyInfo info = graph.get(identity);
        if (info == null) {
            return CompletableFuture.failedFuture(new ReferenceResolutionException("Package " + identity + " is neither installed nor provided by any registry"));
        }
        PackageRegistry source = info.getSource();
        return source.download(identity, cache, executor, token).thenCompose((archive) -> {
            return ConcurrencyUtil.schedule(() -> {
                if (!root && !archive.hasLibOrRef()) {
                    LoggingAdapter.getDefaultLogger().debug(ReferenceAssemblyResolver.class, "Skipping {} as it has no compile-time assets", identity);
                    return null;
                }
                return new InstalledPackage(identity, this.extractor.extract(archive, identity, source.getRegistryId(), this.localFolder, token));
            }, executor, token);
        });
    }

    @NotNull
    private CompletableFuture<List<@NotNull InstalledPackage>> acquireAll(@NotNull List<@NotNull PackageIdentity> installList, @Nullable PackageIdentity root, @NotNull DependencyGraph graph,
            @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        List<@NotNull InstalledPackage> installed = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (PackageIdentity identity : installList) {
            chain = chain.thenCompose((ignored) -> {
                token.throwIfCancellationRequested();
                return this.acquire(identity, identity.equals(root), graph, cache, executor, token);
            }).thenAccept((pkg) -> {
                if (pkg != null) {
                    installed.add(pkg);
                }
            });
        }
        return chain.thenApply((ignored) -> installed);
    }

    public ReferenceAssemblyResolver addRegistries(@NotNull Collection<@NotNull PackageRegistry> registries) {
        registries.forEach(this::addRegistry);
        return this;
    }

    /**
     * Adds a registry to query after all previously added registries.
     *
     * @param registry The registry to add
     * @return This instance, for chaining
     */
    public ReferenceAssemblyResolver addRegistry(@NotNull PackageRegistry registry) {
        synchronized (this.registries) {
            this.registries.add(Objects.requireNonNull(registry, "registry may not be null"));
        }
        return this;
    }

    @Nullable
    @Contract(pure = true)
    public PackageFolder getGlobalFolder() {
        return this.globalFolder;
    }

    @NotNull
    @Contract(pure = true)
    public PackageFolder getLocalFolder() {
        return this.localFolder;
    }

    /**
     * Obtains the semaphore guarding the local folder against concurrent resolutions, both within
     * this process and from other processes.
     *
     * @return The semaphore of the local folder
     */
    @NotNull
    public FileSystemSemaphore getLock() {
        return FileSystemSemaphore.forPath(this.localFolder.getRoot().resolve(ReferenceAssemblyResolver.LOCK_FILE_NAME));
    }

    @NotNull
    public List<@NotNull PackageRegistry> getRegistries() {
        synchronized (this.registries) {
            return Collections.unmodifiableList(new ArrayList<>(this.registries));
        }
    }

    /**
     * Resolves the assemblies of a descriptor without consulting or populating any memo. Callers
     * must hold the {@link #getLock() lock} of this resolver.
     *
     * @param descriptor The descriptor to resolve
     * @param language The source language whose specific assemblies are included, or null
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the resolved assembly paths
     */
    @NotNull
    CompletableFuture<Set<@NotNull Path>> resolveUnguarded(@NotNull ReferenceAssemblies descriptor, @Nullable String language, @NotNull Executor executor, @NotNull CancellationToken token) {
        PackageIdentity root = descriptor.getReferenceAssemblyPackage();
        List<@NotNull PackageIdentity> packages = descriptor.getPackages();
        RegistryCacheContext cache = new RegistryCacheContext();
        DependencyGraphResolver graphResolver = new DependencyGraphResolver(this.getRegistries(), descriptor.getTargetFramework());

        LoggingAdapter.getDefaultLogger().debug(ReferenceAssemblyResolver.class, "Resolving {} for language {}", descriptor, language);
        return graphResolver.resolveAsync(root, packages, cache, executor, token).thenCompose((graph) -> {
            Set<PackageIdentity> installList = new LinkedHashSet<>();
            if (root != null) {
                installList.add(root);
            }
            if (!packages.isEmpty()) {
                installList.addAll(new PackageResolver().resolve(graph, packages));
            }
            return this.acquireAll(new ArrayList<>(installList), root, graph, cache, executor, token);
        }).thenCompose((installed) -> {
            AssemblySetBuilder builder = new AssemblySetBuilder(this.reducer);
            return ConcurrencyUtil.schedule(() -> {
                try {
                    return builder.build(descriptor, language, installed);
                } catch (IOException e) {
                    throw new UncheckedIOException("Unable to collect the assemblies of " + descriptor, e);
                }
            }, executor, token);
        });
    }

    @Override
    @NotNull
    public String toString() {
        return "ReferenceAssemblyResolver[local=" + this.localFolder.getRoot() + " global=" + (this.globalFolder == null ? null : this.globalFolder.getRoot()) + " registries=" + this.getRegistries() + "]";
    }
}
