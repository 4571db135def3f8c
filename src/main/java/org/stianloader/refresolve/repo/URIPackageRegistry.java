package org.stianloader.refresolve.repo;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLConnection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.FrameworkReducer;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.internal.ConcurrencyUtil;
import org.stianloader.refresolve.logging.LoggingAdapter;
import org.stianloader.refresolve.packaging.NuspecReader;
import org.stianloader.refresolve.packaging.PackageArchive;
import org.stianloader.refresolve.packaging.PackageFolder;

/**
 * A registry serving the NuGet v3 "flat container" layout, where the manifest of a package is
 * stored as "&lt;id&gt;/&lt;version&gt;/&lt;id&gt;.nuspec" and the archive as
 * "&lt;id&gt;/&lt;version&gt;/&lt;id&gt;.&lt;version&gt;.nupkg", all in lower case.
 */
public class URIPackageRegistry implements PackageRegistry {

    @NotNull
    private final URI base;
    @NotNull
    private final String id;
    @NotNull
    private final FrameworkReducer reducer = new FrameworkReducer();

    public URIPackageRegistry(@NotNull String id, @NotNull URI base) {
        if (base.getPath().isEmpty()) {
            base = base.resolve("/");
        } else if (!base.getPath().endsWith("/")) {
            base = base.resolve(base.getPath() + "/");
        }
        this.base = base;
        this.id = id;
    }

    @NotNull
    private static String getPackagePath(@NotNull PackageIdentity identity) {
        return identity.lowerCaseId() + "/" + PackageFolder.getVersionFolderName(identity) + "/";
    }

    @Override
    @NotNull
    public CompletableFuture<PackageArchive> download(@NotNull PackageIdentity identity, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        String path = URIPackageRegistry.getPackagePath(identity) + PackageFolder.getArchiveFileName(identity);
        return this.getResource(path, cache, executor, token).thenApply((data) -> {
            if (data == null) {
                throw new UncheckedIOException(new FileNotFoundException("Package " + identity + " is not available from " + this.base));
            }
            try {
                return PackageArchive.read(data);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read archive of " + identity, e);
            }
        });
    }

    @Override
    @NotNull
    public CompletableFuture<DependencyInfo> getDependencyInfo(@NotNull PackageIdentity identity, @NotNull TargetFramework targetFramework, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        String path = URIPackageRegistry.getPackagePath(identity) + identity.lowerCaseId() + ".nuspec";
        return this.getResource(path, cache, executor, token).thenApply((data) -> {
            if (data == null) {
                return null;
            }
            try {
                NuspecReader nuspec = NuspecReader.read(data);
                return new DependencyInfo(identity, nuspec.getDependencies(targetFramework, this.reducer), this);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read manifest of " + identity, e);
            }
        });
    }

    @NotNull
    @Contract(pure = true)
    public String getPlaintextURL() {
        return this.base.toString();
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getRegistryId() {
        return this.id;
    }

    @NotNull
    private CompletableFuture<byte[]> getResource(@NotNull String path, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        URI resolved = this.base.resolve(path);
        return cache.getOrLoad(resolved.toString(), () -> {
            return ConcurrencyUtil.schedule(() -> this.getResource0(resolved, token), executor, token);
        });
    }

    /**
     * Fetches a resource, returning null if the server reports it as absent.
     */
    protected byte @Nullable[] getResource0(@NotNull URI resolved, @NotNull CancellationToken token) throws IOException {
        LoggingAdapter.getDefaultLogger().info(URIPackageRegistry.class, "Downloading {}", resolved);
        URLConnection connection = resolved.toURL().openConnection();
        Runnable unregister = () -> { };
        try {
            if (connection instanceof HttpURLConnection) {
                HttpURLConnection httpUrlConn = (HttpURLConnection) connection;
                unregister = token.onCancel(httpUrlConn::disconnect);
                int code = httpUrlConn.getResponseCode();
                if (code == HttpURLConnection.HTTP_NOT_FOUND) {
                    LoggingAdapter.getDefaultLogger().debug(URIPackageRegistry.class, "{} does not exist on {}", resolved, this.id);
                    return null;
                } else if ((code / 100) != 2) {
                    throw new IOException("Query for " + connection.getURL() + " returned with a response code of " + code + " (" + httpUrlConn.getResponseMessage() + ")");
                }
            }

            try (InputStream is = connection.getInputStream()) {
                return is.readAllBytes();
            } catch (FileNotFoundException e) {
                if (connection instanceof HttpURLConnection) {
                    throw e;
                }
                // Local mirrors (file: URIs) report absent resources this way
                LoggingAdapter.getDefaultLogger().debug(URIPackageRegistry.class, "{} does not exist on {}", resolved, this.id);
                return null;
            }
        } finally {
            unregister.run();
        }
    }

    @Override
    @NotNull
    public String toString() {
        return "URIPackageRegistry[id=" + this.id + " url=" + this.base + "]";
    }
}
