package org.stianloader.refresolve.repo;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
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
import org.stianloader.refresolve.packaging.NuspecReader;
import org.stianloader.refresolve.packaging.PackageArchive;
import org.stianloader.refresolve.packaging.PackageFolder;

/**
 * A local feed: a directory containing package archives named "&lt;id&gt;.&lt;version&gt;.nupkg".
 * File names are matched without regard to case.
 */
public class FolderPackageRegistry implements PackageRegistry {

    @NotNull
    private final Path directory;
    @NotNull
    private final String id;
    @NotNull
    private final FrameworkReducer reducer = new FrameworkReducer();

    public FolderPackageRegistry(@NotNull String id, @NotNull Path directory) {
        this.id = Objects.requireNonNull(id, "id may not be null");
        this.directory = Objects.requireNonNull(directory, "directory may not be null");
    }

    @Override
    @NotNull
    public CompletableFuture<PackageArchive> download(@NotNull PackageIdentity identity, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        return this.readArchive(identity, cache, executor, token).thenApply((archive) -> {
            if (archive == null) {
                throw new UncheckedIOException(new FileNotFoundException("Package " + identity + " is not present in " + this.directory));
            }
            return archive;
        });
    }

    @Nullable
    private Path findArchive(@NotNull PackageIdentity identity) throws IOException {
        if (!Files.isDirectory(this.directory)) {
            return null;
        }
        String expected = PackageFolder.getArchiveFileName(identity);
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(this.directory, "*.nupkg")) {
            for (Path file : stream) {
                if (file.getFileName().toString().equalsIgnoreCase(expected)) {
                    return file;
                }
            }
        }
        return null;
    }

    @Override
    @NotNull
    public CompletableFuture<DependencyInfo> getDependencyInfo(@NotNull PackageIdentity identity, @NotNull TargetFramework targetFramework, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        return this.readArchive(identity, cache, executor, token).thenApply((archive) -> {
            if (archive == null) {
                return null;
            }
            try {
                NuspecReader nuspec = archive.getNuspec();
                if (nuspec == null) {
                    throw new IOException("Archive of " + identity + " in " + this.directory + " has no manifest");
                }
                return new DependencyInfo(identity, nuspec.getDependencies(targetFramework, this.reducer), this);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @NotNull
    @Contract(pure = true)
    public Path getDirectory() {
        return this.directory;
    }

    @Override
    @NotNull
    @Contract(pure = true)
    public String getRegistryId() {
        return this.id;
    }

    @NotNull
    private CompletableFuture<PackageArchive> readArchive(@NotNull PackageIdentity identity, @NotNull RegistryCacheContext cache, @NotNull Executor executor, @NotNull CancellationToken token) {
        String key = this.directory.toUri() + "#" + identity.lowerCaseId() + "/" + PackageFolder.getVersionFolderName(identity);
        return cache.getOrLoad(key, () -> {
            return ConcurrencyUtil.schedule(() -> {
                Path file = this.findArchive(identity);
                if (file == null) {
                    return null;
                }
                return Files.readAllBytes(file);
            }, executor, token);
        }).thenApply((data) -> {
            if (data == null) {
                return null;
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
    public String toString() {
        return "FolderPackageRegistry[id=" + this.id + " directory=" + this.directory + "]";
    }
}
