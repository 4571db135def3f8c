package org.stianloader.refresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.ReferenceAssemblies;
import org.stianloader.refresolve.ReferenceAssemblyResolver;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.packaging.PackageArchive;
import org.stianloader.refresolve.repo.RegistryCacheContext;
import org.stianloader.refresolve.repo.URIPackageRegistry;

public class URIPackageRegistryTest {

    @TempDir
    Path temp;

    private Path feed;

    /**
     * Lays out a package the way a flat container feed serves it:
     * {@code <lowerid>/<version>/<lowerid>.nuspec} and {@code <lowerid>/<version>/<lowerid>.<version>.nupkg}.
     */
    @NotNull
    private TestPackage publish(@NotNull TestPackage pkg) throws IOException {
        String lowerId = pkg.getIdentity().lowerCaseId();
        String version = pkg.getIdentity().version().toString().toLowerCase(Locale.ROOT);
        Path directory = this.feed.resolve(lowerId).resolve(version);
        Files.createDirectories(directory);
        Files.write(directory.resolve(lowerId + ".nuspec"), pkg.nuspec().getBytes(StandardCharsets.UTF_8));
        Files.write(directory.resolve(lowerId + "." + version + ".nupkg"), pkg.toArchive());
        return pkg;
    }

    @BeforeEach
    public void setup() throws IOException {
        this.feed = Files.createDirectories(this.temp.resolve("feed"));
    }

    @Test
    public void testFlatContainerLayout() throws Exception {
        this.publish(new TestPackage("Remote.Base", "1.0.0").dependency("Other", "[2.0.0,)").file("lib/net45/Remote.Base.dll"));
        URIPackageRegistry registry = new URIPackageRegistry("files", this.feed.toUri());
        assertEquals("files", registry.getRegistryId());
        assertTrue(registry.getPlaintextURL().endsWith("/"));

        RegistryCacheContext cache = new RegistryCacheContext();
        DependencyInfo info = registry.getDependencyInfo(PackageIdentity.of("Remote.Base", "1.0.0"), TargetFramework.parse("net45"), cache, Runnable::run, CancellationToken.NONE).get();
        assertNotNull(info);
        assertEquals(1, info.getDependencies().size());
        assertEquals("Other", info.getDependencies().get(0).id());
        assertEquals(registry, info.getSource());

        PackageArchive archive = registry.download(PackageIdentity.of("Remote.Base", "1.0.0"), cache, Runnable::run, CancellationToken.NONE).get();
        assertTrue(archive.hasLibOrRef());
        assertEquals(2, cache.size());
    }

    @Test
    public void testMissingResources() throws Exception {
        this.publish(new TestPackage("Remote.Base", "1.0.0").file("lib/net45/Remote.Base.dll"));
        URIPackageRegistry registry = new URIPackageRegistry("files", this.feed.toUri());
        RegistryCacheContext cache = new RegistryCacheContext();

        assertNull(registry.getDependencyInfo(PackageIdentity.of("Remote.Base", "9.0.0"), TargetFramework.parse("net45"), cache, Runnable::run, CancellationToken.NONE).get());
        assertNull(registry.getDependencyInfo(PackageIdentity.of("Unknown", "1.0.0"), TargetFramework.parse("net45"), cache, Runnable::run, CancellationToken.NONE).get());

        Throwable t = FutureAssertions.assertFails(registry.download(PackageIdentity.of("Remote.Base", "9.0.0"), cache, Runnable::run, CancellationToken.NONE));
        assertTrue(t instanceof UncheckedIOException, () -> "Unexpected failure " + t);
        assertTrue(t.getCause() instanceof FileNotFoundException, () -> "Unexpected cause " + t.getCause());
    }

    @Test
    public void testCacheContextReuse() throws Exception {
        TestPackage pkg = this.publish(new TestPackage("Cached", "1.0.0").file("lib/net45/Cached.dll"));
        URIPackageRegistry registry = new URIPackageRegistry("files", this.feed.toUri());
        RegistryCacheContext cache = new RegistryCacheContext();

        PackageArchive first = registry.download(pkg.getIdentity(), cache, Runnable::run, CancellationToken.NONE).get();
        Files.delete(this.feed.resolve("cached").resolve("1.0.0").resolve("cached.1.0.0.nupkg"));

        // Served from the cache context even though the feed no longer has it
        PackageArchive second = registry.download(pkg.getIdentity(), cache, Runnable::run, CancellationToken.NONE).get();
        assertEquals(first.getFiles(), second.getFiles());
        assertEquals(1, cache.size());

        FutureAssertions.assertFails(registry.download(pkg.getIdentity(), new RegistryCacheContext(), Runnable::run, CancellationToken.NONE));
    }

    @Test
    public void testResolveFromFeed() throws Exception {
        this.publish(new TestPackage("Base", "1.0.0").file("lib/p1/Core.dll"));
        this.publish(new TestPackage("Ext", "1.0.0").dependency("Base", "[1.0.0,)").file("lib/p1/Ext.dll"));
        ReferenceAssemblyResolver resolver = new ReferenceAssemblyResolver(this.temp.resolve("local"))
                .addRegistry(new URIPackageRegistry("files", this.feed.toUri()));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("p1"), PackageIdentity.of("Base", "1.0.0"), "build")
                .addPackages(PackageIdentity.of("Ext", "1.0.0"));
        Set<Path> assemblies = descriptor.resolveAsync(null, resolver, Runnable::run, CancellationToken.NONE).join();
        assertEquals(2, assemblies.size());
        for (Path assembly : assemblies) {
            assertTrue(Files.isRegularFile(assembly), () -> assembly + " does not exist");
            assertTrue(assembly.startsWith(this.temp.resolve("local").toAbsolutePath().normalize()));
        }
    }
}
