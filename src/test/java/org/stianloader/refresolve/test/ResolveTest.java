package org.stianloader.refresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.LanguageNames;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.ReferenceAssemblies;
import org.stianloader.refresolve.ReferenceAssemblyResolver;
import org.stianloader.refresolve.ReferenceResolutionException;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.logging.LoggingAdapter;
import org.stianloader.refresolve.packaging.PackageFolder;

public class ResolveTest {

    @NotNull
    private static Set<String> fileNames(@NotNull Set<Path> paths) {
        Set<String> names = new TreeSet<>();
        for (Path path : paths) {
            names.add(path.getFileName().toString());
        }
        return names;
    }

    @NotNull
    private static Set<String> names(@NotNull String... names) {
        return new TreeSet<>(Arrays.asList(names));
    }

    @TempDir
    Path temp;

    private Path globalFolder;
    private Path localFolder;
    private InMemoryPackageRegistry registry;
    private ReferenceAssemblyResolver resolver;

    @BeforeEach
    public void setup() {
        this.localFolder = this.temp.resolve("local");
        this.globalFolder = this.temp.resolve("global");
        this.registry = new InMemoryPackageRegistry("memory");
        this.resolver = new ReferenceAssemblyResolver(this.localFolder, this.globalFolder).addRegistry(this.registry);
    }

    @NotNull
    private Set<Path> resolve(@NotNull ReferenceAssemblies descriptor, String language) {
        return descriptor.resolveAsync(language, this.resolver, Runnable::run, CancellationToken.NONE).join();
    }

    @Test
    public void testBaseAndExtension() {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/p1/Core.dll"));
        this.registry.add(new TestPackage("Base", "1.1.0").file("lib/p1/Core.dll"));
        this.registry.add(new TestPackage("Ext", "1.0.0").dependency("Base", "[1.0.0,)").file("lib/p1/Ext.dll").file("lib/p1/Ext.xml"));

        ReferenceAssemblies base = new ReferenceAssemblies(TargetFramework.parse("p1"), PackageIdentity.of("Base", "1.0.0"), "build");
        Set<Path> assemblies = resolve(base, null);
        assertEquals(1, assemblies.size());
        Path core = assemblies.iterator().next();
        assertTrue(core.endsWith(Path.of("base", "1.0.0", "lib", "p1", "Core.dll")));
        assertTrue(core.isAbsolute());
        assertTrue(core.startsWith(this.localFolder.toAbsolutePath().normalize()));
        assertTrue(Files.isRegularFile(core));

        ReferenceAssemblies extended = base.addPackages(PackageIdentity.of("Ext", "1.0.0"));
        Set<Path> extendedAssemblies = resolve(extended, null);
        assertEquals(names("Core.dll", "Ext.dll"), fileNames(extendedAssemblies));
        assertTrue(extendedAssemblies.contains(core));
        assertFalse(Files.exists(this.localFolder.resolve("base").resolve("1.1.0")));
    }

    @Test
    public void testGenericFrameworkVersions() {
        this.registry.add(new TestPackage("Tiered", "1.0.0")
                .file("lib/p1/Tiered.P1.dll")
                .file("lib/p2/Tiered.P2.dll")
                .file("lib/p3/Tiered.P3.dll")
                .file("lib/q2/Tiered.Q2.dll"));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("p2")).addPackages(PackageIdentity.of("Tiered", "1.0.0"));
        assertEquals(names("Tiered.P2.dll"), fileNames(resolve(descriptor, null)));
    }

    @Test
    public void testRefPreferredOverLib() {
        this.registry.add(new TestPackage("Split", "1.0.0")
                .file("lib/net472/Split.Impl.dll")
                .file("ref/netstandard2.0/Split.Api.dll"));
        this.registry.add(new TestPackage("LibOnly", "1.0.0")
                .file("lib/net45/LibOnly.dll")
                .file("lib/netstandard2.0/LibOnly.Standard.dll")
                .file("ref/netcoreapp2.1/LibOnly.Core.dll"));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472"))
                .addPackages(PackageIdentity.of("Split", "1.0.0"), PackageIdentity.of("LibOnly", "1.0.0"));

        assertEquals(names("Split.Api.dll", "LibOnly.dll"), fileNames(resolve(descriptor, null)));
    }

    @Test
    public void testNamedAndLanguageSpecificAssemblies() {
        this.registry.add(new TestPackage("Framework.Ref", "1.0.0")
                .file("build/.NETFramework/v4.7.2/mscorlib.dll")
                .file("build/.NETFramework/v4.7.2/System.dll")
                .file("build/.NETFramework/v4.7.2/System.Net.Http.dll")
                .file("build/.NETFramework/v4.7.2/Microsoft.CSharp.dll")
                .file("build/.NETFramework/v4.7.2/Facades/System.Runtime.dll")
                .file("build/.NETFramework/v4.7.2/Facades/readme.txt"));
        this.registry.add(new TestPackage("Http.Client", "1.0.0")
                .frameworkAssembly("System.Net.Http", ".NETFramework4.5")
                .file("lib/net45/Http.Client.dll"));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472"), PackageIdentity.of("Framework.Ref", "1.0.0"), "build/.NETFramework/v4.7.2")
                .addAssemblies("mscorlib", "System", "NotShipped")
                .addLanguageSpecificAssemblies(LanguageNames.CSHARP, "Microsoft.CSharp")
                .addPackages(PackageIdentity.of("Http.Client", "1.0.0"));

        Set<Path> agnostic = resolve(descriptor, null);
        assertEquals(names("Http.Client.dll", "System.Net.Http.dll", "mscorlib.dll", "System.dll", "System.Runtime.dll"), fileNames(agnostic));

        Set<Path> csharp = resolve(descriptor, LanguageNames.CSHARP);
        assertEquals(names("Http.Client.dll", "System.Net.Http.dll", "mscorlib.dll", "System.dll", "System.Runtime.dll", "Microsoft.CSharp.dll"), fileNames(csharp));

        // No Visual Basic specific assemblies are registered, so the language-agnostic set is shared
        assertSame(agnostic, resolve(descriptor, LanguageNames.VISUAL_BASIC));
    }

    @Test
    public void testDeterminism() {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll"));
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));

        Set<Path> first = resolve(descriptor, null);
        Set<Path> second = resolve(descriptor, null);
        assertSame(first, second);
        assertEquals(1, this.registry.lookups.get());

        // An equal descriptor has its own memo but finds the package already extracted
        ReferenceAssemblies copy = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));
        assertEquals(descriptor, copy);
        Set<Path> third = resolve(copy, null);
        assertNotSame(first, third);
        assertEquals(first, third);
        assertEquals(1, this.registry.downloads.get());
    }

    @Test
    public void testIdempotentExtractionAcrossResolvers() {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll"));
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));
        Set<Path> first = resolve(descriptor, null);

        ReferenceAssemblyResolver other = new ReferenceAssemblyResolver(this.localFolder).addRegistry(this.registry);
        Set<Path> second = descriptor.addAssemblies().resolveAsync(null, other, Runnable::run, CancellationToken.NONE).join();

        assertEquals(first, second);
        assertEquals(1, this.registry.downloads.get());
        assertTrue(Files.isRegularFile(this.localFolder.resolve("base").resolve("1.0.0").resolve(PackageFolder.METADATA_FILE_NAME)));
    }

    private void installGlobally(@NotNull String id, @NotNull String version, @NotNull String assembly, @NotNull String... markers) throws IOException {
        Path installed = this.globalFolder.resolve(id.toLowerCase(Locale.ROOT)).resolve(version);
        Files.createDirectories(installed.resolve("lib").resolve("net472"));
        Files.write(installed.resolve("lib").resolve("net472").resolve(assembly), new byte[0]);
        Files.write(installed.resolve(id.toLowerCase(Locale.ROOT) + "." + version + ".nupkg"), new byte[0]);
        for (String marker : markers) {
            Files.write(installed.resolve(marker), "{}".getBytes(StandardCharsets.UTF_8));
        }
    }

    @Test
    public void testGlobalFolderIsProbed() throws Exception {
        // Layout of a current NuGet client: metadata file plus hash file
        this.installGlobally("Base", "1.0.0", "Global.dll", ".nupkg.metadata", "base.1.0.0.nupkg.sha512");
        // Older NuGet clients only write the hash file
        this.installGlobally("Legacy", "2.0.0", "Legacy.dll", "legacy.2.0.0.nupkg.sha512");
        // Interrupted installation without any marker
        this.installGlobally("Partial", "1.0.0", "Stale.dll");
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Remote.dll"));
        this.registry.add(new TestPackage("Legacy", "2.0.0").file("lib/net472/Remote.Legacy.dll"));
        this.registry.add(new TestPackage("Partial", "1.0.0").file("lib/net472/Partial.dll"));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472"))
                .addPackages(PackageIdentity.of("Base", "1.0.0"), PackageIdentity.of("Legacy", "2.0.0"), PackageIdentity.of("Partial", "1.0.0"));
        assertEquals(names("Global.dll", "Legacy.dll", "Partial.dll"), fileNames(resolve(descriptor, null)));
        assertEquals(1, this.registry.downloads.get());
    }

    @Test
    public void testPackagesWithoutCompileAssetsAreSkipped() {
        this.registry.add(new TestPackage("Analyzers", "1.0.0").file("analyzers/dotnet/cs/Analyzers.dll"));
        this.registry.add(new TestPackage("App", "1.0.0").dependency("Analyzers", "1.0.0").file("lib/net472/App.dll"));

        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("App", "1.0.0"));
        assertEquals(names("App.dll"), fileNames(resolve(descriptor, null)));
        assertFalse(Files.exists(this.localFolder.resolve("analyzers")));
    }

    @Test
    public void testUnavailablePackageFails() {
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Nowhere", "1.0.0"));

        Throwable failure = FutureAssertions.assertFails(descriptor.resolveAsync(null, this.resolver, Runnable::run, CancellationToken.NONE));
        assertTrue(failure instanceof ReferenceResolutionException, () -> "Unexpected failure " + failure);
        assertFalse(this.resolver.getLock().isHeld());

        // Failures are not memoized
        this.registry.add(new TestPackage("Nowhere", "1.0.0").file("lib/net472/Nowhere.dll"));
        assertEquals(names("Nowhere.dll"), fileNames(resolve(descriptor, null)));
    }

    @Test
    public void testCancellation() {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll"));
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));

        CancellationToken token = new CancellationToken();
        token.cancel();
        FutureAssertions.assertCancelled(descriptor.resolveAsync(null, this.resolver, Runnable::run, token));
        assertFalse(this.resolver.getLock().isHeld());
        assertEquals(0, this.registry.lookups.get());

        assertEquals(names("Core.dll"), fileNames(resolve(descriptor, null)));
    }

    @Test
    public void testCancellationDuringExtractionKeepsLock() throws Exception {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll"));
        PackageIdentity base = PackageIdentity.of("Base", "1.0.0");
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(base);

        CountDownLatch extracting = new CountDownLatch(1);
        CountDownLatch resume = new CountDownLatch(1);
        LoggingAdapter previous = LoggingAdapter.getDefaultLogger();
        LoggingAdapter.setDefaultLogger(new PausingLogger(previous, "Extracting", extracting, resume));
        ExecutorService executor = Executors.newCachedThreadPool();
        try {
            CancellationToken token = new CancellationToken();
            CompletableFuture<Set<Path>> future = descriptor.resolveAsync(null, this.resolver, executor, token);
            assertTrue(extracting.await(30, TimeUnit.SECONDS));

            token.cancel();
            // The extraction task is still running, so nothing may be handed to the next caller yet
            assertFalse(future.isDone());
            assertTrue(this.resolver.getLock().isHeld());

            resume.countDown();
            FutureAssertions.assertCancelled(future);
            assertFalse(this.resolver.getLock().isHeld());
        } finally {
            resume.countDown();
            LoggingAdapter.setDefaultLogger(previous);
            executor.shutdownNow();
        }

        PackageFolder local = new PackageFolder(this.localFolder);
        assertNull(local.getInstalledPath(base));
        try (Stream<Path> leftovers = Files.list(this.localFolder.resolve("base"))) {
            assertEquals(0, leftovers.count());
        }
        assertEquals(names("Core.dll"), fileNames(resolve(descriptor, null)));
    }

    @Test
    public void testSingleFlight() throws Exception {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll"));
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Set<Path>>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> descriptor, executor)
                        .thenCompose((d) -> d.resolveAsync(null, this.resolver, executor, CancellationToken.NONE)));
            }
            Set<Path> first = futures.get(0).get(30, TimeUnit.SECONDS);
            for (CompletableFuture<Set<Path>> future : futures) {
                assertSame(first, future.get(30, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, this.registry.lookups.get());
        assertEquals(1, this.registry.downloads.get());
        assertFalse(this.resolver.getLock().isHeld());
    }

    @Test
    public void testReferenceHandles() {
        this.registry.add(new TestPackage("Base", "1.0.0").file("lib/net472/Core.dll").file("lib/net472/Util.dll"));
        ReferenceAssemblies descriptor = new ReferenceAssemblies(TargetFramework.parse("net472")).addPackages(PackageIdentity.of("Base", "1.0.0"));

        List<String> first = descriptor.resolveReferencesAsync(null, this.resolver, (path) -> path.getFileName().toString(), Runnable::run, CancellationToken.NONE).join();
        List<String> second = descriptor.resolveReferencesAsync(null, this.resolver, (path) -> path.getFileName().toString(), Runnable::run, CancellationToken.NONE).join();
        assertEquals(names("Core.dll", "Util.dll"), new TreeSet<>(first));
        assertEquals(first, second);
        assertNotSame(first, second);
    }
}
