package org.stianloader.refresolve.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.stianloader.refresolve.CancellationToken;
import org.stianloader.refresolve.PackageConflictException;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.DependencyGraph;
import org.stianloader.refresolve.graph.DependencyGraphResolver;
import org.stianloader.refresolve.repo.RegistryCacheContext;
import org.stianloader.refresolve.resolve.PackageResolver;

public class PackageResolverTest {

    private List<PackageIdentity> resolve(InMemoryPackageRegistry registry, PackageIdentity... targets) throws Exception {
        DependencyGraph graph = new DependencyGraphResolver(Collections.singletonList(registry), TargetFramework.parse("net472"))
                .resolveAsync(null, Arrays.asList(targets), new RegistryCacheContext(), Runnable::run, CancellationToken.NONE)
                .get();
        return new PackageResolver().resolve(graph, Arrays.asList(targets));
    }

    @Test
    public void testLowestSatisfyingVersion() throws Exception {
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("Ext", "1.0.0").dependency("Base", "[1.0.0,)"))
                .add(new TestPackage("Base", "1.0.0"));

        List<PackageIdentity> selected = resolve(registry, PackageIdentity.of("Ext", "1.0.0"));

        assertEquals(Arrays.asList(PackageIdentity.of("Base", "1.0.0"), PackageIdentity.of("Ext", "1.0.0")), selected);
    }

    @Test
    public void testHighestLowerBoundWins() throws Exception {
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("A", "1.0.0").dependency("Common", "1.0.0"))
                .add(new TestPackage("B", "1.0.0").dependency("Common", "2.0.0"))
                .add(new TestPackage("Common", "1.0.0"))
                .add(new TestPackage("Common", "2.0.0"))
                .add(new TestPackage("Common", "3.0.0"));

        List<PackageIdentity> selected = resolve(registry, PackageIdentity.of("A", "1.0.0"), PackageIdentity.of("B", "1.0.0"));

        assertEquals(3, selected.size());
        assertTrue(selected.contains(PackageIdentity.of("Common", "2.0.0")));
        assertTrue(selected.indexOf(PackageIdentity.of("Common", "2.0.0")) < selected.indexOf(PackageIdentity.of("A", "1.0.0")));
        assertTrue(selected.indexOf(PackageIdentity.of("Common", "2.0.0")) < selected.indexOf(PackageIdentity.of("B", "1.0.0")));
    }

    @Test
    public void testBacktracking() throws Exception {
        // Common 1.0 needs Helper 1.0, but B requires Helper 2.0 through Mid, which is only discovered after Common was selected
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("A", "1.0.0").dependency("Common", "[1.0.0,3.0.0)"))
                .add(new TestPackage("B", "1.0.0").dependency("Mid", "[1.0.0]"))
                .add(new TestPackage("Mid", "1.0.0").dependency("Helper", "[2.0.0]"))
                .add(new TestPackage("Common", "1.0.0").dependency("Helper", "[1.0.0]"))
                .add(new TestPackage("Common", "2.0.0").dependency("Helper", "[2.0.0]"))
                .add(new TestPackage("Helper", "1.0.0"))
                .add(new TestPackage("Helper", "2.0.0"));

        List<PackageIdentity> selected = resolve(registry, PackageIdentity.of("A", "1.0.0"), PackageIdentity.of("B", "1.0.0"),
                PackageIdentity.of("Common", "1.0.0"), PackageIdentity.of("Common", "2.0.0"));

        assertEquals(5, selected.size());
        assertTrue(selected.contains(PackageIdentity.of("Common", "2.0.0")));
        assertTrue(selected.contains(PackageIdentity.of("Helper", "2.0.0")));
        assertTrue(selected.indexOf(PackageIdentity.of("Helper", "2.0.0")) < selected.indexOf(PackageIdentity.of("Mid", "1.0.0")));
    }

    @Test
    public void testConflict() {
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("A", "1.0.0").dependency("Common", "[1.0.0]"))
                .add(new TestPackage("B", "1.0.0").dependency("Common", "[2.0.0,)"))
                .add(new TestPackage("Common", "1.0.0"))
                .add(new TestPackage("Common", "2.0.0"));

        PackageConflictException conflict = assertThrows(PackageConflictException.class, () -> {
            resolve(registry, PackageIdentity.of("A", "1.0.0"), PackageIdentity.of("B", "1.0.0"));
        });
        assertTrue(conflict.getConflictingIds().contains("common"));
    }

    @Test
    public void testRequestedVersionIsKept() throws Exception {
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("A", "1.0.0").dependency("Base", "[2.0.0,)"))
                .add(new TestPackage("Base", "1.0.0"))
                .add(new TestPackage("Base", "2.0.0"));

        assertThrows(PackageConflictException.class, () -> {
            resolve(registry, PackageIdentity.of("A", "1.0.0"), PackageIdentity.of("Base", "1.0.0"));
        });
    }

    @Test
    public void testMissingDependencyIgnored() throws Exception {
        InMemoryPackageRegistry registry = new InMemoryPackageRegistry("feed")
                .add(new TestPackage("A", "1.0.0").dependency("Missing", "1.0.0"));

        assertEquals(Collections.singletonList(PackageIdentity.of("A", "1.0.0")), resolve(registry, PackageIdentity.of("A", "1.0.0")));
    }
}
