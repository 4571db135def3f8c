package org.stianloader.refresolve;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.framework.FrameworkReducer;
import org.stianloader.refresolve.framework.FrameworkSpecificGroup;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.logging.LoggingAdapter;
import org.stianloader.refresolve.packaging.InstalledPackage;
import org.stianloader.refresolve.packaging.PackageFolderReader;
import org.stianloader.refresolve.packaging.PackageReader;

/**
 * Collects the assembly files of the installed packages into the final reference set.
 *
 * <p>The set consists of
 * <ol>
 * <li>the ".dll" files of the nearest "ref" group of every package, or of the nearest "lib"
 * group if the package has no compatible "ref" group;</li>
 * <li>the framework assemblies the packages ask for;</li>
 * <li>the assemblies named by the descriptor, including those of the requested language;</li>
 * <li>the facade assemblies of the reference assembly package.</li>
 * </ol>
 * Assemblies of the last three kinds are looked up in the reference assembly directory of the
 * root package and are silently left out if absent there. Without a root package only the first
 * kind is collected.
 */
public class AssemblySetBuilder {

    private static final String ASSEMBLY_EXTENSION = ".dll";
    private static final String FACADES_FOLDER = "Facades";

    @NotNull
    private static Path resolveRelative(@NotNull Path base, @NotNull String relativePath) {
        Path resolved = base;
        for (String segment : relativePath.replace('\\', '/').split("/")) {
            if (!segment.isEmpty()) {
                resolved = resolved.resolve(segment);
            }
        }
        return resolved;
    }

    private static boolean isAssembly(@NotNull String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(AssemblySetBuilder.ASSEMBLY_EXTENSION);
    }

    @NotNull
    private final FrameworkReducer reducer;

    public AssemblySetBuilder(@NotNull FrameworkReducer reducer) {
        this.reducer = Objects.requireNonNull(reducer, "reducer may not be null");
    }

    private void addNamedAssembly(@NotNull Set<Path> out, @NotNull Path referenceDirectory, @NotNull String name) {
        Path assembly = referenceDirectory.resolve(name + AssemblySetBuilder.ASSEMBLY_EXTENSION);
        if (Files.isRegularFile(assembly)) {
            out.add(assembly.toAbsolutePath().normalize());
        } else {
            LoggingAdapter.getDefaultLogger().debug(AssemblySetBuilder.class, "Assembly {} is not present in {}", name, referenceDirectory);
        }
    }

    /**
     * Builds the reference set.
     *
     * @param descriptor The descriptor that is being resolved
     * @param language The source language whose specific assemblies are included, or null for none
     * @param installed The installed packages, the root package first if there is one
     * @return The absolute, normalized assembly paths in insertion order
     * @throws IOException If a package directory could not be read
     */
    @NotNull
    public Set<@NotNull Path> build(@NotNull ReferenceAssemblies descriptor, @Nullable String language, @NotNull List<@NotNull InstalledPackage> installed) throws IOException {
        TargetFramework target = descriptor.getTargetFramework();
        Set<@NotNull Path> assemblies = new LinkedHashSet<>();
        List<@NotNull String> frameworkAssemblies = new ArrayList<>();

        for (InstalledPackage pkg : installed) {
            PackageReader reader = new PackageFolderReader(pkg.directory());
            FrameworkSpecificGroup compileGroup = this.getNearest(target, reader.getRefItems());
            if (compileGroup == null) {
                compileGroup = this.getNearest(target, reader.getLibItems());
            }
            if (compileGroup != null) {
                for (String item : compileGroup.getItems()) {
                    if (AssemblySetBuilder.isAssembly(item)) {
                        assemblies.add(AssemblySetBuilder.resolveRelative(pkg.directory(), item).toAbsolutePath().normalize());
                    }
                }
            }
            FrameworkSpecificGroup frameworkGroup = this.getNearest(target, reader.getFrameworkItems());
            if (frameworkGroup != null) {
                frameworkAssemblies.addAll(frameworkGroup.getItems());
            }
        }

        PackageIdentity rootPackage = descriptor.getReferenceAssemblyPackage();
        if (rootPackage == null) {
            return Collections.unmodifiableSet(assemblies);
        }
        Path rootDirectory = null;
        for (InstalledPackage pkg : installed) {
            if (pkg.identity().equals(rootPackage)) {
                rootDirectory = pkg.directory();
                break;
            }
        }
        if (rootDirectory == null) {
            throw new ReferenceResolutionException("Reference assembly package " + rootPackage + " is not installed");
        }
        String referencePath = descriptor.getReferenceAssemblyPath();
        Path referenceDirectory = referencePath == null ? rootDirectory : AssemblySetBuilder.resolveRelative(rootDirectory, referencePath);

        for (String name : frameworkAssemblies) {
            this.addNamedAssembly(assemblies, referenceDirectory, name);
        }
        for (String name : descriptor.getAssemblies()) {
            this.addNamedAssembly(assemblies, referenceDirectory, name);
        }
        if (language != null) {
            for (String name : descriptor.getLanguageSpecificAssemblies(language)) {
                this.addNamedAssembly(assemblies, referenceDirectory, name);
            }
        }

        Path facades = referenceDirectory.resolve(AssemblySetBuilder.FACADES_FOLDER);
        if (Files.isDirectory(facades)) {
            List<Path> facadeAssemblies = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(facades)) {
                for (Path file : stream) {
                    if (Files.isRegularFile(file) && AssemblySetBuilder.isAssembly(file.getFileName().toString())) {
                        facadeAssemblies.add(file.toAbsolutePath().normalize());
                    }
                }
            }
            Collections.sort(facadeAssemblies);
            assemblies.addAll(facadeAssemblies);
        }

        return Collections.unmodifiableSet(assemblies);
    }

    @Nullable
    private FrameworkSpecificGroup getNearest(@NotNull TargetFramework target, @NotNull List<@NotNull FrameworkSpecificGroup> groups) {
        List<@NotNull TargetFramework> frameworks = new ArrayList<>();
        for (FrameworkSpecificGroup group : groups) {
            frameworks.add(group.getTargetFramework());
        }
        TargetFramework nearest = this.reducer.getNearest(target, frameworks);
        if (nearest == null) {
            return null;
        }
        for (FrameworkSpecificGroup group : groups) {
            if (group.getTargetFramework().equals(nearest)) {
                return group;
            }
        }
        return null;
    }
}
