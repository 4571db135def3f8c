package org.stianloader.refresolve.packaging;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.framework.FrameworkReducer;
import org.stianloader.refresolve.framework.FrameworkSpecificGroup;
import org.stianloader.refresolve.framework.TargetFramework;
import org.stianloader.refresolve.graph.PackageDependency;
import org.stianloader.refresolve.internal.XMLUtil;
import org.stianloader.refresolve.version.PackageVersion;
import org.stianloader.refresolve.version.VersionRange;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Reads the package manifest (".nuspec" file) of a package.
 */
public class NuspecReader {

    public static final record DependencyGroup(@NotNull TargetFramework targetFramework, @NotNull List<@NotNull PackageDependency> dependencies) {
    }

    @NotNull
    public static NuspecReader read(byte @NotNull[] nuspec) throws IOException {
        return new NuspecReader(XMLUtil.parse(new ByteArrayInputStream(nuspec)));
    }

    @NotNull
    private static List<@NotNull PackageDependency> readDependencies(@NotNull Element parent) {
        List<@NotNull PackageDependency> dependencies = new ArrayList<>();
        for (Element dependency : XMLUtil.getChildElements(parent, "dependency")) {
            String id = dependency.getAttribute("id").trim();
            if (id.isEmpty()) {
                continue;
            }
            dependencies.add(new PackageDependency(id, VersionRange.parse(dependency.getAttribute("version"))));
        }
        return dependencies;
    }

    @NotNull
    private final Element metadata;

    public NuspecReader(@NotNull Document document) {
        this.metadata = XMLUtil.reqElement(document.getDocumentElement(), "metadata");
    }

    /**
     * Obtains the dependencies of the dependency group nearest to the given framework.
     * Returns an empty list if no group is compatible.
     *
     * @param target The consuming framework
     * @param reducer The reducer to select the nearest group with
     * @return The dependencies declared for the target
     */
    @NotNull
    public List<@NotNull PackageDependency> getDependencies(@NotNull TargetFramework target, @NotNull FrameworkReducer reducer) {
        List<@NotNull DependencyGroup> groups = this.getDependencyGroups();
        List<@NotNull TargetFramework> frameworks = new ArrayList<>();
        for (DependencyGroup group : groups) {
            frameworks.add(group.targetFramework());
        }
        TargetFramework nearest = reducer.getNearest(target, frameworks);
        if (nearest == null) {
            return Collections.emptyList();
        }
        for (DependencyGroup group : groups) {
            if (group.targetFramework().equals(nearest)) {
                return group.dependencies();
            }
        }
        throw new IllegalStateException("Nearest framework " + nearest + " is not part of " + frameworks);
    }

    /**
     * Obtains all dependency groups. Dependencies declared outside of a group, as done by legacy
     * manifests, form a single framework-agnostic group.
     *
     * @return The dependency groups in declaration order
     */
    @NotNull
    public List<@NotNull DependencyGroup> getDependencyGroups() {
        Element dependencies = XMLUtil.optElement(this.metadata, "dependencies");
        if (dependencies == null) {
            return Collections.emptyList();
        }
        List<@NotNull DependencyGroup> groups = new ArrayList<>();
        for (Element group : XMLUtil.getChildElements(dependencies, "group")) {
            TargetFramework framework = TargetFramework.parse(group.getAttribute("targetFramework"));
            groups.add(new DependencyGroup(framework, Collections.unmodifiableList(NuspecReader.readDependencies(group))));
        }
        List<@NotNull PackageDependency> ungrouped = NuspecReader.readDependencies(dependencies);
        if (!ungrouped.isEmpty()) {
            groups.add(new DependencyGroup(TargetFramework.ANY, Collections.unmodifiableList(ungrouped)));
        }
        return groups;
    }

    /**
     * Obtains the assemblies a package expects to be provided by the framework itself, grouped by
     * the frameworks they apply to. An assembly may name multiple comma-separated frameworks.
     *
     * @return The framework assembly groups
     */
    @NotNull
    public List<@NotNull FrameworkSpecificGroup> getFrameworkAssemblyGroups() {
        Element frameworkAssemblies = XMLUtil.optElement(this.metadata, "frameworkAssemblies");
        if (frameworkAssemblies == null) {
            return Collections.emptyList();
        }
        Map<TargetFramework, List<@NotNull String>> grouped = new LinkedHashMap<>();
        for (Element assembly : XMLUtil.getChildElements(frameworkAssemblies, "frameworkAssembly")) {
            String name = assembly.getAttribute("assemblyName").trim();
            if (name.isEmpty()) {
                continue;
            }
            for (String framework : assembly.getAttribute("targetFramework").split(",")) {
                grouped.computeIfAbsent(TargetFramework.parse(framework), (ignored) -> new ArrayList<>()).add(name);
            }
        }
        List<@NotNull FrameworkSpecificGroup> groups = new ArrayList<>();
        grouped.forEach((framework, names) -> groups.add(new FrameworkSpecificGroup(framework, names)));
        return groups;
    }

    @NotNull
    public String getId() {
        String id = XMLUtil.elementText(this.metadata, "id");
        if (id == null || id.isEmpty()) {
            throw new IllegalStateException("Package manifest does not declare an id");
        }
        return id;
    }

    @NotNull
    public PackageIdentity getIdentity() {
        return new PackageIdentity(this.getId(), this.getVersion());
    }

    @NotNull
    public PackageVersion getVersion() {
        String version = XMLUtil.elementText(this.metadata, "version");
        if (version == null) {
            throw new IllegalStateException("Package manifest does not declare a version");
        }
        return PackageVersion.parse(version);
    }

    @Nullable
    @Contract(pure = true)
    public String getDescription() {
        return XMLUtil.elementText(this.metadata, "description");
    }
}
