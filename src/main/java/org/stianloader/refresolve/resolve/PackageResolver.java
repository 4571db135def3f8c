package org.stianloader.refresolve.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.PackageConflictException;
import org.stianloader.refresolve.PackageIdentity;
import org.stianloader.refresolve.graph.DependencyGraph;
import org.stianloader.refresolve.graph.DependencyInfo;
import org.stianloader.refresolve.graph.PackageDependency;
import org.stianloader.refresolve.version.PackageVersion;
import org.stianloader.refresolve.version.VersionRange;

/**
 * Selects one version per package id out of a {@link DependencyGraph} such that every dependency
 * constraint of every selected package holds, preferring the lowest acceptable version.
 *
 * <p>The requested packages may only be selected in the versions they were requested with.
 * Any other package may be selected in every version the graph contains, which are tried in
 * ascending order; the search backtracks as soon as a constraint can no longer be met.
 * Dependencies on packages absent from the graph are ignored, as nothing could be installed for
 * them anyway.
 */
public class PackageResolver {

    private static final class SearchState {
        @NotNull
        private final Map<String, PackageIdentity> selected;
        @NotNull
        private final Map<String, List<VersionRange>> constraints;
        @NotNull
        private final List<String> open;

        private SearchState(@NotNull Map<String, PackageIdentity> selected, @NotNull Map<String, List<VersionRange>> constraints, @NotNull List<String> open) {
            this.selected = selected;
            this.constraints = constraints;
            this.open = open;
        }

        @NotNull
        private SearchState copy() {
            Map<String, List<VersionRange>> constraints = new HashMap<>();
            this.constraints.forEach((id, ranges) -> constraints.put(id, new ArrayList<>(ranges)));
            return new SearchState(new LinkedHashMap<>(this.selected), constraints, new ArrayList<>(this.open));
        }
    }

    @NotNull
    private static String key(@NotNull String id) {
        return id.toLowerCase(Locale.ROOT);
    }

    private boolean accepts(@NotNull SearchState state, @NotNull String key, @NotNull PackageVersion version) {
        List<VersionRange> ranges = state.constraints.get(key);
        if (ranges != null) {
            for (VersionRange range : ranges) {
                if (!range.containsVersion(version)) {
                    return false;
                }
            }
        }
        return true;
    }

    @NotNull
    private List<PackageIdentity> getCandidates(@NotNull DependencyGraph graph, @NotNull Map<String, List<PackageIdentity>> targets, @NotNull String key, @NotNull String id) {
        List<PackageIdentity> requested = targets.get(key);
        if (requested != null) {
            return requested;
        }
        List<PackageIdentity> candidates = new ArrayList<>();
        for (PackageVersion version : graph.getVersions(id)) {
            candidates.add(new PackageIdentity(id, version));
        }
        return candidates;
    }

    /**
     * Resolves the versions to install for the given target packages.
     *
     * @param graph The graph containing the targets, their dependencies and all versions thereof
     * @param targets The requested packages
     * @return The selected packages, each listed after all of its dependencies
     * @throws PackageConflictException If no version selection satisfies all constraints
     */
    @NotNull
    public List<@NotNull PackageIdentity> resolve(@NotNull DependencyGraph graph, @NotNull List<@NotNull PackageIdentity> targets) {
        Map<String, List<PackageIdentity>> requested = new LinkedHashMap<>();
        for (PackageIdentity target : targets) {
            List<PackageIdentity> versions = requested.computeIfAbsent(PackageResolver.key(target.id()), (ignored) -> new ArrayList<>());
            if (!versions.contains(target)) {
                versions.add(target);
            }
        }
        requested.values().forEach((versions) -> versions.sort((a, b) -> a.version().compareTo(b.version())));

        Set<String> conflicting = new HashSet<>();
        SearchState initial = new SearchState(new LinkedHashMap<>(), new HashMap<>(), new ArrayList<>());
        for (PackageIdentity target : targets) {
            if (!initial.open.contains(target.id())) {
                initial.open.add(target.id());
            }
        }

        Map<String, PackageIdentity> selection = this.search(graph, requested, initial, conflicting);
        if (selection == null) {
            List<String> ids = new ArrayList<>(conflicting);
            Collections.sort(ids);
            throw new PackageConflictException("Unable to find versions of " + ids + " satisfying all dependency constraints of " + targets, ids);
        }

        List<@NotNull PackageIdentity> ordered = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (PackageIdentity target : targets) {
            this.visit(graph, selection, PackageResolver.key(target.id()), visited, ordered);
        }
        return ordered;
    }

    @Nullable
    private Map<String, PackageIdentity> search(@NotNull DependencyGraph graph, @NotNull Map<String, List<PackageIdentity>> targets, @NotNull SearchState state, @NotNull Set<String> conflicting) {
        String id = null;
        while (!state.open.isEmpty()) {
            String candidateId = state.open.remove(0);
            if (!state.selected.containsKey(PackageResolver.key(candidateId))) {
                id = candidateId;
                break;
            }
        }
        if (id == null) {
            return state.selected;
        }

        String key = PackageResolver.key(id);
        candidateLoop:
        for (PackageIdentity candidate : this.getCandidates(graph, targets, key, id)) {
            if (!this.accepts(state, key, candidate.version())) {
                continue;
            }
            SearchState next = state.copy();
            next.selected.put(key, candidate);
            DependencyInfo info = graph.get(candidate);
            if (info != null) {
                for (PackageDependency dependency : info.getDependencies()) {
                    String dependencyKey = PackageResolver.key(dependency.id());
                    if (!targets.containsKey(dependencyKey) && graph.getVersions(dependency.id()).isEmpty()) {
                        continue;
                    }
                    PackageIdentity selectedDependency = next.selected.get(dependencyKey);
                    if (selectedDependency != null && !dependency.range().containsVersion(selectedDependency.version())) {
                        conflicting.add(dependencyKey);
                        continue candidateLoop;
                    }
                    next.constraints.computeIfAbsent(dependencyKey, (ignored) -> new ArrayList<>()).add(dependency.range());
                    if (selectedDependency == null) {
                        next.open.add(dependency.id());
                    }
                }
            }
            Map<String, PackageIdentity> result = this.search(graph, targets, next, conflicting);
            if (result != null) {
                return result;
            }
        }
        conflicting.add(key);
        return null;
    }

    private void visit(@NotNull DependencyGraph graph, @NotNull Map<String, PackageIdentity> selection, @NotNull String key, @NotNull Set<String> visited, @NotNull List<@NotNull PackageIdentity> out) {
        PackageIdentity identity = selection.get(key);
        if (identity == null || !visited.add(key)) {
            return;
        }
        DependencyInfo info = graph.get(identity);
        if (info != null) {
            for (PackageDependency dependency : info.getDependencies()) {
                this.visit(graph, selection, PackageResolver.key(dependency.id()), visited, out);
            }
        }
        out.add(identity);
    }
}
