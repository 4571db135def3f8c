package org.stianloader.refresolve;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.framework.TargetFramework;

/**
 * Describes the set of reference assemblies a compilation is performed against: the target
 * framework, the package providing the framework's reference assemblies together with the path of
 * those assemblies within the package, the assemblies to reference out of that path and any
 * additional packages.
 *
 * <p>Descriptors are immutable. All {@code with} and {@code add} methods return a new descriptor
 * and leave the original untouched. Each descriptor instance memoizes the assemblies resolved for
 * it, separately for each source language, so that resolving the same descriptor instance again
 * is cheap and yields the same set. The memo is bound to the instance: a descriptor derived from
 * another one starts with an empty memo, even if it is equal to the original.
 *
 * <p>The memo does not distinguish between {@link ReferenceAssemblyResolver resolvers}: the first
 * resolution of a descriptor determines the result for all later ones.
 */
public final class ReferenceAssemblies {

    private static final String DEFAULT_LANGUAGE = "";

    @NotNull
    private static <T> List<T> concat(@NotNull List<T> a, @NotNull Collection<? extends T> b) {
        List<T> list = new ArrayList<>(a.size() + b.size());
        list.addAll(a);
        list.addAll(b);
        return Collections.unmodifiableList(list);
    }

    @NotNull
    private static Map<String, List<@NotNull String>> copyLanguageMap(@NotNull Map<String, ? extends List<@NotNull String>> map) {
        Map<String, List<@NotNull String>> copy = new LinkedHashMap<>();
        map.forEach((language, assemblies) -> {
            copy.put(Objects.requireNonNull(language, "language may not be null"), Collections.unmodifiableList(new ArrayList<>(assemblies)));
        });
        return Collections.unmodifiableMap(copy);
    }

    @NotNull
    private final List<@NotNull String> assemblies;
    @NotNull
    private final AssemblyIdentityComparer assemblyIdentityComparer;
    @NotNull
    private final Map<String, List<@NotNull String>> languageSpecificAssemblies;
    @NotNull
    private final Map<String, Set<@NotNull Path>> memo = new HashMap<>();
    @NotNull
    private final List<@NotNull PackageIdentity> packages;
    @Nullable
    private final PackageIdentity referenceAssemblyPackage;
    @Nullable
    private final String referenceAssemblyPath;
    @NotNull
    private final TargetFramework targetFramework;

    /**
     * Creates a descriptor that is not backed by a reference assembly package. Such descriptors
     * obtain all of their assemblies from {@link #withPackages(List) extra packages}.
     *
     * @param targetFramework The framework compiled against
     */
    public ReferenceAssemblies(@NotNull TargetFramework targetFramework) {
        this(targetFramework, AssemblyIdentityComparer.DEFAULT, null, null, Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());
    }

    /**
     * Creates a descriptor backed by a reference assembly package.
     *
     * @param targetFramework The framework compiled against
     * @param referenceAssemblyPackage The package providing the reference assemblies
     * @param referenceAssemblyPath The directory of the reference assemblies within the package, using '/' as separator
     */
    public ReferenceAssemblies(@NotNull TargetFramework targetFramework, @NotNull PackageIdentity referenceAssemblyPackage, @NotNull String referenceAssemblyPath) {
        this(targetFramework, AssemblyIdentityComparer.DEFAULT, Objects.requireNonNull(referenceAssemblyPackage, "referenceAssemblyPackage may not be null"),
                Objects.requireNonNull(referenceAssemblyPath, "referenceAssemblyPath may not be null"), Collections.emptyList(), Collections.emptyMap(), Collections.emptyList());
    }

    private ReferenceAssemblies(@NotNull TargetFramework targetFramework, @NotNull AssemblyIdentityComparer assemblyIdentityComparer,
            @Nullable PackageIdentity referenceAssemblyPackage, @Nullable String referenceAssemblyPath, @NotNull List<@NotNull String> assemblies,
            @NotNull Map<String, List<@NotNull String>> languageSpecificAssemblies, @NotNull List<@NotNull PackageIdentity> packages) {
        this.targetFramework = Objects.requireNonNull(targetFramework, "targetFramework may not be null");
        this.assemblyIdentityComparer = Objects.requireNonNull(assemblyIdentityComparer, "assemblyIdentityComparer may not be null");
        this.referenceAssemblyPackage = referenceAssemblyPackage;
        this.referenceAssemblyPath = referenceAssemblyPath;
        this.assemblies = assemblies;
        this.languageSpecificAssemblies = languageSpecificAssemblies;
        this.packages = packages;
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addAssemblies(@NotNull String @NotNull... assemblies) {
        return this.addAssemblies(Arrays.asList(assemblies));
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addAssemblies(@NotNull List<@NotNull String> assemblies) {
        return this.withAssemblies(ReferenceAssemblies.concat(this.assemblies, assemblies));
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addLanguageSpecificAssemblies(@NotNull String language, @NotNull String @NotNull... assemblies) {
        return this.addLanguageSpecificAssemblies(language, Arrays.asList(assemblies));
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addLanguageSpecificAssemblies(@NotNull String language, @NotNull List<@NotNull String> assemblies) {
        return this.withLanguageSpecificAssemblies(language, ReferenceAssemblies.concat(this.getLanguageSpecificAssemblies(language), assemblies));
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addPackages(@NotNull PackageIdentity @NotNull... packages) {
        return this.addPackages(Arrays.asList(packages));
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies addPackages(@NotNull List<@NotNull PackageIdentity> packages) {
        return this.withPackages(ReferenceAssemblies.concat(this.packages, packages));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ReferenceAssemblies)) {
            return false;
        }
        ReferenceAssemblies other = (ReferenceAssemblies) obj;
        return this.targetFramework.equals(other.targetFramework)
                && this.assemblyIdentityComparer == other.assemblyIdentityComparer
                && Objects.equals(this.referenceAssemblyPackage, other.referenceAssemblyPackage)
                && Objects.equals(this.referenceAssemblyPath, other.referenceAssemblyPath)
                && this.assemblies.equals(other.assemblies)
                && this.languageSpecificAssemblies.equals(other.languageSpecificAssemblies)
                && this.packages.equals(other.packages);
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getAssemblies() {
        return this.assemblies;
    }

    @NotNull
    @Contract(pure = true)
    public AssemblyIdentityComparer getAssemblyIdentityComparer() {
        return this.assemblyIdentityComparer;
    }

    @NotNull
    @Contract(pure = true)
    public Map<String, List<@NotNull String>> getLanguageSpecificAssemblies() {
        return this.languageSpecificAssemblies;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull String> getLanguageSpecificAssemblies(@NotNull String language) {
        List<@NotNull String> assemblies = this.languageSpecificAssemblies.get(language);
        return assemblies == null ? Collections.emptyList() : assemblies;
    }

    @NotNull
    @Contract(pure = true)
    public List<@NotNull PackageIdentity> getPackages() {
        return this.packages;
    }

    @Nullable
    @Contract(pure = true)
    public PackageIdentity getReferenceAssemblyPackage() {
        return this.referenceAssemblyPackage;
    }

    @Nullable
    @Contract(pure = true)
    public String getReferenceAssemblyPath() {
        return this.referenceAssemblyPath;
    }

    @NotNull
    @Contract(pure = true)
    public TargetFramework getTargetFramework() {
        return this.targetFramework;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.targetFramework, this.assemblyIdentityComparer, this.referenceAssemblyPackage, this.referenceAssemblyPath,
                this.assemblies, this.languageSpecificAssemblies, this.packages);
    }

    /**
     * Resolves the assemblies of this descriptor on the common pool.
     *
     * @param language The source language, or null
     * @param resolver The environment to resolve in
     * @param token The cancellation signal
     * @return A future completing with the resolved assembly paths
     * @see #resolveAsync(String, ReferenceAssemblyResolver, Executor, CancellationToken)
     */
    @NotNull
    public CompletableFuture<Set<@NotNull Path>> resolveAsync(@Nullable String language, @NotNull ReferenceAssemblyResolver resolver, @NotNull CancellationToken token) {
        return this.resolveAsync(language, resolver, ForkJoinPool.commonPool(), token);
    }

    /**
     * Resolves the assembly files to compile against for the given source language.
     *
     * <p>If the language is null, or if this descriptor does not register any assemblies specific
     * to the language, the language-agnostic set is resolved. The result is memoized per language:
     * once a set was resolved, the very same set instance is returned without any I/O.
     * Otherwise the lock of the resolver's local folder is acquired, so that at most one
     * resolution per folder runs at a time across all threads and processes. Should another
     * thread have resolved this descriptor while the lock was awaited, its result is returned.
     *
     * <p>The lock is released once the returned future completes, regardless of its outcome.
     * Failed and cancelled resolutions are not memoized.
     *
     * @param language The source language, or null
     * @param resolver The environment to resolve in
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the unmodifiable set of absolute assembly paths
     */
    @NotNull
    public CompletableFuture<Set<@NotNull Path>> resolveAsync(@Nullable String language, @NotNull ReferenceAssemblyResolver resolver, @NotNull Executor executor, @NotNull CancellationToken token) {
        String memoKey;
        if (language == null || this.getLanguageSpecificAssemblies(language).isEmpty()) {
            memoKey = ReferenceAssemblies.DEFAULT_LANGUAGE;
        } else {
            memoKey = language;
        }
        String effectiveLanguage = memoKey.isEmpty() ? null : memoKey;

        synchronized (this.memo) {
            Set<@NotNull Path> cached = this.memo.get(memoKey);
            if (cached != null) {
                return CompletableFuture.completedFuture(cached);
            }
        }

        return resolver.getLock().acquire(executor, token).thenCompose((releaser) -> {
            CompletableFuture<Set<@NotNull Path>> result;
            try {
                Set<@NotNull Path> cached;
                synchronized (this.memo) {
                    cached = this.memo.get(memoKey);
                }
                if (cached != null) {
                    result = CompletableFuture.completedFuture(cached);
                } else {
                    result = resolver.resolveUnguarded(this, effectiveLanguage, executor, token).thenApply((resolved) -> {
                        token.throwIfCancellationRequested();
                        synchronized (this.memo) {
                            Set<@NotNull Path> present = this.memo.putIfAbsent(memoKey, resolved);
                            return present == null ? resolved : present;
                        }
                    });
                }
            } catch (RuntimeException e) {
                result = CompletableFuture.failedFuture(e);
            }
            return result.whenComplete((value, ex) -> releaser.close());
        });
    }

    /**
     * Resolves the assemblies of this descriptor and converts each of them into a reference
     * handle. The handles are created anew on every call, in the order of the resolved set.
     *
     * @param <R> The type of the reference handles
     * @param language The source language, or null
     * @param resolver The environment to resolve in
     * @param factory The function creating the handles
     * @param executor The executor to perform blocking operations on
     * @param token The cancellation signal
     * @return A future completing with the reference handles
     */
    @NotNull
    public <R> CompletableFuture<List<R>> resolveReferencesAsync(@Nullable String language, @NotNull ReferenceAssemblyResolver resolver, @NotNull ReferenceHandleFactory<R> factory,
            @NotNull Executor executor, @NotNull CancellationToken token) {
        return this.resolveAsync(language, resolver, executor, token).thenApply((assemblies) -> {
            List<R> references = new ArrayList<>(assemblies.size());
            for (Path assembly : assemblies) {
                references.add(factory.fromFile(assembly));
            }
            return Collections.unmodifiableList(references);
        });
    }

    @NotNull
    public <R> CompletableFuture<List<R>> resolveReferencesAsync(@Nullable String language, @NotNull ReferenceAssemblyResolver resolver, @NotNull ReferenceHandleFactory<R> factory, @NotNull CancellationToken token) {
        return this.resolveReferencesAsync(language, resolver, factory, ForkJoinPool.commonPool(), token);
    }

    @Override
    @NotNull
    public String toString() {
        StringBuilder builder = new StringBuilder("ReferenceAssemblies[");
        builder.append(this.targetFramework);
        if (this.referenceAssemblyPackage != null) {
            builder.append(" package=").append(this.referenceAssemblyPackage).append(" path=").append(this.referenceAssemblyPath);
        }
        if (!this.packages.isEmpty()) {
            builder.append(" packages=").append(this.packages);
        }
        return builder.append(']').toString();
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies withAssemblies(@NotNull List<@NotNull String> assemblies) {
        return new ReferenceAssemblies(this.targetFramework, this.assemblyIdentityComparer, this.referenceAssemblyPackage, this.referenceAssemblyPath,
                Collections.unmodifiableList(new ArrayList<>(assemblies)), this.languageSpecificAssemblies, this.packages);
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies withAssemblyIdentityComparer(@NotNull AssemblyIdentityComparer comparer) {
        return new ReferenceAssemblies(this.targetFramework, comparer, this.referenceAssemblyPackage, this.referenceAssemblyPath,
                this.assemblies, this.languageSpecificAssemblies, this.packages);
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies withLanguageSpecificAssemblies(@NotNull Map<String, ? extends List<@NotNull String>> languageSpecificAssemblies) {
        return new ReferenceAssemblies(this.targetFramework, this.assemblyIdentityComparer, this.referenceAssemblyPackage, this.referenceAssemblyPath,
                this.assemblies, ReferenceAssemblies.copyLanguageMap(languageSpecificAssemblies), this.packages);
    }

    /**
     * Replaces the assemblies specific to a single language, keeping those of other languages.
     *
     * @param language The source language
     * @param assemblies The assemblies referenced only when compiling that language
     * @return The new descriptor
     */
    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies withLanguageSpecificAssemblies(@NotNull String language, @NotNull List<@NotNull String> assemblies) {
        Map<String, List<@NotNull String>> map = new LinkedHashMap<>(this.languageSpecificAssemblies);
        map.put(Objects.requireNonNull(language, "language may not be null"), assemblies);
        return this.withLanguageSpecificAssemblies(map);
    }

    @NotNull
    @Contract(pure = true)
    public ReferenceAssemblies withPackages(@NotNull List<@NotNull PackageIdentity> packages) {
        List<@NotNull PackageIdentity> copy = new ArrayList<>(packages.size());
        for (PackageIdentity pkg : packages) {
            copy.add(Objects.requireNonNull(pkg, "packages may not contain null"));
        }
        return new ReferenceAssemblies(this.targetFramework, this.assemblyIdentityComparer, this.referenceAssemblyPackage, this.referenceAssemblyPath,
                this.assemblies, this.languageSpecificAssemblies, Collections.unmodifiableList(copy));
    }
}
