package org.stianloader.refresolve.repo;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * Caches the raw resources fetched from {@link PackageRegistry registries} for the duration of a
 * single resolution. A manifest that was fetched while building the dependency graph is therefore
 * not fetched a second time, and concurrent requests for the same resource share one download.
 *
 * <p>Failed fetches are evicted so that they are not replayed to later callers.
 */
public final class RegistryCacheContext {

    @NotNull
    private final ConcurrentMap<String, CompletableFuture<byte[]>> resources = new ConcurrentHashMap<>();

    /**
     * Obtains the cached resource for the key, or starts fetching it through the loader.
     * The future may complete with null if the resource does not exist.
     *
     * @param key A key uniquely identifying the resource, for example its URI
     * @param loader The function starting the fetch on a cache miss
     * @return The future of the resource contents
     */
    @NotNull
    public CompletableFuture<byte[]> getOrLoad(@NotNull String key, @NotNull Supplier<@NotNull CompletableFuture<byte[]>> loader) {
        Objects.requireNonNull(key, "key may not be null");
        CompletableFuture<byte[]> created = new CompletableFuture<>();
        CompletableFuture<byte[]> present = this.resources.putIfAbsent(key, created);
        if (present != null) {
            LoggingAdapter.getDefaultLogger().debug(RegistryCacheContext.class, "Reusing cached resource {}", key);
            return present;
        }

        CompletableFuture<byte[]> source;
        try {
            source = loader.get();
        } catch (RuntimeException e) {
            source = CompletableFuture.failedFuture(e);
        }
        source.whenComplete((value, ex) -> {
            if (ex != null) {
                this.resources.remove(key, created);
                created.completeExceptionally(ex);
            } else {
                created.complete(value);
            }
        });
        return created;
    }

    public int size() {
        return this.resources.size();
    }
}
