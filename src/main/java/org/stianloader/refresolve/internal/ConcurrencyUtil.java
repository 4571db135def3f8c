package org.stianloader.refresolve.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.stianloader.refresolve.CancellationToken;

public class ConcurrencyUtil {

    /**
     * Runs the given {@link Callable} on the executor.
     *
     * <p>A task that is cancelled while still queued is never started and its future fails right
     * away. Once the task has started, its future only completes when the task returns: tasks
     * are expected to poll the token themselves. Callers may thus release resources guarding
     * the task as soon as the future completes, even on cancellation.
     *
     * @param <T> The type of the computed value
     * @param source The task to run
     * @param executor The executor to run the task on
     * @param token The cancellation signal
     * @return A future completing with the task's result
     */
    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor, @NotNull CancellationToken token) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        AtomicBoolean claimed = new AtomicBoolean();
        Runnable unregister = token.onCancel(() -> {
            if (claimed.compareAndSet(false, true)) {
                cf.completeExceptionally(new CancellationException("The operation was cancelled"));
            }
        });
        try {
            executor.execute(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return;
                }
                try {
                    token.throwIfCancellationRequested();
                    cf.complete(source.call());
                } catch (Throwable t) {
                    cf.completeExceptionally(t);
                } finally {
                    unregister.run();
                }
            });
        } catch (RuntimeException e) {
            unregister.run();
            if (claimed.compareAndSet(false, true)) {
                cf.completeExceptionally(e);
            }
        }
        return cf;
    }

    /**
     * Strips the {@link CompletionException} wrappers that {@link CompletableFuture} puts around
     * exceptions thrown by dependent stages.
     *
     * @param t The throwable to unwrap
     * @return The innermost cause that is not a {@link CompletionException}
     */
    @Nullable
    public static Throwable unwrap(@Nullable Throwable t) {
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
