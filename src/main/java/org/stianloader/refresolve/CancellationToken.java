package org.stianloader.refresolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * A cooperative cancellation signal that is threaded through every asynchronous operation of the
 * resolver. Operations poll {@link #throwIfCancellationRequested()} at their suspension points
 * and may register callbacks through {@link #onCancel(Runnable)} in order to abort blocking I/O
 * or to fail pending futures.
 *
 * <p>Cancellation is one-way: once {@link #cancel()} was called the token stays cancelled.
 * There is no built-in timeout, callers that need one should cancel the token themselves.
 */
public final class CancellationToken {

    /**
     * A token that can never be cancelled.
     */
    @NotNull
    public static final CancellationToken NONE = new CancellationToken(false);

    @NotNull
    private final List<@NotNull Runnable> callbacks = new ArrayList<>();
    private final boolean cancellable;
    private volatile boolean cancelled;

    public CancellationToken() {
        this(true);
    }

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Requests cancellation. Registered callbacks are run on the calling thread, exactly once.
     * Calling this method on an already cancelled token has no effect.
     */
    public void cancel() {
        if (!this.cancellable) {
            throw new IllegalStateException("This token cannot be cancelled");
        }
        List<@NotNull Runnable> toRun;
        synchronized (this.callbacks) {
            if (this.cancelled) {
                return;
            }
            this.cancelled = true;
            toRun = new ArrayList<>(this.callbacks);
            this.callbacks.clear();
        }
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                LoggingAdapter.getDefaultLogger().warn(CancellationToken.class, "Cancellation callback {} failed", callback, e);
            }
        }
    }

    @Contract(pure = true)
    public boolean isCancellationRequested() {
        return this.cancelled;
    }

    /**
     * Registers a callback that is run once cancellation is requested. If the token is already
     * cancelled, the callback is run immediately on the calling thread.
     *
     * @param callback The callback to run
     * @return A handle which unregisters the callback when run
     */
    @NotNull
    public Runnable onCancel(@NotNull Runnable callback) {
        Objects.requireNonNull(callback, "callback may not be null");
        if (!this.cancellable) {
            return () -> { };
        }
        synchronized (this.callbacks) {
            if (!this.cancelled) {
                this.callbacks.add(callback);
                return () -> {
                    synchronized (this.callbacks) {
                        this.callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> { };
    }

    public void throwIfCancellationRequested() {
        if (this.cancelled) {
            throw new CancellationException("The operation was cancelled");
        }
    }
}
