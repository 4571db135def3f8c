package org.stianloader.refresolve.test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.jetbrains.annotations.NotNull;
import org.stianloader.refresolve.logging.LoggingAdapter;

/**
 * Forwards to another logger, but holds up the thread logging an info message with the given
 * prefix until released. Used to pause the resolver at a well-known point.
 */
class PausingLogger extends LoggingAdapter {

    @NotNull
    private final LoggingAdapter delegate;
    @NotNull
    private final String prefix;
    @NotNull
    private final CountDownLatch reached;
    @NotNull
    private final CountDownLatch resume;

    PausingLogger(@NotNull LoggingAdapter delegate, @NotNull String prefix, @NotNull CountDownLatch reached, @NotNull CountDownLatch resume) {
        this.delegate = delegate;
        this.prefix = prefix;
        this.reached = reached;
        this.resume = resume;
    }

    @Override
    public void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.delegate.debug(clazz, message, args);
    }

    @Override
    public void error(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.delegate.error(clazz, message, args);
    }

    @Override
    public void info(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.delegate.info(clazz, message, args);
        if (message.startsWith(this.prefix)) {
            this.reached.countDown();
            try {
                if (!this.resume.await(30, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("Never resumed");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args) {
        this.delegate.warn(clazz, message, args);
    }
}
