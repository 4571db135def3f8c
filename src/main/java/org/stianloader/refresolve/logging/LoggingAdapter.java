package org.stianloader.refresolve.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade of refresolve.
 *
 * <p>refresolve is meant to be dropped into test harnesses which bring their own logging setup.
 * SLF4J is therefore only an optional dependency: if it is present on the classpath it is used as
 * the log sink, otherwise messages are routed to {@link java.util.logging.Logger}.
 *
 * <p>Messages use SLF4J placeholders ("{}"). Arguments without a matching placeholder are appended
 * to the message, leftover placeholders are kept verbatim. If the last argument is a
 * {@link Throwable}, its stacktrace is logged alongside the message.
 */
public abstract class LoggingAdapter {

    @NotNull
    private static volatile LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        LoggingAdapter.currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance, "instance may not be null");
    }

    public abstract void debug(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void error(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void info(@NotNull Class<?> clazz, @NotNull String message, Object... args);
    public abstract void warn(@NotNull Class<?> clazz, @NotNull String message, Object... args);
}
