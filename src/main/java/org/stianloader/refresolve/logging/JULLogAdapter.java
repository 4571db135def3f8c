package org.stianloader.refresolve.logging;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

class JULLogAdapter extends LoggingAdapter {

    @NotNull
    static String formatMessage(@NotNull String message, @Nullable Throwable thrown, Object @NotNull... args) {
        int argCount = thrown == null ? args.length : args.length - 1;
        StringBuilder builder = new StringBuilder(message.length() + 16 * argCount);
        int head = 0;
        int i = 0;
        for (; i < argCount; i++) {
            int placeholder = message.indexOf("{}", head);
            if (placeholder == -1) {
                break;
            }
            builder.append(message, head, placeholder).append(Objects.toString(args[i]));
            head = placeholder + 2;
        }
        builder.append(message, head, message.length());
        for (; i < argCount; i++) {
            builder.append(' ').append(Objects.toString(args[i]));
        }
        return builder.toString();
    }

    private static void log(@NotNull Class<?> clazz, @NotNull Level level, @NotNull String message, Object @NotNull... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (!logger.isLoggable(level)) {
            return;
        }
        Throwable thrown = null;
        if (args.length != 0 && args[args.length - 1] instanceof Throwable) {
            thrown = (Throwable) args[args.length - 1];
        }
        LogRecord record = new LogRecord(level, JULLogAdapter.formatMessage(message, thrown, args));
        record.setLoggerName(logger.getName());
        record.setSourceClassName(clazz.getName());
        record.setThrown(thrown);
        logger.log(record);
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.FINE, message, args);
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.SEVERE, message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.INFO, message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        JULLogAdapter.log(clazz, Level.WARNING, message, args);
    }
}
