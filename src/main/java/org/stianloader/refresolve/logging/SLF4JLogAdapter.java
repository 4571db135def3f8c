package org.stianloader.refresolve.logging;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    @NotNull
    private final ClassValue<Logger> loggers = new ClassValue<>() {
        @Override
        protected Logger computeValue(Class<?> type) {
            return LoggerFactory.getLogger(type);
        }
    };

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        Logger logger = this.loggers.get(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        this.loggers.get(clazz).error(message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        this.loggers.get(clazz).info(message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        this.loggers.get(clazz).warn(message, args);
    }
}
