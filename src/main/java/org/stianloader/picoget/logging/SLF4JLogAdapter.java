package org.stianloader.picoget.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SLF4JLogAdapter extends LoggingAdapter {

    private static Logger logger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }

    @Override
    public void debug(Class<?> clazz, String message, Object... args) {
        Logger logger = SLF4JLogAdapter.logger(clazz);
        if (logger.isDebugEnabled()) {
            logger.debug(message, args);
        }
    }

    @Override
    public void error(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).error(message, args);
    }

    @Override
    public void info(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).info(message, args);
    }

    @Override
    public void warn(Class<?> clazz, String message, Object... args) {
        SLF4JLogAdapter.logger(clazz).warn(message, args);
    }
}
