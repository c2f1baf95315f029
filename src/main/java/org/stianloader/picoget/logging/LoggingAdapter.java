package org.stianloader.picoget.logging;

import java.util.Objects;

import org.jetbrains.annotations.NotNull;

/**
 * Logging facade used by picoget for diagnostics that are not part of the user-facing
 * progress stream, such as index queries, skipped dependencies or finished transfers.
 *
 * <p>SLF4J is an optional dependency of picoget. If it is present on the classpath,
 * messages are routed through it, otherwise {@link java.util.logging.Logger} is used as the sink.
 * The active adapter can be swapped through {@link #setDefaultLogger(LoggingAdapter)}, which
 * is mostly of interest to embedders that want to capture picoget's output.
 *
 * <p>Messages use SLF4J-style "{}" placeholders. Arguments without a matching placeholder
 * are appended to the message and a trailing {@link Throwable} argument has its stacktrace logged.
 * Placeholders never need escaping and are never indexed.
 */
public abstract class LoggingAdapter {

    @NotNull
    static LoggingAdapter currentInstance;

    static {
        LoggingAdapter instance;
        try {
            Class.forName("org.slf4j.LoggerFactory");
            instance = new SLF4JLogAdapter();
        } catch (ClassNotFoundException | NoClassDefFoundError expected) {
            instance = new JULLogAdapter();
        }
        currentInstance = instance;
    }

    @NotNull
    public static LoggingAdapter getDefaultLogger() {
        return LoggingAdapter.currentInstance;
    }

    public static void setDefaultLogger(@NotNull LoggingAdapter instance) {
        LoggingAdapter.currentInstance = Objects.requireNonNull(instance);
    }

    public abstract void debug(Class<?> clazz, String message, Object... args);
    public abstract void error(Class<?> clazz, String message, Object... args);
    public abstract void info(Class<?> clazz, String message, Object... args);
    public abstract void warn(Class<?> clazz, String message, Object... args);
}
