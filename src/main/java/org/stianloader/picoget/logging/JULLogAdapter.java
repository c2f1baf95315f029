package org.stianloader.picoget.logging;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

class JULLogAdapter extends LoggingAdapter {

    /**
     * Expands "{}" placeholders from left to right. Surplus arguments are appended,
     * with a trailing {@link Throwable} rendered as its stacktrace on a new line.
     */
    @NotNull
    @Contract(pure = true)
    static String formatMessage(@NotNull String message, Object... args) {
        StringBuilder builder = new StringBuilder(message.length() + 16 * args.length);
        int cursor = 0;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            int placeholder = message.indexOf("{}", cursor);
            if (placeholder != -1) {
                builder.append(message, cursor, placeholder).append(Objects.toString(arg));
                cursor = placeholder + 2;
                continue;
            }
            builder.append(message, cursor, message.length());
            cursor = message.length();
            if (i == args.length - 1 && arg instanceof Throwable) {
                StringWriter sw = new StringWriter();
                ((Throwable) arg).printStackTrace(new PrintWriter(sw));
                builder.append('\n').append(sw);
            } else {
                builder.append(' ').append(Objects.toString(arg));
            }
        }
        builder.append(message, cursor, message.length());
        return builder.toString();
    }

    private static void log(Class<?> clazz, Level level, String message, Object... args) {
        Logger logger = Logger.getLogger(clazz.getName());
        if (logger.isLoggable(level)) {
            logger.log(level, JULLogAdapter.formatMessage(message, args));
        }
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
