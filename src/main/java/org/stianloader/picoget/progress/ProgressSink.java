package org.stianloader.picoget.progress;

import org.jetbrains.annotations.NotNull;
import org.stianloader.picoget.logging.LoggingAdapter;

/**
 * Receives the human-readable status lines of a run, one call per line, in the order the events happened.
 */
@FunctionalInterface
public interface ProgressSink {

    @NotNull
    ProgressSink NONE = (message) -> { };

    /**
     * Obtains a sink that forwards every line to the {@link LoggingAdapter#getDefaultLogger() default logger}
     * at info level.
     *
     * @return The logging sink
     */
    @NotNull
    static ProgressSink logging() {
        return (message) -> LoggingAdapter.getDefaultLogger().info(ProgressSink.class, "{}", message);
    }

    void progress(@NotNull String message);
}
