package org.stianloader.picoget.progress;

import org.jetbrains.annotations.NotNull;

/**
 * A stop predicate that is polled between discrete steps of a run: before the graph is built,
 * after it was built, before every dependency edge is resolved and before every download.
 *
 * <p>Cancellation is purely cooperative. An index query or a file transfer in progress is never
 * interrupted, the request is only honoured once the next checkpoint is reached.
 */
@FunctionalInterface
public interface CancellationToken {

    /**
     * A token that never requests a stop.
     */
    @NotNull
    CancellationToken NONE = () -> false;

    boolean isStopRequested();
}
