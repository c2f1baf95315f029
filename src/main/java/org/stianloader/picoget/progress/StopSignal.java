package org.stianloader.picoget.progress;

import java.util.concurrent.atomic.AtomicBoolean;

import org.jetbrains.annotations.Contract;

/**
 * A {@link CancellationToken} that can be raised from any thread, for example from a shutdown hook
 * or a "stop" button while the run itself executes elsewhere. Once raised it stays raised.
 */
public final class StopSignal implements CancellationToken {
    private final AtomicBoolean raised = new AtomicBoolean();

    @Override
    public boolean isStopRequested() {
        return this.raised.get();
    }

    /**
     * Requests the run observing this signal to stop at its next checkpoint.
     *
     * @return True if this call raised the signal, false if it was raised already
     */
    @Contract(mutates = "this")
    public boolean raise() {
        return this.raised.compareAndSet(false, true);
    }
}
