package at.sv.astro;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag handed to a running computation, which checks it between its steps.
 */
public final class CancellationToken {

    private volatile boolean cancelled;

    /**
     * @return a token that is only cancelled if {@link #cancel()} is called on it, for direct synchronous use
     */
    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled = true;
    }

    /**
     * @throws CancellationException if this token was cancelled or the current thread was interrupted
     */
    public void ensureActive() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Computation was superseded");
        }
    }
}
