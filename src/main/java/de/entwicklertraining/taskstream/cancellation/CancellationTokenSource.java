package de.entwicklertraining.taskstream.cancellation;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Owns a {@link CancellationToken} and decides when it is cancelled.
 *
 * <p>The source is handed to whoever may cancel (a UI stop button, a shutdown hook),
 * the token to whoever does the work.
 */
public final class CancellationTokenSource implements AutoCloseable {

    private static final ScheduledExecutorService TIMER = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "cancellation-timer");
        thread.setDaemon(true);
        return thread;
    });

    private final CancellationToken token = new CancellationToken();
    private final ScheduledFuture<?> timeout;

    private CancellationTokenSource(Duration cancelAfter) {
        if (cancelAfter == null) {
            this.timeout = null;
        } else {
            this.timeout = TIMER.schedule(token::cancel, cancelAfter.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Creates a source whose token is only cancelled explicitly.
     *
     * @return a new source
     */
    public static CancellationTokenSource create() {
        return new CancellationTokenSource(null);
    }

    /**
     * Creates a source whose token cancels itself after the given duration.
     *
     * @param cancelAfter delay after which the token is cancelled
     * @return a new source
     * @throws IllegalArgumentException if cancelAfter is null or negative
     */
    public static CancellationTokenSource create(Duration cancelAfter) {
        if (cancelAfter == null || cancelAfter.isNegative()) {
            throw new IllegalArgumentException("cancelAfter must be a non-negative duration");
        }
        return new CancellationTokenSource(cancelAfter);
    }

    public CancellationToken getToken() {
        return token;
    }

    public void cancel() {
        token.cancel();
    }

    public boolean isCancellationRequested() {
        return token.isCancelled();
    }

    /**
     * Stops a pending timed cancellation. Does not cancel the token.
     */
    @Override
    public void close() {
        if (timeout != null) {
            timeout.cancel(false);
        }
    }
}
