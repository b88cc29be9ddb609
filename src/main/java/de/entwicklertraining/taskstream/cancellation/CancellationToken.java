package de.entwicklertraining.taskstream.cancellation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * A cooperative cancellation signal shared by everything working on behalf of one call.
 *
 * <p>The token is checked explicitly at attempt and read boundaries; nothing relies on
 * thread interruption. Code that blocks on I/O registers a callback with
 * {@link #onCancel(Runnable)} so that a pending read is released as soon as the token
 * is cancelled, and retry delays wait through {@link #awaitCancellation(Duration)} so
 * that cancellation always wins over a pending backoff.
 *
 * <p>Example:
 * <pre>
 * CancellationTokenSource source = CancellationTokenSource.create();
 * client.streamAsync(request.withCancellationToken(source.getToken()), listener);
 * ...
 * source.cancel();
 * </pre>
 */
public class CancellationToken {
    private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

    private final CountDownLatch cancelledLatch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled = false;

    /**
     * Creates a token that is not cancelled. Prefer {@link CancellationTokenSource#create()}
     * when the party that cancels is different from the party that observes.
     */
    public CancellationToken() {
    }

    /**
     * Returns a fresh token that nobody else holds, for calls that are never cancelled.
     *
     * @return a new, uncancelled token
     */
    public static CancellationToken none() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled when the given future is cancelled.
     *
     * @param future the future to follow
     * @return a token tied to the future's cancellation
     * @throws IllegalArgumentException if future is null
     */
    public static CancellationToken fromCompletableFuture(CompletableFuture<?> future) {
        if (future == null) {
            throw new IllegalArgumentException("Future cannot be null");
        }
        CancellationToken token = new CancellationToken();
        future.whenComplete((ignored, error) -> {
            if (future.isCancelled()) {
                token.cancel();
            }
        });
        return token;
    }

    /**
     * Checks whether cancellation has been requested.
     *
     * @return true once {@link #cancel()} has been called
     */
    public synchronized boolean isCancelled() {
        return cancelled;
    }

    /**
     * Requests cancellation. Registered callbacks run once, on the calling thread.
     * Calling this more than once has no further effect.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        cancelledLatch.countDown();
        logger.debug("Cancellation requested, running {} callback(s)", toRun.size());
        for (Runnable callback : toRun) {
            runCallback(callback);
        }
    }

    /**
     * Registers a callback that runs when the token is cancelled. If the token is
     * already cancelled the callback runs immediately.
     *
     * @param callback the action to run on cancellation
     * @return a registration that removes the callback when closed
     */
    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (CancellationToken.this) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        runCallback(callback);
        return () -> { };
    }

    /**
     * Waits until the token is cancelled or the timeout elapses, whichever comes first.
     *
     * @param timeout the maximum time to wait
     * @return true if the token was cancelled, false if the full timeout elapsed
     * @throws CancellationException if the waiting thread is interrupted
     */
    public boolean awaitCancellation(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return isCancelled();
        }
        try {
            return cancelledLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting", e);
        }
    }

    /**
     * Throws if cancellation has been requested.
     *
     * @throws CancellationException if the token is cancelled
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Exposes the token as a supplier, for APIs that poll.
     *
     * @return a supplier returning the current cancellation state
     */
    public Supplier<Boolean> asSupplier() {
        return this::isCancelled;
    }

    private static void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Handle for a callback registered with {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        /**
         * Removes the callback. Has no effect if it already ran.
         */
        @Override
        void close();
    }
}
