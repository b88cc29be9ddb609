package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.TaskStreamClient.TransientTransportException;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bounded retry of a unit of work that may fail with a {@link TransientTransportException}.
 *
 * <p>{@code maxAttempts} counts every attempt including the first one, so a policy with
 * {@code maxAttempts = 1} never retries. Any other exception ends the loop immediately.
 * Between attempts the policy waits on the caller's {@link CancellationToken}, so a
 * cancellation during the delay ends the loop without another attempt.
 *
 * <p>The delay is fixed unless a backoff multiplier greater than 1.0 is set, in which case
 * the n-th delay is {@code delay * multiplier^(n-1)}.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration delay;
    private final double backoffMultiplier;
    private final boolean useJitter;

    private RetryPolicy(int maxAttempts, Duration delay, double backoffMultiplier, boolean useJitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 but was " + maxAttempts);
        }
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0 but was " + backoffMultiplier);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.backoffMultiplier = backoffMultiplier;
        this.useJitter = useJitter;
    }

    /**
     * Creates a fixed-delay policy.
     *
     * @param maxAttempts total number of attempts, at least 1
     * @param delay pause between two attempts
     * @return the policy
     */
    public static RetryPolicy of(int maxAttempts, Duration delay) {
        return new RetryPolicy(maxAttempts, delay, 1.0, false);
    }

    /**
     * A policy that runs the work exactly once.
     *
     * @return the policy
     */
    public static RetryPolicy once() {
        return of(1, Duration.ZERO);
    }

    public RetryPolicy withBackoffMultiplier(double multiplier) {
        return new RetryPolicy(maxAttempts, delay, multiplier, useJitter);
    }

    /**
     * Adds up to 100% random extra delay to every pause.
     *
     * @param jitter whether to randomize delays
     * @return a copy of this policy
     */
    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(maxAttempts, delay, backoffMultiplier, jitter);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public boolean isUseJitter() {
        return useJitter;
    }

    /**
     * Computes the pause taken after the given failed attempt.
     *
     * @param failedAttempt the 1-based number of the attempt that just failed
     * @return the pause before the next attempt
     */
    Duration delayAfter(int failedAttempt) {
        double factor = Math.pow(backoffMultiplier, failedAttempt - 1);
        if (useJitter) {
            factor *= (1.0 + Math.random());
        }
        return Duration.ofMillis((long) (delay.toMillis() * factor));
    }

    /**
     * Runs the work until it succeeds, fails with a non-transient exception, runs out of
     * attempts, or the token is cancelled.
     *
     * @param work the unit of work; receives the 1-based attempt number
     * @param token cancellation token checked before every attempt and during every pause
     * @param <T> result type
     * @return the result of the first successful attempt
     * @throws TransientTransportException the last transient failure, with the failures of
     *         earlier attempts attached as suppressed exceptions, once all attempts are used up
     * @throws CancellationException if the token is cancelled before an attempt or during a pause
     */
    public <T> T execute(Attempt<T> work, CancellationToken token) {
        List<TransientTransportException> failures = new ArrayList<>();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (token.isCancelled()) {
                throw new CancellationException("Cancelled before attempt " + attempt);
            }

            try {
                return work.run(attempt);
            } catch (TransientTransportException ex) {
                failures.add(ex);
                if (attempt == maxAttempts) {
                    break;
                }
                Duration pause = delayAfter(attempt);
                logger.warn("Attempt {}/{} failed: {}. Retrying in {} ms",
                        attempt, maxAttempts, ex.getMessage(), pause.toMillis());
                if (token.awaitCancellation(pause)) {
                    throw new CancellationException("Cancelled while waiting to retry");
                }
            }
        }

        TransientTransportException last = failures.get(failures.size() - 1);
        for (int i = 0; i < failures.size() - 1; i++) {
            last.addSuppressed(failures.get(i));
        }
        if (maxAttempts > 1) {
            logger.warn("Giving up after {} attempts: {}", maxAttempts, last.getMessage());
        }
        throw last;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts
                + ", delay=" + delay.toMillis() + "ms"
                + ", backoffMultiplier=" + backoffMultiplier
                + ", useJitter=" + useJitter + '}';
    }

    /**
     * One attempt of a retried unit of work.
     *
     * @param <T> result type
     */
    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attemptNumber);
    }
}
