package de.entwicklertraining.taskstream.cancellation;

/**
 * Thrown when an operation stops because its {@link CancellationToken} was cancelled.
 *
 * <p>Cancellation is not a failure: plain calls throw this exception so the caller's
 * control flow ends, while stream sessions swallow it and end silently in the
 * {@code ABORTED} state.
 */
public class CancellationException extends RuntimeException {

    /**
     * Creates a new CancellationException.
     *
     * @param message the detail message
     */
    public CancellationException(String message) {
        super(message);
    }

    /**
     * Creates a new CancellationException with a cause.
     *
     * @param message the detail message
     * @param cause the cause of the cancellation
     */
    public CancellationException(String message, Throwable cause) {
        super(message, cause);
    }
}
