package de.entwicklertraining.taskstream.streaming;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Summary of a finished stream session.
 *
 * <p>The listener has already been told how the session ended; the result repeats it for
 * callers that prefer to inspect the outcome after {@code stream(...)} returns, and adds
 * counters useful for diagnostics.
 */
public final class StreamResult {
    private final StreamSession.State state;
    private final StreamIds lastSeenIds;
    private final int framesDecoded;
    private final int messagesDelivered;
    private final int decodeErrors;
    private final int connectionAttempts;
    private final int refreshes;
    private final Throwable failure;
    private final Instant startedAt;
    private final Instant endedAt;

    private StreamResult(Builder builder) {
        this.state = builder.state;
        this.lastSeenIds = builder.lastSeenIds;
        this.framesDecoded = builder.framesDecoded;
        this.messagesDelivered = builder.messagesDelivered;
        this.decodeErrors = builder.decodeErrors;
        this.connectionAttempts = builder.connectionAttempts;
        this.refreshes = builder.refreshes;
        this.failure = builder.failure;
        this.startedAt = builder.startedAt;
        this.endedAt = builder.endedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return true if the sentinel arrived
     */
    public boolean isSuccess() {
        return state == StreamSession.State.COMPLETED;
    }

    public boolean isCancelled() {
        return state == StreamSession.State.ABORTED;
    }

    public StreamSession.State getState() {
        return state;
    }

    public StreamIds getLastSeenIds() {
        return lastSeenIds;
    }

    /**
     * Frames of every kind decoded over all connection attempts, including malformed ones.
     *
     * @return the count
     */
    public int getFramesDecoded() {
        return framesDecoded;
    }

    public int getMessagesDelivered() {
        return messagesDelivered;
    }

    public int getDecodeErrors() {
        return decodeErrors;
    }

    public int getConnectionAttempts() {
        return connectionAttempts;
    }

    public int getRefreshes() {
        return refreshes;
    }

    /**
     * The failure handed to {@link StreamListener#onError(Throwable)}.
     *
     * @return the failure, empty unless the session failed
     */
    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getEndedAt() {
        return endedAt;
    }

    public Duration getDuration() {
        return Duration.between(startedAt, endedAt);
    }

    @Override
    public String toString() {
        return "StreamResult{state=" + state
                + ", ids=" + lastSeenIds
                + ", frames=" + framesDecoded
                + ", messages=" + messagesDelivered
                + ", decodeErrors=" + decodeErrors
                + ", attempts=" + connectionAttempts
                + ", refreshes=" + refreshes
                + (failure != null ? ", failure=" + failure : "")
                + '}';
    }

    public static final class Builder {
        private StreamSession.State state = StreamSession.State.INIT;
        private StreamIds lastSeenIds = StreamIds.empty();
        private int framesDecoded;
        private int messagesDelivered;
        private int decodeErrors;
        private int connectionAttempts;
        private int refreshes;
        private Throwable failure;
        private Instant startedAt = Instant.now();
        private Instant endedAt;

        private Builder() {
        }

        public Builder state(StreamSession.State state) {
            this.state = state;
            return this;
        }

        public Builder lastSeenIds(StreamIds lastSeenIds) {
            this.lastSeenIds = lastSeenIds;
            return this;
        }

        public Builder framesDecoded(int framesDecoded) {
            this.framesDecoded = framesDecoded;
            return this;
        }

        public Builder messagesDelivered(int messagesDelivered) {
            this.messagesDelivered = messagesDelivered;
            return this;
        }

        public Builder decodeErrors(int decodeErrors) {
            this.decodeErrors = decodeErrors;
            return this;
        }

        public Builder connectionAttempts(int connectionAttempts) {
            this.connectionAttempts = connectionAttempts;
            return this;
        }

        public Builder refreshes(int refreshes) {
            this.refreshes = refreshes;
            return this;
        }

        public Builder failure(Throwable failure) {
            this.failure = failure;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder endedAt(Instant endedAt) {
            this.endedAt = endedAt;
            return this;
        }

        public StreamResult build() {
            if (endedAt == null) {
                endedAt = Instant.now();
            }
            return new StreamResult(this);
        }
    }
}
