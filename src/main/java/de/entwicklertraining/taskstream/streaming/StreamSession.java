package de.entwicklertraining.taskstream.streaming;

import de.entwicklertraining.taskstream.RequestDescriptor;
import de.entwicklertraining.taskstream.RetryPolicy;
import de.entwicklertraining.taskstream.TaskStreamClient.ApiClientException;
import de.entwicklertraining.taskstream.TaskStreamClient.ApiStatusException;
import de.entwicklertraining.taskstream.TaskStreamClient.ApiTimeoutException;
import de.entwicklertraining.taskstream.TaskStreamClient.ApplicationErrorException;
import de.entwicklertraining.taskstream.TaskStreamClient.StreamingException;
import de.entwicklertraining.taskstream.TaskStreamClient.StreamingPartialResponseException;
import de.entwicklertraining.taskstream.TaskStreamClient.TransientTransportException;
import de.entwicklertraining.taskstream.TransportFailures;
import de.entwicklertraining.taskstream.auth.AuthException;
import de.entwicklertraining.taskstream.auth.TokenRefresher;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import de.entwicklertraining.taskstream.transport.HttpTransport;
import de.entwicklertraining.taskstream.transport.TransportRequest;
import de.entwicklertraining.taskstream.transport.TransportResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * One streaming call, from connecting to the terminal callback.
 *
 * <pre>
 * INIT -&gt; CONNECTING -&gt; STREAMING -&gt; COMPLETED | FAILED
 *            |    ^
 *            v    |
 *       REAUTHENTICATING            any state -&gt; ABORTED (cancellation)
 * </pre>
 *
 * <p>A 401 on connect triggers one credential refresh per session and a reconnect with the
 * same request. Transient transport failures restart the whole session, decoding from the
 * first byte again, as long as the retry policy allows. An application error frame, a
 * non-2xx status, a failed refresh or a stream that ends without the sentinel fail the
 * session.
 *
 * <p>The listener gets exactly one of {@code onComplete} and {@code onError}, unless the
 * session is cancelled, in which case it gets neither and no further messages. Sessions are
 * single-use.
 */
public final class StreamSession {
    private static final Logger logger = LoggerFactory.getLogger(StreamSession.class);

    private static final int READ_BUFFER_SIZE = 8192;
    private static final int MAX_ERROR_BODY_LENGTH = 2048;

    /**
     * Lifecycle of a session. COMPLETED, FAILED and ABORTED are final.
     */
    public enum State {
        INIT,
        CONNECTING,
        REAUTHENTICATING,
        STREAMING,
        COMPLETED,
        FAILED,
        ABORTED;

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED || this == ABORTED;
        }
    }

    private final RequestDescriptor descriptor;
    private final StreamListener listener;
    private final HttpTransport transport;
    private final Function<RequestDescriptor, TransportRequest> requestFactory;
    private final TokenRefresher refresher;
    private final RetryPolicy retryPolicy;
    private final DiagnosticSink diagnosticSink;
    private final CancellationToken token;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean terminalDelivered = new AtomicBoolean();
    private volatile State state = State.INIT;

    private boolean refreshUsed;
    private StreamIds lastSeenIds = StreamIds.empty();
    private int framesDecoded;
    private int messagesDelivered;
    private int decodeErrors;
    private int connectionAttempts;
    private int refreshes;

    private StreamSession(Builder builder) {
        this.descriptor = Objects.requireNonNull(builder.descriptor, "descriptor");
        this.listener = Objects.requireNonNull(builder.listener, "listener");
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.requestFactory = Objects.requireNonNull(builder.requestFactory, "requestFactory");
        this.refresher = Objects.requireNonNull(builder.refresher, "refresher");
        this.retryPolicy = Objects.requireNonNull(builder.retryPolicy, "retryPolicy");
        this.diagnosticSink = builder.diagnosticSink != null ? builder.diagnosticSink : new LoggingDiagnosticSink();
        this.token = descriptor.getCancellationToken();
    }

    public static Builder builder() {
        return new Builder();
    }

    public State getState() {
        return state;
    }

    /**
     * Runs the session on the calling thread until it reaches a terminal state.
     *
     * @return the outcome; the listener has been notified before this returns
     * @throws IllegalStateException if the session was already run
     * @throws Error an error raised while streaming, typically by the listener, after the
     *         session was marked FAILED and {@code onError} was called
     */
    public StreamResult run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream session can only be run once");
        }
        Instant startedAt = Instant.now();
        Throwable failure = null;

        try {
            retryPolicy.execute(this::attempt, token);
        } catch (CancellationException e) {
            abort();
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                abort();
            } else {
                failure = e;
                fail(e);
            }
        } catch (Error e) {
            fail(e);
            throw e;
        }

        return StreamResult.builder()
                .state(state)
                .lastSeenIds(lastSeenIds)
                .framesDecoded(framesDecoded)
                .messagesDelivered(messagesDelivered)
                .decodeErrors(decodeErrors)
                .connectionAttempts(connectionAttempts)
                .refreshes(refreshes)
                .failure(state == State.FAILED ? failure : null)
                .startedAt(startedAt)
                .endedAt(Instant.now())
                .build();
    }

    private Void attempt(int attemptNumber) {
        if (attemptNumber > 1) {
            logger.info("Reconnecting stream {} (attempt {}/{})", descriptor, attemptNumber, retryPolicy.getMaxAttempts());
        }
        FrameDecoder decoder = new FrameDecoder();
        TransportResponse<InputStream> response = connect();
        transition(State.STREAMING);
        readLoop(response.body(), decoder);
        return null;
    }

    private TransportResponse<InputStream> connect() {
        transition(State.CONNECTING);
        TransportRequest request = requestFactory.apply(descriptor);
        TransportResponse<InputStream> response = open(request);

        if (response.isUnauthorized()) {
            closeQuietly(response.body());
            if (refreshUsed) {
                throw new AuthException("Stream " + descriptor + " rejected with HTTP 401 after credential refresh");
            }
            refreshUsed = true;
            transition(State.REAUTHENTICATING);
            logger.debug("Stream {} rejected with HTTP 401, refreshing credential", descriptor);
            refresher.refreshAfterRejection(request.bearerToken(), token);
            refreshes++;

            token.throwIfCancelled();
            transition(State.CONNECTING);
            response = open(requestFactory.apply(descriptor));
            if (response.isUnauthorized()) {
                closeQuietly(response.body());
                throw new AuthException("Stream " + descriptor + " rejected with HTTP 401 after credential refresh");
            }
        }

        if (!response.isSuccess()) {
            String body = readErrorBody(response.body());
            throw new ApiStatusException(response.status(), body,
                    "Stream " + descriptor + " failed with HTTP " + response.status());
        }
        return response;
    }

    private TransportResponse<InputStream> open(TransportRequest request) {
        token.throwIfCancelled();
        connectionAttempts++;
        CompletableFuture<TransportResponse<InputStream>> future = transport.open(request);
        TransportResponse<InputStream> response;
        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            response = request.timeout() != null
                    ? future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ApiTimeoutException("Stream " + descriptor + " got no response within "
                    + request.timeout().toMillis() + " ms", e);
        } catch (java.util.concurrent.CancellationException e) {
            throw new CancellationException("Stream connect was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ApiClientException("Interrupted while connecting stream " + descriptor, e);
        } catch (ExecutionException e) {
            if (token.isCancelled()) {
                throw new CancellationException("Stream connect was cancelled", e.getCause());
            }
            throw TransportFailures.translate(e, "Stream " + descriptor);
        }
        if (token.isCancelled()) {
            closeQuietly(response.body());
            throw new CancellationException("Stream was cancelled while connecting");
        }
        return response;
    }

    private void readLoop(InputStream body, FrameDecoder decoder) {
        byte[] chunk = new byte[READ_BUFFER_SIZE];
        try (InputStream in = body;
             CancellationToken.Registration ignored = token.onCancel(() -> closeQuietly(in))) {
            while (true) {
                token.throwIfCancelled();
                int read;
                try {
                    read = in.read(chunk);
                } catch (IOException e) {
                    if (token.isCancelled()) {
                        throw new CancellationException("Stream was cancelled", e);
                    }
                    throw new TransientTransportException("Reading stream " + descriptor + " failed: " + e.getMessage(), e);
                }
                if (read < 0) {
                    dispatch(decoder.finish(), decoder);
                    if (!decoder.isTerminated()) {
                        throw new StreamingPartialResponseException(
                                "Stream " + descriptor + " ended without completion sentinel", framesDecoded);
                    }
                    return;
                }
                if (read > 0) {
                    dispatch(decoder.feed(chunk, 0, read), decoder);
                    if (decoder.isTerminated()) {
                        return;
                    }
                }
            }
        } catch (IOException e) {
            // only reachable from closing the body
            logger.debug("Closing stream body failed: {}", e.getMessage());
        }
    }

    private void dispatch(List<StreamEvent> events, FrameDecoder decoder) {
        for (StreamEvent event : events) {
            token.throwIfCancelled();
            framesDecoded++;
            lastSeenIds = decoder.getLastSeenIds();

            if (event instanceof StreamEvent.DataEvent data) {
                messagesDelivered++;
                try {
                    listener.onMessage(data);
                } catch (RuntimeException e) {
                    throw new StreamingException("Stream listener failed: " + e.getMessage(), e);
                }
            } else if (event instanceof StreamEvent.DecodeError error) {
                decodeErrors++;
                diagnosticSink.onDecodeError(Instant.now(), error);
            } else if (event instanceof StreamEvent.ApplicationError error) {
                throw new ApplicationErrorException(error.code(), error.message());
            } else if (event instanceof StreamEvent.Done) {
                complete();
            }
        }
    }

    private void complete() {
        transition(State.COMPLETED);
        if (terminalDelivered.compareAndSet(false, true)) {
            logger.debug("Stream {} completed with {}", descriptor, lastSeenIds);
            try {
                listener.onComplete(lastSeenIds);
            } catch (RuntimeException e) {
                logger.warn("Stream listener onComplete failed: {}", e.getMessage(), e);
            }
        }
    }

    private void fail(Throwable error) {
        transition(State.FAILED);
        if (terminalDelivered.compareAndSet(false, true)) {
            logger.error("Stream {} failed: {}", descriptor, error.getMessage());
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                logger.warn("Stream listener onError failed: {}", e.getMessage(), e);
            }
        }
    }

    private void abort() {
        transition(State.ABORTED);
        logger.debug("Stream {} cancelled", descriptor);
    }

    private void transition(State next) {
        if (state.isTerminal()) {
            return;
        }
        logger.debug("Stream {}: {} -> {}", descriptor, state, next);
        state = next;
    }

    private String readErrorBody(InputStream body) {
        if (body == null) {
            return "";
        }
        try (InputStream in = body) {
            byte[] bytes = in.readNBytes(MAX_ERROR_BODY_LENGTH);
            return new String(bytes, StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Could not read error body of stream {}: {}", descriptor, e.getMessage());
            return "";
        }
    }

    private static void closeQuietly(InputStream body) {
        if (body == null) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            logger.debug("Closing stream body failed: {}", e.getMessage());
        }
    }

    public static final class Builder {
        private RequestDescriptor descriptor;
        private StreamListener listener;
        private HttpTransport transport;
        private Function<RequestDescriptor, TransportRequest> requestFactory;
        private TokenRefresher refresher;
        private RetryPolicy retryPolicy = RetryPolicy.once();
        private DiagnosticSink diagnosticSink;

        private Builder() {
        }

        public Builder descriptor(RequestDescriptor descriptor) {
            this.descriptor = descriptor;
            return this;
        }

        public Builder listener(StreamListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Builds the transport request for each connect, including the current
         * {@code Authorization} header.
         *
         * @param requestFactory the factory
         * @return this builder
         */
        public Builder requestFactory(Function<RequestDescriptor, TransportRequest> requestFactory) {
            this.requestFactory = requestFactory;
            return this;
        }

        public Builder refresher(TokenRefresher refresher) {
            this.refresher = refresher;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder diagnosticSink(DiagnosticSink diagnosticSink) {
            this.diagnosticSink = diagnosticSink;
            return this;
        }

        public StreamSession build() {
            return new StreamSession(this);
        }
    }
}
