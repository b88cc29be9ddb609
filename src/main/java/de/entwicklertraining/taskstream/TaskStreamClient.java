package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.auth.AuthException;
import de.entwicklertraining.taskstream.auth.Credential;
import de.entwicklertraining.taskstream.auth.CredentialStore;
import de.entwicklertraining.taskstream.auth.InMemoryCredentialStore;
import de.entwicklertraining.taskstream.auth.TokenRefresher;
import de.entwicklertraining.taskstream.cancellation.CancellationException;
import de.entwicklertraining.taskstream.cancellation.CancellationToken;
import de.entwicklertraining.taskstream.streaming.DiagnosticSink;
import de.entwicklertraining.taskstream.streaming.LoggingDiagnosticSink;
import de.entwicklertraining.taskstream.streaming.StreamListener;
import de.entwicklertraining.taskstream.streaming.StreamResult;
import de.entwicklertraining.taskstream.streaming.StreamSession;
import de.entwicklertraining.taskstream.transport.HttpTransport;
import de.entwicklertraining.taskstream.transport.JdkHttpTransport;
import de.entwicklertraining.taskstream.transport.TransportRequest;
import de.entwicklertraining.taskstream.transport.TransportResponse;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Client for a task-execution backend that answers plain JSON calls and long-running
 * streaming calls.
 *
 * <p>Every request carries {@code Authorization: Bearer <token>} from the
 * {@link CredentialStore}, falling back to the credential configured in
 * {@link ClientSettings}. A request answered with 401 triggers one credential refresh and
 * is then sent again unchanged; a second 401 fails with {@link AuthException}.
 *
 * <p>Timeouts and connection failures are retried according to the verb: GET and DELETE up
 * to {@link ClientSettings#getMaxAttempts()} attempts, POST and PUT once, unless the settings
 * or the request override it. HTTP error statuses are never retried.
 *
 * <p>Example:
 * <pre>
 * try (TaskStreamClient client = TaskStreamClient.builder()
 *         .settings(ClientSettings.fromEnvironment(System.getenv()).build())
 *         .credentialStore(new FileCredentialStore(Path.of("credentials.properties")))
 *         .build()) {
 *
 *     ApiResponse tasks = client.get("/api/v1/tasks");
 *
 *     client.stream("/api/v1/chat", new JSONObject().put("query", "hello"), listener,
 *             CancellationToken.none());
 * }
 * </pre>
 */
public class TaskStreamClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskStreamClient.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    protected final ClientSettings settings;
    protected final HttpConfiguration httpConfig;
    private final CredentialStore credentialStore;
    private final HttpTransport transport;
    private final TokenRefresher tokenRefresher;
    private final DiagnosticSink diagnosticSink;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();

    protected TaskStreamClient(Builder builder) {
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.httpConfig = builder.httpConfig != null ? builder.httpConfig : HttpConfiguration.defaults();
        this.credentialStore = builder.credentialStore != null ? builder.credentialStore : new InMemoryCredentialStore();
        this.diagnosticSink = builder.diagnosticSink != null ? builder.diagnosticSink : new LoggingDiagnosticSink();
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "task-stream-client-" + THREAD_COUNTER.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            this.ownsExecutor = true;
        }
        this.transport = builder.transport != null
                ? builder.transport
                : JdkHttpTransport.create(settings.getConnectTimeout(), executor);
        this.tokenRefresher = new TokenRefresher(transport, settings, httpConfig, credentialStore);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ClientSettings getSettings() {
        return settings;
    }

    public HttpConfiguration getHttpConfig() {
        return httpConfig;
    }

    public CredentialStore getCredentialStore() {
        return credentialStore;
    }

    public TokenRefresher getTokenRefresher() {
        return tokenRefresher;
    }

    // ---------------------------------------
    // Plain calls
    // ---------------------------------------

    /**
     * Sends a request and decodes the response envelope.
     *
     * @param request the request
     * @return the decoded 2xx response
     * @throws ApiStatusException for any non-2xx status other than a recoverable 401
     * @throws AuthException if the credential could not be refreshed or was rejected again
     * @throws TransientTransportException the last timeout or connection failure once all attempts are used
     * @throws ApiResponseUnusableException if a 2xx body is not a JSON object
     * @throws CancellationException if the request's token was cancelled
     */
    public ApiResponse execute(RequestDescriptor request) {
        ensureOpen();
        RetryPolicy policy = retryPolicyFor(request);
        AtomicBoolean authReplayed = new AtomicBoolean();
        return policy.execute(attempt -> executeOnce(request, attempt, authReplayed), request.getCancellationToken());
    }

    /**
     * Runs {@link #execute(RequestDescriptor)} on the client's executor. Cancelling the
     * returned future cancels the request.
     *
     * @param request the request
     * @return a future completed with the response or the exception {@code execute} would throw
     */
    public CompletableFuture<ApiResponse> executeAsync(RequestDescriptor request) {
        return runAsync(request, this::execute);
    }

    public ApiResponse get(String path) {
        return execute(RequestDescriptor.get(path));
    }

    public ApiResponse get(String path, CancellationToken token) {
        return execute(RequestDescriptor.builder(HttpMethod.GET, path).cancellationToken(token).build());
    }

    public ApiResponse post(String path, JSONObject body) {
        return execute(RequestDescriptor.post(path, body));
    }

    public ApiResponse post(String path, JSONObject body, CancellationToken token) {
        return execute(RequestDescriptor.builder(HttpMethod.POST, path).body(body).cancellationToken(token).build());
    }

    public ApiResponse put(String path, JSONObject body) {
        return execute(RequestDescriptor.put(path, body));
    }

    public ApiResponse put(String path, JSONObject body, CancellationToken token) {
        return execute(RequestDescriptor.builder(HttpMethod.PUT, path).body(body).cancellationToken(token).build());
    }

    public ApiResponse delete(String path) {
        return execute(RequestDescriptor.delete(path));
    }

    public ApiResponse delete(String path, CancellationToken token) {
        return execute(RequestDescriptor.builder(HttpMethod.DELETE, path).cancellationToken(token).build());
    }

    private ApiResponse executeOnce(RequestDescriptor request, int attempt, AtomicBoolean authReplayed) {
        TransportRequest transportRequest = buildTransportRequest(request, false);
        logger.debug("Sending {} (attempt {}) with token {}", request, attempt, maskedToken(transportRequest));
        TransportResponse<String> response = send(transportRequest, request);

        if (response.isUnauthorized()) {
            if (!authReplayed.compareAndSet(false, true)) {
                throw new AuthException(request + " rejected with HTTP 401 after credential refresh");
            }
            logger.debug("{} rejected with HTTP 401, refreshing credential", request);
            tokenRefresher.refreshAfterRejection(transportRequest.bearerToken(), request.getCancellationToken());
            request.getCancellationToken().throwIfCancelled();

            TransportRequest replay = buildTransportRequest(request, false);
            response = send(replay, request);
            if (response.isUnauthorized()) {
                throw new AuthException(request + " rejected with HTTP 401 after credential refresh");
            }
        }

        if (!response.isSuccess()) {
            throw new ApiStatusException(response.status(), response.body(),
                    request + " failed with HTTP " + response.status() + " - " + ApiResponse.abbreviate(response.body()));
        }
        return ApiResponse.parse(response.status(), response.body());
    }

    private TransportResponse<String> send(TransportRequest transportRequest, RequestDescriptor request) {
        CancellationToken token = request.getCancellationToken();
        token.throwIfCancelled();
        CompletableFuture<TransportResponse<String>> future = transport.send(transportRequest);

        try (CancellationToken.Registration ignored = token.onCancel(() -> future.cancel(true))) {
            if (transportRequest.timeout() != null) {
                return future.get(transportRequest.timeout().toMillis(), TimeUnit.MILLISECONDS);
            }
            return future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ApiTimeoutException(request + " got no response within "
                    + transportRequest.timeout().toMillis() + " ms", e);
        } catch (java.util.concurrent.CancellationException e) {
            throw new CancellationException("Request was canceled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ApiClientException("Request interrupted", e);
        } catch (ExecutionException e) {
            if (token.isCancelled()) {
                throw new CancellationException("Request was canceled", e.getCause());
            }
            throw TransportFailures.translate(e, request.toString());
        }
    }

    // ---------------------------------------
    // Streaming calls
    // ---------------------------------------

    /**
     * Runs a streaming call on the calling thread. The listener's callbacks run on this
     * thread as well.
     *
     * @param request the streaming request, usually a POST
     * @param listener receives messages and exactly one terminal callback unless cancelled
     * @return the outcome of the session; failures are reported here and through the
     *         listener, not thrown
     */
    public StreamResult stream(RequestDescriptor request, StreamListener listener) {
        ensureOpen();
        StreamSession session = StreamSession.builder()
                .descriptor(request)
                .listener(listener)
                .transport(transport)
                .requestFactory(descriptor -> buildTransportRequest(descriptor, true))
                .refresher(tokenRefresher)
                .retryPolicy(retryPolicyFor(request))
                .diagnosticSink(diagnosticSink)
                .build();
        return session.run();
    }

    /**
     * Sends {@code body} as POST to {@code path} and streams the answer.
     *
     * @param path the request path
     * @param body the request body, or null
     * @param listener receives the stream's events
     * @param token cancels the stream
     * @return the outcome of the session
     */
    public StreamResult stream(String path, JSONObject body, StreamListener listener, CancellationToken token) {
        RequestDescriptor request = RequestDescriptor.builder(HttpMethod.POST, path)
                .body(body)
                .cancellationToken(token)
                .build();
        return stream(request, listener);
    }

    /**
     * Runs {@link #stream(RequestDescriptor, StreamListener)} on the client's executor.
     * Cancelling the returned future cancels the stream silently, like cancelling the
     * request's own token.
     *
     * @param request the streaming request
     * @param listener receives the stream's events
     * @return a future completed with the session outcome
     */
    public CompletableFuture<StreamResult> streamAsync(RequestDescriptor request, StreamListener listener) {
        return runAsync(request, linked -> stream(linked, listener));
    }

    private <T> CompletableFuture<T> runAsync(RequestDescriptor request,
                                              Function<RequestDescriptor, T> call) {
        ensureOpen();
        CompletableFuture<T> result = new CompletableFuture<>();
        CancellationToken linked = CancellationToken.fromCompletableFuture(result);
        CancellationToken.Registration link = request.getCancellationToken().onCancel(linked::cancel);
        RequestDescriptor linkedRequest = request.withCancellationToken(linked);

        try {
            executor.execute(() -> {
                try {
                    result.complete(call.apply(linkedRequest));
                } catch (Throwable t) {
                    // errors from listeners included, so the future never stays pending
                    result.completeExceptionally(t);
                } finally {
                    link.close();
                }
            });
        } catch (RejectedExecutionException e) {
            link.close();
            result.completeExceptionally(new ApiClientException("Client executor rejected " + request, e));
        }
        return result;
    }

    // ---------------------------------------
    // Request construction
    // ---------------------------------------

    private RetryPolicy retryPolicyFor(RequestDescriptor request) {
        int attempts = request.getMaxAttempts().orElseGet(() -> settings.maxAttemptsFor(request.getMethod()));
        return settings.retryPolicy(attempts);
    }

    /**
     * Builds the outgoing request with the credential that is current right now.
     *
     * @param request the logical request
     * @param streaming whether stream headers apply
     * @return the request for the transport, after all request modifiers ran
     */
    protected TransportRequest buildTransportRequest(RequestDescriptor request, boolean streaming) {
        Map<String, String> headers = new LinkedHashMap<>(
                streaming ? httpConfig.getStreamRequestHeaders() : httpConfig.getGlobalHeaders());
        if (request.getBody() != null) {
            headers.putIfAbsent("Content-Type", "application/json");
        }
        if (!streaming) {
            headers.putIfAbsent("Accept", "application/json");
        }
        headers.putAll(request.getHeaders());
        currentCredential().ifPresent(credential ->
                headers.put("Authorization", "Bearer " + credential.accessToken()));

        TransportRequest transportRequest = new TransportRequest(
                request.getMethod(),
                settings.resolve(request.getPath()),
                headers,
                request.getBody(),
                settings.getRequestTimeout());
        return httpConfig.applyModifiers(transportRequest);
    }

    private Optional<Credential> currentCredential() {
        Optional<Credential> stored = credentialStore.get();
        if (stored.isPresent()) {
            return stored;
        }
        return settings.getFallbackCredential();
    }

    private static String maskedToken(TransportRequest request) {
        String token = request.bearerToken();
        return token == null ? "<none>" : Credential.mask(token);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("TaskStreamClient is closed");
        }
    }

    /**
     * Stops accepting requests and shuts down the executor if the client created it.
     * Calls that are already running are not interrupted.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (ownsExecutor) {
            executor.shutdown();
        }
        logger.debug("TaskStreamClient closed");
    }

    public static class Builder {
        private ClientSettings settings;
        private HttpConfiguration httpConfig;
        private CredentialStore credentialStore;
        private HttpTransport transport;
        private DiagnosticSink diagnosticSink;
        private ExecutorService executor;

        protected Builder() {
        }

        public Builder settings(ClientSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder httpConfig(HttpConfiguration httpConfig) {
            this.httpConfig = httpConfig;
            return this;
        }

        public Builder credentialStore(CredentialStore credentialStore) {
            this.credentialStore = credentialStore;
            return this;
        }

        /**
         * Replaces the default {@link JdkHttpTransport}.
         *
         * @param transport the transport
         * @return this builder
         */
        public Builder transport(HttpTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder diagnosticSink(DiagnosticSink diagnosticSink) {
            this.diagnosticSink = diagnosticSink;
            return this;
        }

        /**
         * Executor for the async entry points. A caller-supplied executor is not shut down
         * by {@link TaskStreamClient#close()}.
         *
         * @param executor the executor
         * @return this builder
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public TaskStreamClient build() {
            if (settings == null) {
                throw new IllegalArgumentException("settings are required");
            }
            return new TaskStreamClient(this);
        }
    }

    // ---------------------------------------
    // Exceptions
    // ---------------------------------------

    /**
     * Base exception of every failure raised by the client, apart from cancellation.
     */
    public static class ApiClientException extends RuntimeException {
        /**
         * Creates a new ApiClientException with the specified detail message.
         *
         * @param message the detail message
         */
        public ApiClientException(String message) {
            super(message);
        }

        /**
         * Creates a new ApiClientException with the specified detail message and cause.
         *
         * @param message the detail message
         * @param cause the cause
         */
        public ApiClientException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The request could not be completed for reasons that may go away on their own: the
     * connection failed or was reset before a response was read. Retried according to the
     * verb's attempt budget.
     */
    public static class TransientTransportException extends ApiClientException {
        public TransientTransportException(String message) {
            super(message);
        }

        public TransientTransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * An attempt did not get a response within the configured request timeout.
     */
    public static class ApiTimeoutException extends TransientTransportException {
        public ApiTimeoutException(String message) {
            super(message);
        }

        public ApiTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The server answered with a non-2xx status. Never retried.
     */
    public static class ApiStatusException extends ApiClientException {
        private final int statusCode;
        private final String body;

        public ApiStatusException(int statusCode, String body, String message) {
            super(message);
            this.statusCode = statusCode;
            this.body = body;
        }

        public int getStatusCode() {
            return statusCode;
        }

        /**
         * @return the response body, possibly truncated for streaming calls
         */
        public String getBody() {
            return body;
        }
    }

    /**
     * A 2xx response whose body cannot be used: not JSON, or not the expected shape.
     */
    public static class ApiResponseUnusableException extends ApiClientException {
        public ApiResponseUnusableException(String message) {
            super(message);
        }

        public ApiResponseUnusableException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Base exception for failures of a stream after it was accepted by the server.
     */
    public static class StreamingException extends ApiClientException {
        public StreamingException(String message) {
            super(message);
        }

        public StreamingException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * The stream ended without the completion sentinel.
     */
    public static class StreamingPartialResponseException extends StreamingException {
        private final int framesDecoded;

        /**
         * @param message the detail message
         * @param framesDecoded number of frames decoded before the stream ended
         */
        public StreamingPartialResponseException(String message, int framesDecoded) {
            super(message);
            this.framesDecoded = framesDecoded;
        }

        public int getFramesDecoded() {
            return framesDecoded;
        }
    }

    /**
     * The server reported a failure of the task in an error frame.
     */
    public static class ApplicationErrorException extends StreamingException {
        private final int code;
        private final String errorMessage;

        public ApplicationErrorException(int code, String errorMessage) {
            super("Application error " + code + ": " + errorMessage);
            this.code = code;
            this.errorMessage = errorMessage;
        }

        public int getCode() {
            return code;
        }

        /**
         * @return the message text of the error frame
         */
        public String getErrorMessage() {
            return errorMessage;
        }
    }
}
