package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.transport.HttpTransport;
import de.entwicklertraining.taskstream.transport.TransportRequest;
import de.entwicklertraining.taskstream.transport.TransportResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory {@link HttpTransport} answering from scripted responses, in order. Refresh calls
 * (any path ending in {@code /refresh-token}) have their own script.
 */
public class ScriptedTransport implements HttpTransport {

    private final Queue<Function<TransportRequest, CompletableFuture<TransportResponse<String>>>> sendScript =
            new ConcurrentLinkedQueue<>();
    private final Queue<Function<TransportRequest, CompletableFuture<TransportResponse<String>>>> refreshScript =
            new ConcurrentLinkedQueue<>();
    private final Queue<Function<TransportRequest, CompletableFuture<TransportResponse<InputStream>>>> openScript =
            new ConcurrentLinkedQueue<>();

    private final List<TransportRequest> sent = new CopyOnWriteArrayList<>();
    private final List<TransportRequest> refreshes = new CopyOnWriteArrayList<>();
    private final List<TransportRequest> opened = new CopyOnWriteArrayList<>();

    public ScriptedTransport respond(int status, String body) {
        sendScript.add(request -> CompletableFuture.completedFuture(new TransportResponse<>(status, Map.of(), body)));
        return this;
    }

    public ScriptedTransport timeout() {
        sendScript.add(request -> CompletableFuture.failedFuture(new HttpTimeoutException("request timed out")));
        return this;
    }

    public ScriptedTransport connectionReset() {
        sendScript.add(request -> CompletableFuture.failedFuture(new IOException("Connection reset")));
        return this;
    }

    /**
     * Never completes; only a timeout or a cancellation ends the call.
     */
    public ScriptedTransport hang() {
        sendScript.add(request -> new CompletableFuture<>());
        return this;
    }

    public ScriptedTransport sendWith(Function<TransportRequest, CompletableFuture<TransportResponse<String>>> handler) {
        sendScript.add(handler);
        return this;
    }

    public ScriptedTransport refreshResponds(int status, String body) {
        refreshScript.add(request -> CompletableFuture.completedFuture(new TransportResponse<>(status, Map.of(), body)));
        return this;
    }

    public ScriptedTransport refreshSucceeds(String accessToken, String refreshToken) {
        return refreshResponds(200, "{\"status\":true,\"payload\":{\"access_token\":\"" + accessToken
                + "\",\"refresh_token\":\"" + refreshToken + "\"}}");
    }

    public ScriptedTransport refreshWith(Function<TransportRequest, CompletableFuture<TransportResponse<String>>> handler) {
        refreshScript.add(handler);
        return this;
    }

    public ScriptedTransport stream(int status, String body) {
        return stream(status, new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    public ScriptedTransport stream(int status, InputStream body) {
        openScript.add(request -> CompletableFuture.completedFuture(new TransportResponse<>(status, Map.of(), body)));
        return this;
    }

    public ScriptedTransport streamTimeout() {
        openScript.add(request -> CompletableFuture.failedFuture(new HttpTimeoutException("stream connect timed out")));
        return this;
    }

    public ScriptedTransport streamHang() {
        openScript.add(request -> new CompletableFuture<>());
        return this;
    }

    public List<TransportRequest> sentRequests() {
        return sent;
    }

    public List<TransportRequest> refreshRequests() {
        return refreshes;
    }

    public List<TransportRequest> openedRequests() {
        return opened;
    }

    @Override
    public CompletableFuture<TransportResponse<String>> send(TransportRequest request) {
        if (request.uri().getPath().endsWith("/refresh-token")) {
            refreshes.add(request);
            return next(refreshScript, request);
        }
        sent.add(request);
        return next(sendScript, request);
    }

    @Override
    public CompletableFuture<TransportResponse<InputStream>> open(TransportRequest request) {
        opened.add(request);
        return next(openScript, request);
    }

    private static <T> CompletableFuture<T> next(Queue<Function<TransportRequest, CompletableFuture<T>>> script,
                                                 TransportRequest request) {
        Function<TransportRequest, CompletableFuture<T>> step = script.poll();
        if (step == null) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("No scripted response for " + request.method() + " " + request.uri()));
        }
        return step.apply(request);
    }
}
