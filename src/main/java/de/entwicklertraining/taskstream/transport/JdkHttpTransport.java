package de.entwicklertraining.taskstream.transport;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link HttpTransport} on top of {@link java.net.http.HttpClient}.
 *
 * <p>Streaming bodies are consumed through {@link HttpResponse.BodyHandlers#ofPublisher()}
 * so that closing the body releases a reader that is waiting for the next chunk.
 */
public final class JdkHttpTransport implements HttpTransport {
    private final HttpClient http;

    /**
     * Creates a transport around an existing HttpClient.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    /**
     * Creates a transport with its own HttpClient speaking HTTP/1.1.
     *
     * @param connectTimeout timeout for establishing connections
     * @param executor executor for the client's asynchronous work
     * @return a new transport
     */
    public static JdkHttpTransport create(Duration connectTimeout, Executor executor) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(connectTimeout);
        if (executor != null) {
            builder.executor(executor);
        }
        return new JdkHttpTransport(builder.build());
    }

    @Override
    public CompletableFuture<TransportResponse<String>> send(TransportRequest request) {
        return http.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> new TransportResponse<>(
                        response.statusCode(), response.headers().map(), response.body()));
    }

    @Override
    public CompletableFuture<TransportResponse<InputStream>> open(TransportRequest request) {
        return http.sendAsync(buildRequest(request), HttpResponse.BodyHandlers.ofPublisher())
                .thenApply(response -> {
                    SubscriberInputStream body = new SubscriberInputStream();
                    response.body().subscribe(body);
                    return new TransportResponse<InputStream>(
                            response.statusCode(), response.headers().map(), body);
                });
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.BodyPublisher body = request.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(request.body(), StandardCharsets.UTF_8);

        HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri())
                .method(request.method().name(), body);

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            if (header.getKey() != null && header.getValue() != null) {
                builder.header(header.getKey(), header.getValue());
            }
        }
        return builder.build();
    }
}
