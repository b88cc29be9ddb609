package de.entwicklertraining.taskstream.transport;

import java.io.InputStream;
import java.util.concurrent.CompletableFuture;

/**
 * The network seam underneath {@link de.entwicklertraining.taskstream.TaskStreamClient}.
 *
 * <p>Implementations perform exactly one HTTP exchange per call: no authentication,
 * no retries, no status interpretation. Failures complete the returned future
 * exceptionally with the transport's own exception, typically an {@link java.io.IOException}
 * ({@link java.net.http.HttpTimeoutException} for an elapsed per-attempt timeout).
 * Cancelling the returned future should abort the exchange.
 */
public interface HttpTransport {

    /**
     * Sends a request and buffers the whole response body as text.
     *
     * @param request the request to send
     * @return a future completed with the response once the body has been read
     */
    CompletableFuture<TransportResponse<String>> send(TransportRequest request);

    /**
     * Sends a request and completes as soon as the response headers arrived. The body is
     * delivered incrementally through the returned InputStream; closing the stream from
     * another thread must release a blocked read.
     *
     * @param request the request to send
     * @return a future completed with the response and its unread body
     */
    CompletableFuture<TransportResponse<InputStream>> open(TransportRequest request);
}
