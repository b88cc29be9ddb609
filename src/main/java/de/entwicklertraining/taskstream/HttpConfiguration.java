package de.entwicklertraining.taskstream;

import de.entwicklertraining.taskstream.transport.TransportRequest;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * HTTP-level customization applied to every request a {@link TaskStreamClient} sends.
 *
 * <p>Header precedence, lowest first: global headers, stream headers (streaming calls only),
 * request headers, {@code Authorization}. Request modifiers run last, on the fully built
 * {@link TransportRequest}, for plain calls, stream connects and reconnects and token refreshes.
 *
 * <pre>
 * HttpConfiguration config = HttpConfiguration.builder()
 *     .header("X-Client", "task-stream-client")
 *     .requestModifier(request -&gt; tracing.decorate(request))
 *     .build();
 * </pre>
 */
public final class HttpConfiguration {
    private final Map<String, String> globalHeaders;
    private final Map<String, String> streamHeaders;
    private final List<UnaryOperator<TransportRequest>> requestModifiers;

    private HttpConfiguration(Builder builder) {
        this.globalHeaders = Map.copyOf(builder.globalHeaders);
        this.streamHeaders = Map.copyOf(builder.streamHeaders);
        this.requestModifiers = List.copyOf(builder.requestModifiers);
    }

    /**
     * Configuration with no extra headers and the default stream headers.
     *
     * @return the default configuration
     */
    public static HttpConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.streamHeaders.clear();
        return builder
                .headers(globalHeaders)
                .streamHeaders(streamHeaders)
                .requestModifiers(requestModifiers);
    }

    public Map<String, String> getGlobalHeaders() {
        return globalHeaders;
    }

    public Map<String, String> getStreamHeaders() {
        return streamHeaders;
    }

    public List<UnaryOperator<TransportRequest>> getRequestModifiers() {
        return requestModifiers;
    }

    /**
     * Global headers merged with the stream headers, stream headers winning.
     *
     * @return the combined headers for a streaming call
     */
    public Map<String, String> getStreamRequestHeaders() {
        Map<String, String> combined = new LinkedHashMap<>(globalHeaders);
        combined.putAll(streamHeaders);
        return combined;
    }

    /**
     * Runs all request modifiers in registration order.
     *
     * @param request the request built by the client
     * @return the request to hand to the transport
     */
    public TransportRequest applyModifiers(TransportRequest request) {
        TransportRequest current = request;
        for (UnaryOperator<TransportRequest> modifier : requestModifiers) {
            current = modifier.apply(current);
            if (current == null) {
                throw new IllegalStateException("Request modifier returned null");
            }
        }
        return current;
    }

    public static final class Builder {
        private final Map<String, String> globalHeaders = new LinkedHashMap<>();
        private final Map<String, String> streamHeaders = new LinkedHashMap<>();
        private final List<UnaryOperator<TransportRequest>> requestModifiers = new ArrayList<>();

        private Builder() {
            streamHeaders.put("Accept", "text/event-stream");
            streamHeaders.put("Cache-Control", "no-cache");
        }

        public Builder header(String name, String value) {
            this.globalHeaders.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.globalHeaders.putAll(headers);
            return this;
        }

        /**
         * Adds or replaces a header sent only on streaming calls.
         *
         * @param name header name
         * @param value header value
         * @return this builder
         */
        public Builder streamHeader(String name, String value) {
            this.streamHeaders.put(name, value);
            return this;
        }

        public Builder streamHeaders(Map<String, String> headers) {
            this.streamHeaders.putAll(headers);
            return this;
        }

        public Builder requestModifier(UnaryOperator<TransportRequest> modifier) {
            this.requestModifiers.add(modifier);
            return this;
        }

        public Builder requestModifiers(List<UnaryOperator<TransportRequest>> modifiers) {
            this.requestModifiers.addAll(modifiers);
            return this;
        }

        public HttpConfiguration build() {
            globalHeaders.forEach(Builder::validateHeader);
            streamHeaders.forEach(Builder::validateHeader);
            return new HttpConfiguration(this);
        }

        private static void validateHeader(String name, String value) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Header name must not be blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("Header '" + name + "' has no value");
            }
            if (name.equalsIgnoreCase("Authorization")) {
                throw new IllegalArgumentException("Authorization is managed by the credential store");
            }
        }
    }
}
